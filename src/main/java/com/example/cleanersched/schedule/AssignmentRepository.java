package com.example.cleanersched.schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface AssignmentRepository extends JpaRepository<Assignment, Long> {

    /**
     * 指定週の割り当てを登録順に取得
     */
    List<Assignment> findByWeekStartOrderByIdAsc(LocalDate weekStart);

    /**
     * 指定週のキャンセル以外の割り当て件数
     */
    @Query("SELECT COUNT(a) FROM Assignment a WHERE a.weekStart = :weekStart " +
           "AND a.status <> com.example.cleanersched.schedule.AssignmentStatus.CANCELLED")
    long countActiveByWeekStart(@Param("weekStart") LocalDate weekStart);
}
