package com.example.cleanersched.roster;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface WorkerRepository extends JpaRepository<Worker, Long> {
    Optional<Worker> findByName(String name);

    /**
     * 登録順の名簿を取得（代替候補の並び順はこの順序に従う）
     */
    List<Worker> findAllByOrderByIdAsc();

    List<Worker> findByActiveTrueOrderByIdAsc();
}
