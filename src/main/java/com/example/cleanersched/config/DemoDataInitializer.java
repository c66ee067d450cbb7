package com.example.cleanersched.config;

import com.example.cleanersched.roster.Clearance;
import com.example.cleanersched.roster.Worker;
import com.example.cleanersched.roster.WorkerRepository;
import com.example.cleanersched.schedule.Assignment;
import com.example.cleanersched.schedule.AssignmentRepository;
import com.example.cleanersched.schedule.ScheduleWeek;
import com.example.cleanersched.site.Site;
import com.example.cleanersched.site.SiteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Configuration
@ConditionalOnProperty(name = "scheduling.demo-data.enabled", havingValue = "true")
public class DemoDataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DemoDataInitializer.class);

    // 起動時に清掃員が0件ならデモ用の名簿・現場・今週の割り当てを投入します
    @Bean
    CommandLineRunner loadDemoSchedule(WorkerRepository workers, SiteRepository sites, AssignmentRepository assignments) {
        return args -> {
            if (workers.count() > 0) {
                return;
            }
            workers.saveAll(List.of(
                    new Worker("Ann", Clearance.HIGH),
                    new Worker("Ben", Clearance.MEDIUM),
                    new Worker("Cara", Clearance.LOW),
                    new Worker("Dan", Clearance.LOW),
                    new Worker("Eve", Clearance.MEDIUM, false)));
            sites.saveAll(List.of(
                    new Site("Acme", "Tower A", Clearance.HIGH),
                    new Site("Acme", "Tower B", Clearance.MEDIUM),
                    new Site("Globex", "Main Office", null),
                    new Site("Initech", "Warehouse", Clearance.LOW)));

            LocalDate monday = ScheduleWeek.mondayOf(LocalDate.now());
            List<Assignment> demo = List.of(
                    new Assignment(DayOfWeek.MONDAY, "Acme", "Tower A", List.of("Ann"), 3, LocalTime.of(9, 0)),
                    new Assignment(DayOfWeek.MONDAY, "Globex", "Main Office", List.of("Ann"), 2, LocalTime.of(11, 0)),
                    new Assignment(DayOfWeek.TUESDAY, "Acme", "Tower A", List.of("Cara"), 4, LocalTime.of(8, 0)),
                    new Assignment(DayOfWeek.WEDNESDAY, "Initech", "Warehouse", List.of("Ben", "Dan"), 6, LocalTime.of(13, 0)),
                    new Assignment(DayOfWeek.MONDAY, "Acme", "Tower B", List.of("Ben"), 2, LocalTime.of(8, 0)));
            demo.forEach(a -> a.setWeekStart(monday));
            assignments.saveAll(demo);
            logger.info("デモデータを投入しました: week={} 割り当て={}件", monday, demo.size());
        };
    }
}
