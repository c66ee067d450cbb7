package com.example.cleanersched.conflict;

import com.example.cleanersched.roster.Worker;
import com.example.cleanersched.schedule.Assignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 同じ清掃員の同日の割り当てで、前の作業の終了が次の開始より遅いものを検出する。
 * <p>
 * 開始時刻の無い割り当ては対象外。時間数0以下の割り当ては並び順には含めるが、前側としては判定しない。
 * 終了時刻は24時で折り返すため、日を跨ぐ作業は次の作業と重ならない扱いになる。
 */
public class TimeOverlapDetector implements ConflictDetector {

    private static final Logger logger = LoggerFactory.getLogger(TimeOverlapDetector.class);

    @Override
    public ConflictType type() {
        return ConflictType.TIME_OVERLAP;
    }

    @Override
    public List<Conflict> detect(ScheduleIndex index) {
        List<Conflict> conflicts = new ArrayList<>();
        for (Map.Entry<WorkerDay, List<Assignment>> group : index.groups().entrySet()) {
            List<Assignment> timed = group.getValue().stream()
                    .filter(a -> a.getStartTime() != null)
                    .sorted(Comparator.comparing(Assignment::getStartTime))
                    .toList();
            for (int i = 0; i + 1 < timed.size(); i++) {
                Assignment current = timed.get(i);
                Assignment next = timed.get(i + 1);
                if (current.hoursOrZero() <= 0) {
                    continue;
                }
                LocalTime end = current.endTime().orElseThrow();
                if (!end.isAfter(next.getStartTime())) {
                    continue;
                }
                WorkerDay key = group.getKey();
                logger.debug("時間帯の重複検出: {} {} -> {}", key.label(), current.getId(), next.getId());
                conflicts.add(new Conflict(
                        "time-overlap-" + key.key() + "-" + current.getId() + "-" + next.getId(),
                        ConflictType.TIME_OVERLAP,
                        Severity.HIGH,
                        "時間帯の重複",
                        key.label() + " の " + current.getSiteName() + "（〜" + end + "）と "
                                + next.getSiteName() + "（" + next.getStartTime() + "〜）が重なっています",
                        List.of(current, next),
                        resolutionsFor(index, key, current, next, end),
                        ConflictType.TIME_OVERLAP.impactFor(2)));
            }
        }
        return conflicts;
    }

    private List<Resolution> resolutionsFor(ScheduleIndex index, WorkerDay key,
                                            Assignment earlier, Assignment later, LocalTime earlierEnd) {
        List<Resolution> resolutions = new ArrayList<>();
        resolutions.add(new Resolution(
                "reschedule-" + later.getId(),
                ResolutionType.RESCHEDULE,
                "開始時刻を変更",
                later.getSiteName() + " を " + earlier.getSiteName() + " の終了後 " + earlierEnd + " 開始に変更",
                List.of(FieldChange.reschedule(later.getId(), earlierEnd)),
                new EstimatedBenefit(60, 100, 25)));
        List<Worker> candidates = index.freeQualifiedWorkers(later);
        if (!candidates.isEmpty()) {
            Worker candidate = candidates.get(0);
            resolutions.add(new Resolution(
                    "reassign-" + later.getId() + "-" + candidate.getName(),
                    ResolutionType.REASSIGN,
                    candidate.getName() + " に再割り当て",
                    later.getSiteName() + " の担当を " + key.workerName() + " から " + candidate.getName() + " に変更",
                    List.of(FieldChange.reassign(later.getId(), key.workerName(), candidate.getName())),
                    new EstimatedBenefit(60, 100, 25)));
        }
        return resolutions;
    }
}
