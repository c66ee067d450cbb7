package com.example.cleanersched.conflict;

import com.example.cleanersched.common.error.ErrorLogBuffer;
import com.example.cleanersched.config.ConflictSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 5種類の検出器を固定順（ダブルブッキング → 時間重複 → セキュリティ → 業務量 → 移動）で実行する。
 * <p>
 * 状態を持たず、呼び出しごとに索引を作り直す。検出器で例外が起きた場合はログとエラーバッファに記録し、
 * その検出器の結果を空として残りを続行する。検出器間での重複排除は行わない。
 */
@Service
public class ConflictDetectionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ConflictDetectionEngine.class);

    /** 変更の事前検証で使う種別 */
    public static final Set<ConflictType> GATE_TYPES =
            EnumSet.of(ConflictType.DOUBLE_BOOKING, ConflictType.TIME_OVERLAP, ConflictType.SECURITY_ACCESS);

    private final List<ConflictDetector> detectors;
    private final ErrorLogBuffer errorLogBuffer;

    @Autowired
    public ConflictDetectionEngine(ConflictSettings settings, ErrorLogBuffer errorLogBuffer) {
        this(defaultDetectors(settings), errorLogBuffer);
    }

    public ConflictDetectionEngine(ConflictSettings settings) {
        this(defaultDetectors(settings), null);
    }

    ConflictDetectionEngine(List<ConflictDetector> detectors, ErrorLogBuffer errorLogBuffer) {
        this.detectors = List.copyOf(detectors);
        this.errorLogBuffer = errorLogBuffer;
    }

    public static List<ConflictDetector> defaultDetectors(ConflictSettings settings) {
        return List.of(
                new DoubleBookingDetector(),
                new TimeOverlapDetector(),
                new SecurityAccessDetector(),
                new WorkloadImbalanceDetector(WorkloadAttribution.EVEN_SPLIT, settings.getWorkloadThreshold()),
                new RoutingInefficiencyDetector(settings.getGroupingStartHour()));
    }

    public List<Conflict> detectConflicts(ScheduleSnapshot snapshot) {
        return detectConflicts(snapshot, EnumSet.allOf(ConflictType.class));
    }

    /**
     * 指定種別の検出器だけを実行する
     */
    public List<Conflict> detectConflicts(ScheduleSnapshot snapshot, Set<ConflictType> types) {
        if (snapshot == null) {
            return List.of();
        }
        ScheduleIndex index;
        try {
            index = ScheduleIndex.of(snapshot);
        } catch (RuntimeException e) {
            record("ScheduleIndex", "スケジュール索引の作成に失敗しました", e);
            return List.of();
        }
        List<Conflict> conflicts = new ArrayList<>();
        for (ConflictDetector detector : detectors) {
            if (types.contains(detector.type())) {
                conflicts.addAll(runIsolated(detector, index));
            }
        }
        logger.debug("競合検出完了: 割り当て={} 競合={}", snapshot.assignments().size(), conflicts.size());
        return conflicts;
    }

    public ConflictReport report(ScheduleSnapshot snapshot) {
        return new ConflictReport(detectConflicts(snapshot));
    }

    private List<Conflict> runIsolated(ConflictDetector detector, ScheduleIndex index) {
        try {
            List<Conflict> found = detector.detect(index);
            return found == null ? List.of() : found;
        } catch (RuntimeException e) {
            record(detector.type().name(), detector.type() + " の検出中にエラーが発生しました", e);
            return List.of();
        }
    }

    private void record(String source, String message, RuntimeException e) {
        logger.error(message, e);
        if (errorLogBuffer != null) {
            errorLogBuffer.addError(source, message, e);
        }
    }
}
