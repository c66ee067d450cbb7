package com.example.cleanersched.conflict;

import java.util.List;

/**
 * 1種類の競合を検出する。
 * <p>
 * 実装は索引の読み取りのみ行い、例外処理は {@link ConflictDetectionEngine} 側で行う。
 */
public interface ConflictDetector {

    ConflictType type();

    List<Conflict> detect(ScheduleIndex index);
}
