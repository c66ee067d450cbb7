package com.example.cleanersched.conflict;

import java.util.function.IntFunction;

/**
 * 競合の種別。種別ごとに損失見込みの算出式を持つ。
 * <p>
 * 算出式の引数は種別ごとの規模で、ダブルブッキングは同日件数、
 * 負荷偏りは過負荷人数、移動非効率は顧客数。
 */
public enum ConflictType {
    DOUBLE_BOOKING(true, size -> new EstimatedImpact(size * 30, size * 50, size * 15)),
    TIME_OVERLAP(true, size -> new EstimatedImpact(60, 100, 25)),
    SECURITY_ACCESS(false, size -> new EstimatedImpact(60, 200, 50)),
    WORKLOAD_IMBALANCE(false, overloaded -> new EstimatedImpact(0, overloaded * 25, 10)),
    ROUTING_INEFFICIENCY(false, clients -> new EstimatedImpact((clients - 1) * 20, (clients - 1) * 15, 5));

    private final boolean relational;
    private final IntFunction<EstimatedImpact> impactModel;

    ConflictType(boolean relational, IntFunction<EstimatedImpact> impactModel) {
        this.relational = relational;
        this.impactModel = impactModel;
    }

    /**
     * 複数の割り当て同士の関係で成立する競合か（単独の割り当てでは発生しない）
     */
    public boolean isRelational() {
        return relational;
    }

    public EstimatedImpact impactFor(int magnitude) {
        return impactModel.apply(magnitude);
    }
}
