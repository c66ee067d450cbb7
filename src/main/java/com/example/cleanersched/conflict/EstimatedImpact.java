package com.example.cleanersched.conflict;

/**
 * 競合による損失見込み（分 / ドル / 効率低下%）
 */
public record EstimatedImpact(int timeWasted, int costIncrease, int efficiencyLoss) {

    public static final EstimatedImpact NONE = new EstimatedImpact(0, 0, 0);
}
