package com.example.cleanersched.conflict;

/**
 * 解決策を適用した場合の効果見込み（分 / ドル / 効率改善%）
 */
public record EstimatedBenefit(int timeSaved, int costReduction, int efficiencyGain) {
}
