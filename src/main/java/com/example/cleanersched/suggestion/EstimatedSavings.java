package com.example.cleanersched.suggestion;

/**
 * 提案の削減見込み（分 / ドル）
 */
public record EstimatedSavings(int time, int cost) {

    public int total() {
        return time + cost;
    }
}
