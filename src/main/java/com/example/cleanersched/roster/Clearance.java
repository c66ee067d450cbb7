package com.example.cleanersched.roster;

/**
 * セキュリティクリアランス。LOW &lt; MEDIUM &lt; HIGH の全順序。
 */
public enum Clearance {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * このクリアランスで要求レベルの現場に入れるか。要求なし(null)は常に許可。
     */
    public boolean satisfies(Clearance required) {
        return required == null || this.compareTo(required) >= 0;
    }

    public static Clearance orLow(Clearance clearance) {
        return clearance == null ? LOW : clearance;
    }
}
