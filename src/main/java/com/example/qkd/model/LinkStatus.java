package com.example.qkd.model;

public enum LinkStatus {
    /** 链路安全，可正常发放密钥 */
    GREEN("G"),
    /** QBER 偏高，仍在安全阈值内 */
    YELLOW("Y"),
    /** 检测到窃听，停止发放密钥 */
    RED("R");

    /** 单字母简写，fromName 也认 */
    private final String code;

    LinkStatus(String code) {
        this.code = code;
    }

    /**
     * 只看最近一次的 QBER，不做平滑，不看历史状态。
     *
     * @param qber              最近一次观测到的误码率
     * @param detected          模拟器给出的窃听判定
     * @param safeThreshold     GREEN / YELLOW 分界
     * @param securityThreshold YELLOW / RED 分界
     */
    public static LinkStatus classify(double qber,
                                      boolean detected,
                                      double safeThreshold,
                                      double securityThreshold) {
        if (detected || qber >= securityThreshold) {
            return RED;
        }
        if (qber < safeThreshold) {
            return GREEN;
        }
        return YELLOW;
    }

    public static LinkStatus fromName(String name) {
        if (name == null) {
            return null;
        }
        for (LinkStatus s : values()) {
            if (s.name().equalsIgnoreCase(name.trim()) || s.code.equalsIgnoreCase(name.trim())) {
                return s;
            }
        }
        return null;
    }
}
