package com.example.qkd.model;

public enum RejectionReason {
    /** QBER 超阈值：安全事件，链路置 RED */
    EAVESDROPPER_DETECTED,
    /** 保留比特不足（重试后仍不够）：不是安全事件，链路状态不变 */
    INSUFFICIENT_KEY_MATERIAL
}
