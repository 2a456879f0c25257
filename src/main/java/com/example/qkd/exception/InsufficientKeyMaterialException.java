package com.example.qkd.exception;

import lombok.Getter;

/**
 * 筛选后保留的比特不足以拼出原始密钥（或公开样本为空）。
 * 属于可重试的尺寸问题，不是安全事件。
 */
@Getter
public class InsufficientKeyMaterialException extends QkdException {

    private final int siftedLength;
    private final int retainedLength;
    private final int requiredBits;

    public InsufficientKeyMaterialException(String message,
                                            int siftedLength,
                                            int retainedLength,
                                            int requiredBits) {
        super(message);
        this.siftedLength = siftedLength;
        this.retainedLength = retainedLength;
        this.requiredBits = requiredBits;
    }
}
