package com.example.qkd.exception;

/**
 * 参数非法 / 随机源不可用：调用直接失败，不做静默兜底。
 */
public class QkdConfigurationException extends QkdException {

    public QkdConfigurationException(String message) {
        super(message);
    }

    public QkdConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
