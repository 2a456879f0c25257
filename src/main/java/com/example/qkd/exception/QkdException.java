package com.example.qkd.exception;

/**
 * 本服务所有运行期异常的根类型。
 */
public class QkdException extends RuntimeException {

    public QkdException(String message) {
        super(message);
    }

    public QkdException(String message, Throwable cause) {
        super(message, cause);
    }
}
