package com.example.qkd.exception;

/**
 * 链路健康查询失败（KMS 不可达、响应无法解析等），执行端按 "unknown" 处理。
 */
public class LinkHealthUnavailableException extends QkdException {

    public LinkHealthUnavailableException(String message) {
        super(message);
    }

    public LinkHealthUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
