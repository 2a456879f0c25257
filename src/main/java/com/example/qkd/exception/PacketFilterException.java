package com.example.qkd.exception;

public class PacketFilterException extends QkdException {

    public PacketFilterException(String message) {
        super(message);
    }

    public PacketFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
