package com.example.qkd.util;

import org.springframework.stereotype.Component;

@Component
public class HexCodec {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    public String encodeHex(byte[] bytes) {
        if (bytes == null) return "";
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[i * 2] = DIGITS[(bytes[i] >> 4) & 0x0f];
            out[i * 2 + 1] = DIGITS[bytes[i] & 0x0f];
        }
        return new String(out);
    }

    /**
     * 日志里只打前 n 个字节，不输出完整密钥。
     */
    public String prefix(byte[] bytes, int n) {
        if (bytes == null) return "";
        int len = Math.min(n, bytes.length);
        byte[] head = new byte[len];
        System.arraycopy(bytes, 0, head, 0, len);
        return encodeHex(head);
    }
}
