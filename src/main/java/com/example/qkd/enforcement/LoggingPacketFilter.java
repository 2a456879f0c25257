package com.example.qkd.enforcement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 只记日志的过滤器，没有真实防火墙时使用。
 */
public class LoggingPacketFilter implements PacketFilter {

    private static final Logger log = LoggerFactory.getLogger(LoggingPacketFilter.class);

    @Override
    public void block() {
        log.info("[FILTER] traffic BLOCKED");
    }

    @Override
    public void allow() {
        log.info("[FILTER] traffic ALLOWED");
    }
}
