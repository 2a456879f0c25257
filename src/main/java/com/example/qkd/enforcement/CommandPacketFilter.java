package com.example.qkd.enforcement;

import com.example.qkd.exception.PacketFilterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 通过外部命令（例如 iptables）落实封禁。
 *
 * block 命令失败直接抛异常，执行端下一轮会重试；
 * allow 命令失败只记 warn（删除不存在的规则本来就会失败，视为已放行）。
 */
public class CommandPacketFilter implements PacketFilter {

    private static final Logger log = LoggerFactory.getLogger(CommandPacketFilter.class);

    private final List<List<String>> blockCommands;
    private final List<List<String>> allowCommands;
    private final Duration timeout;

    public CommandPacketFilter(List<String> blockCommands, List<String> allowCommands, Duration timeout) {
        if (blockCommands == null || blockCommands.isEmpty()) {
            throw new IllegalArgumentException("blockCommands is empty");
        }
        this.blockCommands = tokenize(blockCommands);
        this.allowCommands = tokenize(allowCommands == null ? List.of() : allowCommands);
        this.timeout = timeout;
    }

    @Override
    public void block() {
        for (List<String> cmd : blockCommands) {
            int code = run(cmd);
            if (code != 0) {
                throw new PacketFilterException("block command failed (exit=" + code + "): " + String.join(" ", cmd));
            }
        }
    }

    @Override
    public void allow() {
        for (List<String> cmd : allowCommands) {
            int code = run(cmd);
            if (code != 0) {
                log.warn("Allow command exited with {} (rule may already be absent): {}", code, String.join(" ", cmd));
            }
        }
    }

    private int run(List<String> cmd) {
        ProcessBuilder pb = new ProcessBuilder(cmd);
        // 合并 stdout/stderr，便于排错
        pb.redirectErrorStream(true);

        log.debug("Running filter command: {}", String.join(" ", cmd));

        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            throw new PacketFilterException("cannot start command: " + String.join(" ", cmd), e);
        }

        try {
            String out;
            try (InputStream is = p.getInputStream()) {
                out = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new PacketFilterException("command timed out after " + timeout + ": " + String.join(" ", cmd));
            }
            if (!out.isBlank()) {
                log.debug("Filter command output: {}", out.trim());
            }
            return p.exitValue();
        } catch (IOException e) {
            throw new PacketFilterException("failed reading command output: " + String.join(" ", cmd), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            throw new PacketFilterException("interrupted while running: " + String.join(" ", cmd), e);
        }
    }

    private static List<List<String>> tokenize(List<String> commands) {
        List<List<String>> out = new ArrayList<>();
        for (String c : commands) {
            if (c == null || c.isBlank()) continue;
            out.add(Arrays.asList(c.trim().split("\\s+")));
        }
        return out;
    }
}
