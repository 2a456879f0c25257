package com.example.qkd.enforcement;

import com.example.qkd.model.LinkHealthSnapshot;
import com.example.qkd.model.LinkStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 链路执行端：定时拉取链路健康，把状态变化翻译成封禁 / 放行。
 *
 * RED -> BLOCKED，GREEN / YELLOW -> ALLOWED。
 * 自己记住上一次已执行的状态，相同动作不重复下发；KMS 不关心谁读过状态。
 */
@Slf4j
public class LinkEnforcementAgent {

    private final LinkHealthSource source;
    private final PacketFilter filter;
    private final UnknownStatusPolicy unknownPolicy;
    private final Duration pollInterval;
    private final boolean releaseOnStop;

    private volatile FilterState lastApplied = FilterState.UNKNOWN;
    private ScheduledExecutorService scheduler;

    public LinkEnforcementAgent(LinkHealthSource source,
                                PacketFilter filter,
                                UnknownStatusPolicy unknownPolicy,
                                Duration pollInterval,
                                boolean releaseOnStop) {
        this.source = source;
        this.filter = filter;
        this.unknownPolicy = unknownPolicy;
        this.pollInterval = pollInterval;
        this.releaseOnStop = releaseOnStop;
    }

    public FilterState getLastApplied() {
        return lastApplied;
    }

    /**
     * 拉取一次并按需执行，返回执行后的状态。
     */
    public synchronized FilterState pollOnce() {
        LinkHealthSnapshot health = null;
        try {
            health = source.checkLinkHealth();
        } catch (RuntimeException e) {
            log.warn("[GUARD] link health unknown: {}", e.getMessage());
        }

        FilterState desired = desiredState(health);
        if (desired == lastApplied) {
            return lastApplied;
        }

        try {
            if (desired == FilterState.BLOCKED) {
                filter.block();
                log.info("[GUARD] traffic BLOCKED. status={}, qber={}",
                        health == null ? "UNKNOWN" : health.getStatus(),
                        health == null ? null : health.getLastQber());
            } else {
                filter.allow();
                log.info("[GUARD] traffic ALLOWED. status={}, qber={}", health.getStatus(), health.getLastQber());
            }
            lastApplied = desired;
        } catch (RuntimeException e) {
            // 不更新 lastApplied，下一轮重试
            log.error("[GUARD] failed to apply {}: {}", desired, e.getMessage(), e);
        }
        return lastApplied;
    }

    private FilterState desiredState(LinkHealthSnapshot health) {
        if (health == null) {
            return unknownPolicy == UnknownStatusPolicy.BLOCK ? FilterState.BLOCKED : lastApplied;
        }
        return health.getStatus() == LinkStatus.RED ? FilterState.BLOCKED : FilterState.ALLOWED;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "link-enforcement");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::pollQuietly, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[GUARD] link enforcement started. interval={}, unknownPolicy={}", pollInterval, unknownPolicy);
    }

    public void stop() {
        ScheduledExecutorService s;
        synchronized (this) {
            s = scheduler;
            scheduler = null;
        }
        if (s == null) {
            return;
        }
        s.shutdownNow();
        try {
            s.awaitTermination(pollInterval.toMillis() + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        synchronized (this) {
            if (releaseOnStop && lastApplied == FilterState.BLOCKED) {
                try {
                    filter.allow();
                    lastApplied = FilterState.ALLOWED;
                } catch (RuntimeException e) {
                    log.error("[GUARD] failed to release block on stop: {}", e.getMessage(), e);
                }
            }
        }
        log.info("[GUARD] link enforcement stopped");
    }

    private void pollQuietly() {
        // 异常逃出去会让 ScheduledExecutorService 停掉后续调度
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("[GUARD] poll failed", e);
        }
    }
}
