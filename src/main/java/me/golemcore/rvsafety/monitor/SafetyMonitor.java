package me.golemcore.rvsafety.monitor;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.rvsafety.domain.service.PinManager;
import me.golemcore.rvsafety.domain.service.SafetyService;
import me.golemcore.rvsafety.infrastructure.config.RvSafetyProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the two supervision loops of {@link SafetyService}.
 *
 * <p>
 * The health loop runs {@link SafetyService#performHealthCheck()} every
 * {@code rvsafety.safety.health-check-interval-ms}. The watchdog loop runs on
 * its own thread so that a health iteration stuck on the safety actor is still
 * detected. Both loops idle once the service is in safe state.
 *
 * <p>
 * A third, independent loop sweeps expired PIN sessions and purges old session
 * and attempt records every {@code rvsafety.pin.cleanup-interval-ms}.
 */
@Component
@Slf4j
public class SafetyMonitor {

    private final SafetyService safetyService;
    private final PinManager pinManager;
    private final RvSafetyProperties.SafetyProperties config;
    private final long cleanupIntervalMs;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService healthScheduler;
    private ScheduledExecutorService watchdogScheduler;
    private ScheduledExecutorService cleanupScheduler;
    private ScheduledFuture<?> healthTask;
    private ScheduledFuture<?> watchdogTask;
    private ScheduledFuture<?> cleanupTask;

    public SafetyMonitor(SafetyService safetyService, PinManager pinManager, RvSafetyProperties properties) {
        this.safetyService = safetyService;
        this.pinManager = pinManager;
        this.config = properties.getSafety();
        this.cleanupIntervalMs = properties.getPin().getCleanupIntervalMs();
    }

    @PostConstruct
    public void init() {
        if (cleanupIntervalMs > 0) {
            cleanupScheduler = daemonScheduler("pin-session-cleanup");
            cleanupTask = cleanupScheduler.scheduleWithFixedDelay(this::cleanupTick, cleanupIntervalMs,
                    cleanupIntervalMs, TimeUnit.MILLISECONDS);
        }

        if (!config.isMonitoringEnabled()) {
            log.info("[SafetyMonitor] Safety monitoring disabled");
            return;
        }

        safetyService.kickWatchdog();

        healthScheduler = daemonScheduler("safety-health-monitor");
        watchdogScheduler = daemonScheduler("safety-watchdog");

        long healthInterval = config.getHealthCheckIntervalMs();
        long watchdogInterval = config.getWatchdogPollIntervalMs();
        healthTask = healthScheduler.scheduleAtFixedRate(this::healthTick, healthInterval, healthInterval,
                TimeUnit.MILLISECONDS);
        watchdogTask = watchdogScheduler.scheduleAtFixedRate(this::watchdogTick, watchdogInterval,
                watchdogInterval, TimeUnit.MILLISECONDS);

        log.info("[SafetyMonitor] Started: health every {}ms, watchdog poll every {}ms, timeout {}ms",
                healthInterval, watchdogInterval, config.getWatchdogTimeoutMs());
    }

    @PreDestroy
    public void shutdown() {
        if (healthTask != null) {
            healthTask.cancel(false);
        }
        if (watchdogTask != null) {
            watchdogTask.cancel(false);
        }
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
        stop(healthScheduler);
        stop(watchdogScheduler);
        stop(cleanupScheduler);
        log.info("[SafetyMonitor] Shut down");
    }

    void healthTick() {
        try {
            if (safetyService.isInSafeState()) {
                return;
            }
            if (!executing.compareAndSet(false, true)) {
                log.debug("[SafetyMonitor] Health tick skipped: previous check still in progress");
                return;
            }
            try {
                safetyService.performHealthCheck();
            } finally {
                executing.set(false);
            }
        } catch (Exception e) {
            executing.set(false);
            log.error("[SafetyMonitor] Health tick failed: {}", e.getMessage(), e);
        }
    }

    void watchdogTick() {
        try {
            if (safetyService.checkWatchdog()) {
                log.error("[SafetyMonitor] Watchdog expired, safe state entered");
            }
        } catch (Exception e) {
            log.error("[SafetyMonitor] Watchdog tick failed: {}", e.getMessage(), e);
        }
    }

    void cleanupTick() {
        try {
            int cleaned = pinManager.cleanupExpiredSessions();
            if (cleaned > 0) {
                log.info("[SafetyMonitor] Expired {} PIN session(s)", cleaned);
            }
        } catch (Exception e) {
            log.warn("[SafetyMonitor] PIN session cleanup failed: {}", e.getMessage());
        }
    }

    boolean isRunning() {
        return healthScheduler != null && !healthScheduler.isShutdown();
    }

    private static ScheduledExecutorService daemonScheduler(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    private static void stop(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
