package com.kotsin.snapshot.monitoring;

import com.kotsin.snapshot.domain.record.DiagnosticReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic quality report and alerting
 *
 * ALERTING: a high share of no-data cycles usually means a misconfigured source
 * (wrong study id, empty subgraph) rather than a quiet market.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotMonitor {

    private static final long ALERT_COOLDOWN_MS = 300_000; // 5 minutes

    private final SnapshotQualityMetrics metrics;

    @Value("${snapshot.monitor.no-data-alert-percent:50.0}")
    private double noDataAlertPercent = 50.0;

    @Value("${snapshot.monitor.min-cycles-for-alert:20}")
    private long minCyclesForAlert = 20;

    private long lastAlertTime = 0;

    @Scheduled(fixedRateString = "${snapshot.monitor.report-interval-ms:60000}")
    public void reportMetrics() {
        log.info("📊 === SNAPSHOT QUALITY REPORT ===");
        log.info("📈 Cycles: total={} emitted={} suppressed={} noData={}",
            metrics.getTotalCycles(), metrics.getEmittedCycles(),
            metrics.getSuppressedCycles(), metrics.getNoDataCycles());
        log.info("🔧 Corrections: {} ({}% of emitted)",
            metrics.getCorrectedSnapshots(), String.format("%.2f", metrics.getCorrectionRate()));
        log.info("📋 Detail: {}", metrics.getSnapshot());

        checkAlertConditions(System.currentTimeMillis());
        log.info("============================");
    }

    /**
     * Share of non-suppressed cycles that produced no snapshot.
     */
    public double getNoDataPercent() {
        long attempted = metrics.getEmittedCycles() + metrics.getNoDataCycles();
        return attempted > 0 ? (double) metrics.getNoDataCycles() / attempted * 100 : 0;
    }

    public boolean isHealthy() {
        long attempted = metrics.getEmittedCycles() + metrics.getNoDataCycles();
        return attempted < minCyclesForAlert || getNoDataPercent() < noDataAlertPercent;
    }

    boolean checkAlertConditions(long now) {
        if (now - lastAlertTime < ALERT_COOLDOWN_MS) {
            return false;
        }
        if (isHealthy()) {
            return false;
        }
        log.error("🚨 ALERT: {}% of cycles had no data (source unavailable={}, bounds exhausted={}, invalid={})",
            String.format("%.1f", getNoDataPercent()),
            metrics.getDiagnosticCount(DiagnosticReason.SOURCE_UNAVAILABLE),
            metrics.getDiagnosticCount(DiagnosticReason.BOUNDS_EXHAUSTED),
            metrics.getDiagnosticCount(DiagnosticReason.INVALID_TRIPLET));
        lastAlertTime = now;
        return true;
    }
}
