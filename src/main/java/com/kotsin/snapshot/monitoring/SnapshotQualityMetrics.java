package com.kotsin.snapshot.monitoring;

import com.kotsin.snapshot.domain.model.Bias;
import com.kotsin.snapshot.domain.model.ViolationKind;
import com.kotsin.snapshot.domain.record.DiagnosticReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SnapshotQualityMetrics - Tracks data quality across snapshot cycles
 *
 * Provides:
 * - Counters for emitted / suppressed / no-data cycles
 * - Counters by violation kind
 * - Counters by diagnostic reason
 * - Counters by bias classification
 */
@Component
@Slf4j
public class SnapshotQualityMetrics {

    // ==================== CYCLE COUNTERS ====================
    private final AtomicLong totalCycles = new AtomicLong(0);
    private final AtomicLong emittedCycles = new AtomicLong(0);
    private final AtomicLong suppressedCycles = new AtomicLong(0);
    private final AtomicLong noDataCycles = new AtomicLong(0);
    private final AtomicLong correctedSnapshots = new AtomicLong(0);
    private final AtomicLong sinkFailures = new AtomicLong(0);

    // ==================== COUNTERS BY KIND ====================
    private final Map<ViolationKind, AtomicLong> violationCounters = new ConcurrentHashMap<>();
    private final Map<DiagnosticReason, AtomicLong> diagnosticCounters = new ConcurrentHashMap<>();
    private final Map<Bias, AtomicLong> biasCounters = new ConcurrentHashMap<>();

    // ==================== INCREMENT METHODS ====================

    public void recordEmittedCycle() {
        totalCycles.incrementAndGet();
        emittedCycles.incrementAndGet();
    }

    public void recordSuppressedCycle() {
        totalCycles.incrementAndGet();
        suppressedCycles.incrementAndGet();
    }

    public void recordNoDataCycle() {
        totalCycles.incrementAndGet();
        noDataCycles.incrementAndGet();
    }

    public void recordCorrection(Iterable<ViolationKind> violations) {
        correctedSnapshots.incrementAndGet();
        for (ViolationKind kind : violations) {
            violationCounters.computeIfAbsent(kind, k -> new AtomicLong(0)).incrementAndGet();
        }
    }

    public void recordDiagnostic(DiagnosticReason reason) {
        diagnosticCounters.computeIfAbsent(reason, k -> new AtomicLong(0)).incrementAndGet();
    }

    public void recordBias(Bias bias) {
        biasCounters.computeIfAbsent(bias, k -> new AtomicLong(0)).incrementAndGet();
    }

    public void recordSinkFailure() {
        sinkFailures.incrementAndGet();
    }

    // ==================== GETTER METHODS ====================

    public long getTotalCycles() {
        return totalCycles.get();
    }

    public long getEmittedCycles() {
        return emittedCycles.get();
    }

    public long getSuppressedCycles() {
        return suppressedCycles.get();
    }

    public long getNoDataCycles() {
        return noDataCycles.get();
    }

    public long getCorrectedSnapshots() {
        return correctedSnapshots.get();
    }

    public long getSinkFailures() {
        return sinkFailures.get();
    }

    public long getViolationCount(ViolationKind kind) {
        AtomicLong counter = violationCounters.get(kind);
        return counter == null ? 0 : counter.get();
    }

    public long getDiagnosticCount(DiagnosticReason reason) {
        AtomicLong counter = diagnosticCounters.get(reason);
        return counter == null ? 0 : counter.get();
    }

    public long getBiasCount(Bias bias) {
        AtomicLong counter = biasCounters.get(bias);
        return counter == null ? 0 : counter.get();
    }

    /**
     * Percentage of emitted cycles whose snapshot needed a correction.
     */
    public double getCorrectionRate() {
        long emitted = emittedCycles.get();
        return emitted > 0 ? (double) correctedSnapshots.get() / emitted * 100 : 0;
    }

    // ==================== SNAPSHOT FOR REPORTING ====================

    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("totalCycles", totalCycles.get());
        snapshot.put("emittedCycles", emittedCycles.get());
        snapshot.put("suppressedCycles", suppressedCycles.get());
        snapshot.put("noDataCycles", noDataCycles.get());
        snapshot.put("correctedSnapshots", correctedSnapshots.get());
        snapshot.put("correctionRate", getCorrectionRate());
        snapshot.put("sinkFailures", sinkFailures.get());
        snapshot.put("violations", toCounts(violationCounters, ViolationKind.class));
        snapshot.put("diagnostics", toCounts(diagnosticCounters, DiagnosticReason.class));
        snapshot.put("bias", toCounts(biasCounters, Bias.class));
        return snapshot;
    }

    private static <E extends Enum<E>> Map<E, Long> toCounts(Map<E, AtomicLong> counters, Class<E> type) {
        Map<E, Long> result = new EnumMap<>(type);
        counters.forEach((k, v) -> result.put(k, v.get()));
        return result;
    }

    // ==================== RESET ====================

    public void reset() {
        totalCycles.set(0);
        emittedCycles.set(0);
        suppressedCycles.set(0);
        noDataCycles.set(0);
        correctedSnapshots.set(0);
        sinkFailures.set(0);
        violationCounters.clear();
        diagnosticCounters.clear();
        biasCounters.clear();
        log.info("SnapshotQualityMetrics reset");
    }
}
