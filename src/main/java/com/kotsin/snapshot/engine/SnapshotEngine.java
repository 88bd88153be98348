package com.kotsin.snapshot.engine;

import com.kotsin.snapshot.audit.AuditLogger;
import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import com.kotsin.snapshot.domain.model.Feed;
import com.kotsin.snapshot.domain.model.RawTriplet;
import com.kotsin.snapshot.domain.model.Scope;
import com.kotsin.snapshot.domain.normalizer.NormalizedPrice;
import com.kotsin.snapshot.domain.normalizer.PriceNormalizer;
import com.kotsin.snapshot.domain.record.BiasRecord;
import com.kotsin.snapshot.domain.record.DiagnosticReason;
import com.kotsin.snapshot.domain.record.DiagnosticRecord;
import com.kotsin.snapshot.domain.record.EngineRecord;
import com.kotsin.snapshot.domain.record.SnapshotRecord;
import com.kotsin.snapshot.domain.signal.BiasSignalGenerator;
import com.kotsin.snapshot.domain.tracker.SnapshotStateTracker;
import com.kotsin.snapshot.domain.tracker.TrackerOutcome;
import com.kotsin.snapshot.domain.validator.TripletValidator;
import com.kotsin.snapshot.domain.validator.ValidationResult;
import com.kotsin.snapshot.monitoring.SnapshotQualityMetrics;
import com.kotsin.snapshot.sink.EmissionSink;
import com.kotsin.snapshot.source.BarBounds;
import com.kotsin.snapshot.source.SnapshotSource;
import com.kotsin.snapshot.source.TradePriceSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * SnapshotEngine - one synchronous cycle per bar-close event per feed
 *
 * Flow:
 * bounds/clamp → dedup → read current triplet → normalize → validate/correct
 * → track (lineage) → emit previous + current → last price → bias
 *
 * Nothing here is fatal: unavailable or invalid input becomes a DiagnosticRecord,
 * duplicate bars are suppressed silently, sink failures are logged and counted.
 * A feed's whole cycle runs under that feed's lock only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotEngine {

    private final SnapshotSource snapshotSource;
    private final TradePriceSource tradePriceSource;
    private final PriceNormalizer normalizer;
    private final TripletValidator validator;
    private final SnapshotStateTracker tracker;
    private final BiasSignalGenerator biasGenerator;
    private final EmissionSink sink;
    private final SnapshotQualityMetrics metrics;
    private final AuditLogger auditLogger;

    public CycleResult onBarClose(Feed feed, int barIndex) {
        return tracker.runExclusive(feed.getId(), () -> runCycle(feed, barIndex));
    }

    private CycleResult runCycle(Feed feed, int requestedBarIndex) {
        String feedId = feed.getId();
        List<EngineRecord> records = new ArrayList<>();

        BarBounds bounds;
        try {
            bounds = snapshotSource.bounds(feed);
        } catch (RuntimeException e) {
            log.warn("⚠️ Bounds lookup failed for feed {}: {}", feedId, e.getMessage());
            return noData(feed, requestedBarIndex, records, DiagnosticReason.SOURCE_UNAVAILABLE,
                "bounds lookup failed: " + e.getMessage());
        }
        if (bounds == null || bounds.isEmpty()) {
            return noData(feed, requestedBarIndex, records, DiagnosticReason.BOUNDS_EXHAUSTED,
                "no bars available");
        }

        int barIndex = bounds.clamp(requestedBarIndex);
        if (barIndex != requestedBarIndex) {
            log.debug("Clamped bar index for feed {}: {} -> {} (bounds {}..{})",
                feedId, requestedBarIndex, barIndex, bounds.getFirst(), bounds.getLast());
        }

        if (tracker.isSuppressed(feedId, barIndex)) {
            log.debug("Duplicate bar {} for feed {}, cycle suppressed", barIndex, feedId);
            metrics.recordSuppressedCycle();
            return new CycleResult(feedId, barIndex, CycleStatus.SUPPRESSED, records, tracker.phase(feedId));
        }

        Optional<RawTriplet> raw = readCurrent(feed, barIndex);
        if (raw.isEmpty()) {
            return noData(feed, barIndex, records, DiagnosticReason.SOURCE_UNAVAILABLE,
                "no current triplet at bar " + barIndex);
        }

        RawTriplet normalized = normalizeTriplet(feed, barIndex, raw.get(), records);
        ValidationResult validation = validator.validate(normalized, barIndex);
        if (!validation.isValid()) {
            tracker.track(feedId, barIndex, null);
            auditLogger.logDiagnostic(feedId, barIndex, DiagnosticReason.INVALID_TRIPLET, validation.getInvalidReason());
            return noData(feed, barIndex, records, DiagnosticReason.INVALID_TRIPLET, validation.getInvalidReason());
        }

        CorrectedSnapshot snapshot = validation.getSnapshot();
        if (snapshot.isCorrected()) {
            metrics.recordCorrection(snapshot.getViolations());
            auditLogger.logCorrection(feedId, barIndex, normalized, snapshot);
        }

        TrackerOutcome outcome = tracker.track(feedId, barIndex, snapshot);
        if (!outcome.isAccepted()) {
            // Only reachable if the lock contract is broken; treat as a duplicate
            metrics.recordSuppressedCycle();
            return new CycleResult(feedId, barIndex, CycleStatus.SUPPRESSED, records, outcome.getPhase());
        }

        if (outcome.hasPreviousToEmit()) {
            emit(records, SnapshotRecord.of(feedId, Scope.PREVIOUS, outcome.getPreviousToEmit()));
        }
        emit(records, SnapshotRecord.of(feedId, Scope.CURRENT, snapshot));

        deriveBias(feed, barIndex, snapshot, records);

        metrics.recordEmittedCycle();
        return new CycleResult(feedId, barIndex, CycleStatus.EMITTED, records, outcome.getPhase());
    }

    private Optional<RawTriplet> readCurrent(Feed feed, int barIndex) {
        try {
            Optional<RawTriplet> raw = snapshotSource.readTriplet(feed, Scope.CURRENT, barIndex);
            return raw != null ? raw : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("⚠️ Triplet read failed for feed {} bar {}: {}", feed.getId(), barIndex, e.getMessage());
            return Optional.empty();
        }
    }

    private RawTriplet normalizeTriplet(Feed feed, int barIndex, RawTriplet raw, List<EngineRecord> records) {
        double reference = normalizeField(feed, barIndex, "reference", raw.getReference(), records).getPrice();
        double upper = normalizeField(feed, barIndex, "upper", raw.getUpper(), records).getPrice();
        double lower = normalizeField(feed, barIndex, "lower", raw.getLower(), records).getPrice();
        return RawTriplet.of(reference, upper, lower);
    }

    private NormalizedPrice normalizeField(Feed feed, int barIndex, String field, double raw,
                                           List<EngineRecord> records) {
        NormalizedPrice price = normalizer.normalize(raw, feed);
        if (price.isRescaled()) {
            double threshold = normalizer.effectiveThreshold(feed);
            auditLogger.logRescale(feed.getId(), barIndex, field, price.getUnscaled(), price.getPrice(), threshold);
            diagnostic(records, feed, barIndex, DiagnosticReason.PRICE_RESCALED,
                String.format("%s %.8f -> %.8f (threshold %.2f)", field, price.getUnscaled(), price.getPrice(), threshold));
        }
        return price;
    }

    private void deriveBias(Feed feed, int barIndex, CorrectedSnapshot snapshot, List<EngineRecord> records) {
        OptionalDouble rawPrice;
        try {
            rawPrice = tradePriceSource.lastPrice(feed);
        } catch (RuntimeException e) {
            log.warn("⚠️ Last price lookup failed for feed {}: {}", feed.getId(), e.getMessage());
            rawPrice = OptionalDouble.empty();
        }
        if (rawPrice == null || rawPrice.isEmpty()) {
            diagnostic(records, feed, barIndex, DiagnosticReason.LAST_PRICE_UNAVAILABLE, "no last trade price");
            return;
        }

        NormalizedPrice lastPrice = normalizeField(feed, barIndex, "lastPrice", rawPrice.getAsDouble(), records);
        if (!lastPrice.isAvailable()) {
            diagnostic(records, feed, barIndex, DiagnosticReason.LAST_PRICE_UNAVAILABLE,
                "last trade price rejected: " + rawPrice.getAsDouble());
            return;
        }

        BiasRecord bias = biasGenerator.generate(feed, snapshot, lastPrice.getPrice());
        metrics.recordBias(bias.getBias());
        emit(records, bias);
    }

    private CycleResult noData(Feed feed, int barIndex, List<EngineRecord> records,
                               DiagnosticReason reason, String detail) {
        log.debug("No data for feed {} bar {}: {} ({})", feed.getId(), barIndex, reason, detail);
        diagnostic(records, feed, barIndex, reason, detail);
        metrics.recordNoDataCycle();
        return new CycleResult(feed.getId(), barIndex, CycleStatus.NO_DATA, records, tracker.phase(feed.getId()));
    }

    private void diagnostic(List<EngineRecord> records, Feed feed, int barIndex,
                            DiagnosticReason reason, String detail) {
        metrics.recordDiagnostic(reason);
        emit(records, DiagnosticRecord.of(feed.getId(), barIndex, reason, detail));
    }

    private void emit(List<EngineRecord> records, EngineRecord record) {
        records.add(record);
        try {
            sink.emit(record);
        } catch (RuntimeException e) {
            metrics.recordSinkFailure();
            log.error("❌ Sink rejected {} for feed {} bar {}: {}",
                record.getKind(), record.getFeedId(), record.getBarIndex(), e.getMessage(), e);
        }
    }
}
