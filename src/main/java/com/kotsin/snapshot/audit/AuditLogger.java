package com.kotsin.snapshot.audit;

import com.kotsin.snapshot.domain.model.CorrectedSnapshot;
import com.kotsin.snapshot.domain.model.RawTriplet;
import com.kotsin.snapshot.domain.record.DiagnosticReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit logging for every intervention the engine makes on host data
 *
 * Corrections and rescales change what downstream consumers see, so each one
 * leaves a structured line with the before/after values.
 */
@Component
@Slf4j
public class AuditLogger {

    @Value("${features.audit-logging.enabled:true}")
    private boolean auditLoggingEnabled = true;

    private static final DateTimeFormatter AUDIT_DATE_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

    /**
     * Log a triplet repaired by the validator
     */
    public void logCorrection(String feedId, int barIndex, RawTriplet raw, CorrectedSnapshot corrected) {
        if (!auditLoggingEnabled) {
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("barIndex", barIndex);
        details.put("violations", corrected.getViolations());
        details.put("rawReference", raw.getReference());
        details.put("rawUpper", raw.getUpper());
        details.put("rawLower", raw.getLower());
        details.put("reference", corrected.getReference());
        details.put("upper", corrected.getUpper());
        details.put("lower", corrected.getLower());

        logEvent("SNAPSHOT_CORRECTED", feedId, details);
    }

    /**
     * Log the mis-scaling heuristic firing on a price
     */
    public void logRescale(String feedId, int barIndex, String field, double before, double after, double threshold) {
        if (!auditLoggingEnabled) {
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("barIndex", barIndex);
        details.put("field", field);
        details.put("before", before);
        details.put("after", after);
        details.put("threshold", threshold);

        logEvent("PRICE_RESCALED", feedId, details);
    }

    /**
     * Log a diagnostic handed to the sink
     */
    public void logDiagnostic(String feedId, int barIndex, DiagnosticReason reason, String detail) {
        if (!auditLoggingEnabled) {
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("barIndex", barIndex);
        details.put("reason", reason);
        details.put("detail", detail);
        details.put("severity", "WARNING");

        logEvent("DIAGNOSTIC", feedId, details);
    }

    void logEvent(String event, String feedId, Map<String, Object> details) {
        Map<String, Object> auditRecord = new LinkedHashMap<>();
        auditRecord.put("timestamp", ZonedDateTime.now().format(AUDIT_DATE_FORMAT));
        auditRecord.put("event", event);
        auditRecord.put("feedId", feedId);
        auditRecord.putAll(details);
        log.info("AUDIT: {}", formatAuditRecord(auditRecord));
    }

    private String formatAuditRecord(Map<String, Object> record) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : record.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append("}").toString();
    }

    public boolean isEnabled() {
        return auditLoggingEnabled;
    }

    public void setEnabled(boolean enabled) {
        this.auditLoggingEnabled = enabled;
    }
}
