package com.fincore.foresight.observability;

import com.fincore.foresight.domain.model.SeriesKey;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for FORESIGHT service.
 * <p>
 * Writes {@code message | data={json}} lines and scopes MDC keys for the series and
 * training run being processed.
 */
@Slf4j
@Component
public class ForesightStructuredLogger {

    // MDC keys
    public static final String MDC_SERIES_KEY = "seriesKey";
    public static final String MDC_SOURCE = "source";
    public static final String MDC_TRAINING_RUN_ID = "trainingRunId";

    private static final long SLOW_TRAINING_MS = 10_000;

    /**
     * Log a training pass lifecycle event.
     */
    public void logTrainingEvent(String runId, TrainingEventType eventType, String message,
                                 Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_TRAINING_RUN_ID, runId))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("trainingRunId", runId);
            if (details != null) {
                logData.putAll(details);
            }

            log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log the outcome of fitting one series within a training pass.
     */
    public void logSeriesEvent(String runId, SeriesKey key, SeriesEventType eventType, String message,
                               Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_TRAINING_RUN_ID, runId,
                MDC_SERIES_KEY, key.toString()))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("source", key.getSource());
            logData.put("metricName", key.getMetricName());
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case TRAINED -> log.info("{} | data={}", message, formatLogData(logData));
                case NOT_FITTED, SKIPPED -> log.debug("{} | data={}", message, formatLogData(logData));
                case TIMED_OUT -> log.warn("{} | data={}", message, formatLogData(logData));
                case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a served analytics request.
     */
    public void logRequestEvent(RequestType requestType, String source, String metricName,
                                String message, Map<String, Object> details) {
        Map<String, String> context = new LinkedHashMap<>();
        if (source != null) {
            context.put(MDC_SOURCE, source);
        }
        if (source != null && metricName != null) {
            context.put(MDC_SERIES_KEY, SeriesKey.of(source, metricName).toString());
        }
        try (var scope = withContext(context)) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", requestType.name());
            if (source != null) {
                logData.put("source", source);
            }
            if (metricName != null) {
                logData.put("metricName", metricName);
            }
            if (details != null) {
                logData.putAll(details);
            }
            log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log the duration of a training pass.
     */
    public void logTrainingDuration(String runId, Duration duration, int seriesCount) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "PERFORMANCE");
        logData.put("trainingRunId", runId);
        logData.put("durationMs", duration.toMillis());
        logData.put("series", seriesCount);

        if (duration.toMillis() > SLOW_TRAINING_MS) {
            log.warn("Slow training pass took {}ms | data={}", duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Training pass completed in {}ms | data={}", duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum TrainingEventType {
        PASS_STARTED, PASS_COMPLETED
    }

    public enum SeriesEventType {
        TRAINED, NOT_FITTED, SKIPPED, TIMED_OUT, FAILED
    }

    public enum RequestType {
        INGEST, FORECAST, ANOMALY_DETECTION, HEALTH, CAPACITY, SUMMARY
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
