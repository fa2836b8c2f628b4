package com.entity.extraction.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * On close every key put through this context gets back the value it had
 * before, or is removed if it had none, so contexts nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMerge(correlationId, sourceId)) {
 *     log.info("merge.completed entities={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String SOURCE_ID = "sourceId";
    public static final String OPERATION = "operation";
    public static final String EXTRACTOR = "extractor";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Scopes a composite merge of one text.
     */
    public static LogContext forMerge(String correlationId, String sourceId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(SOURCE_ID, sourceId);
        ctx.put(OPERATION, "merge");
        return ctx;
    }

    /**
     * Scopes one capability's run inside a merge. Only the extractor key is
     * added, so closing it leaves the enclosing merge context in place.
     */
    public static LogContext forExtraction(String extractorName) {
        LogContext ctx = new LogContext();
        ctx.put(EXTRACTOR, extractorName);
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        List<Map.Entry<String, String>> entries = new ArrayList<>(previous.entrySet());
        Collections.reverse(entries);
        for (Map.Entry<String, String> entry : entries) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
