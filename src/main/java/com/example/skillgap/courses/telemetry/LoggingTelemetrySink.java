package com.example.skillgap.courses.telemetry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes telemetry events to the application log. Events carrying a {@code severity} attribute of
 * MEDIUM or HIGH are logged at WARN, everything else at DEBUG so per-operation cache events stay quiet.
 */
@Slf4j
@Component
public class LoggingTelemetrySink implements TelemetrySink {

    static final String SEVERITY = "severity";

    @Override
    public void record(String event, Map<String, Object> attributes) {
        Object severity = attributes == null ? null : attributes.get(SEVERITY);
        if ("HIGH".equals(severity) || "MEDIUM".equals(severity)) {
            log.warn("telemetry event={} attributes={}", event, attributes);
        } else {
            log.debug("telemetry event={} attributes={}", event, attributes);
        }
    }
}
