package com.example.skillgap.courses.telemetry;

import java.util.Map;

/**
 * Fire-and-forget event recording. Callers must not let a failing sink affect their own result.
 */
@FunctionalInterface
public interface TelemetrySink {

    void record(String event, Map<String, Object> attributes);

    static TelemetrySink noop() {
        return (event, attributes) -> { };
    }
}
