package com.example.skillgap.courses.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enhancement entries aggregated across one batch, keyed by course id.
 * Certifications and specializations share the {@code certifications} map.
 */
public record EnhancementData(
        Map<String, EnhancementEntry> projects,
        Map<String, EnhancementEntry> certifications
) {

    public EnhancementData {
        projects = projects == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(projects));
        certifications = certifications == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(certifications));
    }

    public static EnhancementData empty() {
        return new EnhancementData(Map.of(), Map.of());
    }
}
