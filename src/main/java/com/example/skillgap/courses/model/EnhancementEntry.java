package com.example.skillgap.courses.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Project or certification surfaced for resume enhancement, tagged with the skill it came from.
 */
public record EnhancementEntry(
        String id,
        String name,
        String provider,
        String description,
        @JsonProperty("related_skill") String relatedSkill
) {
}
