package com.example.skillgap.courses.service;

import java.util.List;

/**
 * Batched embedding of skill query texts.
 */
public interface SkillEmbeddingClient {

    /**
     * @return one vector per input text, in input order
     */
    List<float[]> embedAll(List<String> texts);
}
