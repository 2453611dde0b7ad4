package com.example.skillgap.courses.service;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Sends all texts of a batch to the embedding model in a single request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LangChain4jSkillEmbeddingClient implements SkillEmbeddingClient {

    private final EmbeddingModel embeddingModel;

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();

        log.debug("Embedding {} skill texts in one request", segments.size());
        Response<List<Embedding>> response = embeddingModel.embedAll(segments);
        List<Embedding> embeddings = response == null ? null : response.content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new IllegalStateException("Embedding model returned %d vectors for %d texts"
                    .formatted(embeddings == null ? 0 : embeddings.size(), texts.size()));
        }

        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (Embedding embedding : embeddings) {
            vectors.add(embedding.vector());
        }
        return vectors;
    }
}
