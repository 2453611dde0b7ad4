package com.example.skillgap.courses.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds properties:
 *
 * langchain4j.openai.api-key=...
 * langchain4j.openai.embedding-model=text-embedding-3-small
 * langchain4j.openai.timeout=10s
 */
@Data
@ConfigurationProperties(prefix = "langchain4j.openai")
public class Langchain4jOpenAiProperties {

    /**
     * OpenAI API key
     */
    private String apiKey;

    /**
     * Optional base URL, e.g. an Azure OpenAI compatible gateway
     */
    private String baseUrl;

    /**
     * Embedding model name. Must match the model that produced courses.embedding.
     */
    private String embeddingModel = "text-embedding-3-small";

    /**
     * Timeout of a single batched embedding request
     */
    private Duration timeout = Duration.ofSeconds(10);

    private int maxRetries = 2;
}
