package com.example.skillgap.courses.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embedding model used to vectorise skill queries against courses.embedding.
 */
@Configuration
@EnableConfigurationProperties(Langchain4jOpenAiProperties.class)
public class EmbeddingConfig {

    @Bean
    public EmbeddingModel embeddingModel(Langchain4jOpenAiProperties props) {
        OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder = OpenAiEmbeddingModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getEmbeddingModel())
                .timeout(props.getTimeout())
                .maxRetries(props.getMaxRetries());
        if (props.getBaseUrl() != null && !props.getBaseUrl().isBlank()) {
            builder.baseUrl(props.getBaseUrl());
        }
        return builder.build();
    }
}
