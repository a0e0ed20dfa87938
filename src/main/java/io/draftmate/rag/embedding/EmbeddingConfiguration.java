package io.draftmate.rag.embedding;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;

/**
 * Wires the text encoder. The model itself is only constructed on first use
 * so that startup does not block on loading the ONNX runtime.
 */
@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfiguration {

    static final String MINI_LM_MODEL = "all-MiniLM-L6-v2";
    static final String DETERMINISTIC_MODEL = "deterministic-sha256";

    @Bean
    @ConditionalOnMissingBean
    public TextEncoder textEncoder(EmbeddingProperties properties) {
        if (properties.isMock()) {
            return new TextEncoder(DETERMINISTIC_MODEL,
                    () -> new DeterministicEmbeddingModel(properties.getDimension()),
                    properties.getDimension(), properties.getBatchSize(), properties.getBatchPause());
        }
        return new TextEncoder(MINI_LM_MODEL, AllMiniLmL6V2EmbeddingModel::new,
                properties.getDimension(), properties.getBatchSize(), properties.getBatchPause());
    }

    @Bean
    @ConditionalOnProperty(name = "writing.embedding.warm-up-on-startup", havingValue = "true", matchIfMissing = true)
    public EncoderWarmUp encoderWarmUp(TextEncoder textEncoder) {
        return new EncoderWarmUp(textEncoder);
    }
}
