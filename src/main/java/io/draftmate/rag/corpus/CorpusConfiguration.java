package io.draftmate.rag.corpus;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.draftmate.rag.embedding.EmbeddingProperties;
import io.draftmate.rag.embedding.TextEncoder;

/**
 * Wires the essay store. The in-memory store is used unless
 * {@code writing.corpus.mock-store=false}.
 */
@Configuration
@EnableConfigurationProperties({ CorpusProperties.class, EmbeddingProperties.class })
public class CorpusConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "writing.corpus.mock-store", havingValue = "true", matchIfMissing = true)
    public EssayStore inMemoryEssayStore(CorpusProperties properties, EmbeddingProperties embeddingProperties,
            Clock clock) {
        return new InMemoryEssayStore(embeddingProperties.getDimension(), properties.getMatchThreshold(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "writing.corpus.mock-store", havingValue = "false")
    public EssayStore postgresEssayStore(JdbcClient jdbcClient, TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper, CorpusProperties properties, EmbeddingProperties embeddingProperties,
            Clock clock) {
        return new PostgresEssayStore(jdbcClient, transactionTemplate, objectMapper, properties,
                embeddingProperties.getDimension(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "writing.corpus.import-path")
    public CorpusImportRunner corpusImportRunner(CorpusProperties properties, TextEncoder textEncoder,
            EssayStore essayStore, ObjectMapper objectMapper) {
        return new CorpusImportRunner(properties.getImportPath(), textEncoder, essayStore, objectMapper);
    }
}
