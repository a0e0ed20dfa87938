package io.draftmate.rag.tool;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.draftmate.rag.corpus.CorpusProperties;
import io.draftmate.rag.corpus.EssayStore;
import io.draftmate.rag.embedding.TextEncoder;

@Configuration
public class ToolConfiguration {

    @Bean
    ToolRegistry toolRegistry(ObjectMapper objectMapper) {
        return new ToolRegistry(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    TextAnalyzer textAnalyzer() {
        return new PlaceholderTextAnalyzer();
    }

    @Bean
    ToolExecutor toolExecutor(TextAnalyzer textAnalyzer, TextEncoder textEncoder, EssayStore essayStore,
            ObjectMapper objectMapper, CorpusProperties corpusProperties) {
        return new ToolExecutor(textAnalyzer, textEncoder, essayStore, objectMapper,
                corpusProperties.getTopicLimit());
    }
}
