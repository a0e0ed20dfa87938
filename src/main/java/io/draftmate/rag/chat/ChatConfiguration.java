package io.draftmate.rag.chat;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import io.draftmate.rag.tool.ToolExecutor;
import io.draftmate.rag.tool.ToolRegistry;

/**
 * Wires the writing agent and the conversational transport. The
 * {@code writing.agent.mock-llm} toggle decides whether Anthropic is contacted.
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class ChatConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "chatExecutor")
    public ExecutorService chatExecutor(AgentProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerThreads(), new CustomizableThreadFactory("chat-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public SseEmitterFactory sseEmitterFactory(AgentProperties properties) {
        return new DefaultSseEmitterFactory(properties.getStreamTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "writing.agent.mock-llm", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient(ObjectMapper objectMapper) {
        return new MockLlmClient(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "writing.agent.mock-llm", havingValue = "false")
    public LlmClient anthropicLlmClient(AgentProperties properties) {
        AgentProperties.Anthropic anthropic = properties.getAnthropic();
        if (!StringUtils.hasText(anthropic.getApiKey())) {
            throw new IllegalArgumentException("Anthropic API key is required when writing.agent.mock-llm=false");
        }
        return new LangChain4jLlmClient(AnthropicChatModel.builder()
                .apiKey(anthropic.getApiKey())
                .modelName(anthropic.getModel())
                .maxTokens(anthropic.getMaxTokens())
                .timeout(anthropic.getTimeout())
                .build());
    }

    @Bean
    public WritingAgent writingAgent(LlmClient llmClient, ToolRegistry toolRegistry, ToolExecutor toolExecutor,
            Clock clock) {
        return new WritingAgent(llmClient, toolRegistry, toolExecutor, clock);
    }

    @Bean
    public ChatService chatService(WritingAgent writingAgent, ToolExecutor toolExecutor,
            ExecutorService chatExecutor, Clock clock) {
        return new ChatService(writingAgent, toolExecutor, chatExecutor, clock);
    }
}
