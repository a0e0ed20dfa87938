package io.draftmate.rag.chat;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration of the writing agent and its connection to Anthropic.
 */
@ConfigurationProperties(prefix = "writing.agent")
public class AgentProperties implements EnvironmentAware {

    /**
     * Use the deterministic offline language model instead of Anthropic.
     */
    private boolean mockLlm = true;

    /**
     * Number of threads processing conversational requests.
     */
    private int workerThreads = 8;

    /**
     * How long a server sent event stream stays open.
     */
    private Duration streamTimeout = Duration.ofMinutes(3);

    private final Anthropic anthropic = new Anthropic();

    public boolean isMockLlm() {
        return mockLlm;
    }

    public void setMockLlm(boolean mockLlm) {
        this.mockLlm = mockLlm;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Duration getStreamTimeout() {
        return streamTimeout;
    }

    public void setStreamTimeout(Duration streamTimeout) {
        this.streamTimeout = streamTimeout;
    }

    public Anthropic getAnthropic() {
        return anthropic;
    }

    @Override
    public void setEnvironment(Environment environment) {
        anthropic.environment = environment;
    }

    public static class Anthropic {

        /**
         * API key that authorises requests against Anthropic. Falls back to the
         * {@code ANTHROPIC_API_KEY} environment variable.
         */
        private String apiKey;

        /**
         * Name of the chat model.
         */
        private String model = "claude-3-5-sonnet-20241022";

        /**
         * Upper bound of generated tokens per model call.
         */
        private int maxTokens = 4000;

        private Duration timeout = Duration.ofSeconds(60);

        private Environment environment;

        public String getApiKey() {
            if (StringUtils.hasText(apiKey)) {
                return apiKey;
            }
            return environment != null ? environment.getProperty("ANTHROPIC_API_KEY") : null;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
