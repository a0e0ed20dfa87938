package io.draftmate.rag.corpus;

import static org.assertj.core.api.Assertions.assertThat;

import javax.sql.DataSource;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.draftmate.rag.embedding.EmbeddingConfiguration;

class CorpusConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(CorpusConfiguration.class, EmbeddingConfiguration.class,
                    InfrastructureConfiguration.class)
            .withPropertyValues("writing.embedding.mock=true");

    @Test
    void usesInMemoryStoreByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(EssayStore.class);
            assertThat(context).getBean(EssayStore.class).isInstanceOf(InMemoryEssayStore.class);
            assertThat(context).doesNotHaveBean(CorpusImportRunner.class);
            CorpusProperties properties = context.getBean(CorpusProperties.class);
            assertThat(properties.getMatchThreshold()).isEqualTo(0.78d);
            assertThat(properties.getMatchCount()).isEqualTo(5);
        });
    }

    @Test
    void createsPostgresStoreWhenMockDisabled() {
        contextRunner
                .withPropertyValues(
                        "writing.corpus.mock-store=false",
                        "writing.corpus.table=reference_essays",
                        "writing.corpus.ivfflat-probes=20")
                .run(context -> {
                    assertThat(context).hasSingleBean(EssayStore.class);
                    assertThat(context).getBean(EssayStore.class).isInstanceOf(PostgresEssayStore.class);
                    CorpusProperties properties = context.getBean(CorpusProperties.class);
                    assertThat(properties.getTable()).isEqualTo("reference_essays");
                    assertThat(properties.getIvfflatProbes()).isEqualTo(20);
                });
    }

    @Test
    void registersImportRunnerWhenImportPathIsSet() {
        contextRunner
                .withPropertyValues("writing.corpus.import-path=data/essays.json")
                .run(context -> assertThat(context).hasSingleBean(CorpusImportRunner.class));
    }

    @Test
    void failsOnInvalidTableName() {
        contextRunner
                .withPropertyValues("writing.corpus.mock-store=false", "writing.corpus.table=drop table")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    static class InfrastructureConfiguration {

        @Bean
        JdbcClient jdbcClient(DataSource dataSource) {
            return JdbcClient.create(dataSource);
        }

        @Bean
        TransactionTemplate transactionTemplate(DataSource dataSource) {
            return new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        DataSource dataSource() {
            DriverManagerDataSource dataSource = new DriverManagerDataSource();
            dataSource.setDriverClassName("org.h2.Driver");
            dataSource.setUrl("jdbc:h2:mem:corpus;MODE=PostgreSQL");
            dataSource.setUsername("sa");
            dataSource.setPassword("");
            return dataSource;
        }
    }
}
