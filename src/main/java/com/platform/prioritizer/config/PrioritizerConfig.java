package com.platform.prioritizer.config;

import com.platform.prioritizer.store.JdbcQueryExecutor;
import com.platform.prioritizer.store.LoggingResultSink;
import com.platform.prioritizer.store.ManifestWriter;
import com.platform.prioritizer.store.QueryExecutor;
import com.platform.prioritizer.store.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.nio.file.Path;

/**
 * Collaborators at the edge of the pipeline: the event store, the result sink and
 * the manifest writer. Each can be replaced by declaring a bean of the same type.
 */
@Configuration
public class PrioritizerConfig {

    private static final Logger log = LoggerFactory.getLogger(PrioritizerConfig.class);

    @Value("${prioritizer.output-dir:}")
    private String outputDir;

    @Bean
    @ConditionalOnMissingBean(QueryExecutor.class)
    public QueryExecutor queryExecutor(NamedParameterJdbcTemplate jdbcTemplate) {
        return new JdbcQueryExecutor(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(ResultSink.class)
    public ResultSink resultSink() {
        return new LoggingResultSink();
    }

    @Bean
    public ManifestWriter manifestWriter() {
        if (outputDir == null || outputDir.isBlank()) {
            log.info("prioritizer.output-dir not set; run manifests are only logged");
            return new ManifestWriter(null);
        }
        return new ManifestWriter(Path.of(outputDir));
    }
}
