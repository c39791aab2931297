package com.example.hazardrisk.infrastructure.config;

import com.example.hazardrisk.infrastructure.cache.AggregateSnapshotStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SnapshotConfig {

    private static final Logger log = LoggerFactory.getLogger(SnapshotConfig.class);

    @Bean
    public AggregateSnapshotStore aggregateSnapshotStore(
            @Value("${hazardrisk.stats.snapshot-path}") String snapshotPath,
            @Value("${hazardrisk.stats.use-snapshot:true}") boolean enabled
    ) {
        log.info("event=snapshot_config path={} enabled={}", snapshotPath, enabled);
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        return new AggregateSnapshotStore(Path.of(snapshotPath), mapper, enabled);
    }
}
