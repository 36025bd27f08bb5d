package com.conveyor.orchestrator.config;

import com.conveyor.orchestrator.ledger.InMemoryRunLedger;
import com.conveyor.orchestrator.ledger.JpaRunLedger;
import com.conveyor.orchestrator.ledger.RunLedger;
import com.conveyor.orchestrator.platform.LoggingMetricsSink;
import com.conveyor.orchestrator.platform.MetricsSink;
import com.conveyor.orchestrator.repository.LedgerRecordRepository;
import com.conveyor.orchestrator.service.EngineSettings;
import com.conveyor.orchestrator.service.TriggerSettings;
import com.conveyor.orchestrator.stage.Backoff;
import com.conveyor.orchestrator.support.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * The beans that depend on configuration; everything else is a component.
 *
 * The ledger store is chosen by {@code conveyor.ledger.store}: "jpa"
 * (default, PostgreSQL through Spring Data) or "memory".
 */
@Configuration
@EnableConfigurationProperties(ConveyorProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    @ConditionalOnMissingBean
    MetricsSink metricsSink() {
        return new LoggingMetricsSink();
    }

    // ------------------------------------------------------------------
    // Ledger store
    // ------------------------------------------------------------------

    @Bean
    @ConditionalOnProperty(prefix = "conveyor.ledger", name = "store", havingValue = "jpa", matchIfMissing = true)
    RunLedger jpaRunLedger(LedgerRecordRepository repository, ObjectMapper objectMapper) {
        log.info("Run ledger: PostgreSQL (ledger_entries)");
        return new JpaRunLedger(repository, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "conveyor.ledger", name = "store", havingValue = "memory")
    RunLedger inMemoryRunLedger() {
        log.warn("Run ledger: in-memory; entries are lost on restart");
        return new InMemoryRunLedger();
    }

    // ------------------------------------------------------------------
    // Engine settings
    // ------------------------------------------------------------------

    @Bean
    EngineSettings engineSettings(ConveyorProperties props) {
        ConveyorProperties.Engine engine = props.engine();
        return new EngineSettings(engine.workerCount(), engine.retryBaseDelay(), engine.retryMaxDelay());
    }

    @Bean
    Backoff retryBackoff(EngineSettings settings) {
        return settings.backoff();
    }

    @Bean
    TriggerSettings triggerSettings(ConveyorProperties props) {
        return new TriggerSettings(props.downstreams());
    }
}
