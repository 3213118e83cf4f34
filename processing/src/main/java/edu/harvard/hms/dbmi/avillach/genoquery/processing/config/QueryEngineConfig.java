package edu.harvard.hms.dbmi.avillach.genoquery.processing.config;

import edu.harvard.hms.dbmi.avillach.genoquery.processing.compiler.DialectCompilerFactory;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.partition.PartitionIndex;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.runner.RunnerSettings;
import edu.harvard.hms.dbmi.avillach.genoquery.processing.service.VariantQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

@Configuration
@PropertySource("classpath:genoquery.properties")
@ComponentScan(basePackageClasses = VariantQueryService.class)
public class QueryEngineConfig {

    private static Logger log = LoggerFactory.getLogger(QueryEngineConfig.class);

    @Value("${genoquery.runner.offer-timeout-ms:100}")
    private long offerTimeoutMs;

    @Value("${genoquery.runner.warn-every:1000}")
    private int warnEvery;

    @Value("${genoquery.runner.max-offer-attempts:5000}")
    private int maxOfferAttempts;

    @Bean
    public RunnerSettings runnerSettings() {
        if (warnEvery <= 0 || maxOfferAttempts <= 0 || offerTimeoutMs <= 0) {
            throw new IllegalArgumentException("Runner thresholds must be positive: offer-timeout-ms=" + offerTimeoutMs
                    + ", warn-every=" + warnEvery + ", max-offer-attempts=" + maxOfferAttempts);
        }
        log.info("Runner settings: offer timeout " + offerTimeoutMs + "ms, warn every " + warnEvery
                + " attempts, give up after " + maxOfferAttempts);
        return RunnerSettings.builder()
                .offerTimeoutMs(offerTimeoutMs)
                .warnEvery(warnEvery)
                .maxOfferAttempts(maxOfferAttempts)
                .build();
    }

    @Bean
    public PartitionIndex partitionIndex() {
        return new PartitionIndex();
    }

    @Bean
    public DialectCompilerFactory dialectCompilerFactory(PartitionIndex partitionIndex) {
        return new DialectCompilerFactory(partitionIndex);
    }
}
