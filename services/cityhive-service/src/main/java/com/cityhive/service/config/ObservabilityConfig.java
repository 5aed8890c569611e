package com.cityhive.service.config;

import com.cityhive.database.health.JdbcRoundTripCheck;
import com.cityhive.observability.HealthAggregator;
import com.cityhive.observability.HealthProbe;
import com.cityhive.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Clock, metrics and health probing beans.
 */
@Configuration
public class ObservabilityConfig {

    public static final String DATABASE_COMPONENT = "database";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, CityHiveProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    /**
     * Runs dependency checks on a dedicated daemon pool, separate from request threads.
     */
    @Bean
    public HealthProbe healthProbe() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "health-check-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new HealthProbe(Executors.newCachedThreadPool(threads));
    }

    @Bean
    public HealthAggregator healthAggregator(
            HealthProbe healthProbe,
            DataSource dataSource,
            CityHiveProperties properties,
            MetricFactory metricFactory,
            Clock clock) {
        HealthAggregator aggregator = new HealthAggregator(
                healthProbe,
                properties.name(),
                properties.version(),
                properties.health().dbTimeout(),
                metricFactory,
                clock);
        aggregator.register(DATABASE_COMPONENT, new JdbcRoundTripCheck(dataSource));
        return aggregator;
    }
}
