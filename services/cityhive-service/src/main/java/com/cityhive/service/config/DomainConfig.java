package com.cityhive.service.config;

import com.cityhive.observability.MetricFactory;
import com.cityhive.service.domain.hive.HiveCreationService;
import com.cityhive.service.domain.hive.HiveQueryService;
import com.cityhive.service.domain.hive.HiveRepository;
import com.cityhive.service.domain.inspection.InspectionCreationService;
import com.cityhive.service.domain.inspection.InspectionQueryService;
import com.cityhive.service.domain.inspection.InspectionRepository;
import com.cityhive.service.domain.user.UserCreationService;
import com.cityhive.service.domain.user.UserQueryService;
import com.cityhive.service.domain.user.UserRepository;
import java.time.Clock;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the domain services to their ports. Apart from inspection scheduling, which publishes
 * through Spring's {@link ApplicationEventPublisher}, the services have no Spring dependency.
 */
@Configuration
public class DomainConfig {

    @Bean
    public UserCreationService userCreationService(UserRepository users, Clock clock, MetricFactory metrics) {
        return new UserCreationService(users, clock, metrics);
    }

    @Bean
    public UserQueryService userQueryService(UserRepository users) {
        return new UserQueryService(users);
    }

    @Bean
    public HiveCreationService hiveCreationService(
            UserRepository users, HiveRepository hives, Clock clock, MetricFactory metrics) {
        return new HiveCreationService(users, hives, clock, metrics);
    }

    @Bean
    public HiveQueryService hiveQueryService(HiveRepository hives) {
        return new HiveQueryService(hives);
    }

    @Bean
    public InspectionCreationService inspectionCreationService(
            HiveRepository hives,
            InspectionRepository inspections,
            Clock clock,
            CityHiveProperties properties,
            ApplicationEventPublisher events,
            MetricFactory metrics) {
        return new InspectionCreationService(
                hives, inspections, clock, properties.inspection().maxDaysAhead(), events, metrics);
    }

    @Bean
    public InspectionQueryService inspectionQueryService(InspectionRepository inspections) {
        return new InspectionQueryService(inspections);
    }
}
