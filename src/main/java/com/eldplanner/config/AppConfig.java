package com.eldplanner.config;

import com.eldplanner.geo.LocationResolver;
import com.eldplanner.geo.NoOpLocationResolver;
import com.eldplanner.geo.TimeoutLocationResolver;
import com.eldplanner.routing.RouteProvider;
import com.eldplanner.routing.StraightLineRouteProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring of the planner's external collaborators.
 *
 * Deployments that have a real geocoder or road router declare their own
 * {@link LocationResolver} or {@link RouteProvider} bean; the defaults here
 * resolve nothing and estimate straight-line legs.
 */
@Configuration
@EnableConfigurationProperties(PlannerProperties.class)
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(LocationResolver.class)
    public TimeoutLocationResolver locationResolver(PlannerProperties properties) {
        return new TimeoutLocationResolver(new NoOpLocationResolver(),
            properties.getResolverTimeout(), properties.getResolverThreads());
    }

    @Bean
    @ConditionalOnMissingBean(RouteProvider.class)
    public RouteProvider routeProvider(PlannerProperties properties) {
        return new StraightLineRouteProvider(properties.getFallbackSpeedMph());
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ApplicationRunner splitSleeperOptionCheck(PlannerProperties properties) {
        return args -> {
            String option = properties.getSplitSleeperOption();
            if (!"7/3".equals(option)) {
                log.warn("planner.split-sleeper-option={} is ignored; split sleeper periods are always 7h + 3h", option);
            }
        };
    }
}
