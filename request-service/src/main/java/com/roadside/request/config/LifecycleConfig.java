package com.roadside.request.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({MatchingProperties.class, PaymentProperties.class, LifecycleProperties.class})
public class LifecycleConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs the first GeoIndex query of every new search session off the caller's thread. */
    @Bean(name = "matchingExecutor")
    public ThreadPoolTaskExecutor matchingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("matching-");
        executor.initialize();
        return executor;
    }
}
