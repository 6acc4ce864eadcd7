package com.example.dutyroster.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class RosterExecutorConfig {

    /**
     * Pool for independent randomized roster trials
     */
    @Bean(name = "rosterTrialExecutor")
    public Executor rosterTrialExecutor(@Value("${roster.trial-pool-size:2}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, poolSize));
        executor.setMaxPoolSize(Math.max(1, poolSize));
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("Roster-");
        executor.initialize();
        return executor;
    }
}
