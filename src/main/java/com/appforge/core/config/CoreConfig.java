package com.appforge.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Shared infrastructure beans: the clock every time-window decision reads and the
 * pool that executes agent runs off the request thread.
 */
@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "runExecutor")
    public ThreadPoolTaskExecutor runExecutor(AgentProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getRunPoolSize());
        executor.setMaxPoolSize(properties.getRunPoolSize());
        executor.setQueueCapacity(properties.getRunQueueCapacity());
        executor.setThreadNamePrefix("agent-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
