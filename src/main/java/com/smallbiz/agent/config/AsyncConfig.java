package com.smallbiz.agent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AsyncConfig {

    /**
     * Runs individual provider calls. Bounded so a burst of syncs cannot exhaust threads.
     */
    @Bean(name = "calendarSyncExecutor")
    public ThreadPoolTaskExecutor calendarSyncExecutor(CalendarProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.sync().poolSize());
        executor.setMaxPoolSize(properties.sync().poolSize());
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("calendar-sync-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        executor.initialize();
        return executor;
    }

    /**
     * Runs background orchestration after a booking; separate from the provider pool so it cannot starve it.
     */
    @Bean(name = "calendarDispatchExecutor")
    public ThreadPoolTaskExecutor calendarDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("calendar-dispatch-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock(BusinessProperties businessProperties) {
        return Clock.system(businessProperties.zone());
    }
}
