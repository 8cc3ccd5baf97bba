package io.github.drompincen.postscheduler.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Timer threads and the dispatch pool are kept apart: timers only hand fired triggers over,
 * the dispatch pool does the sending.
 */
@Configuration
public class SchedulerConfig {

    @Bean
    ZoneId referenceZone(@Value("${postscheduler.timezone:Asia/Tokyo}") String timezone) {
        return ZoneId.of(timezone);
    }

    @Bean
    Clock clock(ZoneId referenceZone) {
        return Clock.system(referenceZone);
    }

    @Bean
    ThreadPoolTaskScheduler taskScheduler(@Value("${postscheduler.scheduler.pool-size:2}") int poolSize) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("schedule-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    ThreadPoolTaskExecutor dispatchExecutor(@Value("${postscheduler.dispatch.pool-size:4}") int poolSize) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
