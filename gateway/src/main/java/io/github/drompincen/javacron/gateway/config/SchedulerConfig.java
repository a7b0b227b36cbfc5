package io.github.drompincen.javacron.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

    /** Timer threads. They only hand fires over to {@link #fireExecutor}. */
    @Bean
    ThreadPoolTaskScheduler taskScheduler(@Value("${javacron.scheduler.pool-size:4}") int poolSize) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("schedule-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    /** Runs accepted fires, which block until their job finishes. */
    @Bean
    ThreadPoolTaskExecutor fireExecutor(@Value("${javacron.scheduler.fire-threads:16}") int threads) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("fire-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
