package com.bbthechange.mobilelogin.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for inbound socket events, the shared clock and scheduling.
 */
@Configuration
@EnableScheduling
public class ExecutorConfig {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorConfig.class);

    private static final int QUEUE_CAPACITY = 1000;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Each inbound event runs here so the WebSocket container thread is never blocked on
     * DynamoDB. When the queue is full the container thread runs the task itself.
     */
    @Bean(name = "loginTaskExecutor")
    public ThreadPoolTaskExecutor loginTaskExecutor(LoginProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());
        executor.setQueueCapacity(QUEUE_CAPACITY);
        executor.setThreadNamePrefix("login-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        logger.info("Initialized login task executor - Pool: {}, Queue: {}",
                properties.getWorkerPoolSize(), QUEUE_CAPACITY);
        return executor;
    }

    /**
     * Named {@code taskScheduler} so scheduled jobs pick it over the scheduler the WebSocket
     * support registers.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("login-scheduler-");
        scheduler.initialize();
        return scheduler;
    }
}
