package com.syncnest.accountservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class ExecutorConfig {

    public static final String HASHING_EXECUTOR = "hashingExecutor";
    public static final String OTP_MAIL_SCHEDULER = "otpMailScheduler";

    /** Bounded pool for bcrypt work so request threads never hash inline. */
    @Bean(HASHING_EXECUTOR)
    public TaskExecutor hashingExecutor() {
        int cores = Math.max(2, Runtime.getRuntime().availableProcessors());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(cores);
        ex.setMaxPoolSize(cores);
        ex.setQueueCapacity(500);
        ex.setThreadNamePrefix("hashing-");
        ex.initialize();
        return ex;
    }

    @Bean(OTP_MAIL_SCHEDULER)
    public ThreadPoolTaskScheduler otpMailScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("otp-mail-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        scheduler.initialize();
        return scheduler;
    }
}
