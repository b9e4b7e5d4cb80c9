package com.example.courier.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
@EnableAsync
public class TaskConfig {

    /**
     * Customizes the thread pool for @Async methods.
     */
    @Bean
    @Primary
    public AsyncTaskExecutor asyncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setThreadNamePrefix("async-task-");
        executor.initialize();
        return executor;
    }

    /**
     * Single worker for event routing. One thread keeps publish order intact for
     * every delivery stream.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler routerScheduler(AppProperties appProperties) {
        return Schedulers.newSingle(appProperties.getRouter().getThreadName());
    }
}
