package com.tenacy.tradepulse.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    @Value("${tradepulse.async.probe-pool-size:6}")
    private int probePoolSize;

    @Value("${tradepulse.async.alert-pool-size:3}")
    private int alertPoolSize;

    @Value("${tradepulse.async.scheduler-pool-size:4}")
    private int schedulerPoolSize;

    // @Scheduled 작업과 로그 tail 폴러가 함께 사용, 웹소켓 설정의 기본 스케줄러보다 우선
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerPoolSize);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "probeExecutor")
    public ThreadPoolTaskExecutor probeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(probePoolSize);
        executor.setMaxPoolSize(probePoolSize * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("probe-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    // 채널 전송용 작은 풀
    @Bean(name = "alertExecutor")
    public Executor alertExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(alertPoolSize);
        executor.setMaxPoolSize(alertPoolSize * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("alert-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
