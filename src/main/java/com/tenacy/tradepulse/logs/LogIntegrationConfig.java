package com.tenacy.tradepulse.logs;

import com.tenacy.tradepulse.config.MonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.integration.channel.ExecutorChannel;
import org.springframework.integration.config.EnableIntegration;
import org.springframework.integration.dsl.IntegrationFlow;
import org.springframework.integration.file.dsl.Files;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.support.ErrorMessage;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.File;

/**
 * Live tail of the trading agent log feeding {@link LogAggregator}.
 * <p>
 * The tailer only publishes onto {@code logLineChannel}; a single consumer thread
 * drains it so arrival order is kept and the tailer never waits on processing.
 */
@Slf4j
@Configuration
@EnableIntegration
public class LogIntegrationConfig {

    @Bean
    public ThreadPoolTaskExecutor logLineExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("log-line-");
        executor.initialize();
        return executor;
    }

    @Bean
    public MessageChannel logLineChannel() {
        return new ExecutorChannel(logLineExecutor());
    }

    @Bean
    @ConditionalOnProperty(prefix = "tradepulse.logs", name = "watch-enabled", havingValue = "true", matchIfMissing = true)
    public IntegrationFlow logTailFlow(MonitorProperties properties) {
        MonitorProperties.Logs logs = properties.getLogs();
        log.info("Starting log aggregator on {}", logs.getFile());

        return IntegrationFlow.from(Files.tailAdapter(new File(logs.getFile()))
                        .delay(logs.getPollDelayMs())
                        .end(true)
                        .reopen(true)
                        .id("logTailAdapter"))
                .channel(logLineChannel())
                .get();
    }

    @Bean
    public IntegrationFlow logAggregationFlow(LogAggregator logAggregator) {
        return IntegrationFlow.from(logLineChannel())
                .handle(String.class, (line, headers) -> {
                    logAggregator.processLogLine(line);
                    return null;
                })
                .get();
    }

    @Bean
    public IntegrationFlow logErrorHandlingFlow() {
        return IntegrationFlow.from("errorChannel")
                .handle(message -> {
                    if (message instanceof ErrorMessage errorMessage) {
                        Throwable payload = errorMessage.getPayload();
                        log.error("Log tail flow error: {}", payload.getMessage(), payload);
                    } else {
                        log.error("Unknown error in log tail flow: {}", message);
                    }
                })
                .get();
    }
}
