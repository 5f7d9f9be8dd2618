package com.callinsight.config;

import com.callinsight.processing.service.InferenceGate;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class InferenceConfig {

    @Bean(name = "inferenceExecutor")
    public ThreadPoolTaskExecutor inferenceExecutor(AppProperties appProperties) {
        AppProperties.Inference settings = appProperties.inference();
        int poolSize = Math.max(settings.poolSize(), settings.maxConcurrent());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(poolSize * 2);
        executor.setThreadNamePrefix("inference-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public InferenceGate inferenceGate(@Qualifier("inferenceExecutor") ThreadPoolTaskExecutor inferenceExecutor,
                                       AppProperties appProperties,
                                       MeterRegistry meterRegistry) {
        return new InferenceGate(inferenceExecutor, appProperties.inference(), meterRegistry);
    }
}
