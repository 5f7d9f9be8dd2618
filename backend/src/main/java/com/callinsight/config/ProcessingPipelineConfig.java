package com.callinsight.config;

import com.callinsight.processing.adapter.SseStatusBroadcaster;
import com.callinsight.processing.queue.ProcessingQueue;
import com.callinsight.processing.service.ProcessingCoordinator;
import com.callinsight.processing.service.RecordingProcessor;
import com.callinsight.processing.tracker.ProcessingTracker;
import com.callinsight.summary.service.CallSummaryService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ProcessingPipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessingTracker processingTracker() {
        return new ProcessingTracker();
    }

    @Bean
    public ProcessingCoordinator processingCoordinator(ProcessingTracker processingTracker,
                                                       CallSummaryService callSummaryService,
                                                       RecordingProcessor recordingProcessor) {
        return new ProcessingCoordinator(processingTracker, callSummaryService, recordingProcessor);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ProcessingQueue processingQueue(ProcessingCoordinator processingCoordinator,
                                           SseStatusBroadcaster statusBroadcaster,
                                           AppProperties appProperties,
                                           MeterRegistry meterRegistry,
                                           Clock clock) {
        return new ProcessingQueue(
                processingCoordinator::processQueued,
                statusBroadcaster,
                appProperties.queue(),
                meterRegistry,
                clock
        );
    }
}
