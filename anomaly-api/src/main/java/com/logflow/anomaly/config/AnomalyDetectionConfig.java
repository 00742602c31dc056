package com.logflow.anomaly.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
@EnableConfigurationProperties(AnomalyDetectionProperties.class)
public class AnomalyDetectionConfig {

    public static final String DETECTOR_EXECUTOR = "anomalyDetectorExecutor";
    public static final String REQUEST_EXECUTOR = "anomalyRequestExecutor";

    @Bean
    DetectorConfig detectorConfig(AnomalyDetectionProperties properties) {
        return properties.toDetectorConfig();
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = DETECTOR_EXECUTOR)
    ThreadPoolTaskExecutor anomalyDetectorExecutor(AnomalyDetectionProperties properties) {
        // saturation runs the detector on the request thread
        return executor("anomaly-detector-", properties.getExecutor().getDetectorThreads(),
                properties.getExecutor().getQueueCapacity(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean(name = REQUEST_EXECUTOR)
    ThreadPoolTaskExecutor anomalyRequestExecutor(AnomalyDetectionProperties properties) {
        // saturation rejects; a request never runs on the HTTP thread
        return executor("anomaly-request-", properties.getExecutor().getRequestThreads(),
                properties.getExecutor().getQueueCapacity(), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    ApplicationRunner logDetectorConfig(DetectorConfig detectorConfig) {
        return args -> log.info("Anomaly detector initialized: enabled={}, minSamples={}, sensitivity={}, methods={}",
                detectorConfig.isEnabled(), detectorConfig.getMinSamples(), detectorConfig.getSensitivity(),
                detectorConfig.getEnabledMethods());
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int threads, int queueCapacity,
                                                   RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.initialize();
        return executor;
    }
}
