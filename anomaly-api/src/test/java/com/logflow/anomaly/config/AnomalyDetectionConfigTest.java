package com.logflow.anomaly.config;

import com.logflow.anomaly.dto.DetectionMethod;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalyDetectionConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(AnomalyDetectionConfig.class);

    @Test
    void bindsPropertiesIntoImmutableConfig() {
        contextRunner.withPropertyValues(
                        "anomaly.detection.min-samples=8",
                        "anomaly.detection.sensitivity=1.5",
                        "anomaly.detection.methods=zscore, moving_average",
                        "anomaly.detection.request-timeout=5s")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    DetectorConfig config = context.getBean(DetectorConfig.class);
                    assertThat(config.getMinSamples()).isEqualTo(8);
                    assertThat(config.getSensitivity()).isEqualTo(1.5);
                    assertThat(config.getEnabledMethods())
                            .containsExactlyInAnyOrder(DetectionMethod.ZSCORE, DetectionMethod.MOVING_AVERAGE);
                    assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(context).hasBean(AnomalyDetectionConfig.DETECTOR_EXECUTOR);
                    assertThat(context).hasBean(AnomalyDetectionConfig.REQUEST_EXECUTOR);
                });
    }

    @Test
    void requestExecutorRejectsWhenSaturatedWhileDetectorExecutorRunsOnCaller() {
        contextRunner.run(context -> {
            ThreadPoolTaskExecutor requests =
                    context.getBean(AnomalyDetectionConfig.REQUEST_EXECUTOR, ThreadPoolTaskExecutor.class);
            ThreadPoolTaskExecutor detectors =
                    context.getBean(AnomalyDetectionConfig.DETECTOR_EXECUTOR, ThreadPoolTaskExecutor.class);
            assertThat(requests.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
            assertThat(detectors.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
        });
    }

    @Test
    void invalidConfigurationFailsStartup() {
        contextRunner.withPropertyValues("anomaly.detection.sensitivity=0")
                .run(context -> assertThat(context).hasFailed());
        contextRunner.withPropertyValues("anomaly.detection.contamination=0.7")
                .run(context -> assertThat(context).hasFailed());
    }
}
