package com.logflow.anomaly.config;

import com.logflow.anomaly.dto.DetectionMethod;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorConfigTest {

    @Test
    void defaultsMatchSparseSeriesTuning() {
        DetectorConfig config = DetectorConfig.defaults().build();

        assertThat(config.getMinSamples()).isEqualTo(5);
        assertThat(config.getSensitivity()).isEqualTo(1.0);
        assertThat(config.getEnabledMethods()).containsExactlyInAnyOrder(DetectionMethod.values());
        assertThat(config.getIsolationForestMinSamples()).isEqualTo(20);
        assertThat(config.getContamination()).isEqualTo(0.1);
        assertThat(config.getRandomSeed()).isEqualTo(42L);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> DetectorConfig.defaults().minSamples(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("minSamples");
        assertThatThrownBy(() -> DetectorConfig.defaults().sensitivity(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("sensitivity");
        assertThatThrownBy(() -> DetectorConfig.defaults().sensitivity(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorConfig.defaults().contamination(0.5).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("contamination");
        assertThatThrownBy(() -> DetectorConfig.defaults().enabledMethods(Set.of()).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorConfig.defaults().requestTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectorConfig.defaults().detectionWindowMinutes(5).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void methodSetIsCopiedAndReadOnly() {
        Set<DetectionMethod> methods = EnumSet.of(DetectionMethod.ZSCORE);
        DetectorConfig config = DetectorConfig.defaults().enabledMethods(methods).build();
        methods.add(DetectionMethod.ISOLATION_FOREST);

        assertThat(config.isMethodEnabled(DetectionMethod.ISOLATION_FOREST)).isFalse();
        assertThatThrownBy(() -> config.getEnabledMethods().add(DetectionMethod.MOVING_AVERAGE))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void disabledConfigMayHaveNoMethods() {
        DetectorConfig config = DetectorConfig.defaults().enabled(false).enabledMethods(Set.of()).build();

        assertThat(config.getEnabledMethods()).isEmpty();
    }

    @Test
    void propertiesFreezeIntoConfig() {
        AnomalyDetectionProperties properties = new AnomalyDetectionProperties();
        properties.setSensitivity(2.5);
        properties.setMethods(EnumSet.of(DetectionMethod.ZSCORE, DetectionMethod.MOVING_AVERAGE));
        properties.setRequestTimeout(Duration.ofSeconds(5));

        DetectorConfig config = properties.toDetectorConfig();

        assertThat(config.getSensitivity()).isEqualTo(2.5);
        assertThat(config.isMethodEnabled(DetectionMethod.ISOLATION_FOREST)).isFalse();
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getMinSamples()).isEqualTo(5);
    }
}
