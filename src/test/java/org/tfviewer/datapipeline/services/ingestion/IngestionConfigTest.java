package org.tfviewer.datapipeline.services.ingestion;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tfviewer.datapipeline.services.loaders.LoaderOptions;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class IngestionConfigTest {

    @Test
    void testDefaults() {
        IngestionConfig config = IngestionConfig.defaults();

        assertThat(config.pollInterval()).isEqualTo(Duration.ofMillis(2500));
        assertThat(config.interactivePreload()).isFalse();
        assertThat(config.workerThreads()).isEqualTo(4);
        assertThat(config.progressInterval()).isEqualTo(10);
        assertThat(config.stopTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.loaderOptions()).isEqualTo(LoaderOptions.DEFAULTS);
    }

    @Test
    void testFromRoot_ReferenceConfMatchesDefaults() {
        assertThat(IngestionConfig.fromRoot(ConfigFactory.load())).isEqualTo(IngestionConfig.defaults());
    }

    @Test
    void testFromRoot_OverridesSelectedKeys() {
        IngestionConfig config = IngestionConfig.fromRoot(ConfigFactory.parseString("""
            tfviewer.ingestion {
              pollIntervalMs = 100
              interactivePreload = true
              corruptRecordRetries = 5
            }
            """));

        assertThat(config.pollInterval()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.interactivePreload()).isTrue();
        assertThat(config.loaderOptions()).isEqualTo(new LoaderOptions(32, 5));
        assertThat(config.workerThreads()).isEqualTo(4);
    }

    @Test
    void testFromRoot_MissingBlockGivesDefaults() {
        assertThat(IngestionConfig.fromRoot(ConfigFactory.empty())).isEqualTo(IngestionConfig.defaults());
    }

    @Test
    void testValidation() {
        assertThatThrownBy(() -> IngestionConfig.from(ConfigFactory.parseString("workerThreads = 0")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("workerThreads");
        assertThatThrownBy(() -> IngestionConfig.from(ConfigFactory.parseString("pollIntervalMs = 0")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IngestionConfig.from(ConfigFactory.parseString("progressInterval = 0")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testWithers_KeepOtherSettings() {
        IngestionConfig config = IngestionConfig.defaults()
            .withPollInterval(Duration.ofMillis(20))
            .withInteractivePreload(true);

        assertThat(config.pollInterval()).isEqualTo(Duration.ofMillis(20));
        assertThat(config.interactivePreload()).isTrue();
        assertThat(config.workerThreads()).isEqualTo(4);
    }
}
