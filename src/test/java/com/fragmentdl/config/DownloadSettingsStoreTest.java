package com.fragmentdl.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fragmentdl.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DownloadSettingsStoreTest {

    // lenient like the application mapper
    static final ObjectMapper APPLICATION_MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @TempDir
    Path dir;

    @Test
    void missingFileYieldsDefaults() throws Exception {
        DownloadSettings settings = new DownloadSettingsStore(dir.resolve("download_config.json"), APPLICATION_MAPPER).load();

        assertThat(settings).isEqualTo(DownloadSettings.defaults());
        assertThat(settings.maxConcurrentFragments()).isEqualTo(4);
        assertThat(settings.chunkSize()).isEqualTo(8192);
        assertThat(settings.timeout()).isEqualTo(30);
        assertThat(settings.retryAttempts()).isEqualTo(3);
        assertThat(settings.outputDirectory()).isEqualTo("./downloads");
        assertThat(settings.tempDirectory()).isEqualTo("./temp");
        assertThat(settings.verifySsl()).isTrue();
        assertThat(settings.showProgress()).isTrue();
        assertThat(settings.progressStyle()).isEqualTo(ProgressStyle.INLINE);
    }

    @Test
    void partialDocumentKeepsDefaultsForMissingKeys() throws Exception {
        Path file = dir.resolve("download_config.json");
        Files.writeString(file, """
                {"max_concurrent_fragments": 8, "progress_style": "full_screen", "verify_ssl": false}
                """);

        DownloadSettings settings = new DownloadSettingsStore(file, APPLICATION_MAPPER).load();

        assertThat(settings.maxConcurrentFragments()).isEqualTo(8);
        assertThat(settings.progressStyle()).isEqualTo(ProgressStyle.FULL_SCREEN);
        assertThat(settings.verifySsl()).isFalse();
        assertThat(settings.chunkSize()).isEqualTo(8192);
    }

    @Test
    void savedSettingsLoadBack() throws Exception {
        Path file = dir.resolve("nested").resolve("download_config.json");
        DownloadSettingsStore store = new DownloadSettingsStore(file, APPLICATION_MAPPER);
        DownloadSettings settings = DownloadSettings.defaults()
                .withChunkSize(65536)
                .withProgressStyle(ProgressStyle.SIMPLE)
                .withOutputDirectory("/data/downloads");

        store.save(settings);

        assertThat(Files.readString(file)).contains("\"chunk_size\" : 65536", "\"progress_style\" : \"simple\"");
        assertThat(store.load()).isEqualTo(settings);
    }

    @Test
    void malformedJsonIsConfigurationError() throws Exception {
        Path file = dir.resolve("download_config.json");
        Files.writeString(file, "{\"chunk_size\": ");

        assertThatThrownBy(() -> new DownloadSettingsStore(file, APPLICATION_MAPPER).load())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid configuration");
    }

    @Test
    void unknownKeyIsConfigurationError() throws Exception {
        Path file = dir.resolve("download_config.json");
        Files.writeString(file, "{\"max_fragments\": 4}");

        assertThatThrownBy(() -> new DownloadSettingsStore(file, APPLICATION_MAPPER).load())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("max_fragments");
        assertThat(APPLICATION_MAPPER.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)).isFalse();
    }

    @Test
    void rendersSettingsAsIndentedJson() throws Exception {
        DownloadSettingsStore store = new DownloadSettingsStore(dir.resolve("download_config.json"), APPLICATION_MAPPER);

        String json = store.toJson(DownloadSettings.defaults().withMaxConcurrentFragments(6));

        assertThat(json).contains("\"max_concurrent_fragments\" : 6", "\"progress_style\" : \"inline\"");
        assertThat(json.lines().count()).isGreaterThan(1);
    }

    @Test
    void unknownProgressStyleIsConfigurationError() throws Exception {
        Path file = dir.resolve("download_config.json");
        Files.writeString(file, "{\"progress_style\": \"fancy\"}");

        assertThatThrownBy(() -> new DownloadSettingsStore(file, APPLICATION_MAPPER).load())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void nonPositiveValueIsRejected() throws Exception {
        Path file = dir.resolve("download_config.json");
        Files.writeString(file, "{\"retry_attempts\": 0}");

        assertThatThrownBy(() -> new DownloadSettingsStore(file, APPLICATION_MAPPER).load())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("retry_attempts");
        assertThatThrownBy(() -> new DownloadSettingsStore(dir.resolve("other.json"), APPLICATION_MAPPER)
                .save(DownloadSettings.defaults().withTimeout(-1)))
                .isInstanceOf(ConfigurationException.class);
        assertThat(dir.resolve("other.json")).doesNotExist();
    }
}
