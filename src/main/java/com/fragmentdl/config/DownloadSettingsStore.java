package com.fragmentdl.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fragmentdl.exceptions.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves {@link DownloadSettings} as a JSON document.
 */
@Slf4j
public class DownloadSettingsStore {

    private final Path location;
    private final ObjectMapper objectMapper;

    /**
     * @param objectMapper the application mapper; a copy is taken so unknown keys can be rejected here only
     */
    public DownloadSettingsStore(Path location, ObjectMapper objectMapper) {
        this.location = location;
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getLocation() {
        return location;
    }

    /**
     * @return the stored settings, or the defaults when no document exists yet
     */
    public DownloadSettings load() throws ConfigurationException {
        if (!Files.exists(location)) {
            log.debug("No configuration at {}, using defaults", location);
            return DownloadSettings.defaults();
        }
        try {
            DownloadSettings settings = objectMapper.readValue(location.toFile(), DownloadSettings.class);
            if (settings == null) {
                return DownloadSettings.defaults();
            }
            log.info("Loaded configuration from {}", location);
            return settings.validate();
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration in " + location + ": "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + location + ": " + e.getMessage(), e);
        }
    }

    public void save(DownloadSettings settings) throws ConfigurationException {
        settings.validate();
        try {
            Path parent = location.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(location.toFile(), settings);
            log.info("Configuration saved to {}", location);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot write configuration " + location + ": " + e.getMessage(), e);
        }
    }

    public String toJson(DownloadSettings settings) throws ConfigurationException {
        try {
            return objectMapper.writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Cannot render configuration: " + e.getOriginalMessage(), e);
        }
    }
}
