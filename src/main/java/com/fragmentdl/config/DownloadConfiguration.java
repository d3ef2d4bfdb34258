package com.fragmentdl.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class DownloadConfiguration {

    @Bean
    public DownloadSettingsStore downloadSettingsStore(EngineProperties properties, ObjectMapper objectMapper) {
        return new DownloadSettingsStore(Path.of(properties.configFile()), objectMapper);
    }

    @Bean
    public HttpClientFactory httpClientFactory() {
        return new HttpClientFactory();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
