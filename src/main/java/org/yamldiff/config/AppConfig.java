package org.yamldiff.config;

import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class AppConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public OkHttpClient httpClient(YamlDiffConfig yamlDiffConfig) {
        int timeoutSeconds = yamlDiffConfig.getRemote().getTimeoutSeconds();
        LOGGER.debug("Creating HTTP client with {}s timeout", timeoutSeconds);
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .followRedirects(true)
                .build();
    }
}
