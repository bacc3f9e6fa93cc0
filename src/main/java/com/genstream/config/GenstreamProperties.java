package com.genstream.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the generative model client.
 */
@Data
@ConfigurationProperties(prefix = "genstream")
public class GenstreamProperties {

    private boolean enabled = true;
    private String apiKey;
    private String baseUrl = "https://generativelanguage.googleapis.com";
    private String apiVersion = "v1beta";

    /**
     * Limit for single-shot calls, and for the gap between two reads of a stream.
     */
    private Duration timeout = Duration.ofSeconds(120);

    private Duration connectTimeout = Duration.ofSeconds(10);
}
