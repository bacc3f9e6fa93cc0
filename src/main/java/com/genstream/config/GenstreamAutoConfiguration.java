package com.genstream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genstream.provider.GenerativeModelProvider;
import com.genstream.provider.GoogleAiProvider;
import com.genstream.service.ResponseClassifier;
import com.genstream.service.ResponseValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the client when {@code genstream.api-key} is set.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(GenstreamProperties.class)
@Import({JacksonConfiguration.class, WebClientConfiguration.class})
@ConditionalOnProperty(prefix = "genstream", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GenstreamAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ResponseValidator responseValidator(@Qualifier(JacksonConfiguration.OBJECT_MAPPER_BEAN) ObjectMapper objectMapper) {
        return new ResponseValidator(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseClassifier responseClassifier() {
        return new ResponseClassifier();
    }

    @Bean
    @ConditionalOnMissingBean(GenerativeModelProvider.class)
    @ConditionalOnProperty(prefix = "genstream", name = "api-key")
    public GoogleAiProvider googleAiProvider(
            @Qualifier(WebClientConfiguration.WEB_CLIENT_BEAN) WebClient webClient,
            GenstreamProperties properties,
            @Qualifier(JacksonConfiguration.OBJECT_MAPPER_BEAN) ObjectMapper objectMapper,
            ResponseValidator responseValidator,
            ResponseClassifier responseClassifier) {
        log.info("Configured generative model provider: baseUrl={}, apiVersion={}, timeout={}",
                properties.getBaseUrl(), properties.getApiVersion(), properties.getTimeout());
        return new GoogleAiProvider(webClient, properties, objectMapper, responseValidator, responseClassifier);
    }
}
