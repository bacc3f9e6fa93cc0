package com.genstream.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson ObjectMapper used for every request and response body.
 * Kept separate from any application-wide mapper.
 */
@Configuration(proxyBeanMethods = false)
public class JacksonConfiguration {

    public static final String OBJECT_MAPPER_BEAN = "genstreamObjectMapper";

    @Bean(OBJECT_MAPPER_BEAN)
    public ObjectMapper genstreamObjectMapper() {
        return createObjectMapper();
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Newer servers may add fields
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        // ...and enum values, which map to UNKNOWN
        mapper.configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE, true);

        // Don't include null values in JSON
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        return mapper;
    }
}
