package com.genstream.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for HTTP requests to the model API.
 */
@Configuration(proxyBeanMethods = false)
public class WebClientConfiguration {

    public static final String WEB_CLIENT_BEAN = "genstreamWebClient";

    @Bean(WEB_CLIENT_BEAN)
    public WebClient genstreamWebClient(GenstreamProperties properties) {
        return createWebClient(properties);
    }

    public static WebClient createWebClient(GenstreamProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis())
                .responseTimeout(properties.getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
