package com.example.asyncdemo.config;

import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Builds the single outbound client used for the todo API.
 *
 * The connector owns a connection pool, so it must be created once per process
 * and shared, never per request.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Bean
    public WebClient todoApiClient(WebClient.Builder builder,
                                   @Value("${app.remote.base-url:https://jsonplaceholder.typicode.com}") String baseUrl,
                                   @Value("${app.remote.connect-timeout:2s}") Duration connectTimeout,
                                   @Value("${app.remote.response-timeout:5s}") Duration responseTimeout) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(connectTimeout.toMillis()))
            .responseTimeout(responseTimeout);

        log.info("Todo API client targeting {} (connect timeout {}, response timeout {})",
            baseUrl, connectTimeout, responseTimeout);

        return builder
            .baseUrl(baseUrl)
            .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
