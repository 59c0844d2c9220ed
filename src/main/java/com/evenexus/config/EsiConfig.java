package com.evenexus.config;

import java.net.http.HttpClient;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and the HTTP client for the public ESI market API.
 *
 * <p>Binds to the {@code esi.*} prefix. The client is built on the JDK {@link HttpClient}
 * so a blocked request is interruptible: cancelling an appraisal interrupts its fetch
 * workers and the in-flight HTTP exchanges with them.
 */
@Configuration
@ConfigurationProperties(prefix = "esi")
@Getter
@Setter
public class EsiConfig {

    private static final Logger log = LoggerFactory.getLogger(EsiConfig.class);

    private String baseUrl = "https://esi.evetech.net/latest";

    /** ESI server to query. */
    private String datasource = "tranquility";

    /** ESI asks clients to identify themselves with a contact address. */
    private String userAgent = "nexus-appraisal/0.1 (contact@example.com)";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(15);

    /** How long a fetched order book is served from cache when a refresh is not forced. */
    private Duration cacheTtl = Duration.ofHours(3);

    private long cacheMaximumSize = 5_000;

    @Bean
    public RestClient esiRestClient(RestClient.Builder restClientBuilder) {
        log.info("Creating ESI RestClient: baseUrl={}, datasource={}", baseUrl, datasource);
        HttpClient httpClient =
                HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(readTimeout);
        return restClientBuilder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
