package com.swab.backend.modules.slack.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(SlackProperties.class)
public class SlackClientConfig {

    @Bean
    public RestClient slackRestClient(RestClient.Builder builder, SlackProperties properties) {
        int timeoutMillis = Math.toIntExact(properties.timeout().toMillis());
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        return builder
                .requestFactory(requestFactory)
                .build();
    }
}
