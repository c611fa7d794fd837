package com.agenteval.experiment.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ClientConfig {

    @Bean
    @Qualifier("judgeRestClient")
    RestClient judgeRestClient(ExperimentProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getJudge().getConnectTimeoutMs());
        requestFactory.setReadTimeout(properties.getJudge().getReadTimeoutMs());
        return RestClient.builder()
            .requestFactory(requestFactory)
            .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Bean
    @Qualifier("agentRuntimeRestClient")
    RestClient agentRuntimeRestClient(ExperimentProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = Math.max(1, properties.getCaseTimeoutSeconds()) * 1000;
        requestFactory.setConnectTimeout(Math.min(timeoutMs, 15_000));
        requestFactory.setReadTimeout(timeoutMs);
        return RestClient.builder()
            .baseUrl(properties.getAgentRuntimeBaseUrl())
            .requestFactory(requestFactory)
            .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
            .build();
    }
}
