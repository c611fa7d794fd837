package com.agenteval.experiment.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class FakeCapabilitiesConfig {

    @Bean
    @Primary
    FakeCaseExecutor fakeCaseExecutor() {
        return new FakeCaseExecutor();
    }

    @Bean
    @Primary
    FakeScoringClient fakeScoringClient() {
        return new FakeScoringClient();
    }
}
