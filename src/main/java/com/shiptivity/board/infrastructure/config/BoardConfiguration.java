package com.shiptivity.board.infrastructure.config;

import com.shiptivity.board.core.ranking.RerankingEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires framework-free core components into the Spring context.
 */
@Configuration
@EnableConfigurationProperties(BoardProperties.class)
public class BoardConfiguration {

    @Bean
    public RerankingEngine rerankingEngine() {
        return new RerankingEngine();
    }
}
