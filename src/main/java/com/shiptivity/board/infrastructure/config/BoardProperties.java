package com.shiptivity.board.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Board settings bound from {@code shiptivity.board.*}.
 *
 * @param seedOnStartup whether the seed board replaces the stored clients at startup
 */
@ConfigurationProperties(prefix = "shiptivity.board")
public record BoardProperties(
        @DefaultValue("true") boolean seedOnStartup
) {}
