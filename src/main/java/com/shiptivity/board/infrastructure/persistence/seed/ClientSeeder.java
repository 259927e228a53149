package com.shiptivity.board.infrastructure.persistence.seed;

import com.shiptivity.board.application.service.ClientService;
import com.shiptivity.board.infrastructure.config.BoardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads the seed board once the context is up.
 */
@Component
public class ClientSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ClientSeeder.class);

    private final ClientService clientService;
    private final BoardProperties properties;

    public ClientSeeder(ClientService clientService, BoardProperties properties) {
        this.clientService = clientService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.seedOnStartup()) {
            log.info("Seeding disabled, keeping existing board");
            return;
        }
        clientService.resetBoard();
    }
}
