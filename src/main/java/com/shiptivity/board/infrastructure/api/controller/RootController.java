package com.shiptivity.board.infrastructure.api.controller;

import com.shiptivity.board.infrastructure.api.dto.MessageResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the API root banner.
 */
@RestController
public class RootController {

    @GetMapping("/")
    public MessageResponse root() {
        return new MessageResponse("SHIPTIVITY API. Read documentation to see API docs");
    }
}
