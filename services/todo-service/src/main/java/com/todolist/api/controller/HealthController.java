package com.todolist.api.controller;

import com.todolist.api.dto.MessageResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check for service monitoring. Public.
 */
@RestController
public class HealthController {

    @GetMapping("/")
    public MessageResponse health() {
        return new MessageResponse("Healthy");
    }
}
