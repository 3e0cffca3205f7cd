package com.whereq.iris.controller;

import com.whereq.iris.engine.MacroEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and engine status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final MacroEngine engine;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and the ImageJ engine are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromSupplier(() -> {
            Map<String, Object> health = new HashMap<>();
            health.put("status", "UP");
            health.put("service", "whereq-iris");

            Map<String, String> engineInfo = new HashMap<>();
            engineInfo.put("status", engine.isReady() ? "READY" : "UNAVAILABLE");
            engineInfo.put("executable", String.valueOf(engine.getExecutable()));
            health.put("engine", engineInfo);

            return ResponseEntity.ok(health);
        });
    }
}
