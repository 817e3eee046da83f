package com.company.fermentation.controller;

import com.company.fermentation.broadcast.Broadcaster;
import com.company.fermentation.reference.ReferenceModel;
import com.company.fermentation.stream.StreamOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final ReferenceModel referenceModel;
    private final StreamOrchestrator orchestrator;
    private final Broadcaster broadcaster;

    @GetMapping
    @Operation(summary = "Health check")
    public ResponseEntity<Map<String, Object>> health() {
        boolean referenceLoaded = referenceModel.isAvailable();

        Map<String, Object> response = new HashMap<>();
        response.put("status", referenceLoaded ? "UP" : "DEGRADED");
        response.put("timestamp", Instant.now());
        response.put("service", "fermentation-monitor");
        response.put("version", "1.0.0");
        response.put("referenceLoaded", referenceLoaded);
        response.put("tick", orchestrator.getTickCount());
        response.put("streamFinished", orchestrator.isFinished());
        response.put("subscribers", broadcaster.subscriberCount());

        return ResponseEntity.ok(response);
    }
}
