package com.library.registry.controller;

import com.library.registry.dto.response.ApiInfoResponse;
import com.library.registry.dto.response.HealthResponse;
import com.library.registry.dto.response.StatisticsResponse;
import com.library.registry.service.SystemService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "System", description = "Service information, health and statistics")
public class SystemController {

    private final SystemService systemService;

    @Value("${registry.api.name:Library Registry API}")
    private String apiName;

    @Value("${registry.api.version:1.0.0}")
    private String apiVersion;

    @GetMapping("/")
    @Operation(summary = "API information")
    public ResponseEntity<ApiInfoResponse> root() {
        return ResponseEntity.ok(new ApiInfoResponse(apiName, apiVersion, "running"));
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "database is \"connected\" or \"unavailable\".")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(systemService.health());
    }

    @GetMapping("/statistics")
    @Operation(summary = "Entity counts")
    public ResponseEntity<StatisticsResponse> statistics() {
        return ResponseEntity.ok(systemService.statistics());
    }
}
