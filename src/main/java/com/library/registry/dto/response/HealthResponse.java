package com.library.registry.dto.response;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp, String database) {}
