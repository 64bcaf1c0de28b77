package com.library.registry.dto.response;

public record MessageResponse(String message) {}
