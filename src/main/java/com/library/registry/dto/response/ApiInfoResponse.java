package com.library.registry.dto.response;

public record ApiInfoResponse(String name, String version, String status) {}
