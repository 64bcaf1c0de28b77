package com.library.registry.dto.response;

public record BulkItemError(int index, String error) {}
