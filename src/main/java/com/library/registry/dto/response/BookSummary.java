package com.library.registry.dto.response;

public record BookSummary(Long id, String title) {}
