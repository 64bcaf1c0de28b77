package com.library.registry.dto.response;

public record CountResponse(long count) {}
