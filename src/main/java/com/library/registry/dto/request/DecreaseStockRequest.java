package com.library.registry.dto.request;

import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /book/{id}/methods/decrease_stock}: {@code {"params": {"qty": 3}}}.
 * The quantity itself is checked by {@code Book.decreaseStock} so that a missing or
 * non-positive value yields the same message as an excessive one.
 */
public record DecreaseStockRequest(

    @NotNull(message = "Method parameters are required")
    Params params
) {
    public record Params(Integer qty) {}
}
