package com.library.registry.dto.response;

import java.util.List;

public record LinkedEntitiesResponse<M>(
    Long ownerId,
    String relation,
    int count,
    List<M> items
) {}
