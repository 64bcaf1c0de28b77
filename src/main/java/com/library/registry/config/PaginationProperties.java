package com.library.registry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param defaultLimit page size used by {@code /paginated} when the request has no {@code limit}
 */
@ConfigurationProperties(prefix = "registry.pagination")
public record PaginationProperties(@DefaultValue("100") int defaultLimit) {}
