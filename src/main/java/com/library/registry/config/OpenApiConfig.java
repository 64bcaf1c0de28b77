package com.library.registry.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI registryOpenAPI(@Value("${registry.api.name:Library Registry API}") String name,
                                   @Value("${registry.api.version:1.0.0}") String version) {
        return new OpenAPI()
            .info(new Info()
                .title(name)
                .description("REST API for books, authors and libraries, with many-to-many "
                    + "link management, bulk operations and stock control.")
                .version(version));
    }
}
