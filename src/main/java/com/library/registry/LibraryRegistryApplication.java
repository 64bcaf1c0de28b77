package com.library.registry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LibraryRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibraryRegistryApplication.class, args);
    }
}
