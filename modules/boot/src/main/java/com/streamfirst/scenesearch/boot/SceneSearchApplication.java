package com.streamfirst.scenesearch.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Command-line entry point. Runs one selection with the configured parameters and prints the
 * selected scenes and tiles.
 */
@SpringBootApplication
@EnableConfigurationProperties(SceneSearchProperties.class)
public class SceneSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(SceneSearchApplication.class, args);
    }
}
