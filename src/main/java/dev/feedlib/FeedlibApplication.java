package dev.feedlib;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the feedlib application.
 *
 * <p>Wires the {@code fetch} and {@code parse} components; the library has no web surface of its
 * own and is driven by the service that embeds it.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FeedlibApplication {
    public static void main(String[] args) {
        SpringApplication.run(FeedlibApplication.class, args);
    }
}
