package net.imagecraft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the image pipeline. Runs as a non-web application context; callers use the
 * services directly.
 */
@SpringBootApplication
public class ImageCraftApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageCraftApplication.class, args);
    }
}
