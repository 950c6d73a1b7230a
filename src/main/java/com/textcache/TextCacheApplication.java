package com.textcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for text-cache - tiered response cache for AI text processing.
 */
@SpringBootApplication
public class TextCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(TextCacheApplication.class, args);
    }
}
