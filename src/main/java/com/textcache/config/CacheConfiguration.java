package com.textcache.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Cache infrastructure beans.
 */
@Configuration
public class CacheConfiguration {

    /**
     * Wall clock used for metric timestamps and {@code cached_at}. Replaced in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
