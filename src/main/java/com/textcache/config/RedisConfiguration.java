package com.textcache.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the second cache tier.
 */
@Slf4j
@Configuration
public class RedisConfiguration {

    /**
     * Lettuce connection factory with connect/command timeouts. A timeout surfaces as an
     * exception from the template, which the cache turns into a miss.
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties redisProperties,
                                                           TextCacheProperties properties) {
        TextCacheProperties.RedisConfig redisConfig = properties.getRedis();

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(redisConfig.getConnectTimeout())
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(redisConfig.getCommandTimeout()))
                .build();

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(redisConfig.getCommandTimeout())
                .build();

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(
                redisProperties.getHost(), redisProperties.getPort());
        server.setDatabase(redisProperties.getDatabase());
        if (redisProperties.getPassword() != null) {
            server.setPassword(redisProperties.getPassword());
        }

        LettuceConnectionFactory factory = new LettuceConnectionFactory(server, clientConfig);

        log.info("Configured Redis connection factory for {}:{} (connect timeout {}, command timeout {})",
                redisProperties.getHost(), redisProperties.getPort(),
                redisConfig.getConnectTimeout(), redisConfig.getCommandTimeout());
        return factory;
    }

    /**
     * Redis template for byte array storage. Values are enveloped and compressed by the cache itself.
     */
    @Bean
    public RedisTemplate<String, byte[]> redisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        template.setKeySerializer(new StringRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());

        template.setValueSerializer(RedisSerializer.byteArray());
        template.setHashValueSerializer(RedisSerializer.byteArray());

        template.afterPropertiesSet();

        log.info("Configured RedisTemplate for byte array storage");
        return template;
    }
}
