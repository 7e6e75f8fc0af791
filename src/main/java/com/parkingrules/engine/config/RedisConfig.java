package com.parkingrules.engine.config;

import com.parkingrules.engine.model.InterpretedSummary;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for reading interpreted regulation summaries.
 *
 * The annotator writes one JSON value per canonical regulation key:
 * - Key: "interpretation:{md5}"
 * - Value: {"summary": "...", "confidence": 0.92}
 *
 * The engine only reads these; a miss or an unreachable Redis simply means the raw
 * regulation description is shown.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, InterpretedSummary> interpretationRedisTemplate(
            RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, InterpretedSummary> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        // String keys (e.g. "interpretation:9f86d08...")
        template.setKeySerializer(new StringRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());

        // Plain JSON values, no type hints
        Jackson2JsonRedisSerializer<InterpretedSummary> jsonSerializer =
            new Jackson2JsonRedisSerializer<>(InterpretedSummary.class);
        template.setValueSerializer(jsonSerializer);
        template.setHashValueSerializer(jsonSerializer);

        template.afterPropertiesSet();
        return template;
    }
}
