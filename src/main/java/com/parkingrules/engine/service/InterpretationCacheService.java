package com.parkingrules.engine.service;

import com.parkingrules.engine.config.ParkingProperties;
import com.parkingrules.engine.model.InterpretedSummary;
import com.parkingrules.engine.rules.InterpretationLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reads interpreted regulation summaries from Redis.
 *
 * Redis Storage Format:
 * - Key: "interpretation:{canonicalKey}" (MD5 of the regulation's text fields)
 * - Value: JSON {"summary": "...", "confidence": 0.9}
 *
 * Entries are written by the external annotator. This service never writes, and any Redis
 * failure degrades to "no summary" so legality answers keep flowing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterpretationCacheService implements InterpretationLookup {

    private final RedisTemplate<String, InterpretedSummary> interpretationRedisTemplate;
    private final ParkingProperties properties;

    @Override
    public Optional<InterpretedSummary> interpretation(String canonicalKey) {
        if (!properties.getInterpretation().isEnabled() || canonicalKey == null) {
            return Optional.empty();
        }
        String key = properties.getInterpretation().getKeyPrefix() + canonicalKey;
        try {
            InterpretedSummary summary = interpretationRedisTemplate.opsForValue().get(key);
            if (summary == null) {
                log.debug("No interpretation cached for {}", key);
            }
            return Optional.ofNullable(summary);
        } catch (RuntimeException e) {
            log.warn("Interpretation lookup failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
