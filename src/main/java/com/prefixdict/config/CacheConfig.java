package com.prefixdict.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
public class CacheConfig {

    // query word -> stored words that prefix it; flushed on every insert
    @Bean("prefixCache")
    public Cache<String, List<String>> prefixCache(
            @Value("${prefixdict.cache.maximum-size:50000}") long maximumSize,
            @Value("${prefixdict.cache.expire-after-write:10m}") Duration expireAfterWrite) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireAfterWrite)
                .build();
    }
}
