package com.stock.pulse.engine.config;

import com.stock.pulse.engine.core.HotCache;
import com.stock.pulse.engine.core.RedisHotCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@ConditionalOnProperty(name = "stockpulse.redis.enabled", havingValue = "true")
public class RedisConfig {

    // connection factory comes from spring.data.redis.* auto-configuration
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
        return new StringRedisTemplate(cf);
    }

    @Bean
    public HotCache hotCache(StringRedisTemplate template,
                             @Value("${stockpulse.redis.key-prefix:}") String prefix) {
        return new RedisHotCache(template, prefix);
    }
}
