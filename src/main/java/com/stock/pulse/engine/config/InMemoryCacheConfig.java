package com.stock.pulse.engine.config;

import com.stock.pulse.engine.core.HotCache;
import com.stock.pulse.engine.core.InMemoryHotCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "stockpulse.redis.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryCacheConfig {

    @Bean
    public HotCache hotCache(@Value("${stockpulse.redis.key-prefix:}") String prefix) {
        return new InMemoryHotCache(prefix);
    }
}
