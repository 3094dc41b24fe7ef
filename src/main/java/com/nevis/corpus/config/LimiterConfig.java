package com.nevis.corpus.config;

import com.nevis.corpus.infra.InMemoryRpmRateLimiter;
import com.nevis.corpus.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("chatLimiter")
    public RateLimiter chatLimiter(@Value("${app.collaborator.requests-per-minute:12}") int requestsPerMinute) {
        return new InMemoryRpmRateLimiter(requestsPerMinute);
    }
}
