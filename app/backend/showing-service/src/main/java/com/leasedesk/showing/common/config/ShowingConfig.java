package com.leasedesk.showing.common.config;

import com.leasedesk.showing.agent.service.AgentDirectory;
import com.leasedesk.showing.matching.ratelimit.TokenBucketRateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(ShowingProperties.class)
public class ShowingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AgentDirectory agentDirectory(ShowingProperties properties) {
        return AgentDirectory.from(properties.getAgents());
    }

    /**
     * Process-wide limiter for OpenAI calls, shared by every invocation.
     */
    @Bean
    public TokenBucketRateLimiter openAiRateLimiter(ShowingProperties properties, Clock clock) {
        ShowingProperties.OpenAi openAi = properties.getOpenai();
        Duration refillInterval = Duration.ofMinutes(1).dividedBy(openAi.getRequestsPerMinute());
        return new TokenBucketRateLimiter(openAi.getBurstSize(), refillInterval, clock);
    }
}
