package com.leasedesk.showing.matching.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.leasedesk.showing.common.config.ShowingProperties;
import com.leasedesk.showing.common.exception.UpstreamServiceException;
import com.leasedesk.showing.matching.dto.AddressCandidate;
import com.leasedesk.showing.matching.ratelimit.TokenBucketRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the property a caller meant from a short list of candidate addresses using
 * OpenAI chat completions. Calls are gated by the shared {@link TokenBucketRateLimiter}.
 */
@Component
@Slf4j
public class OpenAiAddressMatcher {

    static final String SERVICE = "openai";

    private static final Pattern INDEX_PATTERN = Pattern.compile("-?\\d+");

    private static final String PROMPT_TEMPLATE = """
            Given the user's spoken query about a property address, find the best matching address from the list.

            User Query: "%s"

            Available Addresses:
            %sReturn ONLY the index number (0, 1, 2, etc.) of the best matching address. If no address matches at all, return -1.

            Important: The query may contain spoken numbers (like "eight twenty eight" for "828") or slight variations. Match based on the most likely intended address.""";

    private final RestTemplate restTemplate;
    private final TokenBucketRateLimiter rateLimiter;
    private final ShowingProperties.OpenAi settings;

    public OpenAiAddressMatcher(RestTemplateBuilder restTemplateBuilder,
                                ShowingProperties properties,
                                TokenBucketRateLimiter rateLimiter) {
        this.settings = properties.getOpenai();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(settings.getTimeout())
                .setReadTimeout(settings.getTimeout())
                .build();
        this.rateLimiter = rateLimiter;
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    /**
     * Best matching candidate for the query.
     *
     * @param query      caller's spoken query
     * @param candidates addresses to choose from, indexed in list order
     * @param deadline   latest instant to wait for a rate limit token
     * @return property id of the chosen candidate, or empty when the model reports no match
     * @throws com.leasedesk.showing.matching.ratelimit.RateLimitExceededException no token before the deadline
     * @throws UpstreamServiceException request failed or the reply could not be read
     */
    public Optional<String> pickBestCandidate(String query, List<AddressCandidate> candidates, Instant deadline) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("no address candidates provided");
        }

        rateLimiter.acquire(deadline);

        Map<String, Object> body = Map.of(
                "model", settings.getModel(),
                "messages", List.of(Map.of("role", "user", "content", buildPrompt(query, candidates))),
                "max_tokens", 10,
                "temperature", 0
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(settings.getApiKey());

        JsonNode response;
        try {
            log.debug("OpenAI address matching request: candidates={}", candidates.size());
            response = restTemplate.postForObject(settings.getBaseUrl() + "/chat/completions",
                    new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            log.error("OpenAI request failed: error={}", e.getMessage());
            throw new UpstreamServiceException(SERVICE, "OpenAI API error", e);
        }

        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || content.isMissingNode() || content.isNull()) {
            throw new UpstreamServiceException(SERVICE, "no response from OpenAI");
        }

        Matcher matcher = INDEX_PATTERN.matcher(content.asText());
        if (!matcher.find()) {
            throw new UpstreamServiceException(SERVICE, "failed to parse OpenAI response: " + content.asText());
        }

        int index = Integer.parseInt(matcher.group());
        if (index < 0 || index >= candidates.size()) {
            log.debug("OpenAI reported no matching address: index={}", index);
            return Optional.empty();
        }
        return Optional.ofNullable(candidates.get(index).getPropertyId());
    }

    static String buildPrompt(String query, List<AddressCandidate> candidates) {
        StringBuilder addressList = new StringBuilder();
        for (int i = 0; i < candidates.size(); i++) {
            addressList.append(i).append(". ").append(candidates.get(i).getAddress1()).append('\n');
        }
        return String.format(PROMPT_TEMPLATE, query, addressList);
    }
}
