package com.leasedesk.showing.calendar.client;

import com.leasedesk.showing.calendar.dto.OAuthTokenRow;
import com.leasedesk.showing.calendar.exception.CalendarTokenNotFoundException;
import com.leasedesk.showing.common.config.ShowingProperties;
import com.leasedesk.showing.common.exception.UpstreamServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Supabase token store client. Agents' Google OAuth access tokens live in the oauth_tokens table.
 */
@Component
@Slf4j
public class CalendarTokenClient {

    static final String SERVICE = "supabase";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;

    public CalendarTokenClient(RestTemplateBuilder restTemplateBuilder, ShowingProperties properties) {
        ShowingProperties.Supabase supabase = properties.getSupabase();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(supabase.getTimeout())
                .setReadTimeout(supabase.getTimeout())
                .build();
        this.baseUrl = supabase.getRestUrl();
        this.apiKey = supabase.getApiKey();
    }

    /**
     * Stored calendar access token of an agent.
     *
     * @param email agent email
     * @return OAuth access token
     * @throws CalendarTokenNotFoundException no token stored for the email
     * @throws UpstreamServiceException       Supabase request failed
     */
    public String getAccessToken(String email) {
        String url = baseUrl + "/oauth_tokens?email=eq.{email}&select=access_token";

        HttpHeaders headers = new HttpHeaders();
        headers.set("apikey", apiKey);
        headers.setBearerAuth(apiKey);

        List<OAuthTokenRow> tokens;
        try {
            log.debug("Supabase token lookup: email={}", email);
            ResponseEntity<List<OAuthTokenRow>> response = restTemplate.exchange(
                    url,
                    HttpMethod.GET,
                    new HttpEntity<Void>(headers),
                    new ParameterizedTypeReference<List<OAuthTokenRow>>() {},
                    email
            );
            tokens = response.getBody();
        } catch (RestClientException e) {
            log.error("Supabase token lookup failed: email={}, error={}", email, e.getMessage());
            throw new UpstreamServiceException(SERVICE, "Supabase API error", e);
        }

        if (tokens == null || tokens.isEmpty() || tokens.get(0).getAccessToken() == null) {
            throw new CalendarTokenNotFoundException("No token found for email: " + email);
        }
        return tokens.get(0).getAccessToken();
    }
}
