package com.leasedesk.showing.property.client;

import com.leasedesk.showing.common.config.ShowingProperties;
import com.leasedesk.showing.common.exception.UpstreamServiceException;
import com.leasedesk.showing.property.dto.PropertySearchResponse;
import com.leasedesk.showing.property.exception.PropertyNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Property search service client (free text query -> AppFolio property id)
 */
@Component
@Slf4j
public class PropertySearchClient {

    static final String SERVICE = "property-search";

    /** Metadata keys that may hold the property id, checked before and after the top-level field. */
    private static final List<String> PRIMARY_ID_KEYS = List.of("PropertyId", "property_id");
    private static final List<String> FALLBACK_ID_KEYS = List.of("Id", "id");

    private final RestTemplate restTemplate;
    private final String searchUrl;

    public PropertySearchClient(RestTemplateBuilder restTemplateBuilder, ShowingProperties properties) {
        ShowingProperties.Search search = properties.getSearch();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(search.getTimeout())
                .setReadTimeout(search.getTimeout())
                .build();
        this.searchUrl = search.getUrl();
    }

    /**
     * Finds the property id of the best search hit.
     *
     * @param query caller's free text
     * @return AppFolio property id
     * @throws PropertyNotFoundException no result, or the first result has no id
     * @throws UpstreamServiceException  search service unreachable or failing
     */
    public String findPropertyId(String query) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, String> body = Map.of(
                "Query", query,
                "ExtractedProperty", query
        );

        PropertySearchResponse response;
        try {
            log.debug("Property search request: query={}", query);
            response = restTemplate.postForObject(searchUrl, new HttpEntity<>(body, headers), PropertySearchResponse.class);
        } catch (RestClientException e) {
            log.error("Property search failed: query={}, error={}", query, e.getMessage());
            throw new UpstreamServiceException(SERVICE, "search request failed", e);
        }

        if (response == null || response.getResults() == null || response.getResults().isEmpty()) {
            throw new PropertyNotFoundException("No property found for query: " + query);
        }

        PropertySearchResponse.Result first = response.getResults().get(0);
        Map<String, Object> metadata = first.getMetadata() != null ? first.getMetadata() : Map.of();

        String propertyId = firstPresent(metadata, PRIMARY_ID_KEYS);
        if (propertyId == null && first.getPropertyId() != null && !first.getPropertyId().isEmpty()) {
            propertyId = first.getPropertyId();
        }
        if (propertyId == null) {
            propertyId = firstPresent(metadata, FALLBACK_ID_KEYS);
        }
        if (propertyId == null) {
            throw new PropertyNotFoundException("Property ID missing in search result for query: " + query);
        }

        log.debug("Property search hit: query={}, propertyId={}, count={}", query, propertyId, response.getCount());
        return propertyId;
    }

    private static String firstPresent(Map<String, Object> metadata, List<String> keys) {
        for (String key : keys) {
            Object value = metadata.get(key);
            if (value != null) {
                return String.valueOf(value);
            }
        }
        return null;
    }
}
