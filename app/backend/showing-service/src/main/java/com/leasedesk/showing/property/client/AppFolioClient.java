package com.leasedesk.showing.property.client;

import com.leasedesk.showing.common.config.ShowingProperties;
import com.leasedesk.showing.common.exception.UpstreamServiceException;
import com.leasedesk.showing.property.dto.AppFolioDataResponse;
import com.leasedesk.showing.property.dto.AppFolioGroup;
import com.leasedesk.showing.property.dto.AppFolioProperty;
import com.leasedesk.showing.property.exception.PropertyNotFoundException;
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

import java.util.Collections;
import java.util.List;

/**
 * AppFolio Property API client
 */
@Component
@Slf4j
public class AppFolioClient {

    static final String SERVICE = "appfolio";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String authHeader;
    private final String developerId;

    public AppFolioClient(RestTemplateBuilder restTemplateBuilder, ShowingProperties properties) {
        ShowingProperties.AppFolio appFolio = properties.getAppfolio();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(appFolio.getTimeout())
                .setReadTimeout(appFolio.getTimeout())
                .build();
        this.baseUrl = appFolio.getBaseUrl();
        this.authHeader = appFolio.getAuthHeader();
        this.developerId = appFolio.getDeveloperId();
    }

    /**
     * Property details by id.
     *
     * @throws PropertyNotFoundException AppFolio returned no record for the id
     * @throws UpstreamServiceException  request failed
     */
    public AppFolioProperty getProperty(String propertyId) {
        String url = baseUrl + "/api/v0/properties?filters[Id]={id}";

        List<AppFolioProperty> properties = fetch(url, propertyId,
                new ParameterizedTypeReference<AppFolioDataResponse<AppFolioProperty>>() {}, "property");

        if (properties.isEmpty()) {
            throw new PropertyNotFoundException("Property not found: " + propertyId);
        }
        return properties.get(0);
    }

    /**
     * Property groups by id. No ids means no groups and no request.
     *
     * @throws UpstreamServiceException request failed
     */
    public List<AppFolioGroup> getPropertyGroups(List<String> groupIds) {
        if (groupIds == null || groupIds.isEmpty()) {
            return Collections.emptyList();
        }

        String url = baseUrl + "/api/v0/property_groups?filters[Id]={ids}";
        return fetch(url, String.join(",", groupIds),
                new ParameterizedTypeReference<AppFolioDataResponse<AppFolioGroup>>() {}, "groups");
    }

    private <T> List<T> fetch(String url, String filter,
                              ParameterizedTypeReference<AppFolioDataResponse<T>> type, String resource) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, authHeader);
        headers.set("X-AppFolio-Developer-ID", developerId);

        try {
            log.debug("AppFolio {} request: filter={}", resource, filter);
            ResponseEntity<AppFolioDataResponse<T>> response = restTemplate.exchange(
                    url,
                    HttpMethod.GET,
                    new HttpEntity<Void>(headers),
                    type,
                    filter
            );

            AppFolioDataResponse<T> body = response.getBody();
            return body != null && body.getData() != null ? body.getData() : Collections.emptyList();
        } catch (RestClientException e) {
            log.error("AppFolio {} request failed: filter={}, error={}", resource, filter, e.getMessage());
            throw new UpstreamServiceException(SERVICE, "AppFolio API error (" + resource + ")", e);
        }
    }
}
