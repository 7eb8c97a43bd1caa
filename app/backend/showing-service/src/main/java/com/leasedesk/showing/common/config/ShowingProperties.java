package com.leasedesk.showing.common.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Showing service settings bound from application.yml (prefix "showing").
 *
 * Required values are validated at startup; a missing environment variable stops the
 * application with the message of the failing constraint.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "showing")
public class ShowingProperties {

    /**
     * Zone used for business hours and slot labels.
     */
    @NotBlank
    private String timezone = "America/Los_Angeles";

    @Valid
    @NotNull
    private Search search = new Search();

    @Valid
    @NotNull
    private AppFolio appfolio = new AppFolio();

    @Valid
    @NotNull
    private Supabase supabase = new Supabase();

    @Valid
    @NotNull
    private GoogleCalendar googleCalendar = new GoogleCalendar();

    @Valid
    @NotNull
    private OpenAi openai = new OpenAi();

    /**
     * Leasing agents keyed by zone code (PD1, PD2, ...).
     */
    @Valid
    @NotEmpty(message = "showing.agents must list at least one leasing agent zone.")
    private Map<String, Agent> agents = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Search {

        /**
         * Environment variable: SEARCH_SERVICE_URL
         */
        @NotBlank(message = "SEARCH_SERVICE_URL must be configured. Please check your .env file.")
        private String url;

        private Duration timeout = Duration.ofSeconds(15);
    }

    @Getter
    @Setter
    public static class AppFolio {

        @NotBlank
        private String baseUrl = "https://api.appfolio.com";

        /**
         * Environment variable: APPFOLIO_AUTH_HEADER
         */
        @NotBlank(message = "APPFOLIO_AUTH_HEADER must be configured. Please check your .env file.")
        private String authHeader;

        /**
         * Environment variable: APPFOLIO_DEVELOPER_ID
         */
        @NotBlank(message = "APPFOLIO_DEVELOPER_ID must be configured. Please check your .env file.")
        private String developerId;

        private Duration timeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Supabase {

        /**
         * Environment variable: SUPABASE_PROJECT_ID
         */
        @NotBlank(message = "SUPABASE_PROJECT_ID must be configured. Please check your .env file.")
        private String projectId;

        /**
         * REST endpoint override; defaults to https://{projectId}.supabase.co/rest/v1
         */
        private String baseUrl;

        /**
         * Environment variable: SUPABASE_KEY
         */
        @NotBlank(message = "SUPABASE_KEY must be configured. Please check your .env file.")
        private String apiKey;

        private Duration timeout = Duration.ofSeconds(10);

        public String getRestUrl() {
            if (baseUrl != null && !baseUrl.isBlank()) {
                return baseUrl;
            }
            return "https://" + projectId + ".supabase.co/rest/v1";
        }
    }

    @Getter
    @Setter
    public static class GoogleCalendar {

        @NotBlank
        private String baseUrl = "https://www.googleapis.com/calendar/v3";

        private Duration timeout = Duration.ofSeconds(15);
    }

    @Getter
    @Setter
    public static class OpenAi {

        @NotBlank
        private String baseUrl = "https://api.openai.com/v1";

        /**
         * Environment variable: OPENAI_API_KEY (optional, address matching is skipped without it)
         */
        private String apiKey;

        @NotBlank
        private String model = "gpt-4o-mini";

        private Duration timeout = Duration.ofSeconds(30);

        @Min(1)
        private int requestsPerMinute = 10;

        @Min(1)
        private int burstSize = 3;

        /**
         * Longest time one invocation waits for a rate limit token.
         */
        private Duration maxRateLimitWait = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    public static class Agent {

        @NotBlank
        private String id;

        @NotBlank
        private String name;

        @NotBlank
        private String email;
    }
}
