package com.leasedesk.showing.vapi.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Voice assistant webhook body ("tool-calls" server message)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VapiWebhookPayload {

    private Message message;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {

        private String type;  // "tool-calls"

        @Builder.Default
        private List<ToolCall> toolCalls = new ArrayList<>();

        @Builder.Default
        private Artifact artifact = new Artifact();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolCall {

        private String id;

        private String type;

        private ToolFunction function;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolFunction {

        private String name;

        private ToolArguments arguments;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolArguments {

        @JsonProperty("Query")
        private String query;

        @JsonProperty("Phone")
        private String phone;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Artifact {

        private List<ArtifactMessage> messages = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArtifactMessage {

        private String role;  // "tool_call_result", "assistant", ...

        private String name;

        /**
         * Either a plain string or a search result object; kept raw.
         */
        private JsonNode result;
    }
}
