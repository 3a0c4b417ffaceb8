package io.leadscore.engine.leads.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body of the conversions endpoint. Contact data in {@link UserData} is SHA-256 hashed.
 */
public record ConversionEventPayload(List<Event> data) {

    public record Event(@JsonProperty("event_name") String eventName,
                        @JsonProperty("event_time") long eventTime,
                        @JsonProperty("action_source") String actionSource,
                        @JsonProperty("user_data") UserData userData,
                        @JsonProperty("custom_data") CustomData customData) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UserData(@JsonProperty("lead_id") long leadId,
                           @JsonProperty("em") List<String> emails,
                           @JsonProperty("ph") List<String> phones) {
    }

    public record CustomData(@JsonProperty("event_source") String eventSource,
                             @JsonProperty("lead_event_source") String leadEventSource) {
    }
}
