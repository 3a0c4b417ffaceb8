package io.leadscore.engine.leads.events;

import io.leadscore.engine.config.LeadScoringConfig;
import io.leadscore.engine.exceptions.ConversionEventException;
import io.leadscore.engine.exceptions.ScoringValidationException;
import io.leadscore.engine.leads.model.dto.ConversionEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.apache.commons.codec.digest.DigestUtils;
import org.eclipse.microprofile.rest.client.inject.RestClient;

import java.time.Instant;
import java.util.List;

/**
 * Sends a "Lead" event to the conversions API of the client's pixel.
 */
@JBossLog
@ApplicationScoped
public class RestConversionEventNotifier implements ConversionEventNotifier {

    static final String EVENT_NAME = "Lead";
    static final String ACTION_SOURCE = "system_generated";
    static final String EVENT_SOURCE = "crm";

    @Inject
    @RestClient
    ConversionsApiClient client;

    @Inject
    LeadScoringConfig config;

    @Override
    public void send(ConversionEvent event) {
        if (isBlank(event.pixelId()) || isBlank(event.pixelToken())) {
            throw new ScoringValidationException("Pixel id and token are required to send a conversion event");
        }

        ConversionEventPayload payload = payloadOf(event, Instant.now().getEpochSecond());
        String version = config.conversionEvents().apiVersion();
        try (Response response = client.sendEvents(version, event.pixelId(), event.pixelToken(), payload)) {
            if (response.getStatus() < 200 || response.getStatus() > 299) {
                String body = response.hasEntity() ? response.readEntity(String.class) : "";
                throw new ConversionEventException("Conversions API returned " + response.getStatus() + " for lead "
                        + event.leadId() + ": " + body, null);
            }
            log.infof("[Conversion Event] Lead event sent for lead %s to pixel %s", event.leadId(), event.pixelId());
        } catch (ConversionEventException e) {
            throw e;
        } catch (RuntimeException e) {
            log.errorf(e, "[Conversion Event] Failed to send lead event for lead %s", event.leadId());
            throw new ConversionEventException("Failed to send conversion event for lead " + event.leadId(), e);
        }
    }

    ConversionEventPayload payloadOf(ConversionEvent event, long eventTime) {
        List<String> emails = isBlank(event.email()) ? null : List.of(hash(event.email()));
        List<String> phones = isBlank(event.phone()) ? null : List.of(hash(normalizePhone(event.phone())));
        ConversionEventPayload.UserData userData =
                new ConversionEventPayload.UserData(numericLeadId(event.leadId()), emails, phones);
        ConversionEventPayload.CustomData customData =
                new ConversionEventPayload.CustomData(EVENT_SOURCE, config.conversionEvents().leadEventSource());
        return new ConversionEventPayload(List.of(
                new ConversionEventPayload.Event(EVENT_NAME, eventTime, ACTION_SOURCE, userData, customData)));
    }

    static String hash(String value) {
        return DigestUtils.sha256Hex(value.trim().toLowerCase());
    }

    /**
     * Keeps digits and '+'. Numbers without a country code are taken as North American (+1).
     */
    static String normalizePhone(String phone) {
        String normalized = phone.replaceAll("[^\\d+]", "");
        return normalized.startsWith("+") ? normalized : "+1" + normalized;
    }

    /**
     * The API wants a numeric lead id; the first 15 hex digits of the id's MD5 give a stable one.
     */
    static long numericLeadId(String leadId) {
        return Long.parseLong(DigestUtils.md5Hex(leadId).substring(0, 15), 16);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
