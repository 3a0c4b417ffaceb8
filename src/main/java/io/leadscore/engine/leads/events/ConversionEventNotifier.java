package io.leadscore.engine.leads.events;

import io.leadscore.engine.leads.model.dto.ConversionEvent;

/**
 * Reports a booked job to the advertising platform.
 * Implementations throw {@link io.leadscore.engine.exceptions.ConversionEventException} when delivery fails.
 */
public interface ConversionEventNotifier {

    void send(ConversionEvent event);
}
