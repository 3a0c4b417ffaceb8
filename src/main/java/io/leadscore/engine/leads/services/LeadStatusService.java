package io.leadscore.engine.leads.services;

import io.leadscore.engine.config.LeadScoringConfig;
import io.leadscore.engine.exceptions.LeadNotFoundException;
import io.leadscore.engine.exceptions.ScoringValidationException;
import io.leadscore.engine.leads.events.ConversionEventNotifier;
import io.leadscore.engine.leads.model.Lead;
import io.leadscore.engine.leads.model.dto.ConversionEvent;
import io.leadscore.engine.leads.model.dto.StatusChange;
import io.leadscore.engine.leads.model.dto.StatusUpdateResult;
import io.leadscore.engine.leads.model.enums.LeadStatus;
import io.leadscore.engine.leads.repository.LeadStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Applies manual status changes to a lead.
 *
 * <ul>
 *   <li>Unqualified needs a reason and carries no amounts; leaving unqualified clears the reason.</li>
 *   <li>proposalAmount survives only on positive statuses, jobBookedAmount only on job_booked.</li>
 *   <li>statusHistory keeps the latest timestamp per status and is touched only by an actual change.</li>
 *   <li>Entering job_booked sends one conversion event. If sending fails nothing is saved.</li>
 * </ul>
 */
@JBossLog
@ApplicationScoped
public class LeadStatusService {

    @Inject
    LeadStore leadStore;

    @Inject
    ConversionEventNotifier notifier;

    @Inject
    LeadScoringConfig config;

    public StatusUpdateResult updateStatus(String leadId, StatusChange change) {
        validate(leadId, change);
        Lead lead = leadStore.findLead(leadId).orElseThrow(() -> new LeadNotFoundException(leadId));

        LeadStatus target = change.status();
        LeadStatus previous = lead.getStatus();
        boolean statusChanged = previous != target;
        Instant now = Instant.now();

        lead.setStatus(target);
        if (target == LeadStatus.UNQUALIFIED) {
            lead.setUnqualifiedLeadReason(change.unqualifiedLeadReason().trim());
        } else {
            lead.setUnqualifiedLeadReason(null);
        }
        lead.setProposalAmount(amountFor(target.permitsProposalAmount(), change.proposalAmount(), lead.getProposalAmount()));
        lead.setJobBookedAmount(amountFor(target.permitsJobBookedAmount(), change.jobBookedAmount(), lead.getJobBookedAmount()));
        if (statusChanged) {
            if (lead.getStatusHistory() == null) lead.setStatusHistory(new HashMap<>());
            lead.getStatusHistory().put(target, now);
        }
        lead.setLastManualUpdate(now);

        List<String> warnings = new ArrayList<>();
        boolean eventSent = false;
        if (statusChanged && target == LeadStatus.JOB_BOOKED) {
            eventSent = sendConversionEvent(lead, warnings);
        }

        Lead saved = leadStore.saveStatusChange(lead);
        log.infof("[Lead Status] Lead %s: %s -> %s%s", leadId, previous, target, eventSent ? " (conversion event sent)" : "");
        return new StatusUpdateResult(saved, previous, statusChanged, eventSent, warnings);
    }

    private boolean sendConversionEvent(Lead lead, List<String> warnings) {
        if (!config.conversionEvents().enabled()) {
            return false;
        }
        LeadScoringConfig.ConversionEvents.Pixel pixel = config.conversionEvents().clients().get(lead.getClientId());
        if (pixel == null || isBlank(pixel.pixelId()) || isBlank(pixel.pixelToken())) {
            String warning = "No pixel credentials for client " + lead.getClientId() + ", conversion event skipped for lead " + lead.getId();
            log.warnf("[Lead Status] %s", warning);
            warnings.add(warning);
            return false;
        }
        // ConversionEventException propagates: the status change is not saved
        notifier.send(new ConversionEvent(pixel.pixelId(), pixel.pixelToken(), lead.getEmail(), lead.getPhone(), lead.getId()));
        return true;
    }

    private static double amountFor(boolean permitted, Double requested, double current) {
        if (!permitted) return 0.0;
        return requested != null ? requested : current;
    }

    private static void validate(String leadId, StatusChange change) {
        if (isBlank(leadId)) {
            throw new ScoringValidationException("leadId is required");
        }
        if (change == null || change.status() == null) {
            throw new ScoringValidationException("status is required");
        }
        LeadStatus target = change.status();
        if (target == LeadStatus.UNQUALIFIED && isBlank(change.unqualifiedLeadReason())) {
            throw new ScoringValidationException("A reason is required to mark a lead as unqualified");
        }
        if (change.proposalAmount() != null) {
            if (change.proposalAmount() < 0) {
                throw new ScoringValidationException("proposalAmount cannot be negative");
            }
            if (!target.permitsProposalAmount()) {
                throw new ScoringValidationException("proposalAmount is not allowed for status " + target.value());
            }
        }
        if (change.jobBookedAmount() != null) {
            if (change.jobBookedAmount() < 0) {
                throw new ScoringValidationException("jobBookedAmount cannot be negative");
            }
            if (!target.permitsJobBookedAmount()) {
                throw new ScoringValidationException("jobBookedAmount is not allowed for status " + target.value());
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
