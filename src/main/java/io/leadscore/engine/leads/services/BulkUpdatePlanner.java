package io.leadscore.engine.leads.services;

import io.leadscore.engine.config.LeadScoringConfig;
import io.leadscore.engine.leads.model.Lead;
import io.leadscore.engine.leads.model.dto.LeadUpdate;
import io.leadscore.engine.leads.model.dto.ScoredLead;
import io.leadscore.engine.leads.model.dto.UpdatePlan;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plans the smallest set of lead writes that brings every stored snapshot and score in line
 * with the current rate table. A lead that already matches gets no write, so re-running with
 * unchanged inputs plans nothing.
 */
@JBossLog
@ApplicationScoped
public class BulkUpdatePlanner {

    @Inject
    LeadScorer scorer;

    @Inject
    LeadScoringConfig config;

    public UpdatePlan plan(List<Lead> leads, RateTable rateTable) {
        return plan(leads, rateTable, ScoringWeights.from(config.weights()));
    }

    public UpdatePlan plan(List<Lead> leads, RateTable rateTable, ScoringWeights weights) {
        List<LeadUpdate> writes = new ArrayList<>();
        for (Lead lead : leads) {
            ScoredLead candidate = scorer.score(lead, rateTable, weights);
            if (isInSync(lead, candidate)) continue;
            writes.add(new LeadUpdate(lead.getId(), candidate.snapshot(), candidate.leadScore()));
        }
        log.debugf("[Planner] %d of %d leads need a write", writes.size(), leads.size());
        return new UpdatePlan(writes, leads.size(), writes.size());
    }

    private static boolean isInSync(Lead lead, ScoredLead candidate) {
        return lead.getLeadScore() != null
                && lead.getLeadScore() == candidate.leadScore()
                && Objects.equals(lead.getConversionRates(), candidate.snapshot());
    }
}
