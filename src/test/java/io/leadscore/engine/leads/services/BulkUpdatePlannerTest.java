package io.leadscore.engine.leads.services;

import io.leadscore.engine.leads.model.ConversionRateSnapshot;
import io.leadscore.engine.leads.model.Lead;
import io.leadscore.engine.leads.model.RateKey;
import io.leadscore.engine.leads.model.dto.LeadUpdate;
import io.leadscore.engine.leads.model.dto.UpdatePlan;
import io.leadscore.engine.leads.model.enums.KeyField;
import io.leadscore.engine.leads.utils.TestScoringConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.leadscore.engine.leads.model.enums.LeadStatus.NEW;
import static io.leadscore.engine.leads.utils.TestDataBuilders.aLead;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BulkUpdatePlanner")
class BulkUpdatePlannerTest {

    private BulkUpdatePlanner planner;

    private final RateTable rates = RateTable.of(Map.of(
            new RateKey(KeyField.SERVICE, "Roofing"), 1.0,
            new RateKey(KeyField.ZIP, "10001"), 0.5));

    @BeforeEach
    void setUp() {
        TestScoringConfig config = new TestScoringConfig();
        LeadScorer scorer = new LeadScorer();
        scorer.config = config;
        planner = new BulkUpdatePlanner();
        planner.scorer = scorer;
        planner.config = config;
    }

    private Lead roofingLead(String id) {
        return aLead(id).service("Roofing").zip("10001").status(NEW).build();
    }

    @Test
    @DisplayName("never scored leads are always written")
    void neverScored() {
        UpdatePlan plan = planner.plan(List.of(roofingLead("l1"), roofingLead("l2")), rates);

        assertEquals(2, plan.changedCount());
        assertEquals(2, plan.consideredCount());
        LeadUpdate update = plan.writes().get(0);
        assertEquals("l1", update.leadId());
        // 1.0*30 + 0.5*50
        assertEquals(55, update.leadScore());
        assertEquals(1.0, update.conversionRates().getService());
    }

    @Test
    @DisplayName("applying the plan and planning again yields no writes")
    void idempotent() {
        Lead lead = roofingLead("l1");
        LeadUpdate update = planner.plan(List.of(lead), rates).writes().get(0);
        lead.setConversionRates(update.conversionRates());
        lead.setLeadScore(update.leadScore());

        UpdatePlan second = planner.plan(List.of(lead), rates);

        assertTrue(second.writes().isEmpty());
        assertEquals(1, second.consideredCount());
    }

    @Test
    @DisplayName("a changed snapshot with the same score is still written")
    void snapshotDrift() {
        Lead lead = roofingLead("l1");
        lead.setLeadScore(55);
        lead.setConversionRates(new ConversionRateSnapshot(1.0, 0.0, 0.0, 0.0, 0.49));

        assertEquals(1, planner.plan(List.of(lead), rates).changedCount());
    }

    @Test
    @DisplayName("an unscored lead with an all-zero result is written once with score 0")
    void zeroScoreForNullScore() {
        Lead lead = aLead("l1").service("Plumbing").status(NEW).build();

        UpdatePlan plan = planner.plan(List.of(lead), rates);

        assertEquals(1, plan.changedCount());
        assertEquals(0, plan.writes().get(0).leadScore());
        assertEquals(ConversionRateSnapshot.zero(), plan.writes().get(0).conversionRates());
    }
}
