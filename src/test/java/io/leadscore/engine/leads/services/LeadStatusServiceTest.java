package io.leadscore.engine.leads.services;

import io.leadscore.engine.exceptions.ConversionEventException;
import io.leadscore.engine.exceptions.LeadNotFoundException;
import io.leadscore.engine.exceptions.ScoringValidationException;
import io.leadscore.engine.leads.events.ConversionEventNotifier;
import io.leadscore.engine.leads.model.ConversionRateSnapshot;
import io.leadscore.engine.leads.model.Lead;
import io.leadscore.engine.leads.model.dto.ConversionEvent;
import io.leadscore.engine.leads.model.dto.LeadUpdate;
import io.leadscore.engine.leads.model.dto.StatusChange;
import io.leadscore.engine.leads.model.dto.StatusUpdateResult;
import io.leadscore.engine.leads.utils.InMemoryLeadStore;
import io.leadscore.engine.leads.utils.TestScoringConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static io.leadscore.engine.leads.model.enums.LeadStatus.*;
import static io.leadscore.engine.leads.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeadStatusService")
class LeadStatusServiceTest {

    @Mock
    private ConversionEventNotifier notifier;

    private InMemoryLeadStore leadStore;
    private TestScoringConfig config;
    private LeadStatusService service;

    @BeforeEach
    void setUp() {
        leadStore = new InMemoryLeadStore();
        config = new TestScoringConfig().withPixel(CLIENT_ID, "pixel-1", "token-1");
        service = new LeadStatusService();
        service.leadStore = leadStore;
        service.notifier = notifier;
        service.config = config;
    }

    @Nested
    @DisplayName("Monetary fields and reasons")
    class MonetaryRules {

        @Test
        @DisplayName("marking an estimate unqualified zeroes the amounts and stores the reason")
        void estimateToUnqualified() {
            leadStore.add(aLead("l1").status(ESTIMATE_SET).proposalAmount(12000).build());

            StatusUpdateResult result = service.updateStatus("l1", StatusChange.unqualified("no budget"));

            Lead stored = leadStore.get("l1");
            assertEquals(UNQUALIFIED, stored.getStatus());
            assertEquals(0.0, stored.getProposalAmount());
            assertEquals(0.0, stored.getJobBookedAmount());
            assertEquals("no budget", stored.getUnqualifiedLeadReason());
            assertEquals(ESTIMATE_SET, result.previousStatus());
            assertTrue(result.statusChanged());
        }

        @Test
        @DisplayName("leaving unqualified clears the reason")
        void leavingUnqualified() {
            leadStore.add(aLead("l1").status(UNQUALIFIED).unqualifiedLeadReason("no budget").build());

            service.updateStatus("l1", StatusChange.to(IN_PROGRESS));

            assertNull(leadStore.get("l1").getUnqualifiedLeadReason());
        }

        @Test
        @DisplayName("leaving job_booked zeroes the booked amount but keeps the proposal")
        void leavingJobBooked() {
            leadStore.add(aLead("l1").status(JOB_BOOKED).proposalAmount(9000).jobBookedAmount(8500).build());

            service.updateStatus("l1", StatusChange.to(PROPOSAL_PRESENTED));

            Lead stored = leadStore.get("l1");
            assertEquals(9000.0, stored.getProposalAmount());
            assertEquals(0.0, stored.getJobBookedAmount());
        }

        @Test
        @DisplayName("amounts on a permitting status are stored")
        void storesAmounts() {
            leadStore.add(aLead("l1").status(PROPOSAL_PRESENTED).build());

            service.updateStatus("l1", new StatusChange(JOB_BOOKED, null, 10000.0, 9500.0));

            Lead stored = leadStore.get("l1");
            assertEquals(10000.0, stored.getProposalAmount());
            assertEquals(9500.0, stored.getJobBookedAmount());
        }

        @Test
        @DisplayName("an amount the status does not permit is rejected")
        void rejectsForbiddenAmount() {
            leadStore.add(aLead("l1").status(NEW).build());

            assertThrows(ScoringValidationException.class,
                    () -> service.updateStatus("l1", new StatusChange(ESTIMATE_SET, null, null, 500.0)));
            assertThrows(ScoringValidationException.class,
                    () -> service.updateStatus("l1", new StatusChange(JOB_LOST, null, 500.0, null)));
            assertEquals(0, leadStore.saveCalls);
        }

        @Test
        @DisplayName("negative amounts are rejected")
        void rejectsNegativeAmount() {
            assertThrows(ScoringValidationException.class,
                    () -> service.updateStatus("l1", new StatusChange(JOB_BOOKED, null, -1.0, null)));
        }

        @Test
        @DisplayName("unqualified without a reason is rejected")
        void unqualifiedNeedsReason() {
            assertThrows(ScoringValidationException.class,
                    () -> service.updateStatus("l1", StatusChange.unqualified("  ")));
            assertThrows(ScoringValidationException.class,
                    () -> service.updateStatus("l1", StatusChange.to(UNQUALIFIED)));
        }

        @Test
        @DisplayName("a missing status is rejected")
        void missingStatus() {
            assertThrows(ScoringValidationException.class,
                    () -> service.updateStatus("l1", new StatusChange(null, null, null, null)));
        }

        @Test
        @DisplayName("an unknown lead is not found")
        void unknownLead() {
            assertThrows(LeadNotFoundException.class, () -> service.updateStatus("missing", StatusChange.to(NEW)));
        }

        @Test
        @DisplayName("a deleted lead is not found")
        void deletedLead() {
            leadStore.add(aLead("l1").deleted(true).deletedAt(Instant.now()).build());

            assertThrows(LeadNotFoundException.class, () -> service.updateStatus("l1", StatusChange.to(NEW)));
        }
    }

    @Nested
    @DisplayName("Status history")
    class History {

        @Test
        @DisplayName("a real change records the new status")
        void recordsChange() {
            leadStore.add(aLead("l1").status(NEW).build());

            service.updateStatus("l1", StatusChange.to(IN_PROGRESS));

            Lead stored = leadStore.get("l1");
            assertTrue(stored.getStatusHistory().containsKey(IN_PROGRESS));
            assertNotNull(stored.getLastManualUpdate());
        }

        @Test
        @DisplayName("re-applying the current status leaves the history untouched")
        void reapplyKeepsHistory() {
            Instant earlier = Instant.parse("2024-01-01T00:00:00Z");
            Lead lead = aLead("l1").status(ESTIMATE_SET).build();
            lead.getStatusHistory().put(ESTIMATE_SET, earlier);
            leadStore.add(lead);

            StatusUpdateResult result = service.updateStatus("l1", new StatusChange(ESTIMATE_SET, null, 750.0, null));

            Lead stored = leadStore.get("l1");
            assertFalse(result.statusChanged());
            assertEquals(earlier, stored.getStatusHistory().get(ESTIMATE_SET));
            assertEquals(750.0, stored.getProposalAmount());
        }
    }

    @Nested
    @DisplayName("Conversion events")
    class ConversionEvents {

        @Test
        @DisplayName("booking a job twice sends one event")
        void jobBookedTwice() {
            leadStore.add(aLead("l1").status(PROPOSAL_PRESENTED).build());

            StatusUpdateResult first = service.updateStatus("l1", StatusChange.to(JOB_BOOKED));
            StatusUpdateResult second = service.updateStatus("l1", StatusChange.to(JOB_BOOKED));

            assertTrue(first.conversionEventSent());
            assertFalse(second.conversionEventSent());
            ArgumentCaptor<ConversionEvent> captor = ArgumentCaptor.forClass(ConversionEvent.class);
            verify(notifier, times(1)).send(captor.capture());
            ConversionEvent event = captor.getValue();
            assertEquals("pixel-1", event.pixelId());
            assertEquals("token-1", event.pixelToken());
            assertEquals("l1", event.leadId());
            assertEquals("l1@example.com", event.email());
        }

        @Test
        @DisplayName("other transitions send nothing")
        void otherTransitions() {
            leadStore.add(aLead("l1").status(NEW).build());

            service.updateStatus("l1", StatusChange.to(ESTIMATE_SET));

            verifyNoInteractions(notifier);
        }

        @Test
        @DisplayName("a client without pixel credentials is skipped with a warning")
        void missingCredentials() {
            leadStore.add(aLead("o1").clientId(OTHER_CLIENT_ID).status(PROPOSAL_PRESENTED).build());

            StatusUpdateResult result = service.updateStatus("o1", StatusChange.to(JOB_BOOKED));

            assertFalse(result.conversionEventSent());
            assertEquals(1, result.warnings().size());
            assertEquals(JOB_BOOKED, leadStore.get("o1").getStatus());
            verifyNoInteractions(notifier);
        }

        @Test
        @DisplayName("disabled conversion events send nothing")
        void disabled() {
            config.conversionEventsEnabled = false;
            leadStore.add(aLead("l1").status(PROPOSAL_PRESENTED).build());

            StatusUpdateResult result = service.updateStatus("l1", StatusChange.to(JOB_BOOKED));

            assertFalse(result.conversionEventSent());
            assertTrue(result.warnings().isEmpty());
            verifyNoInteractions(notifier);
        }

        @Test
        @DisplayName("a failed event aborts the status change")
        void failureAborts() {
            leadStore.add(aLead("l1").status(PROPOSAL_PRESENTED).build());
            doThrow(new ConversionEventException("boom", null)).when(notifier).send(any());

            assertThrows(ConversionEventException.class, () -> service.updateStatus("l1", StatusChange.to(JOB_BOOKED)));

            assertEquals(PROPOSAL_PRESENTED, leadStore.get("l1").getStatus());
            assertEquals(0, leadStore.saveCalls);
        }

        @Test
        @DisplayName("a score written while the status update is in flight survives the save")
        void concurrentScoreWriteKept() {
            ConversionRateSnapshot stale = new ConversionRateSnapshot(0.1, 0.1, 0.1, 0.1, 0.1);
            leadStore.add(aLead("l1").status(PROPOSAL_PRESENTED).conversionRates(stale).leadScore(10).build());
            ConversionRateSnapshot fresh = new ConversionRateSnapshot(0.8, 0.6, 0.5, 0.7, 0.9);
            doAnswer(invocation -> leadStore.bulkWrite(List.of(new LeadUpdate("l1", fresh, 72))))
                    .when(notifier).send(any());

            StatusUpdateResult result = service.updateStatus("l1", new StatusChange(JOB_BOOKED, null, 10000.0, 9500.0));

            Lead stored = leadStore.get("l1");
            assertEquals(JOB_BOOKED, stored.getStatus());
            assertEquals(9500.0, stored.getJobBookedAmount());
            assertEquals(72, stored.getLeadScore());
            assertEquals(0.8, stored.getConversionRates().getService());
            assertEquals(0.9, stored.getConversionRates().getZip());
            assertEquals(72, result.lead().getLeadScore());
        }
    }
}
