package io.leadscore.engine.leads.services;

import io.leadscore.engine.config.LeadScoringConfig;
import io.leadscore.engine.exceptions.ScoringValidationException;
import io.leadscore.engine.leads.model.ConversionRate;
import io.leadscore.engine.leads.model.ConversionRateSnapshot;
import io.leadscore.engine.leads.model.Lead;
import io.leadscore.engine.leads.model.RateKey;
import io.leadscore.engine.leads.model.ScoringWatermark;
import io.leadscore.engine.leads.model.dto.*;
import io.leadscore.engine.leads.repository.ConversionRateStore;
import io.leadscore.engine.leads.repository.LeadStore;
import io.leadscore.engine.leads.repository.ScoringWatermarkStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Runs the scoring pipelines for a client.
 *
 * Full recompute:   leads -> aggregate -> upsert -> read rates -> plan -> bulk write
 * Incremental:      batch -> aggregate -> merge with stored rates -> upsert -> re-score all leads -> bulk write
 * Fleet-wide sync:  incremental (or a bootstrap full recompute) for every client, one client at a time
 *
 * Every pipeline runs under the client's lock. Failing to load the client's leads or rates up front
 * throws; anything that fails after that is reported in the result's errors.
 */
@JBossLog
@ApplicationScoped
public class ScoringOrchestrator {

    static final String FULL_BATCH_PREFIX = "full:";

    @Inject
    LeadStore leadStore;

    @Inject
    ConversionRateStore rateStore;

    @Inject
    ScoringWatermarkStore watermarkStore;

    @Inject
    ConversionRateAggregator aggregator;

    @Inject
    IncrementalMerger merger;

    @Inject
    BulkUpdatePlanner planner;

    @Inject
    ClientJobLocks locks;

    @Inject
    LeadScoringConfig config;

    @Inject
    MeterRegistry registry;

    public ScoringResult fullRecompute(String clientId) {
        requireClientId(clientId);
        return locks.withClientLock(clientId, () -> registry.timer("leadscore.pipeline.duration", "pipeline", "full")
                .record(() -> runFullRecompute(clientId)));
    }

    public ScoringResult weeklyIncrementalUpdate(String clientId, List<Lead> newLeads) {
        return weeklyIncrementalUpdate(clientId, newLeads, null);
    }

    /**
     * @param batchId identifies the batch; a batch id equal to the last one applied for the client is skipped
     */
    public ScoringResult weeklyIncrementalUpdate(String clientId, List<Lead> newLeads, String batchId) {
        requireClientId(clientId);
        if (newLeads == null || newLeads.isEmpty()) {
            return ScoringResult.empty(clientId);
        }
        return locks.withClientLock(clientId, () -> registry.timer("leadscore.pipeline.duration", "pipeline", "incremental")
                .record(() -> runIncremental(clientId, newLeads, batchId, null)));
    }

    public FleetSyncResult fleetWideIncrementalSync() {
        List<String> clientIds = leadStore.getDistinctClientIds();
        log.infof("[Fleet Sync] Starting sync for %d clients", clientIds.size());

        int totalUpdatedRates = 0;
        int totalUpdatedLeads = 0;
        List<String> errors = new ArrayList<>();
        for (String clientId : clientIds) {
            long started = System.currentTimeMillis();
            try {
                ScoringResult result = locks.withClientLock(clientId, () -> syncClient(clientId));
                totalUpdatedRates += result.updatedConversionRates();
                totalUpdatedLeads += result.updatedLeads();
                errors.addAll(result.errors());
                log.infof("[Fleet Sync] Client %s done in %d ms: %d rates, %d leads updated, %d errors",
                        clientId, System.currentTimeMillis() - started,
                        result.updatedConversionRates(), result.updatedLeads(), result.errors().size());
            } catch (Exception e) {
                log.errorf(e, "[Fleet Sync] Client %s failed", clientId);
                errors.add(String.format("Client %s: sync failed: %s", clientId, e.getMessage()));
                registry.counter("leadscore.sync.client.failures").increment();
            }
        }

        log.infof("[Fleet Sync] Finished: %d clients, %d rates, %d leads updated, %d errors",
                clientIds.size(), totalUpdatedRates, totalUpdatedLeads, errors.size());
        return new FleetSyncResult(clientIds.size(), totalUpdatedRates, totalUpdatedLeads, errors);
    }

    /**
     * Re-scores every lead of the client from the stored rate table, without aggregating.
     * A client without any rate rows gets score 0 and an all-zero snapshot on every lead.
     */
    public RecalculateResult recalculateLeadScores(String clientId) {
        requireClientId(clientId);
        return locks.withClientLock(clientId, () -> {
            List<Lead> leads = leadStore.getLeadsByClientId(clientId);
            if (leads.isEmpty()) {
                return new RecalculateResult(0, 0, List.of());
            }
            List<ConversionRate> rates = rateStore.getRates(RateFilter.byClient(clientId));
            if (rates.isEmpty()) {
                int modified = leadStore.updateMany(LeadFilter.byClient(clientId), ConversionRateSnapshot.zero(), 0);
                log.infof("[Recalculate] Client %s has no conversion rates, reset %d leads to score 0", clientId, modified);
                return new RecalculateResult(leads.size(), modified, List.of());
            }

            List<String> errors = new ArrayList<>();
            int updated = writeScores(clientId, leads, RateTable.of(rates), errors);
            log.infof("[Recalculate] Client %s: %d of %d leads re-scored", clientId, updated, leads.size());
            return new RecalculateResult(leads.size(), updated, errors);
        });
    }

    /**
     * The batch is every lead stored after the watermark, whatever its leadDate says.
     * The watermark moves to the newest ingestion stamp in the batch, never to the clock.
     */
    private ScoringResult syncClient(String clientId) {
        Optional<ScoringWatermark> watermark = watermarkStore.findByClientId(clientId);
        if (watermark.isEmpty() || watermark.get().getLastIngestedAt() == null) {
            log.infof("[Fleet Sync] Client %s has no watermark, bootstrapping with a full recompute", clientId);
            return fullRecompute(clientId);
        }

        Instant from = watermark.get().getLastIngestedAt();
        List<Lead> newLeads = leadStore.findLeads(LeadFilter.ingestedAfter(clientId, from));
        if (newLeads.isEmpty()) {
            return ScoringResult.empty(clientId);
        }
        Instant to = latestIngestion(newLeads, from);
        String batchId = clientId + ":" + from + ".." + to;
        return runIncremental(clientId, newLeads, batchId, to);
    }

    private ScoringResult runFullRecompute(String clientId) {
        List<Lead> leads = leadStore.getLeadsByClientId(clientId);
        if (leads.isEmpty()) {
            log.infof("[Full Recompute] Client %s has no leads", clientId);
            return ScoringResult.empty(clientId);
        }

        String batchId = FULL_BATCH_PREFIX + LocalDate.now(zone());
        // leads without a stamp are counted here only
        Instant coveredUntil = latestIngestion(leads, Instant.EPOCH);
        AggregationResult aggregation = aggregator.aggregate(leads, clientId);
        aggregation.rates().forEach(row -> row.setLastBatchId(batchId));

        List<String> errors = new ArrayList<>();
        UpsertStats stats;
        try {
            stats = rateStore.batchUpsert(aggregation.rates());
        } catch (Exception e) {
            log.errorf(e, "[Full Recompute] Failed to store conversion rates for client %s", clientId);
            errors.add(String.format("Client %s: failed to store conversion rates: %s", clientId, e.getMessage()));
            return new ScoringResult(clientId, 0, 0, leads.size(), errors, aggregation.warnings(), UpsertStats.none());
        }
        saveWatermark(clientId, coveredUntil, batchId, errors);

        int updatedLeads = rescoreFromStore(clientId, leads, errors);
        registry.counter("leadscore.leads.updated", "pipeline", "full").increment(updatedLeads);
        log.infof("[Full Recompute] Client %s: %d rates (%d new, %d changed), %d of %d leads updated",
                clientId, stats.total(), stats.newInserts(), stats.updated(), updatedLeads, leads.size());
        return new ScoringResult(clientId, stats.total(), updatedLeads, leads.size(), errors, aggregation.warnings(), stats);
    }

    private ScoringResult runIncremental(String clientId, List<Lead> newLeads, String batchId, Instant coveredUntil) {
        Optional<ScoringWatermark> watermark = watermarkStore.findByClientId(clientId);
        if (batchId != null && watermark.map(w -> batchId.equals(w.getLastBatchId())).orElse(false)) {
            log.warnf("[Incremental] Client %s: batch %s was already applied, skipping", clientId, batchId);
            return ScoringResult.skipped(clientId, "Batch " + batchId + " was already applied");
        }

        AggregationResult aggregation = aggregator.aggregate(newLeads, clientId);
        aggregation.rates().forEach(row -> row.setLastBatchId(batchId));
        List<ConversionRate> existing = rateStore.getRates(RateFilter.byClient(clientId));
        Set<RateKey> touched = aggregation.rates().stream().map(ConversionRate::key).collect(Collectors.toSet());
        List<ConversionRate> changedRows = merger.merge(existing, aggregation.rates()).stream()
                .filter(row -> touched.contains(row.key()))
                .toList();

        List<String> errors = new ArrayList<>();
        UpsertStats stats;
        try {
            stats = rateStore.batchUpsert(changedRows);
        } catch (Exception e) {
            log.errorf(e, "[Incremental] Failed to store merged conversion rates for client %s", clientId);
            errors.add(String.format("Client %s: failed to store merged conversion rates: %s", clientId, e.getMessage()));
            return new ScoringResult(clientId, 0, 0, newLeads.size(), errors, aggregation.warnings(), UpsertStats.none());
        }
        if (batchId != null || coveredUntil != null) {
            // a caller-supplied batch does not move the ingestion watermark
            Instant processed = coveredUntil != null
                    ? coveredUntil
                    : watermark.map(ScoringWatermark::getLastIngestedAt).orElse(null);
            saveWatermark(clientId, processed, batchId, errors);
        }

        // the rate table changed, so any lead of the client may map to a new rate
        List<Lead> allLeads;
        try {
            allLeads = leadStore.getLeadsByClientId(clientId);
        } catch (Exception e) {
            log.errorf(e, "[Incremental] Failed to load leads for re-scoring client %s", clientId);
            errors.add(String.format("Client %s: failed to load leads for re-scoring: %s", clientId, e.getMessage()));
            return new ScoringResult(clientId, stats.total(), 0, newLeads.size(), errors, aggregation.warnings(), stats);
        }

        int updatedLeads = rescoreFromStore(clientId, allLeads, errors);
        registry.counter("leadscore.leads.updated", "pipeline", "incremental").increment(updatedLeads);
        log.infof("[Incremental] Client %s: batch of %d leads, %d rates (%d new, %d changed), %d of %d leads updated",
                clientId, newLeads.size(), stats.total(), stats.newInserts(), stats.updated(), updatedLeads, allLeads.size());
        return new ScoringResult(clientId, stats.total(), updatedLeads, allLeads.size(), errors, aggregation.warnings(), stats);
    }

    private int rescoreFromStore(String clientId, List<Lead> leads, List<String> errors) {
        List<ConversionRate> stored;
        try {
            stored = rateStore.getRates(RateFilter.byClient(clientId));
        } catch (Exception e) {
            log.errorf(e, "[Scoring] Failed to read back conversion rates for client %s", clientId);
            errors.add(String.format("Client %s: failed to read conversion rates: %s", clientId, e.getMessage()));
            return 0;
        }
        return writeScores(clientId, leads, RateTable.of(stored), errors);
    }

    private int writeScores(String clientId, List<Lead> leads, RateTable rateTable, List<String> errors) {
        UpdatePlan plan = planner.plan(leads, rateTable, ScoringWeights.from(config.weights()));
        if (plan.writes().isEmpty()) return 0;

        BulkWriteResult result;
        try {
            result = leadStore.bulkWrite(plan.writes());
        } catch (Exception e) {
            log.errorf(e, "[Scoring] Bulk write of %d leads failed for client %s", plan.changedCount(), clientId);
            errors.add(String.format("Client %s: bulk write of %d leads failed: %s", clientId, plan.changedCount(), e.getMessage()));
            return 0;
        }
        for (WriteFailure failure : result.failures()) {
            errors.add(String.format("Client %s: lead %s not updated: %s", clientId, failure.leadId(), failure.message()));
        }
        if (result.isPartialFailure()) {
            log.warnf("[Scoring] Client %s: %d of %d lead writes failed",
                    clientId, result.failures().size(), plan.changedCount());
        }
        return result.modifiedCount();
    }

    private static Instant latestIngestion(List<Lead> leads, Instant floor) {
        return leads.stream()
                .map(Lead::getIngestedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .filter(latest -> latest.isAfter(floor))
                .orElse(floor);
    }

    private void saveWatermark(String clientId, Instant ingestedUntil, String batchId, List<String> errors) {
        try {
            watermarkStore.save(new ScoringWatermark(clientId, ingestedUntil, batchId, null));
        } catch (Exception e) {
            log.errorf(e, "[Scoring] Failed to save watermark for client %s", clientId);
            errors.add(String.format("Client %s: failed to save watermark: %s", clientId, e.getMessage()));
        }
    }

    private ZoneId zone() {
        return ZoneId.of(config.timezone());
    }

    private static void requireClientId(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            throw new ScoringValidationException("clientId is required");
        }
    }
}
