package io.leadscore.engine.leads.jobs;

import io.leadscore.engine.config.LeadScoringConfig;
import io.leadscore.engine.leads.model.ScoringJobLog;
import io.leadscore.engine.leads.model.dto.FleetSyncResult;
import io.leadscore.engine.leads.model.enums.JobStatus;
import io.leadscore.engine.leads.repository.ScoringJobLogRepository;
import io.leadscore.engine.leads.services.ScoringOrchestrator;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Weekly conversion rate sync for every client, logged to scoring_job_log.
 */
@JBossLog
@ApplicationScoped
public class ConversionRateSyncJob {

    static final String JOB_NAME = "conversion-rate-sync";

    @Inject
    ScoringOrchestrator orchestrator;

    @Inject
    ScoringJobLogRepository jobLogRepository;

    @Inject
    LeadScoringConfig config;

    @Scheduled(cron = "{leadscore.sync.cron}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledSync() {
        if (!config.sync().enabled()) {
            log.info("[CR Sync] Scheduled sync is disabled");
            return;
        }
        runSync();
    }

    /**
     * Runs the sync now, regardless of the enabled flag.
     */
    public FleetSyncResult runSync() {
        String executionId = UUID.randomUUID().toString();
        ScoringJobLog entry = jobLogRepository.start(new ScoringJobLog(JOB_NAME, executionId, LocalDateTime.now()));
        log.infof("[CR Sync] Starting execution %s", executionId);

        try {
            FleetSyncResult result = orchestrator.fleetWideIncrementalSync();
            entry.setStatus(result.errors().isEmpty() ? JobStatus.SUCCESS : JobStatus.FAILURE);
            entry.setProcessedCount(result.processedClients());
            entry.setDetails(String.format("clients=%d, rates=%d, leads=%d, errors=%d",
                    result.processedClients(), result.totalUpdatedRates(), result.totalUpdatedLeads(), result.errors().size()));
            if (!result.errors().isEmpty()) {
                entry.setError(String.join("\n", result.errors()));
            }
            log.infof("[CR Sync] Execution %s finished: %s", executionId, entry.getDetails());
            return result;
        } catch (RuntimeException e) {
            log.errorf(e, "[CR Sync] Execution %s failed", executionId);
            entry.setStatus(JobStatus.FAILURE);
            entry.setError(e.getMessage());
            throw e;
        } finally {
            entry.setFinishedAt(LocalDateTime.now());
            jobLogRepository.finish(entry);
        }
    }
}
