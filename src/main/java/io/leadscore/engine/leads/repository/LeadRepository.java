package io.leadscore.engine.leads.repository;

import io.leadscore.engine.exceptions.LeadNotFoundException;
import io.leadscore.engine.exceptions.ScoringPersistenceException;
import io.leadscore.engine.leads.model.ConversionRateSnapshot;
import io.leadscore.engine.leads.model.Lead;
import io.leadscore.engine.leads.model.dto.BulkWriteResult;
import io.leadscore.engine.leads.model.dto.LeadFilter;
import io.leadscore.engine.leads.model.dto.LeadUpdate;
import io.leadscore.engine.leads.model.dto.WriteFailure;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.util.*;

@JBossLog
@ApplicationScoped
public class LeadRepository implements PanacheRepositoryBase<Lead, String>, LeadStore {

    @Override
    public List<Lead> getLeadsByClientId(String clientId) {
        try {
            return list("clientId = ?1 and deleted = false", clientId);
        } catch (RuntimeException e) {
            throw new ScoringPersistenceException("Failed to load leads for client " + clientId, e);
        }
    }

    @Override
    public List<Lead> findLeads(LeadFilter filter) {
        filter.validate();
        Map<String, Object> params = new HashMap<>();
        String where = whereClause(filter, params);
        try {
            return list(where, params);
        } catch (RuntimeException e) {
            throw new ScoringPersistenceException("Failed to query leads for client " + filter.clientId(), e);
        }
    }

    @Override
    public BulkWriteResult bulkWrite(List<LeadUpdate> updates) {
        if (updates.isEmpty()) return BulkWriteResult.empty();

        int modified = 0;
        List<WriteFailure> failures = new ArrayList<>();
        for (LeadUpdate update : updates) {
            try {
                boolean written = QuarkusTransaction.requiringNew().call(() -> {
                    Lead lead = find("id = ?1 and deleted = false", update.leadId()).firstResult();
                    if (lead == null) return false;
                    lead.setConversionRates(update.conversionRates());
                    lead.setLeadScore(update.leadScore());
                    return true;
                });
                if (written) modified++;
                else failures.add(new WriteFailure(update.leadId(), "lead not found or deleted"));
            } catch (Exception e) {
                log.errorf(e, "[LeadRepository] Failed to write score for lead %s", update.leadId());
                failures.add(new WriteFailure(update.leadId(), e.getMessage()));
            }
        }
        return new BulkWriteResult(modified, failures);
    }

    @Override
    @Transactional
    public int updateMany(LeadFilter filter, ConversionRateSnapshot conversionRates, int leadScore) {
        filter.validate();
        Map<String, Object> params = new HashMap<>();
        String where = whereClause(filter, params);
        params.put("leadScore", leadScore);
        params.put("service", conversionRates.getService());
        params.put("adSetName", conversionRates.getAdSetName());
        params.put("adName", conversionRates.getAdName());
        params.put("leadDate", conversionRates.getLeadDate());
        params.put("zip", conversionRates.getZip());
        try {
            return update("leadScore = :leadScore, " +
                            "conversionRates.service = :service, " +
                            "conversionRates.adSetName = :adSetName, " +
                            "conversionRates.adName = :adName, " +
                            "conversionRates.leadDate = :leadDate, " +
                            "conversionRates.zip = :zip " +
                            "where " + where,
                    params);
        } catch (RuntimeException e) {
            throw new ScoringPersistenceException("Failed to update leads for client " + filter.clientId(), e);
        }
    }

    @Override
    public List<String> getDistinctClientIds() {
        try {
            return getEntityManager()
                    .createQuery("select distinct l.clientId from Lead l where l.deleted = false order by l.clientId", String.class)
                    .getResultList();
        } catch (RuntimeException e) {
            throw new ScoringPersistenceException("Failed to list client ids", e);
        }
    }

    @Override
    public Optional<Lead> findLead(String leadId) {
        return find("id = ?1 and deleted = false", leadId).firstResultOptional();
    }

    /**
     * Writes the status columns onto the current row. Snapshot and score are not touched,
     * so a scoring write that landed after {@code lead} was loaded is kept.
     */
    @Override
    @Transactional
    public Lead saveStatusChange(Lead lead) {
        Lead managed;
        try {
            managed = find("id = ?1 and deleted = false", lead.getId()).firstResult();
        } catch (RuntimeException e) {
            throw new ScoringPersistenceException("Failed to load lead " + lead.getId() + " for status update", e);
        }
        if (managed == null) {
            throw new LeadNotFoundException(lead.getId());
        }
        managed.setStatus(lead.getStatus());
        managed.setUnqualifiedLeadReason(lead.getUnqualifiedLeadReason());
        managed.setProposalAmount(lead.getProposalAmount());
        managed.setJobBookedAmount(lead.getJobBookedAmount());
        managed.getStatusHistory().clear();
        if (lead.getStatusHistory() != null) managed.getStatusHistory().putAll(lead.getStatusHistory());
        managed.setLastManualUpdate(lead.getLastManualUpdate());
        return managed;
    }

    /*
     * Lead dates are ISO strings, so day boundaries compare lexicographically:
     * "after D" means >= D+1 and "until D" means < D+1.
     */
    private static String whereClause(LeadFilter filter, Map<String, Object> params) {
        List<String> conditions = new ArrayList<>();
        conditions.add("deleted = false");
        conditions.add("clientId = :clientId");
        params.put("clientId", filter.clientId());

        if (filter.leadDateAfter() != null) {
            conditions.add("leadDate >= :fromDay");
            params.put("fromDay", filter.leadDateAfter().plusDays(1).toString());
        }
        if (filter.leadDateUntil() != null) {
            conditions.add("leadDate < :toDay");
            params.put("toDay", filter.leadDateUntil().plusDays(1).toString());
        }
        if (filter.ingestedAfter() != null) {
            conditions.add("ingestedAt > :ingestedAfter");
            params.put("ingestedAfter", filter.ingestedAfter());
        }
        if (filter.hasStatuses()) {
            conditions.add("status IN (:statuses)");
            params.put("statuses", filter.statuses());
        }
        return String.join(" AND ", conditions);
    }
}
