package io.leadscore.engine.leads.repository;

import io.leadscore.engine.leads.model.ConversionRateSnapshot;
import io.leadscore.engine.leads.model.Lead;
import io.leadscore.engine.leads.model.dto.BulkWriteResult;
import io.leadscore.engine.leads.model.dto.LeadFilter;
import io.leadscore.engine.leads.model.dto.LeadUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Lead persistence as seen by the scoring engine. Soft-deleted leads are invisible through every method.
 */
public interface LeadStore {

    List<Lead> getLeadsByClientId(String clientId);

    List<Lead> findLeads(LeadFilter filter);

    /**
     * Applies each update independently. Rows that fail are reported in the result, the rest are kept.
     */
    BulkWriteResult bulkWrite(List<LeadUpdate> updates);

    /**
     * Sets the same snapshot and score on every lead matching the filter.
     *
     * @return number of leads modified
     */
    int updateMany(LeadFilter filter, ConversionRateSnapshot conversionRates, int leadScore);

    List<String> getDistinctClientIds();

    Optional<Lead> findLead(String leadId);

    /**
     * Persists the status, reason, amounts, status history and lastManualUpdate of {@code lead}.
     * Other columns keep their stored values.
     */
    Lead saveStatusChange(Lead lead);
}
