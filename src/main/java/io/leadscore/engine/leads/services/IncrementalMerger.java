package io.leadscore.engine.leads.services;

import io.leadscore.engine.leads.model.ConversionRate;
import io.leadscore.engine.leads.model.RateKey;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds the counters of a freshly aggregated batch onto the stored counters.
 *
 * Commutative and associative over disjoint batches, not idempotent: merging the same
 * batch twice counts it twice. Callers must hand every lead to exactly one batch.
 */
@ApplicationScoped
public class IncrementalMerger {

    /**
     * @param existing rows currently stored for the client
     * @param incoming rows aggregated from the new batch only
     * @return one row per key in either input; input rows are not modified
     */
    public List<ConversionRate> merge(List<ConversionRate> existing, List<ConversionRate> incoming) {
        Map<RateKey, ConversionRate> merged = new LinkedHashMap<>();
        for (ConversionRate row : existing) {
            merged.put(row.key(), row);
        }
        for (ConversionRate row : incoming) {
            ConversionRate current = merged.get(row.key());
            merged.put(row.key(), current == null ? copyOf(row) : sum(current, row));
        }
        return new ArrayList<>(merged.values());
    }

    private static ConversionRate sum(ConversionRate current, ConversionRate addition) {
        ConversionRate row = new ConversionRate(
                current.getClientId(),
                current.getKeyField(),
                current.getKeyName(),
                current.getPastTotalEst() + addition.getPastTotalEst(),
                current.getPastTotalCount() + addition.getPastTotalCount());
        row.setId(current.getId());
        row.setCreated(current.getCreated());
        row.setLastBatchId(addition.getLastBatchId());
        return row;
    }

    private static ConversionRate copyOf(ConversionRate source) {
        ConversionRate row = new ConversionRate(
                source.getClientId(),
                source.getKeyField(),
                source.getKeyName(),
                source.getPastTotalEst(),
                source.getPastTotalCount());
        row.setLastBatchId(source.getLastBatchId());
        return row;
    }
}
