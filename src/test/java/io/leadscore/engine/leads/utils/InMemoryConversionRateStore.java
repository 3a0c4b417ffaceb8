package io.leadscore.engine.leads.utils;

import io.leadscore.engine.exceptions.ScoringPersistenceException;
import io.leadscore.engine.leads.model.ConversionRate;
import io.leadscore.engine.leads.model.RateKey;
import io.leadscore.engine.leads.model.dto.RateFilter;
import io.leadscore.engine.leads.model.dto.UpsertStats;
import io.leadscore.engine.leads.repository.ConversionRateStore;

import java.util.*;

/**
 * Rate store with the same upsert counting as the Panache repository.
 */
public class InMemoryConversionRateStore implements ConversionRateStore {

    private final Map<String, Map<RateKey, ConversionRate>> rows = new HashMap<>();
    private long nextId = 1;

    public int upsertCalls;
    public boolean failUpserts;

    public synchronized InMemoryConversionRateStore add(ConversionRate... added) {
        for (ConversionRate row : added) {
            ConversionRate stored = copyOf(row);
            stored.setId(nextId++);
            rows.computeIfAbsent(row.getClientId(), id -> new LinkedHashMap<>()).put(row.key(), stored);
        }
        return this;
    }

    public synchronized Optional<ConversionRate> get(String clientId, RateKey key) {
        return Optional.ofNullable(rows.getOrDefault(clientId, Map.of()).get(key)).map(InMemoryConversionRateStore::copyOf);
    }

    public synchronized int size(String clientId) {
        return rows.getOrDefault(clientId, Map.of()).size();
    }

    @Override
    public synchronized List<ConversionRate> getRates(RateFilter filter) {
        filter.validate();
        return rows.getOrDefault(filter.clientId(), Map.of()).values().stream()
                .filter(r -> filter.keyField() == null || filter.keyField() == r.getKeyField())
                .map(InMemoryConversionRateStore::copyOf)
                .toList();
    }

    @Override
    public synchronized UpsertStats batchUpsert(List<ConversionRate> upserts) {
        upsertCalls++;
        if (failUpserts) {
            throw new ScoringPersistenceException("Failed to upsert conversion rates");
        }
        int inserts = 0;
        int updated = 0;
        for (ConversionRate row : upserts) {
            Map<RateKey, ConversionRate> clientRows = rows.computeIfAbsent(row.getClientId(), id -> new LinkedHashMap<>());
            ConversionRate stored = clientRows.get(row.key());
            if (stored == null) {
                ConversionRate insert = copyOf(row);
                insert.setId(nextId++);
                clientRows.put(row.key(), insert);
                inserts++;
                continue;
            }
            if (row.getLastBatchId() != null) stored.setLastBatchId(row.getLastBatchId());
            if (stored.sameValues(row)) continue;
            stored.setPastTotalEst(row.getPastTotalEst());
            stored.setPastTotalCount(row.getPastTotalCount());
            stored.setConversionRate(ConversionRate.rateOf(row.getPastTotalEst(), row.getPastTotalCount()));
            updated++;
        }
        return new UpsertStats(inserts + updated, inserts, updated);
    }

    private static ConversionRate copyOf(ConversionRate row) {
        ConversionRate copy = new ConversionRate(row.getClientId(), row.getKeyField(), row.getKeyName(),
                row.getPastTotalEst(), row.getPastTotalCount());
        copy.setId(row.getId());
        copy.setLastBatchId(row.getLastBatchId());
        copy.setCreated(row.getCreated());
        copy.setUpdated(row.getUpdated());
        return copy;
    }
}
