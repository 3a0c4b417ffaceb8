package io.leadscore.engine.leads.repository;

import io.leadscore.engine.exceptions.ScoringPersistenceException;
import io.leadscore.engine.leads.model.ConversionRate;
import io.leadscore.engine.leads.model.RateKey;
import io.leadscore.engine.leads.model.dto.RateFilter;
import io.leadscore.engine.leads.model.dto.UpsertStats;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

@JBossLog
@ApplicationScoped
public class ConversionRateRepository implements PanacheRepositoryBase<ConversionRate, Long>, ConversionRateStore {

    @Override
    public List<ConversionRate> getRates(RateFilter filter) {
        filter.validate();
        try {
            if (filter.keyField() == null) {
                return list("clientId = ?1", filter.clientId());
            }
            return list("clientId = ?1 and keyField = ?2", filter.clientId(), filter.keyField());
        } catch (RuntimeException e) {
            throw new ScoringPersistenceException("Failed to load conversion rates for client " + filter.clientId(), e);
        }
    }

    @Override
    @Transactional
    public UpsertStats batchUpsert(List<ConversionRate> rows) {
        if (rows.isEmpty()) return UpsertStats.none();

        Set<String> clientIds = rows.stream().map(ConversionRate::getClientId).collect(Collectors.toSet());
        Map<String, Map<RateKey, ConversionRate>> existing = new HashMap<>();
        try {
            for (ConversionRate stored : list("clientId in ?1", clientIds)) {
                existing.computeIfAbsent(stored.getClientId(), id -> new HashMap<>()).put(stored.key(), stored);
            }
        } catch (RuntimeException e) {
            throw new ScoringPersistenceException("Failed to load conversion rates for upsert", e);
        }

        LocalDateTime now = LocalDateTime.now();
        int newInserts = 0;
        int updated = 0;
        try {
            for (ConversionRate row : rows) {
                ConversionRate stored = existing.getOrDefault(row.getClientId(), Map.of()).get(row.key());
                if (stored == null) {
                    ConversionRate insert = new ConversionRate(row.getClientId(), row.getKeyField(), row.getKeyName(),
                            row.getPastTotalEst(), row.getPastTotalCount());
                    insert.setLastBatchId(row.getLastBatchId());
                    insert.setCreated(now);
                    insert.setUpdated(now);
                    persist(insert);
                    newInserts++;
                    continue;
                }
                if (row.getLastBatchId() != null) stored.setLastBatchId(row.getLastBatchId());
                if (stored.sameValues(row)) continue;

                stored.setPastTotalEst(row.getPastTotalEst());
                stored.setPastTotalCount(row.getPastTotalCount());
                stored.setConversionRate(ConversionRate.rateOf(row.getPastTotalEst(), row.getPastTotalCount()));
                stored.setUpdated(now);
                updated++;
            }
        } catch (RuntimeException e) {
            throw new ScoringPersistenceException("Failed to upsert conversion rates", e);
        }

        log.debugf("[ConversionRateRepository] Upserted %d rows: %d new, %d changed", rows.size(), newInserts, updated);
        return new UpsertStats(newInserts + updated, newInserts, updated);
    }
}
