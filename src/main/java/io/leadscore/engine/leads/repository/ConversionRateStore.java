package io.leadscore.engine.leads.repository;

import io.leadscore.engine.leads.model.ConversionRate;
import io.leadscore.engine.leads.model.dto.RateFilter;
import io.leadscore.engine.leads.model.dto.UpsertStats;

import java.util.List;

public interface ConversionRateStore {

    List<ConversionRate> getRates(RateFilter filter);

    /**
     * Inserts or replaces rows keyed by (clientId, keyField, keyName).
     * Rows whose values did not change are not counted as updated.
     */
    UpsertStats batchUpsert(List<ConversionRate> rows);
}
