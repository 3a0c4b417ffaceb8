package io.leadscore.engine.leads.services;

import io.leadscore.engine.leads.model.ConversionRate;
import io.leadscore.engine.leads.model.RateKey;
import io.leadscore.engine.leads.model.enums.KeyField;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Read-only lookup of a client's stored conversion rates by (key field, key name).
 */
public final class RateTable {

    private final Map<RateKey, Double> rates;

    private RateTable(Map<RateKey, Double> rates) {
        this.rates = rates;
    }

    public static RateTable of(Collection<ConversionRate> rows) {
        Map<RateKey, Double> map = new HashMap<>(rows.size() * 2);
        for (ConversionRate row : rows) {
            map.put(row.key(), row.getConversionRate());
        }
        return new RateTable(map);
    }

    public static RateTable of(Map<RateKey, Double> rates) {
        return new RateTable(new HashMap<>(rates));
    }

    /**
     * Stored rate, or 0 when the key is unknown or the key name is empty.
     */
    public double rateFor(KeyField field, String keyName) {
        if (keyName == null || keyName.isBlank()) return 0.0;
        return rates.getOrDefault(new RateKey(field, keyName), 0.0);
    }

    public boolean isEmpty() {
        return rates.isEmpty();
    }

    public int size() {
        return rates.size();
    }
}
