package io.leadscore.engine.leads.model.dto;

/**
 * @param total      rows inserted plus rows whose values actually changed
 * @param newInserts rows that did not exist before
 * @param updated    existing rows whose counters or rate changed
 */
public record UpsertStats(int total, int newInserts, int updated) {

    public static UpsertStats none() {
        return new UpsertStats(0, 0, 0);
    }
}
