package io.leadscore.engine.leads.utils;

import io.leadscore.engine.leads.model.ScoringWatermark;
import io.leadscore.engine.leads.repository.ScoringWatermarkStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryWatermarkStore implements ScoringWatermarkStore {

    private final Map<String, ScoringWatermark> watermarks = new HashMap<>();

    @Override
    public synchronized Optional<ScoringWatermark> findByClientId(String clientId) {
        return Optional.ofNullable(watermarks.get(clientId)).map(InMemoryWatermarkStore::copyOf);
    }

    @Override
    public synchronized void save(ScoringWatermark watermark) {
        watermarks.put(watermark.getClientId(), copyOf(watermark));
    }

    private static ScoringWatermark copyOf(ScoringWatermark w) {
        return new ScoringWatermark(w.getClientId(), w.getLastIngestedAt(), w.getLastBatchId(), w.getUpdated());
    }
}
