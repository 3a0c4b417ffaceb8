package io.leadscore.engine.leads.repository;

import io.leadscore.engine.leads.model.ScoringWatermark;

import java.util.Optional;

public interface ScoringWatermarkStore {

    Optional<ScoringWatermark> findByClientId(String clientId);

    void save(ScoringWatermark watermark);
}
