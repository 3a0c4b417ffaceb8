package io.leadscore.engine.leads.repository;

import io.leadscore.engine.exceptions.ScoringPersistenceException;
import io.leadscore.engine.leads.model.ScoringWatermark;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@ApplicationScoped
public class ScoringWatermarkRepository implements PanacheRepositoryBase<ScoringWatermark, String>, ScoringWatermarkStore {

    @Override
    public Optional<ScoringWatermark> findByClientId(String clientId) {
        try {
            return findByIdOptional(clientId);
        } catch (RuntimeException e) {
            throw new ScoringPersistenceException("Failed to read watermark for client " + clientId, e);
        }
    }

    @Override
    @Transactional
    public void save(ScoringWatermark watermark) {
        watermark.setUpdated(LocalDateTime.now());
        try {
            getEntityManager().merge(watermark);
        } catch (RuntimeException e) {
            throw new ScoringPersistenceException("Failed to save watermark for client " + watermark.getClientId(), e);
        }
    }
}
