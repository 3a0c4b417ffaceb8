package io.leadscore.engine.leads.repository;

import io.leadscore.engine.leads.model.ScoringJobLog;
import io.quarkus.hibernate.orm.panache.PanacheRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

@ApplicationScoped
public class ScoringJobLogRepository implements PanacheRepository<ScoringJobLog> {

    @Transactional
    public ScoringJobLog start(ScoringJobLog entry) {
        persist(entry);
        return entry;
    }

    @Transactional
    public void finish(ScoringJobLog entry) {
        getEntityManager().merge(entry);
    }
}
