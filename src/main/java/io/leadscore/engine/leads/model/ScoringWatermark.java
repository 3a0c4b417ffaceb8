package io.leadscore.engine.leads.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Records how far a client's conversion rate counters reach, so a replayed
 * incremental batch is not merged twice.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "scoring_watermark")
public class ScoringWatermark {

    @Id
    @Column(name = "client_id")
    private String clientId;

    // leads ingested at or before this instant are already counted
    @Column(name = "last_ingested_at")
    private Instant lastIngestedAt;

    @Column(name = "last_batch_id")
    private String lastBatchId;

    private LocalDateTime updated;
}
