package io.leadscore.engine.leads.model;

import io.leadscore.engine.leads.model.enums.JobStatus;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Entity
@Table(name = "scoring_job_log", indexes = {
        @Index(name = "idx_job_log_name_started", columnList = "job_name, started_at"),
        @Index(name = "idx_job_log_execution", columnList = "execution_id")
})
public class ScoringJobLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_name", nullable = false)
    private String jobName;

    @Enumerated(EnumType.STRING)
    private JobStatus status;

    @Column(name = "execution_id")
    private String executionId;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @Column(name = "processed_count")
    private Integer processedCount;

    @Lob
    private String details;

    @Lob
    private String error;

    public ScoringJobLog(String jobName, String executionId, LocalDateTime startedAt) {
        this.jobName = jobName;
        this.executionId = executionId;
        this.startedAt = startedAt;
        this.status = JobStatus.STARTED;
    }
}
