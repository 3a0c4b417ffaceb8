package io.leadscore.engine.leads.model;

import io.leadscore.engine.leads.model.enums.LeadStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static jakarta.persistence.FetchType.EAGER;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "leads", indexes = {
        @Index(name = "idx_lead_client", columnList = "client_id, deleted"),
        @Index(name = "idx_lead_client_date", columnList = "client_id, lead_date"),
        @Index(name = "idx_lead_client_ingested", columnList = "client_id, ingested_at")
})
public class Lead {

    @Id
    private String id;

    @Column(name = "client_id", nullable = false)
    private String clientId;

    private String name;
    private String email;
    private String phone;

    private String service;
    @Column(name = "ad_set_name")
    private String adSetName;
    @Column(name = "ad_name")
    private String adName;
    private String zip;

    // ISO-8601 date or date-time as delivered by ingestion
    @Column(name = "lead_date")
    private String leadDate;

    @Enumerated(EnumType.STRING)
    private LeadStatus status;

    @Column(name = "unqualified_lead_reason")
    private String unqualifiedLeadReason;

    @Column(name = "proposal_amount")
    private double proposalAmount;

    @Column(name = "job_booked_amount")
    private double jobBookedAmount;

    @Column(name = "lead_score")
    private Integer leadScore;

    @Embedded
    private ConversionRateSnapshot conversionRates;

    /**
     * Latest timestamp per status. Not a transition log: re-entering a status overwrites its entry.
     */
    @Builder.Default
    @ElementCollection(fetch = EAGER)
    @CollectionTable(name = "lead_status_history", joinColumns = @JoinColumn(name = "lead_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "status")
    @Column(name = "changed_at")
    private Map<LeadStatus, Instant> statusHistory = new HashMap<>();

    @Column(length = 2000)
    private String notes;

    // stamped when the lead is stored; incremental batches are cut by this, never by leadDate
    @Column(name = "ingested_at")
    private Instant ingestedAt;

    @Column(name = "last_manual_update")
    private Instant lastManualUpdate;

    private boolean deleted;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @PrePersist
    protected void onCreate() {
        if (ingestedAt == null) {
            ingestedAt = Instant.now();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Lead lead = (Lead) o;
        return id != null && id.equals(lead.id);
    }

    @Override
    public int hashCode() {
        return id != null ? id.hashCode() : 0;
    }

    @Override
    public String toString() {
        return "Lead{" +
                "id='" + id + '\'' +
                ", clientId='" + clientId + '\'' +
                ", service='" + service + '\'' +
                ", adSetName='" + adSetName + '\'' +
                ", adName='" + adName + '\'' +
                ", zip='" + zip + '\'' +
                ", leadDate='" + leadDate + '\'' +
                ", status=" + status +
                ", leadScore=" + leadScore +
                '}';
    }
}
