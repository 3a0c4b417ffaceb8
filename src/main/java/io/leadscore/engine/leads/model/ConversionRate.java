package io.leadscore.engine.leads.model;

import io.leadscore.engine.leads.model.enums.KeyField;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Aggregate counters for one (client, key field, key name).
 * {@code conversionRate} is always derived from the two counters via {@link #rateOf(long, long)}.
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "conversion_rate", uniqueConstraints = {
        @UniqueConstraint(name = "uk_conversion_rate_key", columnNames = {"client_id", "key_field", "key_name"})
})
public class ConversionRate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "client_id", nullable = false)
    private String clientId;

    @Enumerated(EnumType.STRING)
    @Column(name = "key_field", nullable = false)
    private KeyField keyField;

    @Column(name = "key_name", nullable = false)
    private String keyName;

    @Column(name = "conversion_rate")
    private double conversionRate;

    // decided leads: positive + negative outcomes
    @Column(name = "past_total_count")
    private long pastTotalCount;

    // positive outcomes
    @Column(name = "past_total_est")
    private long pastTotalEst;

    @Column(name = "last_batch_id")
    private String lastBatchId;

    private LocalDateTime created;

    private LocalDateTime updated;

    public ConversionRate(String clientId, KeyField keyField, String keyName, long pastTotalEst, long pastTotalCount) {
        this.clientId = clientId;
        this.keyField = keyField;
        this.keyName = keyName;
        this.pastTotalEst = pastTotalEst;
        this.pastTotalCount = pastTotalCount;
        this.conversionRate = rateOf(pastTotalEst, pastTotalCount);
    }

    public RateKey key() {
        return new RateKey(keyField, keyName);
    }

    /**
     * Returns true when the stored counters and rate equal the other row's, ignoring identity and audit columns.
     */
    public boolean sameValues(ConversionRate other) {
        return other != null
                && pastTotalCount == other.pastTotalCount
                && pastTotalEst == other.pastTotalEst
                && Double.compare(conversionRate, other.conversionRate) == 0;
    }

    /**
     * est / count rounded HALF_UP to two decimals, 0 when count is 0.
     */
    public static double rateOf(long est, long count) {
        if (count == 0) return 0.0;
        return BigDecimal.valueOf(est)
                .divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
