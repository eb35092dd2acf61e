package org.carball.pgmaint.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class OptimizerThresholds {

    // Slow query triage
    @Builder.Default
    @JsonProperty("slow_query_threshold_ms")
    private double slowQueryThresholdMs = 1000.0;

    @Builder.Default
    @JsonProperty("slow_query_limit")
    private int slowQueryLimit = 20;

    // Maintenance
    @Builder.Default
    @JsonProperty("rebuild_dead_tuple_ratio")
    private double rebuildDeadTupleRatio = 0.2;

    public static OptimizerThresholds defaults() {
        return OptimizerThresholds.builder().build();
    }

    /**
     * Validates the threshold configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (slowQueryThresholdMs < 0) {
            log.warn("Slow query threshold ({} ms) should not be negative", slowQueryThresholdMs);
        }

        if (slowQueryLimit <= 0) {
            log.warn("Slow query limit ({}) should be positive; no slow queries will be reported", slowQueryLimit);
        }

        if (rebuildDeadTupleRatio <= 0) {
            log.warn("Rebuild dead tuple ratio ({}) should be positive; every table with dead tuples will be reindexed",
                    rebuildDeadTupleRatio);
        } else if (rebuildDeadTupleRatio >= 1.0) {
            log.warn("Rebuild dead tuple ratio ({}) of 1.0 or more only reindexes tables with more dead than live rows",
                    rebuildDeadTupleRatio);
        }

        log.debug("Using thresholds - {}", getConfigurationSummary());
    }

    /**
     * Logs a warning for every threshold that departs from the built-in policy values.
     */
    public void warnOnPolicyOverrides() {
        OptimizerThresholds policy = defaults();
        if (Double.compare(slowQueryThresholdMs, policy.slowQueryThresholdMs) != 0) {
            log.warn("Slow query threshold overridden: {} ms instead of the policy value {} ms",
                    slowQueryThresholdMs, policy.slowQueryThresholdMs);
        }
        if (slowQueryLimit != policy.slowQueryLimit) {
            log.warn("Slow query limit overridden: {} instead of the policy value {}",
                    slowQueryLimit, policy.slowQueryLimit);
        }
        if (Double.compare(rebuildDeadTupleRatio, policy.rebuildDeadTupleRatio) != 0) {
            log.warn("Rebuild dead tuple ratio overridden: {} instead of the policy value {}",
                    rebuildDeadTupleRatio, policy.rebuildDeadTupleRatio);
        }
    }

    public String getConfigurationSummary() {
        return String.format(Locale.ROOT, "Slow query: > %.0f ms (top %d) | Rebuild ratio: > %.2f",
                slowQueryThresholdMs, slowQueryLimit, rebuildDeadTupleRatio);
    }
}
