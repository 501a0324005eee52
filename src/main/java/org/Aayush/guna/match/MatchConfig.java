package org.Aayush.guna.match;

import lombok.Builder;
import lombok.Value;
import org.Aayush.guna.aggregate.AggregationPolicy;
import org.Aayush.guna.dosha.ManglikPolicy;

/**
 * Engine-wide match configuration.
 */
@Value
@Builder
public class MatchConfig {
    /** Verdict thresholds, Nadi cancellation and eligibility gate. */
    AggregationPolicy aggregation;
    /** Manglik reference policy and optional cancellations. */
    ManglikPolicy manglik;

    public static MatchConfig defaults() {
        return MatchConfig.builder()
                .aggregation(AggregationPolicy.defaults())
                .manglik(ManglikPolicy.defaults())
                .build();
    }
}
