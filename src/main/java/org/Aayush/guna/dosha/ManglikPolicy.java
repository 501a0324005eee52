package org.Aayush.guna.dosha;

import lombok.Builder;
import lombok.Value;

/**
 * Manglik evaluation settings.
 */
@Value
@Builder
public class ManglikPolicy {
    /** Reference combination; null means {@link ManglikReferencePolicy#LAGNA_ONLY}. */
    ManglikReferencePolicy referencePolicy;
    /** Enables the Jupiter conjunction cancellation. */
    boolean jupiterConjunctionCancels;

    public static ManglikPolicy defaults() {
        return ManglikPolicy.builder()
                .referencePolicy(ManglikReferencePolicy.LAGNA_ONLY)
                .jupiterConjunctionCancels(false)
                .build();
    }

    public ManglikReferencePolicy effectiveReferencePolicy() {
        return referencePolicy == null ? ManglikReferencePolicy.LAGNA_ONLY : referencePolicy;
    }
}
