package org.Aayush.guna.aggregate;

import lombok.Value;

import java.util.List;

/**
 * Pass/fail gate with the reasons that blocked it.
 */
@Value
public class EligibilityGate {
    List<EligibilityReason> reasons;

    public EligibilityGate(List<EligibilityReason> reasons) {
        this.reasons = List.copyOf(reasons);
    }

    public boolean isEligible() {
        return reasons.isEmpty();
    }
}
