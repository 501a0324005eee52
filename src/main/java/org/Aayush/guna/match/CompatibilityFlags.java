package org.Aayush.guna.match;

import lombok.Value;
import org.Aayush.guna.core.TriState;

/**
 * Derived compatibility flags of a pair.
 */
@Value
public class CompatibilityFlags {
    boolean sexualIncompatibility;
    boolean severeNadiDosha;
    TriState dashaConflict;
    TriState dashaGrowth;
}
