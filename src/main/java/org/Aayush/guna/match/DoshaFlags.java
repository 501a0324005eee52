package org.Aayush.guna.match;

import lombok.Value;
import org.Aayush.guna.core.TriState;

/**
 * Pair-level dosha flags.
 */
@Value
public class DoshaFlags {
    /** Final Manglik statuses differ; unknown when either Mars house is missing. */
    TriState manglik;
    /** Both sides share a nadi. */
    TriState nadi;
    /** Moon signs form a 2/12, 5/9 or 6/8 placement. */
    TriState bhakoot;
}
