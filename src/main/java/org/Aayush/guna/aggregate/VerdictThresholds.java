package org.Aayush.guna.aggregate;

import lombok.Builder;
import lombok.Value;
import org.Aayush.guna.koota.Koota;

/**
 * Lower bounds (inclusive) of the verdict bands above {@link VerdictBand#UNFAVORABLE}.
 *
 * <p>Bounds must be strictly increasing and lie in {@code [1, 36]}.</p>
 */
@Value
public class VerdictThresholds {
    public static final int DEFAULT_ACCEPTABLE_FROM = 18;
    public static final int DEFAULT_GOOD_FROM = 25;
    public static final int DEFAULT_EXCELLENT_FROM = 33;

    int acceptableFrom;
    int goodFrom;
    int excellentFrom;

    /**
     * Creates validated thresholds.
     *
     * @throws IllegalArgumentException when bounds are out of range or not increasing.
     */
    @Builder
    public VerdictThresholds(int acceptableFrom, int goodFrom, int excellentFrom) {
        if (acceptableFrom < 1 || excellentFrom > Koota.MAX_TOTAL) {
            throw new IllegalArgumentException(
                    "verdict thresholds must lie in [1, " + Koota.MAX_TOTAL + "]");
        }
        if (acceptableFrom >= goodFrom || goodFrom >= excellentFrom) {
            throw new IllegalArgumentException(
                    "verdict thresholds must be strictly increasing: "
                            + acceptableFrom + ", " + goodFrom + ", " + excellentFrom);
        }
        this.acceptableFrom = acceptableFrom;
        this.goodFrom = goodFrom;
        this.excellentFrom = excellentFrom;
    }

    /**
     * Returns the default bands: below 18, 18 to 24, 25 to 32 and 33 to 36.
     */
    public static VerdictThresholds defaults() {
        return new VerdictThresholds(DEFAULT_ACCEPTABLE_FROM, DEFAULT_GOOD_FROM, DEFAULT_EXCELLENT_FROM);
    }

    /**
     * Classifies a total guna score.
     */
    public VerdictBand classify(int totalGuna) {
        if (totalGuna >= excellentFrom) {
            return VerdictBand.EXCELLENT;
        }
        if (totalGuna >= goodFrom) {
            return VerdictBand.GOOD;
        }
        return totalGuna >= acceptableFrom ? VerdictBand.ACCEPTABLE : VerdictBand.UNFAVORABLE;
    }
}
