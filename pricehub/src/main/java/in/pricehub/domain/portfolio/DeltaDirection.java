package in.pricehub.domain.portfolio;

import java.math.BigDecimal;

/**
 * Direction of a portfolio total change, used for transient up/down feedback.
 */
public enum DeltaDirection {
    INCREASED,
    DECREASED,
    UNCHANGED;

    public static DeltaDirection between(BigDecimal previous, BigDecimal current) {
        int cmp = current.compareTo(previous);
        if (cmp > 0) return INCREASED;
        if (cmp < 0) return DECREASED;
        return UNCHANGED;
    }
}
