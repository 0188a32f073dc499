package com.dorkroom.catalog.exposure;

/**
 * Push/pull stop arithmetic. One stop is a doubling of ISO.
 */
public final class ExposureCalculator {

    private ExposureCalculator() {
    }

    /**
     * Returns the whole number of stops between the box speed and the shooting speed:
     * positive for a push, negative for a pull. Non-positive input gives 0.
     */
    public static int computeStops(double boxIso, double shootingIso) {
        if (!(boxIso > 0) || !(shootingIso > 0)) {
            return 0;
        }
        return roundStops(Math.log(shootingIso / boxIso) / Math.log(2));
    }

    /**
     * Rounds half to even, so 0.5 and -0.5 give 0, 1.5 and 2.5 give 2.
     */
    static int roundStops(double stops) {
        return (int) Math.rint(stops);
    }
}
