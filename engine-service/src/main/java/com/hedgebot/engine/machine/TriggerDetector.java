package com.hedgebot.engine.machine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Price-move arithmetic shared by the live detector and the shadow monitor. A trigger is an upward move of the
 * back price relative to a baseline.
 */
public final class TriggerDetector {

    private TriggerDetector() {
    }

    public static double movePct(double baseline, double price) {
        if (baseline <= 0) {
            throw new IllegalArgumentException("baseline must be positive: " + baseline);
        }
        return (price - baseline) / baseline * 100.0;
    }

    public static boolean isTrigger(double baseline, double price, double triggerPct) {
        return movePct(baseline, price) >= triggerPct;
    }

    /**
     * Move has fallen back under half the trigger threshold.
     */
    public static boolean isReverted(double baseline, double price, double triggerPct) {
        return movePct(baseline, price) < triggerPct * 0.5;
    }

    /**
     * Appends {@code price} and keeps the last {@code window} readings.
     */
    public static List<Double> window(List<Double> readings, double price, int window) {
        List<Double> next = new ArrayList<>(readings);
        next.add(price);
        while (next.size() > window) {
            next.remove(0);
        }
        return next;
    }

    /**
     * All of a full window within {@code stabilityPct} of its median.
     */
    public static boolean isStable(List<Double> readings, int window, double stabilityPct) {
        if (readings.size() < window) {
            return false;
        }
        double median = median(readings);
        for (double price : readings) {
            if (Math.abs((price - median) / median) * 100.0 > stabilityPct) {
                return false;
            }
        }
        return true;
    }

    static double median(List<Double> readings) {
        List<Double> sorted = new ArrayList<>(readings);
        Collections.sort(sorted);
        return sorted.get(sorted.size() / 2);
    }
}
