package com.github.ytdle.service.policy;

import lombok.NonNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered list of explicit quality tiers, highest first, used to step a job down after a failure.
 */
public class QualityLadder {

    public static final String BEST = "best";

    private final List<Integer> tiers;

    public QualityLadder(@NonNull List<String> tiers) {
        this.tiers = tiers.stream()
                .map(QualityLadder::valueOf)
                .filter(value -> value > 0)
                .sorted((a, b) -> Integer.compare(b, a))
                .distinct()
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * The next tier strictly below {@code current}, keeping its unit suffix ("720p" gives "480p").
     * Returns {@link #BEST} once no explicit tier remains or when {@code current} is not an explicit tier.
     */
    public String next(String current) {
        int value = valueOf(current);
        if (value <= 0) {
            return BEST;
        }
        String suffix = current.trim().replaceAll("^\\d+", "");
        for (Integer tier : tiers) {
            if (tier < value) {
                return tier + suffix;
            }
        }
        return BEST;
    }

    public List<Integer> getTiers() {
        return tiers;
    }

    public static boolean isBest(String quality) {
        return quality == null || BEST.equalsIgnoreCase(quality.trim());
    }

    private static int valueOf(String quality) {
        if (quality == null) {
            return -1;
        }
        String digits = quality.trim().replaceAll("\\D", "");
        if (digits.isEmpty() || digits.length() > 6) {
            return -1;
        }
        return Integer.parseInt(digits);
    }
}
