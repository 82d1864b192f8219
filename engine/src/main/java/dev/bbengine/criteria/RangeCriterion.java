package dev.bbengine.criteria;

import dev.bbengine.Errors;
import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Evaluator;
import dev.bbengine.bidding.Hand;

/**
 * Holds when a point count lies within the inclusive {@code min}..{@code max}
 * range given as attributes; either bound may be omitted.
 */
public final class RangeCriterion implements Criterion {

    private final Evaluator evaluator;
    private final int defaultMin;
    private final int defaultMax;

    public RangeCriterion(Evaluator evaluator, int defaultMin, int defaultMax) {
        this.evaluator = evaluator;
        this.defaultMin = defaultMin;
        this.defaultMax = defaultMax;
    }

    public static RangeCriterion hcp() {
        return new RangeCriterion(Evaluator.HCP, 0, 40);
    }

    public static RangeCriterion controls() {
        return new RangeCriterion(Evaluator.CONTROLS, 0, 12);
    }

    @Override
    public boolean test(CriterionSpec spec, Hand hand, Auction auction, CriteriaChecker checker) {
        int points = evaluator.evaluate(hand);
        if (points < bound(spec, "min", defaultMin)) {
            return false;
        }
        return points <= bound(spec, "max", defaultMax);
    }

    private static int bound(CriterionSpec spec, String key, int defaultValue) {
        String value = spec.attribute(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new Errors.InvalidCriterionError(
                spec.name() + " " + key + " must be an integer, got '" + value + "'", e);
        }
    }
}
