package dev.bbengine.criteria;

import dev.bbengine.Errors;
import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Hand;
import dev.bbengine.bidding.ShapePattern;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds when the hand fits the shape pattern given as the rule's text,
 * e.g. {@code shape: "5+,3-"}.
 */
public final class ShapeCriterion implements Criterion {

    private final Map<String, ShapePattern> patterns = new ConcurrentHashMap<>();

    @Override
    public boolean test(CriterionSpec spec, Hand hand, Auction auction, CriteriaChecker checker) {
        if (spec.text() == null) {
            throw new Errors.InvalidCriterionError("shape criterion requires a pattern");
        }
        return patterns.computeIfAbsent(spec.text(), ShapePattern::parse).matches(hand);
    }
}
