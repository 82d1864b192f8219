package dev.bbengine.criteria;

import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Hand;
import dev.bbengine.bidding.ShapePattern;

import java.util.List;

/**
 * Holds for 4-3-3-3, 4-4-3-2 and 5-3-3-2 hands.
 */
public final class BalancedCriterion implements Criterion {

    private static final List<ShapePattern> BALANCED = List.of(
        ShapePattern.parse("4,3,3,3"),
        ShapePattern.parse("4,4,3,2"),
        ShapePattern.parse("5,3,3,2")
    );

    @Override
    public boolean test(CriterionSpec spec, Hand hand, Auction auction, CriteriaChecker checker) {
        return BALANCED.stream().anyMatch(pattern -> pattern.matches(hand));
    }
}
