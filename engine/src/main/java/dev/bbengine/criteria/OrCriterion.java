package dev.bbengine.criteria;

import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Hand;

/**
 * Holds when any nested rule holds.
 */
public final class OrCriterion implements Criterion {
    @Override
    public boolean test(CriterionSpec spec, Hand hand, Auction auction, CriteriaChecker checker) {
        return checker.check(spec.children(), hand, auction, Combinator.ANY);
    }
}
