package dev.bbengine.criteria;

import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Hand;

/**
 * Holds while nobody has made a non-pass call.
 */
public final class OpeningCriterion implements Criterion {
    @Override
    public boolean test(CriterionSpec spec, Hand hand, Auction auction, CriteriaChecker checker) {
        return !auction.hasOpened();
    }
}
