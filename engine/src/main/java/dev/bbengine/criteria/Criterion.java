package dev.bbengine.criteria;

import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Hand;

/**
 * A rule deciding whether a bid suits a hand in the current auction.
 *
 * <p>Implementations must be stateless and free of side effects: the director
 * may evaluate the same rule many times while looking for a bid.
 */
@FunctionalInterface
public interface Criterion {

    /**
     * @param spec the rule's parameters as written in the bidding system
     * @param hand the hand of the seat about to bid
     * @param auction the auction so far (read only)
     * @param checker for combinators that evaluate nested rules
     */
    boolean test(CriterionSpec spec, Hand hand, Auction auction, CriteriaChecker checker);
}
