package dev.bbengine.system;

import dev.bbengine.Errors;
import dev.bbengine.bidding.Bid;
import dev.bbengine.criteria.CriterionSpec;

import java.util.List;

/**
 * A candidate bid in a bidding system: the bid, the rules that must all hold
 * for it to be chosen, the partner responses that follow it and optionally a
 * convention that takes over once it is made.
 */
public final class BidNode {

    private final Bid bid;
    private final List<CriterionSpec> criteria;
    private final List<BidNode> responses;
    private final String handOff;

    /**
     * @throws Errors.MissingCriteriaError if {@code criteria} is empty; a node
     *     without rules would match every hand
     */
    public BidNode(Bid bid, List<CriterionSpec> criteria, List<BidNode> responses, String handOff) {
        if (criteria == null || criteria.isEmpty()) {
            throw new Errors.MissingCriteriaError(String.valueOf(bid));
        }
        this.bid = bid;
        this.criteria = List.copyOf(criteria);
        this.responses = responses == null ? List.of() : List.copyOf(responses);
        this.handOff = handOff;
    }

    public Bid getBid() { return bid; }
    public List<CriterionSpec> getCriteria() { return criteria; }
    public List<BidNode> getResponses() { return responses; }
    public String getHandOff() { return handOff; }

    public boolean hasHandOff() {
        return handOff != null && !handOff.isEmpty();
    }

    @Override
    public String toString() {
        return bid + (hasHandOff() ? " [" + handOff + "]" : "") + " " + criteria;
    }
}
