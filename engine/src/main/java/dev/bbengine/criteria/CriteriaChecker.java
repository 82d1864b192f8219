package dev.bbengine.criteria;

import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Hand;

import java.util.List;

/**
 * Evaluates lists of rules against a hand and an auction.
 */
public class CriteriaChecker {

    private final CriteriaRegistry registry;

    public CriteriaChecker(CriteriaRegistry registry) {
        this.registry = registry;
    }

    public CriteriaRegistry getRegistry() {
        return registry;
    }

    /**
     * True if every rule holds.
     */
    public boolean check(List<CriterionSpec> specs, Hand hand, Auction auction) {
        return check(specs, hand, auction, Combinator.ALL);
    }

    public boolean check(List<CriterionSpec> specs, Hand hand, Auction auction, Combinator combinator) {
        switch (combinator) {
            case ANY:
                return specs.stream().anyMatch(spec -> checkOne(spec, hand, auction));
            case ALL:
            default:
                return specs.stream().allMatch(spec -> checkOne(spec, hand, auction));
        }
    }

    /**
     * @throws dev.bbengine.Errors.UnknownCriterionError for an unregistered name
     */
    public boolean checkOne(CriterionSpec spec, Hand hand, Auction auction) {
        return registry.get(spec.name()).test(spec, hand, auction, this);
    }

    /**
     * Throws for the first rule, at any depth, whose name is not registered.
     */
    public void validate(List<CriterionSpec> specs) {
        for (CriterionSpec spec : specs) {
            registry.get(spec.name());
            validate(spec.children());
        }
    }
}
