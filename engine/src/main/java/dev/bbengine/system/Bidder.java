package dev.bbengine.system;

import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Bid;
import dev.bbengine.bidding.Deal;
import dev.bbengine.bidding.Hand;
import dev.bbengine.bidding.Seat;
import dev.bbengine.criteria.CriteriaChecker;
import dev.bbengine.criteria.CriteriaRegistry;
import dev.bbengine.handoff.HandOffRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Bids a deal for North-South by walking a bidding system.
 *
 * <p>At each turn the candidate bids under the current node are tried in
 * declared order against the hand of the seat to bid; the first whose rules
 * all hold is made, the opponent passes and the walk descends into that bid's
 * responses or hands over to its convention. There is no backtracking. When
 * no candidate matches, or the tree runs out, everyone passes.
 *
 * <p>Construction validates every criterion and hand-off name in the system,
 * so a misconfigured tree fails before the first deal. A bidder holds no
 * per-deal state and may be shared across threads once its registries are
 * frozen.
 */
public class Bidder {
    private static final Logger logger = LoggerFactory.getLogger(Bidder.class);

    private final BiddingSystem system;
    private final CriteriaChecker checker;
    private final HandOffRegistry handOffs;

    /**
     * @throws dev.bbengine.Errors.UnknownCriterionError if a rule names an unregistered criterion
     * @throws dev.bbengine.Errors.UnknownHandOffError if a node names an unregistered hand-off
     */
    public Bidder(BiddingSystem system, CriteriaRegistry criteria, HandOffRegistry handOffs) {
        this.system = system;
        this.checker = new CriteriaChecker(criteria);
        this.handOffs = handOffs;
        system.forEachNode(node -> {
            checker.validate(node.getCriteria());
            if (node.hasHandOff()) {
                handOffs.get(node.getHandOff());
            }
        });
    }

    /**
     * A bidder using the built-in criteria and conventions.
     */
    public static Bidder withStandardRegistries(BiddingSystem system) {
        return new Bidder(system, CriteriaRegistry.standard(), HandOffRegistry.standard());
    }

    public BiddingSystem getSystem() {
        return system;
    }

    /**
     * Bid a deal with North dealing.
     *
     * @return every call of the finished auction, in order
     */
    public List<Bid> bid(Hand north, Hand south) {
        return auction(Seat.NORTH, Deal.of(north, south)).bids();
    }

    public List<Bid> bid(Seat dealer, Hand north, Hand south) {
        return auction(dealer, Deal.of(north, south)).bids();
    }

    /**
     * Bid a deal and return the finished auction.
     */
    public Auction auction(Seat dealer, Deal deal) {
        Auction auction = new Auction(dealer);
        List<BidNode> candidates = system.getOpenings();
        while (!auction.completed()) {
            if (!auction.getNextToBid().isNorthSouth()) {
                // East-West always pass.
                auction.addBid(Bid.PASS);
                continue;
            }
            BidNode selected = select(candidates, deal, auction);
            if (selected == null) {
                // Tree exhausted or nothing fits.
                auction.allPass();
                break;
            }

            Seat seat = auction.getNextToBid();
            logger.debug("bid_selected", kv("seat", seat), kv("bid", selected.getBid()),
                kv("system", system.getName()));
            auction.addBid(selected.getBid());
            if (!auction.completed()) {
                auction.addBid(Bid.PASS);
            }

            if (selected.hasHandOff() && !auction.completed()) {
                logger.debug("handoff_started", kv("handoff", selected.getHandOff()), kv("seat", seat));
                handOffs.run(selected.getHandOff(), deal, auction);
            }
            candidates = selected.getResponses();
        }

        logger.info("auction_complete", kv("system", system.getName()), kv("dealer", dealer),
            kv("auction", auction.toString()), kv("contract", auction.finalContract()),
            kv("declarer", auction.declarer()));
        return auction;
    }

    private BidNode select(List<BidNode> candidates, Deal deal, Auction auction) {
        Hand hand = deal.hand(auction.getNextToBid());
        for (BidNode node : candidates) {
            if (checker.check(node.getCriteria(), hand, auction)) {
                return node;
            }
        }
        return null;
    }
}
