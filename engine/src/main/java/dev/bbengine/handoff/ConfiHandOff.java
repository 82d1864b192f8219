package dev.bbengine.handoff;

import dev.bbengine.Errors;
import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Bid;
import dev.bbengine.bidding.Deal;
import dev.bbengine.bidding.Evaluator;
import dev.bbengine.bidding.Hand;
import dev.bbengine.bidding.Seat;
import dev.bbengine.bidding.Suit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * CONFI: control-showing slam exploration after a no-trump opening.
 *
 * <p>The sequence runs in three stages:
 * <ol>
 *   <li>Opener shows controls (A=2, K=1) in steps over the asking bid,
 *       one step for six or fewer and one more for each control above six.
 *       Responder signs off in no-trump unless the partnership holds 10+.
 *   <li>Both hands bid four-card suits up the line, then five-card suits,
 *       then three-card support for a suit partner showed, looking for a
 *       4-4, 5-3 or 3-5 fit. A fit, or opener's six-card suit, is bid at the
 *       six level.
 *   <li>With no fit and nothing left to show, the auction is signed off in
 *       the cheapest no-trump.
 * </ol>
 *
 * <p>Exploration never bids a suit at the six level itself, and each seat shows
 * a suit at most once per length, so the loop always runs out of room.
 */
public class ConfiHandOff implements HandOff {
    private static final Logger logger = LoggerFactory.getLogger(ConfiHandOff.class);

    static final int EXPECTED_MINIMUM = 6;
    static final int SLAM_CONTROLS = 10;
    static final int CORRECTED_SLAM_CONTROLS = 11;
    static final int LONG_SUIT = 6;
    static final int SLAM_LEVEL = 6;
    private static final int SCAN_STEPS = 4;

    private final Deal deal;
    private final Auction auction;
    private final ConfiProcess process = new ConfiProcess();

    public ConfiHandOff(Deal deal, Auction auction) {
        this.deal = deal;
        this.auction = auction;
    }

    public ConfiProcess getProcess() {
        return process;
    }

    @Override
    public void run() {
        while (!process.isComplete()) {
            step();
        }
    }

    /**
     * Execute the current phase and move to the next one.
     *
     * @return the phase the machine is now in
     */
    public ConfiPhase step() {
        ConfiPhase phase = process.getPhase();
        ConfiPhase next;
        switch (phase) {
            case CONTROL_STEP:
                next = controlStep();
                break;
            case SUFFICIENCY_CHECK:
                next = sufficiencyCheck();
                break;
            case MINIMUM_CORRECTION:
                next = minimumCorrection();
                break;
            case LONG_SUIT_CHECK:
                next = longSuitCheck();
                break;
            case FIT_SEARCH:
                next = fitSearch();
                break;
            case SUIT_CASCADE:
                next = suitCascade();
                break;
            case SIGNOFF:
                next = signoff();
                break;
            case COMPLETE:
            default:
                return phase;
        }
        logger.debug("confi_transition",
            kv("from", phase), kv("to", next), kv("next_to_bid", auction.getNextToBid()),
            kv("auction", auction.toString()));
        process.setPhase(next);
        return next;
    }

    // --- Phases ---

    /**
     * Opener answers the ask with one step per control above the minimum.
     */
    private ConfiPhase controlStep() {
        Bid ask = auction.highestBid();
        if (ask == null) {
            throw new Errors.InvalidStateError("CONFI needs an asking bid to step over");
        }
        Seat opener = auction.getNextToBid();
        int controls = controls(opener);
        process.setOpener(opener);
        process.setOpenerControls(controls);

        int steps = Math.max(controls - EXPECTED_MINIMUM, 0) + 1;
        bidAndPass(ask.stepsAbove(steps));
        return ConfiPhase.SUFFICIENCY_CHECK;
    }

    /**
     * Responder assumes opener has at least the minimum and signs off short
     * of the slam bar.
     */
    private ConfiPhase sufficiencyCheck() {
        int combined = Math.max(process.getOpenerControls(), EXPECTED_MINIMUM)
            + controls(auction.getNextToBid());
        if (combined < SLAM_CONTROLS) {
            logger.debug("confi_insufficient_controls", kv("combined", combined));
            auction.addBid(auction.highestBid().cheapestNoTrumpAtOrAbove());
            auction.allPass();
            return ConfiPhase.COMPLETE;
        }
        return ConfiPhase.MINIMUM_CORRECTION;
    }

    /**
     * On opener's first turn back, an opener who showed the minimum without
     * holding it corrects to no-trump. Responder then needs 11 combined.
     */
    private ConfiPhase minimumCorrection() {
        if (auction.getNextToBid() != process.getOpener() || !process.isOpenersFirstRebid()) {
            return ConfiPhase.LONG_SUIT_CHECK;
        }
        process.setOpenersFirstRebid(false);
        if (process.getOpenerControls() >= EXPECTED_MINIMUM) {
            return ConfiPhase.LONG_SUIT_CHECK;
        }

        Bid current = auction.highestBid();
        if (current.isNoTrump()) {
            auction.allPass();
            return ConfiPhase.COMPLETE;
        }
        bidAndPass(current.cheapestNoTrumpAtOrAbove());

        int combined = EXPECTED_MINIMUM + controls(auction.getNextToBid());
        if (combined < CORRECTED_SLAM_CONTROLS) {
            auction.allPass();
            return ConfiPhase.COMPLETE;
        }
        return ConfiPhase.LONG_SUIT_CHECK;
    }

    /**
     * Opener with a six-card suit simply bids the slam in it.
     */
    private ConfiPhase longSuitCheck() {
        Seat seat = auction.getNextToBid();
        if (seat != process.getOpener()) {
            return ConfiPhase.FIT_SEARCH;
        }
        Hand hand = deal.hand(seat);
        for (Suit suit : Suit.values()) {
            if (hand.length(suit) >= LONG_SUIT) {
                bidSlam(suit);
                return ConfiPhase.COMPLETE;
            }
        }
        return ConfiPhase.FIT_SEARCH;
    }

    private ConfiPhase fitSearch() {
        Seat seat = auction.getNextToBid();
        Hand hand = deal.hand(seat);
        SuitSignals partner = process.signals(seat.partner());

        for (Suit suit : Suit.values()) {
            if (partner.hasShownFour(suit) && hand.length(suit) >= 4) {
                bidSlam(suit);
                return ConfiPhase.COMPLETE;
            }
        }
        for (Suit suit : Suit.values()) {
            if (partner.hasShownFive(suit) && hand.length(suit) >= 3) {
                bidSlam(suit);
                return ConfiPhase.COMPLETE;
            }
        }
        for (Suit suit : Suit.values()) {
            if (partner.hasShownThree(suit) && hand.length(suit) >= 5) {
                bidSlam(suit);
                return ConfiPhase.COMPLETE;
            }
        }
        return ConfiPhase.SUIT_CASCADE;
    }

    /**
     * Show the next piece of suit information; any bid hands the turn to
     * partner, who restarts the fit search.
     */
    private ConfiPhase suitCascade() {
        if (showFourCardSuit() || showFiveCardSuit() || showThreeCardSupport()) {
            return ConfiPhase.MINIMUM_CORRECTION;
        }
        return ConfiPhase.SIGNOFF;
    }

    private ConfiPhase signoff() {
        Bid current = auction.highestBid();
        if (current.isNoTrump()) {
            auction.allPass();
            return ConfiPhase.COMPLETE;
        }
        bidAndPass(current.cheapestNoTrumpAtOrAbove());
        return ConfiPhase.MINIMUM_CORRECTION;
    }

    // --- Suit showing ---

    private boolean showFourCardSuit() {
        Seat seat = auction.getNextToBid();
        Hand hand = deal.hand(seat);
        SuitSignals mine = process.signals(seat);
        SuitSignals partner = process.signals(seat.partner());

        for (Bid bid : suitBidsAbove(auction.highestBid())) {
            Suit suit = bid.suit();
            if (hand.length(suit) < 4) {
                mine.denyFour(suit);
                continue;
            }
            if (partner.hasDeniedFour(suit) || mine.hasShownFour(suit)) {
                continue;
            }
            mine.showFour(suit);
            bidAndPass(bid);
            return true;
        }
        return false;
    }

    private boolean showFiveCardSuit() {
        Seat seat = auction.getNextToBid();
        Hand hand = deal.hand(seat);
        SuitSignals mine = process.signals(seat);

        for (Bid bid : suitBidsAbove(auction.highestBid())) {
            Suit suit = bid.suit();
            if (hand.length(suit) < 5 || mine.hasShownFive(suit)) {
                continue;
            }
            mine.showFive(suit);
            bidAndPass(bid);
            return true;
        }
        return false;
    }

    /**
     * Three cards in a suit partner showed as four, in case partner holds five.
     * Only without going up a level.
     */
    private boolean showThreeCardSupport() {
        Seat seat = auction.getNextToBid();
        Hand hand = deal.hand(seat);
        SuitSignals mine = process.signals(seat);
        SuitSignals partner = process.signals(seat.partner());
        Bid current = auction.highestBid();

        for (Bid bid : suitBidsAbove(current)) {
            if (bid.level() > current.level()) {
                break;
            }
            Suit suit = bid.suit();
            if (hand.length(suit) < 3 || mine.hasShownThree(suit) || !partner.hasShownFour(suit)) {
                continue;
            }
            mine.showThree(suit);
            bidAndPass(bid);
            return true;
        }
        return false;
    }

    /**
     * Up to four suit bids above {@code from}, skipping no-trump and stopping
     * short of the slam level.
     */
    private static List<Bid> suitBidsAbove(Bid from) {
        List<Bid> candidates = new ArrayList<>();
        Bid bid = from;
        for (int i = 0; i < SCAN_STEPS; i++) {
            bid = bid.next();
            if (bid.isNoTrump()) {
                bid = bid.next();
            }
            if (bid.level() >= SLAM_LEVEL) {
                break;
            }
            candidates.add(bid);
        }
        return candidates;
    }

    // --- Helpers ---

    private int controls(Seat seat) {
        return Evaluator.CONTROLS.evaluate(deal.hand(seat));
    }

    private void bidAndPass(Bid bid) {
        auction.addBid(bid);
        auction.addBid(Bid.PASS);
    }

    private void bidSlam(Suit suit) {
        logger.debug("confi_slam", kv("seat", auction.getNextToBid()), kv("suit", suit));
        auction.addBid(Bid.of(SLAM_LEVEL, suit.strain()));
        auction.allPass();
    }
}
