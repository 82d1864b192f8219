package dev.bbengine.bidding;

import dev.bbengine.Errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The record of one bidding run: who dealt, every call made so far and
 * whose turn it is.
 *
 * <p>Calls are append-only. The auction is over after four initial passes,
 * or after three consecutive passes once somebody has opened; from then on
 * {@link #addBid(Bid)} is rejected.
 *
 * <p>Not thread-safe. Each run owns its own instance.
 */
public class Auction {

    private static final int PASSES_TO_CLOSE = 3;

    private final Seat dealer;
    private final List<Bid> bids = new ArrayList<>();
    private Seat nextToBid;

    public Auction(Seat dealer) {
        this.dealer = dealer;
        this.nextToBid = dealer;
    }

    public Seat getDealer() { return dealer; }
    public Seat getNextToBid() { return nextToBid; }

    /**
     * Calls made so far, oldest first.
     */
    public List<Bid> bids() {
        return Collections.unmodifiableList(bids);
    }

    /**
     * Append a call for the seat whose turn it is.
     *
     * @throws Errors.AuctionAlreadyOverError if the auction has completed
     * @throws Errors.InsufficientBidError if a contract bid does not outrank the highest so far
     */
    public void addBid(Bid bid) {
        if (completed()) {
            throw new Errors.AuctionAlreadyOverError(bid.toString());
        }
        Bid highest = highestBid();
        if (!bid.isPass() && highest != null && bid.compareTo(highest) <= 0) {
            throw new Errors.InsufficientBidError(bid.toString(), highest.toString());
        }
        bids.add(bid);
        nextToBid = dealer.advance(bids.size());
    }

    /**
     * Pass for every remaining seat until the auction completes.
     */
    public void allPass() {
        while (!completed()) {
            addBid(Bid.PASS);
        }
    }

    /**
     * Returns whether anybody has made a non-pass call.
     */
    public boolean hasOpened() {
        return bids.stream().anyMatch(b -> !b.isPass());
    }

    public boolean completed() {
        if (!hasOpened()) {
            return bids.size() == 4;
        }
        if (bids.size() < 4) {
            return false;
        }
        return bids.subList(bids.size() - PASSES_TO_CLOSE, bids.size()).stream()
            .allMatch(Bid::isPass);
    }

    /**
     * The most recent contract bid, or null if everyone has passed so far.
     */
    public Bid highestBid() {
        for (int i = bids.size() - 1; i >= 0; i--) {
            if (!bids.get(i).isPass()) {
                return bids.get(i);
            }
        }
        return null;
    }

    /**
     * The contract once the auction has completed; null while it is still
     * running or when it was passed out.
     */
    public Bid finalContract() {
        if (!completed()) {
            return null;
        }
        return highestBid();
    }

    /**
     * The seat that plays the final contract: the first player on the
     * declaring side to name its strain.
     */
    public Seat declarer() {
        Bid contract = finalContract();
        if (contract == null) {
            return null;
        }
        Seat winner = seatOf(lastContractIndex());
        for (int i = 0; i < bids.size(); i++) {
            Seat seat = seatOf(i);
            Bid bid = bids.get(i);
            boolean sameSide = seat == winner || seat == winner.partner();
            if (sameSide && !bid.isPass() && bid.strain() == contract.strain()) {
                return seat;
            }
        }
        return winner;
    }

    /**
     * The seat that made the call at the given position.
     */
    public Seat seatOf(int index) {
        return dealer.advance(index);
    }

    private int lastContractIndex() {
        for (int i = bids.size() - 1; i >= 0; i--) {
            if (!bids.get(i).isPass()) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return bids.stream().map(Bid::toString).collect(Collectors.joining(" "));
    }
}
