package dev.bbengine.handoff;

import dev.bbengine.bidding.Auction;
import dev.bbengine.bidding.Deal;

/**
 * Creates a fresh hand-off bound to one deal and auction.
 */
@FunctionalInterface
public interface HandOffFactory {
    HandOff create(Deal deal, Auction auction);
}
