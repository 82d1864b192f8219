package dev.bbengine.handoff;

/**
 * A multi-round convention that takes over the auction from the bidding tree.
 *
 * <p>An instance is created for one invocation, bids directly into the live
 * auction and is discarded when {@link #run()} returns.
 */
public interface HandOff {

    /**
     * Bid until the convention is resolved. The auction may be complete on
     * return.
     */
    void run();
}
