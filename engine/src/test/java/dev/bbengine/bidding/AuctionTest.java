package dev.bbengine.bidding;

import dev.bbengine.Errors;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuctionTest {

    private static Auction auction(Seat dealer, String calls) {
        Auction auction = new Auction(dealer);
        for (String call : calls.trim().split("\\s+")) {
            auction.addBid(Bid.parse(call));
        }
        return auction;
    }

    // =========================================================================
    // Turn order
    // =========================================================================

    @Test
    void dealer_bids_first_and_turns_rotate_clockwise() {
        Auction auction = new Auction(Seat.EAST);
        assertThat(auction.getNextToBid()).isEqualTo(Seat.EAST);

        auction.addBid(Bid.PASS);
        assertThat(auction.getNextToBid()).isEqualTo(Seat.SOUTH);
        auction.addBid(Bid.parse("1N"));
        assertThat(auction.getNextToBid()).isEqualTo(Seat.WEST);
        assertThat(auction.seatOf(1)).isEqualTo(Seat.SOUTH);
    }

    // =========================================================================
    // Completion
    // =========================================================================

    @Test
    void four_passes_complete_an_unopened_auction() {
        Auction auction = auction(Seat.NORTH, "P P P");
        assertThat(auction.completed()).isFalse();

        auction.addBid(Bid.PASS);
        assertThat(auction.completed()).isTrue();
        assertThat(auction.hasOpened()).isFalse();
        assertThat(auction.finalContract()).isNull();
        assertThat(auction.declarer()).isNull();
    }

    @Test
    void three_passes_after_an_opening_complete_the_auction() {
        Auction auction = auction(Seat.NORTH, "1N P P");
        assertThat(auction.completed()).isFalse();

        auction.addBid(Bid.PASS);
        assertThat(auction.completed()).isTrue();
        assertThat(auction.finalContract()).hasToString("1N");
    }

    @Test
    void passes_before_a_late_opening_do_not_close_the_auction() {
        Auction auction = auction(Seat.NORTH, "P P P 1C P P");

        assertThat(auction.completed()).isFalse();
    }

    @Test
    void all_pass_fills_in_until_complete() {
        Auction auction = auction(Seat.NORTH, "2N P 3N");

        auction.allPass();

        assertThat(auction).hasToString("2N P 3N P P P");
        assertThat(auction.completed()).isTrue();
    }

    @Test
    void adding_to_a_completed_auction_fails() {
        Auction auction = auction(Seat.NORTH, "1N P P P");

        assertThatThrownBy(() -> auction.addBid(Bid.parse("2C")))
            .isInstanceOf(Errors.AuctionAlreadyOverError.class)
            .hasMessageContaining("2C");
        assertThat(auction.bids()).hasSize(4);
    }

    @Test
    void lower_contract_bid_is_rejected() {
        Auction auction = auction(Seat.NORTH, "3N");

        assertThatThrownBy(() -> auction.addBid(Bid.parse("1C")))
            .isInstanceOfSatisfying(Errors.InsufficientBidError.class,
                e -> assertThat(e.isInvariantViolation()).isTrue())
            .hasMessageContaining("1C")
            .hasMessageContaining("3N");
        assertThat(auction).hasToString("3N");
    }

    @Test
    void repeating_the_highest_bid_is_rejected_even_after_passes() {
        Auction auction = auction(Seat.NORTH, "2N P");

        assertThatThrownBy(() -> auction.addBid(Bid.parse("2N")))
            .isInstanceOf(Errors.InsufficientBidError.class);
        auction.addBid(Bid.parse("3C"));
        assertThat(auction.highestBid()).hasToString("3C");
    }

    @Test
    void bids_view_is_read_only() {
        Auction auction = auction(Seat.NORTH, "1N");

        assertThatThrownBy(() -> auction.bids().add(Bid.PASS))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    // =========================================================================
    // Contract and declarer
    // =========================================================================

    @Test
    void highest_bid_is_the_last_contract_bid() {
        Auction auction = auction(Seat.NORTH, "2N P 3N P 4D P");

        assertThat(auction.highestBid()).hasToString("4D");
        assertThat(auction.finalContract()).isNull();
        assertThat(new Auction(Seat.NORTH).highestBid()).isNull();
    }

    @Test
    void declarer_is_first_of_the_side_to_name_the_strain() {
        Auction auction = auction(Seat.NORTH, "2N P 3N P 4D P 4S P 5C P 5D P 5S P 6S P P P");

        assertThat(auction.finalContract()).hasToString("6S");
        assertThat(auction.declarer()).isEqualTo(Seat.SOUTH);
    }

    @Test
    void no_trump_contract_belongs_to_the_opener() {
        Auction auction = auction(Seat.NORTH, "2N P 3N P 4C P 4N P P P");

        assertThat(auction.declarer()).isEqualTo(Seat.NORTH);
    }
}
