package dev.bbengine.bidding;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The hands of the bidding partnership. East and West are not modelled and
 * have no hand.
 */
public final class Deal {

    private final Map<Seat, Hand> hands = new EnumMap<>(Seat.class);

    private Deal(Hand north, Hand south) {
        hands.put(Seat.NORTH, Objects.requireNonNull(north, "north"));
        hands.put(Seat.SOUTH, Objects.requireNonNull(south, "south"));
    }

    public static Deal of(Hand north, Hand south) {
        return new Deal(north, south);
    }

    public static Deal parse(String north, String south) {
        return new Deal(Hand.parse(north), Hand.parse(south));
    }

    /**
     * The hand held at the seat, or null for East and West.
     */
    public Hand hand(Seat seat) {
        return hands.get(seat);
    }

    public Hand north() { return hands.get(Seat.NORTH); }
    public Hand south() { return hands.get(Seat.SOUTH); }

    @Override
    public String toString() {
        return "N: " + north() + " / S: " + south();
    }
}
