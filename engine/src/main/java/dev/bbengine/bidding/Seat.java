package dev.bbengine.bidding;

/**
 * Table positions in clockwise bidding rotation.
 */
public enum Seat {
    NORTH('N'),
    EAST('E'),
    SOUTH('S'),
    WEST('W');

    private final char symbol;

    Seat(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public Seat next() {
        return advance(1);
    }

    public Seat advance(int steps) {
        Seat[] seats = values();
        return seats[Math.floorMod(ordinal() + steps, seats.length)];
    }

    public Seat partner() {
        return advance(2);
    }

    public boolean isNorthSouth() {
        return this == NORTH || this == SOUTH;
    }

    public static Seat fromSymbol(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (Seat seat : values()) {
            if (seat.symbol == upper) {
                return seat;
            }
        }
        return null;
    }
}
