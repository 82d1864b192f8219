package dev.bbengine.bidding;

/**
 * Denomination of a bid, in ascending rank order.
 */
public enum Strain {
    CLUBS('C'),
    DIAMONDS('D'),
    HEARTS('H'),
    SPADES('S'),
    NO_TRUMP('N');

    private final char symbol;

    Strain(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public boolean isNoTrump() {
        return this == NO_TRUMP;
    }

    /**
     * The suit this strain names, or null for no-trump.
     */
    public Suit suit() {
        switch (this) {
            case CLUBS: return Suit.CLUBS;
            case DIAMONDS: return Suit.DIAMONDS;
            case HEARTS: return Suit.HEARTS;
            case SPADES: return Suit.SPADES;
            default: return null;
        }
    }

    public static Strain fromSymbol(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (Strain strain : values()) {
            if (strain.symbol == upper) {
                return strain;
            }
        }
        return null;
    }
}
