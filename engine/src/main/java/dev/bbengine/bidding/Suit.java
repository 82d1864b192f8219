package dev.bbengine.bidding;

/**
 * Suits in the order holdings are written in a hand: spades first.
 */
public enum Suit {
    SPADES('S'),
    HEARTS('H'),
    DIAMONDS('D'),
    CLUBS('C');

    private final char symbol;

    Suit(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public Strain strain() {
        return Strain.fromSymbol(symbol);
    }

    public static Suit fromSymbol(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (Suit suit : values()) {
            if (suit.symbol == upper) {
                return suit;
            }
        }
        return null;
    }
}
