package dev.bbengine.bidding;

import dev.bbengine.Errors;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Thirteen (or, for hypothetical hands, any number of) cards split into four
 * holdings in the order spades, hearts, diamonds, clubs.
 *
 * <p>Holdings are rank strings over {@code AKQJT98765432}, with {@code x}
 * standing for an unspecified spot card.
 */
public final class Hand {

    static final String RANKS = "AKQJT98765432";
    private static final char SPOT = 'x';
    private static final String VOID = "-";

    private final Map<Suit, String> holdings;

    private Hand(Map<Suit, String> holdings) {
        this.holdings = holdings;
    }

    /**
     * Parse a hand such as {@code "AKxxx AKx AKx QJ"}.
     *
     * @throws Errors.InvalidHandError if the text is not four valid holdings
     */
    public static Hand parse(String text) {
        if (text == null || text.isBlank()) {
            throw new Errors.InvalidHandError("Hand must not be empty");
        }
        String[] parts = text.trim().split("\\s+");
        if (parts.length != Suit.values().length) {
            throw new Errors.InvalidHandError(
                "Hand must have 4 holdings (S H D C), got " + parts.length + ": " + text);
        }
        Map<Suit, String> holdings = new EnumMap<>(Suit.class);
        for (Suit suit : Suit.values()) {
            holdings.put(suit, normaliseHolding(parts[suit.ordinal()], text));
        }
        return new Hand(holdings);
    }

    private static String normaliseHolding(String raw, String hand) {
        if (raw.equals(VOID)) {
            return "";
        }
        String value = raw.toUpperCase().replace("10", "T");
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == 'X') {
                sb.append(SPOT);
            } else if (RANKS.indexOf(c) >= 0) {
                sb.append(c);
            } else {
                throw new Errors.InvalidHandError("Invalid rank '" + c + "' in hand: " + hand);
            }
        }
        return sb.toString();
    }

    public String holding(Suit suit) {
        return holdings.get(suit);
    }

    public int length(Suit suit) {
        return holdings.get(suit).length();
    }

    /**
     * Suit lengths in hand order (spades first).
     */
    public int[] shape() {
        int[] shape = new int[Suit.values().length];
        for (Suit suit : Suit.values()) {
            shape[suit.ordinal()] = length(suit);
        }
        return shape;
    }

    /**
     * Suit lengths, longest first; 4-3-3-3 for any 4333 hand.
     */
    public List<Integer> sortedShape() {
        List<Integer> lengths = new ArrayList<>();
        for (int length : shape()) {
            lengths.add(length);
        }
        lengths.sort(Collections.reverseOrder());
        return lengths;
    }

    public int cardCount() {
        return Arrays.stream(shape()).sum();
    }

    /**
     * Number of cards of the given rank symbol across all suits.
     */
    public int count(char rank) {
        int count = 0;
        for (String holding : holdings.values()) {
            for (char c : holding.toCharArray()) {
                if (c == rank) count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hand)) return false;
        return holdings.equals(((Hand) o).holdings);
    }

    @Override
    public int hashCode() {
        return holdings.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Suit suit : Suit.values()) {
            if (sb.length() > 0) sb.append(' ');
            String holding = holding(suit);
            sb.append(holding.isEmpty() ? VOID : holding);
        }
        return sb.toString();
    }
}
