package dev.bbengine.bidding;

import dev.bbengine.Errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A call in the auction: either pass or a contract bid of level and strain.
 *
 * <p>Contract bids are totally ordered by level, then strain. Pass sorts
 * below every contract bid. Instances are interned, so identity and
 * {@link #equals(Object)} agree.
 */
public final class Bid implements Comparable<Bid> {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 7;

    public static final Bid PASS = new Bid(0, null);

    private static final List<Bid> LADDER;

    static {
        List<Bid> ladder = new ArrayList<>();
        for (int level = MIN_LEVEL; level <= MAX_LEVEL; level++) {
            for (Strain strain : Strain.values()) {
                ladder.add(new Bid(level, strain));
            }
        }
        LADDER = Collections.unmodifiableList(ladder);
    }

    private final int level;
    private final Strain strain;

    private Bid(int level, Strain strain) {
        this.level = level;
        this.strain = strain;
    }

    public static Bid of(int level, Strain strain) {
        Objects.requireNonNull(strain, "strain");
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new Errors.InvalidBidError("Bid level must be 1-7, got " + level);
        }
        return LADDER.get(index(level, strain));
    }

    /**
     * Parse "P", "PASS" or a level digit followed by C, D, H, S or N.
     */
    public static Bid parse(String text) {
        if (text == null || text.isBlank()) {
            throw new Errors.InvalidBidError("Bid must not be empty");
        }
        String value = text.trim().toUpperCase();
        if (value.equals("P") || value.equals("PASS")) {
            return PASS;
        }
        if (value.equals("NT") || value.length() < 2 || value.length() > 3 || !Character.isDigit(value.charAt(0))) {
            throw new Errors.InvalidBidError("Unrecognised bid: " + text);
        }
        String strainText = value.substring(1);
        Strain strain = strainText.equals("NT") ? Strain.NO_TRUMP
            : strainText.length() == 1 ? Strain.fromSymbol(strainText.charAt(0)) : null;
        if (strain == null) {
            throw new Errors.InvalidBidError("Unrecognised strain in bid: " + text);
        }
        return of(value.charAt(0) - '0', strain);
    }

    /**
     * All 35 contract bids, cheapest first.
     */
    public static List<Bid> all() {
        return LADDER;
    }

    public boolean isPass() {
        return strain == null;
    }

    public boolean isNoTrump() {
        return strain == Strain.NO_TRUMP;
    }

    public int level() {
        return level;
    }

    public Strain strain() {
        return strain;
    }

    /**
     * The suit of a suit bid, or null for pass and no-trump.
     */
    public Suit suit() {
        return isPass() ? null : strain.suit();
    }

    /**
     * The next contract bid up.
     *
     * @throws Errors.BidSpaceExhaustedError above 7NT, or when called on pass
     */
    public Bid next() {
        return stepsAbove(1);
    }

    /**
     * The contract bid {@code steps} places above this one.
     *
     * @throws Errors.BidSpaceExhaustedError if that would pass 7NT
     */
    public Bid stepsAbove(int steps) {
        if (isPass()) {
            throw new Errors.BidSpaceExhaustedError("Pass has no successor bid");
        }
        int target = ladderIndex() + steps;
        if (target >= LADDER.size()) {
            throw new Errors.BidSpaceExhaustedError(
                "No bid " + steps + " step(s) above " + this);
        }
        return LADDER.get(target);
    }

    /**
     * This bid if it is no-trump, otherwise the cheapest no-trump above it.
     *
     * @throws Errors.NoSignoffAvailableError if no such bid exists
     */
    public Bid cheapestNoTrumpAtOrAbove() {
        if (isPass()) {
            throw new Errors.NoSignoffAvailableError(toString());
        }
        for (int i = ladderIndex(); i < LADDER.size(); i++) {
            Bid candidate = LADDER.get(i);
            if (candidate.isNoTrump()) {
                return candidate;
            }
        }
        throw new Errors.NoSignoffAvailableError(toString());
    }

    public boolean isHigherThan(Bid other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Bid other) {
        if (isPass() || other.isPass()) {
            return Boolean.compare(other.isPass(), isPass());
        }
        return Integer.compare(ladderIndex(), other.ladderIndex());
    }

    private int ladderIndex() {
        return index(level, strain);
    }

    private static int index(int level, Strain strain) {
        return (level - MIN_LEVEL) * Strain.values().length + strain.ordinal();
    }

    @Override
    public String toString() {
        return isPass() ? "P" : level + String.valueOf(strain.symbol());
    }
}
