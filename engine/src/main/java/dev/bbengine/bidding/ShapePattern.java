package dev.bbengine.bidding;

import dev.bbengine.Errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Hand shape pattern such as {@code "5,3,3,2"}, {@code "5+,3-"},
 * {@code "5-6,S3,C3,1-2"} or {@code "CD5,4,2,2"}.
 *
 * <p>Each comma separated term must be satisfied by a different suit. A term is
 * an optional set of suit letters followed by a length: exact ({@code 5}),
 * at least ({@code 5+}), at most ({@code 3-}) or a range ({@code 5-6}). Suits
 * not claimed by any term are unconstrained.
 */
public final class ShapePattern {

    private final String source;
    private final List<Term> terms;

    private ShapePattern(String source, List<Term> terms) {
        this.source = source;
        this.terms = terms;
    }

    /**
     * @throws Errors.InvalidShapePatternError if the pattern is malformed
     */
    public static ShapePattern parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new Errors.InvalidShapePatternError(String.valueOf(pattern), "pattern is empty");
        }
        String[] parts = pattern.replace(" ", "").split(",");
        if (parts.length > Suit.values().length) {
            throw new Errors.InvalidShapePatternError(pattern, "more than 4 terms");
        }
        List<Term> terms = new ArrayList<>();
        for (String part : parts) {
            terms.add(Term.parse(part, pattern));
        }
        // Most restrictive terms first keeps the search shallow.
        terms.sort((a, b) -> Integer.compare(a.suits.size(), b.suits.size()));
        return new ShapePattern(pattern, Collections.unmodifiableList(terms));
    }

    public boolean matches(Hand hand) {
        return assign(0, hand, EnumSet.noneOf(Suit.class));
    }

    private boolean assign(int termIndex, Hand hand, Set<Suit> used) {
        if (termIndex == terms.size()) {
            return true;
        }
        Term term = terms.get(termIndex);
        for (Suit suit : term.suits) {
            if (used.contains(suit) || !term.accepts(hand.length(suit))) {
                continue;
            }
            used.add(suit);
            if (assign(termIndex + 1, hand, used)) {
                return true;
            }
            used.remove(suit);
        }
        return false;
    }

    @Override
    public String toString() {
        return source;
    }

    private static final class Term {
        private final Set<Suit> suits;
        private final int min;
        private final int max;

        private Term(Set<Suit> suits, int min, int max) {
            this.suits = suits;
            this.min = min;
            this.max = max;
        }

        boolean accepts(int length) {
            return length >= min && length <= max;
        }

        static Term parse(String text, String pattern) {
            if (text.isEmpty()) {
                throw new Errors.InvalidShapePatternError(pattern, "empty term");
            }
            int i = 0;
            Set<Suit> suits = EnumSet.noneOf(Suit.class);
            while (i < text.length() && Character.isLetter(text.charAt(i))) {
                Suit suit = Suit.fromSymbol(text.charAt(i));
                if (suit == null) {
                    throw new Errors.InvalidShapePatternError(pattern, "unknown suit '" + text.charAt(i) + "'");
                }
                suits.add(suit);
                i++;
            }
            if (suits.isEmpty()) {
                suits = EnumSet.allOf(Suit.class);
            }
            String length = text.substring(i);
            int min;
            int max;
            try {
                if (length.endsWith("+")) {
                    min = Integer.parseInt(length.substring(0, length.length() - 1));
                    max = 13;
                } else if (length.endsWith("-")) {
                    min = 0;
                    max = Integer.parseInt(length.substring(0, length.length() - 1));
                } else if (length.indexOf('-') > 0) {
                    int dash = length.indexOf('-');
                    min = Integer.parseInt(length.substring(0, dash));
                    max = Integer.parseInt(length.substring(dash + 1));
                } else {
                    min = Integer.parseInt(length);
                    max = min;
                }
            } catch (NumberFormatException e) {
                throw new Errors.InvalidShapePatternError(pattern, "bad length '" + length + "'");
            }
            if (min < 0 || max < 0) {
                throw new Errors.InvalidShapePatternError(pattern, "negative length '" + length + "'");
            }
            if (min > max) {
                throw new Errors.InvalidShapePatternError(pattern, "empty range " + length);
            }
            return new Term(suits, min, max);
        }
    }
}
