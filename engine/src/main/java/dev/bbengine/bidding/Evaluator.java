package dev.bbengine.bidding;

import java.util.Arrays;

/**
 * Rank-weighted point count: the sum over a hand's cards of a per-rank weight,
 * with weights given from the ace downwards. Unlisted ranks and spot cards
 * count zero.
 */
public final class Evaluator {

    /** Milton Work high-card points: A=4, K=3, Q=2, J=1. */
    public static final Evaluator HCP = Evaluator.of(4, 3, 2, 1);

    /** Controls: A=2, K=1. */
    public static final Evaluator CONTROLS = Evaluator.of(2, 1);

    private final int[] weights;

    private Evaluator(int[] weights) {
        this.weights = weights;
    }

    public static Evaluator of(int... weights) {
        if (weights.length > Hand.RANKS.length()) {
            throw new IllegalArgumentException("At most " + Hand.RANKS.length() + " rank weights");
        }
        return new Evaluator(Arrays.copyOf(weights, weights.length));
    }

    public int evaluate(Hand hand) {
        int points = 0;
        for (int i = 0; i < weights.length; i++) {
            points += hand.count(Hand.RANKS.charAt(i)) * weights[i];
        }
        return points;
    }
}
