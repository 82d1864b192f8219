package dev.bbengine.handoff;

import dev.bbengine.bidding.Suit;

import java.util.EnumSet;
import java.util.Set;

/**
 * What one seat has told its partner about its suit lengths during a
 * convention.
 */
public class SuitSignals {
    private final Set<Suit> deniedFour = EnumSet.noneOf(Suit.class);
    private final Set<Suit> showedFour = EnumSet.noneOf(Suit.class);
    private final Set<Suit> showedFive = EnumSet.noneOf(Suit.class);
    private final Set<Suit> showedThree = EnumSet.noneOf(Suit.class);

    public boolean hasDeniedFour(Suit suit) { return deniedFour.contains(suit); }
    public void denyFour(Suit suit) { deniedFour.add(suit); }
    public boolean hasShownFour(Suit suit) { return showedFour.contains(suit); }
    public void showFour(Suit suit) { showedFour.add(suit); }
    public boolean hasShownFive(Suit suit) { return showedFive.contains(suit); }
    public void showFive(Suit suit) { showedFive.add(suit); }
    public boolean hasShownThree(Suit suit) { return showedThree.contains(suit); }
    public void showThree(Suit suit) { showedThree.add(suit); }

    @Override
    public String toString() {
        return "denied4=" + deniedFour + " showed4=" + showedFour
            + " showed5=" + showedFive + " showed3=" + showedThree;
    }
}
