package dev.bbengine.handoff;

import dev.bbengine.bidding.Seat;

import java.util.EnumMap;
import java.util.Map;

/**
 * Running state of one CONFI sequence: the phase machine plus everything the
 * two seats have signalled so far. Lives only as long as the hand-off.
 */
public class ConfiProcess {
    private ConfiPhase phase = ConfiPhase.CONTROL_STEP;
    private Seat opener;
    private int openerControls;
    private boolean openersFirstRebid = true;
    private final Map<Seat, SuitSignals> signals = new EnumMap<>(Seat.class);

    public ConfiPhase getPhase() { return phase; }
    public void setPhase(ConfiPhase phase) { this.phase = phase; }
    public Seat getOpener() { return opener; }
    public void setOpener(Seat opener) { this.opener = opener; }
    public int getOpenerControls() { return openerControls; }
    public void setOpenerControls(int openerControls) { this.openerControls = openerControls; }
    public boolean isOpenersFirstRebid() { return openersFirstRebid; }
    public void setOpenersFirstRebid(boolean openersFirstRebid) { this.openersFirstRebid = openersFirstRebid; }

    public SuitSignals signals(Seat seat) {
        return signals.computeIfAbsent(seat, s -> new SuitSignals());
    }

    public boolean isComplete() {
        return phase == ConfiPhase.COMPLETE;
    }
}
