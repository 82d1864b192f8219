package dev.bbengine.handoff;

/**
 * Phases of the CONFI control-showing slam exploration.
 */
public enum ConfiPhase {
    CONTROL_STEP,
    SUFFICIENCY_CHECK,
    MINIMUM_CORRECTION,
    LONG_SUIT_CHECK,
    FIT_SEARCH,
    SUIT_CASCADE,
    SIGNOFF,
    COMPLETE
}
