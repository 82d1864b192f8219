package dev.bbengine.criteria;

/**
 * How the results of several criteria reduce to one.
 */
public enum Combinator {
    /** Logical AND; true for an empty list. */
    ALL,
    /** Logical OR; false for an empty list. */
    ANY
}
