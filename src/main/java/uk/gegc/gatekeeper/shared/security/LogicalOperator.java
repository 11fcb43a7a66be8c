package uk.gegc.gatekeeper.shared.security;

/**
 * How a set of required permissions is combined.
 */
public enum LogicalOperator {
    /** Every permission must be granted. */
    AND,
    /** At least one permission must be granted. */
    OR
}
