package org.cspii.intranet.model.dto;

/**
 * Why an operation, or one item of a batch, did not fully succeed.
 */
public enum ErrorKind {
    /** A referenced directory entity is absent. */
    NOT_FOUND,
    /** The entity exists already; a success for idempotent paths, a conflict for explicit creation. */
    ALREADY_EXISTS,
    /** Some items of a batch failed; the per-item results tell which. */
    PARTIAL_FAILURE,
    /** Transport-level failure talking to the directory or the folder service. */
    GATEWAY_UNAVAILABLE
}
