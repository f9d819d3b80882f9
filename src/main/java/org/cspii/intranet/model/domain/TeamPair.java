package org.cspii.intranet.model.domain;

/**
 * The franchise and division a derived team belongs to.
 */
public record TeamPair(String franchiseId, String divisionId) {
}
