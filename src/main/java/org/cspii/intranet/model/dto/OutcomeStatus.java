package org.cspii.intranet.model.dto;

public enum OutcomeStatus {
    SUCCEEDED,
    SUCCEEDED_WITH_SKIPS,
    FAILED
}
