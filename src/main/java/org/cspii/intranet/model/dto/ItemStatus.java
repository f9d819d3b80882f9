package org.cspii.intranet.model.dto;

public enum ItemStatus {
    CREATED,
    APPLIED,
    SKIPPED,
    FAILED
}
