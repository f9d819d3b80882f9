package org.cspii.intranet.model.domain;

public enum GroupKind {
    TEAM,
    FRANCHISE,
    DIVISION
}
