package com.taskboard.backend.modules.assignee.domain;

/**
 * Progress of one bulk assignee replacement. Stages advance in declaration order up to
 * {@link #COMMITTED}; any non-terminal stage may instead end in {@link #ROLLED_BACK}.
 */
public enum ReconciliationStage {
    STARTED,
    LOADED,
    DIFFED,
    VALIDATED,
    APPLIED,
    COMMITTED,
    ROLLED_BACK
}
