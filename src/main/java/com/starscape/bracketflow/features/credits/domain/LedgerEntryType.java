package com.starscape.bracketflow.features.credits.domain;

public enum LedgerEntryType {
    DEPOSIT,
    RESERVE,
    RELEASE,
    SETTLE
}
