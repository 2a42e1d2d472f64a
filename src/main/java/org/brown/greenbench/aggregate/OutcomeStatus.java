package org.brown.greenbench.aggregate;

public enum OutcomeStatus {
    SUCCESS,
    FAILED
}
