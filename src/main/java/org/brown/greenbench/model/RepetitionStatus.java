package org.brown.greenbench.model;

public enum RepetitionStatus {
    OK,
    FAILED,
    PARTIAL
}
