package com.pitchcraft.core.model;

/**
 * Outcome of the score gate for one critique.
 */
public enum Decision {
    PASS,
    FAIL
}
