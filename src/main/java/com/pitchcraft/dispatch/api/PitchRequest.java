package com.pitchcraft.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/pitches.
 *
 * @param description free-text product description the pitch is built from
 */
public record PitchRequest(String description) {}
