package com.pitchcraft.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/pitches/{id}/approval.
 *
 * @param approved true to accept the draft, false to request another refinement
 * @param feedback what to improve (rejection) or notes for the final package (approval); nullable
 */
public record ApprovalRequest(Boolean approved, String feedback) {}
