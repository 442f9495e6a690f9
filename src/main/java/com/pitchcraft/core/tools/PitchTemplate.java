package com.pitchcraft.core.tools;

import java.util.Locale;

/**
 * Proven pitch structures handed to the context step as a skeleton for the draft.
 */
public enum PitchTemplate {

    ELEVATOR("""
            ELEVATOR PITCH TEMPLATE:
            1. Hook (1 sentence): Grab attention with the problem
            2. Solution (1-2 sentences): What you built
            3. Unique Value (1 sentence): Why you're different
            4. Traction (1 sentence): Evidence it works
            5. Ask (1 sentence): What you need
            """),

    INVESTOR("""
            INVESTOR PITCH TEMPLATE:
            1. Problem: What pain point exists?
            2. Solution: Your product/MVP
            3. Market Size: TAM/SAM/SOM
            4. Business Model: How you make money
            5. Traction: Metrics, users, revenue
            6. Competition: Landscape and differentiation
            7. Team: Why you'll win
            8. Ask: Funding amount and use
            """),

    DEMO_DAY("""
            DEMO DAY PITCH TEMPLATE:
            1. Opening Hook: Surprising stat or story
            2. Problem: Relatable pain point
            3. Solution Demo: Show the product
            4. Market Opportunity: Size and timing
            5. Traction: Key metrics
            6. Vision: Where you're headed
            7. Team: Quick credibility
            8. The Ask: Clear and specific
            """);

    private final String structure;

    PitchTemplate(String structure) {
        this.structure = structure;
    }

    public String structure() {
        return structure;
    }

    /**
     * Resolves a template by name ("elevator", "investor", "demo_day" or "demo-day"),
     * falling back to {@link #ELEVATOR} for anything unknown.
     */
    public static PitchTemplate fromName(String name) {
        if (name == null || name.isBlank()) {
            return ELEVATOR;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (PitchTemplate template : values()) {
            if (template.name().equals(normalized)) {
                return template;
            }
        }
        return ELEVATOR;
    }
}
