package com.example.shadowlands.model;

import java.util.List;

/**
 * Template-side definition of a branching choice and the consequences it applies.
 */
public record ChoiceDef(String choiceId, String description, List<Consequence> consequences) {

    public ChoiceDef {
        if (choiceId == null || choiceId.isEmpty()) {
            throw new IllegalArgumentException("choice id is required");
        }
        description = description != null ? description : "";
        consequences = consequences != null ? List.copyOf(consequences) : List.of();
    }
}
