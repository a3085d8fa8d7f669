package com.example.shadowlands.model;

import java.util.List;

public record ChoiceResult(String questId, String choiceId, List<Consequence> consequences, boolean questCompleted) {

    public ChoiceResult {
        consequences = List.copyOf(consequences);
    }
}
