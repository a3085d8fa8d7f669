package com.example.shadowlands.quest;

import com.example.shadowlands.model.Consequence;
import com.example.shadowlands.model.GameCharacter;
import com.example.shadowlands.model.QuestInstance;

/**
 * Applies one kind of choice consequence to the character that made the choice.
 * Consequences that only reshape the quest itself are applied by {@link QuestInstance}.
 */
public interface ConsequenceHandler {

    void apply(Consequence consequence, GameCharacter character, QuestInstance quest);
}
