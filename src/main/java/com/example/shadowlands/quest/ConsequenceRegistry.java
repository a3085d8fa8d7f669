package com.example.shadowlands.quest;

import com.example.shadowlands.model.Consequence;
import com.example.shadowlands.model.GameCharacter;
import com.example.shadowlands.model.QuestInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handlers for character-level consequences, keyed by action name.
 * Actions without a handler stay recorded on the quest and change nothing else.
 */
public class ConsequenceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConsequenceRegistry.class);

    private final Map<String, ConsequenceHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registry with the built-in handlers.
     */
    public static ConsequenceRegistry withDefaults() {
        ConsequenceRegistry registry = new ConsequenceRegistry();
        registry.register(Consequence.REPUTATION_CHANGE, (c, character, quest) -> {
            String faction = c.getString("faction", "");
            if (faction.isEmpty()) {
                logger.warn("reputation_change without faction in quest {}", quest.getQuestId());
                return;
            }
            int standing = character.adjustReputation(faction, c.getInt("value", 0));
            logger.debug("{} reputation with {} is now {}", character.getName(), faction, standing);
        });
        return registry;
    }

    public void register(String action, ConsequenceHandler handler) {
        if (action != null && handler != null) handlers.put(action, handler);
    }

    public boolean hasHandler(String action) {
        return action != null && handlers.containsKey(action);
    }

    public void apply(Consequence consequence, GameCharacter character, QuestInstance quest) {
        ConsequenceHandler h = handlers.get(consequence.action());
        if (h != null) {
            h.apply(consequence, character, quest);
        }
    }
}
