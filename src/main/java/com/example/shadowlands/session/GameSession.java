package com.example.shadowlands.session;

import com.example.shadowlands.combat.CombatExchange;
import com.example.shadowlands.combat.CombatResolver;
import com.example.shadowlands.model.AdvanceResult;
import com.example.shadowlands.model.Attributes;
import com.example.shadowlands.model.CharacterSheet;
import com.example.shadowlands.model.ChoiceResult;
import com.example.shadowlands.model.DerivedAttributes;
import com.example.shadowlands.model.GameCharacter;
import com.example.shadowlands.model.QuestInstance;
import com.example.shadowlands.model.QuestStatistics;
import com.example.shadowlands.model.QuestStatus;
import com.example.shadowlands.model.QuestTemplate;
import com.example.shadowlands.model.RewardResult;
import com.example.shadowlands.quest.QuestManager;
import com.example.shadowlands.util.AttributeDeriver;

import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * One player's session: owns exactly one character and, through it, the quest log.
 *
 * Every operation goes through the character this session owns; nothing here reaches
 * another session's state. Mutations are serialized on the session.
 */
public class GameSession {
    private final String sessionId;
    private final GameCharacter character;
    private final Instant createdAt;

    private final AttributeDeriver deriver;
    private final CombatResolver combat;
    private final QuestManager quests;

    GameSession(String sessionId, GameCharacter character, Instant createdAt,
                AttributeDeriver deriver, CombatResolver combat, QuestManager quests) {
        this.sessionId = sessionId;
        this.character = character;
        this.createdAt = createdAt;
        this.deriver = deriver;
        this.combat = combat;
        this.quests = quests;
    }

    public String getSessionId() { return sessionId; }
    public GameCharacter getCharacter() { return character; }
    public Instant getCreatedAt() { return createdAt; }

    public CharacterSheet getSheet() { return character.getSheet(); }
    public DerivedAttributes getDerived() { return character.getDerived(); }

    // ========== Attributes ==========

    /**
     * Recreate the character's attributes and level. The derived values are computed first
     * and the new sheet is published in one step; on a validation error nothing changes.
     */
    public synchronized CharacterSheet replaceAttributes(Attributes attributes, int level) {
        DerivedAttributes derived = deriver.derive(attributes, level);
        return character.updateSheet(old -> new CharacterSheet(attributes, level, old.experience(), derived));
    }

    // ========== Combat ==========

    /**
     * This session's character attacks a defender.
     */
    public CombatExchange attack(DerivedAttributes defender, int weaponDamage, int armorValue, Random rng) {
        return combat.resolve(character.getDerived(), defender, weaponDamage, armorValue, rng);
    }

    /**
     * This session's character is attacked.
     */
    public CombatExchange defend(DerivedAttributes attacker, int weaponDamage, int armorValue, Random rng) {
        return combat.resolve(attacker, character.getDerived(), weaponDamage, armorValue, rng);
    }

    // ========== Quests ==========

    public synchronized QuestInstance startQuest(String templateId) {
        return quests.start(character, templateId);
    }

    public synchronized AdvanceResult advanceObjective(String questId, String objectiveId, int increment) {
        return quests.advanceObjective(character, questId, objectiveId, increment);
    }

    public synchronized ChoiceResult makeChoice(String questId, String choiceId) {
        return quests.makeChoice(character, questId, choiceId);
    }

    public synchronized QuestInstance abandonQuest(String questId) {
        return quests.abandon(character, questId);
    }

    public synchronized RewardResult claimRewards(String questId) {
        return quests.claimRewards(character, questId);
    }

    public QuestInstance getQuest(String questId) {
        return quests.requireQuest(character, questId);
    }

    public List<QuestInstance> getQuests(QuestStatus statusFilter) {
        return quests.quests(character, statusFilter);
    }

    public QuestStatistics statistics() {
        return quests.statistics(character);
    }

    public List<QuestTemplate> availableQuests() {
        return quests.getCatalog().availableFor(character);
    }
}
