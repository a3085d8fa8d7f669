package com.example.shadowlands.api;

import com.example.shadowlands.GameEngine;
import com.example.shadowlands.combat.CombatExchange;
import com.example.shadowlands.error.EngineException;
import com.example.shadowlands.model.AdvanceResult;
import com.example.shadowlands.model.Attributes;
import com.example.shadowlands.model.CharacterSheet;
import com.example.shadowlands.model.ChoiceResult;
import com.example.shadowlands.model.DerivedAttributes;
import com.example.shadowlands.model.QuestInstance;
import com.example.shadowlands.model.QuestStatus;
import com.example.shadowlands.model.RewardResult;
import com.example.shadowlands.session.GameSession;
import com.example.shadowlands.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Boundary between a transport and the engine. Each method is one externally named
 * operation; results come back in the uniform envelope with a status code:
 * 200 success, 400 caller error, 401 no session, 404 unknown id, 500 engine fault.
 */
public class GameApi {

    private static final Logger logger = LoggerFactory.getLogger(GameApi.class);

    static final String INTERNAL_ERROR = "InternalError";

    private final GameEngine engine;
    private final SessionManager sessions;

    public GameApi(GameEngine engine) {
        this.engine = engine;
        this.sessions = engine.getSessions();
    }

    // ========== Sessions & characters ==========

    public ApiResponse createSession(String characterName, Attributes attributes, Integer level) {
        return execute("create_session", () -> {
            GameSession session = sessions.create(characterName, attributes, level);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("session_id", session.getSessionId());
            data.put("character", ResponseMapper.character(session.getCharacter()));
            return data;
        }, "Session created");
    }

    public ApiResponse endSession(String sessionId) {
        return execute("end_session", () -> {
            sessions.require(sessionId);
            sessions.end(sessionId);
            return new LinkedHashMap<>();
        }, "Session ended");
    }

    public ApiResponse getCharacter(String sessionId) {
        return execute("get_character", () ->
            ResponseMapper.character(sessions.require(sessionId).getCharacter()), "Character retrieved");
    }

    public ApiResponse deriveAttributes(Attributes attributes, int level) {
        return execute("derive_attributes", () -> {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("derived_attributes", ResponseMapper.derived(engine.getDeriver().derive(attributes, level)));
            return data;
        }, "Derived attributes calculated");
    }

    public ApiResponse replaceAttributes(String sessionId, Attributes attributes, int level) {
        return execute("replace_attributes", () -> {
            GameSession session = sessions.require(sessionId);
            CharacterSheet sheet = session.replaceAttributes(attributes, level);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("attributes", ResponseMapper.attributes(sheet.attributes()));
            data.put("level", sheet.level());
            data.put("derived_attributes", ResponseMapper.derived(sheet.derived()));
            return data;
        }, "Attributes updated");
    }

    // ========== Combat ==========

    /**
     * The session's character attacks a defender described by attributes and level.
     * A null seed draws from an unseeded source, so the outcome is not reproducible;
     * pass a seed when the exchange has to be replayed.
     */
    public ApiResponse resolveCombat(String sessionId, Attributes defenderAttributes, int defenderLevel,
                                     int weaponDamage, int armorValue, Long seed) {
        return execute("resolve_combat", () -> {
            GameSession session = sessions.require(sessionId);
            DerivedAttributes defender = engine.getDeriver().derive(defenderAttributes, defenderLevel);
            Random rng = seed != null ? new Random(seed) : new Random();
            CombatExchange exchange = session.attack(defender, weaponDamage, armorValue, rng);
            return ResponseMapper.combat(exchange);
        }, "Combat action resolved");
    }

    // ========== Quests ==========

    public ApiResponse listTemplates() {
        return execute("list_templates", () -> {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("templates", ResponseMapper.templates(engine.getCatalog().listTemplates()));
            data.put("total_templates", engine.getCatalog().size());
            return data;
        }, "Quest templates retrieved");
    }

    public ApiResponse availableQuests(String sessionId) {
        return execute("available_quests", () -> {
            GameSession session = sessions.require(sessionId);
            Map<String, Object> data = new LinkedHashMap<>();
            var available = session.availableQuests();
            data.put("available_quests", ResponseMapper.templates(available));
            data.put("character_level", session.getCharacter().getLevel());
            data.put("total_available", available.size());
            return data;
        }, "Available quests retrieved");
    }

    public ApiResponse startQuest(String sessionId, String templateId) {
        return execute("start_quest", () -> {
            QuestInstance quest = sessions.require(sessionId).startQuest(templateId);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("quest", ResponseMapper.quest(quest));
            data.put("started", true);
            return data;
        }, "Quest started");
    }

    public ApiResponse getQuest(String sessionId, String questId) {
        return execute("get_quest", () -> {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("quest", ResponseMapper.quest(sessions.require(sessionId).getQuest(questId)));
            return data;
        }, "Quest retrieved");
    }

    public ApiResponse listQuests(String sessionId, QuestStatus statusFilter) {
        return execute("list_quests", () -> {
            var quests = sessions.require(sessionId).getQuests(statusFilter);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("quests", ResponseMapper.quests(quests));
            data.put("total", quests.size());
            return data;
        }, "Quests retrieved");
    }

    public ApiResponse advanceObjective(String sessionId, String questId, String objectiveId, int increment) {
        return execute("advance_objective", () -> {
            AdvanceResult r = sessions.require(sessionId).advanceObjective(questId, objectiveId, increment);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("objective_completed", r.objectiveCompleted());
            data.put("quest_completed", r.questCompleted());
            data.put("current_progress", r.currentProgress());
            data.put("target_count", r.targetCount());
            return data;
        }, "Objective progress updated");
    }

    public ApiResponse makeChoice(String sessionId, String questId, String choiceId) {
        return execute("make_choice", () -> {
            ChoiceResult r = sessions.require(sessionId).makeChoice(questId, choiceId);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("choice_made", true);
            data.put("consequences", ResponseMapper.consequences(r.consequences()));
            data.put("quest_completed", r.questCompleted());
            return data;
        }, "Choice made");
    }

    public ApiResponse abandonQuest(String sessionId, String questId) {
        return execute("abandon_quest", () -> {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("quest", ResponseMapper.quest(sessions.require(sessionId).abandonQuest(questId)));
            return data;
        }, "Quest abandoned");
    }

    public ApiResponse claimRewards(String sessionId, String questId) {
        return execute("claim_rewards", () -> {
            RewardResult r = sessions.require(sessionId).claimRewards(questId);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("rewards", ResponseMapper.rewards(r.rewards()));
            data.put("experience_gained", r.experienceGained());
            data.put("level", r.newLevel());
            data.put("leveled_up", r.leveledUp());
            return data;
        }, "Rewards claimed");
    }

    public ApiResponse statistics(String sessionId) {
        return execute("quest_statistics", () ->
            ResponseMapper.statistics(sessions.require(sessionId).statistics()), "Quest statistics retrieved");
    }

    // ========== Envelope ==========

    private ApiResponse execute(String operation, Supplier<Map<String, Object>> action, String successMessage) {
        try {
            return ApiResponse.ok(action.get(), successMessage);
        } catch (EngineException e) {
            logger.debug("{} rejected: {} {}", operation, e.getKind(), e.getMessage());
            return ApiResponse.failure(e.getKind().getStatus(), e.getKind().getCode(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected engine fault during {}", operation, e);
            return ApiResponse.failure(500, INTERNAL_ERROR, "Internal engine error");
        }
    }
}
