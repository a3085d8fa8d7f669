package com.example.shadowlands.session;

import com.example.shadowlands.combat.CombatResolver;
import com.example.shadowlands.error.EngineException;
import com.example.shadowlands.error.ErrorKind;
import com.example.shadowlands.model.Attributes;
import com.example.shadowlands.model.CharacterSheet;
import com.example.shadowlands.model.DerivedAttributes;
import com.example.shadowlands.model.GameCharacter;
import com.example.shadowlands.quest.QuestManager;
import com.example.shadowlands.util.AttributeDeriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live sessions. Sessions are independent; ending one drops its character
 * and quest log.
 */
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    /** All live sessions by session ID */
    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    private final AttributeDeriver deriver;
    private final CombatResolver combat;
    private final QuestManager quests;
    private final Attributes defaultAttributes;
    private final int defaultLevel;
    private final Clock clock;

    public SessionManager(AttributeDeriver deriver, CombatResolver combat, QuestManager quests,
                          Attributes defaultAttributes, int defaultLevel, Clock clock) {
        this.deriver = deriver;
        this.combat = combat;
        this.quests = quests;
        this.defaultAttributes = defaultAttributes;
        this.defaultLevel = defaultLevel;
        this.clock = clock;
    }

    // ========== Lifecycle ==========

    /**
     * Start a session with the default attributes and level.
     */
    public GameSession create(String characterName) {
        return create(characterName, defaultAttributes, defaultLevel);
    }

    /**
     * Start a session. Null attributes or a null level fall back to the defaults.
     *
     * @throws EngineException INVALID_ATTRIBUTES, INVALID_LEVEL
     */
    public GameSession create(String characterName, Attributes attributes, Integer level) {
        Attributes attrs = attributes != null ? attributes : defaultAttributes;
        int lvl = level != null ? level : defaultLevel;
        DerivedAttributes derived = deriver.derive(attrs, lvl);

        GameCharacter character = new GameCharacter(characterName, new CharacterSheet(attrs, lvl, 0, derived));
        String sessionId = UUID.randomUUID().toString();
        GameSession session = new GameSession(sessionId, character, clock.instant(), deriver, combat, quests);
        sessions.put(sessionId, session);

        logger.info("Created session {} for {} (level {})", sessionId, character.getName(), lvl);
        return session;
    }

    /**
     * End a session.
     * @return true if the session existed
     */
    public boolean end(String sessionId) {
        GameSession removed = sessionId != null ? sessions.remove(sessionId) : null;
        if (removed != null) {
            logger.info("Ended session {} for {}", sessionId, removed.getCharacter().getName());
        }
        return removed != null;
    }

    // ========== Lookup ==========

    public Optional<GameSession> get(String sessionId) {
        return sessionId != null ? Optional.ofNullable(sessions.get(sessionId)) : Optional.empty();
    }

    /**
     * @throws EngineException NO_SESSION if there is no live session with this id
     */
    public GameSession require(String sessionId) {
        return get(sessionId).orElseThrow(() ->
            EngineException.of(ErrorKind.NO_SESSION, "No active session %s", sessionId));
    }

    public Collection<GameSession> activeSessions() {
        return sessions.values();
    }

    public int size() {
        return sessions.size();
    }
}
