package com.example.shadowlands;

import com.example.shadowlands.combat.CombatCalculator;
import com.example.shadowlands.combat.CombatResolver;
import com.example.shadowlands.config.EngineConfig;
import com.example.shadowlands.quest.ConsequenceRegistry;
import com.example.shadowlands.quest.QuestCatalog;
import com.example.shadowlands.quest.QuestManager;
import com.example.shadowlands.session.SessionManager;
import com.example.shadowlands.util.AttributeDeriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.UUID;

/**
 * Wires the engine components together from a configuration.
 */
public class GameEngine {

    private static final Logger logger = LoggerFactory.getLogger(GameEngine.class);

    private final EngineConfig config;
    private final AttributeDeriver deriver;
    private final CombatResolver combat;
    private final QuestCatalog catalog;
    private final ConsequenceRegistry consequences;
    private final QuestManager quests;
    private final SessionManager sessions;

    public GameEngine(EngineConfig config, QuestCatalog catalog, Clock clock) {
        this.config = config;
        this.deriver = new AttributeDeriver(config.getDerivation());
        this.combat = new CombatResolver(new CombatCalculator(config.getCombat()));
        this.catalog = catalog;
        this.consequences = ConsequenceRegistry.withDefaults();
        this.quests = new QuestManager(catalog, deriver, consequences, clock,
            () -> UUID.randomUUID().toString());
        this.sessions = new SessionManager(deriver, combat, quests,
            config.getDefaultAttributes(), config.getDefaultLevel(), clock);
        logger.info("Game engine ready with {} quest templates", catalog.size());
    }

    /**
     * Engine from {@code /engine.yaml} and the quest resource it names.
     */
    public static GameEngine fromClasspath() {
        return fromConfig(EngineConfig.load());
    }

    public static GameEngine fromConfig(EngineConfig config) {
        return new GameEngine(config, QuestCatalog.fromResource(config.getQuestResource()), Clock.systemUTC());
    }

    public EngineConfig getConfig() { return config; }
    public AttributeDeriver getDeriver() { return deriver; }
    public CombatResolver getCombat() { return combat; }
    public QuestCatalog getCatalog() { return catalog; }
    /** Register extra consequence handlers here before sessions start making choices */
    public ConsequenceRegistry getConsequences() { return consequences; }
    public QuestManager getQuests() { return quests; }
    public SessionManager getSessions() { return sessions; }
}
