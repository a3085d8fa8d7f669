package com.example.shadowlands;

import com.example.shadowlands.error.EngineException;
import com.example.shadowlands.error.ErrorKind;
import com.example.shadowlands.model.AdvanceResult;
import com.example.shadowlands.model.Attributes;
import com.example.shadowlands.model.CharacterSheet;
import com.example.shadowlands.model.ChoiceResult;
import com.example.shadowlands.model.GameCharacter;
import com.example.shadowlands.model.QuestInstance;
import com.example.shadowlands.model.QuestStatistics;
import com.example.shadowlands.model.QuestStatus;
import com.example.shadowlands.model.RewardResult;
import com.example.shadowlands.quest.ConsequenceRegistry;
import com.example.shadowlands.quest.QuestCatalog;
import com.example.shadowlands.quest.QuestManager;
import com.example.shadowlands.util.AttributeDeriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QuestManager Tests")
class QuestManagerTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");
    private static final Attributes ATTRS = new Attributes(12, 12, 12, 0);

    private final AttributeDeriver deriver = new AttributeDeriver();
    private QuestManager manager;
    private GameCharacter hero;

    @BeforeEach
    void setUp() {
        AtomicInteger counter = new AtomicInteger();
        manager = new QuestManager(QuestCatalog.fromResource("/data/test-quests.yaml"), deriver,
            ConsequenceRegistry.withDefaults(), Clock.fixed(NOW, ZoneOffset.UTC),
            () -> "quest-" + counter.incrementAndGet());
        hero = characterAtLevel(1);
    }

    private GameCharacter characterAtLevel(int level) {
        return new GameCharacter("Hero", new CharacterSheet(ATTRS, level, 0, deriver.derive(ATTRS, level)));
    }

    private static ErrorKind kindOf(Runnable action) {
        return assertThrows(EngineException.class, action::run).getKind();
    }

    // ========== Start ==========

    @Test
    @DisplayName("Start creates an active instance in the quest log")
    void startCreatesActiveQuest() {
        QuestInstance q = manager.start(hero, "gather_003");

        assertEquals("quest-1", q.getQuestId());
        assertEquals("gather_003", q.getTemplateId());
        assertEquals(QuestStatus.ACTIVE, q.getStatus());
        assertEquals(NOW, q.getStartedAt());
        assertEquals(List.of(q), hero.getQuestLog());
    }

    @Test
    @DisplayName("Starting the same template twice while active is rejected")
    void startTwiceRejected() {
        manager.start(hero, "gather_003");
        assertEquals(ErrorKind.ALREADY_ACTIVE, kindOf(() -> manager.start(hero, "gather_003")));
        assertEquals(1, hero.getQuestLog().size());
    }

    @Test
    @DisplayName("Unknown template is a lookup error")
    void startUnknownTemplate() {
        assertEquals(ErrorKind.TEMPLATE_NOT_FOUND, kindOf(() -> manager.start(hero, "missing")));
    }

    @Test
    @DisplayName("Level requirement above the character's level is rejected")
    void startLevelTooLow() {
        assertEquals(ErrorKind.LEVEL_TOO_LOW, kindOf(() -> manager.start(hero, "veteran_005")));
        assertTrue(hero.getQuestLog().isEmpty());

        QuestInstance q = manager.start(characterAtLevel(5), "veteran_005");
        assertEquals(QuestStatus.ACTIVE, q.getStatus());
    }

    @Test
    @DisplayName("Quest with nothing to do completes on start")
    void emptyQuestCompletesOnStart() {
        QuestInstance q = manager.start(hero, "empty_quest");
        assertEquals(QuestStatus.COMPLETED, q.getStatus());
        assertEquals(NOW, q.getCompletedAt());
    }

    // ========== Objectives ==========

    @Test
    @DisplayName("Target 3 completes only on the third single increment")
    void threeIncrements() {
        QuestInstance q = manager.start(hero, "gather_003");

        AdvanceResult first = manager.advanceObjective(hero, q.getQuestId(), "collect", 1);
        AdvanceResult second = manager.advanceObjective(hero, q.getQuestId(), "collect", 1);
        AdvanceResult third = manager.advanceObjective(hero, q.getQuestId(), "collect", 1);

        assertFalse(first.objectiveCompleted());
        assertFalse(first.questCompleted());
        assertFalse(second.questCompleted());
        assertEquals(2, second.currentProgress());
        assertTrue(third.objectiveCompleted());
        assertTrue(third.questCompleted());
        assertEquals(QuestStatus.COMPLETED, q.getStatus());

        assertEquals(ErrorKind.QUEST_NOT_ACTIVE,
            kindOf(() -> manager.advanceObjective(hero, q.getQuestId(), "collect", 1)));
    }

    @ParameterizedTest
    @CsvSource({
        "3",
        "1 2",
        "2 1",
        "1 1 1",
        "5",
        "2 7"
    })
    @DisplayName("Any split of increments reaches the same outcome, completing once")
    void incrementSplits(String increments) {
        QuestInstance q = manager.start(hero, "gather_003");
        int completions = 0;
        for (String inc : increments.split(" ")) {
            if (manager.advanceObjective(hero, q.getQuestId(), "collect", Integer.parseInt(inc)).questCompleted()) {
                completions++;
            }
        }
        assertEquals(1, completions);
        assertEquals(3, q.getObjectives().get(0).currentProgress());
        assertEquals(QuestStatus.COMPLETED, q.getStatus());
    }

    @Test
    @DisplayName("Completing one of two objectives leaves the quest active")
    void partialObjectives() {
        QuestInstance q = manager.start(hero, "two_step");
        AdvanceResult r = manager.advanceObjective(hero, q.getQuestId(), "first", 1);

        assertTrue(r.objectiveCompleted());
        assertFalse(r.questCompleted());
        assertEquals(QuestStatus.ACTIVE, q.getStatus());
        assertEquals(50.0, q.completionPercentage(), 0.001);
    }

    @ParameterizedTest
    @CsvSource({"0", "-1"})
    @DisplayName("Non-positive increments are rejected")
    void invalidIncrement(int increment) {
        QuestInstance q = manager.start(hero, "gather_003");
        assertEquals(ErrorKind.INVALID_INCREMENT,
            kindOf(() -> manager.advanceObjective(hero, q.getQuestId(), "collect", increment)));
        assertEquals(0, q.getObjectives().get(0).currentProgress());
    }

    @Test
    @DisplayName("Unknown quest and objective ids are lookup errors")
    void unknownIds() {
        QuestInstance q = manager.start(hero, "gather_003");
        assertEquals(ErrorKind.QUEST_NOT_FOUND, kindOf(() -> manager.advanceObjective(hero, "nope", "collect", 1)));
        assertEquals(ErrorKind.OBJECTIVE_NOT_FOUND,
            kindOf(() -> manager.advanceObjective(hero, q.getQuestId(), "nope", 1)));
    }

    @Test
    @DisplayName("Another character's quest id is not found")
    void questsAreScopedToCharacter() {
        QuestInstance q = manager.start(hero, "gather_003");
        GameCharacter other = characterAtLevel(1);
        assertEquals(ErrorKind.QUEST_NOT_FOUND,
            kindOf(() -> manager.advanceObjective(other, q.getQuestId(), "collect", 1)));
    }

    @Test
    @DisplayName("Concurrent increments complete the quest exactly once")
    void concurrentIncrements() throws Exception {
        QuestInstance q = manager.start(hero, "gather_003");
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger completions = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    try {
                        if (manager.advanceObjective(hero, q.getQuestId(), "collect", 1).questCompleted()) {
                            completions.incrementAndGet();
                        }
                    } catch (EngineException e) {
                        assertEquals(ErrorKind.QUEST_NOT_ACTIVE, e.getKind());
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, completions.get());
        assertEquals(threads - 3, rejected.get());
        assertEquals(3, q.getObjectives().get(0).currentProgress());
    }

    // ========== Choices ==========

    @Test
    @DisplayName("Reputation consequence reaches the character once")
    void reputationChoice() {
        QuestInstance q = manager.start(hero, "choices_only");
        ChoiceResult r = manager.makeChoice(hero, q.getQuestId(), "left");

        assertEquals(1, r.consequences().size());
        assertFalse(r.questCompleted());
        assertEquals(5, hero.getReputation("roadwardens"));
        assertEquals(QuestStatus.ACTIVE, q.getStatus());
    }

    @Test
    @DisplayName("Quest without objectives completes when its last choice is made")
    void choicesOnlyCompletesOnLastChoice() {
        QuestInstance q = manager.start(hero, "choices_only");
        manager.makeChoice(hero, q.getQuestId(), "left");
        ChoiceResult last = manager.makeChoice(hero, q.getQuestId(), "right");

        assertTrue(last.questCompleted());
        assertEquals(QuestStatus.COMPLETED, q.getStatus());
        assertEquals(ErrorKind.QUEST_NOT_ACTIVE, kindOf(() -> manager.makeChoice(hero, q.getQuestId(), "left")));
        assertEquals(5, hero.getReputation("roadwardens"));
    }

    @Test
    @DisplayName("A choice never completes a quest with open objectives")
    void choiceDoesNotCompleteObjectiveQuest() {
        QuestInstance q = manager.start(hero, "branching");
        ChoiceResult r = manager.makeChoice(hero, q.getQuestId(), "parley");

        assertFalse(r.questCompleted());
        assertEquals(QuestStatus.ACTIVE, q.getStatus());
        assertEquals(3, hero.getReputation("bandits"));
        assertEquals(ErrorKind.CHOICE_ALREADY_MADE, kindOf(() -> manager.makeChoice(hero, q.getQuestId(), "parley")));
        assertEquals(3, hero.getReputation("bandits"));
        assertEquals(ErrorKind.CHOICE_NOT_FOUND, kindOf(() -> manager.makeChoice(hero, q.getQuestId(), "flee")));
    }

    @Test
    @DisplayName("A failing consequence handler leaves the choice open and reputation untouched")
    void failingHandlerKeepsChoiceOpen() {
        ConsequenceRegistry registry = ConsequenceRegistry.withDefaults();
        registry.register("bandit_truce", (c, character, quest) -> {
            throw new IllegalStateException("truce ledger unavailable");
        });
        QuestManager strict = new QuestManager(QuestCatalog.fromResource("/data/test-quests.yaml"), deriver,
            registry, Clock.fixed(NOW, ZoneOffset.UTC), () -> "quest-strict");
        QuestInstance q = strict.start(hero, "branching");

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> strict.makeChoice(hero, q.getQuestId(), "parley"));
        assertEquals("truce ledger unavailable", e.getMessage());
        assertFalse(q.getChoices().stream().filter(c -> c.choiceId().equals("parley")).findFirst()
            .orElseThrow().made());
        assertTrue(q.getAppliedConsequences().isEmpty());
        assertEquals(0, hero.getReputation("bandits"));
        assertTrue(hero.getAllReputation().isEmpty());

        registry.register("bandit_truce", (c, character, quest) -> { });
        ChoiceResult retry = strict.makeChoice(hero, q.getQuestId(), "parley");

        assertEquals(2, retry.consequences().size());
        assertEquals(3, hero.getReputation("bandits"));
        assertEquals(2, q.getAppliedConsequences().size());
    }

    @Test
    @DisplayName("Added objective keeps the quest active until it is done")
    void addedObjectiveKeepsQuestActive() {
        QuestInstance q = manager.start(hero, "branching");
        manager.makeChoice(hero, q.getQuestId(), "fight");

        assertFalse(manager.advanceObjective(hero, q.getQuestId(), "scout", 1).questCompleted());
        assertEquals(QuestStatus.ACTIVE, q.getStatus());
        assertTrue(manager.advanceObjective(hero, q.getQuestId(), "added_1", 2).questCompleted());
    }

    // ========== Abandon ==========

    @Test
    @DisplayName("Abandoning fails the quest and frees the template")
    void abandon() {
        QuestInstance q = manager.start(hero, "gather_003");
        manager.abandon(hero, q.getQuestId());

        assertEquals(QuestStatus.FAILED, q.getStatus());
        assertEquals(ErrorKind.QUEST_NOT_ACTIVE, kindOf(() -> manager.abandon(hero, q.getQuestId())));

        QuestInstance again = manager.start(hero, "gather_003");
        assertNotEquals(q.getQuestId(), again.getQuestId());
        assertEquals(2, hero.getQuestLog().size());
    }

    // ========== Rewards ==========

    @Test
    @DisplayName("Claiming rewards grants everything once and levels up")
    void claimRewards() {
        QuestInstance q = manager.start(hero, "reward_quest");
        assertEquals(ErrorKind.QUEST_NOT_COMPLETED, kindOf(() -> manager.claimRewards(hero, q.getQuestId())));

        manager.advanceObjective(hero, q.getQuestId(), "deliver", 1);
        RewardResult r = manager.claimRewards(hero, q.getQuestId());

        assertEquals(1000, r.experienceGained());
        assertEquals(1, r.previousLevel());
        assertEquals(6, r.newLevel());
        assertTrue(r.leveledUp());
        assertEquals(1000, hero.getExperience());
        assertEquals(6, hero.getLevel());
        assertEquals(deriver.derive(ATTRS, 6), hero.getDerived());
        assertEquals(List.of("silver_locket"), hero.getItems());
        assertEquals(List.of("insight"), hero.getSkills());
        assertEquals(5, hero.getReputation("forest_guardians"));
        assertTrue(q.isRewardsClaimed());

        assertEquals(ErrorKind.REWARDS_ALREADY_CLAIMED, kindOf(() -> manager.claimRewards(hero, q.getQuestId())));
        assertEquals(1000, hero.getExperience());
        assertEquals(List.of("silver_locket"), hero.getItems());
    }

    @Test
    @DisplayName("Quest without rewards leaves the sheet unchanged")
    void claimWithoutRewards() {
        QuestInstance q = manager.start(hero, "gather_003");
        manager.advanceObjective(hero, q.getQuestId(), "collect", 3);
        CharacterSheet before = hero.getSheet();

        RewardResult r = manager.claimRewards(hero, q.getQuestId());
        assertEquals(0, r.experienceGained());
        assertFalse(r.leveledUp());
        assertEquals(before, hero.getSheet());
    }

    @Test
    @DisplayName("Experience never lowers a level set above the table")
    void experienceKeepsHigherLevel() {
        GameCharacter veteran = characterAtLevel(10);
        QuestInstance q = manager.start(veteran, "reward_quest");
        manager.advanceObjective(veteran, q.getQuestId(), "deliver", 1);

        RewardResult r = manager.claimRewards(veteran, q.getQuestId());
        assertEquals(10, r.newLevel());
        assertEquals(1000, veteran.getExperience());
    }

    // ========== Reads ==========

    @Test
    @DisplayName("Statistics and filtered listings follow the quest log")
    void statisticsAndListing() {
        QuestInstance done = manager.start(hero, "gather_003");
        manager.advanceObjective(hero, done.getQuestId(), "collect", 3);
        QuestInstance dropped = manager.start(hero, "two_step");
        manager.abandon(hero, dropped.getQuestId());
        manager.start(hero, "branching");
        manager.start(hero, "choices_only");

        QuestStatistics stats = manager.statistics(hero);
        assertEquals(2, stats.activeCount());
        assertEquals(1, stats.completedCount());
        assertEquals(1, stats.failedCount());
        assertEquals(4, stats.totalCount());
        assertEquals(1, stats.level());

        assertEquals(4, manager.quests(hero, null).size());
        assertEquals(List.of(done), manager.quests(hero, QuestStatus.COMPLETED));
        assertEquals(List.of(dropped), manager.quests(hero, QuestStatus.FAILED));
    }
}
