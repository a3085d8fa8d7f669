package com.example.shadowlands.quest;

import com.example.shadowlands.error.EngineException;
import com.example.shadowlands.error.ErrorKind;
import com.example.shadowlands.model.AdvanceResult;
import com.example.shadowlands.model.ChoiceDef;
import com.example.shadowlands.model.ChoiceResult;
import com.example.shadowlands.model.Consequence;
import com.example.shadowlands.model.GameCharacter;
import com.example.shadowlands.model.QuestInstance;
import com.example.shadowlands.model.QuestStatistics;
import com.example.shadowlands.model.QuestStatus;
import com.example.shadowlands.model.QuestTemplate;
import com.example.shadowlands.model.RewardDef;
import com.example.shadowlands.model.RewardResult;
import com.example.shadowlands.util.AttributeDeriver;
import com.example.shadowlands.util.ExperienceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Starts quest instances and drives them through their lifecycle.
 *
 * Quest states: ACTIVE -> COMPLETED | FAILED. Objectives: in progress -> completed.
 * Choices: available -> made. All terminal.
 *
 * The character whose quest log is touched is always passed in explicitly.
 */
public class QuestManager {

    private static final Logger logger = LoggerFactory.getLogger(QuestManager.class);

    private final QuestCatalog catalog;
    private final AttributeDeriver deriver;
    private final ConsequenceRegistry consequences;
    private final Clock clock;
    private final Supplier<String> questIds;

    public QuestManager(QuestCatalog catalog, AttributeDeriver deriver, ConsequenceRegistry consequences,
                        Clock clock, Supplier<String> questIds) {
        this.catalog = catalog;
        this.deriver = deriver;
        this.consequences = consequences;
        this.clock = clock;
        this.questIds = questIds;
    }

    public QuestCatalog getCatalog() { return catalog; }

    /**
     * Start a new instance of a template for the character.
     *
     * @throws EngineException TEMPLATE_NOT_FOUND, LEVEL_TOO_LOW, ALREADY_ACTIVE
     */
    public QuestInstance start(GameCharacter character, String templateId) {
        QuestTemplate template = catalog.getTemplate(templateId);
        int level = character.getLevel();
        if (!template.isAvailableAtLevel(level)) {
            throw EngineException.of(ErrorKind.LEVEL_TOO_LOW,
                "Quest %s requires level %d, character is level %d",
                templateId, template.getLevelRequirement(), level);
        }
        QuestInstance quest;
        synchronized (character) {
            if (character.hasActiveQuest(templateId)) {
                throw EngineException.of(ErrorKind.ALREADY_ACTIVE,
                    "Quest %s is already active for %s", templateId, character.getName());
            }
            quest = new QuestInstance(questIds.get(), template, clock.instant());
            character.addQuest(quest);
        }
        logger.info("{} started quest {} ({})", character.getName(), template.getTitle(), quest.getQuestId());
        if (quest.getStatus() == QuestStatus.COMPLETED) {
            logger.info("Quest {} has nothing to do and completed on start", quest.getQuestId());
        }
        return quest;
    }

    /**
     * Add progress to one objective of an active quest.
     *
     * @throws EngineException QUEST_NOT_FOUND, QUEST_NOT_ACTIVE, INVALID_INCREMENT, OBJECTIVE_NOT_FOUND
     */
    public AdvanceResult advanceObjective(GameCharacter character, String questId, String objectiveId, int increment) {
        QuestInstance quest = requireQuest(character, questId);
        AdvanceResult result = quest.advanceObjective(objectiveId, increment, clock.instant());
        logger.debug("Quest {} objective {} at {}/{}", questId, objectiveId,
            result.currentProgress(), result.targetCount());
        if (result.questCompleted()) {
            logger.info("{} completed quest {}", character.getName(), quest);
        }
        return result;
    }

    /**
     * Make a choice in an active quest and apply its consequences once.
     * Handlers run before the choice is recorded; if one throws, reputation changes
     * from the earlier handlers are undone and the choice stays open.
     *
     * @throws EngineException QUEST_NOT_FOUND, QUEST_NOT_ACTIVE, CHOICE_NOT_FOUND, CHOICE_ALREADY_MADE
     */
    public ChoiceResult makeChoice(GameCharacter character, String questId, String choiceId) {
        QuestInstance quest = requireQuest(character, questId);
        ChoiceResult result;
        synchronized (quest) {
            ChoiceDef choice = quest.pendingChoice(choiceId);
            Map<String, Integer> standings = character.getAllReputation();
            try {
                for (Consequence c : choice.consequences()) {
                    if (consequences.hasHandler(c.action())) {
                        consequences.apply(c, character, quest);
                    } else if (!Consequence.ADD_OBJECTIVE.equals(c.action())) {
                        logger.debug("No handler for {} in quest {}, recorded only", c.action(), questId);
                    }
                }
            } catch (RuntimeException e) {
                character.restoreReputation(standings);
                logger.warn("Choice {} in quest {} rolled back: {}", choiceId, questId, e.getMessage());
                throw e;
            }
            result = quest.makeChoice(choiceId, clock.instant());
        }
        logger.debug("{} chose {} in quest {} ({} consequences)", character.getName(), choiceId, questId,
            result.consequences().size());
        if (result.questCompleted()) {
            logger.info("{} completed quest {}", character.getName(), quest);
        }
        return result;
    }

    /**
     * Give up on an active quest. The template may be started again afterwards.
     *
     * @throws EngineException QUEST_NOT_FOUND, QUEST_NOT_ACTIVE
     */
    public QuestInstance abandon(GameCharacter character, String questId) {
        QuestInstance quest = requireQuest(character, questId);
        quest.fail(clock.instant());
        logger.info("{} abandoned quest {}", character.getName(), quest);
        return quest;
    }

    /**
     * Hand out the rewards of a completed quest. Experience may raise the level,
     * in which case derived attributes are recomputed with the new sheet.
     *
     * @throws EngineException QUEST_NOT_FOUND, QUEST_NOT_COMPLETED, REWARDS_ALREADY_CLAIMED
     */
    public RewardResult claimRewards(GameCharacter character, String questId) {
        QuestInstance quest = requireQuest(character, questId);
        quest.claimRewards();

        List<RewardDef> rewards = catalog.getTemplate(quest.getTemplateId()).getRewards();
        int experience = 0;
        for (RewardDef reward : rewards) {
            switch (reward.type()) {
                case EXPERIENCE:
                    experience += reward.experienceAmount();
                    break;
                case ITEM:
                    character.grantItem(reward.value());
                    break;
                case SKILL:
                    character.grantSkill(reward.value());
                    break;
                case REPUTATION:
                    character.adjustReputation(reward.reputationFaction(), reward.reputationAmount());
                    break;
                default:
                    break;
            }
        }

        int previousLevel = character.getLevel();
        int gained = experience;
        int newLevel = character.updateSheet(sheet -> {
            int total = sheet.experience() + gained;
            int level = Math.max(sheet.level(), ExperienceTable.levelFor(total));
            return sheet.withExperience(total, level, deriver.derive(sheet.attributes(), level));
        }).level();

        if (newLevel > previousLevel) {
            logger.info("{} reached level {}", character.getName(), newLevel);
        }
        return new RewardResult(questId, rewards, gained, previousLevel, newLevel);
    }

    /**
     * Counts over the character's quest log. Reads only.
     */
    public QuestStatistics statistics(GameCharacter character) {
        int active = 0;
        int completed = 0;
        int failed = 0;
        for (QuestInstance q : character.getQuestLog()) {
            switch (q.getStatus()) {
                case ACTIVE: active++; break;
                case COMPLETED: completed++; break;
                case FAILED: failed++; break;
                default: break;
            }
        }
        return new QuestStatistics(active, completed, failed, character.getLevel());
    }

    /**
     * Quests in the character's log, optionally restricted to one status.
     */
    public List<QuestInstance> quests(GameCharacter character, QuestStatus statusFilter) {
        List<QuestInstance> out = new ArrayList<>();
        for (QuestInstance q : character.getQuestLog()) {
            if (statusFilter == null || q.getStatus() == statusFilter) {
                out.add(q);
            }
        }
        return out;
    }

    public QuestInstance requireQuest(GameCharacter character, String questId) {
        return character.findQuest(questId).orElseThrow(() ->
            EngineException.of(ErrorKind.QUEST_NOT_FOUND, "Quest %s not found", questId));
    }
}
