package com.example.shadowlands.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable definition of a quest: its objectives, choices, rewards and level requirement.
 * Shared by every instance started from it.
 */
public class QuestTemplate {
    private final String templateId;
    private final String title;
    private final String description;
    private final QuestType questType;
    private final QuestComplexity complexity;
    private final int levelRequirement;
    private final List<ObjectiveDef> objectives;
    private final List<ChoiceDef> choices;
    private final List<RewardDef> rewards;

    public QuestTemplate(String templateId, String title, String description,
                         QuestType questType, QuestComplexity complexity, int levelRequirement,
                         List<ObjectiveDef> objectives, List<ChoiceDef> choices, List<RewardDef> rewards) {
        if (templateId == null || templateId.isEmpty()) {
            throw new IllegalArgumentException("template id is required");
        }
        this.templateId = templateId;
        this.title = title != null ? title : templateId;
        this.description = description != null ? description : "";
        this.questType = questType != null ? questType : QuestType.MAIN_CAMPAIGN;
        this.complexity = complexity != null ? complexity : QuestComplexity.STANDARD;
        this.levelRequirement = Math.max(1, levelRequirement);
        this.objectives = objectives != null ? new ArrayList<>(objectives) : new ArrayList<>();
        this.choices = choices != null ? new ArrayList<>(choices) : new ArrayList<>();
        this.rewards = rewards != null ? new ArrayList<>(rewards) : new ArrayList<>();
    }

    public String getTemplateId() { return templateId; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public QuestType getQuestType() { return questType; }
    public QuestComplexity getComplexity() { return complexity; }
    public int getLevelRequirement() { return levelRequirement; }

    public List<ObjectiveDef> getObjectives() { return Collections.unmodifiableList(objectives); }
    public List<ChoiceDef> getChoices() { return Collections.unmodifiableList(choices); }
    public List<RewardDef> getRewards() { return Collections.unmodifiableList(rewards); }

    public boolean isAvailableAtLevel(int level) {
        return level >= levelRequirement;
    }

    @Override
    public String toString() {
        return title + " (" + templateId + ")";
    }
}
