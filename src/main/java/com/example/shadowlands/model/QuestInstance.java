package com.example.shadowlands.model;

import com.example.shadowlands.error.EngineException;
import com.example.shadowlands.error.ErrorKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One character's live progress through a quest template.
 *
 * All state lives behind this instance's monitor. Objectives and choices are immutable
 * records replaced on update, so every read returns a consistent snapshot and no
 * half-applied increment or choice is ever visible.
 */
public class QuestInstance {
    private final String questId;
    private final String templateId;
    private final String title;
    private final Instant startedAt;
    private final List<ChoiceDef> choiceDefs;

    private QuestStatus status = QuestStatus.ACTIVE;
    private Instant completedAt;
    private boolean rewardsClaimed;

    private final List<QuestObjective> objectives = new ArrayList<>();
    private final List<QuestChoice> choices = new ArrayList<>();
    // consequences in the order they were applied
    private final List<Consequence> appliedConsequences = new ArrayList<>();
    private int addedObjectiveCounter;

    public QuestInstance(String questId, QuestTemplate template, Instant startedAt) {
        this.questId = questId;
        this.templateId = template.getTemplateId();
        this.title = template.getTitle();
        this.startedAt = startedAt;
        this.choiceDefs = template.getChoices();
        for (ObjectiveDef def : template.getObjectives()) {
            objectives.add(QuestObjective.from(def));
        }
        for (ChoiceDef def : template.getChoices()) {
            choices.add(QuestChoice.from(def));
        }
        // nothing to do at all: done on arrival
        if (objectives.isEmpty() && choices.isEmpty()) {
            complete(startedAt);
        }
    }

    public String getQuestId() { return questId; }
    public String getTemplateId() { return templateId; }
    public String getTitle() { return title; }
    public Instant getStartedAt() { return startedAt; }

    public synchronized QuestStatus getStatus() { return status; }
    public synchronized Instant getCompletedAt() { return completedAt; }
    public synchronized boolean isRewardsClaimed() { return rewardsClaimed; }
    public synchronized boolean isActive() { return status == QuestStatus.ACTIVE; }

    public synchronized List<QuestObjective> getObjectives() { return List.copyOf(objectives); }
    public synchronized List<QuestChoice> getChoices() { return List.copyOf(choices); }
    public synchronized List<Consequence> getAppliedConsequences() { return List.copyOf(appliedConsequences); }

    /**
     * Consistent copy of the whole instance.
     */
    public synchronized QuestSnapshot snapshot() {
        return new QuestSnapshot(questId, templateId, title, status, startedAt, completedAt, rewardsClaimed,
            List.copyOf(objectives), List.copyOf(choices), List.copyOf(appliedConsequences),
            completionPercentage());
    }

    /**
     * Add progress to an objective, clamped at its target.
     * Completes the quest on the call that finishes its last open objective.
     */
    public synchronized AdvanceResult advanceObjective(String objectiveId, int increment, Instant now) {
        requireActive();
        if (increment <= 0) {
            throw EngineException.of(ErrorKind.INVALID_INCREMENT, "Increment must be positive, got %d", increment);
        }
        int index = indexOfObjective(objectiveId);
        QuestObjective before = objectives.get(index);
        QuestObjective after = before.advance(increment);
        objectives.set(index, after);

        boolean objectiveCompleted = !before.completed() && after.completed();
        boolean questCompleted = false;
        if (objectiveCompleted && allObjectivesCompleted()) {
            complete(now);
            questCompleted = true;
        }
        return new AdvanceResult(questId, objectiveId, objectiveCompleted, questCompleted,
            after.currentProgress(), after.targetCount());
    }

    /**
     * The definition of a choice that could be made now, without making it.
     *
     * @throws EngineException QUEST_NOT_ACTIVE, CHOICE_NOT_FOUND, CHOICE_ALREADY_MADE
     */
    public synchronized ChoiceDef pendingChoice(String choiceId) {
        return choiceDefs.get(indexOfOpenChoice(choiceId));
    }

    /**
     * Mark a choice made and apply the consequences that act on this quest.
     * Returns the consequences applied, in template order.
     */
    public synchronized ChoiceResult makeChoice(String choiceId, Instant now) {
        int index = indexOfOpenChoice(choiceId);
        QuestChoice choice = choices.get(index);
        ChoiceDef def = choiceDefs.get(index);
        for (Consequence c : def.consequences()) {
            if (c.type() == ConsequenceType.IMMEDIATE && Consequence.ADD_OBJECTIVE.equals(c.action())) {
                addObjective(c);
            }
            appliedConsequences.add(c);
        }
        choices.set(index, choice.markMade());

        boolean questCompleted = false;
        // Without objectives the last outstanding choice finishes the quest.
        if (objectives.isEmpty() && allChoicesMade()) {
            complete(now);
            questCompleted = true;
        }
        return new ChoiceResult(questId, def.choiceId(), def.consequences(), questCompleted);
    }

    /**
     * ACTIVE -> FAILED.
     */
    public synchronized void fail(Instant now) {
        requireActive();
        status = QuestStatus.FAILED;
        completedAt = now;
    }

    /**
     * Flag the rewards as handed out. Only once, and only for completed quests.
     */
    public synchronized void claimRewards() {
        if (status != QuestStatus.COMPLETED) {
            throw EngineException.of(ErrorKind.QUEST_NOT_COMPLETED, "Quest %s is %s", questId, status.key());
        }
        if (rewardsClaimed) {
            throw EngineException.of(ErrorKind.REWARDS_ALREADY_CLAIMED, "Rewards for quest %s already claimed", questId);
        }
        rewardsClaimed = true;
    }

    public synchronized double completionPercentage() {
        if (objectives.isEmpty()) {
            return status == QuestStatus.COMPLETED ? 100.0 : 0.0;
        }
        double total = 0;
        for (QuestObjective o : objectives) {
            total += o.progressPercentage();
        }
        return total / objectives.size();
    }

    private void addObjective(Consequence c) {
        addedObjectiveCounter++;
        String id = c.getString("objective_id", "added_" + addedObjectiveCounter);
        int target = Math.max(1, c.getInt("target_value", 1));
        objectives.add(new QuestObjective(id,
            ObjectiveType.fromString(c.getString("objective_type", "interact_npc")),
            c.getString("description", "New objective"),
            target, 0));
    }

    private void complete(Instant now) {
        status = QuestStatus.COMPLETED;
        completedAt = now;
    }

    private void requireActive() {
        if (status != QuestStatus.ACTIVE) {
            throw EngineException.of(ErrorKind.QUEST_NOT_ACTIVE, "Quest %s is %s", questId, status.key());
        }
    }

    private boolean allObjectivesCompleted() {
        for (QuestObjective o : objectives) {
            if (!o.completed()) return false;
        }
        return true;
    }

    private boolean allChoicesMade() {
        for (QuestChoice c : choices) {
            if (!c.made()) return false;
        }
        return true;
    }

    private int indexOfObjective(String objectiveId) {
        for (int i = 0; i < objectives.size(); i++) {
            if (objectives.get(i).objectiveId().equals(objectiveId)) return i;
        }
        throw EngineException.of(ErrorKind.OBJECTIVE_NOT_FOUND,
            "Objective %s not found in quest %s", objectiveId, questId);
    }

    private int indexOfOpenChoice(String choiceId) {
        requireActive();
        int index = indexOfChoice(choiceId);
        if (choices.get(index).made()) {
            throw EngineException.of(ErrorKind.CHOICE_ALREADY_MADE,
                "Choice %s was already made in quest %s", choiceId, questId);
        }
        return index;
    }

    private int indexOfChoice(String choiceId) {
        for (int i = 0; i < choices.size(); i++) {
            if (choices.get(i).choiceId().equals(choiceId)) return i;
        }
        throw EngineException.of(ErrorKind.CHOICE_NOT_FOUND, "Choice %s not found in quest %s", choiceId, questId);
    }

    @Override
    public String toString() {
        return title + " [" + questId + "]";
    }

    /**
     * Immutable copy of a quest instance, for readers.
     */
    public record QuestSnapshot(
        String questId,
        String templateId,
        String title,
        QuestStatus status,
        Instant startedAt,
        Instant completedAt,
        boolean rewardsClaimed,
        List<QuestObjective> objectives,
        List<QuestChoice> choices,
        List<Consequence> appliedConsequences,
        double completionPercentage
    ) {
        public QuestSnapshot {
            objectives = Collections.unmodifiableList(objectives);
            choices = Collections.unmodifiableList(choices);
            appliedConsequences = Collections.unmodifiableList(appliedConsequences);
        }
    }
}
