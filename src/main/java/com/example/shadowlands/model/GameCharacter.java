package com.example.shadowlands.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * The single character owned by a session: its attribute sheet, quest log,
 * faction standing and anything handed out by quest rewards.
 */
public class GameCharacter {
    private final String name;

    // swapped whole, never mutated
    private volatile CharacterSheet sheet;

    private final List<QuestInstance> questLog = new CopyOnWriteArrayList<>();

    // Faction -> standing
    private final Map<String, Integer> reputation = new ConcurrentHashMap<>();

    private final List<String> items = new CopyOnWriteArrayList<>();
    private final List<String> skills = new CopyOnWriteArrayList<>();

    public GameCharacter(String name, CharacterSheet sheet) {
        this.name = name != null ? name : "Unknown Drifter";
        this.sheet = sheet;
    }

    public String getName() { return name; }

    public CharacterSheet getSheet() { return sheet; }

    /**
     * Replace the sheet with a value computed from the current one, atomically
     * with respect to other sheet updates.
     */
    public synchronized CharacterSheet updateSheet(UnaryOperator<CharacterSheet> update) {
        this.sheet = update.apply(sheet);
        return sheet;
    }

    // Convenience readers over the current sheet
    public Attributes getAttributes() { return sheet.attributes(); }
    public DerivedAttributes getDerived() { return sheet.derived(); }
    public int getLevel() { return sheet.level(); }
    public int getExperience() { return sheet.experience(); }

    // -- Quest log --

    /**
     * Quest log in start order. The returned list is a snapshot.
     */
    public List<QuestInstance> getQuestLog() {
        return List.copyOf(questLog);
    }

    public void addQuest(QuestInstance quest) {
        questLog.add(quest);
    }

    public Optional<QuestInstance> findQuest(String questId) {
        if (questId == null) return Optional.empty();
        for (QuestInstance q : questLog) {
            if (q.getQuestId().equals(questId)) return Optional.of(q);
        }
        return Optional.empty();
    }

    /**
     * Whether an ACTIVE instance of the template is already in the log.
     */
    public boolean hasActiveQuest(String templateId) {
        for (QuestInstance q : questLog) {
            if (q.getTemplateId().equals(templateId) && q.isActive()) return true;
        }
        return false;
    }

    // -- Reputation --

    public int getReputation(String faction) {
        return reputation.getOrDefault(faction, 0);
    }

    public int adjustReputation(String faction, int delta) {
        return reputation.merge(faction, delta, Integer::sum);
    }

    /**
     * Sorted copy of all standings.
     */
    public Map<String, Integer> getAllReputation() {
        return Collections.unmodifiableMap(new TreeMap<>(reputation));
    }

    /**
     * Put every standing back to a copy taken with {@link #getAllReputation()}.
     */
    public void restoreReputation(Map<String, Integer> standings) {
        reputation.keySet().retainAll(standings.keySet());
        reputation.putAll(standings);
    }

    // -- Reward grants --

    public void grantItem(String itemKey) { items.add(itemKey); }
    public void grantSkill(String skillKey) {
        if (!skills.contains(skillKey)) skills.add(skillKey);
    }

    public List<String> getItems() { return List.copyOf(items); }
    public List<String> getSkills() { return List.copyOf(skills); }
}
