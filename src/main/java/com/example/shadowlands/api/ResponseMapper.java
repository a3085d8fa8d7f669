package com.example.shadowlands.api;

import com.example.shadowlands.combat.CombatExchange;
import com.example.shadowlands.model.Attributes;
import com.example.shadowlands.model.CharacterSheet;
import com.example.shadowlands.model.Consequence;
import com.example.shadowlands.model.DerivedAttributes;
import com.example.shadowlands.model.GameCharacter;
import com.example.shadowlands.model.QuestChoice;
import com.example.shadowlands.model.QuestInstance;
import com.example.shadowlands.model.QuestObjective;
import com.example.shadowlands.model.QuestStatistics;
import com.example.shadowlands.model.QuestTemplate;
import com.example.shadowlands.model.RewardDef;
import com.example.shadowlands.util.ExperienceTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns engine types into the snake_case maps carried in response payloads.
 */
final class ResponseMapper {

    private ResponseMapper() {}

    static Map<String, Object> attributes(Attributes a) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("might", a.might());
        m.put("intellect", a.intellect());
        m.put("will", a.will());
        m.put("shadow", a.shadow());
        return m;
    }

    static Map<String, Object> derived(DerivedAttributes d) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("health", d.health());
        m.put("mana", d.mana());
        m.put("accuracy", d.accuracy());
        m.put("evasion", d.evasion());
        m.put("mitigation", d.mitigation());
        m.put("attack_power", d.attackPower());
        m.put("corruption_resistance", d.corruptionResistance());
        m.put("action_points", d.actionPoints());
        return m;
    }

    static Map<String, Object> character(GameCharacter c) {
        CharacterSheet sheet = c.getSheet();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", c.getName());
        m.put("level", sheet.level());
        m.put("experience", sheet.experience());
        m.put("experience_to_next_level", ExperienceTable.experienceToNextLevel(sheet.experience()));
        m.put("attributes", attributes(sheet.attributes()));
        m.put("derived_attributes", derived(sheet.derived()));
        m.put("reputation", c.getAllReputation());
        m.put("items", c.getItems());
        m.put("skills", c.getSkills());
        return m;
    }

    static Map<String, Object> template(QuestTemplate t) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("template_id", t.getTemplateId());
        m.put("title", t.getTitle());
        m.put("description", t.getDescription());
        m.put("quest_type", t.getQuestType().key());
        m.put("complexity", t.getComplexity().key());
        m.put("level_requirement", t.getLevelRequirement());
        m.put("objectives_count", t.getObjectives().size());
        m.put("choices_count", t.getChoices().size());
        m.put("rewards_count", t.getRewards().size());
        return m;
    }

    static List<Map<String, Object>> templates(List<QuestTemplate> templates) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (QuestTemplate t : templates) out.add(template(t));
        return out;
    }

    static Map<String, Object> quest(QuestInstance quest) {
        QuestInstance.QuestSnapshot s = quest.snapshot();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("quest_id", s.questId());
        m.put("template_id", s.templateId());
        m.put("title", s.title());
        m.put("status", s.status().key());
        m.put("completion_percentage", s.completionPercentage());
        m.put("started_at", s.startedAt().toString());
        m.put("completed_at", s.completedAt() != null ? s.completedAt().toString() : null);
        m.put("rewards_claimed", s.rewardsClaimed());

        List<Map<String, Object>> objectives = new ArrayList<>();
        for (QuestObjective o : s.objectives()) {
            Map<String, Object> om = new LinkedHashMap<>();
            om.put("objective_id", o.objectiveId());
            om.put("objective_type", o.type().key());
            om.put("description", o.description());
            om.put("target_count", o.targetCount());
            om.put("current_progress", o.currentProgress());
            om.put("completed", o.completed());
            objectives.add(om);
        }
        m.put("objectives", objectives);

        List<Map<String, Object>> choices = new ArrayList<>();
        for (QuestChoice c : s.choices()) {
            Map<String, Object> cm = new LinkedHashMap<>();
            cm.put("choice_id", c.choiceId());
            cm.put("description", c.description());
            cm.put("made", c.made());
            cm.put("consequences_applied", c.consequencesApplied());
            choices.add(cm);
        }
        m.put("choices", choices);
        return m;
    }

    static List<Map<String, Object>> quests(List<QuestInstance> quests) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (QuestInstance q : quests) out.add(quest(q));
        return out;
    }

    static List<Map<String, Object>> consequences(List<Consequence> consequences) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Consequence c : consequences) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("type", c.type().key());
            m.put("action", c.action());
            m.putAll(c.params());
            out.add(m);
        }
        return out;
    }

    static List<Map<String, Object>> rewards(List<RewardDef> rewards) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (RewardDef r : rewards) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("type", r.type().key());
            m.put("value", r.value());
            m.put("description", r.description());
            out.add(m);
        }
        return out;
    }

    static Map<String, Object> statistics(QuestStatistics s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("active_count", s.activeCount());
        m.put("completed_count", s.completedCount());
        m.put("failed_count", s.failedCount());
        m.put("total_count", s.totalCount());
        m.put("level", s.level());
        return m;
    }

    static Map<String, Object> combat(CombatExchange e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("hit_success", e.hitSuccess());
        m.put("damage_dealt", e.damageDealt());
        m.put("hit_chance", e.hitChance());
        m.put("base_damage", e.rawDamage());
        m.put("defense", e.reduction());
        return m;
    }
}
