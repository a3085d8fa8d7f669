package com.example.shadowlands.persistence;

import com.example.shadowlands.model.ChoiceDef;
import com.example.shadowlands.model.Consequence;
import com.example.shadowlands.model.ConsequenceType;
import com.example.shadowlands.model.ObjectiveDef;
import com.example.shadowlands.model.ObjectiveType;
import com.example.shadowlands.model.QuestComplexity;
import com.example.shadowlands.model.QuestTemplate;
import com.example.shadowlands.model.QuestType;
import com.example.shadowlands.model.RewardDef;
import com.example.shadowlands.model.RewardType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads quest templates from a YAML resource.
 *
 * <pre>
 * quests:
 *   - template_id: main_001
 *     title: Into the Corrupted Forest
 *     quest_type: main_campaign
 *     complexity: epic
 *     level_requirement: 5
 *     objectives:
 *       - id: enter_forest
 *         type: reach_location
 *         description: Enter the Corrupted Forest
 *         target_value: 1
 *     choices:
 *       - id: direct_approach
 *         description: Approach the corruption directly
 *         consequences:
 *           - type: immediate
 *             action: add_objective
 *             target_value: 3
 *     rewards:
 *       - type: experience
 *         value: 500
 * </pre>
 *
 * Objective and choice ids default to {@code obj_N} / {@code choice_N} (1-based) when omitted.
 * Bad template data is a packaging defect and fails with IllegalStateException.
 */
public class QuestTemplateLoader {

    private static final Logger logger = LoggerFactory.getLogger(QuestTemplateLoader.class);

    public List<QuestTemplate> loadFromResource(String resourcePath) {
        try (InputStream in = QuestTemplateLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Quest resource not found: " + resourcePath);
            }
            List<QuestTemplate> templates = load(in, resourcePath);
            logger.info("Loaded {} quest templates from {}", templates.size(), resourcePath);
            return templates;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read quest resource " + resourcePath, e);
        }
    }

    @SuppressWarnings("unchecked")
    List<QuestTemplate> load(InputStream in, String source) {
        Map<String, Object> root = new Yaml().load(in);
        if (root == null || !(root.get("quests") instanceof List)) {
            throw new IllegalStateException("No 'quests' list in " + source);
        }
        List<Map<String, Object>> questList = (List<Map<String, Object>>) root.get("quests");

        List<QuestTemplate> templates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Map<String, Object> data : questList) {
            QuestTemplate template;
            try {
                template = parseTemplate(data);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid quest template in " + source + ": " + e.getMessage(), e);
            }
            if (!seen.add(template.getTemplateId())) {
                throw new IllegalStateException("Duplicate quest template id in " + source + ": " + template.getTemplateId());
            }
            templates.add(template);
        }
        return templates;
    }

    @SuppressWarnings("unchecked")
    private QuestTemplate parseTemplate(Map<String, Object> data) {
        String templateId = getString(data, "template_id", "");

        List<ObjectiveDef> objectives = new ArrayList<>();
        int i = 0;
        for (Map<String, Object> obj : getList(data, "objectives")) {
            i++;
            objectives.add(new ObjectiveDef(
                getString(obj, "id", "obj_" + i),
                ObjectiveType.fromString(getString(obj, "type", "")),
                getString(obj, "description", ""),
                getInt(obj, "target_value", 1)));
        }

        List<ChoiceDef> choices = new ArrayList<>();
        i = 0;
        for (Map<String, Object> ch : getList(data, "choices")) {
            i++;
            List<Consequence> consequences = new ArrayList<>();
            for (Map<String, Object> c : getList(ch, "consequences")) {
                Map<String, Object> params = new LinkedHashMap<>(c);
                params.remove("type");
                params.remove("action");
                consequences.add(new Consequence(
                    ConsequenceType.fromString(getString(c, "type", "")),
                    getString(c, "action", ""),
                    params));
            }
            choices.add(new ChoiceDef(
                getString(ch, "id", "choice_" + i),
                getString(ch, "description", ""),
                consequences));
        }

        List<RewardDef> rewards = new ArrayList<>();
        for (Map<String, Object> r : getList(data, "rewards")) {
            rewards.add(new RewardDef(
                RewardType.fromString(getString(r, "type", "")),
                getString(r, "value", ""),
                getString(r, "description", "")));
        }

        return new QuestTemplate(
            templateId,
            getString(data, "title", templateId),
            getString(data, "description", ""),
            QuestType.fromString(getString(data, "quest_type", "")),
            QuestComplexity.fromString(getString(data, "complexity", "")),
            getInt(data, "level_requirement", 1),
            objectives, choices, rewards);
    }

    // YAML helper methods
    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> getList(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (!(val instanceof List)) return List.of();
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object o : (List<?>) val) {
            if (o instanceof Map) out.add((Map<String, Object>) o);
        }
        return out;
    }

    private static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt((String) val); } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not an integer: " + val, e);
            }
        }
        return defaultVal;
    }
}
