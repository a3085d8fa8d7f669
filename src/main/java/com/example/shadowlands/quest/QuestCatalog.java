package com.example.shadowlands.quest;

import com.example.shadowlands.error.EngineException;
import com.example.shadowlands.error.ErrorKind;
import com.example.shadowlands.model.GameCharacter;
import com.example.shadowlands.model.QuestTemplate;
import com.example.shadowlands.persistence.QuestTemplateLoader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only registry of quest templates, filled once at start-up.
 * Never mutated afterwards, so concurrent readers need no locking.
 */
public class QuestCatalog {

    private final Map<String, QuestTemplate> templates;

    public QuestCatalog(List<QuestTemplate> templates) {
        Map<String, QuestTemplate> byId = new LinkedHashMap<>();
        for (QuestTemplate t : templates) {
            if (byId.putIfAbsent(t.getTemplateId(), t) != null) {
                throw new IllegalArgumentException("Duplicate quest template id: " + t.getTemplateId());
            }
        }
        this.templates = Collections.unmodifiableMap(byId);
    }

    public static QuestCatalog fromResource(String resourcePath) {
        return new QuestCatalog(new QuestTemplateLoader().loadFromResource(resourcePath));
    }

    /**
     * All templates in load order.
     */
    public List<QuestTemplate> listTemplates() {
        return List.copyOf(templates.values());
    }

    public QuestTemplate getTemplate(String templateId) {
        QuestTemplate t = templateId != null ? templates.get(templateId) : null;
        if (t == null) {
            throw EngineException.of(ErrorKind.TEMPLATE_NOT_FOUND, "Quest template %s not found", templateId);
        }
        return t;
    }

    public boolean contains(String templateId) {
        return templateId != null && templates.containsKey(templateId);
    }

    /**
     * Templates the character may start right now: level requirement met and
     * no active instance of the template in its log.
     */
    public List<QuestTemplate> availableFor(GameCharacter character) {
        int level = character.getLevel();
        List<QuestTemplate> result = new ArrayList<>();
        for (QuestTemplate t : templates.values()) {
            if (t.isAvailableAtLevel(level) && !character.hasActiveQuest(t.getTemplateId())) {
                result.add(t);
            }
        }
        return result;
    }

    public int size() {
        return templates.size();
    }
}
