package com.example.shadowlands.error;

/**
 * Every error the engine reports to callers.
 * Each kind belongs to a category and carries the status code the boundary answers with.
 */
public enum ErrorKind {
    // Validation
    INVALID_ATTRIBUTES(Category.VALIDATION),
    INVALID_LEVEL(Category.VALIDATION),
    INVALID_INCREMENT(Category.VALIDATION),
    INVALID_COMBAT_INPUT(Category.VALIDATION),
    INVALID_EXPERIENCE(Category.VALIDATION),

    // State machine misuse
    QUEST_NOT_ACTIVE(Category.STATE),
    ALREADY_ACTIVE(Category.STATE),
    CHOICE_ALREADY_MADE(Category.STATE),
    QUEST_NOT_COMPLETED(Category.STATE),
    REWARDS_ALREADY_CLAIMED(Category.STATE),

    // Lookup
    TEMPLATE_NOT_FOUND(Category.LOOKUP),
    QUEST_NOT_FOUND(Category.LOOKUP),
    OBJECTIVE_NOT_FOUND(Category.LOOKUP),
    CHOICE_NOT_FOUND(Category.LOOKUP),

    // Preconditions
    LEVEL_TOO_LOW(Category.PRECONDITION),

    NO_SESSION(Category.SESSION);

    public enum Category {
        VALIDATION(400),
        STATE(400),
        LOOKUP(404),
        PRECONDITION(400),
        SESSION(401);

        private final int status;

        Category(int status) {
            this.status = status;
        }

        public int getStatus() { return status; }
    }

    private final Category category;

    ErrorKind(Category category) {
        this.category = category;
    }

    public Category getCategory() { return category; }

    public int getStatus() { return category.getStatus(); }

    /**
     * Name used on the wire, e.g. {@code QuestNotActive}.
     */
    public String getCode() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
