package com.example.shadowlands.model;

/**
 * Immutable view of everything derived from a character's attributes.
 * A character swaps whole sheets, so readers never see attributes and derived values out of step.
 */
public record CharacterSheet(Attributes attributes, int level, int experience, DerivedAttributes derived) {

    public CharacterSheet withExperience(int experience, int level, DerivedAttributes derived) {
        return new CharacterSheet(attributes, level, experience, derived);
    }
}
