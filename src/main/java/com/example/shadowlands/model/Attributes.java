package com.example.shadowlands.model;

/**
 * The four base attributes of a character.
 * Values are not range-checked here; {@link com.example.shadowlands.util.AttributeDeriver} rejects negatives.
 */
public record Attributes(int might, int intellect, int will, int shadow) {

    public boolean hasNegative() {
        return might < 0 || intellect < 0 || will < 0 || shadow < 0;
    }
}
