package com.roundgrader.checks;

/**
 * What was observed after clicking an element.
 */
public enum ClickEffect {
    ELEMENT_MISSING,
    CLICK_REGISTERED,
    EFFECT_CONFIRMED
}
