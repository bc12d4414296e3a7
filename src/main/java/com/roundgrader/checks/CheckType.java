package com.roundgrader.checks;

/**
 * Supported check descriptor types, keyed by the {@code type} field of the descriptor.
 */
public enum CheckType {
    ELEMENT_EXISTS("element_exists"),
    BUTTON_EXISTS("button_exists"),
    CLICK_INTERACTION("click_interaction"),
    RESPONSIVE_CHECK("responsive_check"),
    KEYBOARD_EVENT("keyboard_event"),
    CLICK_SEQUENCE("click_sequence"),
    UNKNOWN(null);

    private final String wireName;

    CheckType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Whether the check needs script execution, input simulation or viewport control.
     */
    public boolean requiresInteraction() {
        switch (this) {
            case CLICK_INTERACTION:
            case RESPONSIVE_CHECK:
            case KEYBOARD_EVENT:
            case CLICK_SEQUENCE:
                return true;
            default:
                return false;
        }
    }

    public static CheckType fromWireName(String name) {
        for (CheckType type : values()) {
            if (type.wireName != null && type.wireName.equals(name)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
