package com.roundgrader.checks;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A parsed check descriptor. Every supported type has its own variant; anything else becomes
 * {@link Unknown} so it can be reported and skipped instead of failing the run.
 */
public interface Check {

    CheckType type();

    /**
     * Name of the result row this check produces on the happy path.
     */
    String resultName();

    record ElementExists(String selector, int minCount) implements Check {
        @Override
        public CheckType type() { return CheckType.ELEMENT_EXISTS; }

        @Override
        public String resultName() {
            return "element_" + (selector.length() > 20 ? selector.substring(0, 20) : selector);
        }
    }

    record ButtonExists(List<String> texts) implements Check {
        @Override
        public CheckType type() { return CheckType.BUTTON_EXISTS; }

        @Override
        public String resultName() { return "button_check"; }

        public String resultNameFor(String matchedText) {
            return "button_" + (matchedText.length() > 20 ? matchedText.substring(0, 20) : matchedText);
        }
    }

    record ClickInteraction(String selector, String expectedResult) implements Check {
        @Override
        public CheckType type() { return CheckType.CLICK_INTERACTION; }

        @Override
        public String resultName() { return "click_interaction"; }

        public boolean expectsModal() {
            return expectedResult != null && expectedResult.toLowerCase().contains("modal");
        }
    }

    record ResponsiveCheck(List<Integer> breakpoints) implements Check {
        public static final List<Integer> DEFAULT_BREAKPOINTS = List.of(768, 1024);

        @Override
        public CheckType type() { return CheckType.RESPONSIVE_CHECK; }

        @Override
        public String resultName() { return "responsive_design"; }
    }

    record KeyboardEvent(String key, String expectedResult) implements Check {
        @Override
        public CheckType type() { return CheckType.KEYBOARD_EVENT; }

        @Override
        public String resultName() { return "keyboard_" + key; }
    }

    record ClickSequence(List<String> buttons, String expectedResult) implements Check {
        @Override
        public CheckType type() { return CheckType.CLICK_SEQUENCE; }

        @Override
        public String resultName() { return "click_sequence"; }

        /**
         * Accepted display values; the expected result lists alternatives separated by {@code |}.
         */
        public List<String> acceptedResults() {
            return List.of(expectedResult.split("\\|"));
        }
    }

    record Unknown(String rawType, JsonNode descriptor) implements Check {
        @Override
        public CheckType type() { return CheckType.UNKNOWN; }

        @Override
        public String resultName() { return "check_" + rawType; }
    }
}
