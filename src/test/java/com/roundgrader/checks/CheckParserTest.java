package com.roundgrader.checks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private Check parse(String json) throws Exception {
        return CheckParser.parse(objectMapper.readTree(json));
    }

    @Test
    void elementExistsDefaultsMinCountToOne() throws Exception {
        Check check = parse("{\"type\":\"element_exists\",\"selector\":\"#gallery img\"}");

        assertEquals(new Check.ElementExists("#gallery img", 1), check);
        assertEquals("element_#gallery img", check.resultName());
    }

    @Test
    void elementResultNameTruncatesLongSelectors() throws Exception {
        Check check = parse("{\"type\":\"element_exists\",\"selector\":\".a-really-long-selector-name\",\"min_count\":3}");

        assertEquals("element_.a-really-long-selec", check.resultName());
        assertEquals(3, ((Check.ElementExists) check).minCount());
    }

    @Test
    void buttonTextAcceptsBareString() throws Exception {
        Check check = parse("{\"type\":\"button_exists\",\"text\":\"Start\"}");

        assertEquals(List.of("Start"), ((Check.ButtonExists) check).texts());
    }

    @Test
    void responsiveUsesDefaultBreakpoints() throws Exception {
        Check.ResponsiveCheck check = (Check.ResponsiveCheck) parse("{\"type\":\"responsive_check\"}");

        assertEquals(List.of(768, 1024), check.breakpoints());
    }

    @Test
    void clickSequenceSplitsAlternatives() throws Exception {
        Check.ClickSequence check = (Check.ClickSequence) parse(
                "{\"type\":\"click_sequence\",\"buttons\":[\"2\",\"+\",\"2\",\"=\"],\"result\":\"4|4.0\"}");

        assertEquals(List.of("2", "+", "2", "="), check.buttons());
        assertEquals(List.of("4", "4.0"), check.acceptedResults());
    }

    @Test
    void clickInteractionDetectsModalExpectation() throws Exception {
        Check.ClickInteraction check = (Check.ClickInteraction) parse(
                "{\"type\":\"click_interaction\",\"selector\":\"img\",\"result\":\"opens modal\"}");

        assertTrue(check.expectsModal());
    }

    @Test
    void unknownTypeBecomesUnknownVariant() throws Exception {
        JsonNode descriptor = objectMapper.readTree("{\"type\":\"mouse_event\",\"event\":\"wheel\"}");

        Check check = CheckParser.parse(descriptor);

        assertEquals(CheckType.UNKNOWN, check.type());
        assertEquals("mouse_event", ((Check.Unknown) check).rawType());
    }

    @Test
    void missingRequiredFieldFails() {
        assertThrows(IllegalArgumentException.class, () -> parse("{\"type\":\"element_exists\"}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"type\":\"keyboard_event\"}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"type\":\"click_sequence\",\"buttons\":[\"1\"]}"));
        assertThrows(IllegalArgumentException.class, () -> parse("\"element_exists\""));
    }

    @Test
    void interactionTypesAreFlagged() {
        assertTrue(CheckType.CLICK_INTERACTION.requiresInteraction());
        assertTrue(CheckType.KEYBOARD_EVENT.requiresInteraction());
        assertFalse(CheckType.ELEMENT_EXISTS.requiresInteraction());
        assertFalse(CheckType.BUTTON_EXISTS.requiresInteraction());
    }
}
