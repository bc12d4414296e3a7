package com.roundgrader.checks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckEngineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private List<JsonNode> descriptors(String... json) throws IOException {
        List<JsonNode> nodes = new ArrayList<>();
        for (String j : json) {
            nodes.add(objectMapper.readTree(j));
        }
        return nodes;
    }

    private List<JsonNode> fiveChecks() throws IOException {
        return descriptors(
                "{\"type\":\"element_exists\",\"selector\":\"#gallery img\",\"min_count\":3}",
                "{\"type\":\"button_exists\",\"text\":[\"Next\",\"Forward\"]}",
                "{\"type\":\"click_interaction\",\"selector\":\"#gallery img\",\"result\":\"modal opens\"}",
                "{\"type\":\"responsive_check\",\"breakpoints\":[320,768,1024]}",
                "{\"type\":\"keyboard_event\",\"key\":\"ArrowRight\",\"result\":\"next image\"}");
    }

    @Test
    void interactiveBackendScoresEveryCheckInOrder() throws IOException {
        FakeBackend backend = new FakeBackend(true);
        backend.counts.put("#gallery img", 4);
        backend.buttons.add("Next image");
        backend.clickEffect = ClickEffect.EFFECT_CONFIRMED;
        backend.widestCollapsed = 320;
        CheckEngine engine = new CheckEngine(() -> backend, () -> fail("static backend should not be used"));

        List<CheckOutcome> outcomes = engine.evaluate("https://a.github.io/repo/", fiveChecks());

        assertEquals(List.of("element_#gallery img", "button_Next", "click_interaction", "responsive_design",
                "keyboard_ArrowRight"), outcomes.stream().map(CheckOutcome::name).toList());
        assertEquals(List.of(1.0, 1.0, 1.0, 2.0 / 3.0, 1.0), outcomes.stream().map(CheckOutcome::score).toList());
        assertEquals("Responsive at 2/3 breakpoints", outcomes.get(3).reason());
        assertEquals("https://a.github.io/repo/", backend.loadedUrl);
        assertTrue(backend.closed);
    }

    @Test
    void fallsBackToStaticWhenInteractiveCannotStart() throws IOException {
        FakeBackend staticBackend = new FakeBackend(false);
        staticBackend.counts.put("#gallery img", 1);
        CheckEngine engine = new CheckEngine(() -> {
            throw new BackendUnavailableException("no browser");
        }, () -> staticBackend);

        List<CheckOutcome> outcomes = engine.evaluate("https://a.github.io/repo/", fiveChecks());

        assertEquals(5, outcomes.size());
        assertEquals(0.0, outcomes.get(0).score());
        assertEquals("button_check", outcomes.get(1).name());
        assertEquals(0.0, outcomes.get(1).score());
        for (CheckOutcome interaction : outcomes.subList(2, 5)) {
            assertEquals(0.5, interaction.score());
            assertTrue(interaction.reason().contains("static fallback"), interaction.reason());
        }
        assertTrue(staticBackend.closed);
    }

    @Test
    void missingInteractiveFactoryUsesStatic() throws IOException {
        FakeBackend staticBackend = new FakeBackend(false);
        CheckEngine engine = new CheckEngine(null, () -> staticBackend);

        List<CheckOutcome> outcomes = engine.evaluate("https://a/", descriptors(
                "{\"type\":\"click_sequence\",\"buttons\":[\"1\"],\"result\":\"1\"}"));

        assertEquals(1, outcomes.size());
        assertEquals(0.5, outcomes.get(0).score());
    }

    @Test
    void pageLoadFailureShortCircuits() throws IOException {
        FakeBackend backend = new FakeBackend(true);
        backend.loadFailure = new IOException("Page failed to load: timeout");
        CheckEngine engine = new CheckEngine(() -> backend, () -> backend);

        List<CheckOutcome> outcomes = engine.evaluate("https://a/", fiveChecks());

        assertEquals(1, outcomes.size());
        assertEquals("page_load", outcomes.get(0).name());
        assertEquals(0.0, outcomes.get(0).score());
        assertTrue(backend.closed);
    }

    @Test
    void errorInOneCheckDoesNotStopTheOthers() throws IOException {
        FakeBackend backend = new FakeBackend(true);
        backend.countFailure = new IllegalStateException("detached frame");
        backend.buttons.add("Start");
        CheckEngine engine = new CheckEngine(() -> backend, () -> backend);

        List<CheckOutcome> outcomes = engine.evaluate("https://a/", descriptors(
                "{\"type\":\"element_exists\",\"selector\":\"#quiz\"}",
                "{\"type\":\"button_exists\",\"text\":\"Start\"}"));

        assertEquals(2, outcomes.size());
        assertEquals("check_element_exists", outcomes.get(0).name());
        assertEquals("Error: detached frame", outcomes.get(0).reason());
        assertEquals(1.0, outcomes.get(1).score());
    }

    @Test
    void malformedDescriptorBecomesZeroScoreResult() throws IOException {
        FakeBackend backend = new FakeBackend(true);
        CheckEngine engine = new CheckEngine(() -> backend, () -> backend);

        List<CheckOutcome> outcomes = engine.evaluate("https://a/", descriptors("{\"type\":\"element_exists\"}"));

        assertEquals(1, outcomes.size());
        assertEquals("check_element_exists", outcomes.get(0).name());
        assertEquals(0.0, outcomes.get(0).score());
    }

    @Test
    void unknownChecksProduceNoResult() throws IOException {
        FakeBackend backend = new FakeBackend(true);
        backend.counts.put("#app", 1);
        CheckEngine engine = new CheckEngine(() -> backend, () -> backend);

        List<CheckOutcome> outcomes = engine.evaluate("https://a/", descriptors(
                "{\"type\":\"geolocation_check\",\"button\":\"Locate\"}",
                "{\"type\":\"element_exists\",\"selector\":\"#app\"}"));

        assertEquals(1, outcomes.size());
        assertEquals("element_#app", outcomes.get(0).name());
    }

    @Test
    void clickSequenceComparesDisplayAgainstAlternatives() throws IOException {
        FakeBackend backend = new FakeBackend(true);
        backend.buttons.addAll(List.of("2", "+", "="));
        backend.display = "4";
        CheckEngine engine = new CheckEngine(() -> backend, () -> backend);

        List<CheckOutcome> outcomes = engine.evaluate("https://a/", descriptors(
                "{\"type\":\"click_sequence\",\"buttons\":[\"2\",\"+\",\"2\",\"=\"],\"result\":\"4|4.0\"}",
                "{\"type\":\"click_sequence\",\"buttons\":[\"2\",\"+\",\"2\",\"=\"],\"result\":\"5\"}",
                "{\"type\":\"click_sequence\",\"buttons\":[\"9\"],\"result\":\"9\"}"));

        assertEquals(List.of(1.0, 0.0, 0.0), outcomes.stream().map(CheckOutcome::score).toList());
        assertEquals("Button not found: 9", outcomes.get(2).reason());
    }

    @Test
    void clickSequenceRejectsDisplayThatOnlyContainsTheAnswer() throws IOException {
        FakeBackend backend = new FakeBackend(true);
        backend.buttons.addAll(List.of("5", "+", "3", "="));
        backend.display = "18";
        CheckEngine engine = new CheckEngine(() -> backend, () -> backend);

        List<CheckOutcome> outcomes = engine.evaluate("https://a/", descriptors(
                "{\"type\":\"click_sequence\",\"buttons\":[\"5\",\"+\",\"3\",\"=\"],\"result\":\"8\"}"));

        assertEquals(0.0, outcomes.get(0).score());
        assertEquals("5 + 3 = expected 8 but display shows 18", outcomes.get(0).reason());
    }

    @Test
    void displayMatchingIsExactOrNumeric() {
        assertTrue(CheckEngine.displayMatches("4", "4.0"));
        assertTrue(CheckEngine.displayMatches("0.50", "0.5"));
        assertTrue(CheckEngine.displayMatches("Error", "Error"));
        assertFalse(CheckEngine.displayMatches("500", "50"));
        assertFalse(CheckEngine.displayMatches("15", "5"));
        assertFalse(CheckEngine.displayMatches("4", ""));
    }

    @Test
    void clickWithoutConfirmedEffectScoresHalf() throws IOException {
        FakeBackend backend = new FakeBackend(true);
        backend.clickEffect = ClickEffect.CLICK_REGISTERED;
        backend.keyChangesPage = false;
        CheckEngine engine = new CheckEngine(() -> backend, () -> backend);

        List<CheckOutcome> outcomes = engine.evaluate("https://a/", descriptors(
                "{\"type\":\"click_interaction\",\"selector\":\"img\",\"result\":\"modal\"}",
                "{\"type\":\"keyboard_event\",\"key\":\"Escape\",\"result\":\"closes\"}"));

        assertEquals(List.of(0.5, 0.5), outcomes.stream().map(CheckOutcome::score).toList());

        backend.clickEffect = ClickEffect.ELEMENT_MISSING;
        List<CheckOutcome> missing = engine.evaluate("https://a/", descriptors(
                "{\"type\":\"click_interaction\",\"selector\":\"img\",\"result\":\"modal\"}"));
        assertEquals(0.0, missing.get(0).score());
    }

    @Test
    void outcomeRejectsScoresOutsideUnitRangeAndTruncatesLogs() {
        assertThrows(IllegalArgumentException.class, () -> new CheckOutcome("x", 1.5, "", ""));
        assertThrows(IllegalArgumentException.class, () -> new CheckOutcome("x", -0.1, "", ""));
        assertEquals(500, new CheckOutcome("x", 1.0, "", "y".repeat(800)).logs().length());
        assertEquals("", new CheckOutcome("x", 1.0, "", null).logs());
    }
}
