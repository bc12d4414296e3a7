package com.roundgrader.checks;

import com.fasterxml.jackson.databind.JsonNode;
import com.roundgrader.utils.PipelineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs a task's check descriptors against a deployed page, one outcome per descriptor, in order.
 * <p>
 * The interactive backend is tried first; if it cannot be started the static backend is used
 * instead. A page that fails to load yields a single {@code page_load} outcome. An error inside
 * one check becomes a 0-score outcome for that check only.
 */
public class CheckEngine {
    private static final Logger logger = LoggerFactory.getLogger(CheckEngine.class);

    static final double NEUTRAL_SCORE = 0.5;

    private final BackendFactory interactiveFactory;
    private final BackendFactory staticFactory;

    /**
     * @param interactiveFactory may be null to always use the static backend
     */
    public CheckEngine(BackendFactory interactiveFactory, BackendFactory staticFactory) {
        this.interactiveFactory = interactiveFactory;
        this.staticFactory = staticFactory;
    }

    public static CheckEngine fromSettings(PipelineSettings settings) {
        BackendFactory interactive = settings.isInteractiveEnabled()
                ? PlaywrightBackend.factory(settings.getPageLoadTimeout(), settings.getSettleDelay())
                : null;
        return new CheckEngine(interactive, StaticHtmlBackend.factory(settings.getStaticFetchTimeout()));
    }

    public List<CheckOutcome> evaluate(String url, List<JsonNode> descriptors) {
        CheckBackend backend = openBackend();
        try {
            logger.info("Running {} checks against {} with {} backend", descriptors.size(), url, backend.name());
            try {
                backend.load(url);
            } catch (IOException | RuntimeException e) {
                logger.warn("Page load failed for {}: {}", url, e.getMessage());
                return List.of(CheckOutcome.failed("page_load", e.getMessage()));
            }

            List<CheckOutcome> outcomes = new ArrayList<>();
            for (JsonNode descriptor : descriptors) {
                runIsolated(backend, descriptor).ifPresent(outcomes::add);
            }
            return outcomes;
        } finally {
            backend.close();
        }
    }

    private CheckBackend openBackend() {
        if (interactiveFactory != null) {
            try {
                return interactiveFactory.open();
            } catch (RuntimeException e) {
                logger.warn("Interactive backend unavailable, falling back to static HTML checks: {}", e.getMessage());
            }
        }
        return staticFactory.open();
    }

    private Optional<CheckOutcome> runIsolated(CheckBackend backend, JsonNode descriptor) {
        String rawType = descriptor.path("type").asText("");
        try {
            return run(backend, CheckParser.parse(descriptor));
        } catch (RuntimeException e) {
            logger.error("Error in check {}: {}", rawType, e.getMessage());
            return Optional.of(CheckOutcome.failed("check_" + rawType, "Error: " + e.getMessage()));
        }
    }

    Optional<CheckOutcome> run(CheckBackend backend, Check check) {
        if (check.type() == CheckType.UNKNOWN) {
            logger.warn("Unknown check type: {}", ((Check.Unknown) check).rawType());
            return Optional.empty();
        }
        if (check.type().requiresInteraction() && !backend.supportsInteraction()) {
            return Optional.of(new CheckOutcome(check.resultName(), NEUTRAL_SCORE,
                    check.type().getWireName() + " skipped (no script execution in static fallback)", ""));
        }

        switch (check.type()) {
            case ELEMENT_EXISTS:
                return Optional.of(elementExists(backend, (Check.ElementExists) check));
            case BUTTON_EXISTS:
                return Optional.of(buttonExists(backend, (Check.ButtonExists) check));
            case CLICK_INTERACTION:
                return Optional.of(clickInteraction(backend, (Check.ClickInteraction) check));
            case RESPONSIVE_CHECK:
                return Optional.of(responsive(backend, (Check.ResponsiveCheck) check));
            case KEYBOARD_EVENT:
                return Optional.of(keyboard(backend, (Check.KeyboardEvent) check));
            case CLICK_SEQUENCE:
                return Optional.of(clickSequence(backend, (Check.ClickSequence) check));
            default:
                throw new IllegalStateException("Unhandled check type " + check.type());
        }
    }

    private CheckOutcome elementExists(CheckBackend backend, Check.ElementExists check) {
        int count = backend.countElements(check.selector());
        double score = count >= check.minCount() ? 1.0 : 0.0;
        return new CheckOutcome(check.resultName(), score,
                "Found " + count + " elements (expected >=" + check.minCount() + ")",
                "selector=" + check.selector() + " count=" + count);
    }

    private CheckOutcome buttonExists(CheckBackend backend, Check.ButtonExists check) {
        Optional<String> match = backend.findButton(check.texts());
        if (match.isPresent()) {
            return new CheckOutcome(check.resultNameFor(match.get()), 1.0,
                    "Button with text \"" + match.get() + "\" found", "");
        }
        return CheckOutcome.failed(check.resultName(), "No button found with text: " + check.texts());
    }

    private CheckOutcome clickInteraction(CheckBackend backend, Check.ClickInteraction check) {
        ClickEffect effect = backend.click(check.selector(), check.expectsModal());
        switch (effect) {
            case ELEMENT_MISSING:
                return CheckOutcome.failed(check.resultName(), "Element not found: " + check.selector());
            case EFFECT_CONFIRMED:
                return new CheckOutcome(check.resultName(), 1.0, "Modal/lightbox opened on click", "");
            default:
                return new CheckOutcome(check.resultName(), NEUTRAL_SCORE,
                        "Click registered but expected result unclear", "expected=" + check.expectedResult());
        }
    }

    private CheckOutcome responsive(CheckBackend backend, Check.ResponsiveCheck check) {
        int passed = 0;
        StringBuilder evidence = new StringBuilder();
        for (int width : check.breakpoints()) {
            boolean ok = backend.laidOutAt(width);
            if (ok) {
                passed++;
            }
            evidence.append(width).append(ok ? "=ok " : "=collapsed ");
        }
        int total = check.breakpoints().size();
        double score = total == 0 ? 0.0 : (double) passed / total;
        return new CheckOutcome(check.resultName(), score,
                "Responsive at " + passed + "/" + total + " breakpoints", evidence.toString().trim());
    }

    private CheckOutcome keyboard(CheckBackend backend, Check.KeyboardEvent check) {
        if (backend.pressKey(check.key())) {
            return new CheckOutcome(check.resultName(), 1.0, "Page changed after pressing " + check.key(), "");
        }
        return new CheckOutcome(check.resultName(), NEUTRAL_SCORE,
                "Key " + check.key() + " registered but no visible change", "expected=" + check.expectedResult());
    }

    private CheckOutcome clickSequence(CheckBackend backend, Check.ClickSequence check) {
        for (String button : check.buttons()) {
            if (!backend.clickButton(button)) {
                return CheckOutcome.failed(check.resultName(), "Button not found: " + button);
            }
        }
        Optional<String> display = backend.readDisplay();
        if (display.isEmpty()) {
            return CheckOutcome.failed(check.resultName(), "No display element found");
        }
        String shown = display.get().trim();
        String sequence = String.join(" ", check.buttons());
        for (String accepted : check.acceptedResults()) {
            if (displayMatches(shown, accepted.trim())) {
                return new CheckOutcome(check.resultName(), 1.0,
                        sequence + " shows " + shown, "display=" + shown);
            }
        }
        return new CheckOutcome(check.resultName(), 0.0,
                sequence + " expected " + check.expectedResult() + " but display shows " + shown,
                "display=" + shown);
    }

    /**
     * Exact match, or numeric equality when both sides parse as numbers ({@code 4} matches {@code 4.0}).
     */
    static boolean displayMatches(String shown, String accepted) {
        if (accepted.isEmpty()) {
            return false;
        }
        if (shown.equals(accepted)) {
            return true;
        }
        try {
            return new BigDecimal(shown).compareTo(new BigDecimal(accepted)) == 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
