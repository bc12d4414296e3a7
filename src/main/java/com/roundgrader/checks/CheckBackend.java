package com.roundgrader.checks;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * An execution strategy for running checks against one page. A backend instance is scoped to a
 * single submission and must be closed on every exit path.
 * <p>
 * The interaction methods are only called when {@link #supportsInteraction()} is true.
 */
public interface CheckBackend extends AutoCloseable {

    String name();

    boolean supportsInteraction();

    /**
     * Load the page; any failure here short-circuits the whole evaluation.
     */
    void load(String url) throws IOException;

    int countElements(String selector);

    /**
     * First of {@code texts} found (case-insensitive) on a button or clickable input.
     */
    Optional<String> findButton(List<String> texts);

    ClickEffect click(String selector, boolean expectModal);

    /**
     * Resize the viewport to {@code width} and report whether the body still has a positive width.
     */
    boolean laidOutAt(int width);

    /**
     * Press a key and report whether the document changed.
     */
    boolean pressKey(String key);

    /**
     * Click the button whose visible text is exactly {@code text}; false when there is none.
     */
    boolean clickButton(String text);

    /**
     * Current text of the calculator-style display element, if the page has one.
     */
    Optional<String> readDisplay();

    @Override
    void close();
}
