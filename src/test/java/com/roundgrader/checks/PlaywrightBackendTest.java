package com.roundgrader.checks;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Keyboard;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.BoundingBox;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlaywrightBackendTest {

    @Mock
    Playwright playwright;
    @Mock
    Browser browser;
    @Mock
    Page page;
    @Mock
    ElementHandle element;

    private PlaywrightBackend backend;

    @BeforeEach
    void setUp() {
        backend = new PlaywrightBackend(playwright, browser, page, Duration.ofSeconds(30), Duration.ofMillis(500));
    }

    @Test
    void navigationTimeoutIsALoadFailure() {
        when(page.navigate(anyString(), any(Page.NavigateOptions.class))).thenThrow(new TimeoutError("Timeout 30000ms exceeded"));

        IOException e = assertThrows(IOException.class, () -> backend.load("https://a.github.io/repo/"));
        assertEquals("Page failed to load: timeout", e.getMessage());
    }

    @Test
    void clickConfirmsVisibleModal() {
        ElementHandle modal = mock(ElementHandle.class);
        when(page.querySelector("#gallery img")).thenReturn(element);
        when(page.querySelector(PlaywrightBackend.MODAL_SELECTOR)).thenReturn(modal);
        when(modal.isVisible()).thenReturn(true);

        assertEquals(ClickEffect.EFFECT_CONFIRMED, backend.click("#gallery img", true));
        verify(element).click();
        verify(page).waitForTimeout(500);
    }

    @Test
    void clickWithoutModalIsOnlyRegistered() {
        when(page.querySelector("#gallery img")).thenReturn(element);
        when(page.querySelector(PlaywrightBackend.MODAL_SELECTOR)).thenReturn(null);

        assertEquals(ClickEffect.CLICK_REGISTERED, backend.click("#gallery img", true));
    }

    @Test
    void clickOnMissingElement() {
        when(page.querySelector(".missing")).thenReturn(null);

        assertEquals(ClickEffect.ELEMENT_MISSING, backend.click(".missing", false));
    }

    @Test
    void responsiveChecksBodyWidthAfterResize() {
        BoundingBox box = new BoundingBox();
        box.width = 768;
        when(page.querySelector("body")).thenReturn(element);
        when(element.boundingBox()).thenReturn(box);

        assertTrue(backend.laidOutAt(768));
        verify(page).setViewportSize(768, 800);

        box.width = 0;
        assertFalse(backend.laidOutAt(320));
    }

    @Test
    void keyPressComparesDocumentBeforeAndAfter() {
        Keyboard keyboard = mock(Keyboard.class);
        when(page.keyboard()).thenReturn(keyboard);
        when(page.content()).thenReturn("<img src=a>", "<img src=b>");

        assertTrue(backend.pressKey("ArrowRight"));
        verify(keyboard).press("ArrowRight");
    }

    @Test
    void findsButtonByText() {
        when(page.querySelector(anyString())).thenReturn(null);
        when(page.querySelector(eq("button:has-text(\"Next\"), [type=\"button\"]:has-text(\"Next\")"))).thenReturn(element);

        assertEquals(Optional.of("Next"), backend.findButton(List.of("Forward", "Next")));
    }

    @Test
    void readsInputDisplayValue() {
        when(page.querySelector(PlaywrightBackend.DISPLAY_SELECTOR)).thenReturn(element);
        when(element.evaluate("el => el.tagName")).thenReturn("INPUT");
        when(element.inputValue()).thenReturn(" 4 ");

        assertEquals(Optional.of("4"), backend.readDisplay());
    }

    @Test
    void closeReleasesEverythingEvenWhenOneStepFails() throws Exception {
        doThrow(new RuntimeException("already closed")).when(page).close();

        backend.close();

        verify(page).close();
        verify(browser).close();
        verify(playwright).close();
    }
}
