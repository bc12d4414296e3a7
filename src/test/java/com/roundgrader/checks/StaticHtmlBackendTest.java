package com.roundgrader.checks;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StaticHtmlBackendTest {

    private static final String PAGE = """
            <!DOCTYPE html>
            <html>
            <head><title>Gallery</title></head>
            <body>
              <div id="gallery">
                <img src="a.png"><img src="b.png"><img src="c.png">
              </div>
              <button class="nav">Previous</button>
              <button class="nav">Next Image</button>
              <input type="button" value="Reset">
              <input type="text" value="Search photos">
              <script>document.body.innerHTML += '<img src="late.png">';</script>
            </body>
            </html>
            """;

    private MockWebServer server;
    private StaticHtmlBackend backend;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        backend = new StaticHtmlBackend(new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        backend.close();
        server.shutdown();
    }

    @Test
    void countsElementsInStaticMarkupOnly() throws IOException {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(PAGE));

        backend.load(server.url("/").toString());

        assertEquals(3, backend.countElements("#gallery img"));
        assertEquals(3, backend.countElements("img"));
        assertEquals(0, backend.countElements(".modal"));
    }

    @Test
    void findsButtonsCaseInsensitively() throws IOException {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(PAGE));
        backend.load(server.url("/").toString());

        assertEquals(Optional.of("next"), backend.findButton(List.of("Forward", "next")));
        assertEquals(Optional.of("reset"), backend.findButton(List.of("reset")));
        assertEquals(Optional.empty(), backend.findButton(List.of("Submit")));
    }

    @Test
    void textFieldsAreNotButtons() throws IOException {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(PAGE));
        backend.load(server.url("/").toString());

        assertEquals(Optional.empty(), backend.findButton(List.of("Search")));
    }

    @Test
    void non200IsALoadFailure() {
        server.enqueue(new MockResponse().setResponseCode(404));

        IOException e = assertThrows(IOException.class, () -> backend.load(server.url("/missing").toString()));
        assertEquals("HTTP 404", e.getMessage());
    }

    @Test
    void reportsNoInteraction() {
        assertFalse(backend.supportsInteraction());
        assertThrows(UnsupportedOperationException.class, () -> backend.pressKey("Enter"));
    }
}
