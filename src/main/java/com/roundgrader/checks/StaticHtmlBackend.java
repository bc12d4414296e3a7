package com.roundgrader.checks;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Fallback backend: fetches the page over plain HTTP and parses the markup with jsoup.
 * No script runs, so interaction checks are never routed here.
 */
public class StaticHtmlBackend implements CheckBackend {
    private static final Logger logger = LoggerFactory.getLogger(StaticHtmlBackend.class);

    private final OkHttpClient httpClient;
    private Document document;

    public StaticHtmlBackend(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public static BackendFactory factory(Duration fetchTimeout) {
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .callTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .build();
        return () -> new StaticHtmlBackend(client);
    }

    @Override
    public String name() {
        return "static-html";
    }

    @Override
    public boolean supportsInteraction() {
        return false;
    }

    @Override
    public void load(String url) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() != 200) {
                throw new IOException("HTTP " + response.code());
            }
            ResponseBody body = response.body();
            String html = body != null ? body.string() : "";
            this.document = Jsoup.parse(html, url);
            logger.debug("Fetched {} ({} characters)", url, html.length());
        }
    }

    @Override
    public int countElements(String selector) {
        return requireDocument().select(selector).size();
    }

    @Override
    public Optional<String> findButton(List<String> texts) {
        for (String text : texts) {
            String needle = text.toLowerCase();
            for (Element candidate : requireDocument().select("button, input[type=button], input[type=submit]")) {
                String label = "input".equals(candidate.tagName()) ? candidate.attr("value") : candidate.text();
                if (label.toLowerCase().contains(needle)) {
                    return Optional.of(text);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public ClickEffect click(String selector, boolean expectModal) {
        throw new UnsupportedOperationException("click requires script execution");
    }

    @Override
    public boolean laidOutAt(int width) {
        throw new UnsupportedOperationException("viewport control requires a rendering engine");
    }

    @Override
    public boolean pressKey(String key) {
        throw new UnsupportedOperationException("keyboard input requires script execution");
    }

    @Override
    public boolean clickButton(String text) {
        throw new UnsupportedOperationException("click requires script execution");
    }

    @Override
    public Optional<String> readDisplay() {
        throw new UnsupportedOperationException("display state requires script execution");
    }

    @Override
    public void close() {
        document = null;
    }

    private Document requireDocument() {
        if (document == null) {
            throw new IllegalStateException("Page not loaded");
        }
        return document;
    }
}
