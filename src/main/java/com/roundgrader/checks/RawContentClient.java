package com.roundgrader.checks;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * Reads single files of a repository at a fixed revision from a raw content host,
 * laid out as {@code {base}/{owner}/{repo}/{commitSha}/{path}}.
 */
public class RawContentClient {

    private final OkHttpClient httpClient;
    private final String baseUrl;

    public RawContentClient(OkHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * @throws IllegalArgumentException if the resulting URL is malformed
     */
    public RawFile fetch(String ownerRepo, String commitSha, String path) throws IOException {
        String url = baseUrl + "/" + ownerRepo + "/" + commitSha + "/" + path;
        try (Response response = httpClient.newCall(new Request.Builder().url(url).get().build()).execute()) {
            if (response.code() != 200) {
                return new RawFile(response.code(), null);
            }
            ResponseBody body = response.body();
            return new RawFile(200, body != null ? body.string() : "");
        }
    }

    // "https://github.com/owner/repo" -> "owner/repo"
    static String ownerAndRepo(String repoUrl) {
        if (repoUrl == null) {
            return null;
        }
        String trimmed = repoUrl.endsWith("/") ? repoUrl.substring(0, repoUrl.length() - 1) : repoUrl;
        if (trimmed.endsWith(".git")) {
            trimmed = trimmed.substring(0, trimmed.length() - 4);
        }
        String[] parts = trimmed.split("/");
        if (parts.length < 2 || parts[parts.length - 1].isEmpty() || parts[parts.length - 2].isEmpty()) {
            return null;
        }
        return parts[parts.length - 2] + "/" + parts[parts.length - 1];
    }

    public record RawFile(int statusCode, String content) {
        public boolean found() {
            return statusCode == 200;
        }
    }
}
