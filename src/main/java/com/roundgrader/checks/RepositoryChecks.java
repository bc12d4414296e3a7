package com.roundgrader.checks;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundgrader.utils.PipelineSettings;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Assembles the enabled repository checks in the order their results are written.
 */
public final class RepositoryChecks {

    private RepositoryChecks() {}

    public static List<RepositoryCheck> fromSettings(PipelineSettings settings, ObjectMapper objectMapper) {
        OkHttpClient client = httpClient(settings.getStaticFetchTimeout());
        RawContentClient rawContent = new RawContentClient(client, settings.getRawContentBaseUrl());
        boolean quality = settings.isRepositoryQualityChecksEnabled();

        List<RepositoryCheck> checks = new ArrayList<>();
        if (quality) {
            checks.add(new RepoCreationCheck(client, objectMapper, settings.getRepoApiBaseUrl()));
        }
        if (settings.isLicenseCheckEnabled()) {
            checks.add(new LicenseCheck(rawContent));
        }
        if (quality) {
            checks.add(new ReadmeCheck(rawContent));
            checks.add(new CodeQualityCheck(rawContent));
        }
        return checks;
    }

    private static OkHttpClient httpClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .build();
    }
}
