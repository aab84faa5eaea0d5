package com.coursegen.orchestrator.media;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Fetches a provider result (http, https or file URI) into the job workspace.
 */
public class MediaDownloader {

    private static final Duration TIMEOUT = Duration.ofMinutes(2);

    private final HttpClient http;

    public MediaDownloader(HttpClient http) {
        this.http = http;
    }

    /** @throws MediaException if the resource cannot be fetched */
    public Path download(String url, Path target) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new MediaException("Malformed media URL: " + url, e);
        }
        try {
            Files.createDirectories(target.getParent());
            if ("file".equalsIgnoreCase(uri.getScheme())) {
                Files.copy(Path.of(uri), target, StandardCopyOption.REPLACE_EXISTING);
                return target;
            }
            HttpRequest req = HttpRequest.newBuilder(uri).timeout(TIMEOUT).GET().build();
            HttpResponse<InputStream> resp = http.send(req, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = resp.body()) {
                if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                    throw new MediaException("Download of " + url + " failed: HTTP " + resp.statusCode());
                }
                Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return target;
        } catch (IOException e) {
            throw new MediaException("Download of " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MediaException("Download of " + url + " interrupted", e);
        }
    }
}
