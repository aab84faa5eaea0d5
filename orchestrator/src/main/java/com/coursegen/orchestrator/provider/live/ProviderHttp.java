package com.coursegen.orchestrator.provider.live;

import com.coursegen.orchestrator.fallback.FailureKind;
import com.coursegen.orchestrator.provider.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Shared request plumbing for the live provider clients.
 *
 * Every failure leaves here as a classified {@link ProviderException}:
 * HTTP timeouts as TIMEOUT, 401/403 as CONFIGURATION, unparseable bodies as
 * VALIDATION and everything else as PROVIDER.
 */
public class ProviderHttp {

    private final HttpClient   http;
    private final ObjectMapper json;

    public ProviderHttp(HttpClient http, ObjectMapper json) {
        this.http = http;
        this.json = json;
    }

    public JsonNode postJson(String provider, URI uri, Map<String, String> headers,
                             Object body, Duration timeout) {
        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(provider, body)));
        headers.forEach(req::header);
        return parse(provider, send(provider, req.build()));
    }

    public JsonNode getJson(String provider, URI uri, Map<String, String> headers, Duration timeout) {
        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        headers.forEach(req::header);
        return parse(provider, send(provider, req.build()));
    }

    /** POST a JSON body and return the raw response bytes (audio, images). */
    public byte[] postForBytes(String provider, URI uri, Map<String, String> headers,
                               Object body, Duration timeout) {
        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(provider, body)));
        headers.forEach(req::header);
        return send(provider, req.build());
    }

    public byte[] getBytes(String provider, URI uri, Duration timeout) {
        return send(provider, HttpRequest.newBuilder(uri).timeout(timeout).GET().build());
    }

    // ------------------------------------------------------------------

    private byte[] send(String provider, HttpRequest request) {
        try {
            HttpResponse<byte[]> resp = http.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw ProviderException.httpStatus(provider, resp.statusCode(),
                        new String(resp.body(), StandardCharsets.UTF_8));
            }
            return resp.body();
        } catch (HttpTimeoutException e) {
            throw new ProviderException(FailureKind.TIMEOUT, provider + " timed out: " + request.uri(), e);
        } catch (IOException e) {
            throw new ProviderException(FailureKind.PROVIDER, provider + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(FailureKind.PROVIDER, provider + " call interrupted", e);
        }
    }

    private JsonNode parse(String provider, byte[] body) {
        try {
            return json.readTree(body);
        } catch (IOException e) {
            throw new ProviderException(FailureKind.VALIDATION, provider + " returned unparseable JSON", e);
        }
    }

    private String toJson(String provider, Object body) {
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(FailureKind.VALIDATION, "Could not serialize " + provider + " request", e);
        }
    }
}
