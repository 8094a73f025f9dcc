package io.kvcache.fetch;

import io.kvcache.exception.FetchException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Fetches pages over HTTP with bounded connect and request timeouts.
 */
public final class HttpPageFetcher implements PageFetcher {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient client;
    private final Duration timeout;

    public HttpPageFetcher() {
        this(DEFAULT_TIMEOUT);
    }

    public HttpPageFetcher(Duration timeout) {
        this.client = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        this.timeout = timeout;
    }

    @Override
    public String fetch(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, e);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FetchException(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new FetchException(url, response.statusCode());
        }
        return response.body();
    }
}
