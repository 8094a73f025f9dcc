package io.kvcache.exception;

/**
 * Thrown when a remote resource cannot be fetched.
 */
public class FetchException extends KvCacheException {

    private final String url;
    private final int statusCode;

    public FetchException(String url, int statusCode) {
        super("Fetch failed for " + url + " (HTTP " + statusCode + ")");
        this.url = url;
        this.statusCode = statusCode;
    }

    public FetchException(String url, Throwable cause) {
        super("Fetch failed for " + url, cause);
        this.url = url;
        this.statusCode = -1;
    }

    public String getUrl() {
        return url;
    }

    /**
     * Gets the HTTP status of the failed response.
     *
     * @return the status code, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
