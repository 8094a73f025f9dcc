package io.kvcache.fetch;

/**
 * Fetches the content of a remote resource.
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * Fetches the content at a URL.
     *
     * @param url the URL
     * @return the content as text
     * @throws io.kvcache.exception.FetchException if the resource cannot be fetched
     */
    String fetch(String url);
}
