package org.smileyface.linkarchive.fetch;

/**
 * Retrieves and normalizes the content behind a URL. Implementations may block; the
 * {@link FetcherAdapter} bounds every call with a timeout.
 */
@FunctionalInterface
public interface ContentFetcher {

    /**
     * @param url the link URL, as written in the link list
     * @return the normalized page
     * @throws FetchException when the page cannot be archived
     */
    FetchResult fetch(String url) throws FetchException;
}
