package com.openforge.searchmate.search;

/**
 * Failure of the external search backend: network, quota, HTTP error or an
 * unreadable response. Checked, so every caller has to decide what a failed
 * lookup means.
 */
public class SearchProviderException extends Exception {

    public SearchProviderException(String message) {
        super(message);
    }

    public SearchProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
