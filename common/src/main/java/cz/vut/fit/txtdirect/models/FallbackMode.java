package cz.vut.fit.txtdirect.models;

/**
 * Selects the target of a fallback response.
 */
public enum FallbackMode {
    /**
     * Redirect to the configured fallback URL, or respond with 404 if there is none.
     */
    GLOBAL,
    /**
     * Redirect to the {@code to=} target of the last resolved record.
     */
    TO,
    /**
     * Redirect to the {@code website=} target of the last resolved record.
     */
    WEBSITE
}
