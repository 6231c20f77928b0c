package com.scaniq.collector.service.decision;

/**
 * Characteristic keys capabilities report about a page.
 */
public final class PageCharacteristics {

    public static final String TITLE = "title";
    public static final String STATUS_CODE = "statusCode";
    public static final String HAS_JAVASCRIPT = "hasJavaScript";
    public static final String HAS_API_REFERENCES = "hasApiReferences";
    public static final String HAS_SECURITY_HEADERS = "hasSecurityHeaders";
    public static final String FRAMEWORKS = "frameworks";
    public static final String CLIENT_ROUTES = "clientRoutes";

    private PageCharacteristics() {
    }
}
