package org.muxhttp.domain.model;

/** The status codes this server can produce, with their reason phrases and stock bodies. */
public enum HttpStatus {
    OK(200, "OK", null),
    NOT_MODIFIED(304, "Not Modified", null),
    FORBIDDEN(403, "Forbidden", "<h1>403 Forbidden</h1>"),
    NOT_FOUND(404, "Not Found", "<h1>404 Not Found</h1>"),
    INTERNAL_SERVER_ERROR(500, "Internal Server Error", "<h1>500 Internal Server Error</h1>"),
    HTTP_VERSION_NOT_SUPPORTED(505, "HTTP Version Not Supported", "<h1>505 HTTP Version Not Supported</h1>");

    private final int code;
    private final String reason;
    private final String defaultBody;

    HttpStatus(int code, String reason, String defaultBody) {
        this.code = code;
        this.reason = reason;
        this.defaultBody = defaultBody;
    }

    public int code() { return code; }
    public String reason() { return reason; }

    /** HTML explaining the status, or null for statuses whose body comes from elsewhere. */
    public String defaultBody() { return defaultBody; }
}
