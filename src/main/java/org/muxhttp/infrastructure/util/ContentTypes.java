package org.muxhttp.infrastructure.util;

import java.util.HashMap;
import java.util.Map;

/** Extension to media type mapping; unknown or missing extensions fall back to text/html. */
public final class ContentTypes {

    public static final String DEFAULT = "text/html";

    private static final Map<String, String> BUILT_IN = new HashMap<>();
    static {
        BUILT_IN.put("html", "text/html");
        BUILT_IN.put("htm", "text/html");
        BUILT_IN.put("txt", "text/plain");
        BUILT_IN.put("css", "text/css");
        BUILT_IN.put("js", "application/javascript");
        BUILT_IN.put("json", "application/json");
        BUILT_IN.put("xml", "application/xml");
        BUILT_IN.put("pdf", "application/pdf");
        BUILT_IN.put("jpg", "image/jpeg");
        BUILT_IN.put("jpeg", "image/jpeg");
        BUILT_IN.put("png", "image/png");
        BUILT_IN.put("gif", "image/gif");
        BUILT_IN.put("svg", "image/svg+xml");
        BUILT_IN.put("ico", "image/x-icon");
    }

    private final Map<String, String> types;

    public ContentTypes() {
        this(Map.of());
    }

    /** @param extra additional or overriding entries, keyed by extension without the dot */
    public ContentTypes(Map<String, String> extra) {
        Map<String, String> m = new HashMap<>(BUILT_IN);
        if (extra != null) {
            extra.forEach((ext, type) -> m.put(ext.toLowerCase(), type));
        }
        this.types = Map.copyOf(m);
    }

    public String forName(String name) {
        if (name == null) return DEFAULT;
        String lower = name.toLowerCase();
        int slash = lower.lastIndexOf('/');
        int dot = lower.lastIndexOf('.');
        if (dot > slash && dot < lower.length() - 1) {
            return types.getOrDefault(lower.substring(dot + 1), DEFAULT);
        }
        return DEFAULT;
    }
}
