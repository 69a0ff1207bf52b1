package org.muxhttp.api.impl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Header fields of one message. Names are case-insensitive for lookup; a repeated
 * name replaces the earlier value (and spelling) but keeps its original position,
 * so the block can be forwarded in arrival order.
 */
public final class Headers {

    // lowercased name -> {name as received, value}
    private final Map<String, String[]> fields = new LinkedHashMap<>();

    public String get(String name) {
        if (name == null) return null;
        String[] f = fields.get(name.toLowerCase());
        return f == null ? null : f[1];
    }

    public void set(String name, String value) {
        String key = name.toLowerCase();
        String[] existing = fields.get(key);
        if (existing != null) {
            existing[0] = name;
            existing[1] = value;
        } else {
            fields.put(key, new String[]{name, value});
        }
    }

    /** Read-only view keyed by the received spelling. */
    public Map<String, String> asMap() {
        Map<String, String> out = new LinkedHashMap<>();
        for (String[] f : fields.values()) {
            out.put(f[0], f[1]);
        }
        return Collections.unmodifiableMap(out);
    }
}
