package com.demo.loadclient.metrics;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Well-known tag names the client sets on request and check samples.
 */
public enum SystemTag {
    NAME("name"),
    URL("url"),
    METHOD("method"),
    STATUS("status"),
    ERROR("error"),
    ERROR_CODE("error_code"),
    EXPECTED_RESPONSE("expected_response"),
    IP("ip"),
    CHECK("check"),
    PROTO("proto");

    private final String tagName;

    SystemTag(String tagName) {
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }

    /** Everything except {@code ip}, which is opt-in. */
    public static Set<SystemTag> defaults() {
        return EnumSet.complementOf(EnumSet.of(IP));
    }

    /**
     * Parse a comma separated list of tag names, e.g. {@code "name,url,status"}.
     * A blank value means {@link #defaults()}.
     */
    public static Set<SystemTag> parse(String csv) {
        if (csv == null || csv.isBlank()) {
            return defaults();
        }
        EnumSet<SystemTag> result = EnumSet.noneOf(SystemTag.class);
        for (String raw : csv.split(",")) {
            String name = raw.trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            result.add(fromTagName(name));
        }
        return result;
    }

    public static SystemTag fromTagName(String name) {
        for (SystemTag tag : values()) {
            if (tag.tagName.equals(name)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("unknown system tag: " + name);
    }
}
