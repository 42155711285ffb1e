package com.demo.loadclient.metrics;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Mutable tag and metadata context. Tags become metric dimensions, metadata travels with
 * samples without being indexed. Copy before modifying a shared instance.
 */
public class TagsAndMeta {

    private final Map<String, String> tags;
    private final Map<String, String> metadata;

    public TagsAndMeta() {
        this(Map.of(), Map.of());
    }

    public TagsAndMeta(Map<String, String> tags, Map<String, String> metadata) {
        this.tags = new TreeMap<>(tags);
        this.metadata = new TreeMap<>(metadata);
    }

    public TagsAndMeta copy() {
        return new TagsAndMeta(tags, metadata);
    }

    @Nullable
    public String getTag(String name) {
        return tags.get(name);
    }

    public boolean hasTag(String name) {
        return tags.containsKey(name);
    }

    public void setTag(String name, String value) {
        tags.put(name, value);
    }

    public void setMetadata(String key, String value) {
        metadata.put(key, value);
    }

    public void setSystemTag(SystemTag tag, String value) {
        tags.put(tag.tagName(), value);
    }

    /**
     * Set a system tag only when it is part of the enabled set.
     */
    public void setSystemTagIfEnabled(Set<SystemTag> enabled, SystemTag tag, String value) {
        if (enabled.contains(tag)) {
            setSystemTag(tag, value);
        }
    }

    /** Snapshot of the current tags. */
    public Map<String, String> tags() {
        return Collections.unmodifiableMap(new TreeMap<>(tags));
    }

    /** Snapshot of the current metadata. */
    public Map<String, String> metadata() {
        return Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    @Override
    public String toString() {
        return "TagsAndMeta{tags=" + tags + ", metadata=" + metadata + "}";
    }
}
