package com.demo.loadclient.metrics;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TagsAndMetaTest {

    @Test
    void testCopyIsIndependent() {
        TagsAndMeta original = new TagsAndMeta();
        original.setTag("env", "dev");
        TagsAndMeta copy = original.copy();
        copy.setTag("env", "prod");
        copy.setMetadata("vu", "1");

        assertEquals("dev", original.getTag("env"));
        assertEquals("prod", copy.getTag("env"));
        assertTrue(original.metadata().isEmpty());
    }

    @Test
    void testSystemTagOnlyWhenEnabled() {
        TagsAndMeta tags = new TagsAndMeta();
        Set<SystemTag> enabled = EnumSet.of(SystemTag.STATUS);
        tags.setSystemTagIfEnabled(enabled, SystemTag.STATUS, "200");
        tags.setSystemTagIfEnabled(enabled, SystemTag.METHOD, "GET");

        assertEquals("200", tags.getTag("status"));
        assertFalse(tags.hasTag("method"));
    }

    @Test
    void testSnapshotsAreReadOnly() {
        TagsAndMeta tags = new TagsAndMeta();
        tags.setTag("a", "b");
        assertThrows(UnsupportedOperationException.class, () -> tags.tags().put("c", "d"));
    }

    @Test
    void testSystemTagParsing() {
        assertEquals(SystemTag.defaults(), SystemTag.parse(""));
        assertFalse(SystemTag.defaults().contains(SystemTag.IP));
        assertEquals(EnumSet.of(SystemTag.IP, SystemTag.ERROR_CODE), SystemTag.parse("ip, error_code"));
        assertThrows(IllegalArgumentException.class, () -> SystemTag.parse("nope"));
    }
}
