package com.demo.loadclient;

import com.demo.loadclient.metrics.TagsAndMeta;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoadClientConfigurationTest {

    @Test
    void testParseRunTags() {
        TagsAndMeta tags = LoadClientConfiguration.parseRunTags(List.of("env=staging", " team = core ", ""));

        assertEquals("staging", tags.getTag("env"));
        assertEquals("core", tags.getTag("team"));
        assertEquals(2, tags.tags().size());
    }

    @Test
    void testInvalidRunTag() {
        assertThrows(IllegalArgumentException.class, () -> LoadClientConfiguration.parseRunTags(List.of("=x")));
        assertThrows(IllegalArgumentException.class, () -> LoadClientConfiguration.parseRunTags(List.of("novalue")));
    }
}
