package com.musicsync.engine;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Track key forms and the tiered lookup built on them.
 */
public class TrackKeyTest {

    @Test
    void testKeyForms() {
        String key = TrackKey.of(" CamelPhat & Elderbrook ", "Cola (Extended Mix) ");
        assertEquals("CamelPhat & Elderbrook - Cola (Extended Mix)", key);
        assertEquals("camelphat & elderbrook - cola (extended mix)", TrackKey.lower(key));
        assertEquals("CamelPhat & Elderbrook - Cola", TrackKey.stripParens(key));
        assertEquals("camelphat & elderbrook - cola", TrackKey.normalized(key));
        assertEquals("camelphat, elderbrook - cola", TrackKey.deep(key));
        assertEquals(TrackKey.deep("Elderbrook, CamelPhat - Cola"), TrackKey.deep(key));
    }

    @Test
    void testStripParensKeepsKeyWhenNothingRemains() {
        assertEquals("(Intro)", TrackKey.stripParens("(Intro)"));
    }

    @Test
    void testSplit() {
        assertArrayEquals(new String[] {"Artist", "Song - Part 2"}, TrackKey.split("Artist - Song - Part 2"));
        assertArrayEquals(new String[] {"", "Untitled"}, TrackKey.split("Untitled"));
        assertArrayEquals(new String[] {"", ""}, TrackKey.split(null));
    }

    @Test
    void testLookupFindsNormalizedOnlyKey() {
        Map<String, String> urls = new LinkedHashMap<>();
        urls.put("Artist - Song", "u1");
        TrackKeyIndex<String> index = new TrackKeyIndex<>(urls);

        Optional<TrackKeyIndex.Match<String>> match = index.find("ARTIST - Song (Radio Edit)");
        assertTrue(match.isPresent());
        assertEquals(TrackKeyIndex.Tier.NORMALIZED, match.get().tier());
        assertEquals("u1", match.get().value());
    }

    @Test
    void testExactTierWinsOverLooserTiers() {
        Map<String, String> urls = new LinkedHashMap<>();
        // registered first so a merged result would prefer it
        urls.put("B & A - Song", "deep-hit");
        urls.put("a - song", "lower-hit");
        urls.put("A - Song", "exact-hit");
        TrackKeyIndex<String> index = new TrackKeyIndex<>(urls);

        assertEquals("exact-hit", index.get("A - Song").orElseThrow());
        assertEquals(TrackKeyIndex.Tier.EXACT, index.find("A - Song").orElseThrow().tier());
        assertEquals(TrackKeyIndex.Tier.LOWERCASE, index.find("a - SONG").orElseThrow().tier());
        assertEquals(TrackKeyIndex.Tier.DEEP, index.find("A, B - Song").orElseThrow().tier());
        assertEquals("deep-hit", index.get("A, B - Song").orElseThrow());
    }

    @Test
    void testFindAllStaysInOneTier() {
        TrackKeyIndex<String> index = TrackKeyIndex.ofKeys(List.of("A - Song (Extended Mix)", "a - song (radio edit)", "A - Song"));
        List<TrackKeyIndex.Match<String>> exact = index.findAll("A - Song");
        assertEquals(1, exact.size());
        assertEquals("A - Song", exact.get(0).key());

        List<TrackKeyIndex.Match<String>> normalized = index.findAll("a - song (club mix)");
        assertEquals(3, normalized.size());
        assertTrue(normalized.stream().allMatch(m -> m.tier() == TrackKeyIndex.Tier.NORMALIZED));
    }

    @Test
    void testMissingKey() {
        TrackKeyIndex<String> index = TrackKeyIndex.ofKeys(List.of("A - Song"));
        assertFalse(index.contains("C - Other"));
        assertTrue(index.findAll(null).isEmpty());
        assertEquals(1, index.size());
    }
}
