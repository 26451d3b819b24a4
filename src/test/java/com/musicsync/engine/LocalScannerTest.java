package com.musicsync.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LocalScannerTest {

    @TempDir
    Path dir;

    private void createLibrary() throws IOException {
        Files.write(dir.resolve("Bicep - Glue.mp3"), new byte[0]);
        Files.writeString(dir.resolve("notes.txt"), "not audio");
        Path sub = Files.createDirectories(dir.resolve("sub"));
        Files.write(sub.resolve("CamelPhat_-_Cola.FLAC"), new byte[0]);
    }

    @Test
    void testFilenameScanFindsAudioFilesRecursively() throws IOException {
        createLibrary();
        List<int[]> progress = new ArrayList<>();
        List<LocalTrack> tracks = new LocalScanner(true).scan(List.of(dir.toString()), new CancellationToken(),
            (done, total) -> progress.add(new int[] {done, total}));

        assertEquals(2, tracks.size());
        assertEquals("Bicep - Glue", tracks.get(0).key());
        assertEquals("CamelPhat - Cola", tracks.get(1).key());
        assertFalse(tracks.get(0).fromTags());
        assertTrue(tracks.get(0).scannedAt() > 0);
        assertEquals(2, progress.get(progress.size() - 1)[0]);
    }

    @Test
    void testUnreadableTagsFallBackToFileName() throws IOException {
        createLibrary();
        List<LocalTrack> tracks = new LocalScanner().scan(List.of(dir.toString()), null, null);
        assertEquals(2, tracks.size());
        assertEquals("Bicep - Glue", tracks.get(0).key());
    }

    @Test
    void testMissingFolderIsSkipped() {
        List<LocalTrack> tracks = new LocalScanner(true).scan(List.of(dir.resolve("absent").toString()),
            new CancellationToken(), null);
        assertTrue(tracks.isEmpty());
    }

    @Test
    void testCancelledScanStops() throws IOException {
        createLibrary();
        CancellationToken token = new CancellationToken();
        token.cancel();
        assertThrows(CancelledException.class, () -> new LocalScanner(true).scan(List.of(dir.toString()), token, null));
    }

    @Test
    void testParseArtistTitleFromFilename() {
        assertArrayEquals(new String[] {"Bicep", "Glue"}, LocalScanner.parseArtistTitleFromFilename("Bicep - Glue.mp3"));
        assertArrayEquals(new String[] {"Bicep", "Glue"}, LocalScanner.parseArtistTitleFromFilename("Bicep – Glue.wav"));
        assertArrayEquals(new String[] {"Bicep", "Glue"}, LocalScanner.parseArtistTitleFromFilename("Bicep_-_Glue.aiff"));
        assertArrayEquals(new String[] {"Bicep", "Glue"}, LocalScanner.parseArtistTitleFromFilename("Bicep-Glue.mp3"));
        assertArrayEquals(new String[] {"", "-Intro"}, LocalScanner.parseArtistTitleFromFilename("-Intro.mp3"));
        assertArrayEquals(new String[] {"", "Glue"}, LocalScanner.parseArtistTitleFromFilename("Glue.mp3"));
    }
}
