package com.musicsync.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {

    @TempDir
    Path dir;

    @Test
    void testWritesDownloadList() throws IOException {
        SyncState state = SyncState.empty();
        state.toDownload.addAll(List.of("CamelPhat - Cola", "Bicep, Hammer - Glue"));
        state.haveLocally.add("Local - Only");
        state.urls.put("CamelPhat - Cola", "https://example.com/track/cola-101.html");
        state.remoteIds.put("CamelPhat - Cola", "101");
        state.starred.put("CamelPhat - Cola", true);
        state.notFound.put("Bicep, Hammer - Glue", true);

        Path file = dir.resolve("out").resolve("to-download.csv");
        int rows = new CsvService().writeDownloadList(state, file);

        assertEquals(2, rows);
        List<String> lines = Files.readAllLines(file);
        assertEquals(3, lines.size());
        assertEquals("\"Artist\",\"Title\",\"URL\",\"RemoteId\",\"Starred\",\"NotFound\"", lines.get(0));
        assertEquals("\"CamelPhat\",\"Cola\",\"https://example.com/track/cola-101.html\",\"101\",\"true\",\"false\"", lines.get(1));
        assertEquals("\"Bicep, Hammer\",\"Glue\",\"\",\"\",\"\",\"true\"", lines.get(2));
    }

    @Test
    void testRejectsNullArguments() {
        CsvService csv = new CsvService();
        assertThrows(IllegalArgumentException.class, () -> csv.writeDownloadList(null, dir.resolve("x.csv")));
        assertThrows(IllegalArgumentException.class, () -> csv.writeDownloadList(SyncState.empty(), null));
    }
}
