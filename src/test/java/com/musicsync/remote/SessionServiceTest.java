package com.musicsync.remote;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SessionServiceTest {

    @TempDir
    Path dir;

    private SessionService service(Path file) {
        return new SessionService(file, new RemoteUrls("https://soundeo.com"));
    }

    @Test
    void testCookieHeaderFiltersByDomainPathAndExpiry() throws IOException {
        Path file = dir.resolve("storage-state.json");
        Files.writeString(file, "{\"cookies\":["
            + "{\"name\":\"sid\",\"value\":\"abc\",\"domain\":\".soundeo.com\",\"path\":\"/\",\"expires\":-1},"
            + "{\"name\":\"old\",\"value\":\"x\",\"domain\":\"soundeo.com\",\"path\":\"/\",\"expires\":1000},"
            + "{\"name\":\"other\",\"value\":\"y\",\"domain\":\"example.org\",\"path\":\"/\"},"
            + "{\"name\":\"acct\",\"value\":\"z\",\"domain\":\"soundeo.com\",\"path\":\"/account\"}"
            + "],\"origins\":[]}");
        SessionService session = service(file);
        assertTrue(session.hasSavedSession());
        assertEquals("sid=abc; acct=z", session.cookieHeader(URI.create("https://soundeo.com/account/favorites")));
        assertEquals("sid=abc", session.cookieHeader(URI.create("https://www.soundeo.com/list/tracks")));
    }

    @Test
    void testNoSessionMeansNoCookies() throws IOException {
        assertEquals("", service(dir.resolve("absent.json")).cookieHeader(URI.create("https://soundeo.com/")));

        Path garbage = dir.resolve("garbage.json");
        Files.writeString(garbage, "not json at all");
        SessionService session = service(garbage);
        assertFalse(session.hasSavedSession());
        assertEquals("", session.cookieHeader(URI.create("https://soundeo.com/")));
    }

    @Test
    void testInitCreatesDirectory() {
        Path file = dir.resolve("nested").resolve("storage-state.json");
        service(file).init();
        assertTrue(Files.isDirectory(file.getParent()));
    }

    @Test
    void testDomainMatches() {
        assertTrue(SessionService.domainMatches("soundeo.com", ".soundeo.com"));
        assertTrue(SessionService.domainMatches("www.soundeo.com", "soundeo.com"));
        assertTrue(SessionService.domainMatches("soundeo.com", ""));
        assertFalse(SessionService.domainMatches("notsoundeo.com", "soundeo.com"));
    }
}
