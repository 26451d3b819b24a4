package com.musicsync.engine;

import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.exceptions.InvalidAudioFrameException;
import org.jaudiotagger.audio.exceptions.ReadOnlyFileException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks the destination folders and reads artist/title of every audio file with jaudiotagger.
 * Files without usable tags fall back to {@link #parseArtistTitleFromFilename(String)}.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class LocalScanner implements LocalScannerInterface {
    private static final Logger logger = LoggerFactory.getLogger(LocalScanner.class);

    static final Set<String> AUDIO_EXTENSIONS = Set.of(".mp3", ".aiff", ".aif", ".wav", ".flac");
    private static final String[] FILENAME_SEPARATORS = {" - ", " – ", " — ", " _ ", "_-_"};
    private static final int PROGRESS_EVERY = 50;

    static {
        // jaudiotagger reports every odd frame through java.util.logging
        java.util.logging.Logger.getLogger("org.jaudiotagger").setLevel(Level.OFF);
    }

    private final boolean filenameOnly;

    public LocalScanner() {
        this(false);
    }

    /**
     * @param filenameOnly skip tag reading and parse names only
     */
    public LocalScanner(boolean filenameOnly) {
        this.filenameOnly = filenameOnly;
    }

    @Override
    public List<LocalTrack> scan(List<String> folders, CancellationToken token, BiConsumer<Integer, Integer> onProgress) {
        List<Path> files = listAudioFiles(folders);
        int total = files.size();
        logger.info("Scanning {} audio files in {} folder(s)", total, folders == null ? 0 : folders.size());
        List<LocalTrack> tracks = new ArrayList<>(total);
        int fromTags = 0;
        for (int i = 0; i < total; i++) {
            if (token != null) {
                token.throwIfCancelled();
            }
            LocalTrack track = read(files.get(i));
            if (track != null) {
                tracks.add(track);
                if (track.fromTags()) fromTags++;
            }
            int done = i + 1;
            if (onProgress != null && (done % PROGRESS_EVERY == 0 || done == total)) {
                onProgress.accept(done, total);
            }
        }
        logger.info("Scan finished: {} tracks ({} from tags, {} from file names)", tracks.size(), fromTags,
            tracks.size() - fromTags);
        return tracks;
    }

    private static List<Path> listAudioFiles(List<String> folders) {
        List<Path> out = new ArrayList<>();
        if (folders == null) {
            return out;
        }
        for (String folder : folders) {
            if (folder == null || folder.isBlank()) continue;
            Path root = Paths.get(folder);
            if (!Files.isDirectory(root)) {
                logger.warn("Destination folder {} does not exist; skipping", root);
                continue;
            }
            try (Stream<Path> walk = Files.walk(root)) {
                out.addAll(walk.filter(Files::isRegularFile)
                    .filter(p -> AUDIO_EXTENSIONS.contains(extension(p.getFileName().toString())))
                    .sorted()
                    .collect(Collectors.toList()));
            } catch (IOException | UncheckedIOException e) {
                logger.warn("Failed to walk {}: {}", root, e.getMessage());
            }
        }
        return out;
    }

    LocalTrack read(Path file) {
        String filename = file.getFileName().toString();
        long scannedAt;
        try {
            scannedAt = Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            logger.debug("No modification time for {}: {}", file, e.getMessage());
            scannedAt = 0L;
        }
        if (!filenameOnly) {
            String[] tags = readTags(file);
            if (tags != null && !tags[1].isBlank()) {
                return new LocalTrack(tags[0], tags[1], file.toAbsolutePath().toString(), scannedAt, true);
            }
        }
        String[] parsed = parseArtistTitleFromFilename(filename);
        if (parsed[1].isBlank()) {
            return null;
        }
        return new LocalTrack(parsed[0], parsed[1], file.toAbsolutePath().toString(), scannedAt, false);
    }

    private static String[] readTags(Path file) {
        try {
            AudioFile audio = AudioFileIO.read(file.toFile());
            Tag tag = audio.getTag();
            if (tag == null) {
                logger.debug("No tags found in file: {}", file);
                return null;
            }
            return new String[] {tag.getFirst(FieldKey.ARTIST).trim(), tag.getFirst(FieldKey.TITLE).trim()};
        } catch (CannotReadException | IOException | TagException | ReadOnlyFileException
                 | InvalidAudioFrameException | RuntimeException e) {
            logger.debug("Failed to read tags from {}: {}", file, e.getMessage());
            return null;
        }
    }

    /**
     * Splits "Artist - Title.ext" style names. Dash variants and underscores are tried before a bare hyphen.
     * @return {artist, title}; artist is empty when no separator was found
     */
    public static String[] parseArtistTitleFromFilename(String filename) {
        String name = filename == null ? "" : filename;
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        for (String sep : FILENAME_SEPARATORS) {
            int i = name.indexOf(sep);
            if (i >= 0) {
                return new String[] {name.substring(0, i).trim(), name.substring(i + sep.length()).trim()};
            }
        }
        int hyphen = name.indexOf('-');
        if (hyphen >= 0) {
            String artist = name.substring(0, hyphen).trim();
            String title = name.substring(hyphen + 1).trim();
            if (!artist.isEmpty() && !title.isEmpty()) {
                return new String[] {artist, title};
            }
        }
        return new String[] {"", name.trim()};
    }

    private static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot).toLowerCase(Locale.ROOT);
    }
}
