package dev.everydaythings.fontcat.freetype;

import dev.everydaythings.fontcat.CatalogConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds font files under a set of directories.
 */
public final class FontDirectoryScanner {

    private static final Logger log = Logger.getLogger(FontDirectoryScanner.class.getName());

    /** Font files nest a few levels deep in distribution layouts (fonts/truetype/vendor/...). */
    static final int MAX_DEPTH = 8;

    private static final Set<String> EXTENSIONS = Set.of(".ttf", ".otf", ".ttc", ".otc");

    private FontDirectoryScanner() {
    }

    /**
     * Directories from {@code font.freetype.directories} (comma separated), or the
     * usual system and per-user font folders when unset.
     */
    public static List<Path> directories(CatalogConfig config) {
        List<String> configured = config.getList(CatalogConfig.FREETYPE_DIRECTORIES, null);
        if (configured != null) {
            return configured.stream().map(Paths::get).collect(Collectors.toUnmodifiableList());
        }
        return defaultDirectories();
    }

    public static List<Path> defaultDirectories() {
        String home = System.getProperty("user.home", "");
        List<Path> dirs = new ArrayList<>();
        dirs.add(Paths.get("/usr/share/fonts"));
        dirs.add(Paths.get("/usr/local/share/fonts"));
        dirs.add(Paths.get(home, ".local", "share", "fonts"));
        dirs.add(Paths.get(home, ".fonts"));
        dirs.add(Paths.get("/System/Library/Fonts"));
        dirs.add(Paths.get("/Library/Fonts"));
        dirs.add(Paths.get(home, "Library", "Fonts"));
        String windir = System.getenv("WINDIR");
        if (windir != null) {
            dirs.add(Paths.get(windir, "Fonts"));
        }
        String localAppData = System.getenv("LOCALAPPDATA");
        if (localAppData != null) {
            dirs.add(Paths.get(localAppData, "Microsoft", "Windows", "Fonts"));
        }
        return dirs;
    }

    /** Whether the file name has a TrueType/OpenType font or collection extension. */
    public static boolean isFontFile(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        String file = name.toString().toLowerCase(Locale.ROOT);
        int dot = file.lastIndexOf('.');
        return dot > 0 && EXTENSIONS.contains(file.substring(dot));
    }

    /**
     * All font files under {@code directories}, sorted and without duplicates.
     * Missing or unreadable directories are skipped.
     */
    public static List<Path> scan(List<Path> directories) {
        Set<Path> found = new TreeSet<>();
        for (Path dir : directories) {
            if (!Files.isDirectory(dir)) {
                log.finer(() -> "Font directory not present: " + dir);
                continue;
            }
            int before = found.size();
            try (Stream<Path> stream = Files.walk(dir, MAX_DEPTH)) {
                stream.filter(Files::isRegularFile)
                        .filter(FontDirectoryScanner::isFontFile)
                        .map(p -> p.toAbsolutePath().normalize())
                        .forEach(found::add);
            } catch (IOException | UncheckedIOException e) {
                log.log(Level.WARNING, "Failed to scan font directory " + dir, e);
            }
            int added = found.size() - before;
            log.fine(() -> String.format("Scanned %s: %d font files", dir, added));
        }
        return new ArrayList<>(found);
    }
}
