package dev.everydaythings.fontcat.freetype;

import dev.everydaythings.fontcat.CatalogConfig;
import dev.everydaythings.fontcat.FaceDescriptor;
import dev.everydaythings.fontcat.FontVisibility;
import dev.everydaythings.fontcat.PlatformFontProvider;
import dev.everydaythings.fontcat.ProviderUnavailableException;
import dev.everydaythings.fontcat.Slant;
import dev.everydaythings.fontcat.StyleRequest;
import dev.everydaythings.fontcat.StyleTraits;
import dev.everydaythings.fontcat.sfnt.FontTableException;
import dev.everydaythings.fontcat.sfnt.SfntFile;
import dev.everydaythings.fontcat.sfnt.SfntTags;
import org.lwjgl.PointerBuffer;
import org.lwjgl.system.MemoryStack;
import org.lwjgl.util.freetype.FT_Face;
import org.lwjgl.util.freetype.FreeType;

import java.io.IOException;
import java.lang.ref.SoftReference;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PlatformFontProvider} over font files on disk, read with LWJGL's
 * FreeType bindings.
 *
 * <p>Font directories are scanned on first use. Each face is opened once with
 * FreeType to read its names and flags; style traits come from the face's
 * {@code OS/2} table. Tables are served from the file's SFNT directory.
 * Fallback suggestions check {@code FT_Get_Char_Index} over the configured
 * preference list first, then every family.
 *
 * <p>When a change notification is registered, the directories are watched
 * and the index is dropped on change, so the next enumeration rescans.
 *
 * <pre>{@code
 * try (FreeTypeFontProvider provider = new FreeTypeFontProvider(config);
 *      FontCatalog catalog = new FontCatalog(provider, config)) {
 *     ...
 * }
 * }</pre>
 */
public class FreeTypeFontProvider implements PlatformFontProvider, AutoCloseable {

    private static final Logger log = Logger.getLogger(FreeTypeFontProvider.class.getName());

    public static final List<String> DEFAULT_SYSTEM_UI_FAMILIES =
            List.of("Cantarell", "Noto Sans", "DejaVu Sans", "Liberation Sans");

    public static final List<String> DEFAULT_FALLBACK_FAMILIES =
            List.of("Noto Sans", "DejaVu Sans", "Noto Sans Symbols2", "Symbola", "Noto Color Emoji");

    private final List<Path> directories;
    private final List<Path> userDirectories;
    private final List<String> systemUiFamilies;
    private final List<String> fallbackFamilies;

    private long library;
    private FontIndex index;
    /** Faces held open for glyph lookups; FreeType keeps a pointer into each buffer. */
    private final Map<String, OpenFace> openFaces = new HashMap<>();
    private final Map<Path, SoftReference<byte[]>> fileCache = new ConcurrentHashMap<>();
    /** Suggested family per code point and style; "" when nothing covers it. */
    private final Map<FallbackKey, String> fallbackCache = new ConcurrentHashMap<>();

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private FontDirectoryWatcher watcher;
    private boolean closed;

    private record OpenFace(FT_Face face, ByteBuffer data) {}

    public FreeTypeFontProvider() {
        this(CatalogConfig.load());
    }

    public FreeTypeFontProvider(CatalogConfig config) {
        this(FontDirectoryScanner.directories(config),
                config.getList(CatalogConfig.FREETYPE_SYSTEM_UI_FAMILIES, DEFAULT_SYSTEM_UI_FAMILIES),
                config.getList(CatalogConfig.FREETYPE_FALLBACK_FAMILIES, DEFAULT_FALLBACK_FAMILIES));
    }

    public FreeTypeFontProvider(List<Path> directories, List<String> systemUiFamilies,
                                List<String> fallbackFamilies) {
        this.directories = List.copyOf(directories);
        this.systemUiFamilies = List.copyOf(systemUiFamilies);
        this.fallbackFamilies = List.copyOf(fallbackFamilies);
        Path home = Paths.get(System.getProperty("user.home", "")).toAbsolutePath().normalize();
        List<Path> user = new ArrayList<>();
        for (Path dir : this.directories) {
            Path abs = dir.toAbsolutePath().normalize();
            if (abs.startsWith(home)) {
                user.add(abs);
            }
        }
        this.userDirectories = List.copyOf(user);
    }

    // ==================================================================================
    // Enumeration
    // ==================================================================================

    @Override
    public synchronized List<String> enumerateFamilies() {
        return index().familyNames();
    }

    @Override
    public synchronized List<FaceDescriptor> enumerateFaces(String familyName) {
        return index().descriptors(familyName);
    }

    @Override
    public synchronized FontVisibility visibility(String familyName) {
        return index().visibility(familyName);
    }

    @Override
    public synchronized FaceDescriptor resolveLocalFace(String name) {
        FontIndex.Entry entry = index().findLocal(name);
        return entry == null ? null : entry.descriptor();
    }

    /** First configured UI family that is installed. There is no separate display family. */
    @Override
    public synchronized String systemUiFamilyName(boolean display) {
        if (display) {
            return null;
        }
        FontIndex idx = index();
        for (String family : systemUiFamilies) {
            if (idx.contains(family)) {
                return family;
            }
        }
        return null;
    }

    // ==================================================================================
    // Tables
    // ==================================================================================

    @Override
    public byte[] getTable(FaceDescriptor face, int tag) {
        FontIndex.Entry entry;
        synchronized (this) {
            entry = index().entry(face);
        }
        if (entry == null) {
            return null;
        }
        byte[] data = fileData(entry.path());
        if (data == null) {
            return null;
        }
        try {
            return SfntFile.parse(data, entry.faceIndex()).table(tag);
        } catch (FontTableException e) {
            log.fine(() -> String.format("Cannot read '%s' from %s: %s",
                    SfntTags.toString(tag), entry.path(), e.getMessage()));
            return null;
        }
    }

    private byte[] fileData(Path path) {
        SoftReference<byte[]> ref = fileCache.get(path);
        byte[] data = ref == null ? null : ref.get();
        if (data != null) {
            return data;
        }
        try {
            data = Files.readAllBytes(path);
        } catch (IOException e) {
            log.log(Level.WARNING, "Cannot read font file " + path, e);
            return null;
        }
        fileCache.put(path, new SoftReference<>(data));
        return data;
    }

    // ==================================================================================
    // Fallback
    // ==================================================================================

    @Override
    public synchronized String suggestFallbackFamily(int codePoint, Character.UnicodeScript script,
                                                     StyleRequest style) {
        FallbackKey key = FallbackKey.of(codePoint, style);
        String cached = fallbackCache.get(key);
        if (cached != null) {
            return cached.isEmpty() ? null : cached;
        }
        FontIndex idx = index();
        Set<String> candidates = new LinkedHashSet<>();
        for (String family : fallbackFamilies) {
            if (idx.contains(family)) {
                candidates.add(family);
            }
        }
        candidates.addAll(idx.familyNames());

        String found = null;
        for (String family : candidates) {
            FontIndex.Entry entry = closestFace(idx.faces(family), style);
            if (entry != null && hasGlyph(entry, codePoint)) {
                found = family;
                break;
            }
        }
        String result = found;
        log.fine(() -> String.format("Fallback for U+%04X (%s): %s", codePoint, script,
                result == null ? "none" : result));
        fallbackCache.put(key, result == null ? "" : result);
        return result;
    }

    /** The parts of a request that {@link #closestFace} looks at. */
    record FallbackKey(int codePoint, boolean italic, double weight) {
        static FallbackKey of(int codePoint, StyleRequest style) {
            boolean italic = style != null && style.slant().kind() != Slant.Kind.NORMAL;
            return new FallbackKey(codePoint, italic, style != null ? style.weight() : 400);
        }
    }

    /** The face nearest to the requested weight with matching italic-ness, preferring the latter. */
    static FontIndex.Entry closestFace(List<FontIndex.Entry> faces, StyleRequest style) {
        FallbackKey want = FallbackKey.of(0, style);
        boolean wantItalic = want.italic();
        double wantWeight = want.weight();
        FontIndex.Entry best = null;
        double bestScore = Double.MAX_VALUE;
        for (FontIndex.Entry entry : faces) {
            FaceDescriptor d = entry.descriptor();
            double score = Math.abs(StyleTraits.weightFromTrait(d.weightTrait()) - wantWeight)
                    + (d.italic() == wantItalic ? 0 : 10_000);
            if (score < bestScore) {
                best = entry;
                bestScore = score;
            }
        }
        return best;
    }

    private boolean hasGlyph(FontIndex.Entry entry, int codePoint) {
        OpenFace open = openFace(entry);
        return open != null && FreeType.FT_Get_Char_Index(open.face(), codePoint) != 0;
    }

    private OpenFace openFace(FontIndex.Entry entry) {
        String key = entry.descriptor().postscriptName();
        if (openFaces.containsKey(key)) {
            return openFaces.get(key);
        }
        OpenFace open = null;
        byte[] data = fileData(entry.path());
        if (data != null) {
            ByteBuffer buffer = directBuffer(data);
            FT_Face face = newFace(buffer, entry.faceIndex(), entry.path());
            if (face != null) {
                open = new OpenFace(face, buffer);
            }
        }
        // Failed faces are remembered too, so they are not retried.
        openFaces.put(key, open);
        return open;
    }

    // ==================================================================================
    // Change notification
    // ==================================================================================

    @Override
    public synchronized void registerChangeNotification(Runnable callback) {
        callbacks.add(callback);
        if (watcher == null && !closed) {
            try {
                watcher = new FontDirectoryWatcher(directories, this::fontsChanged);
            } catch (IOException e) {
                log.log(Level.WARNING, "Cannot watch font directories, changes will not be noticed", e);
            }
        }
    }

    @Override
    public synchronized void unregisterChangeNotification(Runnable callback) {
        callbacks.remove(callback);
        if (callbacks.isEmpty() && watcher != null) {
            watcher.close();
            watcher = null;
        }
    }

    /** Drop the index and tell registered listeners. Listeners run without this provider's lock held. */
    void fontsChanged() {
        synchronized (this) {
            invalidate();
        }
        for (Runnable callback : callbacks) {
            callback.run();
        }
    }

    private void invalidate() {
        index = null;
        closeOpenFaces();
        fileCache.clear();
        fallbackCache.clear();
    }

    // ==================================================================================
    // Index construction
    // ==================================================================================

    private FontIndex index() {
        if (closed) {
            throw new ProviderUnavailableException("FreeType font provider is closed");
        }
        if (index == null) {
            index = buildIndex();
        }
        return index;
    }

    private FontIndex buildIndex() {
        long start = System.nanoTime();
        List<Path> files = FontDirectoryScanner.scan(directories);
        List<FontIndex.Entry> entries = new ArrayList<>();
        for (Path file : files) {
            readFaces(file, entries);
        }
        FontIndex built = new FontIndex(entries, userDirectories);
        log.info(() -> String.format("Indexed %d faces in %d families from %d files in %.1f ms",
                built.size(), built.familyNames().size(), files.size(), (System.nanoTime() - start) / 1e6));
        return built;
    }

    private void readFaces(Path file, List<FontIndex.Entry> out) {
        byte[] data;
        int count;
        try {
            data = Files.readAllBytes(file);
            count = SfntFile.faceCount(data);
        } catch (IOException | FontTableException e) {
            log.fine(() -> "Skipping " + file + ": " + e.getMessage());
            return;
        }
        ByteBuffer buffer = directBuffer(data);
        for (int i = 0; i < count; i++) {
            FT_Face face = newFace(buffer, i, file);
            if (face == null) {
                continue;
            }
            try {
                String family = face.family_nameString();
                if (family == null || family.isEmpty()) {
                    log.fine(() -> "Skipping unnamed face in " + file);
                    continue;
                }
                byte[] os2 = null;
                try {
                    os2 = SfntFile.parse(data, i).table(SfntTags.OS2);
                } catch (FontTableException e) {
                    log.fine(() -> "No usable SFNT directory in " + file + ": " + e.getMessage());
                }
                FaceDescriptor descriptor = FaceStyles.describe(
                        FreeType.FT_Get_Postscript_Name(face),
                        family,
                        face.style_nameString(),
                        os2,
                        (face.style_flags() & FreeType.FT_STYLE_FLAG_ITALIC) != 0,
                        (face.face_flags() & FreeType.FT_FACE_FLAG_FIXED_WIDTH) != 0);
                out.add(new FontIndex.Entry(file, i, descriptor));
                log.finer(() -> "(fontinit) " + descriptor + " from " + file);
            } finally {
                FreeType.FT_Done_Face(face);
            }
        }
    }

    private FT_Face newFace(ByteBuffer buffer, int faceIndex, Path file) {
        long lib = library();
        try (MemoryStack stack = MemoryStack.stackPush()) {
            PointerBuffer facePtr = stack.mallocPointer(1);
            buffer.rewind();
            int error = FreeType.FT_New_Memory_Face(lib, buffer, faceIndex, facePtr);
            if (error != 0) {
                log.fine(() -> String.format("FreeType cannot open face %d of %s (error %d)", faceIndex, file, error));
                return null;
            }
            return FT_Face.create(facePtr.get(0));
        }
    }

    private long library() {
        if (library != 0) {
            return library;
        }
        try (MemoryStack stack = MemoryStack.stackPush()) {
            PointerBuffer libPtr = stack.mallocPointer(1);
            int error = FreeType.FT_Init_FreeType(libPtr);
            if (error != 0) {
                throw new ProviderUnavailableException("FT_Init_FreeType failed: " + error);
            }
            library = libPtr.get(0);
        } catch (UnsatisfiedLinkError | ExceptionInInitializerError e) {
            throw new ProviderUnavailableException("FreeType natives are not available", e);
        }
        log.fine("FreeType library initialized");
        return library;
    }

    private static ByteBuffer directBuffer(byte[] data) {
        ByteBuffer buffer = ByteBuffer.allocateDirect(data.length).order(ByteOrder.nativeOrder());
        buffer.put(data);
        buffer.flip();
        return buffer;
    }

    // ==================================================================================
    // Cleanup
    // ==================================================================================

    private void closeOpenFaces() {
        for (OpenFace open : openFaces.values()) {
            if (open != null) {
                FreeType.FT_Done_Face(open.face());
            }
        }
        openFaces.clear();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
        closeOpenFaces();
        if (library != 0) {
            FreeType.FT_Done_FreeType(library);
            library = 0;
        }
        index = null;
        callbacks.clear();
        log.fine("FreeType font provider closed");
    }
}
