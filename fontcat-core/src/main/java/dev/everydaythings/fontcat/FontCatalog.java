/*
 * Copyright (C) 2024 fontcat contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.everydaythings.fontcat;

import dev.everydaythings.fontcat.sfnt.CharacterMap;
import dev.everydaythings.fontcat.sfnt.FontTableException;
import dev.everydaythings.fontcat.sfnt.NameTableReader;
import dev.everydaythings.fontcat.sfnt.SfntFile;
import dev.everydaythings.fontcat.sfnt.SfntTags;
import dev.everydaythings.fontcat.sfnt.VariationAxes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * The font catalog: installed families, their faces, alias names and the
 * platform UI families, with style and fallback resolution on top.
 *
 * <p>The catalog initializes itself from its {@link PlatformFontProvider} at
 * the first query and rebuilds wholesale when the provider reports that fonts
 * changed. All lookup state lives in one immutable {@code CatalogState}
 * published under a read/write lock, so a query sees either the old or the
 * new font list, never a mix. Families and faces already handed out stay
 * valid after a rebuild.
 *
 * <p>The catalog is reference counted. The creator holds one reference;
 * {@link #retain()} adds more and {@link #release()} (or {@link #close()})
 * drops them. When the count reaches zero the change notification is
 * unregistered and all state is dropped.
 *
 * <pre>{@code
 * try (FontCatalog catalog = new FontCatalog(provider, CatalogConfig.load())) {
 *     FontFace face = catalog.resolveStyle("Helvetica", StyleRequest.NORMAL.withWeight(700));
 *     FallbackMatch match = catalog.resolveFallback(0x0915, Character.UnicodeScript.DEVANAGARI,
 *             StyleRequest.NORMAL);
 * }
 * }</pre>
 */
public final class FontCatalog implements AutoCloseable {

    private static final Logger log = Logger.getLogger(FontCatalog.class.getName());

    /** Generic names that select the platform UI family. */
    public static final String SYSTEM_UI = "system-ui";
    public static final String APPLE_SYSTEM = "-apple-system";

    private final SerializedFontProvider provider;
    private final CatalogConfig config;
    private final ComplexScriptFilter filter;
    private final Set<String> badUnderlineKeys;
    private final Set<String> placeholderKeys;
    private final FallbackStats fallbackStats = new FallbackStats();
    private final FallbackResolver fallbackResolver;

    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
    /** Serializes initialization, rebuild, import and teardown. Never taken by plain lookups. */
    private final ReentrantLock initLock = new ReentrantLock();
    private CatalogState state;
    private volatile boolean initialized;
    private volatile boolean closed;
    private boolean notificationRegistered;

    private final AtomicInteger refCount = new AtomicInteger(1);
    private final AtomicBoolean ownerReleased = new AtomicBoolean();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger userFontSerial = new AtomicInteger();
    private final Runnable changeCallback = this::onFontsChanged;
    private final List<FontsChangedListener> listeners = new CopyOnWriteArrayList<>();

    public FontCatalog(PlatformFontProvider provider) {
        this(provider, CatalogConfig.empty());
    }

    public FontCatalog(PlatformFontProvider provider, CatalogConfig config) {
        this.provider = new SerializedFontProvider(provider);
        this.config = config;
        this.filter = new ComplexScriptFilter(config.spuriousCoverageFamilies());
        this.badUnderlineKeys = keys(config.badUnderlineFamilies());
        this.placeholderKeys = keys(config.placeholderFamilies());
        this.fallbackResolver = new FallbackResolver(this, this.provider, config.placeholderFamilies(),
                fallbackStats);
    }

    // ==================================================================================
    // Family lookup
    // ==================================================================================

    /**
     * Family by name: exact (case-insensitive) match first, then other names
     * read from the fonts' name tables. Hidden families are not returned.
     *
     * @return the family, or null
     */
    public FontFamily findFamily(String name) {
        return findFamily(name, false);
    }

    /**
     * @param includeHidden whether internal platform families may be returned
     * @return the family, or null
     */
    public FontFamily findFamily(String name, boolean includeHidden) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        CatalogState s = currentState();
        FontFamily family = s.families.get(FontFamily.key(name));
        if (family != null) {
            return family.isHidden() && !includeHidden ? null : family;
        }
        AliasTable.AliasRecord alias = findAlias(s, name);
        if (alias != null && (includeHidden || !alias.family().isHidden())) {
            return alias.family();
        }
        return null;
    }

    /**
     * Resolve a generic family keyword. {@value #SYSTEM_UI} and
     * {@value #APPLE_SYSTEM} select the platform's system text family, or its
     * display family when {@code size} is at or above the configured crossover
     * and the platform has one.
     *
     * @param size     requested size in CSS pixels
     * @param language content language; the platform UI families do not
     *                 currently vary by language
     * @return the family, or null if {@code keyword} is not a supported generic
     *         or the platform has no system UI family
     */
    public FontFamily findFamilyForGeneric(String keyword, double size, Locale language) {
        if (!isSystemUiKeyword(keyword)) {
            return null;
        }
        CatalogState s = currentState();
        boolean display = size >= config.crossoverSize() && s.systemDisplay != null;
        FontFamily family = display ? s.systemDisplay : s.systemText;
        if (family == null) {
            log.fine(() -> "No system UI family for " + keyword + " (" + language + ")");
        }
        return family;
    }

    /** A platform UI family by name, or null. These may be absent from enumeration. */
    public FontFamily findSystemFamily(String name) {
        if (name == null) {
            return null;
        }
        CatalogState s = currentState();
        String key = FontFamily.key(name);
        if (s.systemText != null && s.systemText.key().equals(key)) {
            return s.systemText;
        }
        if (s.systemDisplay != null && s.systemDisplay.key().equals(key)) {
            return s.systemDisplay;
        }
        return null;
    }

    /** The platform default family, or null if the platform has none. */
    public FontFamily defaultFamily() {
        currentState();
        String name;
        try {
            name = provider.call(PlatformFontProvider::defaultFamilyName);
        } catch (ProviderUnavailableException e) {
            log.log(Level.WARNING, "Cannot get default family", e);
            return null;
        }
        FontFamily family = findFamily(name, true);
        return family != null ? family : findSystemFamily(name);
    }

    /** Names of all visible families, in enumeration order. */
    public List<String> familyNames() {
        return currentState().families.values().stream()
                .filter(f -> !f.isHidden())
                .map(FontFamily::name)
                .collect(Collectors.toUnmodifiableList());
    }

    /** Every family including hidden and system UI families. */
    List<FontFamily> allFamilies() {
        CatalogState s = currentState();
        List<FontFamily> all = new ArrayList<>();
        if (s.systemText != null) all.add(s.systemText);
        if (s.systemDisplay != null) all.add(s.systemDisplay);
        all.addAll(s.families.values());
        return all;
    }

    // ==================================================================================
    // Style and fallback resolution
    // ==================================================================================

    /**
     * The face that best matches {@code request} in the named family. The name
     * may be a family name, an alias (matching only the faces that carry it) or
     * a system UI keyword.
     *
     * @return the face, or null if the name does not resolve
     */
    public FontFace resolveStyle(String familyOrGenericName, StyleRequest request) {
        if (familyOrGenericName == null || familyOrGenericName.isEmpty()) {
            return null;
        }
        if (isSystemUiKeyword(familyOrGenericName)) {
            FontFamily family = findFamilyForGeneric(familyOrGenericName, request.size(), Locale.ROOT);
            return family == null ? null : family.findFaceForStyle(request);
        }

        CatalogState s = currentState();
        FontFamily family = s.families.get(FontFamily.key(familyOrGenericName));
        if (family != null) {
            return family.isHidden() ? null : family.findFaceForStyle(request);
        }
        AliasTable.AliasRecord alias = findAlias(s, familyOrGenericName);
        if (alias == null || alias.family().isHidden()) {
            return null;
        }
        List<FontFace> faces = alias.faces().isEmpty() ? alias.family().faces() : alias.faces();
        return StyleMatcher.bestMatch(faces, request);
    }

    /**
     * A face outside the requested family that can render {@code codePoint}.
     *
     * @return the face and family, or null if no valid fallback exists
     * @see FallbackResolver
     */
    public FallbackMatch resolveFallback(int codePoint, Character.UnicodeScript script, StyleRequest request) {
        currentState();
        return fallbackResolver.resolve(codePoint, script, request);
    }

    public FallbackStats fallbackStats() {
        return fallbackStats;
    }

    // ==================================================================================
    // User fonts
    // ==================================================================================

    /**
     * An installed face addressed by full or PostScript name, as a local user
     * font with the given style ranges. The face's family must be visible in
     * the catalog.
     *
     * @return the face, or null if the name is empty, starts with '.', or does not resolve
     */
    public FontFace lookupLocalFont(String name, FontRange weight, FontRange stretch, SlantRange slant) {
        if (name == null || name.isEmpty() || name.startsWith(".")) {
            return null;
        }
        CatalogState s = currentState();
        FaceDescriptor descriptor;
        try {
            descriptor = provider.call(p -> p.resolveLocalFace(name));
        } catch (ProviderUnavailableException e) {
            log.log(Level.WARNING, "Local font lookup failed for " + name, e);
            return null;
        }
        if (descriptor == null) {
            log.fine(() -> "No local font named " + name);
            return null;
        }
        FontFamily family = findFamily(descriptor.familyName());
        if (family == null) {
            log.fine(() -> String.format("Local font %s belongs to %s, which is not visible",
                    name, descriptor.familyName()));
            return null;
        }
        return faceBuilder(descriptor, family.name(), family.hasBadUnderline(), s.maps)
                .weight(weight)
                .stretch(stretch)
                .slant(slant)
                .localUserFont(true)
                .build();
    }

    /**
     * A face backed by font data supplied at runtime. Its coverage is trusted
     * without complex-script filtering.
     *
     * @param familyName family the face is requested under
     * @param data       complete TrueType/OpenType data
     * @return the face, or null if the data is not a usable font
     */
    public FontFace makeUserFont(String familyName, byte[] data, FontRange weight, FontRange stretch,
                                 SlantRange slant) {
        checkOpen();
        SfntFile sfnt;
        try {
            sfnt = SfntFile.parse(data, 0);
        } catch (FontTableException e) {
            log.warning(() -> "Rejected user font " + familyName + ": " + e.getMessage());
            return null;
        }
        String styleName = "Regular";
        byte[] names = sfnt.table(SfntTags.NAME);
        if (names != null) {
            try {
                List<String> subfamilies = NameTableReader.names(names, NameTableReader.NAME_ID_SUBFAMILY);
                if (!subfamilies.isEmpty()) {
                    styleName = subfamilies.get(0);
                }
            } catch (FontTableException e) {
                log.fine(() -> "Ignoring bad name table in user font " + familyName + ": " + e.getMessage());
            }
        }
        String uniqueName = familyName + "-user-" + userFontSerial.incrementAndGet();
        log.fine(() -> String.format("User font %s: %d tables", uniqueName, sfnt.tags().size()));
        return FontFace.builder(uniqueName)
                .familyName(familyName)
                .styleName(styleName)
                .weight(weight)
                .stretch(stretch)
                .slant(slant)
                .dataUserFont(true)
                .tables(sfnt::table)
                .build();
    }

    // ==================================================================================
    // Other family names
    // ==================================================================================

    /**
     * Read the other names of every family from their name tables. Done at most
     * once per font list; later calls return immediately.
     */
    public void loadOtherFamilyNames() {
        readAllOtherFamilyNames(currentState());
    }

    private AliasTable.AliasRecord findAlias(CatalogState s, String name) {
        AliasTable.AliasRecord alias = s.aliases.find(name);
        if (alias == null && !s.otherNamesLoaded) {
            readAllOtherFamilyNames(s);
            alias = s.aliases.find(name);
        }
        return alias;
    }

    private void readAllOtherFamilyNames(CatalogState s) {
        if (s.otherNamesLoaded) {
            return;
        }
        s.otherNamesLock.lock();
        try {
            if (s.otherNamesLoaded) {
                return;
            }
            long start = System.nanoTime();
            for (FontFamily family : s.families.values()) {
                readOtherFamilyNames(s, family);
            }
            s.otherNamesLoaded = true;
            log.info(() -> String.format("Read other family names: %d aliases in %.1f ms",
                    s.aliases.size(), (System.nanoTime() - start) / 1e6));
        } finally {
            s.otherNamesLock.unlock();
        }
    }

    /**
     * Record the other names carried by a family's faces. Stops after the
     * first face if that face has none, since families rarely name only some faces.
     */
    private void readOtherFamilyNames(CatalogState s, FontFamily family) {
        s.otherNamesLock.lock();
        try {
            if (!s.otherNamesRead.add(family.key())) {
                return;
            }
            Map<String, List<FontFace>> byAlias = new LinkedHashMap<>();
            boolean first = true;
            for (FontFace face : family.faces()) {
                List<String> others = List.of();
                byte[] names = face.table(SfntTags.NAME);
                if (names != null) {
                    try {
                        others = NameTableReader.otherFamilyNames(family.name(), names);
                    } catch (FontTableException e) {
                        log.fine(() -> "Bad name table in " + face.name() + ": " + e.getMessage());
                    }
                }
                if (first && others.isEmpty()) {
                    break;
                }
                first = false;
                for (String other : others) {
                    if (!s.families.containsKey(FontFamily.key(other))) {
                        byAlias.computeIfAbsent(other, k -> new ArrayList<>()).add(face);
                    }
                }
            }
            byAlias.forEach((alias, faces) -> s.aliases.add(alias, family, faces));
        } finally {
            s.otherNamesLock.unlock();
        }
    }

    // ==================================================================================
    // Rebuild and notification
    // ==================================================================================

    /**
     * Re-enumerate all families and swap them in atomically, then notify
     * {@link FontsChangedListener}s. Lookups in flight finish on the state they
     * started with.
     */
    public void rebuild() {
        checkOpen();
        initLock.lock();
        try {
            checkOpen();
            CatalogState next = buildState();
            publish(next);
            initialized = true;
            registerNotification();
            preloadOtherNames(next);
        } finally {
            initLock.unlock();
        }
        log.info(() -> String.format("Font list rebuilt (generation %d)", generation.get()));
        notifyListeners();
    }

    /**
     * Provider callback. Ignored until the catalog has been initialized, since
     * the first query will build a fresh list anyway.
     */
    void onFontsChanged() {
        if (!initialized || closed) {
            log.fine("Fonts changed before catalog initialization, ignored");
            return;
        }
        try {
            rebuild();
        } catch (IllegalStateException e) {
            log.fine(() -> "Fonts changed during teardown: " + e.getMessage());
        }
    }

    public void addFontsChangedListener(FontsChangedListener listener) {
        listeners.add(listener);
    }

    public void removeFontsChangedListener(FontsChangedListener listener) {
        listeners.remove(listener);
    }

    /** Incremented on every rebuild or import. */
    public long generation() {
        return generation.get();
    }

    private void notifyListeners() {
        for (FontsChangedListener listener : listeners) {
            try {
                listener.fontsChanged(this);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Fonts-changed listener failed", e);
            }
        }
    }

    // ==================================================================================
    // Replication
    // ==================================================================================

    /**
     * Flat snapshot of the catalog: system UI families first, then every
     * enumerated family. The snapshot is fully populated, so faces, coverage
     * and other family names are loaded first where they have not been.
     */
    public List<FamilyRecord> exportSnapshot() {
        CatalogState s = currentState();
        readAllOtherFamilyNames(s);
        List<FamilyRecord> records = new ArrayList<>();
        for (FontFamily family : allFamilies()) {
            List<FaceRecord> faces = family.faces().stream()
                    .map(FaceRecord::of)
                    .collect(Collectors.toList());
            Map<String, List<String>> aliases = new LinkedHashMap<>();
            for (AliasTable.AliasRecord alias : s.aliases.forFamily(family)) {
                aliases.put(alias.alias(), alias.faces().stream()
                        .map(FontFace::name)
                        .collect(Collectors.toList()));
            }
            records.add(new FamilyRecord(family.name(), family.visibility(), family.kind(),
                    family.hasBadUnderline(), aliases, faces));
        }
        log.fine(() -> "Exported " + records.size() + " families");
        return records;
    }

    /**
     * Replace the catalog contents with families exported by another catalog.
     * Imported families and faces are treated as already resolved: they are
     * not re-enumerated or re-validated against this process's provider, and
     * make no provider calls.
     */
    public void importSnapshot(List<FamilyRecord> records) {
        checkOpen();
        initLock.lock();
        try {
            checkOpen();
            CharacterMapCache maps = new CharacterMapCache();
            Map<String, FontFamily> families = new LinkedHashMap<>();
            FontFamily systemText = null;
            FontFamily systemDisplay = null;
            Map<FontFamily, Map<String, List<String>>> pendingAliases = new LinkedHashMap<>();

            for (FamilyRecord record : records) {
                List<FontFace> faces = new ArrayList<>(record.faces().size());
                for (FaceRecord face : record.faces()) {
                    faces.add(importFace(record, face, maps));
                }
                FontFamily family = FontFamily.withFaces(record.name(), record.visibility(), record.kind(),
                        record.badUnderline(), faces);
                switch (record.kind()) {
                    case SYSTEM_TEXT -> systemText = family;
                    case SYSTEM_DISPLAY -> systemDisplay = family;
                    default -> families.putIfAbsent(family.key(), family);
                }
                if (!record.aliases().isEmpty()) {
                    pendingAliases.put(family, record.aliases());
                }
            }

            CatalogState next = new CatalogState(Collections.unmodifiableMap(families), systemText,
                    systemDisplay, maps, generation.incrementAndGet());
            pendingAliases.forEach((family, aliases) -> aliases.forEach((alias, faceNames) -> {
                if (!families.containsKey(FontFamily.key(alias))) {
                    List<FontFace> faces = family.faces().stream()
                            .filter(face -> faceNames.contains(face.name()))
                            .collect(Collectors.toList());
                    next.aliases.add(alias, family, faces);
                }
            }));
            next.otherNamesLoaded = true;
            publish(next);
            initialized = true;
            log.info(() -> String.format("Imported %d families (generation %d)", records.size(), next.generation));
        } finally {
            initLock.unlock();
        }
        notifyListeners();
    }

    private FontFace importFace(FamilyRecord family, FaceRecord record, CharacterMapCache maps) {
        return FontFace.builder(record.name())
                .familyName(family.name())
                .styleName(record.styleName())
                .weight(record.weight())
                .stretch(record.stretch())
                .slant(record.slant())
                .fixedPitch(record.fixedPitch())
                .standardFace(record.standardFace())
                .badUnderline(family.badUnderline())
                .requiresAlternateShaping(record.requiresAlternateShaping())
                .uvsOffset(record.uvsOffset())
                .mapCache(maps)
                .coverage(CharacterMap.fromRanges(record.coverage()))
                .tables(FaceTables.NONE)
                .build();
    }

    // ==================================================================================
    // Lifecycle
    // ==================================================================================

    /**
     * Add a reference.
     *
     * @throws IllegalStateException if the catalog has already been torn down
     */
    public FontCatalog retain() {
        while (true) {
            int count = refCount.get();
            if (count <= 0) {
                throw new IllegalStateException("Font catalog is closed");
            }
            if (refCount.compareAndSet(count, count + 1)) {
                return this;
            }
        }
    }

    /** Drop a reference, tearing the catalog down when none remain. */
    public void release() {
        int count = refCount.decrementAndGet();
        if (count == 0) {
            shutdown();
        } else if (count < 0) {
            refCount.set(0);
            throw new IllegalStateException("Font catalog released more times than retained");
        }
    }

    /** Drops the creator's reference. Further calls do nothing. */
    @Override
    public void close() {
        if (ownerReleased.compareAndSet(false, true)) {
            release();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int referenceCount() {
        return Math.max(0, refCount.get());
    }

    private void shutdown() {
        initLock.lock();
        try {
            closed = true;
            if (notificationRegistered) {
                try {
                    provider.call(p -> {
                        p.unregisterChangeNotification(changeCallback);
                        return null;
                    });
                } catch (ProviderUnavailableException e) {
                    log.log(Level.WARNING, "Failed to unregister font change notification", e);
                }
                notificationRegistered = false;
            }
            stateLock.writeLock().lock();
            try {
                state = null;
            } finally {
                stateLock.writeLock().unlock();
            }
            initialized = false;
            listeners.clear();
            log.info("Font catalog shut down");
        } finally {
            initLock.unlock();
        }
    }

    // ==================================================================================
    // State construction
    // ==================================================================================

    private CatalogState currentState() {
        checkOpen();
        if (!initialized) {
            initialize();
        }
        stateLock.readLock().lock();
        try {
            if (state == null) {
                throw new IllegalStateException("Font catalog is closed");
            }
            return state;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    private void initialize() {
        initLock.lock();
        try {
            checkOpen();
            if (initialized) {
                return;
            }
            CatalogState first = buildState();
            publish(first);
            initialized = true;
            registerNotification();
            preloadOtherNames(first);
        } finally {
            initLock.unlock();
        }
    }

    private void publish(CatalogState next) {
        stateLock.writeLock().lock();
        try {
            state = next;
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    private void registerNotification() {
        if (notificationRegistered) {
            return;
        }
        try {
            provider.call(p -> {
                p.registerChangeNotification(changeCallback);
                return null;
            });
            notificationRegistered = true;
        } catch (ProviderUnavailableException e) {
            log.log(Level.WARNING, "Failed to register font change notification", e);
        }
    }

    private void preloadOtherNames(CatalogState s) {
        for (String name : config.preloadNames()) {
            FontFamily family = s.families.get(FontFamily.key(name));
            if (family != null) {
                readOtherFamilyNames(s, family);
            } else {
                log.fine(() -> "Preload family not installed: " + name);
            }
        }
    }

    private CatalogState buildState() {
        long start = System.nanoTime();
        CharacterMapCache maps = new CharacterMapCache();

        List<String> names;
        try {
            names = provider.call(PlatformFontProvider::enumerateFamilies);
        } catch (ProviderUnavailableException e) {
            log.log(Level.WARNING, "Font enumeration failed, catalog is empty", e);
            names = List.of();
        }

        Map<String, FontFamily> families = new LinkedHashMap<>();
        for (String name : names) {
            if (name == null || name.isEmpty() || placeholderKeys.contains(FontFamily.key(name))) {
                continue;
            }
            String key = FontFamily.key(name);
            if (families.containsKey(key)) {
                continue;
            }
            FontVisibility visibility = visibilityOf(name);
            families.put(key, new FontFamily(name, visibility, FamilyKind.STANDARD, badUnderline(name),
                    family -> loadFaces(family, p -> p.enumerateFaces(family.name()), maps)));
        }

        FontFamily systemText = systemFamily(false, maps);
        FontFamily systemDisplay = systemFamily(true, maps);

        CatalogState next = new CatalogState(Collections.unmodifiableMap(families), systemText, systemDisplay,
                maps, generation.incrementAndGet());
        log.info(() -> String.format("Font list: %d families in %.1f ms",
                families.size(), (System.nanoTime() - start) / 1e6));
        return next;
    }

    private FontFamily systemFamily(boolean display, CharacterMapCache maps) {
        String name;
        try {
            name = provider.call(p -> p.systemUiFamilyName(display));
        } catch (ProviderUnavailableException e) {
            log.log(Level.WARNING, "Cannot get system UI family", e);
            return null;
        }
        if (name == null || name.isEmpty()) {
            return null;
        }
        FontVisibility visibility = name.startsWith(".") ? FontVisibility.HIDDEN : FontVisibility.BASE;
        FamilyKind kind = display ? FamilyKind.SYSTEM_DISPLAY : FamilyKind.SYSTEM_TEXT;
        return new FontFamily(name, visibility, kind, badUnderline(name),
                family -> loadFaces(family, p -> p.systemUiFaces(display), maps));
    }

    private FontVisibility visibilityOf(String name) {
        if (name.startsWith(".")) {
            return FontVisibility.HIDDEN;
        }
        try {
            FontVisibility visibility = provider.call(p -> p.visibility(name));
            return visibility != null ? visibility : FontVisibility.UNKNOWN;
        } catch (ProviderUnavailableException e) {
            return FontVisibility.UNKNOWN;
        }
    }

    private List<FontFace> loadFaces(FontFamily family,
                                     SerializedFontProvider.ProviderCall<List<FaceDescriptor>> enumerate,
                                     CharacterMapCache maps) {
        List<FaceDescriptor> descriptors = provider.call(enumerate);
        if (descriptors == null) {
            return List.of();
        }
        List<FontFace> faces = new ArrayList<>(descriptors.size());
        FaceDescriptor previous = null;
        for (FaceDescriptor descriptor : descriptors) {
            // Platforms repeat entries for some multi-axis faces.
            if (descriptor.equals(previous)) {
                continue;
            }
            previous = descriptor;
            FontFace face = faceBuilder(descriptor, family.name(), family.hasBadUnderline(), maps).build();
            log.finer(() -> String.format("(fontlist) added %s to %s", face, family.name()));
            faces.add(face);
        }
        return faces;
    }

    /**
     * Normalized face for a provider descriptor: weight from the trait (or the
     * configured override), stretch from the width trait, ranges widened by
     * any variation axes the face declares.
     */
    private FontFace.Builder faceBuilder(FaceDescriptor descriptor, String familyName, boolean badUnderline,
                                         CharacterMapCache maps) {
        FaceTables tables = providerTables(descriptor);

        int override = config.weightOverride(descriptor.postscriptName());
        FontRange weight = FontRange.of(override != 0
                ? StyleTraits.overrideWeight(override)
                : StyleTraits.weightFromTrait(descriptor.weightTrait()));
        FontRange stretch = FontRange.of(StyleTraits.stretchFromTrait(descriptor.widthTrait()));
        SlantRange slant = descriptor.italic() ? SlantRange.ITALIC : SlantRange.NORMAL;

        byte[] fvar = readQuietly(tables, SfntTags.FVAR, descriptor);
        if (fvar != null) {
            try {
                List<VariationAxes.Axis> axes = VariationAxes.parse(fvar);
                VariationAxes.Axis wght = VariationAxes.find(axes, VariationAxes.WEIGHT);
                if (wght != null && override == 0) {
                    weight = FontRange.of(clampWeight(wght.min()), clampWeight(wght.max()));
                }
                VariationAxes.Axis wdth = VariationAxes.find(axes, VariationAxes.WIDTH);
                if (wdth != null) {
                    stretch = FontRange.of(wdth.min(), wdth.max());
                }
                VariationAxes.Axis slnt = VariationAxes.find(axes, VariationAxes.SLANT);
                VariationAxes.Axis ital = VariationAxes.find(axes, VariationAxes.ITALIC);
                if (ital != null && ital.defaultValue() >= 1) {
                    slant = SlantRange.ITALIC;
                } else if (slnt != null && !descriptor.italic() && !(slnt.min() == 0 && slnt.max() == 0)) {
                    // slnt is counter-clockwise, CSS oblique angles are clockwise.
                    slant = SlantRange.oblique(-slnt.max(), -slnt.min());
                }
            } catch (FontTableException e) {
                log.fine(() -> "Ignoring bad fvar in " + descriptor.postscriptName() + ": " + e.getMessage());
            }
        }

        return FontFace.builder(descriptor.postscriptName())
                .familyName(familyName)
                .styleName(descriptor.styleName())
                .weight(weight)
                .stretch(stretch)
                .slant(slant)
                .fixedPitch(descriptor.monospace())
                .badUnderline(badUnderline)
                .tables(tables)
                .filter(filter)
                .mapCache(maps);
    }

    private FaceTables providerTables(FaceDescriptor descriptor) {
        return tag -> provider.call(p -> p.getTable(descriptor, tag));
    }

    private static byte[] readQuietly(FaceTables tables, int tag, FaceDescriptor descriptor) {
        try {
            return tables.table(tag);
        } catch (ProviderUnavailableException e) {
            log.fine(() -> String.format("Cannot read '%s' of %s: %s",
                    SfntTags.toString(tag), descriptor.postscriptName(), e.getMessage()));
            return null;
        }
    }

    private static double clampWeight(double weight) {
        return Math.max(StyleTraits.MIN_WEIGHT, Math.min(StyleTraits.MAX_WEIGHT, weight));
    }

    private boolean badUnderline(String familyName) {
        return badUnderlineKeys.contains(FontFamily.key(familyName));
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Font catalog is closed");
        }
    }

    static boolean isSystemUiKeyword(String name) {
        return SYSTEM_UI.equalsIgnoreCase(name) || APPLE_SYSTEM.equalsIgnoreCase(name);
    }

    private static Set<String> keys(List<String> names) {
        return names.stream().map(FontFamily::key).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * One published font list. Immutable apart from the lazily read alias
     * table, which is filled under {@code otherNamesLock}.
     */
    private static final class CatalogState {
        final Map<String, FontFamily> families;
        final FontFamily systemText;
        final FontFamily systemDisplay;
        final CharacterMapCache maps;
        final long generation;
        final AliasTable aliases = new AliasTable();
        final ReentrantLock otherNamesLock = new ReentrantLock();
        final Set<String> otherNamesRead = ConcurrentHashMap.newKeySet();
        volatile boolean otherNamesLoaded;

        CatalogState(Map<String, FontFamily> families, FontFamily systemText, FontFamily systemDisplay,
                     CharacterMapCache maps, long generation) {
            this.families = families;
            this.systemText = systemText;
            this.systemDisplay = systemDisplay;
            this.maps = maps;
            this.generation = generation;
        }
    }
}
