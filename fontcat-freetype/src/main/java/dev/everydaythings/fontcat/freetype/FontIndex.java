package dev.everydaythings.fontcat.freetype;

import dev.everydaythings.fontcat.FaceDescriptor;
import dev.everydaythings.fontcat.FontVisibility;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * The faces found on disk, grouped by family.
 *
 * <p>Families are listed in case-insensitive name order under the spelling
 * first seen. Faces keep scan order within their family. A PostScript name
 * seen twice keeps its first file.
 */
final class FontIndex {

    /** One face of one font file. */
    record Entry(Path path, int faceIndex, FaceDescriptor descriptor) {}

    private final Map<String, List<Entry>> families;
    private final Map<String, Entry> byPostscriptName = new HashMap<>();
    private final Map<String, Entry> byFullName = new HashMap<>();
    private final List<Path> userDirectories;

    FontIndex(List<Entry> entries, List<Path> userDirectories) {
        this.userDirectories = List.copyOf(userDirectories);
        Map<String, List<Entry>> grouped = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Entry entry : entries) {
            FaceDescriptor d = entry.descriptor();
            if (byPostscriptName.putIfAbsent(d.postscriptName(), entry) != null) {
                continue;
            }
            byFullName.putIfAbsent(key(fullName(d)), entry);
            grouped.computeIfAbsent(d.familyName(), k -> new ArrayList<>()).add(entry);
        }
        Map<String, List<Entry>> ordered = new LinkedHashMap<>();
        grouped.forEach((name, faces) -> ordered.put(faces.get(0).descriptor().familyName(),
                Collections.unmodifiableList(faces)));
        this.families = Collections.unmodifiableMap(ordered);
    }

    static FontIndex empty() {
        return new FontIndex(List.of(), List.of());
    }

    List<String> familyNames() {
        return new ArrayList<>(families.keySet());
    }

    /** Faces of a family by exact name, or an empty list. */
    List<Entry> faces(String familyName) {
        List<Entry> faces = families.get(familyName);
        return faces == null ? List.of() : faces;
    }

    List<FaceDescriptor> descriptors(String familyName) {
        List<FaceDescriptor> out = new ArrayList<>();
        for (Entry entry : faces(familyName)) {
            out.add(entry.descriptor());
        }
        return out;
    }

    Entry entry(FaceDescriptor descriptor) {
        return byPostscriptName.get(descriptor.postscriptName());
    }

    /** A face by PostScript name (exact) or full name (case-insensitive), or null. */
    Entry findLocal(String name) {
        Entry entry = byPostscriptName.get(name);
        return entry != null ? entry : byFullName.get(key(name));
    }

    boolean contains(String familyName) {
        return families.containsKey(familyName);
    }

    /** {@link FontVisibility#USER} when every file of the family lives in a per-user directory. */
    FontVisibility visibility(String familyName) {
        List<Entry> faces = families.get(familyName);
        if (faces == null) {
            return FontVisibility.UNKNOWN;
        }
        for (Entry entry : faces) {
            if (!isUserFile(entry.path())) {
                return FontVisibility.BASE;
            }
        }
        return FontVisibility.USER;
    }

    int size() {
        return byPostscriptName.size();
    }

    private boolean isUserFile(Path path) {
        for (Path dir : userDirectories) {
            if (path.startsWith(dir)) {
                return true;
            }
        }
        return false;
    }

    /** "Family Style", or just the family for regular faces. */
    static String fullName(FaceDescriptor d) {
        String style = d.styleName();
        if (style == null || style.isEmpty() || style.equalsIgnoreCase("Regular")) {
            return d.familyName();
        }
        return d.familyName() + " " + style;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
