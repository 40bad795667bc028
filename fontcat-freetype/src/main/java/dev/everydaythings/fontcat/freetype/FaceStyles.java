package dev.everydaythings.fontcat.freetype;

import dev.everydaythings.fontcat.FaceDescriptor;
import dev.everydaythings.fontcat.StyleTraits;
import dev.everydaythings.fontcat.sfnt.FontTableException;
import dev.everydaythings.fontcat.sfnt.Os2Table;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Turns what FreeType and the {@code OS/2} table report about a face into a
 * {@link FaceDescriptor} with platform-style traits.
 */
final class FaceStyles {

    private static final Logger log = Logger.getLogger(FaceStyles.class.getName());

    private FaceStyles() {
    }

    /**
     * @param postscriptName may be null; a name is then made from family and style
     * @param os2            raw {@code OS/2} table, or null
     * @param italicFlag     FreeType's italic style flag
     * @param fixedWidth     FreeType's fixed-width face flag
     */
    static FaceDescriptor describe(String postscriptName, String family, String style, byte[] os2,
                                   boolean italicFlag, boolean fixedWidth) {
        String styleName = style == null || style.isEmpty() ? "Regular" : style;
        String ps = postscriptName == null || postscriptName.isEmpty()
                ? (family + "-" + styleName).replace(" ", "")
                : postscriptName;

        double weight = weightFromStyleName(styleName);
        double stretch = 100;
        boolean italic = italicFlag;
        if (os2 != null) {
            try {
                Os2Table table = Os2Table.parse(os2);
                if (table.weightClass() >= 1 && table.weightClass() <= 1000) {
                    weight = table.weightClass();
                }
                stretch = table.stretchPercent();
                italic |= table.italic() || table.oblique();
            } catch (FontTableException e) {
                log.fine(() -> String.format("%s: unusable OS/2 (%s), weight from style name", ps, e.getMessage()));
            }
        }
        return new FaceDescriptor(ps, family, styleName, StyleTraits.traitFromWeight(weight),
                StyleTraits.traitFromStretch(stretch), italic, fixedWidth);
    }

    /** CSS weight implied by common style names; 400 when none matches. */
    static double weightFromStyleName(String style) {
        String s = style.toLowerCase(Locale.ROOT).replace(" ", "").replace("-", "");
        if (s.contains("thin") || s.contains("hairline")) return 100;
        if (s.contains("extralight") || s.contains("ultralight")) return 200;
        if (s.contains("semilight") || s.contains("demilight")) return 350;
        if (s.contains("light")) return 300;
        if (s.contains("medium")) return 500;
        if (s.contains("semibold") || s.contains("demibold")) return 600;
        if (s.contains("extrabold") || s.contains("ultrabold")) return 800;
        if (s.contains("black") || s.contains("heavy")) return 900;
        if (s.contains("bold")) return 700;
        return 400;
    }
}
