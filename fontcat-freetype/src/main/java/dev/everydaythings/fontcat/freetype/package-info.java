/**
 * A {@link dev.everydaythings.fontcat.PlatformFontProvider} for systems without a
 * native font service, using LWJGL's FreeType bindings over font files on disk.
 *
 * <p>Directories come from {@code font.freetype.directories}, or the usual system
 * and per-user font folders. The provider needs the LWJGL FreeType natives at
 * runtime; add the {@code lwjgl} and {@code lwjgl-freetype} artifacts with the
 * platform's natives classifier.
 *
 * @see dev.everydaythings.fontcat.freetype.FreeTypeFontProvider
 */
package dev.everydaythings.fontcat.freetype;
