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

/**
 * A face as reported by a {@link PlatformFontProvider}, before normalization.
 *
 * @param postscriptName unique face name, used as the face identity
 * @param familyName     family the provider files the face under
 * @param styleName      the provider's style name, e.g. "Bold Italic"
 * @param weightTrait    weight trait in [-1, 1], 0 is regular
 * @param widthTrait     width trait in [-1, 1], 0 is normal
 * @param italic         whether the face is italic or oblique
 * @param monospace      whether all glyphs share one advance
 */
public record FaceDescriptor(
        String postscriptName,
        String familyName,
        String styleName,
        double weightTrait,
        double widthTrait,
        boolean italic,
        boolean monospace
) {
    public FaceDescriptor {
        if (postscriptName == null || postscriptName.isEmpty()) {
            throw new IllegalArgumentException("Face needs a PostScript name");
        }
    }
}
