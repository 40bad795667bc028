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

package dev.everydaythings.fontcat.sfnt;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Axis records declared by an {@code fvar} table.
 */
public final class VariationAxes {

    public static final int WEIGHT = SfntTags.tag("wght");
    public static final int WIDTH = SfntTags.tag("wdth");
    public static final int SLANT = SfntTags.tag("slnt");
    public static final int ITALIC = SfntTags.tag("ital");

    /** One variation axis, values in user units. */
    public record Axis(int tag, double min, double defaultValue, double max) {
        public String tagName() {
            return SfntTags.toString(tag);
        }
    }

    private VariationAxes() {
    }

    /**
     * @throws FontTableException if the header or axis array is malformed
     */
    public static List<Axis> parse(byte[] fvar) {
        if (fvar == null || fvar.length < 16) {
            throw new FontTableException("fvar", "table too short");
        }
        ByteBuffer buf = ByteBuffer.wrap(fvar).order(ByteOrder.BIG_ENDIAN);
        int axesOffset = buf.getShort(4) & 0xFFFF;
        int axisCount = buf.getShort(8) & 0xFFFF;
        int axisSize = buf.getShort(10) & 0xFFFF;
        if (axisSize < 20) {
            throw new FontTableException("fvar", "axis record size " + axisSize, 10);
        }
        if (axesOffset + (long) axisCount * axisSize > fvar.length) {
            throw new FontTableException("fvar", "axis array exceeds table length", axesOffset);
        }

        List<Axis> axes = new ArrayList<>(axisCount);
        for (int i = 0; i < axisCount; i++) {
            int rec = axesOffset + i * axisSize;
            int tag = buf.getInt(rec);
            double min = fixed(buf.getInt(rec + 4));
            double def = fixed(buf.getInt(rec + 8));
            double max = fixed(buf.getInt(rec + 12));
            if (min > def || def > max) {
                throw new FontTableException("fvar", "axis '" + SfntTags.toString(tag) + "' range inverted", rec);
            }
            axes.add(new Axis(tag, min, def, max));
        }
        return Collections.unmodifiableList(axes);
    }

    /** The axis with the given tag, or null. */
    public static Axis find(List<Axis> axes, int tag) {
        for (Axis axis : axes) {
            if (axis.tag() == tag) {
                return axis;
            }
        }
        return null;
    }

    private static double fixed(int value) {
        return value / 65536.0;
    }
}
