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

/**
 * The style fields of an {@code OS/2} table.
 *
 * @param weightClass usWeightClass, 1..1000
 * @param widthClass  usWidthClass, 1 (ultra-condensed) .. 9 (ultra-expanded)
 * @param italic      fsSelection bit 0
 * @param oblique     fsSelection bit 9
 */
public record Os2Table(int weightClass, int widthClass, boolean italic, boolean oblique) {

    private static final int FS_SELECTION_ITALIC = 1;
    private static final int FS_SELECTION_OBLIQUE = 1 << 9;

    /** Width class percentages defined by OpenType, indexed by usWidthClass - 1. */
    private static final double[] WIDTH_PERCENT = {50, 62.5, 75, 87.5, 100, 112.5, 125, 150, 200};

    /**
     * @throws FontTableException if the table is shorter than the version 0 header
     */
    public static Os2Table parse(byte[] os2) {
        if (os2 == null || os2.length < 64) {
            throw new FontTableException("OS/2", "table too short");
        }
        ByteBuffer buf = ByteBuffer.wrap(os2).order(ByteOrder.BIG_ENDIAN);
        int weight = buf.getShort(4) & 0xFFFF;
        int width = buf.getShort(6) & 0xFFFF;
        int fsSelection = buf.getShort(62) & 0xFFFF;
        return new Os2Table(weight, width,
                (fsSelection & FS_SELECTION_ITALIC) != 0,
                (fsSelection & FS_SELECTION_OBLIQUE) != 0);
    }

    /** usWidthClass as a CSS stretch percentage; out-of-range classes read as 100. */
    public double stretchPercent() {
        return widthPercent(widthClass);
    }

    public static double widthPercent(int widthClass) {
        if (widthClass < 1 || widthClass > WIDTH_PERCENT.length) {
            return 100;
        }
        return WIDTH_PERCENT[widthClass - 1];
    }
}
