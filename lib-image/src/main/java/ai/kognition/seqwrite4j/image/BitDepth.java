/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.seqwrite4j.image;

/**
 * Sample types an image sequence can hold. The {@code bitpix} values are the FITS
 * convention (negative for floating point).
 */
public enum BitDepth {
    BYTE(8, 1),
    USHORT(16, 2),
    FLOAT(-32, 4);

    public final int bitpix;
    public final int bytesPerSample;

    private BitDepth(final int bitpix, final int bytesPerSample) {
        this.bitpix = bitpix;
        this.bytesPerSample = bytesPerSample;
    }

    public int bits() {
        return Math.abs(bitpix);
    }

    public static BitDepth fromBitpix(final int bitpix) {
        for(final BitDepth d: values()) {
            if(d.bitpix == bitpix)
                return d;
        }
        throw new IllegalArgumentException("Unsupported bitpix " + bitpix);
    }
}
