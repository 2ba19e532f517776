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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class ImageBufferTest {

    @Test
    public void allocate() {
        try(final ImageBuffer image = ImageBuffer.allocate(4, 3, 3, BitDepth.USHORT)) {
            assertEquals(4, image.width());
            assertEquals(3, image.height());
            assertEquals(3, image.channels());
            assertEquals(BitDepth.USHORT, image.depth());
            assertEquals(4 * 3 * 3 * 2, image.data().capacity());
            assertEquals(0, image.data().get(0));
        }
    }

    @Test
    public void closeReleasesData() {
        final ImageBuffer image = ImageBuffer.allocate(2, 2, 1, BitDepth.BYTE);
        assertFalse(image.isClosed());
        image.close();
        assertTrue(image.isClosed());
    }

    @Test(expected = IllegalStateException.class)
    public void dataAfterCloseFails() {
        final ImageBuffer image = ImageBuffer.allocate(2, 2, 1, BitDepth.BYTE);
        image.close();
        image.data();
    }

    @Test
    public void secondCloseIsHarmless() {
        final ImageBuffer image = ImageBuffer.allocate(2, 2, 1, BitDepth.FLOAT);
        image.close();
        image.close();
        assertTrue(image.isClosed());
    }

    @Test
    public void returnMeSkipsOneClose() {
        final ImageBuffer handedOff;
        try(final ImageBuffer image = ImageBuffer.allocate(2, 2, 1, BitDepth.BYTE)) {
            handedOff = image.returnMe();
        }
        assertFalse(handedOff.isClosed());
        handedOff.close();
        assertTrue(handedOff.isClosed());
    }

    @Test(expected = IllegalArgumentException.class)
    public void wrapTooSmall() {
        ImageBuffer.wrap(new ImageGeometry(10, 10, 1, BitDepth.USHORT), ByteBuffer.allocate(10));
    }

    @Test
    public void geometryCompatibility() {
        final ImageGeometry established = new ImageGeometry(100, 80, 3, BitDepth.FLOAT);

        assertTrue(new ImageGeometry(100, 80, 3, BitDepth.FLOAT).compatibleWith(established, false));
        assertFalse(new ImageGeometry(101, 80, 3, BitDepth.FLOAT).compatibleWith(established, false));
        assertTrue(new ImageGeometry(101, 79, 3, BitDepth.FLOAT).compatibleWith(established, true));
        // layers and sample type never relax
        assertFalse(new ImageGeometry(100, 80, 1, BitDepth.FLOAT).compatibleWith(established, true));
        assertFalse(new ImageGeometry(100, 80, 3, BitDepth.USHORT).compatibleWith(established, true));
    }

    @Test
    public void bitpix() {
        assertSame(BitDepth.FLOAT, BitDepth.fromBitpix(-32));
        assertSame(BitDepth.USHORT, BitDepth.fromBitpix(16));
        assertEquals(32, BitDepth.FLOAT.bits());
    }

    @Test
    public void closerClosesInReverse() {
        final List<Integer> order = new ArrayList<>();
        try(final Closer closer = new Closer()) {
            closer.add((AutoCloseable)() -> order.add(1));
            closer.add((AutoCloseable)() -> order.add(2));
            final AutoCloseable passedOn = closer.add((AutoCloseable)() -> order.add(3));
            closer.release(passedOn);
            assertEquals(2, closer.size());
        }
        assertEquals(List.of(2, 1), order);
    }
}
