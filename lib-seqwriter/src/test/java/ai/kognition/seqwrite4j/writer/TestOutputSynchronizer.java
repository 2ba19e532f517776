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
package ai.kognition.seqwrite4j.writer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestOutputSynchronizer extends BaseTest {
    private final SequenceTarget a = SequenceTarget.fitseq("a");
    private final SequenceTarget b = SequenceTarget.ser("b");

    private static MemoryThrottle reserved(final int count) throws InterruptedException {
        final MemoryThrottle ret = new MemoryThrottle(count);
        for(int i = 0; i < count; i++)
            ret.reserve();
        return ret;
    }

    @Test
    public void testReleasedOnceEveryOutputReportsAnIndex() throws Throwable {
        final MemoryThrottle throttle = reserved(6);
        throttle.setOutputCount(2);
        throttle.register(a);
        throttle.register(b);
        assertEquals(2, throttle.outputCount());

        for(int i = 0; i <= 5; i++)
            throttle.notifyDataFreed(a, i);
        // nothing comes back while b hasn't reported anything
        assertEquals(6, throttle.active());

        for(int i = 0; i <= 3; i++)
            throttle.notifyDataFreed(b, i);
        assertEquals(5, throttle.highestIndex(a));
        assertEquals(3, throttle.highestIndex(b));
        assertEquals(2, throttle.active());

        throttle.notifyDataFreed(b, 4);
        assertEquals(1, throttle.active());
        throttle.notifyDataFreed(b, 5);
        assertEquals(0, throttle.active());
    }

    @Test
    public void testAheadOfOtherOutputReleasesNothing() throws Throwable {
        final MemoryThrottle throttle = reserved(1);
        throttle.setOutputCount(2);

        throttle.notifyDataFreed(a, 5);
        throttle.notifyDataFreed(b, 3);
        assertEquals(1, throttle.active());

        throttle.notifyDataFreed(b, 5);
        assertEquals(0, throttle.active());
    }

    @Test
    public void testOutOfSequenceNotificationIsRecorded() throws Throwable {
        final MemoryThrottle throttle = reserved(2);
        throttle.setOutputCount(2);

        throttle.notifyDataFreed(a, 0);
        throttle.notifyDataFreed(a, 2); // skipped 1, logged but not fatal
        assertEquals(2, throttle.highestIndex(a));
        assertEquals(-1, throttle.highestIndex(b));
        assertEquals(2, throttle.active());
    }

    @Test
    public void testUnknownOutputReleasesDirectly() throws Throwable {
        final MemoryThrottle throttle = reserved(1);
        throttle.setOutputCount(2);
        throttle.register(a);
        throttle.register(b);

        throttle.notifyDataFreed(SequenceTarget.ser("c"), 0);
        assertEquals(0, throttle.active());
    }

    @Test
    public void testSingleOutputIsPlainRelease() throws Throwable {
        final MemoryThrottle throttle = reserved(2);
        throttle.setOutputCount(2);
        throttle.setOutputCount(1);
        assertEquals(1, throttle.outputCount());

        throttle.notifyDataFreed(a, 0);
        assertEquals(1, throttle.active());
        assertEquals(-1, throttle.highestIndex(a));
    }

    @Test
    public void testTwoWritersShareOneThrottle() throws Throwable {
        final int count = 40;
        final int ceiling = 4;
        final MemoryThrottle throttle = new MemoryThrottle(ceiling);
        throttle.setOutputCount(2);

        final RecordingHook fastHook = new RecordingHook().watch(throttle);
        final RecordingHook slowHook = new RecordingHook().delay(2).watch(throttle);

        try(final SequenceWriter fast = new SequenceWriter(a).hook(fastHook).throttle(throttle);
            final SequenceWriter slow = new SequenceWriter(b).hook(slowHook).throttle(throttle);) {
            fast.start(count);
            slow.start(count);

            for(int i = 0; i < count; i++) {
                throttle.reserve();
                fast.submit(image(i), i);
                slow.submit(image(i), i);
            }

            assertEquals(WriteStatus.OK, fast.stop(false).status);
            assertEquals(WriteStatus.OK, slow.stop(false).status);
        }

        assertEquals(range(count), fastHook.indices());
        assertEquals(range(count), slowHook.indices());
        assertTrue(fastHook.maxActiveSeen() <= ceiling);
        assertTrue(slowHook.maxActiveSeen() <= ceiling);
        assertEquals(count - 1, throttle.highestIndex(a));
        assertEquals(count - 1, throttle.highestIndex(b));
        assertEquals(0, throttle.active());
    }
}
