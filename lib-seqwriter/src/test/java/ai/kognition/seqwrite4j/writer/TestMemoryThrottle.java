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

import static net.dempsy.utils.test.ConditionPoll.poll;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

public class TestMemoryThrottle extends BaseTest {

    private static long errorsLoggedDuring(final Runnable r) {
        final Logger logger = (Logger)LoggerFactory.getLogger(MemoryThrottle.class);
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            r.run();
        } finally {
            logger.detachAppender(appender);
        }
        return appender.list.stream().filter(e -> e.getLevel() == Level.ERROR).count();
    }

    private static Thread reserveInBackground(final MemoryThrottle throttle, final AtomicInteger through, final AtomicBoolean interrupted) {
        final Thread ret = new Thread(() -> {
            try {
                throttle.reserve();
                through.incrementAndGet();
            } catch(final InterruptedException ie) {
                interrupted.set(true);
            }
        }, "reserver");
        ret.setDaemon(true);
        ret.start();
        return ret;
    }

    private static List<Thread> reserveInBackground(final MemoryThrottle throttle, final int count, final AtomicInteger through) {
        final List<Thread> ret = new ArrayList<>();
        for(int i = 0; i < count; i++)
            ret.add(reserveInBackground(throttle, through, new AtomicBoolean(false)));
        return ret;
    }

    @Test
    public void testUnlimitedNeverBlocks() throws Throwable {
        final MemoryThrottle throttle = new MemoryThrottle();
        for(int i = 0; i < 100; i++)
            throttle.reserve();
        assertTrue(throttle.reserve(0, TimeUnit.MILLISECONDS));
        // nothing is counted while unlimited
        assertEquals(0, throttle.active());
        assertEquals(0, errorsLoggedDuring(() -> {
            for(int i = 0; i < 100; i++)
                throttle.release();
        }));
        assertEquals(0, throttle.active());
        assertEquals(0, throttle.waiting());
    }

    @Test
    public void testDefaultWriterThrottleIsQuiet() throws Throwable {
        final RecordingHook hook = new RecordingHook();
        final long errors = errorsLoggedDuring(() -> {
            try(final SequenceWriter writer = new SequenceWriter(SequenceTarget.ser("quiet")).hook(hook);) {
                writer.start(3);
                for(int i = 0; i < 3; i++)
                    writer.submit(image(i), i);
                assertEquals(WriteStatus.OK, writer.stop(false).status);
            }
        });
        assertEquals(0, errors);
        assertEquals(range(3), hook.indices());
    }

    @Test
    public void testLimitingStartsCountingFromZero() throws Throwable {
        final MemoryThrottle throttle = new MemoryThrottle();
        throttle.reserve();
        throttle.reserve();
        throttle.setCeiling(2);
        assertEquals(0, throttle.active());

        throttle.reserve();
        throttle.reserve();
        assertEquals(2, throttle.active());
        assertFalse(throttle.reserve(50, TimeUnit.MILLISECONDS));
        assertEquals(0, throttle.waiting());
        assertEquals(2, throttle.active());
    }

    @Test
    public void testTimedReserveGetsFreedSlot() throws Throwable {
        final MemoryThrottle throttle = new MemoryThrottle(1);
        throttle.reserve();

        final AtomicBoolean got = new AtomicBoolean(false);
        final Thread t = new Thread(() -> {
            try {
                got.set(throttle.reserve(30, TimeUnit.SECONDS));
            } catch(final InterruptedException ie) {
                throw new RuntimeException(ie);
            }
        }, "timed-reserver");
        t.start();
        assertTrue(poll(o -> throttle.waiting() == 1));

        throttle.release();
        t.join();
        assertTrue(got.get());
        assertEquals(1, throttle.active());
    }

    @Test
    public void testBlocksAtCeilingUntilRelease() throws Throwable {
        final MemoryThrottle throttle = new MemoryThrottle(3);
        for(int i = 0; i < 3; i++)
            throttle.reserve();

        final AtomicInteger through = new AtomicInteger(0);
        final Thread t = reserveInBackground(throttle, through, new AtomicBoolean(false));
        assertTrue(poll(o -> throttle.waiting() == 1));
        assertEquals(0, through.get());
        assertEquals(3, throttle.active());

        throttle.release();
        t.join();
        assertEquals(1, through.get());
        assertEquals(3, throttle.active());
        assertEquals(0, throttle.waiting());
    }

    @Test
    public void testManyProducersNeverExceedCeiling() throws Throwable {
        final int ceiling = 4;
        final MemoryThrottle throttle = new MemoryThrottle(ceiling);
        final AtomicInteger max = new AtomicInteger(0);
        final AtomicInteger done = new AtomicInteger(0);

        final List<Thread> producers = new ArrayList<>();
        for(int t = 0; t < 8; t++) {
            producers.add(new Thread(() -> {
                for(int i = 0; i < 50; i++) {
                    try {
                        throttle.reserve();
                    } catch(final InterruptedException e) {
                        throw new RuntimeException(e);
                    }
                    max.accumulateAndGet(throttle.active(), Math::max);
                    Thread.yield();
                    throttle.release();
                }
                done.incrementAndGet();
            }, "producer-" + t));
        }
        producers.forEach(Thread::start);
        for(final Thread p: producers)
            p.join();

        assertEquals(8, done.get());
        assertTrue("saw " + max.get(), max.get() <= ceiling);
        assertEquals(0, throttle.active());
    }

    @Test
    public void testRaisingCeilingAdmitsExactlyTheDifference() throws Throwable {
        final MemoryThrottle throttle = new MemoryThrottle(2);
        throttle.reserve();
        throttle.reserve();

        final AtomicInteger through = new AtomicInteger(0);
        reserveInBackground(throttle, 5, through);
        assertTrue(poll(o -> throttle.waiting() == 5));

        throttle.setCeiling(4);
        assertTrue(poll(o -> through.get() == 2 && throttle.waiting() == 3));
        Thread.sleep(100);
        assertEquals(2, through.get());
        assertEquals(4, throttle.active());

        // unlimited lets everyone through
        throttle.setCeiling(0);
        assertTrue(poll(o -> through.get() == 5));
        assertEquals(7, throttle.active());
        assertEquals(0, throttle.waiting());
    }

    @Test
    public void testDeficitWithoutRaiseAdmitsNobody() throws Throwable {
        final MemoryThrottle throttle = new MemoryThrottle(1);
        throttle.reserve();

        final AtomicInteger through = new AtomicInteger(0);
        reserveInBackground(throttle, through, new AtomicBoolean(false));
        assertTrue(poll(o -> throttle.waiting() == 1));

        throttle.releaseDeficit(3);
        Thread.sleep(100);
        assertEquals(0, through.get());
        assertEquals(1, throttle.waiting());
        assertEquals(1, throttle.active());

        throttle.release();
        assertTrue(poll(o -> through.get() == 1));
        assertEquals(1, throttle.active());
    }

    @Test
    public void testLoweringCeiling() throws Throwable {
        final MemoryThrottle throttle = new MemoryThrottle(4);
        for(int i = 0; i < 4; i++)
            throttle.reserve();
        throttle.setCeiling(2);

        final AtomicInteger through = new AtomicInteger(0);
        reserveInBackground(throttle, through, new AtomicBoolean(false));
        assertTrue(poll(o -> throttle.waiting() == 1));

        throttle.release();
        throttle.release();
        Thread.sleep(100);
        // 2 active at a ceiling of 2
        assertEquals(0, through.get());

        throttle.release();
        assertTrue(poll(o -> through.get() == 1));
        assertEquals(2, throttle.active());
        assertEquals(2, throttle.ceiling());
    }

    @Test
    public void testInterruptedWhileWaiting() throws Throwable {
        final MemoryThrottle throttle = new MemoryThrottle(1);
        throttle.reserve();

        final AtomicInteger through = new AtomicInteger(0);
        final AtomicBoolean interrupted = new AtomicBoolean(false);
        final Thread t = reserveInBackground(throttle, through, interrupted);
        assertTrue(poll(o -> throttle.waiting() == 1));

        t.interrupt();
        t.join();
        assertTrue(interrupted.get());
        assertEquals(0, through.get());
        assertEquals(0, throttle.waiting());
        assertEquals(1, throttle.active());
    }

    @Test
    public void testReleaseWithoutReserveDoesNotGoNegative() {
        final MemoryThrottle throttle = new MemoryThrottle(2);
        assertEquals(1, errorsLoggedDuring(() -> throttle.release()));
        assertEquals(0, throttle.active());
        assertFalse(throttle.toString().isEmpty());
    }
}
