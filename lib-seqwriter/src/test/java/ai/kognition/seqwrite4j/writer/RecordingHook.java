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

import static net.dempsy.util.Functional.uncheck;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.function.IntPredicate;

import ai.kognition.seqwrite4j.image.ImageBuffer;

/**
 * A {@link WriteHook} that remembers what it was asked to write instead of writing it.
 */
public class RecordingHook implements WriteHook {
    private final List<Integer> indices = new ArrayList<>();
    private final List<Integer> ordinals = new ArrayList<>();
    private final List<ImageBuffer> images = new ArrayList<>();
    private long delayMillis = 0;
    private IntPredicate failWhen = i -> false;
    private CountDownLatch gate = null;
    private int gateIndex = -1;
    private MemoryThrottle watch = null;
    private int maxActiveSeen = 0;

    public RecordingHook delay(final long millis) {
        this.delayMillis = millis;
        return this;
    }

    /**
     * Throw an {@link IOException} when asked to write an image whose stamped index matches.
     */
    public RecordingHook failWhen(final IntPredicate failWhen) {
        this.failWhen = failWhen;
        return this;
    }

    /**
     * Block the write of the given index until the latch is counted down.
     */
    public RecordingHook gate(final int index, final CountDownLatch gate) {
        this.gateIndex = index;
        this.gate = gate;
        return this;
    }

    /**
     * Sample the throttle's active count on every write.
     */
    public RecordingHook watch(final MemoryThrottle throttle) {
        this.watch = throttle;
        return this;
    }

    @Override
    public void write(final SequenceWriter writer, final ImageBuffer image, final int framesWritten) throws IOException {
        final int index = BaseTest.indexOf(image);
        if(gate != null && index == gateIndex)
            uncheck(() -> gate.await());
        if(delayMillis > 0)
            uncheck(() -> Thread.sleep(delayMillis));
        if(failWhen.test(index))
            throw new IOException("Failed writing image " + index);
        synchronized(this) {
            indices.add(index);
            ordinals.add(framesWritten);
            images.add(image);
            if(watch != null)
                maxActiveSeen = Math.max(maxActiveSeen, watch.active());
        }
    }

    public synchronized List<Integer> indices() {
        return new ArrayList<>(indices);
    }

    public synchronized List<Integer> ordinals() {
        return new ArrayList<>(ordinals);
    }

    public synchronized List<ImageBuffer> images() {
        return new ArrayList<>(images);
    }

    public synchronized int maxActiveSeen() {
        return maxActiveSeen;
    }
}
