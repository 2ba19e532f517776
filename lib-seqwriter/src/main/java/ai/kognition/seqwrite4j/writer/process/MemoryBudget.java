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
package ai.kognition.seqwrite4j.writer.process;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.seqwrite4j.writer.SeqWriterConfig;

/**
 * <p>
 * Works out, before processing starts, how many images can be worked on at once and how many
 * finished images the writer may hold, from the memory one image needs and the memory that's
 * available.
 * </p>
 *
 * <p>
 * Each processing thread needs {@code mbPerImage + mbPerThread} (the image plus whatever temporary
 * buffers the processing allocates). Finished images waiting in the writer only need
 * {@code mbPerImage}. So the writer is allowed the images the threads already account for plus
 * as many more as fit in what the threads leave unused, capped at {@code queueFactor} times the
 * number of threads.
 * </p>
 */
public final class MemoryBudget {
    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryBudget.class);

    public final long mbPerImage;
    public final long mbPerThread;
    public final long mbAvailable;
    public final int maxThreads;
    public final int queueFactor;

    public MemoryBudget(final long mbPerImage, final long mbPerThread, final long mbAvailable, final int maxThreads, final int queueFactor) {
        Validate.isTrue(mbPerImage > 0, "The memory needed per image must be positive but was %d MB", mbPerImage);
        Validate.isTrue(mbPerThread >= 0, "The extra memory needed per thread can't be negative but was %d MB", mbPerThread);
        Validate.isTrue(mbAvailable >= 0, "The available memory can't be negative but was %d MB", mbAvailable);
        Validate.isTrue(maxThreads > 0, "At least one thread is needed but %d were allowed", maxThreads);
        Validate.isTrue(queueFactor > 0, "The queue factor must be positive but was %d", queueFactor);
        this.mbPerImage = mbPerImage;
        this.mbPerThread = mbPerThread;
        this.mbAvailable = mbAvailable;
        this.maxThreads = maxThreads;
        this.queueFactor = queueFactor;
    }

    public MemoryBudget(final long mbPerImage, final long mbPerThread, final long mbAvailable, final int maxThreads, final SeqWriterConfig config) {
        this(mbPerImage, mbPerThread, mbAvailable, maxThreads, config.queueFactor);
    }

    public long mbRequiredPerThread() {
        return mbPerImage + mbPerThread;
    }

    /**
     * How many images can be processed in parallel. Zero means there isn't enough memory to
     * process even one.
     */
    public int threadLimit() {
        final long limit = Math.min(mbAvailable / mbRequiredPerThread(), maxThreads);
        if(limit == 0)
            logNotEnough();
        return (int)limit;
    }

    /**
     * The ceiling for the {@link ai.kognition.seqwrite4j.writer.MemoryThrottle} feeding the writer.
     * Always at least the {@link #threadLimit()}.
     *
     * @throws IllegalStateException if there isn't enough memory to process even one image. A
     *             zero ceiling would make the throttle unlimited.
     */
    public int writerCeiling() {
        final int threads = threadLimit();
        if(threads == 0)
            throw new IllegalStateException("Not enough memory to process a single image: " + mbRequiredPerThread() + " MB required, "
                + mbAvailable + " MB available");

        final long leftOver = mbAvailable - mbRequiredPerThread() * threads;
        final long limit = Math.min(threads + leftOver / mbPerImage, (long)queueFactor * maxThreads);
        LOGGER.debug("Memory required per thread: {} MB, per image: {} MB, limiting to {} images", mbRequiredPerThread(), mbPerImage, limit);
        return (int)limit;
    }

    private void logNotEnough() {
        LOGGER.error("not enough memory to do this operation ({} MB required per image, {} MB considered available)", mbRequiredPerThread(),
            mbAvailable);
    }

    @Override
    public String toString() {
        return "MemoryBudget [mbPerImage=" + mbPerImage + ", mbPerThread=" + mbPerThread + ", mbAvailable=" + mbAvailable + ", maxThreads="
            + maxThreads + ", queueFactor=" + queueFactor + "]";
    }
}
