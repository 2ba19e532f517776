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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.seqwrite4j.image.Closer;
import ai.kognition.seqwrite4j.image.ImageBuffer;
import ai.kognition.seqwrite4j.util.Timer;
import ai.kognition.seqwrite4j.writer.MemoryThrottle;
import ai.kognition.seqwrite4j.writer.SeqWriterException;
import ai.kognition.seqwrite4j.writer.SequenceWriter;
import ai.kognition.seqwrite4j.writer.WriteResult;

/**
 * <p>
 * Runs an {@link ImageProcessor} over every index of an input sequence on a pool of threads
 * and feeds the results to one or more {@link SequenceWriter}s sharing a {@link MemoryThrottle}.
 * </p>
 *
 * <p>
 * A slot is reserved on the throttle for each index, in index order, before the index is handed
 * to a thread, so the number of images alive at any time is bounded by the throttle's ceiling
 * however far the writers fall behind. With several outputs the throttle is told how many so a
 * slot only comes back once every output is done with the index.
 * </p>
 *
 * <p>
 * If a writer fails, or a processing error happens and {@code stopOnError} is set, or
 * {@link #cancel()} is called, the threads stop taking new indices and the writers are aborted.
 * Without {@code stopOnError} an index that fails to process becomes a hole in every output.
 * </p>
 *
 * <pre>
 * <code>
 * final List&lt;WriteResult&gt; results = new SequenceProcessor(throttle)
 *     .description("background extraction")
 *     .threads(8)
 *     .output(new SequenceWriter(SequenceTarget.fitseq("bkg_")).hook(fitsCube::append))
 *     .run(count, index -&gt; new ImageBuffer[] {removeBackground(index)});
 * </code>
 * </pre>
 */
public class SequenceProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceProcessor.class);

    private static final AtomicLong threadCount = new AtomicLong(0);
    private static final String THREAD_NAME = "seqproc_";
    private static final long RESERVE_POLL_MILLIS = 100;

    private final MemoryThrottle throttle;
    private final List<SequenceWriter> outputs = new ArrayList<>();
    private int threads = Runtime.getRuntime().availableProcessors();
    private boolean stopOnError = true;
    private String description = "processing";

    private final AtomicBoolean ran = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger failures = new AtomicInteger(0);

    public SequenceProcessor(final MemoryThrottle throttle) {
        this.throttle = Validate.notNull(throttle, "Cannot process without a %s", MemoryThrottle.class.getSimpleName());
    }

    /**
     * Add an output. The writer is switched to this processor's throttle and is started by
     * {@link #run(int, ImageProcessor)}, so it must not have been started yet.
     */
    public SequenceProcessor output(final SequenceWriter writer) {
        outputs.add(writer.throttle(throttle));
        return this;
    }

    public SequenceProcessor threads(final int threads) {
        Validate.isTrue(threads > 0, "At least one thread is needed but %d were requested", threads);
        this.threads = threads;
        return this;
    }

    public SequenceProcessor stopOnError(final boolean stopOnError) {
        this.stopOnError = stopOnError;
        return this;
    }

    public SequenceProcessor description(final String description) {
        this.description = description;
        return this;
    }

    public List<SequenceWriter> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    /**
     * Stop processing new indices. Indices already handed to a thread but not started are
     * skipped. The writers are aborted once the threads working on an index have finished with it.
     */
    public void cancel() {
        if(!cancelled.getAndSet(true))
            LOGGER.info("{}: cancelling", description);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * The number of indices whose processing threw.
     */
    public int failures() {
        return failures.get();
    }

    /**
     * Process {@code count} input images and wait until every output is written.
     *
     * @return one result per output, in the order the outputs were added.
     * @throws InterruptedException if the calling thread is interrupted while waiting. The run is
     *             cancelled and the writers aborted before this is thrown.
     */
    public List<WriteResult> run(final int count, final ImageProcessor processor) throws InterruptedException {
        Validate.isTrue(!outputs.isEmpty(), "%s has no outputs", description);
        Validate.isTrue(count >= 0, "Can't process %d images", count);
        if(ran.getAndSet(true))
            throw new IllegalStateException(SequenceProcessor.class.getSimpleName() + " can only be run once");

        final Timer timer = Timer.started();
        throttle.setOutputCount(outputs.size());
        try {
            outputs.forEach(w -> w.start(count));

            final ExecutorService ex = Executors.newFixedThreadPool(threads, r -> new Thread(r, THREAD_NAME + threadCount.getAndIncrement()));
            try {
                for(int i = 0; i < count && !cancelled.get(); i++) {
                    if(!reserveSlot())
                        break;
                    final int index = i;
                    ex.execute(() -> processOne(index, processor));
                }

                ex.shutdown();
                while(!ex.awaitTermination(1, TimeUnit.SECONDS))
                    LOGGER.trace("{}: waiting for processing threads", description);
            } catch(final InterruptedException ie) {
                cancel();
                ex.shutdown();
                awaitUninterruptibly(ex);
                stopOutputs();
                throw ie;
            }

            final List<WriteResult> results = stopOutputs();
            timer.stop();
            LOGGER.info("{}: {} image(s) processed in {}s, {} failure(s){}", description, count, timer, failures.get(),
                cancelled.get() ? ", cancelled" : "");
            return results;
        } finally {
            throttle.setOutputCount(1);
        }
    }

    /**
     * Slots are only ever taken here, one index after the other, so the index each writer is
     * waiting for always has one.
     *
     * @return false if cancelled while waiting.
     */
    private boolean reserveSlot() throws InterruptedException {
        while(!throttle.reserve(RESERVE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            if(cancelled.get())
                return false;
        }
        return true;
    }

    // the producers must be gone before the outputs are stopped and the throttle's registry is reset
    private void awaitUninterruptibly(final ExecutorService ex) {
        boolean interrupted = false;
        while(!ex.isTerminated()) {
            try {
                ex.awaitTermination(1, TimeUnit.SECONDS);
            } catch(final InterruptedException ie) {
                interrupted = true;
            }
        }
        if(interrupted)
            Thread.currentThread().interrupt();
    }

    private List<WriteResult> stopOutputs() {
        final boolean aborting = cancelled.get();
        return outputs.stream().map(w -> w.stop(aborting)).collect(Collectors.toList());
    }

    private void processOne(final int index, final ImageProcessor processor) {
        // The slot for this index was reserved by the dispatching loop. Every output has to account
        // for it, either by being handed the index through submit or by being notified on its behalf below.
        final boolean[] delivered = new boolean[outputs.size()];
        try(Closer closer = new Closer();) {
            if(cancelled.get())
                return;
            if(outputs.stream().anyMatch(w -> !w.isAccepting())) {
                LOGGER.error("{}: an output stopped accepting images, stopping", description);
                cancel();
                return;
            }

            ImageBuffer[] images;
            try {
                images = processor.process(index);
                if(images == null || images.length != outputs.size()) {
                    if(images != null)
                        for(final ImageBuffer image: images)
                            closer.add(image);
                    throw new IllegalStateException("Processing image " + index + " produced " + (images == null ? "nothing" : images.length + " image(s)")
                        + " for " + outputs.size() + " output(s)");
                }
            } catch(final Exception e) {
                if(cancelled.get())
                    return;
                failures.incrementAndGet();
                if(stopOnError) {
                    LOGGER.error("{}: processing of image {} failed, stopping", description, index, e);
                    cancel();
                    return;
                }
                LOGGER.warn("{}: processing of image {} failed, it will be missing from the output", description, index, e);
                images = new ImageBuffer[outputs.size()];
            }

            for(final ImageBuffer image: images)
                closer.add(image);

            for(int j = 0; j < images.length; j++) {
                final SequenceWriter writer = outputs.get(j);
                // the writer owns the image from here, even if it refuses it
                final ImageBuffer image = images[j] == null ? null : closer.release(images[j]);
                delivered[j] = true;
                try {
                    writer.submit(image, index);
                } catch(final SeqWriterException swe) {
                    LOGGER.error("{}: {}", description, swe.getMessage());
                    cancel();
                }
            }
        } finally {
            for(int j = 0; j < delivered.length; j++) {
                if(!delivered[j])
                    throttle.notifyDataFreed(outputs.get(j).target(), index);
            }
        }
    }
}
