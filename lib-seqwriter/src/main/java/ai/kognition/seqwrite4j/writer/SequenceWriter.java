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

import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dempsy.util.QuietCloseable;

import ai.kognition.seqwrite4j.image.ImageBuffer;

/**
 * <p>
 * Writes the images of a single-file sequence (a FITS cube or a SER file) from one thread,
 * in index order, while the images themselves are produced by any number of threads that
 * finish in any order.
 * </p>
 *
 * <p>
 * Producers {@link #submit(ImageBuffer, int)} each image with the index it belongs at, or
 * {@code null} when that index has no image. Submitting never waits for the writer to catch up.
 * The worker thread started by {@link #start(int)} holds back images that arrive early and passes them to the
 * {@link WriteHook} one at a time once their turn comes. Each image is closed, and its
 * {@link MemoryThrottle} slot given back, as soon as the writer is done with it.
 * </p>
 *
 * <p>
 * Every index from 0 up to the expected count must be submitted (with an image or a hole) or the
 * writer waits for it until it's stopped. {@link #stop(boolean)} either lets the worker finish
 * everything already submitted or abandons it, and returns the final {@link WriteResult}.
 * </p>
 *
 * <pre>
 * <code>
 * try(SequenceWriter writer = new SequenceWriter(SequenceTarget.ser("out"))
 *     .hook(serFile::append)
 *     .throttle(throttle);) {
 *     writer.start(count);
 *     ... producers reserve, compute, submit ...
 *     final WriteResult result = writer.stop(false);
 * }
 * </code>
 * </pre>
 */
public class SequenceWriter implements QuietCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceWriter.class);

    private static final AtomicLong threadCount = new AtomicLong(0);
    private static final String THREAD_NAME = "seqwriter_";

    private final SequenceTarget target;
    private WriteHook hook = null;
    private MemoryThrottle throttle = new MemoryThrottle();

    private final PendingWriteQueue queue = new PendingWriteQueue();
    private Thread thread = null;
    private WriteWorker worker = null;
    private WriteResult result = null;

    private volatile WriterState state = WriterState.NEW;
    private volatile boolean accepting = true;
    private volatile Throwable failureCause = null;

    public SequenceWriter(final SequenceTarget target) {
        this.target = target;
    }

    /**
     * Set the hook that appends an image to the container. Required before {@link #start(int)}.
     */
    public SequenceWriter hook(final WriteHook hook) {
        checkNotStarted();
        this.hook = hook;
        return this;
    }

    /**
     * Use a shared throttle. By default the writer has its own unlimited one.
     */
    public SequenceWriter throttle(final MemoryThrottle throttle) {
        checkNotStarted();
        if(throttle == null)
            throw new NullPointerException("Cannot use a null " + MemoryThrottle.class.getSimpleName());
        this.throttle = throttle;
        return this;
    }

    /**
     * Start the worker thread.
     *
     * @param frameCount the number of images expected, or zero or less if it isn't known. When
     *            it isn't known the writer runs until it's stopped and what was written becomes the
     *            final count.
     * @throws IllegalStateException if the hook or the target isn't set, or the writer was
     *             already started.
     */
    public synchronized SequenceWriter start(final int frameCount) {
        if(hook == null)
            throw new IllegalStateException("Cannot start a " + SequenceWriter.class.getSimpleName() + " without a " + WriteHook.class.getSimpleName());
        if(target == null)
            throw new IllegalStateException("Cannot start a " + SequenceWriter.class.getSimpleName() + " without a " + SequenceTarget.class.getSimpleName());
        checkNotStarted();

        if(frameCount > 0)
            LOGGER.debug("writer {}: starting with an expected frame count of {}", target.name, frameCount);
        throttle.register(target);
        worker = new WriteWorker(this, queue, frameCount);
        thread = new Thread(worker, THREAD_NAME + threadCount.getAndIncrement());
        state = WriterState.RUNNING;
        thread.start();
        return this;
    }

    /**
     * <p>
     * Hand an image to the writer for the given index. The writer takes ownership of the image
     * and closes it. Pass {@code null} when there's deliberately no image for the index. The
     * sequence ends up one image shorter rather than with a gap.
     * </p>
     *
     * <p>
     * This never waits for the writer to catch up. Producers find out the writer has failed
     * because this starts throwing. When it throws the image has been closed and its slot given back.
     * </p>
     *
     * @throws SeqWriterException if the writer has already stopped, failed or otherwise finished.
     * @throws IllegalArgumentException if the index is negative.
     */
    public void submit(final ImageBuffer image, final int index) {
        final PendingWrite task = new PendingWrite(image, index, this::dataFreed);
        if(index < 0) {
            task.dispose();
            throw new IllegalArgumentException("Invalid image index " + index + " requested for write to " + target);
        }
        if(state == WriterState.NEW) {
            task.dispose();
            throw new IllegalStateException("The writer for " + target + " hasn't been started.");
        }
        if(!accepting) {
            task.dispose();
            throw terminatedException(index);
        }

        queue.push(task);

        // the worker may have finished between the check and the push. If it did and the task
        // is still in the queue, nothing will ever take it out so take it back.
        if(!accepting && queue.remove(task)) {
            task.dispose();
            throw terminatedException(index);
        }
    }

    /**
     * Ask the worker to finish and wait for it.
     *
     * @param abort if false, everything already submitted is processed before the worker
     *            exits (a graceful stop). If true, the worker exits as soon as it sees the
     *            request and everything still waiting is abandoned.
     * @return the final result. Calling this again returns the same result.
     */
    public synchronized WriteResult stop(final boolean abort) {
        if(thread == null)
            throw new IllegalStateException("The writer for " + target + " was never started.");

        if(result == null) {
            queue.pushTermination(abort);
            LOGGER.debug("writer {} notified{}, waiting for exit...", target.name, abort ? " to abort" : "");
            boolean interrupted = false;
            while(thread.isAlive()) {
                try {
                    thread.join();
                } catch(final InterruptedException ie) {
                    interrupted = true;
                }
            }
            if(interrupted)
                Thread.currentThread().interrupt();
            result = worker.result();
            LOGGER.debug("writer {} joined ({})", target.name, result);
        }
        return result;
    }

    /**
     * Abort the writer if it's still running.
     */
    @Override
    public void close() {
        if(thread != null && result == null)
            stop(true);
    }

    public SequenceTarget target() {
        return target;
    }

    public MemoryThrottle throttle() {
        return throttle;
    }

    public WriterState state() {
        return state;
    }

    /**
     * True once the worker has settled on a final state.
     */
    public boolean isTerminated() {
        return state.isTerminal();
    }

    /**
     * False once the worker is on its way out. Nothing can be submitted after that.
     */
    public boolean isAccepting() {
        return accepting && state != WriterState.NEW;
    }

    public boolean hasFailed() {
        return state == WriterState.FAILED;
    }

    /**
     * The exception thrown by the {@link WriteHook}, if that's why the writer failed.
     */
    public Throwable failureCause() {
        return failureCause;
    }

    /**
     * Images appended so far. Can be read from any thread.
     */
    public int framesWritten() {
        return worker == null ? 0 : worker.framesWritten();
    }

    /**
     * The next index the worker will write.
     */
    public int currentIndex() {
        return worker == null ? 0 : worker.currentIndex();
    }

    /**
     * Images received ahead of their turn and held until the missing ones arrive.
     */
    public int waitingForReorder() {
        return worker == null ? 0 : worker.waitingForReorder();
    }

    /**
     * Entries in the queue, termination signals included.
     */
    int queued() {
        return queue.size();
    }

    void setState(final WriterState state) {
        this.state = state;
    }

    /**
     * Called by the worker on its way out, before it empties the queue.
     */
    void stopAccepting() {
        accepting = false;
    }

    void setFailureCause(final Throwable cause) {
        this.failureCause = cause;
    }

    WriteHook writeHook() {
        return hook;
    }

    private void dataFreed(final int index) {
        throttle.notifyDataFreed(target, index);
    }

    private SeqWriterException terminatedException(final int index) {
        final WriterState current = settledState();
        final WriteStatus status;
        if(current == WriterState.FAILED)
            status = WriteStatus.WRITE_ERROR;
        else if(current == WriterState.DONE)
            status = WriteStatus.OK;
        else
            status = WriteStatus.INCOMPLETE;
        return new SeqWriterException(status, "The writer for " + target + " is " + current + " and can't accept image " + index);
    }

    /**
     * The worker stops accepting just before it empties the queue and settles on its final state.
     * None of that waits on producers, so a producer refused in between waits for the final state
     * rather than report a status that isn't decided yet.
     */
    private WriterState settledState() {
        final Thread t = thread;
        if(t != null && t != Thread.currentThread()) {
            boolean interrupted = false;
            while(!state.isTerminal() && t.isAlive()) {
                try {
                    t.join();
                } catch(final InterruptedException ie) {
                    interrupted = true;
                }
            }
            if(interrupted)
                Thread.currentThread().interrupt();
        }
        return state;
    }

    private void checkNotStarted() {
        if(thread != null)
            throw new IllegalStateException("The writer for " + target + " has already been started.");
    }

    @Override
    public String toString() {
        return SequenceWriter.class.getSimpleName() + " [" + target + ", " + state + ", written=" + framesWritten() + "]";
    }
}
