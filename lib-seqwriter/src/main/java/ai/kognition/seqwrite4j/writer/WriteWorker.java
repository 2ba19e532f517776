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

import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.seqwrite4j.image.ImageBuffer;
import ai.kognition.seqwrite4j.image.ImageGeometry;
import ai.kognition.seqwrite4j.util.Timer;

/**
 * The body of a {@link SequenceWriter}'s thread. It takes the image for the current index from
 * the images that arrived early if it's there, otherwise from the queue, parking anything that
 * arrives ahead of its turn, and passes images to the {@link WriteHook} strictly in index order.
 * Everything except the counters published for other threads is confined to the worker thread.
 */
final class WriteWorker implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(WriteWorker.class);

    private final SequenceWriter writer;
    private final SequenceTarget target;
    private final PendingWriteQueue queue;
    private final WriteHook hook;
    private final boolean countKnown;

    private final List<PendingWrite> nextImages = new LinkedList<>();
    private ImageGeometry established = null;
    private int frameCount;
    private PendingWrite termination = null;
    private boolean rejected = false;

    private volatile int currentIndex = 0;
    private volatile int framesWritten = 0;
    private volatile int waiting = 0;
    private volatile WriteResult result = null;

    WriteWorker(final SequenceWriter writer, final PendingWriteQueue queue, final int frameCount) {
        this.writer = writer;
        this.target = writer.target();
        this.queue = queue;
        this.hook = writer.writeHook();
        this.countKnown = frameCount > 0;
        this.frameCount = frameCount;
    }

    @Override
    public void run() {
        final Timer timer = Timer.started();
        WriteStatus retval;
        try {
            retval = writeLoop();
        } catch(final InterruptedException ie) {
            LOGGER.warn("writer {}: interrupted while waiting for images. Treating it as an abort.", target.name);
            termination = PendingWrite.ABORT;
            retval = WriteStatus.INCOMPLETE;
        } catch(final Throwable th) {
            LOGGER.error("writer {}: unexpected failure", target.name, th);
            writer.setFailureCause(th);
            retval = WriteStatus.WRITE_ERROR;
        }

        writer.stopAccepting();
        final int parked = nextImages.size();
        final int queued = abandon(queue.drain());
        abandon(nextImages);
        nextImages.clear();
        waiting = 0;

        final WriteResult res = resolve(retval, parked, queued);
        timer.stop();
        LOGGER.info("writer {}: {} image(s) written in {}s ({} images/s, {} abandoned), {}", target.name, res.framesWritten, timer,
            String.format("%.1f", timer.rate(res.framesWritten)), res.abandoned, res.status);
        LOGGER.debug("writer {} exits with {} ({})", target.name, res.status, res.status.code);

        result = res;
        writer.setState(res.status == WriteStatus.OK ? WriterState.DONE
            : (res.status == WriteStatus.INCOMPLETE ? WriterState.INCOMPLETE : WriterState.FAILED));
    }

    int currentIndex() {
        return currentIndex;
    }

    int framesWritten() {
        return framesWritten;
    }

    int waitingForReorder() {
        return waiting;
    }

    WriteResult result() {
        return result;
    }

    private WriteStatus writeLoop() throws InterruptedException {
        while(!countKnown || framesWritten < frameCount) {
            PendingWrite task = fromWaitingList();
            if(task == null) {
                task = fromQueue();
                if(task == null)
                    return rejected ? WriteStatus.WRITE_ERROR : WriteStatus.INCOMPLETE;
            }

            if(task.isHole()) {
                LOGGER.debug("writer {}: skipping image {}", target.name, task.index);
                task.dispose();
                currentIndex++;
                if(countKnown)
                    frameCount--;
                continue;
            }

            final ImageBuffer image = task.image();
            LOGGER.debug("writer {}: saving image {}, {}", target.name, task.index, image.geometry());
            try {
                hook.write(writer, image, framesWritten);
            } catch(final Throwable e) {
                LOGGER.error("writer {}: failed to write image {}, aborting", target.name, task.index, e);
                writer.setFailureCause(e);
                task.dispose();
                return WriteStatus.WRITE_ERROR;
            }
            task.dispose();
            framesWritten++;
            currentIndex++;
        }
        return WriteStatus.OK;
    }

    private PendingWrite fromWaitingList() {
        for(final Iterator<PendingWrite> iter = nextImages.iterator(); iter.hasNext();) {
            final PendingWrite stored = iter.next();
            if(stored.index == currentIndex) {
                iter.remove();
                waiting = nextImages.size();
                LOGGER.debug("writer {}: image {} obtained from waiting list", target.name, stored.index);
                return stored;
            }
        }
        return null;
    }

    /**
     * Block on the queue until the task for the current index arrives.
     *
     * @return the task, or null if a termination signal arrived or a task was rejected.
     */
    private PendingWrite fromQueue() throws InterruptedException {
        while(true) {
            LOGGER.trace("writer {}: waiting for message {}", target.name, currentIndex);
            final PendingWrite task = queue.take();

            if(task.isTermination()) {
                LOGGER.debug("writer {}: {} message", target.name, task == PendingWrite.ABORT ? "abort" : "finish");
                termination = task;
                writer.setState(WriterState.DRAINING);
                return null;
            }

            if(!task.isHole()) {
                final ImageGeometry geometry = task.image().geometry();
                if(established == null)
                    established = geometry;
                else if(!geometry.compatibleWith(established, target.allowsDifferentSizes()))
                    return reject(task, "Cannot add an image with different properties (" + geometry + ") to an existing sequence ("
                        + established + ")");
            }

            if(task.index < currentIndex)
                return reject(task, "Invalid image index " + task.index + " requested for write after " + currentIndex
                    + " was reached, aborting file creation");

            if(task.index > currentIndex) {
                if(isWaiting(task.index))
                    return reject(task, "Image index " + task.index + " was submitted twice, aborting file creation");
                LOGGER.debug("writer {}: image {} put stored for later use", target.name, task.index);
                nextImages.add(task);
                waiting = nextImages.size();
                continue;
            }

            LOGGER.debug("writer {}: image {} received", target.name, task.index);
            return task;
        }
    }

    private PendingWrite reject(final PendingWrite task, final String message) {
        LOGGER.error("writer {}: {}", target.name, message);
        writer.setFailureCause(new SeqWriterException(WriteStatus.WRITE_ERROR, message));
        task.dispose();
        rejected = true;
        return null;
    }

    private boolean isWaiting(final int index) {
        return nextImages.stream().anyMatch(t -> t.index == index);
    }

    private static int abandon(final List<PendingWrite> tasks) {
        tasks.forEach(t -> t.dispose());
        return tasks.size();
    }

    private WriteResult resolve(final WriteStatus retval, final int parked, final int queued) {
        if(retval == WriteStatus.WRITE_ERROR)
            return new WriteResult(WriteStatus.WRITE_ERROR, framesWritten, countKnown ? frameCount : framesWritten, parked + queued);

        if(termination == null) {
            // reached the expected count
            if(parked + queued > 0)
                LOGGER.warn("writer {}: {} image(s) submitted beyond the {} expected were discarded", target.name, parked + queued, frameCount);
            return new WriteResult(WriteStatus.OK, framesWritten, framesWritten, parked + queued);
        }

        final int abandoned = parked + queued;
        if(abandoned > 0) {
            LOGGER.error("Incomplete file creation for {}: {} image(s) remained to be written", target, abandoned);
            return new WriteResult(WriteStatus.INCOMPLETE, framesWritten, countKnown ? frameCount : framesWritten, abandoned);
        }

        if(!countKnown) {
            LOGGER.info("Saved {} image(s) in the sequence {}", framesWritten, target);
            return new WriteResult(WriteStatus.OK, framesWritten, framesWritten, 0);
        }

        if(termination == PendingWrite.FINISH) {
            LOGGER.warn("writer {}: stopped after {} of the {} expected image(s)", target.name, framesWritten, frameCount);
            return new WriteResult(WriteStatus.OK, framesWritten, framesWritten, 0);
        }

        LOGGER.debug("writer {}: write aborted, expected {} images, got {}.", target.name, frameCount, framesWritten);
        return new WriteResult(WriteStatus.INCOMPLETE, framesWritten, frameCount, 0);
    }
}
