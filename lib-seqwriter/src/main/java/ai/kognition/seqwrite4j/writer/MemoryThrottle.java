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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Bounds the number of images held in memory between the moment a producer starts working on
 * one and the moment a {@link SequenceWriter} has written it and let it go. Without this, a
 * writer that's slower than the producers lets finished images pile up without limit.
 * </p>
 *
 * <p>
 * A producer calls {@link #reserve()} before it allocates an image. That's the only place a
 * producer ever blocks. The slot is given back when the writer is done with the image, through
 * {@link #notifyDataFreed(SequenceTarget, int)}, or with {@link #release()} directly when the
 * producer ends up not handing anything to a writer.
 * </p>
 *
 * <p>
 * Slots must be reserved in index order. A writer holds on to images that arrive ahead of the one
 * it's waiting for, so if later indices take every slot the missing one can never be produced.
 * </p>
 *
 * <p>
 * When several writers are fed from one processing pass (one reservation per input image,
 * several derived outputs) call {@link #setOutputCount(int)} first. A slot is then only given
 * back once every output has reported the index.
 * </p>
 *
 * <p>
 * The active count and the output registry are the only state shared between writers. Both are
 * guarded by a single lock which is only held long enough to check and update them.
 * </p>
 */
public class MemoryThrottle {
    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryThrottle.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();

    private int active = 0;
    private int ceiling;
    private int waiting = 0;
    private OutputRegistry outputs = null;

    /**
     * An unlimited throttle.
     */
    public MemoryThrottle() {
        this(0);
    }

    /**
     * @param ceiling the most images allowed in flight. Zero or less is unlimited.
     */
    public MemoryThrottle(final int ceiling) {
        this.ceiling = ceiling;
    }

    /**
     * Block until a slot is available and take it. Does nothing when the throttle is unlimited.
     *
     * @throws InterruptedException if interrupted while waiting, in which case no slot
     *             was taken.
     */
    public void reserve() throws InterruptedException {
        lock.lock();
        try {
            if(ceiling <= 0)
                return;
            waiting++;
            try {
                while(ceiling > 0 && active >= ceiling) {
                    LOGGER.trace("  waiting for free memory slot ({} active)", active);
                    slotFreed.await();
                }
            } finally {
                waiting--;
            }
            take();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #reserve()} but gives up after the timeout.
     *
     * @return true if a slot was taken (or the throttle is unlimited), false on timeout.
     * @throws InterruptedException if interrupted while waiting, in which case no slot
     *             was taken.
     */
    public boolean reserve(final long timeout, final TimeUnit unit) throws InterruptedException {
        lock.lock();
        try {
            if(ceiling <= 0)
                return true;
            long nanos = unit.toNanos(timeout);
            waiting++;
            try {
                while(ceiling > 0 && active >= ceiling) {
                    if(nanos <= 0L)
                        return false;
                    nanos = slotFreed.awaitNanos(nanos);
                }
            } finally {
                waiting--;
            }
            take();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Give back a slot and wake one waiting producer. Each reserved slot must be given back
     * exactly once.
     */
    public void release() {
        lock.lock();
        try {
            releaseLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * <p>
     * Change the ceiling. Zero or less is unlimited.
     * </p>
     *
     * <p>
     * Raising the ceiling doesn't by itself wake producers already parked in {@link #reserve()}.
     * The additional slots are handed to them through {@link #releaseDeficit(int)}.
     * </p>
     *
     * <p>
     * Reservations aren't counted while the throttle is unlimited, so going from unlimited to
     * limited starts counting from zero.
     * </p>
     */
    public void setCeiling(final int max) {
        lock.lock();
        try {
            LOGGER.info("Number of images allowed in the write queue: {} (zero or less is unlimited)", max);
            final int previous = ceiling;
            ceiling = max;
            if(previous <= 0 && max > 0) {
                // nothing was counted while unlimited
                active = 0;
            } else if(previous > 0) {
                if(max <= 0)
                    slotFreed.signalAll();
                else if(max > previous)
                    releaseDeficit(max - previous);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wake up to {@code count} producers blocked in {@link #reserve()}, one per slot the
     * ceiling was just raised by. Each one re-checks the ceiling so no more than the new
     * ceiling's worth of slots ever get taken. Nothing is taken from the active count
     * since no image was actually let go.
     */
    public void releaseDeficit(final int count) {
        lock.lock();
        try {
            LOGGER.debug("releasing a deficit of {} slot(s) to {} waiting producer(s)", count, waiting);
            for(int i = 0; i < count; i++)
                slotFreed.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Declare how many output sequences are fed from one reservation. One or less turns
     * off synchronization between outputs. Any previous registrations are forgotten.
     */
    public void setOutputCount(final int numberOfOutputs) {
        lock.lock();
        try {
            LOGGER.debug("number of outputs: {}", numberOfOutputs);
            outputs = numberOfOutputs > 1 ? new OutputRegistry(numberOfOutputs) : null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Make sure the given output has a slot in the registry. This is done on first sight
     * anyway but registering up front fixes the order of the slots.
     */
    public void register(final SequenceTarget target) {
        lock.lock();
        try {
            if(outputs != null)
                outputs.slotFor(target);
        } finally {
            lock.unlock();
        }
    }

    /**
     * A writer is done with the image at {@code index} for the given output, whether it
     * was written, skipped or abandoned. With a single output this is the same as
     * {@link #release()}. With several, the slot is only given back once the last of them
     * reports {@code index}.
     */
    public void notifyDataFreed(final SequenceTarget target, final int index) {
        lock.lock();
        try {
            if(outputs != null && !outputs.indexFreed(target, index))
                return;
            releaseLocked();
        } finally {
            lock.unlock();
        }
    }

    public int active() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    public int ceiling() {
        lock.lock();
        try {
            return ceiling;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The number of producers currently blocked in {@link #reserve()}.
     */
    public int waiting() {
        lock.lock();
        try {
            return waiting;
        } finally {
            lock.unlock();
        }
    }

    public int outputCount() {
        lock.lock();
        try {
            return outputs == null ? 1 : outputs.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * The highest index the given output has reported, or -1. Always -1 when outputs aren't
     * being synchronized.
     */
    public int highestIndex(final SequenceTarget target) {
        lock.lock();
        try {
            return outputs == null ? -1 : outputs.highestIndex(target);
        } finally {
            lock.unlock();
        }
    }

    // only called when limited
    private void take() {
        if(ceiling > 0)
            active++;
    }

    private void releaseLocked() {
        if(active > 0)
            active--;
        else if(ceiling > 0)
            LOGGER.error("A memory slot was released that was never reserved. The active count stays at {}.", active);
        slotFreed.signal();
    }

    @Override
    public String toString() {
        return "MemoryThrottle [active=" + active() + ", ceiling=" + ceiling() + ", outputs=" + outputCount() + "]";
    }
}
