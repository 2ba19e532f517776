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

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dempsy.util.QuietCloseable;

import ai.kognition.seqwrite4j.image.ImageBuffer;

/**
 * <p>
 * An image waiting to be written at {@code index}, or a deliberate hole when there's no image.
 * Once submitted the task owns the image.
 * </p>
 *
 * <p>
 * {@link #dispose()} is the one place a task's resources are let go: it closes the image and gives
 * back the memory slot that was reserved for it. Every path through the writer, whether the image
 * is written, skipped, rejected or abandoned, ends in exactly one call to it.
 * </p>
 */
public final class PendingWrite implements QuietCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PendingWrite.class);

    /**
     * Called when the task's memory slot can be given back.
     */
    @FunctionalInterface
    public static interface SlotRelease {
        public void dataFreed(int index);
    }

    /**
     * Termination signal queued behind everything already submitted.
     */
    static final PendingWrite FINISH = new PendingWrite(null, -1, null);

    /**
     * Termination signal queued in front of everything already submitted.
     */
    static final PendingWrite ABORT = new PendingWrite(null, -1, null);

    public final int index;
    private final ImageBuffer image;
    private final SlotRelease slotRelease;
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    PendingWrite(final ImageBuffer image, final int index, final SlotRelease slotRelease) {
        this.image = image;
        this.index = index;
        this.slotRelease = slotRelease;
    }

    public boolean isHole() {
        return image == null;
    }

    public boolean isTermination() {
        return this == FINISH || this == ABORT;
    }

    /**
     * The image, or null for a hole. Only valid until the task is disposed.
     */
    public ImageBuffer image() {
        return image;
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    /**
     * Close the image and give back its memory slot. A second call is a bug and is logged
     * but otherwise ignored.
     */
    public void dispose() {
        if(isTermination())
            return;
        if(!disposed.compareAndSet(false, true)) {
            LOGGER.error("Pending write for index {} was disposed more than once", index, new RuntimeException());
            return;
        }
        try(QuietCloseable releaseSlot = () -> {
            if(slotRelease != null)
                slotRelease.dataFreed(index);
        };) {
            if(image != null)
                image.close();
        }
    }

    @Override
    public void close() {
        dispose();
    }

    @Override
    public String toString() {
        if(this == FINISH)
            return "PendingWrite [FINISH]";
        if(this == ABORT)
            return "PendingWrite [ABORT]";
        return "PendingWrite [index=" + index + (image == null ? ", hole" : ", " + image.geometry()) + "]";
    }
}
