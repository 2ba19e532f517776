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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The pixel data for a single image along with its {@link ImageGeometry}. An {@link ImageBuffer}
 * is an {@link AutoCloseable} and is meant to be managed with a <em>"try-with-resource"</em>.
 * Closing it releases the pixel data. Image sequences can be large and the number of images
 * held in memory at once is bounded by the writer so each buffer should be closed as soon as
 * it's no longer needed rather than left to the garbage collector.
 * </p>
 *
 * <h2>Ownership</h2>
 *
 * <p>
 * An {@link ImageBuffer} has exactly one owner at a time. When it's handed to something else
 * that takes over responsibility for closing it (a sequence writer, for example) from inside a
 * try-with-resource block, call {@link #returnMe()} so the enclosing block doesn't close it:
 * </p>
 *
 * <pre>
 * <code>
 * try(ImageBuffer image = ImageBuffer.allocate(geometry);) {
 *     fill(image);
 *     writer.submit(image.returnMe(), index);
 * }
 * </code>
 * </pre>
 *
 * <h3>Tracking memory leaks</h3>
 *
 * Setting the environment variable {@code SEQWRITE4J_TRACK_MEMORY_LEAKS="true"} or the system property
 * {@code -Dseqwrite4j.TRACK_MEMORY_LEAKS=true} records where each {@link ImageBuffer} was instantiated
 * so that if one is eventually collected without being closed a {@code debug} level log message
 * identifies it.
 */
public class ImageBuffer implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageBuffer.class);
    protected static final boolean TRACK_MEMORY_LEAKS;

    static {
        final String sysOpTRACKMEMLEAKS = System.getProperty("seqwrite4j.TRACK_MEMORY_LEAKS");
        final boolean sysOpSet = sysOpTRACKMEMLEAKS != null;
        boolean track = ("".equals(sysOpTRACKMEMLEAKS) || Boolean.parseBoolean(sysOpTRACKMEMLEAKS));
        if(!sysOpSet)
            track = Boolean.parseBoolean(System.getenv("SEQWRITE4J_TRACK_MEMORY_LEAKS"));

        TRACK_MEMORY_LEAKS = track;
    }

    private final ImageGeometry geometry;
    private ByteBuffer data;
    private boolean skipCloseOnceForReturn = false;
    private boolean deletedAlready = false;

    protected final RuntimeException stackTrace;

    protected ImageBuffer(final ImageGeometry geometry, final ByteBuffer data) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(data, "data");
        if(data.capacity() < geometry.sizeInBytes())
            throw new IllegalArgumentException(
                "The buffer holds " + data.capacity() + " bytes but an image of " + geometry + " needs " + geometry.sizeInBytes());
        this.data = data;
        stackTrace = TRACK_MEMORY_LEAKS ? new RuntimeException("Here's where I was instantiated: ") : null;
    }

    /**
     * Allocate a zero filled image. <b>Note: The caller owns the ImageBuffer returned</b>
     */
    public static ImageBuffer allocate(final ImageGeometry geometry) {
        final long size = geometry.sizeInBytes();
        if(size > Integer.MAX_VALUE)
            throw new IllegalArgumentException("An image of " + geometry + " is too large for a single buffer");
        return new ImageBuffer(geometry, ByteBuffer.allocateDirect((int)size).order(ByteOrder.nativeOrder()));
    }

    public static ImageBuffer allocate(final int width, final int height, final int channels, final BitDepth depth) {
        return allocate(new ImageGeometry(width, height, channels, depth));
    }

    /**
     * Take over an existing buffer of pixel data. The data isn't copied. <b>Note: The caller owns
     * the ImageBuffer returned</b>
     */
    public static ImageBuffer wrap(final ImageGeometry geometry, final ByteBuffer data) {
        return new ImageBuffer(geometry, data);
    }

    public ImageGeometry geometry() {
        return geometry;
    }

    public int width() {
        return geometry.width;
    }

    public int height() {
        return geometry.height;
    }

    public int channels() {
        return geometry.channels;
    }

    public BitDepth depth() {
        return geometry.depth;
    }

    /**
     * The pixel data. The returned buffer is only valid until this {@link ImageBuffer} is closed.
     *
     * @throws IllegalStateException if the {@link ImageBuffer} has already been closed.
     */
    public synchronized ByteBuffer data() {
        if(deletedAlready)
            throw new IllegalStateException("Attempt to access the data of an " + ImageBuffer.class.getSimpleName() + " that's been closed.");
        return data;
    }

    public synchronized boolean isClosed() {
        return deletedAlready;
    }

    /**
     * <p>
     * Hand this {@link ImageBuffer} to a new owner from inside a try-with-resource. The next
     * {@link #close()} is skipped so the enclosing block doesn't release the data out from
     * under the new owner.
     * </p>
     *
     * <p>
     * Note: if you call {@link ImageBuffer#returnMe()} and don't actually pass the result to
     * something that will close it, you will leak the image.
     * </p>
     */
    public synchronized ImageBuffer returnMe() {
        // hacky, yet efficient.
        skipCloseOnceForReturn = true;
        return this;
    }

    @Override
    public synchronized void close() {
        if(skipCloseOnceForReturn) {
            skipCloseOnceForReturn = false; // next close counts.
            return;
        }
        if(deletedAlready) {
            LOGGER.warn("{} being closed twice at ", ImageBuffer.class.getSimpleName(), new RuntimeException());
            if(TRACK_MEMORY_LEAKS)
                LOGGER.warn("TRACKING: created at: ", stackTrace);
            return;
        }
        data = null;
        deletedAlready = true;
    }

    @Override
    public String toString() {
        return ImageBuffer.class.getSimpleName() + ": (" + getClass().getName() + "@" + Integer.toHexString(hashCode()) + ") " + geometry;
    }

    @Override
    @SuppressWarnings("deprecation")
    protected void finalize() throws Throwable {
        if(!isClosed()) {
            LOGGER.debug("Finalizing an {} that hasn't been closed.", ImageBuffer.class.getSimpleName());
            if(TRACK_MEMORY_LEAKS)
                LOGGER.debug("Here's where I was instantiated: ", stackTrace);
        }
    }
}
