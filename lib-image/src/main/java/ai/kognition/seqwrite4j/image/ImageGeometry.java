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

import java.util.Objects;

/**
 * The shape of an image: width, height, number of channels (layers) and sample type.
 */
public final class ImageGeometry {
    public final int width;
    public final int height;
    public final int channels;
    public final BitDepth depth;

    public ImageGeometry(final int width, final int height, final int channels, final BitDepth depth) {
        if(width <= 0 || height <= 0)
            throw new IllegalArgumentException("Image dimensions must be positive but were " + width + "x" + height);
        if(channels <= 0)
            throw new IllegalArgumentException("An image needs at least one channel but " + channels + " were requested");
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.depth = Objects.requireNonNull(depth, "depth");
    }

    public long sizeInBytes() {
        return (long)width * height * channels * depth.bytesPerSample;
    }

    /**
     * Whether an image of this geometry can be appended to a sequence whose images have
     * the {@code established} geometry. The channel count and sample type always have to match.
     * The width and height have to match unless {@code allowDifferentSize} is set.
     */
    public boolean compatibleWith(final ImageGeometry established, final boolean allowDifferentSize) {
        if(channels != established.channels || depth != established.depth)
            return false;
        return allowDifferentSize || (width == established.width && height == established.height);
    }

    @Override
    public boolean equals(final Object o) {
        if(this == o)
            return true;
        if(!(o instanceof ImageGeometry))
            return false;
        final ImageGeometry other = (ImageGeometry)o;
        return width == other.width && height == other.height && channels == other.channels && depth == other.depth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, channels, depth);
    }

    @Override
    public String toString() {
        return width + "x" + height + ", " + channels + " layer(s), " + depth.bits() + " bits";
    }
}
