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

import java.io.IOException;

import ai.kognition.seqwrite4j.image.ImageBuffer;

/**
 * Appends one image to the underlying container. It's only ever called from the writer's
 * single worker thread, one image at a time and in index order.
 */
@FunctionalInterface
public interface WriteHook {

    /**
     * @param writer the writer doing the writing.
     * @param image the image to append. The writer closes it as soon as this returns so
     *            it must not be retained.
     * @param framesWritten the number of images already in the container, which is the
     *            position this one goes in. This can be less than the image's index when
     *            earlier indices were skipped.
     * @throws IOException (or any {@link RuntimeException}) when the append fails. The
     *             writer fails the whole sequence.
     */
    public void write(SequenceWriter writer, ImageBuffer image, int framesWritten) throws IOException;
}
