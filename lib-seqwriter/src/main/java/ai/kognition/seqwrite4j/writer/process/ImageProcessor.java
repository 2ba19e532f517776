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

import ai.kognition.seqwrite4j.image.ImageBuffer;

/**
 * Produces the output images for one input index. Called concurrently from the
 * {@link SequenceProcessor}'s threads.
 */
@FunctionalInterface
public interface ImageProcessor {

    /**
     * @return one image per output, in the order the outputs were given to the
     *         {@link SequenceProcessor}. A {@code null} entry means that output deliberately
     *         has no image for this index. The caller owns the returned images.
     * @throws Exception when the input can't be processed. Depending on the processor's
     *             {@code stopOnError} setting this either stops the whole run or leaves
     *             a hole at this index in every output.
     */
    public ImageBuffer[] process(int index) throws Exception;
}
