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

import java.util.Objects;

/**
 * Identifies an output sequence and carries the container properties the writer needs to
 * validate incoming images. Two targets are the same output only if they're the same
 * instance; the name is for logging.
 */
public final class SequenceTarget {
    public final String name;
    public final SequenceType type;
    private final boolean allowHeterogeneous;

    public SequenceTarget(final String name, final SequenceType type, final boolean allowHeterogeneous) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.allowHeterogeneous = allowHeterogeneous;
    }

    public static SequenceTarget fitseq(final String name, final SeqWriterConfig config) {
        return new SequenceTarget(name, SequenceType.FITSEQ, config.allowHeterogeneousFitseq);
    }

    public static SequenceTarget fitseq(final String name) {
        return new SequenceTarget(name, SequenceType.FITSEQ, false);
    }

    public static SequenceTarget ser(final String name) {
        return new SequenceTarget(name, SequenceType.SER, false);
    }

    /**
     * Whether images with a width and height different from the first one may be added.
     * Only ever true for containers that can hold it.
     */
    public boolean allowsDifferentSizes() {
        return type.canHoldDifferentSizes && allowHeterogeneous;
    }

    @Override
    public String toString() {
        return name + " (" + type + ")";
    }
}
