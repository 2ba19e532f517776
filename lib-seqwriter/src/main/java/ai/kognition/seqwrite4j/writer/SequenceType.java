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

/**
 * Single-file sequence containers. Both need strictly sequential appends from one writer.
 */
public enum SequenceType {
    /**
     * A FITS cube. Images of different width and height can be stored as separate
     * extensions when heterogeneous sequences are allowed.
     */
    FITSEQ(true),

    /**
     * A SER video file. Every frame must have exactly the same geometry.
     */
    SER(false);

    public final boolean canHoldDifferentSizes;

    private SequenceType(final boolean canHoldDifferentSizes) {
        this.canHoldDifferentSizes = canHoldDifferentSizes;
    }
}
