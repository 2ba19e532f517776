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
 * The final outcome of writing a sequence.
 */
public enum WriteStatus {
    /**
     * Every expected image was written, or the number of images wasn't known up front and
     * what was written is taken as the final count.
     */
    OK(0),

    /**
     * Fatal. The write hook failed, an image didn't match the sequence, or an image arrived
     * for an index that was already passed. Never retried by the writer.
     */
    WRITE_ERROR(1),

    /**
     * The run was stopped early or ended with images still waiting for a missing index.
     * Nothing was corrupted but the sequence is shorter than requested.
     */
    INCOMPLETE(2);

    public final int code;

    private WriteStatus(final int code) {
        this.code = code;
    }
}
