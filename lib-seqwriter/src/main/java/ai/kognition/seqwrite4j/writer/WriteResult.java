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
 * What {@link SequenceWriter#stop(boolean)} reports.
 */
public final class WriteResult {
    public final WriteStatus status;

    /**
     * Images actually appended to the container.
     */
    public final int framesWritten;

    /**
     * The final size of the sequence. When the expected count wasn't known, or the run was
     * stopped gracefully, this is {@link #framesWritten}.
     */
    public final int frameCount;

    /**
     * Images that were received but never written because the run ended first.
     */
    public final int abandoned;

    public WriteResult(final WriteStatus status, final int framesWritten, final int frameCount, final int abandoned) {
        this.status = status;
        this.framesWritten = framesWritten;
        this.frameCount = frameCount;
        this.abandoned = abandoned;
    }

    public boolean isOk() {
        return status == WriteStatus.OK;
    }

    @Override
    public String toString() {
        return "WriteResult [status=" + status + ", framesWritten=" + framesWritten + ", frameCount=" + frameCount + ", abandoned="
            + abandoned + "]";
    }
}
