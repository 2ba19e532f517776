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

public class SeqWriterException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * The state of the writer when the exception was raised. {@code null} if the writer had
     * not reached a final status yet.
     */
    public final WriteStatus status;

    public SeqWriterException(final String message) {
        super(message);
        this.status = null;
    }

    public SeqWriterException(final String message, final Throwable cause) {
        super(message, cause);
        this.status = null;
    }

    public SeqWriterException(final WriteStatus status, final String message) {
        super((status == null) ? message : (status + "(" + status.code + "), " + message));
        this.status = status;
    }
}
