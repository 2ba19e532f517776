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

package ai.kognition.seqwrite4j.util;

/**
 * Wall clock stopwatch used to report how long a sequence took to write. Not thread safe;
 * a {@link Timer} belongs to the thread that starts it.
 */
public final class Timer {
    private long startTime;
    private long endTime;
    private boolean running = false;

    public static final long nanoSecondsPerSecond = 1000000000L;
    public static final double secondsPerNanosecond = 1.0D / nanoSecondsPerSecond;

    public static Timer started() {
        final Timer ret = new Timer();
        ret.start();
        return ret;
    }

    public final void start() {
        startTime = System.nanoTime();
        running = true;
    }

    public final String stop() {
        endTime = System.nanoTime();
        running = false;
        return toString();
    }

    /**
     * Seconds between {@link #start()} and {@link #stop()}, or until now if the timer
     * hasn't been stopped.
     */
    public final float getSeconds() {
        final long end = running ? System.nanoTime() : endTime;
        return (float)((end - startTime) * secondsPerNanosecond);
    }

    /**
     * Average rate of {@code count} events over the timed period. Zero if no time has elapsed.
     */
    public final double rate(final long count) {
        final float secs = getSeconds();
        return secs <= 0.0f ? 0.0D : count / (double)secs;
    }

    @Override
    public final String toString() {
        return String.format("%.3f", getSeconds());
    }
}
