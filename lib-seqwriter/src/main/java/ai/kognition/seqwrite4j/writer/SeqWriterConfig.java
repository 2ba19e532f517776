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

import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.seqwrite4j.util.PropertiesUtils;

/**
 * <p>
 * Runtime settings for sequence writing. {@link #load()} reads the {@value #RESOURCE} classpath
 * resource and then applies any system properties in the {@value #SECTION} section over it,
 * so {@code -Dseqwriter.maxActiveBlocks=8} wins over the file.
 * </p>
 *
 * <ul>
 * <li>{@code seqwriter.allowHeterogeneousFitseq} - let FITS cubes hold images of different
 * widths and heights. SER files never allow it. Default {@code false}.</li>
 * <li>{@code seqwriter.maxActiveBlocks} - initial ceiling on images held in memory between
 * production and writing. Zero or less is unlimited. Default {@code 0}.</li>
 * <li>{@code seqwriter.queueFactor} - upper bound on the writer queue as a multiple of the number
 * of processing threads when the ceiling is computed from a memory budget. Default {@code 3}.</li>
 * </ul>
 */
public final class SeqWriterConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(SeqWriterConfig.class);

    public static final String RESOURCE = "seqwrite4j.properties";
    public static final String SECTION = "seqwriter";

    public static final String ALLOW_HETEROGENEOUS_FITSEQ = "allowHeterogeneousFitseq";
    public static final String MAX_ACTIVE_BLOCKS = "maxActiveBlocks";
    public static final String QUEUE_FACTOR = "queueFactor";

    public static final int DEFAULT_QUEUE_FACTOR = 3;

    public final boolean allowHeterogeneousFitseq;
    public final int maxActiveBlocks;
    public final int queueFactor;

    public SeqWriterConfig(final boolean allowHeterogeneousFitseq, final int maxActiveBlocks, final int queueFactor) {
        if(queueFactor <= 0)
            throw new IllegalArgumentException("The " + QUEUE_FACTOR + " must be positive but was " + queueFactor);
        this.allowHeterogeneousFitseq = allowHeterogeneousFitseq;
        this.maxActiveBlocks = maxActiveBlocks;
        this.queueFactor = queueFactor;
    }

    public static SeqWriterConfig defaults() {
        return new SeqWriterConfig(false, 0, DEFAULT_QUEUE_FACTOR);
    }

    public static SeqWriterConfig load() {
        final Properties props = new Properties();
        PropertiesUtils.loadFromClasspath(props, RESOURCE);
        PropertiesUtils.overrideFromSystem(props, SECTION);
        final SeqWriterConfig ret = fromProperties(props);
        LOGGER.debug("Loaded {}", ret);
        return ret;
    }

    /**
     * Build a config from the {@value #SECTION} section of the given properties. Keys outside
     * the section are ignored.
     */
    public static SeqWriterConfig fromProperties(final Properties props) {
        final Properties section = PropertiesUtils.getSection(props, SECTION, true);
        return new SeqWriterConfig(
            PropertiesUtils.getBoolean(section, ALLOW_HETEROGENEOUS_FITSEQ, false),
            PropertiesUtils.getInt(section, MAX_ACTIVE_BLOCKS, 0),
            PropertiesUtils.getInt(section, QUEUE_FACTOR, DEFAULT_QUEUE_FACTOR));
    }

    /**
     * A new throttle with this config's initial ceiling.
     */
    public MemoryThrottle newThrottle() {
        return new MemoryThrottle(maxActiveBlocks);
    }

    @Override
    public String toString() {
        return "SeqWriterConfig [allowHeterogeneousFitseq=" + allowHeterogeneousFitseq + ", maxActiveBlocks=" + maxActiveBlocks
            + ", queueFactor=" + queueFactor + "]";
    }
}
