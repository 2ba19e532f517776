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

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the progress of several output sequences fed from the same reservations. Slots
 * are assigned on first sight of each output. Not thread safe, it's only ever used while
 * holding the {@link MemoryThrottle}'s lock.
 */
class OutputRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(OutputRegistry.class);

    private final SequenceTarget[] sequences;
    private final int[] highest;

    // index -> how many outputs have reported it so far
    private final Map<Integer, Integer> reported = new HashMap<>();

    OutputRegistry(final int numberOfOutputs) {
        sequences = new SequenceTarget[numberOfOutputs];
        highest = new int[numberOfOutputs];
    }

    int size() {
        return sequences.length;
    }

    /**
     * @return the slot for the target, or -1 if every slot is already taken by another output.
     */
    int slotFor(final SequenceTarget target) {
        for(int i = 0; i < sequences.length; i++) {
            if(sequences[i] == null) {
                sequences[i] = target;
                highest[i] = -1;
                return i;
            }
            if(sequences[i] == target)
                return i;
        }
        LOGGER.error("### {} isn't one of the {} registered outputs. This should never happen. ###", target, sequences.length);
        return -1;
    }

    int highestIndex(final SequenceTarget target) {
        for(int i = 0; i < sequences.length; i++) {
            if(sequences[i] == target)
                return highest[i];
        }
        return -1;
    }

    /**
     * Record that {@code target} is done with {@code index}.
     *
     * @return true when this was the last output to report {@code index} and the slot should
     *         be given back.
     */
    boolean indexFreed(final SequenceTarget target, final int index) {
        final int slot = slotFor(target);
        if(slot < 0)
            return true; // unknown output. Give the slot back rather than strand a producer.

        if(highest[slot] + 1 != index)
            LOGGER.error("inconsistent index in memory management for {} ({} for expected {})", target, index, highest[slot] + 1);
        if(index > highest[slot])
            highest[slot] = index;

        final int count = reported.merge(index, 1, Integer::sum);
        if(count < sequences.length)
            return false;

        reported.remove(index);
        LOGGER.trace("\tgot all outputs notified for index {}, signaling", index);
        return true;
    }
}
