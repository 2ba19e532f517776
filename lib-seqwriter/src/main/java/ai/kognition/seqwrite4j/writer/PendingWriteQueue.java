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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;

/**
 * Unbounded, unordered hand-off from producers to the writer's worker thread. Offering never
 * blocks; bounding the producers is the {@link MemoryThrottle}'s job. Termination signals go
 * through the same channel, at the back for a graceful stop or at the front for an abort.
 */
class PendingWriteQueue {
    private final LinkedBlockingDeque<PendingWrite> queue = new LinkedBlockingDeque<>();

    void push(final PendingWrite task) {
        queue.addLast(task);
    }

    /**
     * @param abort when set the signal is processed before anything already queued and
     *            everything behind it is abandoned. Otherwise it's processed after everything
     *            already queued.
     */
    void pushTermination(final boolean abort) {
        if(abort)
            queue.addFirst(PendingWrite.ABORT);
        else
            queue.addLast(PendingWrite.FINISH);
    }

    PendingWrite take() throws InterruptedException {
        return queue.takeFirst();
    }

    /**
     * Take a specific task back out of the queue.
     *
     * @return false if it was already taken by the worker.
     */
    boolean remove(final PendingWrite task) {
        return queue.removeFirstOccurrence(task);
    }

    /**
     * Empty the queue and return the real tasks that were in it. Termination signals are dropped.
     */
    List<PendingWrite> drain() {
        final List<PendingWrite> ret = new ArrayList<>();
        PendingWrite task;
        while((task = queue.pollFirst()) != null) {
            if(!task.isTermination())
                ret.add(task);
        }
        return ret;
    }

    int size() {
        return queue.size();
    }
}
