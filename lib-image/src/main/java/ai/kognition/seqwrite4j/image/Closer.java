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

package ai.kognition.seqwrite4j.image;

import static net.dempsy.util.Functional.uncheck;

import java.util.LinkedList;
import java.util.List;

/**
 * Manage resources from a single place. Resources are closed in the reverse of the
 * order they were added.
 */
public class Closer implements AutoCloseable {
    private final List<AutoCloseable> toClose = new LinkedList<>();

    public <T extends AutoCloseable> T add(final T resource) {
        if(resource != null)
            toClose.add(0, resource);
        return resource;
    }

    /**
     * Stop managing the given resource, typically because its ownership was passed on.
     *
     * @return the resource
     */
    public <T extends AutoCloseable> T release(final T resource) {
        toClose.remove(resource);
        return resource;
    }

    public int size() {
        return toClose.size();
    }

    @Override
    public void close() {
        toClose.stream().forEach(r -> uncheck(() -> r.close()));
        toClose.clear();
    }
}
