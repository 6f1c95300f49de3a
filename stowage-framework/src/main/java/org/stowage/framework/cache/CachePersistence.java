/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.stowage.framework.cache;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable storage for an {@link ObjectCache}: loaded once when a filesystem is built and
 * saved when it is closed
 */
public interface CachePersistence
{
    /**
     * Returns a persistence that keeps nothing
     *
     * @return no-op persistence
     */
    static CachePersistence none()
    {
        return new CachePersistence()
        {
            @Override
            public Optional<CacheSnapshot> load()
            {
                return Optional.empty();
            }

            @Override
            public void save(CacheSnapshot snapshot)
            {
                // NOP
            }
        };
    }

    /**
     * @return the last saved snapshot or {@code empty()} if there is none
     * @throws IOException errors reading the snapshot
     */
    Optional<CacheSnapshot> load() throws IOException;

    /**
     * @param snapshot state to save
     * @throws IOException errors writing the snapshot
     */
    void save(CacheSnapshot snapshot) throws IOException;
}
