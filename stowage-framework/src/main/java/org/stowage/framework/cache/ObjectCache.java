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

import org.stowage.ObjectDescriptor;
import java.util.List;
import java.util.Optional;

/**
 * <p>
 *     The in-memory view of a backend's namespace: one {@link ObjectRecord} per known path, the paths
 *     known to be absent, and which directories have a complete listing (shallow or recursive).
 * </p>
 *
 * <p>
 *     Every method answers from memory only. A cache never calls the backend; it is told about backend
 *     results through {@link #upsert(ObjectDescriptor, boolean)}, {@link #storeListing(String, boolean, List)}
 *     and the removal methods.
 * </p>
 */
public interface ObjectCache
{
    /**
     * Return a new standard cache instance
     *
     * @return cache instance
     */
    static ObjectCache standard()
    {
        return new StandardObjectCache(true);
    }

    /**
     * Return a new cache instance that does not retain file contents. i.e. records
     * returned by this cache will always return {@code null} for {@link ObjectRecord#getContents()}.
     *
     * @return cache instance that does not retain contents
     */
    static ObjectCache contentsNotCached()
    {
        return new StandardObjectCache(false);
    }

    /**
     * Three-valued existence check
     *
     * @param path path to check
     * @return {@link Existence#UNKNOWN} when only the backend can tell
     */
    Existence has(String path);

    /**
     * Returns true if the cached listing of the directory is exhaustive for the given mode.
     * A recursive listing also satisfies a shallow query.
     *
     * @param directory directory path
     * @param recursive listing mode
     * @return true/false
     */
    boolean isComplete(String directory, boolean recursive);

    /**
     * Merge a backend result into the record for its path. When <code>confirmed</code> the path is known
     * to exist: the record is created if needed and any absence marker on the path or its ancestors is
     * cleared. Otherwise the fields are merged only into an existing record.
     *
     * @param descriptor backend result
     * @param confirmed  true if the path is known to exist
     * @return the record after the merge or {@code empty()} if nothing was recorded
     */
    Optional<ObjectRecord> upsert(ObjectDescriptor descriptor, boolean confirmed);

    /**
     * Record a directory for every ancestor of the path that is not already known. The synthesized
     * directories are not marked complete.
     *
     * @param path path whose ancestors must exist
     */
    void ensureParentDirectories(String path);

    /**
     * Forget the record for the path, mark it absent and unmark the completeness of its parent
     *
     * @param path path that was removed
     */
    void remove(String path);

    /**
     * Forget the directory and everything cached below it, mark it absent and unmark the completeness
     * of its ancestors
     *
     * @param directory directory that was removed
     */
    void removeDirectoryRecursive(String directory);

    /**
     * Move the record at <code>from</code> to <code>to</code>. Cached descendants of either path are
     * invalidated, not rewritten. <code>from</code> becomes absent.
     *
     * @param from old path
     * @param to   new path
     */
    void rename(String from, String to);

    /**
     * Merge a full backend listing and mark the directory complete for the given mode. A recursive
     * listing also marks every listed subdirectory recursively complete. Cached records in the listed
     * scope that the listing does not contain are dropped.
     *
     * @param directory directory that was listed
     * @param recursive listing mode
     * @param entries   backend listing
     * @return the cached listing after the merge
     */
    List<ObjectRecord> storeListing(String directory, boolean recursive, List<ObjectDescriptor> entries);

    /**
     * Return the known records below the directory, sorted by path. Only authoritative
     * when {@link #isComplete(String, boolean)} holds.
     *
     * @param directory directory path
     * @param recursive true for every descendant, false for immediate children only
     * @return records
     */
    List<ObjectRecord> listing(String directory, boolean recursive);

    /**
     * Forget the cached contents of a file whose bytes changed to something unknown
     *
     * @param path file path
     */
    void invalidateContents(String path);

    /**
     * Reset the cache to no records, no absence markers and no complete directories
     */
    void flush();

    /**
     * Return a record from the cache
     *
     * @param path path to get
     * @return record or {@code empty()}
     */
    Optional<ObjectRecord> get(String path);

    Optional<byte[]> contents(String path);

    Optional<String> mimetype(String path);

    Optional<Long> timestamp(String path);

    Optional<String> visibility(String path);

    Optional<Long> size(String path);

    /**
     * Return the current number of records
     *
     * @return number of records
     */
    int size();

    /**
     * Capture the full state of the cache
     *
     * @return snapshot
     */
    CacheSnapshot snapshot();

    /**
     * Replace the full state of the cache
     *
     * @param snapshot state to load
     */
    void restore(CacheSnapshot snapshot);
}
