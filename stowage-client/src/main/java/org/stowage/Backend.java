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
package org.stowage;

import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * <p>
 *     The raw operations of a storage provider. Paths handed to a backend are always
 *     normalized (see {@link org.stowage.utils.StoragePaths#normalize(String)}).
 * </p>
 *
 * <p>
 *     A backend never throws for an operation that simply did not happen: it returns
 *     {@code Optional.empty()} or {@code false}. A successful result describes the object
 *     as the backend sees it after the operation, with whatever metadata it has at hand.
 * </p>
 */
public interface Backend
{
    String VISIBILITY_PUBLIC = "public";

    String VISIBILITY_PRIVATE = "private";

    /**
     * Check whether a path exists
     *
     * @param path path to check
     * @return descriptor of the object or {@code empty()} if it does not exist
     */
    Optional<ObjectDescriptor> has(String path);

    /**
     * Write a new file
     *
     * @param path       path of the file
     * @param contents   file contents
     * @param visibility visibility to apply
     * @return descriptor of the written file or {@code empty()} on failure
     */
    Optional<ObjectDescriptor> write(String path, byte[] contents, String visibility);

    /**
     * Write a new file from a stream. The stream is not closed.
     *
     * @param path       path of the file
     * @param stream     source of the contents
     * @param visibility visibility to apply
     * @return descriptor of the written file or {@code empty()} on failure
     */
    Optional<ObjectDescriptor> writeStream(String path, InputStream stream, String visibility);

    /**
     * Replace the contents of an existing file
     *
     * @param path     path of the file
     * @param contents new contents
     * @return descriptor of the updated file or {@code empty()} on failure
     */
    Optional<ObjectDescriptor> update(String path, byte[] contents);

    /**
     * Replace the contents of an existing file from a stream. The stream is not closed.
     *
     * @param path   path of the file
     * @param stream source of the new contents
     * @return descriptor of the updated file or {@code empty()} on failure
     */
    Optional<ObjectDescriptor> updateStream(String path, InputStream stream);

    /**
     * Read a file
     *
     * @param path path of the file
     * @return descriptor carrying {@link ObjectDescriptor#getContents()} or {@code empty()} on failure
     */
    Optional<ObjectDescriptor> read(String path);

    /**
     * Open a file for reading
     *
     * @param path path of the file
     * @return descriptor carrying {@link ObjectDescriptor#getStream()} or {@code empty()} on failure
     */
    Optional<ObjectDescriptor> readStream(String path);

    boolean rename(String path, String newPath);

    boolean delete(String path);

    /**
     * Delete a directory and everything below it
     *
     * @param dirname directory path
     * @return true on success
     */
    boolean deleteDir(String dirname);

    /**
     * Create a directory, including missing parents
     *
     * @param dirname    directory path
     * @param visibility visibility to apply
     * @return descriptor of the directory or {@code empty()} on failure
     */
    Optional<ObjectDescriptor> createDir(String dirname, String visibility);

    /**
     * List the objects of a directory. The result is a full snapshot: every child (or, when
     * <code>recursive</code>, every descendant) that exists at the time of the call.
     *
     * @param directory directory path
     * @param recursive true to descend into subdirectories
     * @return the listing or {@code empty()} on failure
     */
    Optional<List<ObjectDescriptor>> listContents(String directory, boolean recursive);

    Optional<ObjectDescriptor> getMetadata(String path);

    Optional<ObjectDescriptor> getMimetype(String path);

    Optional<ObjectDescriptor> getTimestamp(String path);

    Optional<ObjectDescriptor> getVisibility(String path);

    Optional<ObjectDescriptor> getSize(String path);

    Optional<ObjectDescriptor> setVisibility(String path, String visibility);
}
