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
package org.stowage.framework;

import org.stowage.Backend;
import org.stowage.ObjectType;
import org.stowage.StowageException;
import org.stowage.framework.cache.ObjectCache;
import org.stowage.framework.cache.ObjectRecord;
import org.stowage.framework.extension.Extension;
import org.stowage.framework.handle.Handler;
import java.io.Closeable;
import java.io.InputStream;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * <p>
 *     File and directory operations over a {@link Backend}, accelerated by an {@link ObjectCache}.
 *     Create instances with {@link FilesystemFactory}.
 * </p>
 *
 * <p>
 *     Paths are normalized before use: "a/b/" and "/a/b" name the same object. Operations that require
 *     a path to exist throw {@link StowageException.NotFoundException}; operations that require it to be
 *     absent throw {@link StowageException.ExistsException}. Both are raised before the backend is touched.
 *     When the backend itself fails, the operation returns {@code false} or {@code empty()} and the cache
 *     is left as it was.
 * </p>
 *
 * <p>
 *     {@link ObjectRecord}s returned by listings and metadata lookups never carry file contents. Use
 *     {@link #read(String)}, which returns a copy.
 * </p>
 */
public interface Filesystem extends Closeable
{
    /**
     * Check whether a path exists. Answered from the cache when it knows, from the backend otherwise.
     *
     * @param path path to check
     * @return true if the path exists
     */
    boolean has(String path);

    /**
     * Write a new file with the default visibility
     *
     * @param path     path of the file
     * @param contents file contents
     * @return true on success
     * @throws StowageException.ExistsException if the path exists
     */
    boolean write(String path, byte[] contents);

    /**
     * Write a new file
     *
     * @param path       path of the file
     * @param contents   file contents
     * @param visibility visibility of the file
     * @return true on success
     * @throws StowageException.ExistsException if the path exists
     */
    boolean write(String path, byte[] contents, String visibility);

    boolean writeStream(String path, InputStream stream);

    /**
     * Write a new file from a stream. The stream is not closed.
     *
     * @param path       path of the file
     * @param stream     source of the contents
     * @param visibility visibility of the file
     * @return true on success
     * @throws StowageException.ExistsException if the path exists
     */
    boolean writeStream(String path, InputStream stream, String visibility);

    boolean put(String path, byte[] contents);

    /**
     * Create a file or replace the contents of an existing one
     *
     * @param path       path of the file
     * @param contents   file contents
     * @param visibility visibility to use when the file is created
     * @return true on success
     */
    boolean put(String path, byte[] contents, String visibility);

    /**
     * Replace the contents of an existing file
     *
     * @param path     path of the file
     * @param contents new contents
     * @return true on success
     * @throws StowageException.NotFoundException if the path does not exist
     */
    boolean update(String path, byte[] contents);

    /**
     * Replace the contents of an existing file from a stream. The stream is not closed.
     *
     * @param path   path of the file
     * @param stream source of the new contents
     * @return true on success
     * @throws StowageException.NotFoundException if the path does not exist
     */
    boolean updateStream(String path, InputStream stream);

    /**
     * Read a file
     *
     * @param path path of the file
     * @return contents or {@code empty()} if the backend could not read them
     * @throws StowageException.NotFoundException if the path does not exist
     */
    Optional<byte[]> read(String path);

    /**
     * Open a file for reading. The caller must close the stream.
     *
     * @param path path of the file
     * @return stream or {@code empty()} if the backend could not open it
     * @throws StowageException.NotFoundException if the path does not exist
     */
    Optional<InputStream> readStream(String path);

    /**
     * Rename a file or directory
     *
     * @param path    current path
     * @param newPath new path
     * @return true on success
     * @throws StowageException.NotFoundException if <code>path</code> does not exist
     * @throws StowageException.ExistsException if <code>newPath</code> exists
     */
    boolean rename(String path, String newPath);

    /**
     * Delete a file
     *
     * @param path path of the file
     * @return true on success
     * @throws StowageException.NotFoundException if the path does not exist
     */
    boolean delete(String path);

    /**
     * Delete a directory and everything below it
     *
     * @param dirname directory path, never the root
     * @return true on success
     * @throws StowageException.NotFoundException if the directory does not exist
     */
    boolean deleteDir(String dirname);

    boolean createDir(String dirname);

    /**
     * Create a directory, including missing parents. Creating an existing directory succeeds.
     *
     * @param dirname    directory path
     * @param visibility visibility of created directories
     * @return true on success
     */
    boolean createDir(String dirname, String visibility);

    /**
     * List a directory. Served from the cache once a listing in the same mode (or a recursive one)
     * has been fetched and nothing below the directory has changed since.
     *
     * @param directory directory path
     * @param recursive true to include every descendant
     * @return records sorted by path, or {@code empty()} if the backend could not list the directory
     */
    Optional<List<ObjectRecord>> listContents(String directory, boolean recursive);

    Optional<List<String>> listPaths(String directory, boolean recursive);

    /**
     * List a directory and fetch extra metadata for every file in it
     *
     * @param fields    metadata field names, see {@link MetadataField}
     * @param directory directory path
     * @param recursive true to include every descendant
     * @return records sorted by path, or {@code empty()} if the backend could not list the directory
     * @throws IllegalArgumentException for an unknown field name
     */
    Optional<List<ObjectRecord>> listWith(Collection<String> fields, String directory, boolean recursive);

    /**
     * Return the metadata known for a path, fetching it from the backend when nothing is cached
     *
     * @param path the path
     * @return metadata or {@code empty()} if the backend could not provide it
     * @throws StowageException.NotFoundException if the path does not exist
     */
    Optional<ObjectRecord> getMetadata(String path);

    /**
     * Return the metadata of a path including the requested fields
     *
     * @param path   the path
     * @param fields metadata field names, see {@link MetadataField}
     * @return metadata or {@code empty()} if the backend could not provide the base metadata
     * @throws IllegalArgumentException for an unknown field name
     * @throws StowageException.NotFoundException if the path does not exist
     */
    Optional<ObjectRecord> getWithMetadata(String path, Collection<String> fields);

    Optional<String> getMimetype(String path);

    /**
     * @param path the path
     * @return last modified time in seconds since the epoch
     */
    Optional<Long> getTimestamp(String path);

    Optional<String> getVisibility(String path);

    Optional<Long> getSize(String path);

    /**
     * Change the visibility of a path
     *
     * @param path       the path
     * @param visibility new visibility
     * @return true on success
     * @throws StowageException.NotFoundException if the path does not exist
     */
    boolean setVisibility(String path, String visibility);

    /**
     * Return a handle for the path, choosing {@link org.stowage.framework.handle.FileHandler} or
     * {@link org.stowage.framework.handle.DirectoryHandler} from its metadata
     *
     * @param path the path
     * @return handle or {@code empty()} if the metadata could not be fetched
     * @throws StowageException.NotFoundException if the path does not exist
     */
    Optional<Handler> resolve(String path);

    /**
     * Return a handle of the given kind without looking the path up
     *
     * @param path the path
     * @param kind kind of handle
     * @return handle
     */
    Handler resolve(String path, ObjectType kind);

    /**
     * Drop everything the cache knows
     *
     * @return this
     */
    Filesystem flushCache();

    /**
     * @param path the path
     * @throws StowageException.NotFoundException if the path does not exist
     */
    void assertPresent(String path);

    /**
     * @param path the path
     * @throws StowageException.ExistsException if the path exists
     */
    void assertAbsent(String path);

    /**
     * Register an extension operation
     *
     * @param extension the extension
     * @return this
     * @throws IllegalArgumentException if the operation name is blank or names a native operation
     */
    Filesystem addExtension(Extension extension);

    /**
     * Run an extension operation
     *
     * @param operation operation name
     * @param arguments arguments passed to the extension
     * @return the extension's result
     * @throws StowageException.ExtensionNotFoundException if no extension is registered for the operation
     */
    Object invoke(String operation, Object... arguments);

    Backend getBackend();

    ObjectCache getCache();

    String getDefaultVisibility();

    /**
     * Save the cache through the configured persistence and stop accepting operations
     */
    @Override
    void close();
}
