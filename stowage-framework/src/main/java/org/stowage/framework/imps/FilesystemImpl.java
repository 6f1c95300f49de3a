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
package org.stowage.framework.imps;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.stowage.Backend;
import org.stowage.ObjectDescriptor;
import org.stowage.ObjectType;
import org.stowage.StowageException;
import org.stowage.framework.Filesystem;
import org.stowage.framework.FilesystemFactory;
import org.stowage.framework.MetadataField;
import org.stowage.framework.cache.CachePersistence;
import org.stowage.framework.cache.ObjectCache;
import org.stowage.framework.cache.ObjectRecord;
import org.stowage.framework.extension.Extension;
import org.stowage.framework.extension.ExtensionRegistry;
import org.stowage.framework.handle.DirectoryHandler;
import org.stowage.framework.handle.FileHandler;
import org.stowage.framework.handle.Handler;
import org.stowage.utils.StoragePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

public class FilesystemImpl implements Filesystem
{
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final Backend backend;
    private final ObjectCache cache;
    private final CachePersistence cachePersistence;
    private final String defaultVisibility;
    private final ExtensionRegistry extensions;
    private final Map<MetadataField, Function<String, Optional<?>>> metadataGetters;
    private final AtomicReference<State> state = new AtomicReference<>(State.STARTED);

    static final Set<String> NATIVE_OPERATIONS = ImmutableSet.of(
        "has", "write", "writeStream", "put", "update", "updateStream", "read", "readStream",
        "rename", "delete", "deleteDir", "createDir", "listContents", "listPaths", "listWith",
        "getMetadata", "getWithMetadata", "getMimetype", "getTimestamp", "getVisibility", "getSize",
        "setVisibility", "resolve", "flushCache", "assertPresent", "assertAbsent", "addExtension",
        "invoke", "close"
    );

    private enum State
    {
        STARTED,
        CLOSED
    }

    public FilesystemImpl(FilesystemFactory.Builder builder)
    {
        backend = Preconditions.checkNotNull(builder.getBackend(), "backend cannot be null");
        cache = builder.getCache();
        cachePersistence = builder.getCachePersistence();
        defaultVisibility = Preconditions.checkNotNull(builder.getDefaultVisibility(), "defaultVisibility cannot be null");
        extensions = new ExtensionRegistry(NATIVE_OPERATIONS);
        builder.getExtensions().forEach(extensions::register);
        metadataGetters = ImmutableMap.<MetadataField, Function<String, Optional<?>>>of(
            MetadataField.MIMETYPE, this::getMimetype,
            MetadataField.TIMESTAMP, this::getTimestamp,
            MetadataField.VISIBILITY, this::getVisibility,
            MetadataField.SIZE, this::getSize
        );

        try
        {
            cachePersistence.load().ifPresent(cache::restore);
        }
        catch ( IOException e )
        {
            log.error("Could not load the saved cache, starting with an empty one", e);
        }
    }

    @Override
    public boolean has(String path)
    {
        String fixedPath = fixPath(path);
        switch ( cache.has(fixedPath) )
        {
            case PRESENT:
            {
                return true;
            }

            case ABSENT:
            {
                return false;
            }

            default:
            {
                break;
            }
        }

        log.debug("Existence of {} not cached, asking the backend", fixedPath);
        Optional<ObjectDescriptor> descriptor = backend.has(fixedPath);
        descriptor.ifPresent(found -> cache.upsert(found, true));
        return descriptor.isPresent();
    }

    @Override
    public boolean write(String path, byte[] contents)
    {
        return write(path, contents, defaultVisibility);
    }

    @Override
    public boolean write(String path, byte[] contents, String visibility)
    {
        Preconditions.checkNotNull(contents, "contents cannot be null");
        String fixedPath = fixPath(path);
        assertAbsent(fixedPath);

        Optional<ObjectDescriptor> written = backend.write(fixedPath, contents, visibility);
        if ( !written.isPresent() )
        {
            log.warn("Backend could not write {}", fixedPath);
            return false;
        }
        cache.upsert(withWrittenContents(written.get(), contents, visibility), true);
        cache.ensureParentDirectories(fixedPath);
        return true;
    }

    @Override
    public boolean writeStream(String path, InputStream stream)
    {
        return writeStream(path, stream, defaultVisibility);
    }

    @Override
    public boolean writeStream(String path, InputStream stream, String visibility)
    {
        Preconditions.checkNotNull(stream, "stream cannot be null");
        String fixedPath = fixPath(path);
        assertAbsent(fixedPath);

        Optional<ObjectDescriptor> written = backend.writeStream(fixedPath, stream, visibility);
        if ( !written.isPresent() )
        {
            log.warn("Backend could not write {} from a stream", fixedPath);
            return false;
        }
        cache.upsert(metadataOnly(written.get(), visibility), true);
        cache.ensureParentDirectories(fixedPath);
        return true;
    }

    @Override
    public boolean put(String path, byte[] contents)
    {
        return put(path, contents, defaultVisibility);
    }

    @Override
    public boolean put(String path, byte[] contents, String visibility)
    {
        if ( has(path) )
        {
            return update(path, contents);
        }
        return write(path, contents, visibility);
    }

    @Override
    public boolean update(String path, byte[] contents)
    {
        Preconditions.checkNotNull(contents, "contents cannot be null");
        String fixedPath = fixPath(path);
        assertPresent(fixedPath);

        Optional<ObjectDescriptor> updated = backend.update(fixedPath, contents);
        if ( !updated.isPresent() )
        {
            log.warn("Backend could not update {}", fixedPath);
            return false;
        }
        cache.upsert(withWrittenContents(updated.get(), contents, null), true);
        return true;
    }

    @Override
    public boolean updateStream(String path, InputStream stream)
    {
        Preconditions.checkNotNull(stream, "stream cannot be null");
        String fixedPath = fixPath(path);
        assertPresent(fixedPath);

        Optional<ObjectDescriptor> updated = backend.updateStream(fixedPath, stream);
        if ( !updated.isPresent() )
        {
            log.warn("Backend could not update {} from a stream", fixedPath);
            return false;
        }
        cache.invalidateContents(fixedPath);
        cache.upsert(metadataOnly(updated.get(), null), true);
        return true;
    }

    @Override
    public Optional<byte[]> read(String path)
    {
        String fixedPath = fixPath(path);
        assertPresent(fixedPath);

        Optional<byte[]> cached = cache.contents(fixedPath);
        if ( cached.isPresent() )
        {
            return cached.map(byte[]::clone);
        }

        log.debug("Contents of {} not cached, reading from the backend", fixedPath);
        Optional<ObjectDescriptor> descriptor = backend.read(fixedPath).filter(read -> read.getContents() != null);
        if ( !descriptor.isPresent() )
        {
            log.warn("Backend could not read {}", fixedPath);
            return Optional.empty();
        }
        cache.upsert(descriptor.get().toBuilder().stream(null).build(), true);
        return Optional.of(descriptor.get().getContents().clone());
    }

    @Override
    public Optional<InputStream> readStream(String path)
    {
        String fixedPath = fixPath(path);
        assertPresent(fixedPath);

        Optional<InputStream> stream = backend.readStream(fixedPath).map(ObjectDescriptor::getStream);
        if ( !stream.isPresent() )
        {
            log.warn("Backend could not open {} for reading", fixedPath);
        }
        return stream;
    }

    @Override
    public boolean rename(String path, String newPath)
    {
        String fixedPath = fixPath(path);
        String fixedNewPath = fixPath(newPath);
        assertPresent(fixedPath);
        assertAbsent(fixedNewPath);

        if ( !backend.rename(fixedPath, fixedNewPath) )
        {
            log.warn("Backend could not rename {} to {}", fixedPath, fixedNewPath);
            return false;
        }
        cache.rename(fixedPath, fixedNewPath);
        cache.ensureParentDirectories(fixedNewPath);
        return true;
    }

    @Override
    public boolean delete(String path)
    {
        String fixedPath = fixPath(path);
        assertPresent(fixedPath);

        if ( !backend.delete(fixedPath) )
        {
            log.warn("Backend could not delete {}", fixedPath);
            return false;
        }
        cache.remove(fixedPath);
        return true;
    }

    @Override
    public boolean deleteDir(String dirname)
    {
        String fixedPath = fixPath(dirname);
        Preconditions.checkArgument(!StoragePaths.isRoot(fixedPath), "Root directories can not be deleted");
        assertPresent(fixedPath);

        if ( !backend.deleteDir(fixedPath) )
        {
            log.warn("Backend could not delete directory {}", fixedPath);
            return false;
        }
        cache.removeDirectoryRecursive(fixedPath);
        return true;
    }

    @Override
    public boolean createDir(String dirname)
    {
        return createDir(dirname, defaultVisibility);
    }

    @Override
    public boolean createDir(String dirname, String visibility)
    {
        String fixedPath = fixPath(dirname);

        Optional<ObjectDescriptor> created = backend.createDir(fixedPath, visibility);
        if ( !created.isPresent() )
        {
            log.warn("Backend could not create directory {}", fixedPath);
            return false;
        }
        if ( !StoragePaths.isRoot(fixedPath) )
        {
            cache.upsert(created.get(), true);
            cache.ensureParentDirectories(fixedPath);
        }
        return true;
    }

    @Override
    public Optional<List<ObjectRecord>> listContents(String directory, boolean recursive)
    {
        String fixedPath = fixPath(directory);
        if ( cache.isComplete(fixedPath, recursive) )
        {
            return Optional.of(withoutContents(cache.listing(fixedPath, recursive)));
        }

        log.debug("Listing of {} (recursive: {}) not cached, asking the backend", fixedPath, recursive);
        Optional<List<ObjectDescriptor>> listing = backend.listContents(fixedPath, recursive);
        if ( !listing.isPresent() )
        {
            log.warn("Backend could not list {}", fixedPath);
            return Optional.empty();
        }

        List<ObjectDescriptor> entries = listing.get().stream()
            .filter(entry -> StoragePaths.isDescendant(fixedPath, entry.getPath()))
            .collect(Collectors.toList());
        if ( entries.size() != listing.get().size() )
        {
            log.warn("Backend listing of {} contained {} entries outside the directory", fixedPath, listing.get().size() - entries.size());
        }
        return Optional.of(withoutContents(cache.storeListing(fixedPath, recursive, entries)));
    }

    @Override
    public Optional<List<String>> listPaths(String directory, boolean recursive)
    {
        return listContents(directory, recursive).map(records -> records.stream()
            .map(ObjectRecord::getPath)
            .collect(ImmutableList.toImmutableList()));
    }

    @Override
    public Optional<List<ObjectRecord>> listWith(Collection<String> fields, String directory, boolean recursive)
    {
        Set<MetadataField> metadataFields = toMetadataFields(fields);
        Optional<List<ObjectRecord>> listing = listContents(directory, recursive);
        if ( !listing.isPresent() || metadataFields.isEmpty() )
        {
            return listing;
        }

        ImmutableList.Builder<ObjectRecord> enriched = ImmutableList.builder();
        for ( ObjectRecord record : listing.get() )
        {
            if ( record.getType() == ObjectType.FILE )
            {
                enriched.add(withMetadata(record.getPath(), record, metadataFields));
            }
            else
            {
                enriched.add(record);
            }
        }
        return Optional.of(enriched.build());
    }

    @Override
    public Optional<ObjectRecord> getMetadata(String path)
    {
        String fixedPath = fixPath(path);
        assertPresent(fixedPath);

        Optional<ObjectRecord> cached = cache.get(fixedPath);
        if ( cached.isPresent() )
        {
            return cached.map(ObjectRecord::withoutContents);
        }

        log.debug("Metadata of {} not cached, asking the backend", fixedPath);
        Optional<ObjectDescriptor> descriptor = backend.getMetadata(fixedPath);
        if ( !descriptor.isPresent() )
        {
            log.warn("Backend could not provide metadata for {}", fixedPath);
            return Optional.empty();
        }
        return cache.upsert(descriptor.get(), true).map(ObjectRecord::withoutContents);
    }

    @Override
    public Optional<ObjectRecord> getWithMetadata(String path, Collection<String> fields)
    {
        Set<MetadataField> metadataFields = toMetadataFields(fields);
        Optional<ObjectRecord> metadata = getMetadata(path);
        return metadata.map(record -> withMetadata(record.getPath(), record, metadataFields));
    }

    @Override
    public Optional<String> getMimetype(String path)
    {
        return getField(path, "mimetype", ObjectRecord::getMimetype, backend::getMimetype);
    }

    @Override
    public Optional<Long> getTimestamp(String path)
    {
        return getField(path, "timestamp", ObjectRecord::getTimestamp, backend::getTimestamp);
    }

    @Override
    public Optional<String> getVisibility(String path)
    {
        return getField(path, "visibility", ObjectRecord::getVisibility, backend::getVisibility);
    }

    @Override
    public Optional<Long> getSize(String path)
    {
        return getField(path, "size", ObjectRecord::getSize, backend::getSize);
    }

    @Override
    public boolean setVisibility(String path, String visibility)
    {
        Preconditions.checkNotNull(visibility, "visibility cannot be null");
        String fixedPath = fixPath(path);
        assertPresent(fixedPath);

        Optional<ObjectDescriptor> changed = backend.setVisibility(fixedPath, visibility);
        if ( !changed.isPresent() )
        {
            log.warn("Backend could not set visibility of {} to {}", fixedPath, visibility);
            return false;
        }
        cache.upsert(metadataOnly(changed.get(), visibility), true);
        return true;
    }

    @Override
    public Optional<Handler> resolve(String path)
    {
        return getMetadata(path).map(record -> resolve(record.getPath(), record.getType()));
    }

    @Override
    public Handler resolve(String path, ObjectType kind)
    {
        Preconditions.checkNotNull(kind, "kind cannot be null");
        String fixedPath = fixPath(path);
        return (kind == ObjectType.FILE) ? new FileHandler(this, fixedPath) : new DirectoryHandler(this, fixedPath);
    }

    @Override
    public Filesystem flushCache()
    {
        checkStarted();
        cache.flush();
        return this;
    }

    @Override
    public void assertPresent(String path)
    {
        String fixedPath = fixPath(path);
        if ( !has(fixedPath) )
        {
            throw new StowageException.NotFoundException(fixedPath);
        }
    }

    @Override
    public void assertAbsent(String path)
    {
        String fixedPath = fixPath(path);
        if ( has(fixedPath) )
        {
            throw new StowageException.ExistsException(fixedPath);
        }
    }

    @Override
    public Filesystem addExtension(Extension extension)
    {
        checkStarted();
        extensions.register(extension);
        return this;
    }

    @Override
    public Object invoke(String operation, Object... arguments)
    {
        checkStarted();
        return extensions.find(operation).handle(this, arguments);
    }

    @Override
    public Backend getBackend()
    {
        return backend;
    }

    @Override
    public ObjectCache getCache()
    {
        return cache;
    }

    @Override
    public String getDefaultVisibility()
    {
        return defaultVisibility;
    }

    @Override
    public void close()
    {
        if ( state.compareAndSet(State.STARTED, State.CLOSED) )
        {
            try
            {
                cachePersistence.save(cache.snapshot());
            }
            catch ( IOException e )
            {
                log.error("Could not save the cache", e);
            }
        }
    }

    private <T> Optional<T> getField(String path, String fieldName, Function<ObjectRecord, T> field, Function<String, Optional<ObjectDescriptor>> fetch)
    {
        String fixedPath = fixPath(path);
        assertPresent(fixedPath);

        Optional<T> cached = cache.get(fixedPath).map(field);
        if ( cached.isPresent() )
        {
            return cached;
        }

        log.debug("{} of {} not cached, asking the backend", fieldName, fixedPath);
        Optional<ObjectDescriptor> descriptor = fetch.apply(fixedPath);
        if ( !descriptor.isPresent() )
        {
            log.warn("Backend could not provide {} for {}", fieldName, fixedPath);
            return Optional.empty();
        }
        return cache.upsert(descriptor.get(), true).map(field);
    }

    /**
     * Fetch the given fields through the getters, then return what the cache now knows about
     * the path, falling back to <code>base</code> if the record went away in the meantime
     */
    private ObjectRecord withMetadata(String path, ObjectRecord base, Set<MetadataField> fields)
    {
        for ( MetadataField field : fields )
        {
            Optional<?> value = metadataGetters.get(field).apply(path);
            if ( !value.isPresent() )
            {
                log.debug("No {} available for {}", field.getFieldName(), path);
            }
        }
        return cache.get(path).orElse(base).withoutContents();
    }

    /**
     * Records leave the filesystem without contents: cached bytes are only handed out as copies by {@link #read(String)}
     */
    private static List<ObjectRecord> withoutContents(List<ObjectRecord> records)
    {
        return records.stream().map(ObjectRecord::withoutContents).collect(ImmutableList.toImmutableList());
    }

    private Set<MetadataField> toMetadataFields(Collection<String> fields)
    {
        Preconditions.checkNotNull(fields, "fields cannot be null");
        Set<MetadataField> metadataFields = EnumSet.noneOf(MetadataField.class);
        fields.forEach(name -> metadataFields.add(MetadataField.fromName(name)));
        return metadataFields;
    }

    /**
     * The backend result enriched with what the caller just wrote, so that the cache holds the
     * written bytes even when the backend does not echo them
     */
    private static ObjectDescriptor withWrittenContents(ObjectDescriptor descriptor, byte[] contents, String visibility)
    {
        ObjectDescriptor.Builder builder = descriptor.toBuilder()
            .contents(contents.clone())
            .stream(null);
        if ( descriptor.getSize() == null )
        {
            builder.size((long)contents.length);
        }
        if ( (descriptor.getVisibility() == null) && (visibility != null) )
        {
            builder.visibility(visibility);
        }
        return builder.build();
    }

    private static ObjectDescriptor metadataOnly(ObjectDescriptor descriptor, String visibility)
    {
        ObjectDescriptor.Builder builder = descriptor.toBuilder()
            .contents(null)
            .stream(null);
        if ( (descriptor.getVisibility() == null) && (visibility != null) )
        {
            builder.visibility(visibility);
        }
        return builder.build();
    }

    private String fixPath(String path)
    {
        checkStarted();
        return StoragePaths.normalize(path);
    }

    private void checkStarted()
    {
        Preconditions.checkState(state.get() == State.STARTED, "instance must be started before calling this method");
    }
}
