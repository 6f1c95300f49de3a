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

import com.google.common.collect.ImmutableList;
import org.stowage.ObjectDescriptor;
import org.stowage.ObjectType;
import org.stowage.utils.StoragePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

class StandardObjectCache implements ObjectCache
{
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ObjectRecord> records = new HashMap<>();
    private final Set<String> absent = new HashSet<>();
    private final Map<String, Completeness> complete = new HashMap<>();
    private final boolean cacheContents;

    private enum Completeness
    {
        SHALLOW,
        RECURSIVE
    }

    StandardObjectCache(boolean cacheContents)
    {
        this.cacheContents = cacheContents;
    }

    @Override
    public Existence has(String path)
    {
        String normalized = StoragePaths.normalize(path);
        return read(() -> {
            if ( StoragePaths.isRoot(normalized) || records.containsKey(normalized) )
            {
                return Existence.PRESENT;
            }
            if ( isMarkedAbsent(normalized) || isListedWithout(normalized) )
            {
                return Existence.ABSENT;
            }
            return Existence.UNKNOWN;
        });
    }

    @Override
    public boolean isComplete(String directory, boolean recursive)
    {
        String normalized = StoragePaths.normalize(directory);
        return read(() -> {
            Completeness completeness = complete.get(normalized);
            return (completeness != null) && (!recursive || (completeness == Completeness.RECURSIVE));
        });
    }

    @Override
    public Optional<ObjectRecord> upsert(ObjectDescriptor descriptor, boolean confirmed)
    {
        return write(() -> upsertLocked(descriptor, confirmed));
    }

    @Override
    public void ensureParentDirectories(String path)
    {
        String normalized = StoragePaths.normalize(path);
        write(() -> {
            for ( String ancestor : StoragePaths.getAncestors(normalized) )
            {
                if ( StoragePaths.isRoot(ancestor) )
                {
                    continue;
                }
                absent.remove(ancestor);
                if ( !records.containsKey(ancestor) )
                {
                    records.put(ancestor, ObjectRecord.directory(ancestor));
                    childrenChanged(ancestor);
                }
            }
            return null;
        });
    }

    @Override
    public void remove(String path)
    {
        String normalized = StoragePaths.normalize(path);
        write(() -> {
            records.remove(normalized);
            complete.remove(normalized);
            dropDescendants(normalized);
            markAbsent(normalized);
            childrenChanged(normalized);
            return null;
        });
    }

    @Override
    public void removeDirectoryRecursive(String directory)
    {
        String normalized = StoragePaths.normalize(directory);
        write(() -> {
            Predicate<String> inTree = key -> key.equals(normalized) || StoragePaths.isDescendant(normalized, key);
            records.keySet().removeIf(inTree);
            complete.keySet().removeIf(inTree);
            absent.removeIf(inTree);
            markAbsent(normalized);
            childrenChanged(normalized);
            return null;
        });
    }

    @Override
    public void rename(String from, String to)
    {
        String normalizedFrom = StoragePaths.normalize(from);
        String normalizedTo = StoragePaths.normalize(to);
        write(() -> {
            ObjectRecord moved = records.remove(normalizedFrom);
            dropDescendants(normalizedFrom);
            complete.remove(normalizedFrom);

            records.remove(normalizedTo);
            dropDescendants(normalizedTo);
            complete.remove(normalizedTo);
            clearAbsence(normalizedTo);

            if ( moved != null )
            {
                records.put(normalizedTo, moved.withPath(normalizedTo));
            }
            markAbsent(normalizedFrom);
            childrenChanged(normalizedFrom);
            childrenChanged(normalizedTo);
            return null;
        });
    }

    @Override
    public List<ObjectRecord> storeListing(String directory, boolean recursive, List<ObjectDescriptor> entries)
    {
        String normalized = StoragePaths.normalize(directory);
        return write(() -> {
            Set<String> impliedDirectories = impliedDirectories(normalized, entries);
            Set<String> listed = entries.stream().map(ObjectDescriptor::getPath).collect(Collectors.toCollection(HashSet::new));
            listed.addAll(impliedDirectories);

            Function<String, String> listedAs = recursive ? key -> key : key -> childOf(normalized, key);
            Predicate<String> stale = key -> StoragePaths.isDescendant(normalized, key) && !listed.contains(listedAs.apply(key));
            int before = records.size();
            records.keySet().removeIf(stale);
            complete.keySet().removeIf(stale);
            if ( before != records.size() )
            {
                log.debug("Listing of {} dropped {} stale records", normalized, before - records.size());
            }
            // absence below the directory now follows from the completeness mark
            absent.removeIf(stale);

            for ( ObjectDescriptor entry : entries )
            {
                upsertLocked(entry, true);
            }
            for ( String implied : impliedDirectories )
            {
                if ( !records.containsKey(implied) )
                {
                    records.put(implied, ObjectRecord.directory(implied));
                }
            }

            if ( recursive )
            {
                complete.put(normalized, Completeness.RECURSIVE);
                entries.stream()
                    .filter(entry -> entry.getType() == ObjectType.DIRECTORY)
                    .filter(entry -> StoragePaths.isDescendant(normalized, entry.getPath()))
                    .forEach(entry -> complete.put(entry.getPath(), Completeness.RECURSIVE));
                impliedDirectories.forEach(implied -> complete.put(implied, Completeness.RECURSIVE));
            }
            else
            {
                complete.putIfAbsent(normalized, Completeness.SHALLOW);
            }
            return listingLocked(normalized, recursive);
        });
    }

    @Override
    public List<ObjectRecord> listing(String directory, boolean recursive)
    {
        String normalized = StoragePaths.normalize(directory);
        return read(() -> listingLocked(normalized, recursive));
    }

    @Override
    public void invalidateContents(String path)
    {
        String normalized = StoragePaths.normalize(path);
        write(() -> records.computeIfPresent(normalized, (__, record) -> record.withoutContents()));
    }

    @Override
    public void flush()
    {
        write(() -> {
            records.clear();
            absent.clear();
            complete.clear();
            return null;
        });
    }

    @Override
    public Optional<ObjectRecord> get(String path)
    {
        String normalized = StoragePaths.normalize(path);
        return read(() -> Optional.ofNullable(records.get(normalized)));
    }

    @Override
    public Optional<byte[]> contents(String path)
    {
        return get(path).map(ObjectRecord::getContents);
    }

    @Override
    public Optional<String> mimetype(String path)
    {
        return get(path).map(ObjectRecord::getMimetype);
    }

    @Override
    public Optional<Long> timestamp(String path)
    {
        return get(path).map(ObjectRecord::getTimestamp);
    }

    @Override
    public Optional<String> visibility(String path)
    {
        return get(path).map(ObjectRecord::getVisibility);
    }

    @Override
    public Optional<Long> size(String path)
    {
        return get(path).map(ObjectRecord::getSize);
    }

    @Override
    public int size()
    {
        return read(records::size);
    }

    @Override
    public CacheSnapshot snapshot()
    {
        return read(() -> new CacheSnapshot(
            records.values().stream().sorted().collect(Collectors.toList()),
            absent.stream().sorted().collect(Collectors.toList()),
            pathsWith(Completeness.SHALLOW),
            pathsWith(Completeness.RECURSIVE)
        ));
    }

    @Override
    public void restore(CacheSnapshot snapshot)
    {
        write(() -> {
            records.clear();
            absent.clear();
            complete.clear();
            for ( ObjectRecord record : snapshot.getRecords() )
            {
                records.put(record.getPath(), cacheContents ? record : record.withoutContents());
            }
            absent.addAll(snapshot.getAbsent());
            snapshot.getCompleteShallow().forEach(path -> complete.put(path, Completeness.SHALLOW));
            snapshot.getCompleteRecursive().forEach(path -> complete.put(path, Completeness.RECURSIVE));
            log.debug("Restored {} records", records.size());
            return null;
        });
    }

    private Optional<ObjectRecord> upsertLocked(ObjectDescriptor descriptor, boolean confirmed)
    {
        String path = descriptor.getPath();
        ObjectRecord existing = records.get(path);
        if ( (existing == null) && !confirmed )
        {
            return Optional.empty();
        }

        ObjectRecord merged = (existing != null) ? existing.merge(descriptor) : ObjectRecord.from(descriptor);
        if ( !cacheContents )
        {
            merged = merged.withoutContents();
        }
        records.put(path, merged);

        if ( confirmed )
        {
            clearAbsence(path);
            if ( existing == null )
            {
                childrenChanged(path);
            }
        }
        return Optional.of(merged);
    }

    /**
     * Directories between <code>directory</code> and the listed entries. Backends that list
     * files only leave them out.
     */
    private static Set<String> impliedDirectories(String directory, List<ObjectDescriptor> entries)
    {
        Set<String> implied = new HashSet<>();
        for ( ObjectDescriptor entry : entries )
        {
            for ( String ancestor : StoragePaths.getAncestors(entry.getPath()) )
            {
                if ( !StoragePaths.isDescendant(directory, ancestor) || !implied.add(ancestor) )
                {
                    break;
                }
            }
        }
        return implied;
    }

    private List<ObjectRecord> listingLocked(String directory, boolean recursive)
    {
        Predicate<String> inScope = recursive ? key -> StoragePaths.isDescendant(directory, key) : key -> StoragePaths.isChild(directory, key);
        return records.values().stream()
            .filter(record -> inScope.test(record.getPath()))
            .sorted()
            .collect(ImmutableList.toImmutableList());
    }

    /**
     * A child of the parent of <code>path</code> was added or removed: the parent's listing is no longer
     * exhaustive in either mode, and no ancestor's recursive listing is either
     */
    private void childrenChanged(String path)
    {
        if ( StoragePaths.isRoot(path) )
        {
            return;
        }
        String parent = StoragePaths.getParent(path);
        complete.remove(parent);
        for ( String ancestor : StoragePaths.getAncestors(parent) )
        {
            complete.computeIfPresent(ancestor, (__, completeness) -> Completeness.SHALLOW);
        }
    }

    /**
     * The path, or one of its ancestors, has no record although a complete listing covers it
     */
    private boolean isListedWithout(String path)
    {
        String candidate = path;
        while ( !StoragePaths.isRoot(candidate) )
        {
            if ( !records.containsKey(candidate) && isCoveredByListing(candidate) )
            {
                return true;
            }
            candidate = StoragePaths.getParent(candidate);
        }
        return false;
    }

    private boolean isCoveredByListing(String path)
    {
        String parent = StoragePaths.getParent(path);
        if ( complete.containsKey(parent) )
        {
            return true;
        }
        return StoragePaths.getAncestors(parent).stream().anyMatch(ancestor -> complete.get(ancestor) == Completeness.RECURSIVE);
    }

    private boolean isMarkedAbsent(String path)
    {
        if ( absent.isEmpty() )
        {
            return false;
        }
        if ( absent.contains(path) )
        {
            return true;
        }
        return StoragePaths.getAncestors(path).stream().anyMatch(absent::contains);
    }

    private void markAbsent(String path)
    {
        if ( !StoragePaths.isRoot(path) )
        {
            absent.add(path);
        }
    }

    private void clearAbsence(String path)
    {
        absent.remove(path);
        StoragePaths.getAncestors(path).forEach(absent::remove);
    }

    private void dropDescendants(String path)
    {
        Predicate<String> below = key -> StoragePaths.isDescendant(path, key);
        records.keySet().removeIf(below);
        complete.keySet().removeIf(below);
        absent.removeIf(below);
    }

    private List<String> pathsWith(Completeness completeness)
    {
        return complete.entrySet().stream()
            .filter(entry -> entry.getValue() == completeness)
            .map(Map.Entry::getKey)
            .sorted()
            .collect(Collectors.toList());
    }

    private static String childOf(String directory, String descendant)
    {
        String child = descendant;
        while ( !StoragePaths.getParent(child).equals(directory) )
        {
            child = StoragePaths.getParent(child);
        }
        return child;
    }

    private <T> T read(Supplier<T> proc)
    {
        lock.readLock().lock();
        try
        {
            return proc.get();
        }
        finally
        {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> proc)
    {
        lock.writeLock().lock();
        try
        {
            return proc.get();
        }
        finally
        {
            lock.writeLock().unlock();
        }
    }
}
