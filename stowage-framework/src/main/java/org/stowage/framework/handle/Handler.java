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
package org.stowage.framework.handle;

import com.google.common.base.Preconditions;
import org.stowage.ObjectType;
import org.stowage.framework.Filesystem;
import org.stowage.framework.cache.ObjectRecord;
import org.stowage.utils.StoragePaths;
import java.util.Optional;

/**
 * A path bound to the {@link Filesystem} it was resolved from. Every operation delegates back
 * into that filesystem, so handles share its cache.
 */
public abstract class Handler
{
    protected final Filesystem filesystem;
    protected volatile String path;

    protected Handler(Filesystem filesystem, String path)
    {
        this.filesystem = Preconditions.checkNotNull(filesystem, "filesystem cannot be null");
        this.path = StoragePaths.normalize(path);
    }

    public Filesystem getFilesystem()
    {
        return filesystem;
    }

    public String getPath()
    {
        return path;
    }

    public boolean exists()
    {
        return filesystem.has(path);
    }

    /**
     * @return the type the filesystem currently reports for this path, or {@code empty()} if the metadata could not be fetched
     */
    public Optional<ObjectType> getType()
    {
        return filesystem.getMetadata(path).map(ObjectRecord::getType);
    }

    public boolean isFile()
    {
        return getType().map(type -> type == ObjectType.FILE).orElse(false);
    }

    public boolean isDirectory()
    {
        return getType().map(type -> type == ObjectType.DIRECTORY).orElse(false);
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + "{path='" + path + "'}";
    }
}
