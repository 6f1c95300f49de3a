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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.stowage.Backend;
import org.stowage.framework.cache.CachePersistence;
import org.stowage.framework.cache.ObjectCache;
import org.stowage.framework.extension.Extension;
import org.stowage.framework.imps.FilesystemImpl;
import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for creating filesystems
 */
public class FilesystemFactory
{
    /**
     * Return a new builder that builds a Filesystem
     *
     * @return new builder
     */
    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Create a new filesystem with a standard cache, no cache persistence and public default visibility
     *
     * @param backend storage backend
     * @return filesystem
     */
    public static Filesystem newFilesystem(Backend backend)
    {
        return builder().backend(backend).build();
    }

    public static class Builder
    {
        private Backend backend;
        private ObjectCache cache;
        private CachePersistence cachePersistence = CachePersistence.none();
        private String defaultVisibility = Backend.VISIBILITY_PUBLIC;
        private final ImmutableList.Builder<Extension> extensions = ImmutableList.builder();

        /**
         * Apply the current values and build a new Filesystem. The cache is loaded from the
         * cache persistence before this method returns.
         *
         * @return new Filesystem
         */
        public Filesystem build()
        {
            Preconditions.checkNotNull(backend, "backend cannot be null");
            return new FilesystemImpl(this);
        }

        /**
         * @param backend the storage backend (required)
         * @return this
         */
        public Builder backend(Backend backend)
        {
            this.backend = backend;
            return this;
        }

        /**
         * Use the given cache instead of a new {@link ObjectCache#standard()} one. The filesystem
         * becomes the only writer of this cache.
         *
         * @param cache the cache
         * @return this
         */
        public Builder cache(ObjectCache cache)
        {
            this.cache = cache;
            return this;
        }

        /**
         * @param cachePersistence where the cache is loaded from on build and saved to on close
         * @return this
         */
        public Builder cachePersistence(CachePersistence cachePersistence)
        {
            this.cachePersistence = cachePersistence;
            return this;
        }

        /**
         * @param defaultVisibility visibility used by writes that do not specify one
         * @return this
         */
        public Builder defaultVisibility(String defaultVisibility)
        {
            this.defaultVisibility = defaultVisibility;
            return this;
        }

        /**
         * @param extensions extensions to register on the new filesystem
         * @return this
         */
        public Builder extensions(Extension... extensions)
        {
            this.extensions.addAll(Arrays.asList(extensions));
            return this;
        }

        public Backend getBackend()
        {
            return backend;
        }

        public ObjectCache getCache()
        {
            return (cache != null) ? cache : ObjectCache.standard();
        }

        public CachePersistence getCachePersistence()
        {
            return (cachePersistence != null) ? cachePersistence : CachePersistence.none();
        }

        public String getDefaultVisibility()
        {
            return defaultVisibility;
        }

        public List<Extension> getExtensions()
        {
            return extensions.build();
        }

        private Builder()
        {
        }
    }

    private FilesystemFactory()
    {
    }
}
