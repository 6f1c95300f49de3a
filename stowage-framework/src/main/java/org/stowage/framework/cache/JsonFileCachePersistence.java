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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps a {@link CacheSnapshot} as a JSON document in a local file
 */
public class JsonFileCachePersistence implements CachePersistence
{
    private final ObjectMapper mapper = new ObjectMapper();
    private final Path file;

    public JsonFileCachePersistence(Path file)
    {
        this.file = Preconditions.checkNotNull(file, "file cannot be null");
    }

    @Override
    public Optional<CacheSnapshot> load() throws IOException
    {
        if ( !Files.exists(file) )
        {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(file.toFile(), CacheSnapshot.class));
    }

    @Override
    public void save(CacheSnapshot snapshot) throws IOException
    {
        Path parent = file.toAbsolutePath().getParent();
        if ( parent != null )
        {
            Files.createDirectories(parent);
        }

        // the snapshot file is only ever replaced whole
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(temp.toFile(), snapshot);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
}
