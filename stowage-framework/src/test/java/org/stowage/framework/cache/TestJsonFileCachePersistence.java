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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verifyNoInteractions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stowage.ObjectDescriptor;
import org.stowage.ObjectType;
import org.stowage.framework.Filesystem;
import org.stowage.framework.FilesystemFactory;
import org.stowage.test.InMemoryBackend;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

public class TestJsonFileCachePersistence
{
    @TempDir
    Path tempDir;

    @Test
    public void testMissingFile() throws Exception
    {
        JsonFileCachePersistence persistence = new JsonFileCachePersistence(tempDir.resolve("none.json"));
        assertFalse(persistence.load().isPresent());
    }

    @Test
    public void testSaveAndLoad() throws Exception
    {
        ObjectCache cache = ObjectCache.standard();
        cache.storeListing("/docs", false, Collections.singletonList(
            ObjectDescriptor.builder("/docs/readme", ObjectType.FILE).size(2L).contents("hi".getBytes(StandardCharsets.UTF_8)).build()
        ));
        cache.remove("/tmp");

        JsonFileCachePersistence persistence = new JsonFileCachePersistence(tempDir.resolve("nested").resolve("cache.json"));
        persistence.save(cache.snapshot());
        assertTrue(Files.exists(tempDir.resolve("nested").resolve("cache.json")));
        assertFalse(Files.exists(tempDir.resolve("nested").resolve("cache.json.tmp")));

        CacheSnapshot loaded = persistence.load().orElseThrow();
        assertEquals(loaded.getRecords(), cache.snapshot().getRecords());
        assertEquals(loaded.getAbsent(), Collections.singletonList("/tmp"));
        assertEquals(loaded.getCompleteShallow(), Collections.singletonList("/docs"));
        assertArrayEquals(loaded.getRecords().get(0).getContents(), "hi".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testCorruptFileStartsCold() throws Exception
    {
        Path file = tempDir.resolve("cache.json");
        Files.write(file, "not json".getBytes(StandardCharsets.UTF_8));

        Filesystem filesystem = FilesystemFactory.builder()
            .backend(new InMemoryBackend())
            .cachePersistence(new JsonFileCachePersistence(file))
            .build();
        assertEquals(filesystem.getCache().size(), 0);
        assertTrue(filesystem.write("/a", "1".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testFilesystemReloadsCache()
    {
        Path file = tempDir.resolve("cache.json");
        InMemoryBackend backend = spy(new InMemoryBackend());

        Filesystem first = FilesystemFactory.builder()
            .backend(backend)
            .cachePersistence(new JsonFileCachePersistence(file))
            .build();
        first.write("/kept/file.txt", "data".getBytes(StandardCharsets.UTF_8));
        first.close();

        clearInvocations(backend);
        Filesystem second = FilesystemFactory.builder()
            .backend(backend)
            .cachePersistence(new JsonFileCachePersistence(file))
            .build();
        assertTrue(second.has("/kept/file.txt"));
        assertArrayEquals(second.read("/kept/file.txt").orElseThrow(), "data".getBytes(StandardCharsets.UTF_8));
        verifyNoInteractions(backend);
        second.close();
    }
}
