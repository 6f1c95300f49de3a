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
package org.stowage.test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.io.ByteStreams;
import org.junit.jupiter.api.Test;
import org.stowage.Backend;
import org.stowage.ObjectDescriptor;
import org.stowage.ObjectType;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

public class TestInMemoryBackend
{
    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1000), ZoneOffset.UTC);

    @Test
    public void testWriteCreatesParents()
    {
        InMemoryBackend backend = new InMemoryBackend(clock);
        ObjectDescriptor written = backend.write("/a/b/c.txt", "hi".getBytes(), Backend.VISIBILITY_PUBLIC).orElseThrow();

        assertEquals(written.getType(), ObjectType.FILE);
        assertEquals(written.getSize(), Long.valueOf(2));
        assertEquals(written.getMimetype(), "text/plain");
        assertEquals(written.getTimestamp(), Long.valueOf(1000));
        assertArrayEquals(written.getContents(), "hi".getBytes());

        assertEquals(backend.has("/a").map(ObjectDescriptor::getType).orElse(null), ObjectType.DIRECTORY);
        assertEquals(backend.has("/a/b").map(ObjectDescriptor::getType).orElse(null), ObjectType.DIRECTORY);
        assertEquals(backend.size(), 3);
    }

    @Test
    public void testWriteRefusesExistingAndFileParents()
    {
        InMemoryBackend backend = new InMemoryBackend(clock);
        assertTrue(backend.write("/x", new byte[0], Backend.VISIBILITY_PUBLIC).isPresent());
        assertFalse(backend.write("/x", new byte[0], Backend.VISIBILITY_PUBLIC).isPresent());
        assertFalse(backend.write("/x/y", new byte[0], Backend.VISIBILITY_PUBLIC).isPresent());
        assertFalse(backend.createDir("/x", Backend.VISIBILITY_PUBLIC).isPresent());
    }

    @Test
    public void testStreams() throws Exception
    {
        InMemoryBackend backend = new InMemoryBackend(clock);
        ObjectDescriptor written = backend.writeStream("/s.bin", new ByteArrayInputStream(new byte[]{1, 2, 3}), Backend.VISIBILITY_PRIVATE).orElseThrow();
        assertEquals(written.getSize(), Long.valueOf(3));
        assertEquals(written.getContents(), null);

        ObjectDescriptor opened = backend.readStream("/s.bin").orElseThrow();
        assertArrayEquals(ByteStreams.toByteArray(opened.getStream()), new byte[]{1, 2, 3});

        backend.updateStream("/s.bin", new ByteArrayInputStream("new".getBytes(StandardCharsets.UTF_8)));
        assertArrayEquals(backend.read("/s.bin").orElseThrow().getContents(), "new".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testListing()
    {
        InMemoryBackend backend = new InMemoryBackend(clock);
        backend.write("/d/one", new byte[0], Backend.VISIBILITY_PUBLIC);
        backend.write("/d/sub/two", new byte[0], Backend.VISIBILITY_PUBLIC);
        backend.write("/other", new byte[0], Backend.VISIBILITY_PUBLIC);

        assertEquals(paths(backend.listContents("/d", false).orElseThrow()), List.of("/d/one", "/d/sub"));
        assertEquals(paths(backend.listContents("/d", true).orElseThrow()), List.of("/d/one", "/d/sub", "/d/sub/two"));
        assertEquals(paths(backend.listContents("/", false).orElseThrow()), List.of("/d", "/other"));
        assertTrue(backend.listContents("/missing", true).orElseThrow().isEmpty());
        assertFalse(backend.listContents("/other", false).isPresent());
    }

    @Test
    public void testRenameMovesSubtree()
    {
        InMemoryBackend backend = new InMemoryBackend(clock);
        backend.write("/d/one", "1".getBytes(), Backend.VISIBILITY_PUBLIC);
        backend.write("/d/sub/two", "2".getBytes(), Backend.VISIBILITY_PUBLIC);

        assertFalse(backend.rename("/d", "/d/inside"));
        assertTrue(backend.rename("/d", "/e/f"));
        assertFalse(backend.has("/d").isPresent());
        assertArrayEquals(backend.read("/e/f/sub/two").orElseThrow().getContents(), "2".getBytes());
        assertTrue(backend.has("/e").isPresent());
    }

    @Test
    public void testDeletes()
    {
        InMemoryBackend backend = new InMemoryBackend(clock);
        backend.write("/d/one", new byte[0], Backend.VISIBILITY_PUBLIC);
        backend.write("/d/sub/two", new byte[0], Backend.VISIBILITY_PUBLIC);

        assertFalse(backend.delete("/d"));
        assertFalse(backend.deleteDir("/d/one"));
        assertTrue(backend.delete("/d/one"));
        assertTrue(backend.deleteDir("/d"));
        assertEquals(backend.size(), 0);
    }

    private static List<String> paths(List<ObjectDescriptor> descriptors)
    {
        return descriptors.stream().map(ObjectDescriptor::getPath).collect(Collectors.toList());
    }
}
