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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.io.ByteStreams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stowage.Backend;
import org.stowage.ObjectType;
import org.stowage.framework.Filesystem;
import org.stowage.framework.FilesystemFactory;
import org.stowage.framework.cache.ObjectRecord;
import org.stowage.test.InMemoryBackend;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

public class TestHandlers
{
    private Filesystem filesystem;

    @BeforeEach
    public void setup()
    {
        filesystem = FilesystemFactory.newFilesystem(new InMemoryBackend());
    }

    @Test
    public void testFileHandler() throws Exception
    {
        FileHandler file = (FileHandler)filesystem.resolve("/docs/note.txt", ObjectType.FILE);
        assertFalse(file.exists());
        assertTrue(file.write(bytes("first")));
        assertTrue(file.exists());
        assertTrue(file.isFile());
        assertArrayEquals(file.read().orElseThrow(), bytes("first"));

        assertTrue(file.update(bytes("second")));
        assertTrue(file.put(bytes("third")));
        assertEquals(file.getSize(), Optional.of(5L));
        assertEquals(file.getMimetype(), Optional.of("text/plain"));
        assertTrue(file.getTimestamp().isPresent());

        assertTrue(file.updateStream(new ByteArrayInputStream(bytes("fourth"))));
        try ( InputStream in = file.readStream().orElseThrow() )
        {
            assertArrayEquals(ByteStreams.toByteArray(in), bytes("fourth"));
        }

        assertTrue(file.setVisibility(Backend.VISIBILITY_PRIVATE));
        assertEquals(file.getVisibility(), Optional.of(Backend.VISIBILITY_PRIVATE));

        assertTrue(file.rename("docs/renamed.txt"));
        assertEquals(file.getPath(), "/docs/renamed.txt");
        assertFalse(filesystem.has("/docs/note.txt"));
        assertArrayEquals(file.read().orElseThrow(), bytes("fourth"));

        assertTrue(file.delete());
        assertFalse(file.exists());
    }

    @Test
    public void testWriteStreamThroughHandler()
    {
        FileHandler file = (FileHandler)filesystem.resolve("/stream.bin", ObjectType.FILE);
        assertTrue(file.writeStream(new ByteArrayInputStream(new byte[]{1, 2, 3})));
        assertArrayEquals(file.read().orElseThrow(), new byte[]{1, 2, 3});
    }

    @Test
    public void testDirectoryHandler()
    {
        filesystem.write("/dir/a", bytes("a"));
        filesystem.write("/dir/sub/b", bytes("b"));

        Handler handler = filesystem.resolve("/dir").orElseThrow();
        assertTrue(handler.isDirectory());
        assertFalse(handler.isFile());
        DirectoryHandler directory = (DirectoryHandler)handler;

        List<ObjectRecord> shallow = directory.getContents(false).orElseThrow();
        assertEquals(shallow.size(), 2);
        List<ObjectRecord> recursive = directory.getContents(true).orElseThrow();
        assertEquals(recursive.size(), 3);

        assertTrue(directory.delete());
        assertFalse(directory.exists());
        assertFalse(filesystem.has("/dir/sub/b"));
    }

    private static byte[] bytes(String value)
    {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
