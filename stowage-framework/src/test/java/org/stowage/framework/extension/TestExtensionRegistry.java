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
package org.stowage.framework.extension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;
import org.stowage.StowageException;
import org.stowage.framework.Filesystem;
import org.stowage.framework.FilesystemFactory;
import org.stowage.test.InMemoryBackend;
import java.nio.charset.StandardCharsets;

public class TestExtensionRegistry
{
    @Test
    public void testRegistration()
    {
        ExtensionRegistry registry = new ExtensionRegistry(ImmutableSet.of("has"));
        Extension first = new FixedResultExtension("answer", 1);
        Extension second = new FixedResultExtension("answer", 2);

        registry.register(first);
        assertTrue(registry.isRegistered("answer"));
        registry.register(second);
        assertEquals(registry.size(), 1);
        assertEquals(registry.find("answer"), second);

        registry.unregister("answer");
        assertFalse(registry.isRegistered("answer"));
        StowageException.ExtensionNotFoundException e = assertThrows(StowageException.ExtensionNotFoundException.class, () -> registry.find("answer"));
        assertEquals(e.getOperation(), "answer");
    }

    @Test
    public void testInvalidNames()
    {
        ExtensionRegistry registry = new ExtensionRegistry(ImmutableSet.of("has"));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new FixedResultExtension("has", 0)));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new FixedResultExtension(" ", 0)));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new FixedResultExtension(null, 0)));
        assertThrows(NullPointerException.class, () -> registry.register(null));
        assertEquals(registry.size(), 0);
    }

    @Test
    public void testFilesystemExtensions()
    {
        Extension countEntries = new Extension()
        {
            @Override
            public String getOperation()
            {
                return "countEntries";
            }

            @Override
            public Object handle(Filesystem filesystem, Object... arguments)
            {
                return filesystem.listPaths((String)arguments[0], true).map(paths -> paths.size()).orElse(-1);
            }
        };

        Filesystem filesystem = FilesystemFactory.builder()
            .backend(new InMemoryBackend())
            .extensions(countEntries)
            .build();
        filesystem.write("/d/a", "a".getBytes(StandardCharsets.UTF_8));
        filesystem.write("/d/b/c", "c".getBytes(StandardCharsets.UTF_8));

        assertEquals(filesystem.invoke("countEntries", "/d"), 3);
        assertEquals(filesystem.addExtension(new FixedResultExtension("fixed", "value")).invoke("fixed"), "value");
        assertThrows(StowageException.ExtensionNotFoundException.class, () -> filesystem.invoke("missing"));
        assertThrows(IllegalArgumentException.class, () -> filesystem.addExtension(new FixedResultExtension("listContents", null)));
    }

    private static class FixedResultExtension implements Extension
    {
        private final String operation;
        private final Object result;

        private FixedResultExtension(String operation, Object result)
        {
            this.operation = operation;
            this.result = result;
        }

        @Override
        public String getOperation()
        {
            return operation;
        }

        @Override
        public Object handle(Filesystem filesystem, Object... arguments)
        {
            return result;
        }
    }
}
