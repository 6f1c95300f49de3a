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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import org.stowage.StowageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps operation names to {@link Extension}s. Names are validated when an extension is
 * registered: blank names and names reserved for native operations are rejected.
 */
public class ExtensionRegistry
{
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final Map<String, Extension> extensions = new ConcurrentHashMap<>();
    private final Set<String> reservedOperations;

    /**
     * @param reservedOperations operation names that extensions may not take over
     */
    public ExtensionRegistry(Set<String> reservedOperations)
    {
        this.reservedOperations = ImmutableSet.copyOf(reservedOperations);
    }

    /**
     * Register an extension, replacing any extension previously registered for the same operation
     *
     * @param extension the extension
     */
    public void register(Extension extension)
    {
        Preconditions.checkNotNull(extension, "extension cannot be null");
        String operation = extension.getOperation();
        Preconditions.checkArgument(!Strings.isNullOrEmpty(operation) && !operation.trim().isEmpty(), "Extension operation name cannot be blank");
        Preconditions.checkArgument(!reservedOperations.contains(operation), "Operation is handled natively and cannot be extended: %s", operation);

        Extension previous = extensions.put(operation, extension);
        if ( previous != null )
        {
            log.debug("Extension for {} replaced", operation);
        }
    }

    /**
     * Remove the extension registered for the operation, if any
     *
     * @param operation operation name
     */
    public void unregister(String operation)
    {
        extensions.remove(operation);
    }

    /**
     * Return the extension for the operation
     *
     * @param operation operation name
     * @return the extension
     * @throws StowageException.ExtensionNotFoundException if none is registered
     */
    public Extension find(String operation)
    {
        Extension extension = (operation != null) ? extensions.get(operation) : null;
        if ( extension == null )
        {
            throw new StowageException.ExtensionNotFoundException(operation);
        }
        return extension;
    }

    public boolean isRegistered(String operation)
    {
        return (operation != null) && extensions.containsKey(operation);
    }

    public int size()
    {
        return extensions.size();
    }
}
