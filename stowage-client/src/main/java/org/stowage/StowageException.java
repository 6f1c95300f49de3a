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
package org.stowage;

/**
 * Base of the typed failures raised by Stowage. Backend operation failures are not exceptions:
 * they are reported as {@code false} or {@code Optional.empty()} results.
 */
public abstract class StowageException extends RuntimeException
{
    protected StowageException(String message)
    {
        super(message);
    }

    /**
     * An operation required the path to exist and it does not
     */
    public static class NotFoundException extends StowageException
    {
        private final String path;

        public NotFoundException(String path)
        {
            super("Path not found: " + path);
            this.path = path;
        }

        public String getPath()
        {
            return path;
        }
    }

    /**
     * An operation required the path to be absent and it exists
     */
    public static class ExistsException extends StowageException
    {
        private final String path;

        public ExistsException(String path)
        {
            super("Path already exists: " + path);
            this.path = path;
        }

        public String getPath()
        {
            return path;
        }
    }

    /**
     * No extension is registered for the requested operation
     */
    public static class ExtensionNotFoundException extends StowageException
    {
        private final String operation;

        public ExtensionNotFoundException(String operation)
        {
            super("No extension registered for operation: " + operation);
            this.operation = operation;
        }

        public String getOperation()
        {
            return operation;
        }
    }
}
