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

import org.stowage.framework.Filesystem;

/**
 * An operation that a {@link Filesystem} does not support natively. Register it with
 * {@link Filesystem#addExtension(Extension)} and call it with {@link Filesystem#invoke(String, Object...)}.
 */
public interface Extension
{
    /**
     * @return the exact operation name this extension answers to
     */
    String getOperation();

    /**
     * Run the operation
     *
     * @param filesystem the filesystem the operation was invoked on
     * @param arguments  the caller's arguments
     * @return operation result (may be null)
     */
    Object handle(Filesystem filesystem, Object... arguments);
}
