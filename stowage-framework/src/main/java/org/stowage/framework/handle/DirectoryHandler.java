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

import org.stowage.framework.Filesystem;
import org.stowage.framework.cache.ObjectRecord;
import java.util.List;
import java.util.Optional;

public class DirectoryHandler extends Handler
{
    public DirectoryHandler(Filesystem filesystem, String path)
    {
        super(filesystem, path);
    }

    /**
     * Delete the directory and everything below it
     *
     * @return true on success
     */
    public boolean delete()
    {
        return filesystem.deleteDir(path);
    }

    /**
     * @param recursive true to include every descendant
     * @return the directory listing or {@code empty()} if the backend could not list it
     */
    public Optional<List<ObjectRecord>> getContents(boolean recursive)
    {
        return filesystem.listContents(path, recursive);
    }
}
