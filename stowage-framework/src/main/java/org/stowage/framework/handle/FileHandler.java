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
import org.stowage.utils.StoragePaths;
import java.io.InputStream;
import java.util.Optional;

public class FileHandler extends Handler
{
    public FileHandler(Filesystem filesystem, String path)
    {
        super(filesystem, path);
    }

    public Optional<byte[]> read()
    {
        return filesystem.read(path);
    }

    public Optional<InputStream> readStream()
    {
        return filesystem.readStream(path);
    }

    public boolean write(byte[] contents)
    {
        return filesystem.write(path, contents);
    }

    public boolean writeStream(InputStream stream)
    {
        return filesystem.writeStream(path, stream);
    }

    public boolean update(byte[] contents)
    {
        return filesystem.update(path, contents);
    }

    public boolean updateStream(InputStream stream)
    {
        return filesystem.updateStream(path, stream);
    }

    public boolean put(byte[] contents)
    {
        return filesystem.put(path, contents);
    }

    /**
     * Rename the file. On success this handle points at the new path.
     *
     * @param newPath new path
     * @return true on success
     */
    public boolean rename(String newPath)
    {
        boolean renamed = filesystem.rename(path, newPath);
        if ( renamed )
        {
            path = StoragePaths.normalize(newPath);
        }
        return renamed;
    }

    public boolean delete()
    {
        return filesystem.delete(path);
    }

    public Optional<String> getMimetype()
    {
        return filesystem.getMimetype(path);
    }

    public Optional<Long> getTimestamp()
    {
        return filesystem.getTimestamp(path);
    }

    public Optional<Long> getSize()
    {
        return filesystem.getSize(path);
    }

    public Optional<String> getVisibility()
    {
        return filesystem.getVisibility(path);
    }

    public boolean setVisibility(String visibility)
    {
        return filesystem.setVisibility(path, visibility);
    }
}
