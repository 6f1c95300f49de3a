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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import org.stowage.utils.StoragePaths;
import java.io.InputStream;

/**
 * What a {@link Backend} knows about one object after an operation. Only <code>path</code> and
 * <code>type</code> are always present; every other field is null when the backend did not report it.
 */
public class ObjectDescriptor
{
    private final String path;
    private final ObjectType type;
    private final Long size;
    private final String mimetype;
    private final Long timestamp;
    private final String visibility;
    private final byte[] contents;
    private final InputStream stream;

    /**
     * Return a new builder for a descriptor of the given path
     *
     * @param path path of the object
     * @param type kind of the object
     * @return new builder
     */
    public static Builder builder(String path, ObjectType type)
    {
        return new Builder(path, type);
    }

    /**
     * Shortcut for a file descriptor without any metadata
     *
     * @param path path of the file
     * @return descriptor
     */
    public static ObjectDescriptor file(String path)
    {
        return builder(path, ObjectType.FILE).build();
    }

    /**
     * Shortcut for a directory descriptor without any metadata
     *
     * @param path path of the directory
     * @return descriptor
     */
    public static ObjectDescriptor directory(String path)
    {
        return builder(path, ObjectType.DIRECTORY).build();
    }

    public static class Builder
    {
        private final String path;
        private final ObjectType type;
        private Long size;
        private String mimetype;
        private Long timestamp;
        private String visibility;
        private byte[] contents;
        private InputStream stream;

        private Builder(String path, ObjectType type)
        {
            this.path = StoragePaths.normalize(path);
            this.type = Preconditions.checkNotNull(type, "type cannot be null");
        }

        public Builder size(Long size)
        {
            this.size = size;
            return this;
        }

        public Builder mimetype(String mimetype)
        {
            this.mimetype = mimetype;
            return this;
        }

        public Builder timestamp(Long timestamp)
        {
            this.timestamp = timestamp;
            return this;
        }

        public Builder visibility(String visibility)
        {
            this.visibility = visibility;
            return this;
        }

        public Builder contents(byte[] contents)
        {
            this.contents = contents;
            return this;
        }

        public Builder stream(InputStream stream)
        {
            this.stream = stream;
            return this;
        }

        public ObjectDescriptor build()
        {
            return new ObjectDescriptor(this);
        }
    }

    /**
     * Return a builder pre-populated with the values of this descriptor
     *
     * @return builder
     */
    public Builder toBuilder()
    {
        return builder(path, type)
            .size(size)
            .mimetype(mimetype)
            .timestamp(timestamp)
            .visibility(visibility)
            .contents(contents)
            .stream(stream);
    }

    public String getPath()
    {
        return path;
    }

    public ObjectType getType()
    {
        return type;
    }

    public Long getSize()
    {
        return size;
    }

    public String getMimetype()
    {
        return mimetype;
    }

    /**
     * @return last modified time in seconds since the epoch, or null
     */
    public Long getTimestamp()
    {
        return timestamp;
    }

    public String getVisibility()
    {
        return visibility;
    }

    /**
     * <p>Returns the file contents if the backend reported them.</p>
     *
     * <p><b>NOTE:</b> the byte array returned is the raw reference of this instance's field.</p>
     *
     * @return contents or null
     */
    public byte[] getContents()
    {
        return contents;
    }

    /**
     * @return an open stream for read-stream operations, or null
     */
    public InputStream getStream()
    {
        return stream;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("path", path)
            .add("type", type)
            .add("size", size)
            .add("mimetype", mimetype)
            .add("timestamp", timestamp)
            .add("visibility", visibility)
            .add("contents", (contents != null) ? contents.length + " bytes" : null)
            .toString();
    }

    private ObjectDescriptor(Builder builder)
    {
        path = builder.path;
        type = builder.type;
        size = builder.size;
        mimetype = builder.mimetype;
        timestamp = builder.timestamp;
        visibility = builder.visibility;
        contents = builder.contents;
        stream = builder.stream;
    }
}
