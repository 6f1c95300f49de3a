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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import org.stowage.ObjectDescriptor;
import org.stowage.ObjectType;
import org.stowage.utils.StoragePaths;
import java.util.Arrays;
import java.util.Objects;

/**
 * The cached knowledge about one path. Every field except <code>path</code> and <code>type</code>
 * may be unknown (null) and is filled in as operations discover it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ObjectRecord implements Comparable<ObjectRecord>
{
    private final String path;
    private final ObjectType type;
    private final Long size;
    private final String mimetype;
    private final Long timestamp;
    private final String visibility;
    private final byte[] contents;

    /**
     * Build a record from everything a backend reported. Streams are never retained.
     *
     * @param descriptor backend result
     * @return new record
     */
    public static ObjectRecord from(ObjectDescriptor descriptor)
    {
        return new ObjectRecord(
            descriptor.getPath(),
            descriptor.getType(),
            descriptor.getSize(),
            descriptor.getMimetype(),
            descriptor.getTimestamp(),
            descriptor.getVisibility(),
            contentsFor(descriptor.getType(), descriptor.getContents())
        );
    }

    /**
     * A directory record with no metadata
     *
     * @param path directory path
     * @return new record
     */
    public static ObjectRecord directory(String path)
    {
        return new ObjectRecord(path, ObjectType.DIRECTORY, null, null, null, null, null);
    }

    @JsonCreator
    public ObjectRecord(
        @JsonProperty("path") String path,
        @JsonProperty("type") ObjectType type,
        @JsonProperty("size") Long size,
        @JsonProperty("mimetype") String mimetype,
        @JsonProperty("timestamp") Long timestamp,
        @JsonProperty("visibility") String visibility,
        @JsonProperty("contents") byte[] contents
    )
    {
        this.path = StoragePaths.normalize(path);
        this.type = Preconditions.checkNotNull(type, "type cannot be null");
        this.size = size;
        this.mimetype = mimetype;
        this.timestamp = timestamp;
        this.visibility = visibility;
        this.contents = contents;
    }

    /**
     * Merge a fresher backend result into this record. Fields the descriptor reports replace
     * the cached ones; fields it leaves out keep their cached value.
     *
     * @param descriptor backend result for the same path
     * @return merged record
     */
    public ObjectRecord merge(ObjectDescriptor descriptor)
    {
        Preconditions.checkArgument(path.equals(descriptor.getPath()), "Cannot merge %s into %s", descriptor.getPath(), path);
        ObjectType mergedType = descriptor.getType();
        return new ObjectRecord(
            path,
            mergedType,
            (descriptor.getSize() != null) ? descriptor.getSize() : size,
            (descriptor.getMimetype() != null) ? descriptor.getMimetype() : mimetype,
            (descriptor.getTimestamp() != null) ? descriptor.getTimestamp() : timestamp,
            (descriptor.getVisibility() != null) ? descriptor.getVisibility() : visibility,
            contentsFor(mergedType, (descriptor.getContents() != null) ? descriptor.getContents() : retainedContents(descriptor))
        );
    }

    private byte[] retainedContents(ObjectDescriptor descriptor)
    {
        boolean sizeChanged = (size != null) && (descriptor.getSize() != null) && !size.equals(descriptor.getSize());
        boolean timestampChanged = (timestamp != null) && (descriptor.getTimestamp() != null) && !timestamp.equals(descriptor.getTimestamp());
        return (sizeChanged || timestampChanged) ? null : contents;
    }

    /**
     * @param newPath the new path
     * @return a copy of this record keyed under a different path
     */
    public ObjectRecord withPath(String newPath)
    {
        return new ObjectRecord(newPath, type, size, mimetype, timestamp, visibility, contents);
    }

    /**
     * @return a copy of this record with unknown contents
     */
    public ObjectRecord withoutContents()
    {
        if ( contents == null )
        {
            return this;
        }
        return new ObjectRecord(path, type, size, mimetype, timestamp, visibility, null);
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

    public Long getTimestamp()
    {
        return timestamp;
    }

    public String getVisibility()
    {
        return visibility;
    }

    /**
     * <p>Returns the cached file contents, or null when they are not known.</p>
     *
     * <p><b>NOTE:</b> the byte array returned is the raw reference of this instance's field. If you change
     * the values in the array any other callers to this method will see the change.</p>
     *
     * @return contents or null
     */
    public byte[] getContents()
    {
        return contents;
    }

    /**
     * @inheritDoc
     *
     * Note: this class has a natural ordering that is inconsistent with equals.
     */
    @Override
    public int compareTo(ObjectRecord rhs)
    {
        return path.compareTo(rhs.path);
    }

    @Override
    public boolean equals(Object o)
    {
        if ( this == o )
        {
            return true;
        }
        if ( o == null || getClass() != o.getClass() )
        {
            return false;
        }

        ObjectRecord that = (ObjectRecord)o;
        return path.equals(that.path)
            && (type == that.type)
            && Objects.equals(size, that.size)
            && Objects.equals(mimetype, that.mimetype)
            && Objects.equals(timestamp, that.timestamp)
            && Objects.equals(visibility, that.visibility)
            && Arrays.equals(contents, that.contents);
    }

    @Override
    public int hashCode()
    {
        int result = Objects.hash(path, type, size, mimetype, timestamp, visibility);
        result = 31 * result + Arrays.hashCode(contents);
        return result;
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

    private static byte[] contentsFor(ObjectType type, byte[] contents)
    {
        return (type == ObjectType.FILE) ? contents : null;
    }
}
