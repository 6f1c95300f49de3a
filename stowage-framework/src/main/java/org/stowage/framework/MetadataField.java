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
package org.stowage.framework;

/**
 * Metadata that {@link Filesystem#getWithMetadata(String, java.util.Collection)} can fetch on top
 * of the base metadata of a path
 */
public enum MetadataField
{
    MIMETYPE("mimetype"),
    TIMESTAMP("timestamp"),
    VISIBILITY("visibility"),
    SIZE("size");

    private final String fieldName;

    MetadataField(String fieldName)
    {
        this.fieldName = fieldName;
    }

    public String getFieldName()
    {
        return fieldName;
    }

    /**
     * Look up a field by its name
     *
     * @param fieldName e.g. "mimetype"
     * @return the field
     * @throws IllegalArgumentException if there is no such field
     */
    public static MetadataField fromName(String fieldName)
    {
        for ( MetadataField field : values() )
        {
            if ( field.fieldName.equals(fieldName) )
            {
                return field;
            }
        }
        throw new IllegalArgumentException("Could not fetch metadata: " + fieldName);
    }
}
