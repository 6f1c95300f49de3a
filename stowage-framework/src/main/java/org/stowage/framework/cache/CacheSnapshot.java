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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Serializable state of an {@link ObjectCache}
 */
public class CacheSnapshot
{
    private final List<ObjectRecord> records;
    private final List<String> absent;
    private final List<String> completeShallow;
    private final List<String> completeRecursive;

    @JsonCreator
    public CacheSnapshot(
        @JsonProperty("records") List<ObjectRecord> records,
        @JsonProperty("absent") List<String> absent,
        @JsonProperty("completeShallow") List<String> completeShallow,
        @JsonProperty("completeRecursive") List<String> completeRecursive
    )
    {
        this.records = (records != null) ? ImmutableList.copyOf(records) : ImmutableList.of();
        this.absent = (absent != null) ? ImmutableList.copyOf(absent) : ImmutableList.of();
        this.completeShallow = (completeShallow != null) ? ImmutableList.copyOf(completeShallow) : ImmutableList.of();
        this.completeRecursive = (completeRecursive != null) ? ImmutableList.copyOf(completeRecursive) : ImmutableList.of();
    }

    public List<ObjectRecord> getRecords()
    {
        return records;
    }

    public List<String> getAbsent()
    {
        return absent;
    }

    public List<String> getCompleteShallow()
    {
        return completeShallow;
    }

    public List<String> getCompleteRecursive()
    {
        return completeRecursive;
    }
}
