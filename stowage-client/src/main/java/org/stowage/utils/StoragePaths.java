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
package org.stowage.utils;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

public class StoragePaths
{
    /**
     * The path separator character.
     */
    public static final String PATH_SEPARATOR = "/";

    /**
     * The normalized form of the root directory.
     */
    public static final String ROOT = PATH_SEPARATOR;

    private static final Splitter PATH_SPLITTER = Splitter.on(PATH_SEPARATOR).omitEmptyStrings();

    /**
     * Normalize a caller supplied path: backslashes become slashes, empty and "." segments are dropped,
     * ".." segments are resolved and the result always starts with a slash and never ends with one
     * (except for the root). i.e. "a//b/./c/" will return "/a/b/c"
     *
     * @param path the path
     * @return normalized path
     * @throws IllegalArgumentException if the path resolves above the root
     */
    public static String normalize(String path)
    {
        Preconditions.checkNotNull(path, "path cannot be null");

        Deque<String> parts = new ArrayDeque<>();
        for ( String part : PATH_SPLITTER.split(path.replace('\\', '/')) )
        {
            if ( part.equals(".") )
            {
                continue;
            }
            if ( part.equals("..") )
            {
                Preconditions.checkArgument(!parts.isEmpty(), "Path is outside of the root: %s", path);
                parts.removeLast();
                continue;
            }
            parts.addLast(part);
        }

        if ( parts.isEmpty() )
        {
            return ROOT;
        }
        StringBuilder normalized = new StringBuilder();
        for ( String part : parts )
        {
            normalized.append(PATH_SEPARATOR).append(part);
        }
        return normalized.toString();
    }

    /**
     * Returns true if the path is the root directory
     *
     * @param path normalized path
     * @return true/false
     */
    public static boolean isRoot(String path)
    {
        return ROOT.equals(path);
    }

    /**
     * Given a full path, return the node name. i.e. "/one/two/three" will return "three"
     *
     * @param path the path
     * @return the node
     */
    public static String getNodeFromPath(String path)
    {
        return getPathAndNode(path).getNode();
    }

    /**
     * Given a full path, return its parent. i.e. "/one/two/three" will return "/one/two". The parent of
     * the root is the root.
     *
     * @param path the path
     * @return the parent path
     */
    public static String getParent(String path)
    {
        return getPathAndNode(path).getPath();
    }

    public static class PathAndNode
    {
        private final String path;
        private final String node;

        public PathAndNode(String path, String node)
        {
            this.path = path;
            this.node = node;
        }

        public String getPath()
        {
            return path;
        }

        public String getNode()
        {
            return node;
        }
    }

    /**
     * Given a full path, return the node name and its path. i.e. "/one/two/three" will return {"/one/two", "three"}
     *
     * @param path the path
     * @return the node
     */
    public static PathAndNode getPathAndNode(String path)
    {
        String normalized = normalize(path);
        int i = normalized.lastIndexOf(PATH_SEPARATOR);
        if ( (i + 1) >= normalized.length() )
        {
            return new PathAndNode(ROOT, "");
        }
        String node = normalized.substring(i + 1);
        String parentPath = (i > 0) ? normalized.substring(0, i) : ROOT;
        return new PathAndNode(parentPath, node);
    }

    /**
     * Return every ancestor of the given path, nearest first and ending with the root.
     * i.e. "/one/two/three" will return {"/one/two", "/one", "/"}. The root has no ancestors.
     *
     * @param path the path
     * @return ancestors
     */
    public static List<String> getAncestors(String path)
    {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        String current = normalize(path);
        while ( !isRoot(current) )
        {
            current = getParent(current);
            builder.add(current);
        }
        return builder.build();
    }

    /**
     * Returns true if <code>path</code> lies strictly below <code>directory</code>
     *
     * @param directory the directory
     * @param path      the path to test
     * @return true/false
     */
    public static boolean isDescendant(String directory, String path)
    {
        String normalizedDirectory = normalize(directory);
        String normalizedPath = normalize(path);
        if ( normalizedPath.equals(normalizedDirectory) )
        {
            return false;
        }
        if ( isRoot(normalizedDirectory) )
        {
            return true;
        }
        return normalizedPath.startsWith(normalizedDirectory + PATH_SEPARATOR);
    }

    /**
     * Returns true if <code>path</code> is an immediate child of <code>directory</code>
     *
     * @param directory the directory
     * @param path      the path to test
     * @return true/false
     */
    public static boolean isChild(String directory, String path)
    {
        String normalizedPath = normalize(path);
        return !isRoot(normalizedPath) && getParent(normalizedPath).equals(normalize(directory));
    }

    private StoragePaths()
    {
    }
}
