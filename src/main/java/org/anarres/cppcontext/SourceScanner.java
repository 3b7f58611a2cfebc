/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cppcontext;

import java.io.File;
import java.io.FileNotFoundException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeMap;
import javax.annotation.Nonnull;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.apache.commons.io.filefilter.AbstractFileFilter;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the C and C++ source files under a set of paths.
 *
 * Extensions are matched case-insensitively. Exclude patterns are
 * wildcards (<code>*</code> and <code>?</code>) matched against the
 * file name, against the whole path, and anywhere within the path; an
 * excluded directory is not descended into.
 */
public class SourceScanner {

    private static final Logger LOG = LoggerFactory.getLogger(SourceScanner.class);

    public static final List<String> SOURCE_EXTENSIONS = Collections.unmodifiableList(
            Arrays.asList("c", "cc", "cpp", "cxx", "c++"));
    public static final List<String> HEADER_EXTENSIONS = Collections.unmodifiableList(
            Arrays.asList("h", "hh", "hpp", "hxx", "h++"));

    private final Set<String> extensions = new LinkedHashSet<String>(SOURCE_EXTENSIONS);
    private final List<String> excludes = new ArrayList<String>();
    private boolean recursive;

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    public void setIncludeHeaders(boolean includeHeaders) {
        if (includeHeaders)
            extensions.addAll(HEADER_EXTENSIONS);
        else
            extensions.removeAll(HEADER_EXTENSIONS);
    }

    /**
     * Adds an extension, with or without its leading dot.
     */
    public void addExtension(@Nonnull String extension) {
        if (extension.startsWith("."))
            extension = extension.substring(1);
        extensions.add(extension.toLowerCase(Locale.ROOT));
    }

    public void addExclude(@Nonnull String pattern) {
        excludes.add(pattern);
    }

    public void addExcludes(@Nonnull Collection<String> patterns) {
        excludes.addAll(patterns);
    }

    public boolean isSource(@Nonnull File file) {
        String extension = FilenameUtils.getExtension(file.getName());
        return extensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    public boolean isExcluded(@Nonnull File file) {
        String name = file.getName();
        String path = FilenameUtils.separatorsToUnix(FilenameUtils.normalizeNoEndSeparator(file.getPath()));
        for (String pattern : excludes) {
            if (FilenameUtils.wildcardMatch(name, pattern, IOCase.SENSITIVE)
                    || FilenameUtils.wildcardMatch(path, pattern, IOCase.SENSITIVE)
                    || FilenameUtils.wildcardMatch(path, "*" + pattern + "*", IOCase.SENSITIVE))
                return true;
        }
        return false;
    }

    private class SourceFilter extends AbstractFileFilter {

        @Override
        public boolean accept(File file) {
            return isSource(file) && !isExcluded(file);
        }
    }

    private class DirectoryFilter extends AbstractFileFilter {

        @Override
        public boolean accept(File dir) {
            if (isExcluded(dir)) {
                LOG.debug("Excluding directory " + dir);
                return false;
            }
            return true;
        }
    }

    /**
     * Returns the source files named by, or contained in, the inputs,
     * sorted by path and without duplicates.
     *
     * @throws FileNotFoundException if an input does not exist.
     */
    @Nonnull
    public List<File> scan(@Nonnull Collection<File> inputs) throws FileNotFoundException {
        TreeMap<String, File> out = new TreeMap<String, File>();
        IOFileFilter fileFilter = new SourceFilter();
        IOFileFilter dirFilter = recursive ? new DirectoryFilter() : null;
        for (File input : inputs) {
            if (input.isFile()) {
                if (fileFilter.accept(input))
                    out.put(input.getPath(), input);
                else
                    LOG.debug("Skipping " + input);
            } else if (input.isDirectory()) {
                for (File file : FileUtils.listFiles(input, fileFilter, dirFilter))
                    out.put(file.getPath(), file);
            } else {
                throw new FileNotFoundException("Path does not exist: " + input);
            }
        }
        return new ArrayList<File>(out.values());
    }
}
