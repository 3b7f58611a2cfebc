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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class SourceScannerTest {

    @TempDir
    Path dir;

    @BeforeEach
    void createTree() throws IOException {
        for (String name : Arrays.asList("main.c", "util.CPP", "util.h", "README.md",
                "sub/deep.cc", "sub/deep.hpp", "generated/gen.c"))
            FileUtils.writeStringToFile(dir.resolve(name).toFile(), "#define X\n", StandardCharsets.UTF_8);
    }

    private List<String> names(List<File> files) {
        List<String> out = new ArrayList<String>();
        for (File file : files)
            out.add(dir.relativize(file.toPath()).toString().replace(File.separatorChar, '/'));
        return out;
    }

    @Test
    void topLevelSourcesOnly() throws IOException {
        SourceScanner scanner = new SourceScanner();
        assertEquals(Arrays.asList("main.c", "util.CPP"),
                names(scanner.scan(Collections.singletonList(dir.toFile()))));
    }

    @Test
    void recursiveWithHeaders() throws IOException {
        SourceScanner scanner = new SourceScanner();
        scanner.setRecursive(true);
        scanner.setIncludeHeaders(true);
        assertEquals(Arrays.asList("generated/gen.c", "main.c", "sub/deep.cc", "sub/deep.hpp", "util.CPP", "util.h"),
                names(scanner.scan(Collections.singletonList(dir.toFile()))));
    }

    @Test
    void excludedDirectoriesAndFiles() throws IOException {
        SourceScanner scanner = new SourceScanner();
        scanner.setRecursive(true);
        scanner.addExclude("generated");
        scanner.addExclude("util.*");
        assertEquals(Arrays.asList("main.c", "sub/deep.cc"),
                names(scanner.scan(Collections.singletonList(dir.toFile()))));
    }

    @Test
    void explicitFilesAreFilteredAndDeduplicated() throws IOException {
        SourceScanner scanner = new SourceScanner();
        File main = dir.resolve("main.c").toFile();
        File readme = dir.resolve("README.md").toFile();
        assertEquals(Collections.singletonList("main.c"),
                names(scanner.scan(Arrays.asList(main, readme, main))));
    }

    @Test
    void missingInput() {
        SourceScanner scanner = new SourceScanner();
        assertThrows(FileNotFoundException.class,
                () -> scanner.scan(Collections.singletonList(dir.resolve("nope").toFile())));
    }

    @Test
    void extensions() {
        SourceScanner scanner = new SourceScanner();
        assertTrue(scanner.isSource(new File("a.C")));
        assertTrue(scanner.isSource(new File("a.c++")));
        assertFalse(scanner.isSource(new File("a.h")));
        scanner.addExtension(".inl");
        assertTrue(scanner.isSource(new File("x/a.inl")));
    }
}
