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
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        PrintStream out = new PrintStream(buffer, true, "UTF-8");
        return Main.run(args, out);
    }

    private String output() {
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void help() throws Exception {
        assertEquals(Main.EXIT_CLEAN, run("--help"));
        assertTrue(output().contains("--exclusive-branches"));
    }

    @Test
    void usageErrors(@TempDir Path dir) throws Exception {
        assertEquals(Main.EXIT_USAGE, run());
        assertEquals(Main.EXIT_USAGE, run("--no-such-option"));
        assertEquals(Main.EXIT_USAGE, run(dir.resolve("absent.c").toString()));
    }

    @Test
    void cleanFile(@TempDir Path dir) throws Exception {
        File file = dir.resolve("clean.c").toFile();
        FileUtils.writeStringToFile(file, "#ifdef DEBUG\n#define X 1\n#endif\n", StandardCharsets.UTF_8);
        assertEquals(Main.EXIT_CLEAN, run(file.getPath()));
        assertTrue(output().contains("Files: 1, directives: 3, defines: 1, critical: 0, errors: 0, warnings: 0"));
    }

    @Test
    void findingsSetTheExitStatus(@TempDir Path dir) throws Exception {
        FileUtils.writeStringToFile(dir.resolve("a.c").toFile(), "#ifdef A\n", StandardCharsets.UTF_8);
        FileUtils.writeStringToFile(dir.resolve("sub/b.c").toFile(), "#define X\n#define X\n", StandardCharsets.UTF_8);
        assertEquals(Main.EXIT_FINDINGS, run("-r", "-j", "2", dir.toString()));
        assertTrue(output().contains("[missing-endif]"));
        assertTrue(output().contains("[duplicate-definition]"));
    }

    @Test
    void warningsAloneAreClean(@TempDir Path dir) throws Exception {
        FileUtils.writeStringToFile(dir.resolve("w.c").toFile(), "#undef NEVER\n", StandardCharsets.UTF_8);
        assertEquals(Main.EXIT_CLEAN, run(dir.toString()));
        assertTrue(output().contains("warnings: 1"));
    }

    @Test
    void writesJson(@TempDir Path dir) throws Exception {
        File input = dir.resolve("in.h").toFile();
        File json = dir.resolve("out/result.json").toFile();
        FileUtils.writeStringToFile(input, "#define Y\n", StandardCharsets.UTF_8);
        assertEquals(Main.EXIT_CLEAN, run("--strict", "--include-headers", "-o", json.getPath(), dir.toString()));

        JsonObject result = JsonParser.parseString(
                FileUtils.readFileToString(json, StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals(1, result.getAsJsonArray("files").size());
        assertEquals(1, result.getAsJsonArray("defines").size());
        assertEquals("include-guard",
                result.getAsJsonArray("errors").get(0).getAsJsonObject().get("kind").getAsString());
    }
}
