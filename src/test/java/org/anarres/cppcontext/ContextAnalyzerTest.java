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
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class ContextAnalyzerTest {

    private static final String SAMPLE = "#ifndef CONFIG_H\n"
            + "#define CONFIG_H\n"
            + "#if defined(WINDOWS) && defined(DEBUG)\n"
            + "#  define LOG_LEVEL 3\n"
            + "#elif LEVEL >= 2\n"
            + "#  define LOG_LEVEL 2\n"
            + "#else\n"
            + "#  define LOG_LEVEL 0\n"
            + "#endif\n"
            + "#include <stdio.h>\n"
            + "#endif /* CONFIG_H */\n";

    private final ContextAnalyzer analyzer = new ContextAnalyzer();

    @Test
    void conditionTextIsVerbatim() {
        AnalysisResult result = analyzer.analyze("#if defined(WINDOWS) && defined(DEBUG)\n#define X\n#endif\n",
                "win.c", new AnalyzerOptions());
        DirectiveRecord directive = result.getDirectives("win.c").get(0);
        assertEquals("defined(WINDOWS) && defined(DEBUG)", directive.getCondition());
        DefineRecord define = result.getDefines().get(0);
        assertEquals("defined(WINDOWS) && defined(DEBUG)", define.getExpression());
        assertEquals(Arrays.asList("WINDOWS", "DEBUG"), Arrays.asList(define.getDependencies().toArray()));
    }

    @Test
    void analyzesACompleteFile() {
        AnalysisResult result = analyzer.analyze(SAMPLE, "config.h", new AnalyzerOptions());
        assertTrue(result.getErrors().isEmpty());
        assertEquals(11, result.getDirectiveCount());

        List<DefineRecord> levels = result.getDefines("LOG_LEVEL");
        assertEquals(3, levels.size());
        assertEquals("!CONFIG_H && defined(WINDOWS) && defined(DEBUG)", levels.get(0).getExpression());
        assertEquals("!CONFIG_H && LEVEL >= 2", levels.get(1).getExpression());
        assertEquals("!CONFIG_H && !(LEVEL >= 2)", levels.get(2).getExpression());
        assertEquals(2, levels.get(2).getDepth());

        FileSummary summary = result.getSummaries().get("config.h");
        assertEquals(11, summary.getLineCount());
        assertEquals(4, summary.getDefineCount());
        assertEquals(2, summary.getMaxDepth());
        assertEquals(2, summary.getCount(DirectiveKind.ENDIF));
        assertEquals(0, summary.getErrorCount());

        assertEquals(Integer.valueOf(1), result.getConditionUsage().get("!CONFIG_H"));
        assertEquals(4, result.getDefinesByContext().size());
        assertTrue(result.getGraph().getDependencies("CONFIG_H").isEmpty());
        assertEquals(4, result.getGraph().getDependencies("LOG_LEVEL").size());
    }

    @Test
    void analysisIsIdempotent() {
        AnalyzerOptions options = new AnalyzerOptions(Feature.STRICT);
        String broken = SAMPLE + "#else\n#ifdef A\n#define X\n#define X\n";
        String first = analyzer.analyze(broken, "broken.h", options).toJson().toString();
        String second = analyzer.analyze(broken, "broken.h", options).toJson().toString();
        assertEquals(first, second);
    }

    @Test
    void wellNestedFileHasNoStructuralErrors() {
        AnalysisResult result = analyzer.analyze("#if A\n#if B\n#else\n#endif\n#elif C\n#endif\n", "n.c",
                new AnalyzerOptions());
        for (ValidationError error : result.getErrors())
            assertFalse(error.getKind().getCategory() == ErrorKind.Category.STRUCTURAL);
        assertFalse(result.hasErrors(Severity.WARNING));
    }

    @Test
    void mergeOrdersFilesByPath() {
        AnalyzerOptions options = new AnalyzerOptions();
        AnalysisResult b = analyzer.analyze("#ifdef A\n#define B\n#endif\n#endif\n", "b.c", options);
        AnalysisResult a = analyzer.analyze("#ifdef A\n#define X\n#endif\n", "a.c", options);
        AnalysisResult merged = analyzer.merge(Arrays.asList(b, a));

        assertEquals(Arrays.asList("a.c", "b.c"), Arrays.asList(merged.getSummaries().keySet().toArray()));
        assertEquals(2, merged.getDefines().size());
        assertEquals("a.c", merged.getDefines().get(0).getPath());
        assertEquals(Integer.valueOf(2), merged.getConditionUsage().get("A"));
        assertEquals(1, merged.getErrors().size());
        assertEquals("b.c", merged.getErrors().get(0).getPath());
        assertEquals(7, merged.getDirectiveCount());

        AnalysisResult reversed = analyzer.merge(Arrays.asList(a, b));
        assertEquals(merged.toJson().toString(), reversed.toJson().toString());
    }

    @Test
    void mergeFindsCyclesAcrossFiles() {
        AnalyzerOptions options = new AnalyzerOptions();
        AnalysisResult one = analyzer.analyze("#ifdef B\n#define A\n#endif\n", "one.c", options);
        AnalysisResult two = analyzer.analyze("#ifdef A\n#define B\n#endif\n", "two.c", options);
        assertTrue(one.getErrors().isEmpty());
        assertTrue(two.getErrors().isEmpty());

        AnalysisResult merged = analyzer.merge(Arrays.asList(one, two));
        List<ValidationError> cycles = merged.getErrors(ErrorKind.CIRCULAR_DEPENDENCY);
        assertEquals(1, cycles.size());
        assertEquals("one.c", cycles.get(0).getPath());

        AnalysisResult again = analyzer.merge(Arrays.asList(merged, one));
        assertEquals(1, again.getErrors(ErrorKind.CIRCULAR_DEPENDENCY).size());
        assertEquals(2, again.getSummaries().size());
    }

    @Test
    void mergeOfNothingIsEmpty() {
        AnalysisResult merged = analyzer.merge(Collections.<AnalysisResult>emptyList());
        assertTrue(merged.getSummaries().isEmpty());
        assertTrue(merged.getErrors().isEmpty());
        assertTrue(merged.getGraph().getNodes().isEmpty());
    }

    @Test
    void analyzesFiles(@TempDir Path dir) throws IOException {
        File file = dir.resolve("f.c").toFile();
        FileUtils.writeStringToFile(file, "#ifdef A\n#define X\n", StandardCharsets.UTF_8);
        AnalysisResult result = analyzer.analyze(file, new AnalyzerOptions());
        assertEquals(1, result.getErrors(ErrorKind.MISSING_ENDIF).size());
        assertEquals(file.getPath(), result.getErrors().get(0).getPath());

        assertThrows(IOException.class,
                () -> analyzer.analyze(dir.resolve("missing.c").toFile(), new AnalyzerOptions()));
    }

    @Test
    void failureIsAFileError() {
        AnalysisResult result = AnalysisResult.failure("gone.c", new IOException("No such file"));
        assertEquals(1, result.getErrors().size());
        assertEquals(ErrorKind.FILE_ERROR, result.getErrors().get(0).getKind());
        assertEquals(0, result.getErrors().get(0).getLine());
        assertTrue(result.getSummaries().get("gone.c").isFailed());
        assertTrue(result.hasErrors(Severity.CRITICAL));
    }
}
