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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ValidatorTest {

    private static List<ErrorKind> kinds(String path, String text, Feature... features) {
        AnalysisResult result = new ContextAnalyzer().analyze(text, path, new AnalyzerOptions(features));
        List<ErrorKind> out = new ArrayList<ErrorKind>();
        for (ValidationError error : result.getErrors())
            out.add(error.getKind());
        return out;
    }

    private static List<ErrorKind> kinds(String text, Feature... features) {
        return kinds("test.c", text, features);
    }

    @Test
    void duplicateDefinitionInSameContext() {
        AnalysisResult result = new ContextAnalyzer().analyze(
                "#ifdef A\n#define X 1\n#define X 2\n#endif\n", "dup.c", new AnalyzerOptions());
        assertEquals(1, result.getErrors().size());
        ValidationError error = result.getErrors().get(0);
        assertEquals(ErrorKind.DUPLICATE_DEFINITION, error.getKind());
        assertEquals(3, error.getLine());
        assertEquals("First defined at line 2", error.getSuggestion());
        assertEquals("#define X 2", error.getContent());
    }

    @Test
    void differentContextsAreNotDuplicates() {
        assertEquals(Collections.emptyList(),
                kinds("#ifdef A\n#define X\n#else\n#define X\n#endif\n"));
    }

    @Test
    void undefDoesNotResetDuplicateTracking() {
        AnalysisResult result = new ContextAnalyzer().analyze(
                "#define X 1\n#undef X\n#define X 2\n", "redef.c", new AnalyzerOptions());
        assertEquals(2, result.getDefines("X").size());
        assertEquals(1, result.getErrors().size());
        ValidationError error = result.getErrors().get(0);
        assertEquals(ErrorKind.DUPLICATE_DEFINITION, error.getKind());
        assertEquals(3, error.getLine());
        assertEquals("First defined at line 1", error.getSuggestion());
    }

    @Test
    void undefOfUnknownSymbol() {
        assertEquals(Collections.singletonList(ErrorKind.UNDEF_OF_UNKNOWN_SYMBOL), kinds("#undef NEVER\n"));
    }

    @Test
    void invalidIdentifiers() {
        assertEquals(Arrays.asList(ErrorKind.INVALID_IDENTIFIER, ErrorKind.INVALID_IDENTIFIER),
                kinds("#define 9LIVES\n#ifdef 2X\n#endif\n"));
    }

    @Test
    void missingNameIsNotAlsoInvalid() {
        assertEquals(Collections.singletonList(ErrorKind.MISSING_SYMBOL_NAME), kinds("#define\n"));
    }

    @Test
    void contradictoryContext() {
        assertEquals(Collections.singletonList(ErrorKind.CONTRADICTORY_CONTEXT),
                kinds("#ifdef A\n#ifndef A\n#define X\n#endif\n#endif\n"));
    }

    @Test
    void reservedNamesOnlyInStrictMode() {
        String text = "#define _RESERVED 1\n#define HAS__DOUBLE 2\n#define fine 3\n";
        assertEquals(Collections.emptyList(), kinds(text));
        assertEquals(Arrays.asList(ErrorKind.RESERVED_NAME, ErrorKind.RESERVED_NAME),
                kinds(text, Feature.STRICT));
        assertTrue(Validator.isReserved("__FOO"));
        assertFalse(Validator.isReserved("_foo"));
    }

    @Test
    void namingConventionOnlyInStrictMode() {
        String text = "#define max_size 1\n#define Mixed_Case 2\n#define UPPER_CASE 3\n"
                + "#define plain 4\n#define _1 5\n";
        assertEquals(Collections.emptyList(), kinds(text));
        List<ValidationError> errors = new ContextAnalyzer()
                .analyze(text, "names.c", new AnalyzerOptions(Feature.STRICT))
                .getErrors(ErrorKind.NAMING_CONVENTION);
        assertEquals(3, errors.size());
        assertEquals(1, errors.get(0).getLine());
        assertEquals("Macro 'max_size' should be in UPPER_CASE by convention", errors.get(0).getMessage());
        assertEquals(2, errors.get(1).getLine());
        assertEquals(5, errors.get(2).getLine());
        assertTrue(Validator.isUpperCase("HAVE_2_THREADS"));
        assertFalse(Validator.isUpperCase("__"));
    }

    @Test
    void functionLikeMacrosOnlyInStrictMode() {
        String text = "#define SQUARE(x) ((x) * (x))\n#define PAREN (1 + 2)\n#define EMPTY()\n";
        assertEquals(Collections.emptyList(), kinds(text));
        AnalysisResult result = new ContextAnalyzer().analyze(text, "macros.c",
                new AnalyzerOptions(Feature.STRICT));
        List<ValidationError> errors = result.getErrors(ErrorKind.FUNCTION_LIKE_MACRO);
        assertEquals(2, errors.size());
        assertEquals(1, errors.get(0).getLine());
        assertEquals("#define SQUARE(x) ((x) * (x))", errors.get(0).getContent());
        assertEquals(3, errors.get(1).getLine());
        assertEquals(Severity.WARNING, errors.get(0).getSeverity());
    }

    @Test
    void suspiciousConditions() {
        String text = "#if A = 1\n#elif A & B\n#elif A | B\n#elif A == 1 && B != 2 || C <= 3\n#endif\n";
        assertEquals(Collections.emptyList(), kinds(text));
        assertEquals(Arrays.asList(ErrorKind.SUSPICIOUS_CONDITION, ErrorKind.SUSPICIOUS_CONDITION,
                ErrorKind.SUSPICIOUS_CONDITION), kinds(text, Feature.STRICT));
    }

    @Test
    void includeGuards() {
        assertEquals(Collections.emptyList(),
                kinds("guarded.h", "#ifndef GUARDED_H\n#define GUARDED_H\n#include <x.h>\n#endif\n", Feature.STRICT));
        assertEquals(Collections.emptyList(),
                kinds("once.hpp", "#pragma once\n#define Y\n", Feature.STRICT));
        assertEquals(Collections.singletonList(ErrorKind.INCLUDE_GUARD),
                kinds("bare.h", "#define Y\n", Feature.STRICT));
        assertEquals(Collections.singletonList(ErrorKind.INCLUDE_GUARD),
                kinds("typo.h", "#ifndef TYPO_H\n#define TYPO_HH\n#endif\n", Feature.STRICT));
        assertEquals(Collections.emptyList(),
                kinds("source.c", "#define Y\n", Feature.STRICT));
    }

    @Test
    void headerDetection() {
        assertTrue(Validator.isHeader("include/foo.H"));
        assertTrue(Validator.isHeader("foo.hpp"));
        assertFalse(Validator.isHeader("foo.c"));
    }

    @Test
    void listenerReceivesEveryFinding() {
        DefaultAnalysisListener listener = new DefaultAnalysisListener();
        ContextAnalyzer analyzer = new ContextAnalyzer(listener);
        AnalysisResult result = analyzer.analyze("#endif\n#define X\n#define X\n", "l.c", new AnalyzerOptions());
        assertEquals(2, result.getErrors().size());
        assertEquals(1, listener.getErrors());
        assertEquals(1, listener.getWarnings());
        listener.reset();
        assertEquals(0, listener.getErrors());

        analyzer.setListener(null);
        analyzer.analyze("#endif\n", "l.c", new AnalyzerOptions());
        assertEquals(0, listener.getErrors());
    }

    @Test
    void errorsFormatWithLocation() {
        ValidationError error = new ValidationError(ErrorKind.UNMATCHED_ENDIF, "a.c", 4, "#endif without #if");
        assertEquals("a.c:4: critical: #endif without #if [unmatched-endif]", error.toString());
        assertEquals(ErrorKind.Category.STRUCTURAL, error.getKind().getCategory());
    }
}
