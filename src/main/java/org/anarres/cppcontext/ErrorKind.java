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

import javax.annotation.Nonnull;

/**
 * The kinds of finding recorded in an {@link AnalysisResult}.
 *
 * Each kind belongs to one {@link Category} and carries a fixed
 * {@link Severity}.
 */
public enum ErrorKind {

    UNMATCHED_ENDIF(Category.STRUCTURAL, Severity.CRITICAL),
    MISSING_ENDIF(Category.STRUCTURAL, Severity.CRITICAL),
    ORPHAN_ELSE(Category.STRUCTURAL, Severity.ERROR),
    ORPHAN_ELIF(Category.STRUCTURAL, Severity.ERROR),
    ELSE_AFTER_ELSE(Category.STRUCTURAL, Severity.ERROR),
    ELIF_AFTER_ELSE(Category.STRUCTURAL, Severity.ERROR),

    EMPTY_CONDITION(Category.SYNTAX, Severity.ERROR),
    MALFORMED_DIRECTIVE(Category.SYNTAX, Severity.ERROR),
    MISSING_SYMBOL_NAME(Category.SYNTAX, Severity.ERROR),
    UNKNOWN_DIRECTIVE(Category.SYNTAX, Severity.WARNING),

    DUPLICATE_DEFINITION(Category.SEMANTIC, Severity.WARNING),
    INVALID_IDENTIFIER(Category.SEMANTIC, Severity.ERROR),
    RESERVED_NAME(Category.SEMANTIC, Severity.WARNING),
    NAMING_CONVENTION(Category.SEMANTIC, Severity.WARNING),
    FUNCTION_LIKE_MACRO(Category.SEMANTIC, Severity.WARNING),
    UNDEF_OF_UNKNOWN_SYMBOL(Category.SEMANTIC, Severity.WARNING),
    CONTRADICTORY_CONTEXT(Category.SEMANTIC, Severity.WARNING),
    SUSPICIOUS_CONDITION(Category.SEMANTIC, Severity.WARNING),
    INCLUDE_GUARD(Category.SEMANTIC, Severity.WARNING),

    CIRCULAR_DEPENDENCY(Category.GRAPH, Severity.WARNING),

    FILE_ERROR(Category.FILE, Severity.CRITICAL);

    public enum Category {
        STRUCTURAL, SYNTAX, SEMANTIC, GRAPH, FILE
    }

    private final Category category;
    private final Severity severity;

    ErrorKind(@Nonnull Category category, @Nonnull Severity severity) {
        this.category = category;
        this.severity = severity;
    }

    @Nonnull
    public Category getCategory() {
        return category;
    }

    @Nonnull
    public Severity getSeverity() {
        return severity;
    }

    /** Returns the kind as it is spelled in reports, e.g. "unmatched-endif". */
    @Nonnull
    public String getLabel() {
        return name().toLowerCase().replace('_', '-');
    }
}
