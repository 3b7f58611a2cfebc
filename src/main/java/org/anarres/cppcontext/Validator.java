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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Collects the findings of one file and runs the checks which need
 * the whole file.
 *
 * The {@link DirectiveLexer} and {@link ContextStackEngine} report
 * inline through {@link #error(ErrorKind, int, String)}; once the
 * file is done, {@link #check(List, AnalyzerOptions)} adds the
 * cross-directive findings. Nothing here throws on bad input.
 */
public class Validator {

    private static final String[] HEADER_SUFFIXES = {".h", ".hh", ".hpp", ".hxx", ".h++"};

    private final String path;
    @CheckForNull
    private final AnalysisListener listener;
    private final List<ValidationError> errors = new ArrayList<ValidationError>();

    public Validator(@Nonnull String path, @CheckForNull AnalysisListener listener) {
        this.path = path;
        this.listener = listener;
    }

    public Validator(@Nonnull String path) {
        this(path, null);
    }

    @Nonnull
    public String getPath() {
        return path;
    }

    /**
     * Records a finding.
     */
    public void error(@Nonnull ErrorKind kind, int line, @Nonnull String msg,
            @CheckForNull String suggestion, @CheckForNull String content) {
        report(new ValidationError(kind, path, line, msg, suggestion, content));
    }

    /**
     * Records a finding.
     *
     * @see #error(ErrorKind, int, String, String, String)
     */
    public void error(@Nonnull ErrorKind kind, int line, @Nonnull String msg) {
        error(kind, line, msg, null, null);
    }

    /**
     * Records a finding about a directive.
     *
     * @see #error(ErrorKind, int, String, String, String)
     */
    public void error(@Nonnull ErrorKind kind, @Nonnull DirectiveRecord directive,
            @Nonnull String msg, @CheckForNull String suggestion) {
        error(kind, directive.getLine(), msg, suggestion, directive.getContent());
    }

    /**
     * Records a finding made elsewhere, such as a dependency cycle.
     */
    public void report(@Nonnull ValidationError error) {
        errors.add(error);
        if (listener != null)
            listener.handleError(error);
    }

    @Nonnull
    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Runs the cross-directive checks over a finished file.
     *
     * @param directives the file's directives, with contexts attached.
     */
    public void check(@Nonnull List<DirectiveRecord> directives, @Nonnull AnalyzerOptions options) {
        checkIdentifiers(directives);
        checkDefinitions(directives);
        if (options.isStrict()) {
            checkReservedNames(directives);
            checkNamingConvention(directives);
            checkFunctionLikeMacros(directives);
            checkConditionStyle(directives);
            checkIncludeGuard(directives);
        }
    }

    /* Invalid names in #define, #undef, #ifdef and #ifndef. */
    private void checkIdentifiers(@Nonnull List<DirectiveRecord> directives) {
        for (DirectiveRecord directive : directives) {
            String symbol = directive.getSymbol();
            if (symbol == null || symbol.isEmpty())
                continue;   // reported by the lexer
            if (!Conditions.isIdentifier(symbol)) {
                error(ErrorKind.INVALID_IDENTIFIER, directive,
                        "Invalid symbol name '" + symbol + "' in #" + directive.getKeyword(),
                        "Symbol names must start with a letter or underscore, followed by"
                        + " letters, digits or underscores");
            }
        }
    }

    /* Duplicate definitions, undefs of unknown symbols and impossible contexts. */
    private void checkDefinitions(@Nonnull List<DirectiveRecord> directives) {
        // symbol -> (context expression -> first defining directive); #undef does not reset it
        Map<String, Map<String, DirectiveRecord>> seen = new HashMap<String, Map<String, DirectiveRecord>>();
        Set<String> defined = new HashSet<String>();
        for (DirectiveRecord directive : directives) {
            String symbol = directive.getSymbol();
            if (symbol == null || symbol.isEmpty())
                continue;
            switch (directive.getKind()) {
                case DEFINE: {
                    String expression = directive.getContext().getExpression();
                    Map<String, DirectiveRecord> byContext = seen.get(symbol);
                    if (byContext == null) {
                        byContext = new HashMap<String, DirectiveRecord>();
                        seen.put(symbol, byContext);
                    }
                    DirectiveRecord first = byContext.get(expression);
                    if (first != null) {
                        error(ErrorKind.DUPLICATE_DEFINITION, directive,
                                "Symbol '" + symbol + "' redefined"
                                + (expression.isEmpty() ? "" : " under " + expression),
                                "First defined at line " + first.getLine());
                    } else {
                        byContext.put(expression, directive);
                    }
                    defined.add(symbol);
                    checkContradiction(directive);
                    break;
                }
                case UNDEF:
                    if (!defined.contains(symbol)) {
                        error(ErrorKind.UNDEF_OF_UNKNOWN_SYMBOL, directive,
                                "#undef of symbol '" + symbol + "' which is not defined in this file",
                                null);
                    }
                    break;
                default:
                    break;
            }
        }
    }

    private void checkContradiction(@Nonnull DirectiveRecord directive) {
        List<String> conditions = directive.getContext().getConditions();
        Set<String> seen = new HashSet<String>(conditions);
        for (String condition : conditions) {
            String negated = Conditions.negate(condition);
            if (seen.contains(negated) && !condition.startsWith("!")) {
                error(ErrorKind.CONTRADICTORY_CONTEXT, directive,
                        "Definition of '" + directive.getSymbol() + "' is unreachable: context requires both "
                        + condition + " and " + negated,
                        null);
                return;
            }
        }
    }

    /* Identifiers reserved for the implementation. */
    private void checkReservedNames(@Nonnull List<DirectiveRecord> directives) {
        for (DirectiveRecord directive : directives) {
            if (directive.getKind() != DirectiveKind.DEFINE)
                continue;
            String symbol = directive.getSymbol();
            if (symbol != null && isReserved(symbol)) {
                error(ErrorKind.RESERVED_NAME, directive,
                        "Symbol name '" + symbol + "' may conflict with reserved identifiers",
                        "Avoid identifiers that start with an underscore and an uppercase letter,"
                        + " or contain a double underscore");
            }
        }
    }

    /* pp */ static boolean isReserved(@Nonnull String symbol) {
        if (symbol.length() >= 2 && symbol.charAt(0) == '_' && Character.isUpperCase(symbol.charAt(1)))
            return true;
        return symbol.contains("__");
    }

    /* Macro names written in words should be UPPER_CASE. */
    private void checkNamingConvention(@Nonnull List<DirectiveRecord> directives) {
        for (DirectiveRecord directive : directives) {
            if (directive.getKind() != DirectiveKind.DEFINE)
                continue;
            String symbol = directive.getSymbol();
            if (symbol == null || symbol.indexOf('_') < 0 || !Conditions.isIdentifier(symbol))
                continue;
            if (!isUpperCase(symbol)) {
                error(ErrorKind.NAMING_CONVENTION, directive,
                        "Macro '" + symbol + "' should be in UPPER_CASE by convention",
                        "Use UPPER_CASE for macro names");
            }
        }
    }

    /**
     * Returns true if symbol has at least one letter and no lower case
     * letter.
     */
    /* pp */ static boolean isUpperCase(@Nonnull String symbol) {
        boolean letters = false;
        for (int i = 0; i < symbol.length(); i++) {
            char c = symbol.charAt(i);
            if (Character.isLowerCase(c))
                return false;
            if (Character.isUpperCase(c))
                letters = true;
        }
        return letters;
    }

    private void checkFunctionLikeMacros(@Nonnull List<DirectiveRecord> directives) {
        for (DirectiveRecord directive : directives) {
            if (directive.getKind() == DirectiveKind.DEFINE && directive.isFunctionLike()) {
                error(ErrorKind.FUNCTION_LIKE_MACRO, directive,
                        "Function-like macro '" + directive.getSymbol() + "', consider an inline function",
                        "Consider a static inline or constexpr function instead of a function-like macro");
            }
        }
    }

    /* Operators which are probably typos in a #if. */
    private void checkConditionStyle(@Nonnull List<DirectiveRecord> directives) {
        for (DirectiveRecord directive : directives) {
            if (directive.getKind() != DirectiveKind.IF && directive.getKind() != DirectiveKind.ELIF)
                continue;
            String condition = directive.getCondition();
            if (condition == null || condition.isEmpty())
                continue;
            if (hasLoneOperator(condition, '=', "=!<>")) {
                error(ErrorKind.SUSPICIOUS_CONDITION, directive,
                        "Possible assignment operator in condition",
                        "Use == for comparison or != for inequality");
            }
            if (hasLoneOperator(condition, '&', "")) {
                error(ErrorKind.SUSPICIOUS_CONDITION, directive,
                        "Bitwise AND (&) in condition, did you mean logical AND (&&)?", null);
            }
            if (hasLoneOperator(condition, '|', "")) {
                error(ErrorKind.SUSPICIOUS_CONDITION, directive,
                        "Bitwise OR (|) in condition, did you mean logical OR (||)?", null);
            }
        }
    }

    /**
     * Returns true if c occurs neither doubled nor preceded by one of
     * the given characters.
     */
    /* pp */ static boolean hasLoneOperator(@Nonnull String text, char c, @Nonnull String prefixes) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != c)
                continue;
            boolean doubled = (i + 1 < text.length() && text.charAt(i + 1) == c)
                    || (i > 0 && text.charAt(i - 1) == c);
            boolean prefixed = i > 0 && prefixes.indexOf(text.charAt(i - 1)) >= 0;
            if (!doubled && !prefixed)
                return true;
        }
        return false;
    }

    /* #ifndef G / #define G / ... / #endif around a header. */
    private void checkIncludeGuard(@Nonnull List<DirectiveRecord> directives) {
        if (!isHeader(path) || directives.isEmpty())
            return;
        DirectiveRecord first = directives.get(0);
        DirectiveRecord last = directives.get(directives.size() - 1);
        if (directives.size() >= 3
                && first.getKind() == DirectiveKind.IFNDEF
                && directives.get(1).getKind() == DirectiveKind.DEFINE
                && last.getKind() == DirectiveKind.ENDIF
                && last.getContext().isEmpty()) {
            String guard = first.getSymbol();
            String define = directives.get(1).getSymbol();
            if (guard != null && !guard.equals(define)) {
                error(ErrorKind.INCLUDE_GUARD, directives.get(1),
                        "Include guard mismatch: " + guard + " vs " + define,
                        "Use the same symbol in #ifndef and #define");
            }
        } else if (first.getKind() != DirectiveKind.PRAGMA || !first.getBody().trim().equals("once")) {
            error(ErrorKind.INCLUDE_GUARD, 1, "Header file has no include guard",
                    "Add an #ifndef/#define guard at the top and #endif at the end, or #pragma once",
                    null);
        }
    }

    /* pp */ static boolean isHeader(@Nonnull String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (String suffix : HEADER_SUFFIXES)
            if (lower.endsWith(suffix))
                return true;
        return false;
    }

    /**
     * Converts the cycles of a dependency graph into findings, located
     * at the first definition of each cycle's first symbol.
     */
    @Nonnull
    public static List<ValidationError> cycleErrors(@Nonnull DependencyGraph graph,
            @Nonnull List<DefineRecord> defines) {
        List<ValidationError> out = new ArrayList<ValidationError>();
        for (List<String> cycle : graph.findCycles()) {
            String head = cycle.get(0);
            DefineRecord at = null;
            for (DefineRecord define : defines) {
                if (define.getSymbol().equals(head)) {
                    at = define;
                    break;
                }
            }
            StringBuilder buf = new StringBuilder("Circular dependency: ");
            for (String symbol : cycle)
                buf.append(symbol).append(" -> ");
            buf.append(head);
            out.add(new ValidationError(ErrorKind.CIRCULAR_DEPENDENCY,
                    at == null ? "" : at.getPath(), at == null ? 0 : at.getLine(),
                    buf.toString(),
                    "Break the cycle between the conditions guarding these definitions", null));
        }
        return out;
    }
}
