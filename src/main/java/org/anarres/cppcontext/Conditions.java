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

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nonnull;
import org.pcollections.OrderedPSet;
import org.pcollections.PSet;

/**
 * Builds canonical condition text for conditional directives and
 * extracts the symbols a condition refers to.
 *
 * Conditions are never evaluated. The text of an <code>#if</code> is
 * kept exactly as written so that reports show what the author wrote.
 */
public final class Conditions {

    /** Joins frame conditions in a derived context expression. */
    public static final String AND = " && ";

    private static final String DEFINED = "defined";

    /* Words which look like identifiers in a #if but are not symbols. */
    private static final Set<String> RESERVED = new HashSet<String>(Arrays.asList(
            "defined", "true", "false", "sizeof",
            "and", "and_eq", "bitand", "bitor", "compl", "not", "not_eq",
            "or", "or_eq", "xor", "xor_eq"));

    /* Operators whose parenthesized argument is not a symbol reference. */
    private static final Set<String> FEATURE_TESTS = new HashSet<String>(Arrays.asList(
            "__has_include", "__has_include_next", "__has_attribute",
            "__has_cpp_attribute", "__has_c_attribute", "__has_builtin",
            "__has_feature", "__has_extension", "__has_warning"));

    private Conditions() {
    }

    @Nonnull
    public static String forIfdef(@Nonnull String symbol) {
        return symbol;
    }

    @Nonnull
    public static String forIfndef(@Nonnull String symbol) {
        return "!" + symbol;
    }

    /**
     * Returns the negation of a condition text.
     *
     * A single term, <code>X</code> or <code>defined(X)</code>, gains
     * or loses a leading <code>!</code>; anything else is parenthesized.
     */
    @Nonnull
    public static String negate(@Nonnull String condition) {
        String text = condition.trim();
        if (isTerm(text))
            return "!" + text;
        if (text.startsWith("!") && isTerm(text.substring(1).trim()))
            return text.substring(1).trim();
        return "!(" + text + ")";
    }

    /* An identifier, or defined applied to one. */
    private static boolean isTerm(@Nonnull String text) {
        if (isIdentifier(text))
            return true;
        if (!text.startsWith(DEFINED))
            return false;
        String rest = text.substring(DEFINED.length()).trim();
        if (rest.startsWith("(") && rest.endsWith(")"))
            return isIdentifier(rest.substring(1, rest.length() - 1).trim());
        return rest.length() < text.length() - DEFINED.length() && isIdentifier(rest);
    }

    /**
     * Joins condition texts, outermost first, into a single expression.
     */
    @Nonnull
    public static String join(@Nonnull List<String> conditions) {
        StringBuilder buf = new StringBuilder();
        for (String condition : conditions) {
            if (buf.length() > 0)
                buf.append(AND);
            buf.append(condition);
        }
        return buf.toString();
    }

    public static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    public static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    /**
     * Returns true if the text is a well-formed C identifier.
     */
    public static boolean isIdentifier(@Nonnull String text) {
        if (text.isEmpty() || !isIdentifierStart(text.charAt(0)))
            return false;
        for (int i = 1; i < text.length(); i++)
            if (!isIdentifierPart(text.charAt(i)))
                return false;
        return true;
    }

    /**
     * Returns true if every ')' closes an earlier '('.
     */
    public static boolean hasBalancedParentheses(@Nonnull String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(text, i);
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (--depth < 0)
                    return false;
            }
        }
        return depth == 0;
    }

    /**
     * Extracts the symbols referenced by a condition, in order of
     * first appearance.
     *
     * Both <code>defined(X)</code> and bare identifiers count, so
     * <code>LEVEL &gt;= 2</code> refers to <code>LEVEL</code>.
     * Keywords, feature-test operators and their arguments, numbers
     * and literals are skipped.
     */
    @Nonnull
    public static PSet<String> referencedSymbols(@Nonnull String condition) {
        PSet<String> symbols = OrderedPSet.empty();
        int len = condition.length();
        int i = 0;
        while (i < len) {
            char c = condition.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(condition, i) + 1;
            } else if (Character.isDigit(c)
                    || (c == '.' && i + 1 < len && Character.isDigit(condition.charAt(i + 1)))) {
                i = skipNumber(condition, i);
            } else if (isIdentifierStart(c)) {
                int start = i;
                while (i < len && isIdentifierPart(condition.charAt(i)))
                    i++;
                String word = condition.substring(start, i);
                if (FEATURE_TESTS.contains(word)) {
                    i = skipArgument(condition, i);
                } else if (!RESERVED.contains(word)) {
                    symbols = symbols.plus(word);
                }
            } else {
                i++;
            }
        }
        return symbols;
    }

    /* Returns the index of the closing quote, or the last index. */
    private static int skipQuoted(String text, int start) {
        char quote = text.charAt(start);
        for (int i = start + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\')
                i++;
            else if (c == quote)
                return i;
        }
        return text.length() - 1;
    }

    /* pp-number: digits, letters, '.', '_' and signed exponents. */
    private static int skipNumber(String text, int start) {
        int i = start;
        while (i < text.length()) {
            char c = text.charAt(i);
            if ((c == '+' || c == '-') && i > start) {
                char p = Character.toLowerCase(text.charAt(i - 1));
                if (p != 'e' && p != 'p')
                    break;
            } else if (!isIdentifierPart(c) && c != '.' && c != '\'') {
                break;
            }
            i++;
        }
        return i;
    }

    /* Skips whitespace and a parenthesized argument following a word. */
    private static int skipArgument(String text, int start) {
        int i = start;
        while (i < text.length() && Character.isWhitespace(text.charAt(i)))
            i++;
        if (i >= text.length() || text.charAt(i) != '(')
            return start;
        int depth = 0;
        for (; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipQuoted(text, i);
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (--depth == 0)
                    return i + 1;
            }
        }
        return text.length();
    }
}
