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
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits source text into logical lines and returns the preprocessor
 * directives among them.
 *
 * Backslash-newline sequences are joined and comments are replaced by
 * a space before a line is examined, so a block comment which spans
 * lines inside a directive continues the directive. Malformed
 * directives are reported to the {@link Validator} and still returned;
 * the lexer never gives up on a file.
 */
public class DirectiveLexer {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveLexer.class);

    private final String path;
    private final Validator validator;
    private final AnalyzerOptions options;
    private final String[] lines;
    private int index;
    private boolean inComment;
    /* Where each physical line group of the current logical line starts. */
    private final List<Integer> segmentOffsets = new ArrayList<Integer>();
    private final List<Integer> segmentLines = new ArrayList<Integer>();

    public DirectiveLexer(@Nonnull String text, @Nonnull String path,
            @Nonnull Validator validator, @Nonnull AnalyzerOptions options) {
        this.path = path;
        this.validator = validator;
        this.options = options;
        this.lines = split(text);
        this.index = 0;
        this.inComment = false;
    }

    /* Splits on \n, \r\n and \r. A trailing newline does not start a line. */
    @Nonnull
    private static String[] split(@Nonnull String text) {
        List<String> out = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                out.add(text.substring(start, i));
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n')
                    i++;
                start = i + 1;
            }
        }
        if (start < text.length())
            out.add(text.substring(start));
        return out.toArray(new String[out.size()]);
    }

    /**
     * Returns the number of physical lines in the text.
     */
    @Nonnegative
    public int getLineCount() {
        return lines.length;
    }

    /**
     * Returns the next directive, or null at the end of the text.
     *
     * The returned record has an empty context.
     */
    @CheckForNull
    public DirectiveRecord next() {
        while (index < lines.length) {
            String text = logicalLine();
            String content = text.trim();
            int line = lineAt(text.indexOf(content));
            DirectiveRecord directive = directive(content, line);
            if (directive != null) {
                if (options.getFeature(Feature.DEBUG))
                    LOG.debug("lex: " + directive);
                return directive;
            }
        }
        return null;
    }

    /* The physical line holding the given offset of the last logical line. */
    private int lineAt(int offset) {
        int line = segmentLines.get(0);
        for (int i = 1; i < segmentOffsets.size(); i++) {
            if (segmentOffsets.get(i) > offset)
                break;
            line = segmentLines.get(i);
        }
        return line;
    }

    /**
     * Reads the next logical line with comments removed.
     *
     * Continues over backslash-newline, and over newlines inside a
     * block comment, which C replaces by a single space.
     */
    @Nonnull
    private String logicalLine() {
        StringBuilder buf = new StringBuilder();
        segmentOffsets.clear();
        segmentLines.clear();
        for (;;) {
            segmentOffsets.add(buf.length());
            segmentLines.add(index + 1);
            StringBuilder raw = new StringBuilder();
            while (index < lines.length) {
                String physical = lines[index++];
                if (endsWithBackslash(physical)) {
                    raw.append(physical, 0, physical.lastIndexOf('\\'));
                } else {
                    raw.append(physical);
                    break;
                }
            }
            strip(raw, buf);
            if (!inComment || index >= lines.length)
                break;
        }
        return buf.toString();
    }

    private static boolean endsWithBackslash(@Nonnull String physical) {
        int i = physical.length() - 1;
        while (i >= 0 && (physical.charAt(i) == ' ' || physical.charAt(i) == '\t'))
            i--;
        return i >= 0 && physical.charAt(i) == '\\';
    }

    /* Appends raw to out with comments replaced by a space. */
    private void strip(@Nonnull CharSequence raw, @Nonnull StringBuilder out) {
        int len = raw.length();
        int i = 0;
        while (i < len) {
            char c = raw.charAt(i);
            if (inComment) {
                if (c == '*' && i + 1 < len && raw.charAt(i + 1) == '/') {
                    inComment = false;
                    out.append(' ');
                    i += 2;
                } else {
                    i++;
                }
            } else if (c == '/' && i + 1 < len && raw.charAt(i + 1) == '/') {
                return;
            } else if (c == '/' && i + 1 < len && raw.charAt(i + 1) == '*') {
                inComment = true;
                i += 2;
            } else if (c == '\'' && isDigitSeparator(raw, i)) {
                out.append(c);
                i++;
            } else if (c == '"' || c == '\'') {
                int end = i + 1;
                while (end < len && raw.charAt(end) != c) {
                    if (raw.charAt(end) == '\\')
                        end++;
                    end++;
                }
                end = Math.min(end + 1, len);
                out.append(raw, i, end);
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
    }

    /* True if the quote at index i continues a number, as in 1'000 or 0xFF'FF. */
    private static boolean isDigitSeparator(@Nonnull CharSequence raw, int i) {
        int start = i;
        while (start > 0 && (Conditions.isIdentifierPart(raw.charAt(start - 1)) || raw.charAt(start - 1) == '\''))
            start--;
        if (start == i || !Character.isDigit(raw.charAt(start)))
            return false;
        return i + 1 < raw.length() && Conditions.isIdentifierPart(raw.charAt(i + 1));
    }

    /* Returns the length of the identifier-like word at the start of text. */
    private static int word(@Nonnull String text) {
        int i = 0;
        while (i < text.length() && Conditions.isIdentifierPart(text.charAt(i)))
            i++;
        return i;
    }

    /**
     * Parses one logical line, already trimmed.
     */
    @CheckForNull
    private DirectiveRecord directive(@Nonnull String content, int line) {
        if (!content.startsWith("#"))
            return null;
        String rest = content.substring(1).trim();
        if (rest.isEmpty())
            return null;    /* Some code has #\n */

        int len = word(rest);
        if (len == 0 || !Conditions.isIdentifierStart(rest.charAt(0))) {
            validator.error(ErrorKind.MALFORMED_DIRECTIVE, line,
                    "Preprocessor directive not a word: " + content, null, content);
            return record(DirectiveKind.UNKNOWN, "", content, line, null, null, rest);
        }
        String keyword = rest.substring(0, len);
        rest = rest.substring(len).trim();
        DirectiveKind kind = DirectiveKind.forText(keyword);

        switch (kind) {
            case DEFINE:
                return define(keyword, content, line, rest);

            case UNDEF: {
                String symbol = rest.substring(0, word(rest));
                String extra = rest.substring(symbol.length()).trim();
                if (symbol.isEmpty()) {
                    validator.error(ErrorKind.MISSING_SYMBOL_NAME, line,
                            "#undef directive missing symbol name",
                            "Add a symbol name after #undef", content);
                } else if (!extra.isEmpty()) {
                    validator.error(ErrorKind.MALFORMED_DIRECTIVE, line,
                            "Extra tokens at end of #undef directive: " + extra, null, content);
                }
                return record(kind, keyword, content, line, symbol, null, extra);
            }

            case IFDEF:
            case IFNDEF: {
                String symbol = rest.substring(0, word(rest));
                String extra = rest.substring(symbol.length()).trim();
                String condition;
                if (rest.isEmpty()) {
                    validator.error(ErrorKind.EMPTY_CONDITION, line,
                            "#" + keyword + " directive missing symbol name",
                            "Add a symbol name after #" + keyword, content);
                    condition = "";
                } else if (symbol.isEmpty()) {
                    validator.error(ErrorKind.MALFORMED_DIRECTIVE, line,
                            "Expected identifier after #" + keyword + ", not " + rest,
                            null, content);
                    condition = "";
                } else {
                    if (!extra.isEmpty())
                        validator.error(ErrorKind.MALFORMED_DIRECTIVE, line,
                                "Extra tokens at end of #" + keyword + " directive: " + extra,
                                null, content);
                    condition = kind == DirectiveKind.IFDEF
                            ? Conditions.forIfdef(symbol)
                            : Conditions.forIfndef(symbol);
                }
                return record(kind, keyword, content, line, symbol, condition, extra);
            }

            case IF:
            case ELIF:
                if (rest.isEmpty()) {
                    validator.error(ErrorKind.EMPTY_CONDITION, line,
                            "#" + keyword + " directive missing condition expression",
                            "Add a condition expression after #" + keyword, content);
                } else if (!Conditions.hasBalancedParentheses(rest)) {
                    validator.error(ErrorKind.MALFORMED_DIRECTIVE, line,
                            "Unbalanced parentheses in condition expression",
                            "Check that every opening parenthesis has a matching closing parenthesis",
                            content);
                }
                return record(kind, keyword, content, line, null, rest, rest);

            case ELSE:
            case ENDIF:
                if (!rest.isEmpty() && options.getFeature(Feature.ENDIF_LABELS))
                    validator.error(ErrorKind.MALFORMED_DIRECTIVE, line,
                            "Extra tokens at end of #" + keyword + " directive: " + rest,
                            "Put the label in a comment", content);
                return record(kind, keyword, content, line, null, null, rest);

            case INCLUDE:
                if (!isIncludeTarget(rest))
                    validator.error(ErrorKind.MALFORMED_DIRECTIVE, line,
                            "#include expects \"FILENAME\" or <FILENAME>",
                            "Add a file path in quotes or angle brackets after #include", content);
                return record(kind, keyword, content, line, null, null, rest);

            case PRAGMA:
            case WARNING:
            case ERROR:
                return record(kind, keyword, content, line, null, null, rest);

            case UNKNOWN:
                validator.error(ErrorKind.UNKNOWN_DIRECTIVE, line,
                        "Unknown preprocessor directive #" + keyword, null, content);
                return record(kind, keyword, content, line, null, null, rest);

            default:
                throw new InternalException("Unhandled directive kind " + kind);
        }
    }

    @Nonnull
    private DirectiveRecord define(@Nonnull String keyword, @Nonnull String content, int line,
            @Nonnull String rest) {
        String symbol = rest.substring(0, word(rest));
        String body;
        boolean functionLike = false;
        if (symbol.isEmpty()) {
            validator.error(ErrorKind.MISSING_SYMBOL_NAME, line,
                    rest.isEmpty()
                    ? "#define directive missing symbol name"
                    : "Expected identifier after #define, not " + rest,
                    "Add a valid symbol name after #define", content);
            body = rest;
        } else {
            body = rest.substring(symbol.length());
            /* A parameter list must follow the name immediately. */
            functionLike = body.startsWith("(");
            if (!functionLike)
                body = body.trim();
        }
        return new DirectiveRecord(DirectiveKind.DEFINE, keyword, content, path, line, symbol, null,
                body, functionLike, ContextStack.EMPTY);
    }

    private static boolean isIncludeTarget(@Nonnull String rest) {
        if (rest.length() >= 2 && rest.charAt(0) == '<')
            return rest.indexOf('>') > 1;
        if (rest.length() >= 2 && rest.charAt(0) == '"')
            return rest.indexOf('"', 1) > 1;
        /* Computed include, e.g. #include HEADER */
        return !rest.isEmpty() && Conditions.isIdentifierStart(rest.charAt(0));
    }

    @Nonnull
    private DirectiveRecord record(@Nonnull DirectiveKind kind, @Nonnull String keyword,
            @Nonnull String content, int line, @CheckForNull String symbol,
            @CheckForNull String condition, @Nonnull String body) {
        return new DirectiveRecord(kind, keyword, content, path, line, symbol, condition, body,
                false, ContextStack.EMPTY);
    }

    /**
     * Lexes the whole text.
     */
    @Nonnull
    public List<DirectiveRecord> directives() {
        List<DirectiveRecord> out = new ArrayList<DirectiveRecord>();
        for (DirectiveRecord directive = next(); directive != null; directive = next())
            out.add(directive);
        return out;
    }
}
