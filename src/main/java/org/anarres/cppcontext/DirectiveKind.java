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

import java.util.HashMap;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The closed set of directive kinds recognised by the {@link DirectiveLexer}.
 *
 * Keywords which are not listed here (<code>#line</code>, <code>#ident</code>,
 * <code>#include_next</code>, ...) lex as {@link #UNKNOWN}.
 */
public enum DirectiveKind {

    DEFINE("define"),
    UNDEF("undef"),
    IFDEF("ifdef"),
    IFNDEF("ifndef"),
    IF("if"),
    ELIF("elif"),
    ELSE("else"),
    ENDIF("endif"),
    INCLUDE("include"),
    PRAGMA("pragma"),
    WARNING("warning"),
    ERROR("error"),
    UNKNOWN(null);

    private static final Map<String, DirectiveKind> map;

    static {
        map = new HashMap<String, DirectiveKind>();
        for (DirectiveKind kind : values())
            if (kind.text != null)
                map.put(kind.text, kind);
    }

    @CheckForNull
    private final String text;

    DirectiveKind(@CheckForNull String text) {
        this.text = text;
    }

    /**
     * Returns the directive keyword, or null for {@link #UNKNOWN}.
     */
    @CheckForNull
    public String getText() {
        return text;
    }

    /**
     * Maps a directive keyword to its kind.
     *
     * Unrecognised keywords map to {@link #UNKNOWN}; the match is
     * case sensitive, as in the C preprocessor.
     */
    @Nonnull
    public static DirectiveKind forText(@Nonnull String text) {
        DirectiveKind kind = map.get(text);
        return kind == null ? UNKNOWN : kind;
    }
}
