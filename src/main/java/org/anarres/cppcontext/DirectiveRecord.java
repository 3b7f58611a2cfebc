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

import com.google.gson.JsonObject;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A preprocessor directive as found in a source file.
 *
 * The lexer emits records with an empty context; the
 * {@link ContextStackEngine} attaches the stack in effect through
 * {@link #withContext(ContextStack)}, which returns a new record.
 */
public final class DirectiveRecord {

    private final DirectiveKind kind;
    private final String keyword;
    private final String content;
    private final String path;
    private final int line;
    @CheckForNull
    private final String symbol;
    @CheckForNull
    private final String condition;
    private final String body;
    private final boolean functionLike;
    private final ContextStack context;

    public DirectiveRecord(@Nonnull DirectiveKind kind, @Nonnull String keyword,
            @Nonnull String content, @Nonnull String path, int line,
            @CheckForNull String symbol, @CheckForNull String condition, @Nonnull String body,
            boolean functionLike, @Nonnull ContextStack context) {
        this.kind = kind;
        this.keyword = keyword;
        this.content = content;
        this.path = path;
        this.line = line;
        this.symbol = symbol;
        this.condition = condition;
        this.body = body;
        this.functionLike = functionLike;
        this.context = context;
    }

    @Nonnull
    public DirectiveRecord withContext(@Nonnull ContextStack context) {
        return new DirectiveRecord(kind, keyword, content, path, line, symbol, condition, body,
                functionLike, context);
    }

    @Nonnull
    public DirectiveKind getKind() {
        return kind;
    }

    /** The directive keyword as written, e.g. "ifdef" or "ident". */
    @Nonnull
    public String getKeyword() {
        return keyword;
    }

    /** The whole logical line, comments removed. */
    @Nonnull
    public String getContent() {
        return content;
    }

    @Nonnull
    public String getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

    /**
     * The symbol of a <code>#define</code>, <code>#undef</code>,
     * <code>#ifdef</code> or <code>#ifndef</code>. May be empty if the
     * directive named none.
     */
    @CheckForNull
    public String getSymbol() {
        return symbol;
    }

    /**
     * The canonical condition text of a conditional directive:
     * "SYM" for <code>#ifdef</code>, "!SYM" for <code>#ifndef</code>,
     * the trimmed expression for <code>#if</code> and <code>#elif</code>.
     * Empty if the directive had no condition; null for other kinds.
     */
    @CheckForNull
    public String getCondition() {
        return condition;
    }

    /**
     * Everything after the symbol of a <code>#define</code>, or after
     * the keyword for other directives.
     */
    @Nonnull
    public String getBody() {
        return body;
    }

    /**
     * True for a <code>#define</code> whose name is followed immediately
     * by a parameter list.
     */
    public boolean isFunctionLike() {
        return functionLike;
    }

    @Nonnull
    public ContextStack getContext() {
        return context;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("kind", kind.name().toLowerCase());
        result.addProperty("line", line);
        result.addProperty("content", content);
        if (symbol != null)
            result.addProperty("symbol", symbol);
        if (condition != null)
            result.addProperty("condition", condition);
        result.add("context", context.toJson());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof DirectiveRecord))
            return false;
        DirectiveRecord o = (DirectiveRecord) obj;
        return kind == o.kind && line == o.line && functionLike == o.functionLike
                && keyword.equals(o.keyword) && content.equals(o.content)
                && path.equals(o.path) && body.equals(o.body)
                && (symbol == null ? o.symbol == null : symbol.equals(o.symbol))
                && (condition == null ? o.condition == null : condition.equals(o.condition))
                && context.equals(o.context);
    }

    @Override
    public int hashCode() {
        return (path.hashCode() * 31 + line) * 31 + content.hashCode();
    }

    @Override
    public String toString() {
        return path + ":" + line + ": " + content;
    }
}
