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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.pcollections.PSet;

/**
 * A <code>#define</code> together with the context it was made in.
 *
 * The context is the stack value at the moment of definition; since
 * {@link ContextStack} is persistent, later directives can never
 * change it.
 */
public final class DefineRecord {

    private final String symbol;
    private final String path;
    private final int line;
    private final String body;
    private final boolean functionLike;
    private final ContextStack context;
    private final String expression;
    private final PSet<String> dependencies;

    public DefineRecord(@Nonnull String symbol, @Nonnull String path, int line,
            @Nonnull String body, boolean functionLike, @Nonnull ContextStack context) {
        this.symbol = symbol;
        this.path = path;
        this.line = line;
        this.body = body;
        this.functionLike = functionLike;
        this.context = context;
        this.expression = context.getExpression();
        this.dependencies = context.getReferencedSymbols();
    }

    @Nonnull
    public String getSymbol() {
        return symbol;
    }

    @Nonnull
    public String getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

    /** The replacement list, preceded by the parameter list if any. */
    @Nonnull
    public String getBody() {
        return body;
    }

    public boolean isFunctionLike() {
        return functionLike;
    }

    @Nonnull
    public ContextStack getContext() {
        return context;
    }

    /**
     * The AND-join of the enclosing conditions, outermost first, or ""
     * for an unconditional definition.
     */
    @Nonnull
    public String getExpression() {
        return expression;
    }

    /** The symbols referenced by the enclosing conditions. */
    @Nonnull
    public PSet<String> getDependencies() {
        return dependencies;
    }

    @Nonnegative
    public int getDepth() {
        return context.depth();
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("symbol", symbol);
        result.addProperty("file", path);
        result.addProperty("line", line);
        if (!body.isEmpty())
            result.addProperty("body", body);
        if (functionLike)
            result.addProperty("functionLike", true);
        result.addProperty("context", expression);
        result.addProperty("depth", getDepth());
        JsonArray deps = new JsonArray();
        for (String dep : dependencies)
            deps.add(dep);
        result.add("dependencies", deps);
        JsonArray frames = new JsonArray();
        for (ContextFrame frame : context)
            frames.add(frame.toJson());
        result.add("frames", frames);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof DefineRecord))
            return false;
        DefineRecord o = (DefineRecord) obj;
        return line == o.line && symbol.equals(o.symbol) && path.equals(o.path)
                && body.equals(o.body) && context.equals(o.context);
    }

    @Override
    public int hashCode() {
        return (symbol.hashCode() * 31 + path.hashCode()) * 31 + line;
    }

    @Override
    public String toString() {
        return symbol + " [" + expression + "] " + path + ":" + line;
    }
}
