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
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * A single finding: a structural, syntax, semantic or graph problem
 * located at a line of a file.
 *
 * Line 0 denotes a finding about the file as a whole.
 */
public final class ValidationError {

    private final ErrorKind kind;
    private final String path;
    private final int line;
    private final String message;
    @CheckForNull
    private final String suggestion;
    @CheckForNull
    private final String content;

    public ValidationError(@Nonnull ErrorKind kind, @Nonnull String path, @Nonnegative int line,
            @Nonnull String message, @CheckForNull String suggestion, @CheckForNull String content) {
        this.kind = kind;
        this.path = path;
        this.line = line;
        this.message = message;
        this.suggestion = suggestion;
        this.content = content;
    }

    public ValidationError(@Nonnull ErrorKind kind, @Nonnull String path, @Nonnegative int line,
            @Nonnull String message) {
        this(kind, path, line, message, null, null);
    }

    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }

    @Nonnull
    public Severity getSeverity() {
        return kind.getSeverity();
    }

    @Nonnull
    public String getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    @CheckForNull
    public String getSuggestion() {
        return suggestion;
    }

    /** The directive text the finding refers to, if any. */
    @CheckForNull
    public String getContent() {
        return content;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("kind", kind.getLabel());
        result.addProperty("category", kind.getCategory().name().toLowerCase());
        result.addProperty("severity", getSeverity().name().toLowerCase());
        result.addProperty("file", path);
        result.addProperty("line", line);
        result.addProperty("message", message);
        if (suggestion != null)
            result.addProperty("suggestion", suggestion);
        if (content != null)
            result.addProperty("content", content);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ValidationError))
            return false;
        ValidationError o = (ValidationError) obj;
        return kind == o.kind
                && line == o.line
                && path.equals(o.path)
                && message.equals(o.message)
                && (suggestion == null ? o.suggestion == null : suggestion.equals(o.suggestion))
                && (content == null ? o.content == null : content.equals(o.content));
    }

    @Override
    public int hashCode() {
        return ((kind.hashCode() * 31 + path.hashCode()) * 31 + line) * 31 + message.hashCode();
    }

    @Override
    public String toString() {
        return path + ":" + line + ": " + getSeverity().name().toLowerCase()
                + ": " + message + " [" + kind.getLabel() + "]";
    }
}
