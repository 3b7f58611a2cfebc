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
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * Per-file statistics of an analysis.
 */
public final class FileSummary {

    private final String path;
    private final int lineCount;
    private final int directiveCount;
    private final int defineCount;
    private final int errorCount;
    private final int maxDepth;
    private final Map<DirectiveKind, Integer> kindCounts;
    private final Map<String, Integer> conditionUsage;
    private final boolean failed;

    public FileSummary(@Nonnull String path, @Nonnegative int lineCount,
            @Nonnegative int directiveCount, @Nonnegative int defineCount,
            @Nonnegative int errorCount, @Nonnegative int maxDepth,
            @Nonnull Map<DirectiveKind, Integer> kindCounts,
            @Nonnull Map<String, Integer> conditionUsage, boolean failed) {
        this.path = path;
        this.lineCount = lineCount;
        this.directiveCount = directiveCount;
        this.defineCount = defineCount;
        this.errorCount = errorCount;
        this.maxDepth = maxDepth;
        EnumMap<DirectiveKind, Integer> counts = new EnumMap<DirectiveKind, Integer>(DirectiveKind.class);
        counts.putAll(kindCounts);
        this.kindCounts = Collections.unmodifiableMap(counts);
        this.conditionUsage = Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(conditionUsage));
        this.failed = failed;
    }

    /** A summary for a file which could not be read or analyzed. */
    @Nonnull
    public static FileSummary failed(@Nonnull String path) {
        return new FileSummary(path, 0, 0, 0, 1, 0,
                Collections.<DirectiveKind, Integer>emptyMap(),
                Collections.<String, Integer>emptyMap(), true);
    }

    @Nonnull
    public String getPath() {
        return path;
    }

    public int getLineCount() {
        return lineCount;
    }

    public int getDirectiveCount() {
        return directiveCount;
    }

    public int getDefineCount() {
        return defineCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    /** The deepest nesting of conditional blocks seen in the file. */
    public int getMaxDepth() {
        return maxDepth;
    }

    public int getCount(@Nonnull DirectiveKind kind) {
        Integer count = kindCounts.get(kind);
        return count == null ? 0 : count;
    }

    @Nonnull
    public Map<DirectiveKind, Integer> getKindCounts() {
        return kindCounts;
    }

    @Nonnull
    public Map<String, Integer> getConditionUsage() {
        return conditionUsage;
    }

    public boolean isFailed() {
        return failed;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject out = new JsonObject();
        out.addProperty("path", path);
        out.addProperty("lines", lineCount);
        out.addProperty("directives", directiveCount);
        out.addProperty("defines", defineCount);
        out.addProperty("errors", errorCount);
        out.addProperty("maxDepth", maxDepth);
        JsonObject kinds = new JsonObject();
        for (Map.Entry<DirectiveKind, Integer> e : kindCounts.entrySet())
            kinds.addProperty(e.getKey().name().toLowerCase(Locale.ROOT), e.getValue());
        out.add("kinds", kinds);
        if (failed)
            out.addProperty("failed", true);
        return out;
    }

    @Override
    public String toString() {
        return path + ": " + directiveCount + " directives, " + defineCount + " defines, "
                + errorCount + " errors, max depth " + maxDepth;
    }
}
