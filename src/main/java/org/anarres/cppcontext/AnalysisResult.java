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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import javax.annotation.Nonnull;

/**
 * The result of analyzing one file, or of merging several.
 *
 * Directive lists and summaries are keyed by path in sorted order.
 * Errors are kept in the order they were found; a merged result lists
 * each file's errors in path order followed by the dependency cycles.
 */
public final class AnalysisResult {

    private final SortedMap<String, List<DirectiveRecord>> directives;
    private final List<DefineRecord> defines;
    private final Map<String, Integer> conditionUsage;
    private final SortedMap<String, FileSummary> summaries;
    private final DependencyGraph graph;
    private final List<ValidationError> errors;

    public AnalysisResult(@Nonnull Map<String, List<DirectiveRecord>> directives,
            @Nonnull List<DefineRecord> defines,
            @Nonnull Map<String, Integer> conditionUsage,
            @Nonnull Map<String, FileSummary> summaries,
            @Nonnull DependencyGraph graph,
            @Nonnull List<ValidationError> errors) {
        SortedMap<String, List<DirectiveRecord>> d = new TreeMap<String, List<DirectiveRecord>>();
        for (Map.Entry<String, List<DirectiveRecord>> e : directives.entrySet())
            d.put(e.getKey(), Collections.unmodifiableList(new ArrayList<DirectiveRecord>(e.getValue())));
        this.directives = Collections.unmodifiableSortedMap(d);
        this.defines = Collections.unmodifiableList(new ArrayList<DefineRecord>(defines));
        this.conditionUsage = Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(conditionUsage));
        this.summaries = Collections.unmodifiableSortedMap(new TreeMap<String, FileSummary>(summaries));
        this.graph = graph;
        this.errors = Collections.unmodifiableList(new ArrayList<ValidationError>(errors));
    }

    /**
     * Returns the result for a file which could not be analyzed at all.
     */
    @Nonnull
    public static AnalysisResult failure(@Nonnull String path, @Nonnull Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        ValidationError error = new ValidationError(ErrorKind.FILE_ERROR, path, 0,
                "Failed to analyze file: " + message);
        return new AnalysisResult(
                Collections.singletonMap(path, Collections.<DirectiveRecord>emptyList()),
                Collections.<DefineRecord>emptyList(),
                Collections.<String, Integer>emptyMap(),
                Collections.singletonMap(path, FileSummary.failed(path)),
                new DependencyGraph(),
                Collections.singletonList(error));
    }

    /** The directives of each file, in source order. */
    @Nonnull
    public SortedMap<String, List<DirectiveRecord>> getDirectives() {
        return directives;
    }

    @Nonnull
    public List<DirectiveRecord> getDirectives(@Nonnull String path) {
        List<DirectiveRecord> out = directives.get(path);
        if (out == null)
            return Collections.emptyList();
        return out;
    }

    public int getDirectiveCount() {
        int count = 0;
        for (List<DirectiveRecord> list : directives.values())
            count += list.size();
        return count;
    }

    @Nonnull
    public List<DefineRecord> getDefines() {
        return defines;
    }

    /** Returns every definition of <code>symbol</code>, in order. */
    @Nonnull
    public List<DefineRecord> getDefines(@Nonnull String symbol) {
        List<DefineRecord> out = new ArrayList<DefineRecord>();
        for (DefineRecord define : defines)
            if (define.getSymbol().equals(symbol))
                out.add(define);
        return out;
    }

    /**
     * Groups the definitions by their derived condition expression.
     * Unconditional definitions are under the empty string.
     */
    @Nonnull
    public Map<String, List<DefineRecord>> getDefinesByContext() {
        Map<String, List<DefineRecord>> out = new TreeMap<String, List<DefineRecord>>();
        for (DefineRecord define : defines) {
            List<DefineRecord> list = out.get(define.getExpression());
            if (list == null) {
                list = new ArrayList<DefineRecord>();
                out.put(define.getExpression(), list);
            }
            list.add(define);
        }
        return out;
    }

    /** Condition text to the number of conditional directives using it. */
    @Nonnull
    public Map<String, Integer> getConditionUsage() {
        return conditionUsage;
    }

    @Nonnull
    public SortedMap<String, FileSummary> getSummaries() {
        return summaries;
    }

    @Nonnull
    public DependencyGraph getGraph() {
        return graph;
    }

    @Nonnull
    public List<ValidationError> getErrors() {
        return errors;
    }

    /** Returns the errors of exactly the given severity. */
    @Nonnull
    public List<ValidationError> getErrors(@Nonnull Severity severity) {
        List<ValidationError> out = new ArrayList<ValidationError>();
        for (ValidationError error : errors)
            if (error.getSeverity() == severity)
                out.add(error);
        return out;
    }

    @Nonnull
    public List<ValidationError> getErrors(@Nonnull ErrorKind kind) {
        List<ValidationError> out = new ArrayList<ValidationError>();
        for (ValidationError error : errors)
            if (error.getKind() == kind)
                out.add(error);
        return out;
    }

    /** Returns true if any error is at least as severe as <code>severity</code>. */
    public boolean hasErrors(@Nonnull Severity severity) {
        for (ValidationError error : errors)
            if (error.getSeverity().isAtLeast(severity))
                return true;
        return false;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject out = new JsonObject();

        JsonArray files = new JsonArray();
        for (Map.Entry<String, FileSummary> e : summaries.entrySet()) {
            JsonObject file = e.getValue().toJson();
            JsonArray list = new JsonArray();
            for (DirectiveRecord directive : getDirectives(e.getKey()))
                list.add(directive.toJson());
            file.add("directives", list);
            files.add(file);
        }
        out.add("files", files);

        JsonArray defs = new JsonArray();
        for (DefineRecord define : defines)
            defs.add(define.toJson());
        out.add("defines", defs);

        JsonObject usage = new JsonObject();
        for (Map.Entry<String, Integer> e : conditionUsage.entrySet())
            usage.addProperty(e.getKey(), e.getValue());
        out.add("conditions", usage);

        out.add("dependencies", graph.toJson());

        JsonArray errs = new JsonArray();
        for (ValidationError error : errors)
            errs.add(error.toJson());
        out.add("errors", errs);
        return out;
    }

    @Override
    public String toString() {
        return "AnalysisResult(" + summaries.keySet() + ", " + defines.size() + " defines, "
                + errors.size() + " errors)";
    }
}
