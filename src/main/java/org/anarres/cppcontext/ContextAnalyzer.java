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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes the conditional-compilation context of C source files.
 *
 * Each call to {@link #analyze(String, String, AnalyzerOptions)} runs on
 * a fresh context stack and shares no mutable state with other calls,
 * so one analyzer may be used from several threads at once provided
 * its listener is thread-safe.
 *
 * <pre>
 * ContextAnalyzer analyzer = new ContextAnalyzer();
 * AnalysisResult result = analyzer.analyze(text, "foo.c", new AnalyzerOptions());
 * for (DefineRecord define : result.getDefines())
 *     System.out.println(define.getSymbol() + " if " + define.getExpression());
 * </pre>
 */
public class ContextAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ContextAnalyzer.class);

    @CheckForNull
    private AnalysisListener listener;

    public ContextAnalyzer() {
    }

    public ContextAnalyzer(@CheckForNull AnalysisListener listener) {
        this.listener = listener;
    }

    /**
     * Sets the AnalysisListener which receives findings as they are
     * made.
     */
    public void setListener(@CheckForNull AnalysisListener listener) {
        this.listener = listener;
    }

    /**
     * Analyzes the text of a single file.
     *
     * Malformed input never causes an exception; every problem is
     * reported in the result.
     */
    @Nonnull
    public AnalysisResult analyze(@Nonnull String source, @Nonnull String path,
            @Nonnull AnalyzerOptions options) {
        Validator validator = new Validator(path, listener);
        DirectiveLexer lexer = new DirectiveLexer(source, path, validator, options);
        ContextStackEngine engine = new ContextStackEngine(path, validator, options);
        for (;;) {
            DirectiveRecord directive = lexer.next();
            if (directive == null)
                break;
            engine.process(directive);
        }
        engine.finish();

        List<DefineRecord> defines = engine.getDefines();
        DependencyGraph graph = DependencyGraph.build(defines);
        validator.check(engine.getDirectives(), options);
        for (ValidationError error : Validator.cycleErrors(graph, defines))
            validator.report(error);

        List<ValidationError> errors = validator.getErrors();
        FileSummary summary = new FileSummary(path, lexer.getLineCount(),
                engine.getDirectives().size(), defines.size(), errors.size(),
                engine.getMaxDepth(), engine.getKindCounts(), engine.getConditionUsage(), false);
        if (options.getFeature(Feature.DEBUG))
            LOG.debug("Analyzed " + summary);

        return new AnalysisResult(
                Collections.singletonMap(path, engine.getDirectives()),
                defines,
                engine.getConditionUsage(),
                Collections.singletonMap(path, summary),
                graph,
                errors);
    }

    /**
     * Reads and analyzes a file as UTF-8.
     *
     * @throws IOException if the file cannot be read.
     */
    @Nonnull
    public AnalysisResult analyze(@Nonnull File file, @Nonnull AnalyzerOptions options)
            throws IOException {
        String source = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
        return analyze(source, file.getPath(), options);
    }

    /**
     * Merges per-file results into one.
     *
     * Files are taken in path order regardless of the order of
     * <code>results</code>, so the merged result is deterministic. The
     * dependency graph is rebuilt from all definitions and its cycles
     * found afresh, which reports cycles spanning several files and
     * replaces the cycles of the inputs.
     *
     * A path present in more than one input is taken from the first.
     */
    @Nonnull
    public AnalysisResult merge(@Nonnull List<AnalysisResult> results) {
        Map<String, AnalysisResult> owners = new TreeMap<String, AnalysisResult>();
        for (AnalysisResult result : results) {
            for (String path : result.getSummaries().keySet()) {
                if (owners.containsKey(path)) {
                    LOG.warn("Ignoring duplicate result for " + path);
                    continue;
                }
                owners.put(path, result);
            }
        }

        Map<String, List<DirectiveRecord>> directives = new LinkedHashMap<String, List<DirectiveRecord>>();
        Map<String, FileSummary> summaries = new LinkedHashMap<String, FileSummary>();
        Map<String, Integer> conditionUsage = new LinkedHashMap<String, Integer>();
        List<DefineRecord> defines = new ArrayList<DefineRecord>();
        List<ValidationError> errors = new ArrayList<ValidationError>();

        for (Map.Entry<String, AnalysisResult> e : owners.entrySet()) {
            String path = e.getKey();
            AnalysisResult result = e.getValue();
            FileSummary summary = result.getSummaries().get(path);
            directives.put(path, result.getDirectives(path));
            summaries.put(path, summary);
            for (Map.Entry<String, Integer> u : summary.getConditionUsage().entrySet()) {
                Integer count = conditionUsage.get(u.getKey());
                conditionUsage.put(u.getKey(), count == null ? u.getValue() : count + u.getValue());
            }
            for (DefineRecord define : result.getDefines())
                if (define.getPath().equals(path))
                    defines.add(define);
            for (ValidationError error : result.getErrors())
                if (error.getPath().equals(path) && error.getKind() != ErrorKind.CIRCULAR_DEPENDENCY)
                    errors.add(error);
        }

        DependencyGraph graph = DependencyGraph.build(defines);
        errors.addAll(Validator.cycleErrors(graph, defines));

        return new AnalysisResult(directives, defines, conditionUsage, summaries, graph, errors);
    }
}
