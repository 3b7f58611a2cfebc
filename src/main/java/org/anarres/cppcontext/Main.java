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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end: scans files and directories, analyzes them
 * and prints a summary or writes the result as JSON.
 *
 * The exit status is 0 when no file has a finding of severity
 * {@link Severity#ERROR} or worse, 1 when some file has, and 2 for
 * usage errors.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_FINDINGS = 1;
    public static final int EXIT_USAGE = 2;

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.out));
    }

    public static int run(@Nonnull String[] args, @Nonnull PrintStream out)
            throws IOException, InterruptedException {
        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.accepts("help",
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Enables debug output.");
        OptionSpec<?> strictOption = parser.accepts("strict",
                "Enables the naming, include guard and condition style checks.");
        OptionSpec<?> exclusiveOption = parser.accepts("exclusive-branches",
                "Folds the negations of earlier branches into #elif and #else contexts.");
        OptionSpec<?> labelsOption = parser.accepts("endif-labels",
                "Reports tokens following #else and #endif.");
        OptionSpec<?> recursiveOption = parser.acceptsAll(Arrays.asList("recursive", "r"),
                "Descends into subdirectories.");
        OptionSpec<?> headersOption = parser.accepts("include-headers",
                "Also analyzes header files.");
        OptionSpec<String> excludeOption = parser.accepts("exclude",
                "Excludes paths matching the given wildcard pattern.")
                .withRequiredArg().ofType(String.class).describedAs("pattern");
        OptionSpec<Integer> threadsOption = parser.acceptsAll(Arrays.asList("threads", "j"),
                "Number of worker threads.")
                .withRequiredArg().ofType(Integer.class).describedAs("n")
                .defaultsTo(Runtime.getRuntime().availableProcessors());
        OptionSpec<File> outputOption = parser.acceptsAll(Arrays.asList("output", "o"),
                "Writes the result as JSON to the given file.")
                .withRequiredArg().ofType(File.class).describedAs("file");
        OptionSpec<File> inputsOption = parser.nonOptions()
                .ofType(File.class).describedAs("Files or directories to analyze.");

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            out.println("Error: " + e.getMessage());
            parser.printHelpOn(out);
            return EXIT_USAGE;
        }

        if (options.has(helpOption)) {
            parser.printHelpOn(out);
            return EXIT_CLEAN;
        }

        List<File> inputs = options.valuesOf(inputsOption);
        if (inputs.isEmpty()) {
            out.println("Error: No input files or directories given.");
            parser.printHelpOn(out);
            return EXIT_USAGE;
        }

        AnalyzerOptions analyzerOptions = new AnalyzerOptions();
        if (options.has(debugOption)) {
            System.setProperty("org.slf4j.simpleLogger.log.org.anarres.cppcontext", "debug");
            analyzerOptions.addFeature(Feature.DEBUG);
        }
        if (options.has(strictOption))
            analyzerOptions.addFeature(Feature.STRICT);
        if (options.has(exclusiveOption))
            analyzerOptions.addFeature(Feature.EXCLUSIVE_BRANCHES);
        if (options.has(labelsOption))
            analyzerOptions.addFeature(Feature.ENDIF_LABELS);

        SourceScanner scanner = new SourceScanner();
        scanner.setRecursive(options.has(recursiveOption));
        scanner.setIncludeHeaders(options.has(headersOption));
        scanner.addExcludes(options.valuesOf(excludeOption));

        List<File> files;
        try {
            files = scanner.scan(inputs);
        } catch (FileNotFoundException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (files.isEmpty())
            LOG.warn("No source files found in " + inputs);
        if (analyzerOptions.getFeature(Feature.DEBUG))
            LOG.debug("Analyzing " + files.size() + " files with " + analyzerOptions);

        ContextAnalyzer analyzer = new ContextAnalyzer();
        AnalysisResult result;
        BatchAnalyzer batch = new BatchAnalyzer(analyzer, analyzerOptions, options.valueOf(threadsOption));
        try {
            result = batch.analyzeFiles(files);
        } finally {
            batch.close();
        }

        if (options.has(outputOption)) {
            File output = options.valueOf(outputOption);
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            FileUtils.writeStringToFile(output, gson.toJson(result.toJson()), StandardCharsets.UTF_8);
            LOG.info("Wrote " + output);
        }
        summary(result, out);

        return result.hasErrors(Severity.ERROR) ? EXIT_FINDINGS : EXIT_CLEAN;
    }

    private static void summary(@Nonnull AnalysisResult result, @Nonnull PrintStream out) {
        for (Map.Entry<String, FileSummary> e : result.getSummaries().entrySet())
            out.println(e.getValue());
        for (ValidationError error : result.getErrors()) {
            out.println(error);
            if (error.getSuggestion() != null)
                out.println("    " + error.getSuggestion());
        }
        out.println("Files: " + result.getSummaries().size()
                + ", directives: " + result.getDirectiveCount()
                + ", defines: " + result.getDefines().size()
                + ", critical: " + result.getErrors(Severity.CRITICAL).size()
                + ", errors: " + result.getErrors(Severity.ERROR).size()
                + ", warnings: " + result.getErrors(Severity.WARNING).size());
    }
}
