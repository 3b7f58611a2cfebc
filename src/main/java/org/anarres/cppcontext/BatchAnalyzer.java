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

import java.io.Closeable;
import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes many files on a fixed pool of worker threads.
 *
 * Files are independent, so each is a separate task. A failure in one
 * task is converted to a {@link ErrorKind#FILE_ERROR} entry for that
 * file and never affects the others. Results are merged in path order,
 * whatever order the tasks complete in.
 */
public class BatchAnalyzer implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final ContextAnalyzer analyzer;
    private final AnalyzerOptions options;
    private final ExecutorService executor;

    /**
     * @param threads the number of worker threads; if not positive, the
     *  number of available processors.
     */
    public BatchAnalyzer(@Nonnull ContextAnalyzer analyzer, @Nonnull AnalyzerOptions options, int threads) {
        this.analyzer = analyzer;
        this.options = options;
        if (threads <= 0)
            threads = Runtime.getRuntime().availableProcessors();
        this.executor = Executors.newFixedThreadPool(threads);
    }

    public BatchAnalyzer(@Nonnull ContextAnalyzer analyzer, @Nonnull AnalyzerOptions options) {
        this(analyzer, options, 0);
    }

    private class AnalysisTask implements Callable<AnalysisResult> {

        private final String path;
        @CheckForNull
        private final File file;
        @CheckForNull
        private final String source;

        AnalysisTask(@Nonnull String path, @CheckForNull File file, @CheckForNull String source) {
            this.path = path;
            this.file = file;
            this.source = source;
        }

        @Override
        public AnalysisResult call() {
            try {
                if (file != null)
                    return analyzer.analyze(file, options);
                return analyzer.analyze(source, path, options);
            } catch (Exception e) {
                LOG.warn("Failed to analyze " + path + ": " + e, e);
                return AnalysisResult.failure(path, e);
            }
        }
    }

    /**
     * Reads and analyzes the given files, then merges the results.
     *
     * @throws InterruptedException if interrupted while waiting for the
     *  workers.
     */
    @Nonnull
    public AnalysisResult analyzeFiles(@Nonnull Collection<File> files) throws InterruptedException {
        SortedMap<String, AnalysisTask> tasks = new TreeMap<String, AnalysisTask>();
        for (File file : files)
            tasks.put(file.getPath(), new AnalysisTask(file.getPath(), file, null));
        return run(tasks);
    }

    /**
     * Analyzes already-decoded sources, keyed by path, then merges the
     * results.
     *
     * @throws InterruptedException if interrupted while waiting for the
     *  workers.
     */
    @Nonnull
    public AnalysisResult analyzeSources(@Nonnull Map<String, String> sources) throws InterruptedException {
        SortedMap<String, AnalysisTask> tasks = new TreeMap<String, AnalysisTask>();
        for (Map.Entry<String, String> e : sources.entrySet())
            tasks.put(e.getKey(), new AnalysisTask(e.getKey(), null, e.getValue()));
        return run(tasks);
    }

    @Nonnull
    private AnalysisResult run(@Nonnull SortedMap<String, AnalysisTask> tasks) throws InterruptedException {
        Map<String, Future<AnalysisResult>> futures = new LinkedHashMap<String, Future<AnalysisResult>>();
        for (Map.Entry<String, AnalysisTask> e : tasks.entrySet())
            futures.put(e.getKey(), executor.submit(e.getValue()));

        List<AnalysisResult> results = new ArrayList<AnalysisResult>(futures.size());
        for (Map.Entry<String, Future<AnalysisResult>> e : futures.entrySet()) {
            try {
                results.add(e.getValue().get());
            } catch (CancellationException ce) {
                LOG.info("Skipped " + e.getKey() + ": analysis cancelled");
            } catch (ExecutionException ee) {
                LOG.warn("Failed to analyze " + e.getKey() + ": " + ee.getCause(), ee.getCause());
                results.add(AnalysisResult.failure(e.getKey(), ee));
            }
        }
        return analyzer.merge(results);
    }

    /**
     * Abandons every file not yet started and stops accepting work.
     * A cancelled file is left out of the merged result.
     */
    public void cancel() {
        for (Runnable pending : executor.shutdownNow())
            if (pending instanceof Future)
                ((Future<?>) pending).cancel(false);
    }

    public boolean isCancelled() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        cancel();
    }
}
