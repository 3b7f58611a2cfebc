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

import javax.annotation.Nonnull;

/**
 * A handler for findings, notified as soon as each one is recorded.
 *
 * Findings are always part of the {@link AnalysisResult} as well; a
 * listener is only needed for progress reporting or logging.
 * Listeners shared by a {@link BatchAnalyzer} are called from worker
 * threads.
 *
 * @see DefaultAnalysisListener
 */
public interface AnalysisListener {

    void handleError(@Nonnull ValidationError error);
}
