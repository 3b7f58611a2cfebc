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

/**
 * Optional behaviours of the analyzer, set through
 * {@link AnalyzerOptions#addFeature(Feature)}.
 */
public enum Feature {

    /**
     * Enables the reserved name, naming convention, macro style, include
     * guard and condition style checks.
     */
    STRICT,
    /**
     * Folds the negations of earlier branches into the context of an
     * <code>#elif</code> or <code>#else</code>.
     */
    EXCLUSIVE_BRANCHES,
    /** Reports tokens following <code>#else</code> and <code>#endif</code>. */
    ENDIF_LABELS,
    /** Logs every directive and the resulting context stack. */
    DEBUG
}
