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
 * How serious a {@link ValidationError} is.
 *
 * Declared in decreasing order of severity, so that the natural
 * ordering sorts the worst findings first.
 */
public enum Severity {

    /** The conditional structure of the file is broken. */
    CRITICAL,
    /** A directive cannot be interpreted correctly. */
    ERROR,
    /** A stylistic or semantic concern. */
    WARNING;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) <= 0;
    }
}
