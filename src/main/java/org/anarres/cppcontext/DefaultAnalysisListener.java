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

import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link AnalysisListener} which logs findings and counts them.
 */
public class DefaultAnalysisListener implements AnalysisListener {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultAnalysisListener.class);

    private final AtomicInteger errors = new AtomicInteger();
    private final AtomicInteger warnings = new AtomicInteger();

    public void reset() {
        errors.set(0);
        warnings.set(0);
    }

    @Nonnegative
    public int getErrors() {
        return errors.get();
    }

    @Nonnegative
    public int getWarnings() {
        return warnings.get();
    }

    @Override
    public void handleError(@Nonnull ValidationError error) {
        if (error.getSeverity() == Severity.WARNING) {
            warnings.incrementAndGet();
            LOG.warn(error.toString());
        } else {
            errors.incrementAndGet();
            LOG.error(error.toString());
        }
    }
}
