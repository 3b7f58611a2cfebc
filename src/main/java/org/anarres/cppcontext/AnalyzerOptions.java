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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import javax.annotation.Nonnull;

/**
 * The feature-set used for an analysis.
 *
 * Options are read concurrently by {@link BatchAnalyzer} workers and
 * must not be modified once an analysis has started.
 */
public class AnalyzerOptions {

    private final Set<Feature> features;

    public AnalyzerOptions() {
        this.features = EnumSet.noneOf(Feature.class);
    }

    public AnalyzerOptions(Feature... features) {
        this();
        addFeatures(features);
    }

    /**
     * Adds a feature to the feature-set of these options.
     */
    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    /**
     * Adds features to the feature-set of these options.
     */
    public void addFeatures(@Nonnull Collection<Feature> f) {
        features.addAll(f);
    }

    /**
     * Adds features to the feature-set of these options.
     */
    public void addFeatures(Feature... f) {
        addFeatures(Arrays.asList(f));
    }

    /**
     * Returns true if the given feature is in the feature-set.
     */
    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    @Nonnull
    public Set<Feature> getFeatures() {
        return Collections.unmodifiableSet(features);
    }

    public boolean isStrict() {
        return getFeature(Feature.STRICT);
    }

    @Override
    public String toString() {
        return "AnalyzerOptions" + features;
    }
}
