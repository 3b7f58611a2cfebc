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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.pcollections.OrderedPSet;
import org.pcollections.PSet;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * The open conditional frames enclosing a point in a file, outermost
 * first.
 *
 * A ContextStack is a persistent value: {@link #push(ContextFrame)},
 * {@link #pop()} and {@link #replaceTop(ContextFrame)} return new
 * stacks and never modify this one, so any stack handed out is already
 * a snapshot.
 */
public final class ContextStack implements Iterable<ContextFrame> {

    public static final ContextStack EMPTY = new ContextStack(TreePVector.<ContextFrame>empty());

    private final PVector<ContextFrame> frames;

    private ContextStack(@Nonnull PVector<ContextFrame> frames) {
        this.frames = frames;
    }

    @Nonnull
    public ContextStack push(@Nonnull ContextFrame frame) {
        return new ContextStack(frames.plus(frame));
    }

    /**
     * Removes the innermost frame.
     *
     * @throws IllegalStateException if the stack is empty.
     */
    @Nonnull
    public ContextStack pop() {
        if (frames.isEmpty())
            throw new IllegalStateException("pop of empty context stack");
        return new ContextStack(frames.minus(frames.size() - 1));
    }

    /**
     * Replaces the innermost frame, as <code>#elif</code> and
     * <code>#else</code> do.
     *
     * @throws IllegalStateException if the stack is empty.
     */
    @Nonnull
    public ContextStack replaceTop(@Nonnull ContextFrame frame) {
        if (frames.isEmpty())
            throw new IllegalStateException("replace on empty context stack");
        return new ContextStack(frames.with(frames.size() - 1, frame));
    }

    @CheckForNull
    public ContextFrame peek() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    @Nonnegative
    public int depth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    @Nonnull
    public List<ContextFrame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    @Override
    public Iterator<ContextFrame> iterator() {
        return getFrames().iterator();
    }

    /**
     * Returns the condition texts of all meaningful frames, outermost
     * first. Frames of directives with an empty condition are skipped.
     */
    @Nonnull
    public List<String> getConditions() {
        List<String> out = new ArrayList<String>(frames.size());
        for (ContextFrame frame : frames)
            if (!frame.isEmpty())
                out.add(frame.getConditionText());
        return out;
    }

    /**
     * Returns the AND-join of all frame conditions, or "" if no
     * meaningful frame is open.
     */
    @Nonnull
    public String getExpression() {
        return Conditions.join(getConditions());
    }

    /** Returns the union of all frames' referenced symbols. */
    @Nonnull
    public PSet<String> getReferencedSymbols() {
        PSet<String> out = OrderedPSet.empty();
        for (ContextFrame frame : frames)
            out = out.plusAll(frame.getReferencedSymbols());
        return out;
    }

    @Nonnull
    public JsonArray toJson() {
        JsonArray result = new JsonArray();
        for (String condition : getConditions())
            result.add(condition);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ContextStack))
            return false;
        return frames.equals(((ContextStack) obj).frames);
    }

    @Override
    public int hashCode() {
        return frames.hashCode();
    }

    @Override
    public String toString() {
        return frames.toString();
    }
}
