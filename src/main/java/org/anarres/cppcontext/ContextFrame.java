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
import com.google.gson.JsonPrimitive;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;
import org.pcollections.Empty;
import org.pcollections.OrderedPSet;
import org.pcollections.PSet;
import org.pcollections.PVector;

/**
 * One open branch of an if-chain.
 *
 * Frames are immutable. <code>#elif</code> and <code>#else</code>
 * replace the top frame with the frame returned by
 * {@link #elif(String, PSet, int, boolean)} or {@link #otherwise(int, boolean)}.
 */
public final class ContextFrame {

    /** Condition text of a frame opened by a directive with no condition. */
    public static final String EMPTY_CONDITION = "<empty>";

    private final DirectiveKind kind;
    private final String conditionText;
    /* The branch's condition as written, without folded siblings. */
    private final String own;
    private final boolean negated;
    private final boolean empty;
    private final boolean sawElse;
    private final int openedAtLine;
    private final int chainLine;
    private final PSet<String> symbols;
    /* Own conditions of the earlier branches of this chain. */
    private final PVector<String> siblings;

    private ContextFrame(DirectiveKind kind, String conditionText, String own, boolean negated,
            boolean empty, boolean sawElse, int openedAtLine, int chainLine,
            PSet<String> symbols, PVector<String> siblings) {
        this.kind = kind;
        this.conditionText = conditionText;
        this.own = own;
        this.negated = negated;
        this.empty = empty;
        this.sawElse = sawElse;
        this.openedAtLine = openedAtLine;
        this.chainLine = chainLine;
        this.symbols = symbols;
        this.siblings = siblings;
    }

    /**
     * Opens a new if-chain for an <code>#if</code>, <code>#ifdef</code>
     * or <code>#ifndef</code>.
     */
    @Nonnull
    public static ContextFrame open(@Nonnull DirectiveKind kind, @Nonnull String conditionText,
            @Nonnull PSet<String> symbols, int line) {
        return new ContextFrame(kind, conditionText, conditionText, false, false, false, line, line,
                symbols, Empty.<String>vector());
    }

    /**
     * Opens a new if-chain whose condition is missing.
     *
     * The frame keeps nesting balanced but contributes nothing to
     * derived expressions.
     */
    @Nonnull
    public static ContextFrame openEmpty(@Nonnull DirectiveKind kind, int line) {
        return new ContextFrame(kind, EMPTY_CONDITION, EMPTY_CONDITION, false, true, false, line, line,
                OrderedPSet.<String>empty(), Empty.<String>vector());
    }

    /**
     * Returns the frame of an <code>#elif</code> following this branch.
     *
     * @param exclusive if true, the negations of all earlier branches
     *  are folded into the condition text.
     */
    @Nonnull
    public ContextFrame elif(@Nonnull String condition, @Nonnull PSet<String> conditionSymbols,
            int line, boolean exclusive) {
        PVector<String> priors = priors();
        boolean isEmpty = condition.isEmpty();
        String branch = isEmpty ? EMPTY_CONDITION : condition;
        String text = branch;
        PSet<String> syms = conditionSymbols;
        if (exclusive && !priors.isEmpty()) {
            List<String> parts = negations(priors);
            if (!isEmpty)
                parts.add(condition);
            text = Conditions.join(parts);
            syms = symbols.plusAll(conditionSymbols);
            isEmpty = false;
        }
        return new ContextFrame(DirectiveKind.ELIF, text, branch, false, isEmpty, false, line,
                chainLine, syms, priors);
    }

    /**
     * Returns the frame of an <code>#else</code> following this branch.
     */
    @Nonnull
    public ContextFrame otherwise(int line, boolean exclusive) {
        PVector<String> priors = priors();
        String text;
        boolean isEmpty;
        if (exclusive) {
            isEmpty = priors.isEmpty();
            text = isEmpty ? EMPTY_CONDITION : Conditions.join(negations(priors));
        } else {
            isEmpty = EMPTY_CONDITION.equals(own);
            text = isEmpty ? EMPTY_CONDITION : Conditions.negate(own);
        }
        return new ContextFrame(DirectiveKind.ELSE, text, text, true, isEmpty, true, line,
                chainLine, symbols, priors);
    }

    /* Own conditions of this chain's branches up to and including this one. */
    private PVector<String> priors() {
        if (EMPTY_CONDITION.equals(own) || sawElse)
            return siblings;
        return siblings.plus(own);
    }

    private static List<String> negations(List<String> conditions) {
        List<String> out = new ArrayList<String>(conditions.size() + 1);
        for (String c : conditions)
            out.add(Conditions.negate(c));
        return out;
    }

    /** The kind of directive which created this frame. */
    @Nonnull
    public DirectiveKind getKind() {
        return kind;
    }

    @Nonnull
    public String getConditionText() {
        return conditionText;
    }

    public boolean isNegated() {
        return negated;
    }

    /** True for the sentinel frame of a directive with no condition. */
    public boolean isEmpty() {
        return empty;
    }

    /** True once the chain has seen its <code>#else</code>. */
    public boolean sawElse() {
        return sawElse;
    }

    public int getOpenedAtLine() {
        return openedAtLine;
    }

    /** The line of the <code>#if</code> which started this chain. */
    public int getChainLine() {
        return chainLine;
    }

    @Nonnull
    public PSet<String> getReferencedSymbols() {
        return symbols;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("condition", conditionText);
        if (negated)
            result.addProperty("negated", true);
        result.addProperty("line", openedAtLine);
        JsonArray syms = new JsonArray();
        for (String s : symbols)
            syms.add(new JsonPrimitive(s));
        result.add("symbols", syms);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ContextFrame))
            return false;
        ContextFrame o = (ContextFrame) obj;
        return o.kind == kind && o.negated == negated && o.empty == empty && o.sawElse == sawElse
                && o.openedAtLine == openedAtLine && o.chainLine == chainLine
                && o.conditionText.equals(conditionText) && o.symbols.equals(symbols)
                && o.siblings.equals(siblings);
    }

    @Override
    public int hashCode() {
        return (conditionText.hashCode() * 31 + openedAtLine) * 31 + (negated ? 1 : 0);
    }

    @Override
    public String toString() {
        return conditionText + "@" + openedAtLine;
    }
}
