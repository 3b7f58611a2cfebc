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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.pcollections.OrderedPSet;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the stack of open conditional blocks through one file.
 *
 * Directives are fed in order to {@link #process(DirectiveRecord)};
 * {@link #finish()} closes whatever is left open at end of file.
 * Every structural problem is recorded with the {@link Validator} and
 * recovered from locally, so processing always completes.
 *
 * An engine holds the state of a single file and must not be shared
 * between threads.
 */
public class ContextStackEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ContextStackEngine.class);

    private final String path;
    private final Validator validator;
    private final AnalyzerOptions options;

    private ContextStack stack;
    private int maxDepth;
    private boolean finished;
    private final List<DirectiveRecord> directives = new ArrayList<DirectiveRecord>();
    private final List<DefineRecord> defines = new ArrayList<DefineRecord>();
    private final Map<String, Integer> conditionUsage = new LinkedHashMap<String, Integer>();
    private final Map<DirectiveKind, Integer> kindCounts = new EnumMap<DirectiveKind, Integer>(DirectiveKind.class);

    public ContextStackEngine(@Nonnull String path, @Nonnull Validator validator,
            @Nonnull AnalyzerOptions options) {
        this.path = path;
        this.validator = validator;
        this.options = options;
        this.stack = ContextStack.EMPTY;
    }

    /* States */
    private void push_state(@Nonnull ContextFrame frame) {
        stack = stack.push(frame);
        if (stack.depth() > maxDepth)
            maxDepth = stack.depth();
    }

    private void pop_state() {
        stack = stack.pop();
    }

    private static PSet<String> symbols(@Nonnull DirectiveRecord directive) {
        String condition = directive.getCondition();
        if (condition == null || condition.isEmpty())
            return OrderedPSet.empty();
        return Conditions.referencedSymbols(condition);
    }

    private void countCondition(@Nonnull DirectiveRecord directive) {
        String condition = directive.getCondition();
        if (condition == null || condition.isEmpty())
            return;
        Integer count = conditionUsage.get(condition);
        conditionUsage.put(condition, count == null ? 1 : count + 1);
    }

    /**
     * Applies one directive to the context stack.
     *
     * @return the directive with the resulting context attached; for
     *  <code>#define</code> and <code>#undef</code> this is the
     *  enclosing context.
     */
    @Nonnull
    public DirectiveRecord process(@Nonnull DirectiveRecord directive) {
        if (finished)
            throw new IllegalStateException("Engine for " + path + " already finished");
        DirectiveKind kind = directive.getKind();
        Integer count = kindCounts.get(kind);
        kindCounts.put(kind, count == null ? 1 : count + 1);
        boolean exclusive = options.getFeature(Feature.EXCLUSIVE_BRANCHES);

        switch (kind) {
            case IF:
            case IFDEF:
            case IFNDEF: {
                String condition = directive.getCondition();
                if (condition == null || condition.isEmpty())
                    push_state(ContextFrame.openEmpty(kind, directive.getLine()));
                else
                    push_state(ContextFrame.open(kind, condition, symbols(directive), directive.getLine()));
                countCondition(directive);
                break;
            }

            case ELIF: {
                ContextFrame top = stack.peek();
                countCondition(directive);
                if (top == null) {
                    validator.error(ErrorKind.ORPHAN_ELIF, directive,
                            "#elif without #if",
                            "Add a matching #if before this #elif, or remove it");
                } else if (top.sawElse()) {
                    validator.error(ErrorKind.ELIF_AFTER_ELSE, directive,
                            "#elif after #else (chain opened at line " + top.getChainLine() + ")",
                            "Move this #elif before the #else");
                } else {
                    String condition = directive.getCondition();
                    stack = stack.replaceTop(top.elif(condition == null ? "" : condition,
                            symbols(directive), directive.getLine(), exclusive));
                }
                break;
            }

            case ELSE: {
                ContextFrame top = stack.peek();
                if (top == null) {
                    validator.error(ErrorKind.ORPHAN_ELSE, directive,
                            "#else without #if",
                            "Add a matching #if before this #else, or remove it");
                } else if (top.sawElse()) {
                    validator.error(ErrorKind.ELSE_AFTER_ELSE, directive,
                            "#else after #else (chain opened at line " + top.getChainLine() + ")",
                            "Remove the second #else or add the missing #endif");
                } else {
                    stack = stack.replaceTop(top.otherwise(directive.getLine(), exclusive));
                }
                break;
            }

            case ENDIF:
                if (stack.isEmpty()) {
                    validator.error(ErrorKind.UNMATCHED_ENDIF, directive,
                            "#endif without #if",
                            "Remove this #endif or add a matching conditional directive");
                } else {
                    pop_state();
                }
                break;

            case DEFINE: {
                String symbol = directive.getSymbol();
                if (symbol != null && !symbol.isEmpty())
                    defines.add(new DefineRecord(symbol, path, directive.getLine(),
                            directive.getBody(), directive.isFunctionLike(), stack));
                break;
            }

            case UNDEF:
            case INCLUDE:
            case PRAGMA:
            case WARNING:
            case ERROR:
            case UNKNOWN:
                break;

            default:
                throw new InternalException("Unhandled directive kind " + kind);
        }

        DirectiveRecord out = directive.withContext(stack);
        directives.add(out);
        if (options.getFeature(Feature.DEBUG))
            LOG.debug("pp: " + out.getLine() + " " + kind + " depth=" + stack.depth()
                    + " context=[" + stack.getExpression() + "]");
        return out;
    }

    /**
     * Ends the file: reports every block still open, innermost first,
     * and closes it.
     */
    public void finish() {
        if (finished)
            return;
        finished = true;
        while (!stack.isEmpty()) {
            ContextFrame frame = stack.peek();
            String text = frame.isEmpty() ? "" : " " + frame.getConditionText();
            validator.error(ErrorKind.MISSING_ENDIF, frame.getOpenedAtLine(),
                    "Unterminated #" + frame.getKind().getText() + text
                    + (frame.getChainLine() != frame.getOpenedAtLine()
                            ? " (chain opened at line " + frame.getChainLine() + ")" : ""),
                    "Add a matching #endif directive", null);
            pop_state();
        }
    }

    @Nonnegative
    public int getDepth() {
        return stack.depth();
    }

    @Nonnegative
    public int getMaxDepth() {
        return maxDepth;
    }

    @Nonnull
    public List<DirectiveRecord> getDirectives() {
        return Collections.unmodifiableList(directives);
    }

    @Nonnull
    public List<DefineRecord> getDefines() {
        return Collections.unmodifiableList(defines);
    }

    /** Condition text to the number of conditional directives using it. */
    @Nonnull
    public Map<String, Integer> getConditionUsage() {
        return Collections.unmodifiableMap(conditionUsage);
    }

    @Nonnull
    public Map<DirectiveKind, Integer> getKindCounts() {
        return Collections.unmodifiableMap(kindCounts);
    }
}
