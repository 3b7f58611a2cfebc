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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ConditionsTest {

    private static List<String> symbols(String condition) {
        return new ArrayList<String>(Conditions.referencedSymbols(condition));
    }

    @Test
    void ifdefAndIfndefConditions() {
        assertEquals("DEBUG", Conditions.forIfdef("DEBUG"));
        assertEquals("!DEBUG", Conditions.forIfndef("DEBUG"));
    }

    @Test
    void definedOperatorsYieldTheirArguments() {
        assertEquals(Arrays.asList("WINDOWS", "DEBUG"),
                symbols("defined(WINDOWS) && defined(DEBUG)"));
        assertEquals(Arrays.asList("A", "B"), symbols("defined A || !defined ( B )"));
    }

    @Test
    void bareIdentifiersAreReferences() {
        assertEquals(Collections.singletonList("LEVEL"), symbols("LEVEL >= 2"));
        assertEquals(Arrays.asList("VERSION", "MAJOR"), symbols("VERSION > 0x10 && MAJOR(VERSION) == 3"));
    }

    @Test
    void numbersLiteralsAndKeywordsAreSkipped() {
        assertEquals(Collections.emptyList(), symbols("1e+5 > 0x1FUL && 'a' == 97"));
        assertEquals(Collections.emptyList(), symbols("true || not false"));
        assertEquals(Collections.singletonList("X"), symbols("X == \"Y Z\""));
    }

    @Test
    void featureTestArgumentsAreSkipped() {
        assertEquals(Collections.singletonList("FOO"),
                symbols("__has_include(<stdio.h>) && FOO && __has_builtin(__builtin_expect)"));
    }

    @Test
    void repeatedSymbolsAreListedOnce() {
        assertEquals(Arrays.asList("A", "B"), symbols("A && (B || A) && defined(B)"));
    }

    @Test
    void negation() {
        assertEquals("!A", Conditions.negate("A"));
        assertEquals("A", Conditions.negate("!A"));
        assertEquals("!(defined(A) && B)", Conditions.negate("defined(A) && B"));
        assertEquals("!(A > 1)", Conditions.negate("A > 1"));
        assertEquals("!defined(A)", Conditions.negate("defined(A)"));
        assertEquals("!defined ( A )", Conditions.negate("defined ( A )"));
        assertEquals("defined A", Conditions.negate("!defined A"));
        assertEquals("!(defined(A) || defined(B))", Conditions.negate("defined(A) || defined(B)"));
    }

    @Test
    void joinUsesLogicalAnd() {
        assertEquals("", Conditions.join(Collections.<String>emptyList()));
        assertEquals("A && !B && C > 1", Conditions.join(Arrays.asList("A", "!B", "C > 1")));
    }

    @Test
    void identifiers() {
        assertTrue(Conditions.isIdentifier("_foo9"));
        assertFalse(Conditions.isIdentifier("9foo"));
        assertFalse(Conditions.isIdentifier("foo-bar"));
        assertFalse(Conditions.isIdentifier(""));
    }

    @Test
    void parenthesesBalance() {
        assertTrue(Conditions.hasBalancedParentheses("(A && (B || C))"));
        assertTrue(Conditions.hasBalancedParentheses("X == ')'"));
        assertFalse(Conditions.hasBalancedParentheses("(A && B"));
        assertFalse(Conditions.hasBalancedParentheses(")A("));
    }
}
