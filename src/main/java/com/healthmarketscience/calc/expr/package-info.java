/*
Copyright (c) 2025 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

/**
 * The public api for expression evaluation.  Expressions are plain
 * arithmetic on double values, e.g. {@code "2 + 3 * sin(30)"}, evaluated via
 * {@link com.healthmarketscience.calc.Calculator}.
 * <p/>
 * <h2>Supporting Classes</h2>
 * <p/>
 * <ul>
 * <li>{@link com.healthmarketscience.calc.expr.EvalTrace} records the
 *     intermediate computations of an evaluation when "detailed" tracing is
 *     requested.</li>
 * <li>{@link com.healthmarketscience.calc.expr.FunctionLookup} provides a
 *     source for {@link com.healthmarketscience.calc.expr.Function} instances
 *     and named constants used during expression evaluation.</li>
 * <li>{@link com.healthmarketscience.calc.expr.EvalException} exception
 *     thrown for failures which occur during expression evaluation, the
 *     {@link com.healthmarketscience.calc.expr.EvalException.Reason}
 *     identifies the failure.</li>
 * <li>{@link com.healthmarketscience.calc.expr.ParseException} exception
 *     thrown for failures which occur while tokenizing the expression
 *     text.</li>
 * </ul>
 * <p/>
 * <h2>Operators</h2>
 * <p/>
 * From lowest to highest precedence:
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Operator</th><th>Notes</th></tr>
 * <tr class="TableRowColor"><td>+ -</td><td>left associative</td></tr>
 * <tr class="TableRowColor"><td>* / %</td><td>left associative, % truncates both operands to integers</td></tr>
 * <tr class="TableRowColor"><td>r</td><td>root, "a r n" is the n-th root of a, not associative</td></tr>
 * <tr class="TableRowColor"><td>^</td><td>right associative</td></tr>
 * <tr class="TableRowColor"><td>unary + -</td><td></td></tr>
 * </table>
 * <p/>
 * <h2>Functions</h2>
 * <p/>
 * Function names are case insensitive.  Trigonometric functions work in
 * degrees.
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Domain</th></tr>
 * <tr class="TableRowColor"><td>sin, cos, tan, atan</td><td></td></tr>
 * <tr class="TableRowColor"><td>asin, acos</td><td>[-1, 1]</td></tr>
 * <tr class="TableRowColor"><td>ln, log</td><td>x &gt; 0</td></tr>
 * <tr class="TableRowColor"><td>exp, abs, floor, ceil, round</td><td></td></tr>
 * <tr class="TableRowColor"><td>sqrt</td><td>x &gt;= 0</td></tr>
 * <tr class="TableRowColor"><td>sinh, cosh, tanh, asinh</td><td></td></tr>
 * <tr class="TableRowColor"><td>acosh</td><td>x &gt;= 1</td></tr>
 * <tr class="TableRowColor"><td>atanh</td><td>-1 &lt; x &lt; 1</td></tr>
 * <tr class="TableRowColor"><td>fact, factorial</td><td>non-negative integer</td></tr>
 * <tr class="TableRowColor"><td>perm, npr, comb, ncr</td><td>(n, k), non-negative integers, k &lt;= n</td></tr>
 * <tr class="TableRowColor"><td>mean, median</td><td>1 or more values</td></tr>
 * <tr class="TableRowColor"><td>stdev, stddev</td><td>2 or more values</td></tr>
 * </table>
 * <p/>
 * The constants {@code pi} and {@code e} are also available.
 */
package com.healthmarketscience.calc.expr;
