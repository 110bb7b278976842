/**
 * Result sum type package.
 *
 * <p>This package defines {@code Result<T, E>}, a sealed two-variant value holding exactly one of
 * a success value or an error value, together with its query, extraction and combinator operations.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.core.type.Result} - Sealed interface (permits Ok, Err)</li>
 * </ul>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.core.type.Ok} - Success, carries a value</li>
 *   <li>{@link com.ryuqq.result.core.type.Err} - Failure, carries an error</li>
 * </ul>
 *
 * <h2>Helpers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.core.type.Results} - Factories, flatten, sequence, attempt</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * int doubled = Result.&lt;Integer, String&gt;ok(5)
 *     .map(x -&gt; x * 2)
 *     .andThen(x -&gt; x &gt; 5 ? Result.ok(x) : Result.err("too small"))
 *     .unwrapOr(0);
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Single slot:</strong> Each variant stores only its own payload</li>
 *   <li><strong>Immutability:</strong> Records with final components, combinators return new instances</li>
 *   <li><strong>Short-circuit:</strong> Value-side operations skip Err, error-side operations skip Ok</li>
 *   <li><strong>Two error classes:</strong> Domain errors travel as Err, contract violations panic</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Result Team
 */
package com.ryuqq.result.core.type;
