/**
 * Contract-violation (panic) reporting package.
 *
 * <p>Extraction operations called on the wrong variant are programmer errors, not domain errors.
 * This package routes them to a host-supplied sink and terminates the operation.</p>
 *
 * <h2>SPI</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.core.panic.PanicHandler} - Host-supplied fatal-error sink</li>
 * </ul>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.core.panic.Panics} - Installed handler holder and panic entry point</li>
 *   <li>{@link com.ryuqq.result.core.panic.LoggingPanicHandler} - Default SLF4J handler (optional process abort)</li>
 *   <li>{@link com.ryuqq.result.core.panic.PanicConfig} - Default handler configuration</li>
 *   <li>{@link com.ryuqq.result.core.panic.ResultPanicException} - Unrecoverable failure signal</li>
 * </ul>
 *
 * <h2>Flow</h2>
 * <pre>
 * Err.unwrap()
 *   ↓
 * Panics.panic(message) → PanicHandler.onPanic(message)
 *   ↓
 * throw ResultPanicException
 * </pre>
 *
 * @since 1.0.0
 * @author Result Team
 */
package com.ryuqq.result.core.panic;
