/**
 * Story Bridge API
 * =============================================================================
 *
 * <p>Types shared by producers, the engine worker and consumers:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.storybridge.api.Command} and its
 *       {@link com.questrail.storybridge.api.CommandSource}, the unit of input</li>
 *   <li>{@link com.questrail.storybridge.api.ControlDirective}, the SYSTEM
 *       tokens the worker interprets itself</li>
 *   <li>{@link com.questrail.storybridge.api.OutputChunk}, the unit of output</li>
 *   <li>{@link com.questrail.storybridge.api.StoryEngine} and
 *       {@link com.questrail.storybridge.api.EngineQuery}, the interpreter SPI</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * <p>All exceptions in this package are unchecked. Queue states
 * ({@link com.questrail.storybridge.api.QueueFullException},
 * {@link com.questrail.storybridge.api.QueueClosedException}) are reported to
 * the producer that hit them. Engine failures never surface as exceptions to
 * producers; they arrive as {@code ERROR} output chunks.</p>
 */
package com.questrail.storybridge.api;
