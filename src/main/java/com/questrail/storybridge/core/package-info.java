/**
 * Bounded channels between producers, the engine worker and consumers.
 *
 * <pre>
 *   producers (any thread)
 *        → PriorityCommandQueue   (priority desc, sequence asc)
 *            → engine worker      (single consumer)
 *                → OutputChannel  (FIFO, END_OF_STREAM after close)
 *                    → consumers
 * </pre>
 *
 * <p>Both channels block rather than drop, and both are closed exactly once
 * while the worker stops.</p>
 */
package com.questrail.storybridge.core;
