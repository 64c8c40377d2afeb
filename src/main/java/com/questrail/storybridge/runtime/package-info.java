/**
 * Story Bridge Runtime
 * =============================================================================
 *
 * <p>{@link com.questrail.storybridge.runtime.StoryBridgeRuntime} is the
 * composition root: it builds the channels, the engine worker, the producer
 * objects and the optional transcript pump, and hands lifecycle to
 * {@link com.questrail.storybridge.runtime.LifecycleController}.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>Input is refused until the worker reports it is running.</li>
 *   <li>Shutdown reports how it ended as a
 *       {@link com.questrail.storybridge.runtime.ShutdownOutcome}. Unless the
 *       worker is unresponsive, both channels are closed when it returns.</li>
 * </ul>
 */
package com.questrail.storybridge.runtime;
