/**
 * Protocol-centric core for event stream clients.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the status classification</li>
 *   <li>The {@link io.github.eventsource.core.Event} model and its wire encoder</li>
 *   <li>The incremental {@link io.github.eventsource.core.EventParser}</li>
 * </ul>
 *
 * <p>HTTP bindings and the reconnecting client live in other modules.
 */
package io.github.eventsource.core;
