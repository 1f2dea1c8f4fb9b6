/**
 * Protocol-centric core for chat WebSocket streaming.
 *
 * <p>This module is framework-neutral. It contains only:
 * <ul>
 *   <li>Wire constants and the typed inbound event model</li>
 *   <li>The close-code table and the failure taxonomy</li>
 *   <li>Cooperative cancellation and endpoint resolution helpers</li>
 * </ul>
 *
 * <p>Socket bindings and JSON codecs live in other modules.
 */
package io.chatwebsocket.core;
