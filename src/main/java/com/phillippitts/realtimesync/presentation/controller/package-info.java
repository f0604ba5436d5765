/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code GET /api/v1/realtime/health} - health statistics</li>
 *   <li>{@code GET /api/v1/realtime/state} - current connection snapshot</li>
 *   <li>{@code POST /api/v1/realtime/reconnect} - forced reconnect</li>
 *   <li>{@code POST /api/v1/realtime/sync} - immediate poll cue to every subscription</li>
 * </ul>
 *
 * @see com.phillippitts.realtimesync.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.realtimesync.presentation.controller;
