package com.postflow.debounce;

import java.time.Instant;

/**
 * Handle for one scheduled fire. Only the ticket carrying the current generation
 * for its key may fire; older tickets are stale.
 *
 * @param key        Rule and subject
 * @param generation Generation at registration time
 * @param deadline   When the quiet period ends
 */
public record DebounceTicket(DebounceKey key, long generation, Instant deadline) {
}
