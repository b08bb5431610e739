package com.questrail.dtchat.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the current wall-clock instant.
 *
 * <p>The chat engine stamps send, completion and acknowledgement times from
 * this clock. It may jump due to NTP or manual adjustment; message ordering
 * tolerates that because timestamps are trusted as received.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();

    /**
     * Returns the current time as a {@link ChatTime}.
     */
    default ChatTime chatNow() {
        return ChatTime.of(now());
    }
}
