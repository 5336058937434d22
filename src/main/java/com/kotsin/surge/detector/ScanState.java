package com.kotsin.surge.detector;

import com.kotsin.surge.model.SurgeEvent;

import java.time.Instant;

/**
 * ScanState - State of the surge scanner between two data points.
 *
 * State Machine:
 * IDLE --surging point--> ACCUMULATING --surging point--> ACCUMULATING
 *   ^                          |
 *   +----non-surging point-----+  (candidate closed and finalized)
 *
 * End of data while ACCUMULATING closes the candidate as ongoing.
 */
public interface ScanState {

    Idle IDLE = new Idle();

    /**
     * No open candidate.
     */
    record Idle() implements ScanState {
    }

    /**
     * Open candidate plus the timestamp of the last surging point, which
     * becomes the end time when the run closes.
     */
    record Accumulating(SurgeEvent candidate, Instant lastSurgingTime) implements ScanState {
    }
}
