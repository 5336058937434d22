package com.kotsin.surge.detector;

import java.util.List;

/**
 * Causes attributed to a surge.
 *
 * @param causes           deduplicated, in first-seen order
 * @param externallyDriven true when a news rule or a high-signal intent
 *                         produced at least one cause
 */
public record CauseAttribution(List<String> causes, boolean externallyDriven) {

    public CauseAttribution {
        causes = List.copyOf(causes);
    }

    public boolean hasCauses() {
        return !causes.isEmpty();
    }
}
