package com.cloudmusic.resolver;

import java.io.IOException;
import java.util.Map;

/**
 * Persistence for {@link SourceStats} counters. The stored mapping is non-authoritative; callers treat
 * every failure as "start from empty" or "skip this write".
 */
public interface SourceStatsStore {
    /**
     * Loads the persisted counters, keyed by provider or source name.
     */
    Map<String, SourceStats.Counter> load() throws IOException;

    void save(Map<String, SourceStats.Counter> counters) throws IOException;
}
