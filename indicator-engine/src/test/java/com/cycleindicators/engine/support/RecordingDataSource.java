package com.cycleindicators.engine.support;

import com.cycleindicators.common.model.TimeframeDataset;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/** {@link StaticDataSource} that remembers every timeframe asked for. */
public class RecordingDataSource extends StaticDataSource {

    private final Set<String> requested = new LinkedHashSet<>();

    @Override
    public synchronized Optional<TimeframeDataset> get(String timeframe) {
        requested.add(timeframe);
        return super.get(timeframe);
    }

    public synchronized Set<String> requested() {
        return Set.copyOf(requested);
    }

    public synchronized void clear() {
        requested.clear();
    }
}
