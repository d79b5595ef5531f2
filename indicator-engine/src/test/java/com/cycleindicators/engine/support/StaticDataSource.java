package com.cycleindicators.engine.support;

import com.cycleindicators.common.indicator.TimeframeDataSource;
import com.cycleindicators.common.model.TimeframeDataset;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class StaticDataSource implements TimeframeDataSource {

    private final Map<String, TimeframeDataset> datasets = new HashMap<>();

    public StaticDataSource put(TimeframeDataset dataset) {
        datasets.put(dataset.timeframe(), dataset);
        return this;
    }

    @Override
    public Optional<TimeframeDataset> get(String timeframe) {
        return Optional.ofNullable(datasets.get(timeframe));
    }
}
