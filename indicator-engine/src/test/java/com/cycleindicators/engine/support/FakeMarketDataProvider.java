package com.cycleindicators.engine.support;

import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.marketdata.MarketDataException;
import com.cycleindicators.engine.marketdata.MarketDataProvider;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/** Scripted provider: serves the dataset registered per timeframe, fails the ones marked failing. */
public class FakeMarketDataProvider implements MarketDataProvider {

    private final Map<String, TimeframeDataset> datasets = new HashMap<>();
    private final Map<String, Integer> calls = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private Double price;

    public FakeMarketDataProvider serve(TimeframeDataset dataset) {
        datasets.put(dataset.timeframe(), dataset);
        failing.remove(dataset.timeframe());
        return this;
    }

    public FakeMarketDataProvider fail(String timeframe) {
        failing.add(timeframe);
        return this;
    }

    public FakeMarketDataProvider price(Double price) {
        this.price = price;
        return this;
    }

    public int calls(String timeframe) {
        return calls.getOrDefault(timeframe, 0);
    }

    @Override
    public Mono<TimeframeDataset> fetchTimeframe(String timeframe, int barCount) {
        return Mono.defer(() -> {
            calls.merge(timeframe, 1, Integer::sum);
            if (failing.contains(timeframe) || !datasets.containsKey(timeframe)) {
                return Mono.error(new MarketDataException("scripted failure for " + timeframe, false));
            }
            return Mono.just(datasets.get(timeframe));
        });
    }

    @Override
    public Mono<Double> currentPrice() {
        return Mono.justOrEmpty(price);
    }
}
