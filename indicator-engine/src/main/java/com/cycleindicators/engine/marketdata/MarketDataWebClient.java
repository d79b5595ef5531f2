package com.cycleindicators.engine.marketdata;

import com.cycleindicators.common.model.OhlcvBar;
import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.series.DerivedSeriesCalculator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Alpha Vantage digital-currency client plus CoinGecko spot price.
 *
 * <pre>
 *   1D, D   DIGITAL_CURRENCY_DAILY
 *   3D, 5D  DIGITAL_CURRENCY_DAILY, consecutive daily bars merged 3 or 5 at a time
 *   1W, W   DIGITAL_CURRENCY_WEEKLY
 *   1M, M   DIGITAL_CURRENCY_MONTHLY
 * </pre>
 *
 * <p>Calls are spaced at least {@code minCallInterval} apart (the free tier allows five per
 * minute) and retried with exponential backoff on transient failures. A JSON body carrying
 * {@code Error Message}, {@code Note} or {@code Information} instead of a time series is a failure.
 */
public class MarketDataWebClient implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(MarketDataWebClient.class);

    private final WebClient webClient;
    private final WebClient priceWebClient;
    private final ObjectMapper objectMapper;
    private final DerivedSeriesCalculator derivedSeries;
    private final Clock clock;
    private final MarketDataSettings settings;

    private Instant nextCallAllowedAt = Instant.EPOCH;

    public MarketDataWebClient(WebClient marketDataWebClient, WebClient priceWebClient, ObjectMapper objectMapper,
                               DerivedSeriesCalculator derivedSeries, Clock clock, MarketDataSettings settings) {
        this.webClient      = marketDataWebClient;
        this.priceWebClient = priceWebClient;
        this.objectMapper   = objectMapper;
        this.derivedSeries  = derivedSeries;
        this.clock          = clock;
        this.settings       = settings;
    }

    @Override
    public Mono<TimeframeDataset> fetchTimeframe(String timeframe, int barCount) {
        SeriesRequest request;
        try {
            request = SeriesRequest.of(timeframe);
        } catch (IllegalArgumentException e) {
            return Mono.error(new MarketDataException(e.getMessage(), false));
        }

        log.info("Fetching market data. provider=AlphaVantage function={} timeframe={} symbol={}",
                 request.function(), timeframe, settings.symbol());

        return query(request.function())
            .map(root -> toDataset(timeframe, request, root, barCount))
            .doOnSuccess(ds -> log.info("Market data fetched. timeframe={} bars={} latestClose={}",
                                        timeframe, ds.size(), ds.latest().close()))
            .doOnError(e -> log.error("Alpha Vantage fetch failed. timeframe={} error={}", timeframe, e.getMessage()));
    }

    @Override
    public Mono<Double> currentPrice() {
        String coin     = settings.priceCoinId();
        String currency = settings.market().toLowerCase();
        return priceWebClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v3/simple/price")
                .queryParam("ids", coin)
                .queryParam("vs_currencies", currency)
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .flatMap(root -> {
                JsonNode price = root.path(coin).path(currency);
                if (!price.isNumber()) {
                    return Mono.<Double>error(new MarketDataException("No " + coin + "/" + currency + " price in response", false));
                }
                return Mono.just(price.asDouble());
            })
            .doOnSuccess(p -> log.info("Current price fetched. provider=CoinGecko coin={} price={}", coin, p))
            .onErrorResume(e -> {
                log.warn("Current price unavailable. provider=CoinGecko coin={} error={}", coin, e.getMessage());
                return Mono.empty();
            });
    }

    // ── request plumbing ────────────────────────────────────────────────────

    private Mono<JsonNode> query(String function) {
        return Mono.defer(() -> Mono.delay(reserveCallSlot())
                .then(webClient.get()
                    .uri(uriBuilder -> uriBuilder
                        .path("/query")
                        .queryParam("function", function)
                        .queryParam("symbol", settings.symbol())
                        .queryParam("market", settings.market())
                        .queryParam("apikey", settings.apiKey())
                        .build())
                    .retrieve()
                    .bodyToMono(String.class)))
            .map(this::parseBody)
            .retryWhen(Retry.backoff(settings.maxRetries(), settings.retryBackoff())
                .filter(MarketDataWebClient::isTransient)
                .doBeforeRetry(signal -> log.warn("Retrying market data call. function={} attempt={} error={}",
                                                  function, signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    /** Time to wait before the next call may go out; reserves the slot after it. */
    synchronized Duration reserveCallSlot() {
        Instant now = clock.instant();
        Instant slot = nextCallAllowedAt.isAfter(now) ? nextCallAllowedAt : now;
        nextCallAllowedAt = slot.plus(settings.minCallInterval());
        Duration wait = Duration.between(now, slot);
        if (!wait.isZero()) {
            log.info("Rate limiting market data calls: waiting {} ms", wait.toMillis());
        }
        return wait;
    }

    JsonNode parseBody(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarketDataException("Unparseable market data response", e);
        }
        if (root == null || !root.isObject()) {
            throw new MarketDataException("Market data response is not a JSON object", false);
        }
        if (root.has("Error Message")) {
            throw new MarketDataException("Alpha Vantage error: " + root.get("Error Message").asText(), false);
        }
        if (root.has("Note")) {
            throw new MarketDataException("Alpha Vantage rate limit: " + root.get("Note").asText(), true);
        }
        if (root.has("Information")) {
            throw new MarketDataException("Alpha Vantage information: " + root.get("Information").asText(), true);
        }
        return root;
    }

    private static boolean isTransient(Throwable e) {
        if (e instanceof MarketDataException mde) return mde.isRetryable();
        if (e instanceof WebClientResponseException wre) {
            return wre.getStatusCode().is5xxServerError() || wre.getStatusCode().value() == 429;
        }
        return e instanceof WebClientRequestException;
    }

    // ── parsing ─────────────────────────────────────────────────────────────

    TimeframeDataset toDataset(String timeframe, SeriesRequest request, JsonNode root, int barCount) {
        JsonNode series = root.get(request.seriesKey());
        if (series == null || !series.isObject() || series.isEmpty()) {
            throw new MarketDataException("No time series '" + request.seriesKey() + "' in response", false);
        }

        TreeMap<LocalDate, OhlcvBar> sorted = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = series.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            LocalDate date;
            try {
                date = LocalDate.parse(entry.getKey().substring(0, Math.min(10, entry.getKey().length())));
            } catch (DateTimeParseException e) {
                log.debug("Skipping bar with unparseable date {}", entry.getKey());
                continue;
            }
            sorted.put(date, toBar(date, entry.getValue()));
        }

        List<OhlcvBar> bars = new ArrayList<>(sorted.values());
        if (request.daysPerBar() > 1) {
            bars = mergeConsecutive(bars, request.daysPerBar());
        }
        if (bars.size() > barCount) {
            bars = bars.subList(bars.size() - barCount, bars.size());
        }
        if (bars.isEmpty()) {
            throw new MarketDataException("No bars for timeframe " + timeframe, false);
        }
        return derivedSeries.enrich(TimeframeDataset.of(timeframe, bars, clock.instant()));
    }

    private OhlcvBar toBar(LocalDate date, JsonNode values) {
        String market = settings.market();
        return new OhlcvBar(
            date.atStartOfDay(ZoneOffset.UTC).toInstant(),
            number(values, "1a. open (" + market + ")", "1. open"),
            number(values, "2a. high (" + market + ")", "2. high"),
            number(values, "3a. low (" + market + ")", "3. low"),
            number(values, "4a. close (" + market + ")", "4. close"),
            number(values, "5. volume", "5. volume"));
    }

    private static double number(JsonNode values, String field, String fallbackField) {
        JsonNode node = values.has(field) ? values.get(field) : values.get(fallbackField);
        if (node == null) {
            throw new MarketDataException("Missing field '" + fallbackField + "' in bar", false);
        }
        try {
            return Double.parseDouble(node.asText());
        } catch (NumberFormatException e) {
            throw new MarketDataException("Non-numeric '" + fallbackField + "' in bar: " + node.asText(), e);
        }
    }

    /**
     * Merges daily bars into {@code size}-day bars anchored on the newest bar, so the last
     * merged bar always ends with the latest day. A partial leading group is dropped.
     */
    static List<OhlcvBar> mergeConsecutive(List<OhlcvBar> daily, int size) {
        List<OhlcvBar> merged = new ArrayList<>();
        int start = daily.size() % size;
        for (int i = start; i + size <= daily.size(); i += size) {
            List<OhlcvBar> group = daily.subList(i, i + size);
            double high = Double.NEGATIVE_INFINITY;
            double low = Double.POSITIVE_INFINITY;
            double volume = 0;
            for (OhlcvBar bar : group) {
                high = Math.max(high, bar.high());
                low = Math.min(low, bar.low());
                volume += bar.volume();
            }
            merged.add(new OhlcvBar(group.get(0).timestamp(), group.get(0).open(), high, low,
                                    group.get(size - 1).close(), volume));
        }
        return merged;
    }

    record SeriesRequest(String function, String seriesKey, int daysPerBar) {

        static SeriesRequest of(String timeframe) {
            return switch (timeframe.toUpperCase()) {
                case "1D", "D" -> daily(1);
                case "3D"      -> daily(3);
                case "5D"      -> daily(5);
                case "1W", "W" -> new SeriesRequest("DIGITAL_CURRENCY_WEEKLY",
                                                    "Time Series (Digital Currency Weekly)", 1);
                case "1M", "M" -> new SeriesRequest("DIGITAL_CURRENCY_MONTHLY",
                                                    "Time Series (Digital Currency Monthly)", 1);
                default -> throw new IllegalArgumentException("Unsupported timeframe: " + timeframe);
            };
        }

        private static SeriesRequest daily(int daysPerBar) {
            return new SeriesRequest("DIGITAL_CURRENCY_DAILY", "Time Series (Digital Currency Daily)", daysPerBar);
        }
    }
}
