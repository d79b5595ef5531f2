package com.cycleindicators.engine.config;

import com.cycleindicators.engine.marketdata.MarketDataException;
import com.cycleindicators.engine.marketdata.MarketDataSettings;
import com.cycleindicators.engine.marketdata.MarketDataWebClient;
import com.cycleindicators.engine.series.DerivedSeriesCalculator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class MarketDataConfig {

    private static final Logger log = LoggerFactory.getLogger(MarketDataConfig.class);

    @Value("${market-data.base-url:https://www.alphavantage.co}")
    private String baseUrl;

    @Value("${market-data.price-url:https://api.coingecko.com}")
    private String priceUrl;

    @Value("${market-data.api-key:demo}")
    private String apiKey;

    @Value("${market-data.symbol:BTC}")
    private String symbol;

    @Value("${market-data.market:USD}")
    private String market;

    @Value("${market-data.price-coin-id:bitcoin}")
    private String priceCoinId;

    @Value("${market-data.min-call-interval:12s}")
    private Duration minCallInterval;

    @Value("${market-data.max-retries:3}")
    private int maxRetries;

    @Value("${market-data.retry-backoff:2s}")
    private Duration retryBackoff;

    @Bean
    public WebClient marketDataWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient(30)))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient priceWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(priceUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient(10)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public MarketDataWebClient marketDataClient(WebClient marketDataWebClient, WebClient priceWebClient,
                                                ObjectMapper objectMapper, DerivedSeriesCalculator derivedSeries,
                                                Clock clock) {
        MarketDataSettings settings = new MarketDataSettings(
            apiKey, symbol, market, priceCoinId, minCallInterval, maxRetries, retryBackoff);
        return new MarketDataWebClient(marketDataWebClient, priceWebClient, objectMapper, derivedSeries, clock, settings);
    }

    private static HttpClient httpClient(int timeoutSeconds) {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new MarketDataException(
                    "Market data server error: " + clientResponse.statusCode(), true));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("apikey=[^&]+", "apikey=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
