package com.marketgateway.marketdata.config;

import com.marketgateway.marketdata.client.FinnhubWebClient;
import com.marketgateway.marketdata.client.MarketDataProviderClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${finnhub.base-url:https://finnhub.io/api/v1}")
    private String baseUrl;

    @Value("${finnhub.api-key:}")
    private String apiKey;

    @Value("${finnhub.timeout-ms:5000}")
    private long timeoutMs;

    @Bean
    public WebClient finnhubWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeoutMs)
            .responseTimeout(Duration.ofMillis(timeoutMs))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
            );

        if (apiKey.isBlank()) {
            log.warn("finnhub.api-key is not set; upstream calls will be rejected by the provider");
        }

        return builder
            .baseUrl(stripTrailingSlash(baseUrl))
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(throttleLoggingFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public MarketDataProviderClient finnhubClient(WebClient finnhubWebClient) {
        return new FinnhubWebClient(finnhubWebClient, apiKey, Duration.ofMillis(timeoutMs));
    }

    private ExchangeFilterFunction throttleLoggingFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                log.warn("Finnhub throttled request. retryAfter={}",
                         clientResponse.headers().asHttpHeaders().getFirst("Retry-After"));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), maskToken(clientRequest.url().toString()));
            return Mono.just(clientRequest);
        });
    }

    static String maskToken(String uri) {
        return uri.replaceAll("token=[^&]+", "token=***");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
