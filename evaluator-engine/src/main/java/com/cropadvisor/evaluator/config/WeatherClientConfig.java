package com.cropadvisor.evaluator.config;

import com.cropadvisor.evaluator.weather.OpenMeteoClient;
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
public class WeatherClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WeatherClientConfig.class);

    @Value("${services.open-meteo.forecast-base-url:https://api.open-meteo.com}")
    private String forecastBaseUrl;

    @Value("${services.open-meteo.archive-base-url:https://archive-api.open-meteo.com}")
    private String archiveBaseUrl;

    @Value("${services.open-meteo.connect-timeout-ms:2000}")
    private int connectTimeoutMs;

    @Value("${services.open-meteo.response-timeout-ms:3500}")
    private long responseTimeoutMs;

    @Value("${services.open-meteo.forecast-days:7}")
    private int forecastDays;

    @Value("${services.open-meteo.archive-after-days:90}")
    private int archiveAfterDays;

    @Bean
    public WebClient openMeteoForecastWebClient(WebClient.Builder builder) {
        return build(builder, forecastBaseUrl);
    }

    @Bean
    public WebClient openMeteoArchiveWebClient(WebClient.Builder builder) {
        return build(builder, archiveBaseUrl);
    }

    @Bean
    public OpenMeteoClient openMeteoClient(WebClient openMeteoForecastWebClient,
                                           WebClient openMeteoArchiveWebClient,
                                           ObjectMapper objectMapper, Clock clock) {
        return new OpenMeteoClient(openMeteoForecastWebClient, openMeteoArchiveWebClient,
                                   objectMapper, clock, forecastDays, archiveAfterDays);
    }

    private WebClient build(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofMillis(responseTimeoutMs))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutMs, TimeUnit.MILLISECONDS)));

        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(response -> {
            if (response.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException("Open-Meteo server error: " + response.statusCode()));
            }
            return Mono.just(response);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            log.debug("Outbound request: {} {}", request.method(), request.url());
            return Mono.just(request);
        });
    }
}
