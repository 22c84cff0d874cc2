package com.hedgeplatform.worker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgeplatform.integration.binance.BinanceFuturesApiConfig;
import com.hedgeplatform.integration.binance.BinanceFuturesConnectorProperties;
import com.hedgeplatform.integration.binance.BinanceFuturesVenueAdapter;
import com.hedgeplatform.integration.gateio.GateioApiConfig;
import com.hedgeplatform.integration.gateio.GateioConnectorProperties;
import com.hedgeplatform.integration.gateio.GateioEarnReservoir;
import com.hedgeplatform.integration.gateio.GateioSpotVenueAdapter;
import com.hedgeplatform.integration.venue.CapitalReservoir;
import com.hedgeplatform.integration.venue.ReadBackoff;
import com.hedgeplatform.integration.venue.ReadRetryExecutor;
import com.hedgeplatform.integration.venue.VenueAdapter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Venue A is Gate.io spot, venue B is Binance USDⓈ-M futures. */
@Configuration
@EnableConfigurationProperties({GateioConnectorProperties.class, BinanceFuturesConnectorProperties.class})
public class VenueConnectorConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock hedgeClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public GateioApiConfig gateioApiConfig(GateioConnectorProperties properties, Clock hedgeClock) {
    String apiKey =
        resolveSecret(
            properties.getApiKey(),
            properties.getApiKeyFile(),
            "connector.gateio.api-key",
            "connector.gateio.api-key-file");
    String apiSecret =
        resolveSecret(
            properties.getApiSecret(),
            properties.getApiSecretFile(),
            "connector.gateio.api-secret",
            "connector.gateio.api-secret-file");
    return new GateioApiConfig(
        URI.create(properties.getBaseUrl()),
        URI.create(properties.getStreamUrl()),
        apiKey,
        apiSecret,
        Duration.ofMillis(properties.getTimeoutMs()),
        hedgeClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public BinanceFuturesApiConfig binanceFuturesApiConfig(
      BinanceFuturesConnectorProperties properties, Clock hedgeClock) {
    String apiKey =
        resolveSecret(
            properties.getApiKey(),
            properties.getApiKeyFile(),
            "connector.binance-futures.api-key",
            "connector.binance-futures.api-key-file");
    String apiSecret =
        resolveSecret(
            properties.getApiSecret(),
            properties.getApiSecretFile(),
            "connector.binance-futures.api-secret",
            "connector.binance-futures.api-secret-file");
    return new BinanceFuturesApiConfig(
        URI.create(properties.getBaseUrl()),
        URI.create(properties.getStreamUrl()),
        apiKey,
        apiSecret,
        properties.getRecvWindowMs(),
        Duration.ofMillis(properties.getTimeoutMs()),
        properties.isDualSidePosition(),
        hedgeClock);
  }

  @Bean(name = "venueA")
  @ConditionalOnMissingBean(name = "venueA")
  public VenueAdapter venueA(
      GateioApiConfig config,
      GateioConnectorProperties properties,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    GateioConnectorProperties.Retry retry = properties.getRetry();
    ReadRetryExecutor retryExecutor =
        retryExecutor(
            retry.getMaxAttempts(),
            retry.getBaseBackoffMs(),
            retry.getMaxBackoffMs(),
            retry.isJitterEnabled(),
            config.clock(),
            meterRegistry);
    return new GateioSpotVenueAdapter(
        config, httpClient(config.timeout()), objectMapper, retryExecutor, meterRegistry);
  }

  @Bean(name = "venueB")
  @ConditionalOnMissingBean(name = "venueB")
  public VenueAdapter venueB(
      BinanceFuturesApiConfig config,
      BinanceFuturesConnectorProperties properties,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    BinanceFuturesConnectorProperties.Retry retry = properties.getRetry();
    ReadRetryExecutor retryExecutor =
        retryExecutor(
            retry.getMaxAttempts(),
            retry.getBaseBackoffMs(),
            retry.getMaxBackoffMs(),
            retry.isJitterEnabled(),
            config.clock(),
            meterRegistry);
    return new BinanceFuturesVenueAdapter(
        config, httpClient(config.timeout()), objectMapper, retryExecutor, meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public CapitalReservoir capitalReservoir(
      GateioConnectorProperties properties, GateioApiConfig config,
      ObjectMapper objectMapper) {
    if (!properties.getEarn().isEnabled()) {
      return CapitalReservoir.none();
    }
    return new GateioEarnReservoir(config, httpClient(config.timeout()), objectMapper);
  }

  private static HttpClient httpClient(Duration timeout) {
    return HttpClient.newBuilder().connectTimeout(timeout).build();
  }

  private static ReadRetryExecutor retryExecutor(
      int maxAttempts,
      long baseBackoffMs,
      long maxBackoffMs,
      boolean jitterEnabled,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new ReadRetryExecutor(
        maxAttempts,
        new ReadBackoff(
            Duration.ofMillis(baseBackoffMs), Duration.ofMillis(maxBackoffMs), jitterEnabled, clock),
        meterRegistry);
  }

  static String resolveSecret(
      String directValue, String filePath, String directName, String fileName) {
    if (filePath != null && !filePath.isBlank()) {
      String fromFile = readSecret(filePath, fileName);
      if (!fromFile.isBlank()) {
        return fromFile;
      }
      throw new IllegalStateException(fileName + " points to an empty file");
    }
    if (directValue == null || directValue.isBlank()) {
      throw new IllegalStateException(directName + " must be configured");
    }
    return directValue;
  }

  private static String readSecret(String filePath, String fileName) {
    try {
      return Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
    } catch (IOException ex) {
      throw new IllegalStateException(fileName + " cannot be read: " + filePath, ex);
    }
  }
}
