package com.tradefeed.infra.redis.config;

import com.tradefeed.infra.redis.observability.MicrometerStreamTelemetry;
import com.tradefeed.infra.redis.observability.NoOpStreamTelemetry;
import com.tradefeed.infra.redis.observability.StreamTelemetry;
import com.tradefeed.infra.redis.publisher.RedisTradeStreamPublisher;
import com.tradefeed.infra.redis.publisher.TradeStreamPublisher;
import com.tradefeed.infra.redis.streams.StreamKeys;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

@AutoConfiguration(
    after = RedisAutoConfiguration.class,
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(InfraRedisProperties.class)
public class InfraRedisAutoConfiguration {
  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(StreamTelemetry.class)
  public StreamTelemetry micrometerStreamTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerStreamTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(StreamTelemetry.class)
  public StreamTelemetry noOpStreamTelemetry() {
    return new NoOpStreamTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public StreamKeys streamKeys(InfraRedisProperties properties) {
    return new StreamKeys(properties.getStreams().getKeyPrefix());
  }

  @Bean
  @ConditionalOnBean(StringRedisTemplate.class)
  @ConditionalOnMissingBean(TradeStreamPublisher.class)
  public TradeStreamPublisher tradeStreamPublisher(
      StringRedisTemplate stringRedisTemplate,
      StreamKeys streamKeys,
      StreamTelemetry streamTelemetry,
      InfraRedisProperties properties) {
    InfraRedisProperties.Streams streams = properties.getStreams();
    return new RedisTradeStreamPublisher(
        stringRedisTemplate,
        streamKeys,
        streamTelemetry,
        streams.getMaxLength(),
        streams.isApproximateTrimming(),
        Clock.systemUTC());
  }
}
