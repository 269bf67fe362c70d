package com.tradefeed.infra.redis.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class InfraRedisPropertiesTest {
  @Test
  void shouldDefaultToBoundedTradeStreams() {
    InfraRedisProperties properties = new InfraRedisProperties();

    assertEquals("trades", properties.getStreams().getKeyPrefix());
    assertEquals(10_000L, properties.getStreams().getMaxLength());
    assertTrue(properties.getStreams().isApproximateTrimming());
  }
}
