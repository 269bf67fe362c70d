package com.tradefeed.infra.redis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.redis")
public class InfraRedisProperties {
  private Streams streams = new Streams();

  public Streams getStreams() {
    return streams;
  }

  public void setStreams(Streams streams) {
    this.streams = streams;
  }

  public static class Streams {
    private String keyPrefix = "trades";
    private long maxLength = 10_000L;
    private boolean approximateTrimming = true;

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }

    public long getMaxLength() {
      return maxLength;
    }

    public void setMaxLength(long maxLength) {
      this.maxLength = maxLength;
    }

    public boolean isApproximateTrimming() {
      return approximateTrimming;
    }

    public void setApproximateTrimming(boolean approximateTrimming) {
      this.approximateTrimming = approximateTrimming;
    }
  }
}
