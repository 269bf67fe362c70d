package com.tradefeed.infra.redis.publisher;

public class StreamPublishException extends RuntimeException {
  private final String streamKey;

  public StreamPublishException(String streamKey, String message, Throwable cause) {
    super(message, cause);
    this.streamKey = streamKey;
  }

  public String getStreamKey() {
    return streamKey;
  }
}
