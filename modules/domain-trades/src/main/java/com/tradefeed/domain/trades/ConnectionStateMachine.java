package com.tradefeed.domain.trades;

import java.util.EnumSet;
import java.util.Map;

public final class ConnectionStateMachine {
  private static final Map<ConnectionStatus, EnumSet<ConnectionStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          ConnectionStatus.CONNECTING,
              EnumSet.of(
                  ConnectionStatus.STREAMING,
                  ConnectionStatus.BACKOFF,
                  ConnectionStatus.FAILED,
                  ConnectionStatus.STOPPED),
          ConnectionStatus.STREAMING,
              EnumSet.of(ConnectionStatus.BACKOFF, ConnectionStatus.FAILED, ConnectionStatus.STOPPED),
          ConnectionStatus.BACKOFF,
              EnumSet.of(ConnectionStatus.CONNECTING, ConnectionStatus.STOPPED),
          ConnectionStatus.FAILED, EnumSet.noneOf(ConnectionStatus.class),
          ConnectionStatus.STOPPED, EnumSet.noneOf(ConnectionStatus.class));

  private ConnectionStateMachine() {}

  public static boolean canTransition(ConnectionStatus from, ConnectionStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<ConnectionStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(ConnectionStatus from, ConnectionStatus to) {
    if (!canTransition(from, to)) {
      throw new ConnectionStateException(
          "Invalid connection status transition from " + from + " to " + to);
    }
  }
}
