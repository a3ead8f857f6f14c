package io.intellixity.ignitekv.exec;

/** Backend connection state as last reported by the backend. */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED
}
