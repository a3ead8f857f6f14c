package io.intellixity.ignitekv.exec;

/** Observer the backend pushes state transitions to (possibly from its own threads). */
@FunctionalInterface
public interface ConnectionStateListener {
  /**
   * @param state new state
   * @param reason cause of a transition to {@link ConnectionState#DISCONNECTED}, or null
   */
  void onStateChange(ConnectionState state, Throwable reason);
}
