package io.github.isoflow.model;

/**
 * Priorities of messages sent to the action queue. Higher values are consumed first.
 */
public enum ActionPriority {
  LOW(0),
  STANDARD(1),
  HIGH(2);

  /**
   * Priority used when the caller does not supply one.
   */
  public static final ActionPriority DEFAULT = LOW;

  private final int value;

  ActionPriority(final int value) {
    this.value = value;
  }

  /**
   * Numeric priority as understood by the queue.
   *
   * @return the value
   */
  public int value() {
    return value;
  }
}
