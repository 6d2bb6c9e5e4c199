package com.github.fsmcodegen.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Declarative timer metadata. Generated code only emits start and stop hooks, expiry is fed back in
 * by the host as an ordinary event.
 */
public final class Timer {
  private final String name;
  private final long durationMillis;
  private final Event event;
  private final TimerMode mode;
  private final Optional<String> autoStartState;

  public Timer(final String name, final long durationMillis, final Event event,
      final TimerMode mode) {
    this(name, durationMillis, event, mode, Optional.empty());
  }

  public Timer(final String name, final long durationMillis, final Event event,
      final TimerMode mode, final Optional<String> autoStartState) {
    this.name = Objects.requireNonNull(name, "name");
    this.durationMillis = durationMillis;
    this.event = Objects.requireNonNull(event, "event");
    this.mode = mode == null ? TimerMode.ONE_SHOT : mode;
    this.autoStartState = autoStartState == null ? Optional.empty() : autoStartState;
  }

  /**
   * A copy of this timer that is started on entry to the given state.
   */
  public Timer withAutoStartState(final String stateName) {
    return new Timer(name, durationMillis, event, mode, Optional.ofNullable(stateName));
  }

  public String getName() {
    return name;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  public Event getEvent() {
    return event;
  }

  public TimerMode getMode() {
    return mode;
  }

  public boolean isPeriodic() {
    return mode == TimerMode.PERIODIC;
  }

  public Optional<String> getAutoStartState() {
    return autoStartState;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Timer)) {
      return false;
    }
    Timer other = (Timer) o;
    return name.equals(other.name) && durationMillis == other.durationMillis
        && event.equals(other.event) && mode == other.mode
        && autoStartState.equals(other.autoStartState);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, durationMillis, event, mode, autoStartState);
  }

  @Override
  public String toString() {
    return "Timer [name=" + name + ", durationMillis=" + durationMillis + ", event=" + event
        + ", mode=" + mode + ", autoStartState=" + autoStartState.orElse("<none>") + "]";
  }
}
