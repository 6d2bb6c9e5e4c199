package com.github.fsmcodegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A call the generated code makes into a host-implemented capability. Parameters are kept exactly
 * as written in the source: identifiers, numbers or double-quoted string literals.
 */
public final class Action {
  static final String startTimerPrefix = "start_timer_";
  static final String stopTimerPrefix = "stop_timer_";

  private final String name;
  private final List<String> params;

  public Action(final String name) {
    this(name, Collections.emptyList());
  }

  public Action(final String name, final List<String> params) {
    this.name = Objects.requireNonNull(name, "name");
    this.params = params == null || params.isEmpty() ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static Action startTimer(final String timerName) {
    return new Action(startTimerPrefix + timerName, Collections.singletonList(timerName));
  }

  public static Action stopTimer(final String timerName) {
    return new Action(stopTimerPrefix + timerName, Collections.singletonList(timerName));
  }

  public String getName() {
    return name;
  }

  public List<String> getParams() {
    return params;
  }

  public boolean hasParams() {
    return !params.isEmpty();
  }

  /**
   * Name of the timer this action starts, if it is a timer start marker.
   */
  public Optional<String> startedTimer() {
    return timerOf(startTimerPrefix);
  }

  /**
   * Name of the timer this action stops, if it is a timer stop marker.
   */
  public Optional<String> stoppedTimer() {
    return timerOf(stopTimerPrefix);
  }

  public boolean isTimerControl() {
    return startedTimer().isPresent() || stoppedTimer().isPresent();
  }

  private Optional<String> timerOf(final String prefix) {
    if (name.startsWith(prefix) && params.size() == 1
        && name.substring(prefix.length()).equals(params.get(0))) {
      return Optional.of(params.get(0));
    }
    return Optional.empty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Action)) {
      return false;
    }
    Action action = (Action) o;
    return name.equals(action.name) && params.equals(action.params);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, params);
  }

  @Override
  public String toString() {
    return name + "(" + String.join(", ", params) + ")";
  }
}
