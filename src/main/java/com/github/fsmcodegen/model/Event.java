package com.github.fsmcodegen.model;

import java.util.Objects;
import java.util.Optional;

/**
 * An event that triggers transitions. Identity is by name only: two events with the same name are
 * the same event whether or not one of them knows about a payload.
 */
public final class Event implements Comparable<Event> {
  private final String name;
  // name of the single scalar payload, for events declared with one
  private final Optional<String> payloadName;

  public Event(final String name) {
    this(name, Optional.empty());
  }

  public Event(final String name, final Optional<String> payloadName) {
    this.name = Objects.requireNonNull(name, "name");
    this.payloadName = payloadName == null ? Optional.empty() : payloadName;
  }

  public String getName() {
    return name;
  }

  public Optional<String> getPayloadName() {
    return payloadName;
  }

  public boolean carriesPayload() {
    return payloadName.isPresent();
  }

  @Override
  public int compareTo(final Event other) {
    return name.compareTo(other.name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Event)) {
      return false;
    }
    return name.equals(((Event) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return payloadName.isPresent() ? name + "(" + payloadName.get() + ")" : name;
  }
}
