package com.github.fsmcodegen.model;

public enum TransitionKind {
  // exits the source and enters the target, even when both are the same state
  EXTERNAL,
  // handles the event without leaving the state, no exit or entry actions run
  INTERNAL,
  // stays within a composite state's boundary
  LOCAL;
}
