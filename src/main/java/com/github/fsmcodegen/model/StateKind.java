package com.github.fsmcodegen.model;

public enum StateKind {
  SIMPLE,
  // has a nested fsm
  COMPOSITE,
  HISTORY,
  DEEP_HISTORY,
  // terminal, wildcard fault rules never apply here
  FINAL;
}
