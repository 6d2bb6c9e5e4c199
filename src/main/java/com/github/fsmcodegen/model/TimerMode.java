package com.github.fsmcodegen.model;

public enum TimerMode {
  ONE_SHOT,
  PERIODIC;
}
