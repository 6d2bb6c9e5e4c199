package com.github.fsmcodegen;

/**
 * This represents the execution architecture that generated code is written for. All targets share
 * the same transition semantics; they differ in how events get from their producers to dispatch.
 */
public enum Target {
  // plain synchronous dispatch on the caller thread, caller provides mutual exclusion if shared.
  STANDARD("Fsm"),
  // bounded multi-producer/single-consumer queue drained by one consumer that owns the dispatcher.
  ACTIVE_OBJECT("ActiveObject"),
  // like ACTIVE_OBJECT but producers are interrupt-like: no allocation, no blocking. Events carry a
  // scalar payload, the machine carries extended state and counts faults.
  INTERRUPT_QUEUE("InterruptFsm");

  private final String classSuffix;

  private Target(final String classSuffix) {
    this.classSuffix = classSuffix;
  }

  /**
   * Suffix appended to the fsm name to form the generated class name.
   */
  public String getClassSuffix() {
    return classSuffix;
  }
}
