package com.github.fsmcodegen.codegen;

import java.util.ArrayList;
import java.util.List;

import com.github.fsmcodegen.model.Action;
import com.github.fsmcodegen.model.Assignment;
import com.github.fsmcodegen.model.ChoiceBranch;
import com.github.fsmcodegen.model.Transition;

/**
 * Human readable {@code event [guard] / action} labels. Used for documentation only, dispatch never
 * depends on them.
 */
public final class Labels {
  private Labels() {}

  public static String of(final Transition transition) {
    final List<String> parts = new ArrayList<>();
    if (transition.getEvent().isPresent()) {
      parts.add(transition.getEvent().get().getName());
    }
    if (transition.getGuard().isPresent()) {
      parts.add("[" + transition.getGuard().get().getExpression() + "]");
    }
    if (transition.getAction().isPresent()) {
      parts.add("/ " + call(transition.getAction().get()));
    }
    if (transition.getGuardRejectedAction().isPresent()) {
      parts.add("else / " + call(transition.getGuardRejectedAction().get()));
    }
    for (Assignment assignment : transition.getAssignments()) {
      parts.add(assignment.toString());
    }
    return String.join(" ", parts);
  }

  /**
   * {@code Source --> Target : label}, or just the arrow when the label is empty.
   */
  public static String edge(final Transition transition) {
    final String label = of(transition);
    final String arrow = transition.getSource() + " --> " + transition.getTarget();
    return label.isEmpty() ? arrow : arrow + " : " + label;
  }

  public static String of(final ChoiceBranch branch) {
    final String label = "[" + branch.getGuard().getExpression() + "] -> " + branch.getTarget();
    return branch.getAction().isPresent() ? label + " / " + call(branch.getAction().get()) : label;
  }

  public static String call(final Action action) {
    return action.getName() + "(" + String.join(", ", action.getParams()) + ")";
  }
}
