package com.verlumen.modelfit.params;

import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Reachability over the graph formed by parameter links and composite parts.
 *
 * <p>An edge runs from a parameter to its link, and from a composite to each of its parts. Nodes
 * are compared by identity.
 */
final class LinkGraph {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Whether {@code target} can be reached from {@code start}, including {@code start} itself. */
  static boolean reaches(Parameter start, Parameter target) {
    Set<Parameter> visited = Sets.newIdentityHashSet();
    Deque<Parameter> pending = new ArrayDeque<>();
    pending.push(start);
    while (!pending.isEmpty()) {
      Parameter node = pending.pop();
      if (node == target) {
        return true;
      }
      if (!visited.add(node)) {
        continue;
      }
      if (node instanceof CompositeParameter) {
        for (Parameter part : ((CompositeParameter) node).getParts()) {
          pending.push(part);
        }
      }
      Parameter link = node.getLink();
      if (link != null) {
        pending.push(link);
      }
    }
    return false;
  }

  /**
   * Removes the link held by {@code downstream}.
   *
   * <p>Called when a new link to {@code downstream} would close a cycle of two or more links.
   * Rather than rejecting the new link, the existing link out of {@code downstream} is dropped,
   * which changes a parameter other than the one being linked.
   */
  static void breakDownstreamCycle(Parameter downstream) {
    logger.atWarning().log(
        "link to %s would create a cycle; removing the link from %s to %s",
        downstream.getFullName(), downstream.getFullName(), downstream.getLink().getFullName());
    downstream.unlink();
  }

  private LinkGraph() {}
}
