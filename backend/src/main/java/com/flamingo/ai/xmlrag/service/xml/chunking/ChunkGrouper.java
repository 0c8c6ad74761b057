package com.flamingo.ai.xmlrag.service.xml.chunking;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reorders drafts so that each chunk declared as grouped with a target directly follows that
 * target, or the previous chunk already grouped under it.
 *
 * <p>The pass is stable: chunks without a resolvable group target keep their document order, and
 * chunks grouped under the same target keep their relative order. Groups nest. A chain of group
 * targets that loops back on itself is left in document order.
 */
final class ChunkGrouper {

  private static final int UNKNOWN = 0;
  private static final int ROOTED = 1;
  private static final int CYCLIC = 2;

  List<DraftChunk> reorder(List<DraftChunk> drafts) {
    int n = drafts.size();
    Map<String, Integer> byIdentifier = new HashMap<>();
    for (int i = 0; i < n; i++) {
      String id = drafts.get(i).identifier();
      if (id != null) {
        byIdentifier.putIfAbsent(id, i);
      }
    }

    int[] parent = new int[n];
    boolean grouped = false;
    for (int i = 0; i < n; i++) {
      String target = drafts.get(i).groupTarget();
      Integer targetIndex = target == null ? null : byIdentifier.get(target);
      parent[i] = targetIndex == null || targetIndex == i ? -1 : targetIndex;
      grouped |= parent[i] >= 0;
    }
    if (!grouped) {
      return drafts;
    }

    breakCycles(parent);

    List<List<Integer>> children = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      children.add(new ArrayList<>());
    }
    for (int i = 0; i < n; i++) {
      if (parent[i] >= 0) {
        children.get(parent[i]).add(i);
      }
    }

    List<DraftChunk> ordered = new ArrayList<>(n);
    boolean[] emitted = new boolean[n];
    for (int i = 0; i < n; i++) {
      if (parent[i] < 0) {
        emit(i, drafts, children, emitted, ordered);
      }
    }
    return ordered;
  }

  /** Detaches every draft whose chain of group targets never reaches an ungrouped draft. */
  private static void breakCycles(int[] parent) {
    int n = parent.length;
    int[] state = new int[n];
    for (int i = 0; i < n; i++) {
      List<Integer> chain = new ArrayList<>();
      int current = i;
      int outcome;
      while (true) {
        if (state[current] != UNKNOWN) {
          outcome = state[current];
          break;
        }
        if (parent[current] < 0) {
          outcome = ROOTED;
          break;
        }
        if (chain.contains(current)) {
          outcome = CYCLIC;
          break;
        }
        chain.add(current);
        current = parent[current];
      }
      for (int visited : chain) {
        state[visited] = outcome;
      }
      if (parent[current] < 0) {
        state[current] = ROOTED;
      }
    }
    for (int i = 0; i < n; i++) {
      if (state[i] == CYCLIC) {
        parent[i] = -1;
      }
    }
  }

  private static void emit(
      int start,
      List<DraftChunk> drafts,
      List<List<Integer>> children,
      boolean[] emitted,
      List<DraftChunk> ordered) {
    // explicit stack keeps deep groups off the call stack
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(start);
    while (!stack.isEmpty()) {
      int index = stack.pop();
      if (emitted[index]) {
        continue;
      }
      emitted[index] = true;
      ordered.add(drafts.get(index));
      List<Integer> kids = children.get(index);
      for (int k = kids.size() - 1; k >= 0; k--) {
        stack.push(kids.get(k));
      }
    }
  }
}
