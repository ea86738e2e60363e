package ncsdecomp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Arena of program nodes addressed by index.
 *
 * <p>The shape is fixed: a PROGRAM root owns SUBROUTINE nodes, each of which owns exactly one
 * COMMAND_BLOCK; a block owns CMD wrappers and each wrapper owns exactly one COMMAND leaf carrying
 * a {@link Command}. Ownership lives in a child-to-parent table. Attaching a node detaches it from
 * its previous parent first, so every node but the root has exactly one parent.
 */
public final class NodeTree {
  public enum NodeKind {
    PROGRAM,
    SUBROUTINE,
    COMMAND_BLOCK,
    CMD,
    COMMAND;
  }

  public static final int NO_PARENT = -1;

  private final List<NodeKind> kinds = new ArrayList<>();
  private final List<Command> payloads = new ArrayList<>();
  private final List<List<Integer>> children = new ArrayList<>();
  private int[] parents = new int[16];
  private boolean frozen = false;

  private final int root;

  public NodeTree() {
    root = add(NodeKind.PROGRAM, null);
  }

  public int root() {
    return root;
  }

  public int size() {
    return kinds.size();
  }

  public NodeKind kind(int node) {
    return kinds.get(node);
  }

  public ImmutableList<Integer> children(int node) {
    return ImmutableList.copyOf(children.get(node));
  }

  public int childCount(int node) {
    return children.get(node).size();
  }

  public int child(int node, int index) {
    return children.get(node).get(index);
  }

  public int parent(int node) {
    return parents[node];
  }

  public int addNode(NodeKind kind) {
    Preconditions.checkArgument(kind != NodeKind.COMMAND, "use addCommand");
    return add(kind, null);
  }

  /** Adds a CMD wrapper owning a fresh COMMAND leaf; returns the wrapper. */
  public int addCommand(Command command) {
    int wrapper = add(NodeKind.CMD, null);
    int leaf = add(NodeKind.COMMAND, command);
    attach(wrapper, leaf);
    return wrapper;
  }

  private int add(NodeKind kind, Command payload) {
    checkMutable();
    int index = kinds.size();
    kinds.add(kind);
    payloads.add(payload);
    children.add(new ArrayList<>());
    if (index >= parents.length) {
      parents = Arrays.copyOf(parents, parents.length * 2);
    }
    parents[index] = NO_PARENT;
    return index;
  }

  /** Appends {@code child} to {@code parent}, detaching it from any current parent first. */
  @CanIgnoreReturnValue
  public int attach(int parent, int child) {
    checkMutable();
    Preconditions.checkArgument(child != root, "the root cannot be attached");
    Preconditions.checkArgument(!isAncestor(child, parent), "attaching would create a cycle");
    checkShape(kind(parent), kind(child));
    if (kind(parent) == NodeKind.CMD || kind(parent) == NodeKind.SUBROUTINE) {
      Preconditions.checkState(children.get(parent).isEmpty(), "%s owns one child", kind(parent));
    }
    detach(child);
    children.get(parent).add(child);
    parents[child] = parent;
    return child;
  }

  public void detach(int child) {
    checkMutable();
    int parent = parents[child];
    if (parent == NO_PARENT) return;
    Verify.verify(children.get(parent).remove(Integer.valueOf(child)), "parent table out of sync");
    parents[child] = NO_PARENT;
  }

  /** Recomputes the parent table from the child lists. */
  public void rebuildParents() {
    Arrays.fill(parents, NO_PARENT);
    for (int node = 0; node < size(); node++) {
      for (int child : children.get(node)) {
        Verify.verify(parents[child] == NO_PARENT, "node %s has two parents", child);
        parents[child] = node;
      }
    }
  }

  /** Deep-copies the subtree rooted at {@code node}; the copy is detached. */
  public int copySubtree(int node) {
    checkMutable();
    int copy = add(kind(node), payloads.get(node));
    for (int child : children(node)) {
      attach(copy, copySubtree(child));
    }
    return copy;
  }

  private boolean isAncestor(int candidate, int node) {
    for (int n = node; n != NO_PARENT; n = parents[n]) {
      if (n == candidate) return true;
    }
    return false;
  }

  private static void checkShape(NodeKind parent, NodeKind child) {
    boolean ok;
    switch (parent) {
      case PROGRAM:
        ok = child == NodeKind.SUBROUTINE;
        break;
      case SUBROUTINE:
        ok = child == NodeKind.COMMAND_BLOCK;
        break;
      case COMMAND_BLOCK:
        ok = child == NodeKind.CMD;
        break;
      case CMD:
        ok = child == NodeKind.COMMAND;
        break;
      default:
        ok = false;
    }
    Preconditions.checkArgument(ok, "%s cannot own %s", parent, child);
  }

  /** Makes the tree read-only. */
  public void freeze() {
    rebuildParents();
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  private void checkMutable() {
    Preconditions.checkState(!frozen, "node tree is frozen");
  }

  /**
   * Returns the innermost command of a node. Wrappers delegate to their single child; a
   * subroutine or block delegates to its first command.
   */
  public Command unwrap(int node) {
    switch (kind(node)) {
      case COMMAND:
        return payloads.get(node);
      case CMD:
      case SUBROUTINE:
      case COMMAND_BLOCK:
        Preconditions.checkState(childCount(node) > 0, "empty %s", kind(node));
        return unwrap(child(node, 0));
      default:
        throw new IllegalArgumentException("cannot unwrap " + kind(node));
    }
  }

  /** The command block owned by a subroutine node. */
  public int block(int subroutine) {
    Preconditions.checkArgument(kind(subroutine) == NodeKind.SUBROUTINE);
    return child(subroutine, 0);
  }

  /** Commands of a command block, in order. */
  public ImmutableList<Command> commands(int block) {
    Preconditions.checkArgument(kind(block) == NodeKind.COMMAND_BLOCK);
    return children
        .get(block)
        .stream()
        .map(this::unwrap)
        .collect(ImmutableList.toImmutableList());
  }
}
