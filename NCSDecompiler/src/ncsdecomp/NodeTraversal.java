package ncsdecomp;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Depth-first walks over a {@link NodeTree}, dispatching each node to a handler picked by its tag:
 * command nodes by {@link Command.Kind}, containers by {@link NodeTree.NodeKind}. A handler may
 * prune the walk below its node. Nodes without a handler are descended into.
 */
final class NodeTraversal {
  enum Visit {
    CONTINUE,
    SKIP_CHILDREN;
  }

  @FunctionalInterface
  interface Handler {
    Visit visit(int node, Command command);
  }

  @FunctionalInterface
  interface ContainerHandler {
    Visit visit(int node);
  }

  static final class Handlers {
    private final Map<Command.Kind, Handler> commands = new EnumMap<>(Command.Kind.class);
    private final Map<NodeTree.NodeKind, ContainerHandler> containers =
        new EnumMap<>(NodeTree.NodeKind.class);

    @CanIgnoreReturnValue
    Handlers on(Command.Kind kind, Handler handler) {
      commands.put(kind, handler);
      return this;
    }

    @CanIgnoreReturnValue
    Handlers onEach(Iterable<Command.Kind> kinds, Handler handler) {
      for (Command.Kind kind : kinds) {
        commands.put(kind, handler);
      }
      return this;
    }

    @CanIgnoreReturnValue
    Handlers onContainer(NodeTree.NodeKind kind, ContainerHandler handler) {
      containers.put(kind, handler);
      return this;
    }

    private Visit dispatch(NodeTree tree, int node) {
      NodeTree.NodeKind kind = tree.kind(node);
      if (kind == NodeTree.NodeKind.CMD) {
        Command command = tree.unwrap(node);
        Handler handler = commands.get(command.kind());
        return handler == null ? Visit.CONTINUE : handler.visit(node, command);
      }
      ContainerHandler handler = containers.get(kind);
      return handler == null ? Visit.CONTINUE : handler.visit(node);
    }
  }

  /** Visits a node before its children, children in order. */
  static void forward(NodeTree tree, int root, Handlers handlers) {
    Deque<Integer> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      int node = pending.pop();
      if (handlers.dispatch(tree, node) == Visit.SKIP_CHILDREN) continue;
      ImmutableList<Integer> children = tree.children(node);
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(children.get(i));
      }
    }
  }

  /** Visits a node before its children, children last to first. */
  static void prunedReversed(NodeTree tree, int root, Handlers handlers) {
    Deque<Integer> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      int node = pending.pop();
      if (handlers.dispatch(tree, node) == Visit.SKIP_CHILDREN) continue;
      for (int child : tree.children(node)) {
        pending.push(child);
      }
    }
  }

  private NodeTraversal() {}
}
