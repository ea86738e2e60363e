package ncsdecomp;

public interface ScriptNodeInterface {
  <V> V accept(ScriptVisitor<V> visitor, V value);

  <V> V visitChildren(ScriptVisitor<V> visitor, V value);
}
