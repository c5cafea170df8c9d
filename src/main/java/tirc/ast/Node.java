package tirc.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import tirc.util.SourceCodeReferable;
import tirc.util.SourceRange;

/** Base of the syntax tree classes. Every node remembers where in the source it was parsed from. */
abstract class Node implements SourceCodeReferable {

  private final SourceRange range;

  Node(SourceRange range) {
    this.range = checkNotNull(range);
  }

  @Override
  public SourceRange range() {
    return range;
  }
}
