package tirc.util;

/** Objects of this type refer to a range of the original source code. */
public interface SourceCodeReferable {

  /** Returns the {@link SourceRange} this object was parsed from. */
  SourceRange range();
}
