package tirc.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import org.jetbrains.annotations.NotNull;

/**
 * An interned symbolic name. Variables, compiler generated temporaries and block labels are all
 * identifiers.
 *
 * <p>Instances are immutable and created through {@link #of(String)}, which guarantees that equal
 * text yields the same instance. Identifiers are ordered by their text.
 */
public final class Identifier implements Comparable<Identifier> {

  private static final Interner<Identifier> INTERNER = Interners.newWeakInterner();

  /** Label of the block every lowered program starts in. */
  public static final Identifier ENTRY = of("entry");

  private final String text;

  private Identifier(String text) {
    this.text = text;
  }

  public static Identifier of(String text) {
    checkNotNull(text);
    checkArgument(!text.isEmpty(), "identifiers must not be empty");
    return INTERNER.intern(new Identifier(text));
  }

  public String text() {
    return text;
  }

  @Override
  public int compareTo(@NotNull Identifier other) {
    return text.compareTo(other.text);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return text.equals(((Identifier) o).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
