package tirc.tir;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import tirc.util.Identifier;

/**
 * The result of lowering: every variable that was ever written or read, plus the control flow
 * graph as a mapping from block label to block. Immutable.
 */
public class TirProgram {

  /** User variables and compiler generated temporaries. */
  public final ImmutableSortedSet<Identifier> declared;

  public final ImmutableSortedMap<Identifier, Block> blocks;

  public TirProgram(Set<Identifier> declared, Map<Identifier, Block> blocks) {
    this.declared = ImmutableSortedSet.copyOf(declared);
    this.blocks = ImmutableSortedMap.copyOf(blocks);
  }

  /** The block labelled {@code entry}; empty only for a degenerate, unverified program. */
  public Optional<Block> entry() {
    return block(Identifier.ENTRY);
  }

  public Optional<Block> block(Identifier label) {
    return Optional.ofNullable(blocks.get(label));
  }

  public int instructionCount() {
    return blocks.values().stream().mapToInt(b -> b.instructions.size()).sum();
  }

  @Override
  public String toString() {
    return TirPrinter.print(this);
  }
}
