package tirc.tir;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** A basic block: straight line instructions followed by exactly one terminator. */
public class Block {
  public final List<Instruction> instructions;
  public final Terminator terminator;

  public Block(List<Instruction> instructions, Terminator terminator) {
    this.instructions = ImmutableList.copyOf(instructions);
    this.terminator = checkNotNull(terminator);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Block block = (Block) o;
    return instructions.equals(block.instructions) && terminator.equals(block.terminator);
  }

  @Override
  public int hashCode() {
    return Objects.hash(instructions, terminator);
  }

  @Override
  public String toString() {
    return instructions + " " + terminator;
  }
}
