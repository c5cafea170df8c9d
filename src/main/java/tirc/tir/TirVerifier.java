package tirc.tir;

import java.util.Map;
import tirc.TircError;
import tirc.util.Identifier;

/**
 * Performs structural checks on a lowered program.
 *
 * <p>1. The {@code entry} block exists.
 *
 * <p>2. Every jump and branch target names an existing block.
 *
 * <p>3. Every variable an instruction or branch reads or writes is declared.
 */
public class TirVerifier {

  private final TirProgram program;

  private TirVerifier(TirProgram program) {
    this.program = program;
  }

  public static void verify(TirProgram program) {
    new TirVerifier(program).verify();
  }

  private void verify() {
    if (!program.entry().isPresent()) {
      throw new VerificationError("program has no " + Identifier.ENTRY + " block");
    }
    for (Map.Entry<Identifier, Block> e : program.blocks.entrySet()) {
      verifyBlock(e.getKey(), e.getValue());
    }
  }

  private void verifyBlock(Identifier label, Block block) {
    for (Instruction instruction : block.instructions) {
      instruction.uses().forEach(v -> checkDeclared(label, instruction, v));
      instruction.defs().forEach(v -> checkDeclared(label, instruction, v));
    }
    block.terminator.match(
        jump -> null,
        branch -> {
          checkDeclared(label, branch, branch.guard);
          return null;
        },
        exit -> null);
    for (Identifier successor : block.terminator.successors()) {
      if (!program.blocks.containsKey(successor)) {
        throw new VerificationError(
            String.format(
                "block %s: '%s' targets missing block %s", label, block.terminator, successor));
      }
    }
  }

  private void checkDeclared(Identifier label, Object where, Identifier variable) {
    if (!program.declared.contains(variable)) {
      throw new VerificationError(
          String.format("block %s: '%s' refers to undeclared %s", label, where, variable));
    }
  }

  public static class VerificationError extends TircError {
    VerificationError(String message) {
      super("TIR verification failed: " + message);
    }
  }
}
