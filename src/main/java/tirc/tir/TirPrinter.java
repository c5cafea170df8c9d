package tirc.tir;

import static org.jooq.lambda.Seq.seq;

import tirc.util.Identifier;

/**
 * Renders a {@link TirProgram} as text. The entry block comes first, all other blocks follow in
 * label order:
 *
 * <pre>
 * declared: _const_1, _t_2, x, y
 * entry:
 *     _const_1 = 3
 *     _t_2 = y + _const_1
 *     x = _t_2
 *     exit
 * </pre>
 */
public class TirPrinter {

  static final Instruction.Visitor<String> INSTRUCTION_FORMATTER = new InstructionFormatter();

  private final StringBuilder builder;

  private TirPrinter(StringBuilder builder) {
    this.builder = builder;
  }

  public static String print(TirProgram program) {
    StringBuilder builder = new StringBuilder();
    new TirPrinter(builder).formatProgram(program);
    return builder.toString();
  }

  public static String format(Instruction instruction) {
    return instruction.accept(INSTRUCTION_FORMATTER);
  }

  public static String format(Terminator terminator) {
    return terminator.toString();
  }

  private void formatProgram(TirProgram program) {
    builder.append("declared:");
    if (!program.declared.isEmpty()) {
      builder.append(" ");
      builder.append(seq(program.declared).toString(", "));
    }
    appendLine();
    program.entry().ifPresent(entry -> formatBlock(Identifier.ENTRY, entry));
    seq(program.blocks.entrySet())
        .filter(e -> !e.getKey().equals(Identifier.ENTRY))
        .forEach(e -> formatBlock(e.getKey(), e.getValue()));
  }

  private void formatBlock(Identifier label, Block block) {
    builder.append(label);
    builder.append(":");
    appendLine();
    for (Instruction instruction : block.instructions) {
      indent();
      builder.append(format(instruction));
      appendLine();
    }
    indent();
    builder.append(format(block.terminator));
    appendLine();
  }

  private void appendLine() {
    builder.append(System.lineSeparator());
  }

  private void indent() {
    builder.append("    ");
  }

  /** Formats a single instruction. Holds no state, so one instance is shared. */
  private static class InstructionFormatter implements Instruction.Visitor<String> {

    @Override
    public String visit(Instruction.Copy copy) {
      return copy.dst + " = " + copy.src;
    }

    @Override
    public String visit(Instruction.Print print) {
      return "print " + print.value;
    }

    @Override
    public String visit(Instruction.Read read) {
      return "read " + read.dst;
    }

    @Override
    public String visit(Instruction.Const constant) {
      return constant.dst + " = " + constant.literal;
    }

    @Override
    public String visit(Instruction.Arith arith) {
      return arith.dst + " = " + arith.lhs + " " + arith.op.string + " " + arith.rhs;
    }
  }
}
