package tirc.util;

import tirc.ast.Program;

public class GeneratedProgram {
  public final Program program;

  GeneratedProgram(Program program) {
    this.program = program;
  }

  @Override
  public String toString() {
    return new PrettyPrinter().visitProgram(program).toString();
  }
}
