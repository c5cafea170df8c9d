package tirc.tir;

import static java.lang.String.format;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import tirc.ast.BinOp;
import tirc.util.Identifier;

public class TirPrinterTest {

  private static Identifier id(String name) {
    return Identifier.of(name);
  }

  @Test
  public void formatInstructions() {
    assertThat(TirPrinter.format(new Instruction.Copy(id("x"), id("y"))), is("x = y"));
    assertThat(TirPrinter.format(new Instruction.Print(id("x"))), is("print x"));
    assertThat(TirPrinter.format(new Instruction.Read(id("x"))), is("read x"));
    assertThat(TirPrinter.format(new Instruction.Const(id("c"), -4)), is("c = -4"));
    assertThat(
        TirPrinter.format(new Instruction.Arith(BinOp.LOWER, id("t"), id("a"), id("b"))),
        is("t = a < b"));
  }

  @Test
  public void instructionToString_matchesFormat() {
    Instruction arith = new Instruction.Arith(BinOp.ADD, id("t"), id("a"), id("b"));
    assertThat(arith.toString(), is("t = a + b"));
    Instruction print = new Instruction.Print(id("x"));
    assertThat(print.toString(), is(TirPrinter.format(print)));
  }

  @Test
  public void formatTerminators() {
    assertThat(TirPrinter.format(new Terminator.Jump(id("lbl3"))), is("jump lbl3"));
    assertThat(
        TirPrinter.format(new Terminator.Branch(id("x"), id("lbl1"), id("lbl2"))),
        is("branch x lbl1 lbl2"));
    assertThat(TirPrinter.format(Terminator.Exit.INSTANCE), is("exit"));
  }

  @Test
  public void printProgram_entryFirstThenLabelOrder() {
    Block entry =
        new Block(
            ImmutableList.of(new Instruction.Read(id("x"))),
            new Terminator.Branch(id("x"), id("b"), id("a")));
    Block a = new Block(ImmutableList.of(), new Terminator.Jump(id("c")));
    Block b =
        new Block(ImmutableList.of(new Instruction.Print(id("x"))), new Terminator.Jump(id("c")));
    Block c = new Block(ImmutableList.of(), Terminator.Exit.INSTANCE);
    TirProgram program =
        new TirProgram(
            ImmutableSet.of(id("x")),
            ImmutableMap.of(id("c"), c, id("b"), b, Identifier.ENTRY, entry, id("a"), a));

    String expected =
        format(
            "declared: x%n"
                + "entry:%n"
                + "    read x%n"
                + "    branch x b a%n"
                + "a:%n"
                + "    jump c%n"
                + "b:%n"
                + "    print x%n"
                + "    jump c%n"
                + "c:%n"
                + "    exit%n");
    assertThat(TirPrinter.print(program), is(equalTo(expected)));
    assertThat(program.toString(), is(equalTo(expected)));
  }

  @Test
  public void printProgramWithoutDeclarations() {
    TirProgram program =
        new TirProgram(
            ImmutableSet.of(),
            ImmutableMap.of(
                Identifier.ENTRY, new Block(ImmutableList.of(), Terminator.Exit.INSTANCE)));
    assertThat(TirPrinter.print(program), is(equalTo(format("declared:%nentry:%n    exit%n"))));
  }
}
