package tirc.util;

import static java.lang.String.format;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import tirc.ast.BinOp;
import tirc.ast.Expression.*;
import tirc.ast.Program;
import tirc.ast.Statement;
import tirc.ast.Statement.*;
import tirc.lexer.Lexer;
import tirc.parser.Parser;

public class PrettyPrinterTest {

  private static final SourceRange r = SourceRange.FIRST_CHAR;
  private PrettyPrinter prettyPrinter;

  @Before
  public void setup() {
    prettyPrinter = new PrettyPrinter();
  }

  private static Identifier id(String name) {
    return Identifier.of(name);
  }

  @Test
  public void visitEmptyProgram_printsNothing() throws Exception {
    Program p = new Program(ImmutableList.of(), r);
    assertThat(p.acceptVisitor(prettyPrinter).toString(), is(equalTo("")));
  }

  @Test
  public void visitAssignOfBinaryOperator_prefixNotation() throws Exception {
    Statement node =
        new Assign(
            id("x"),
            new BinaryOperator(
                BinOp.ADD, new Variable(id("y"), r), new IntegerLiteral(3, r), r),
            r);
    assertThat(node.acceptVisitor(prettyPrinter).toString(), is(equalTo(":= x + y 3")));
  }

  @Test
  public void visitNestedOperators_operandsFollowTheirOperator() throws Exception {
    Statement node =
        new Print(
            new BinaryOperator(
                BinOp.LOWER,
                new Negate(new Variable(id("a"), r), r),
                new BinaryOperator(
                    BinOp.DIVIDE, new IntegerLiteral(10, r), new Variable(id("b"), r), r),
                r),
            r);
    assertThat(node.acceptVisitor(prettyPrinter).toString(), is(equalTo("$print < ~ a / 10 b")));
  }

  @Test
  public void visitRead() throws Exception {
    Statement node = new Read(id("n"), r);
    assertThat(node.acceptVisitor(prettyPrinter).toString(), is(equalTo("$read n")));
  }

  @Test
  public void visitIfWithEmptyBranches_bracesOnOneLine() throws Exception {
    Statement node = new If(new Variable(id("c"), r), ImmutableList.of(), ImmutableList.of(), r);
    assertThat(node.acceptVisitor(prettyPrinter).toString(), is(equalTo("$if c { } { }")));
  }

  @Test
  public void visitProgramWithNestedIf_bodiesAreIndentedWithTabs() throws Exception {
    Program p =
        new Program(
            ImmutableList.of(
                new If(
                    new Variable(id("c"), r),
                    ImmutableList.of(
                        new If(
                            new IntegerLiteral(1, r),
                            ImmutableList.of(new Print(new Variable(id("c"), r), r)),
                            ImmutableList.of(),
                            r)),
                    ImmutableList.of(new Read(id("c"), r)),
                    r),
                new Print(new IntegerLiteral(0, r), r)),
            r);
    String expected =
        format(
            "$if c {%n"
                + "\t$if 1 {%n"
                + "\t\t$print c%n"
                + "\t} { }%n"
                + "} {%n"
                + "\t$read c%n"
                + "}%n"
                + "$print 0%n");
    assertThat(p.acceptVisitor(prettyPrinter).toString(), is(equalTo(expected)));
  }

  @Test
  public void prettyPrintParsedSource_reproducesCanonicalSource() throws Exception {
    String source = "# comment\n:=   x ~ 5\n$if <x 0 {$print x} {}\n";
    Program p = new Parser(new Lexer(source)).parse();
    assertThat(
        p.acceptVisitor(prettyPrinter).toString(),
        is(equalTo(format(":= x ~ 5%n$if < x 0 {%n\t$print x%n} { }%n"))));
  }
}
