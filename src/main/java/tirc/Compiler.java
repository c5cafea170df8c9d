package tirc;

import java.io.InputStream;
import java.util.Iterator;
import tirc.ast.Program;
import tirc.lexer.Lexer;
import tirc.lower.Lowering;
import tirc.lower.TranslationVector;
import tirc.parser.Parser;
import tirc.tir.TirPrinter;
import tirc.tir.TirProgram;
import tirc.tir.TirVerifier;
import tirc.token.Token;
import tirc.util.PrettyPrinter;

public class Compiler {

  public static Lexer lex(InputStream in) {
    return new Lexer(in);
  }

  public static Program parse(Iterator<Token> tokens) {
    return new Parser(tokens).parse();
  }

  public static Program lexAndParse(InputStream in) {
    return parse(lex(in));
  }

  public static TranslationVector translate(Program ast) {
    return Lowering.translate(ast);
  }

  public static TirProgram lower(Program ast) {
    return Lowering.lower(ast);
  }

  public static void verify(TirProgram program) {
    TirVerifier.verify(program);
  }

  public static CharSequence prettyPrint(Program ast) {
    return ast.acceptVisitor(new PrettyPrinter());
  }

  public static String print(TirProgram program) {
    return TirPrinter.print(program);
  }
}
