package tirc.ast;

/** Binary integer operators. {@code LOWER} yields 1 if the left operand is smaller, else 0. */
public enum BinOp {
  ADD("+"),
  SUB("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  LOWER("<");

  public final String string;

  BinOp(String string) {
    this.string = string;
  }
}
