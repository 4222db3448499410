package kvlang.compiler.lexer;

/**
 * 词法与语法阶段异常的公共基类，携带 1 起始的行号与 0 起始的列号。
 */
public class KvSyntaxException extends Exception {
  private final int line;
  private final int column;

  public KvSyntaxException(String message, int line, int column) {
    super(message);
    this.line = line;
    this.column = column;
  }

  public int getLine() { return line; }

  public int getColumn() { return column; }
}
