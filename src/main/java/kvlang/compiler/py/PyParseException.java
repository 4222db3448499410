package kvlang.compiler.py;

/**
 * Python 表达式或语句无法解析。调用方通常捕获后降级为字符串字面量或 {@code pass}。
 */
public final class PyParseException extends Exception {
  private final int offset;

  public PyParseException(String message, int offset) {
    super(message);
    this.offset = offset;
  }

  /** 出错位置在输入文本中的字符偏移。 */
  public int getOffset() { return offset; }
}
