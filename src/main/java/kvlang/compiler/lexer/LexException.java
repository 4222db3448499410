package kvlang.compiler.lexer;

/**
 * 词法分析失败。一经抛出即终止整个文件的词法分析。
 */
public final class LexException extends KvSyntaxException {
  public enum Kind { INVALID_INDENTATION, UNTERMINATED_STRING }

  private final Kind kind;

  public LexException(Kind kind, String message, int line, int column) {
    super(message, line, column);
    this.kind = kind;
  }

  public Kind getKind() { return kind; }
}
