package kvlang.compiler.parser;

import kvlang.compiler.lexer.KvSyntaxException;

/**
 * 语法分析失败。严格模式下直接向调用方传播；容错模式下被转换为 {@link ParsingError}。
 */
public final class ParseException extends KvSyntaxException {
  public enum Kind { UNEXPECTED_TOKEN, SYNTAX_ERROR }

  private final Kind kind;
  private final ErrorKind category;
  private final String suggestion;

  public ParseException(Kind kind, ErrorKind category, String message, int line, int column, String suggestion) {
    super(message, line, column);
    this.kind = kind;
    this.category = category;
    this.suggestion = suggestion;
  }

  public Kind getKind() { return kind; }

  public ErrorKind getCategory() { return category; }

  /** 恢复建议，可能为 null。 */
  public String getSuggestion() { return suggestion; }
}
