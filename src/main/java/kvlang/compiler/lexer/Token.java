package kvlang.compiler.lexer;

import java.util.Locale;

/**
 * 带位置信息的词法记号，创建后不可变。
 *
 * <p>{@code text} 为源码中的原始词素（字符串保留前缀与引号），{@code value} 为解码后的载荷：
 * 标识符名、字符串内容、数字文本、指令整行或注释文本；结构记号的两者均为空串。</p>
 */
public final class Token {
  public final TokenKind kind;
  public final String text;
  public final String value;
  public final int line;
  public final int column;
  public final int length;

  public Token(TokenKind kind, String text, String value, int line, int column, int length) {
    this.kind = kind;
    this.text = text;
    this.value = value;
    this.line = line;
    this.column = column;
    this.length = length;
  }

  static Token structural(TokenKind kind, int line, int column) {
    return new Token(kind, "", "", line, column, 0);
  }

  public boolean is(TokenKind k) { return kind == k; }

  public boolean isIdentifier(String name) {
    return kind == TokenKind.IDENTIFIER && value.equals(name);
  }

  /** 下一个记号是否在同一行紧贴本记号之后（中间没有空白）。 */
  public boolean touches(Token next) {
    return next.line == line && next.column == column + length;
  }

  /** 供诊断消息使用的记号描述。 */
  public String describe() {
    return switch (kind) {
      case IDENTIFIER, NUMBER, OPERATOR -> kind.name().toLowerCase(Locale.ROOT) + " '" + text + "'";
      case STRING -> "string " + text;
      case DIRECTIVE -> "directive '" + text + "'";
      case COMMENT -> "comment";
      case CANVAS -> "'canvas'";
      case INDENT, DEDENT, NEWLINE, EOF -> kind.name();
      default -> "'" + text + "'";
    };
  }

  @Override
  public String toString() {
    return kind + (text.isEmpty() ? "" : "(" + text + ")") + "@" + line + ":" + column;
  }
}
