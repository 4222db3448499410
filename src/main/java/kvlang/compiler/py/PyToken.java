package kvlang.compiler.py;

/**
 * Python 表达式词法记号。STRING 记号的 {@code value} 为解码后的内容，{@code prefix} 为小写前缀（可能为空串）。
 */
public final class PyToken {
  public enum Kind { NAME, NUMBER, STRING, OP, NEWLINE, COMMENT, EOF }

  public final Kind kind;
  public final String text;
  public final String value;
  public final String prefix;
  public final int offset;

  PyToken(Kind kind, String text, String value, String prefix, int offset) {
    this.kind = kind;
    this.text = text;
    this.value = value;
    this.prefix = prefix;
    this.offset = offset;
  }

  public boolean isOp(String op) {
    return kind == Kind.OP && text.equals(op);
  }

  public boolean isName(String name) {
    return kind == Kind.NAME && text.equals(name);
  }

  public boolean isFString() {
    return kind == Kind.STRING && prefix.indexOf('f') >= 0;
  }

  /** 字符串字面量去掉前缀与引号后的原始正文（未解码）。 */
  public String rawBody() {
    String quoted = text.substring(prefix.length());
    int q = quoted.startsWith("'''") || quoted.startsWith("\"\"\"") ? 3 : 1;
    int end = quoted.length() >= 2 * q ? quoted.length() - q : quoted.length();
    return quoted.substring(Math.min(q, end), end);
  }

  @Override
  public String toString() {
    return kind + "(" + text + ")";
  }
}
