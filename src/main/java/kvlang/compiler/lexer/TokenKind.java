package kvlang.compiler.lexer;

/**
 * KV 词法记号种类。
 *
 * <p>结构记号（INDENT/DEDENT/NEWLINE）由缩进栈合成，其余记号与源码字符一一对应。
 * OPERATOR 承载其余所有标点（{@code * / = % { } ! ; & | ^ ~} 等），保证属性表达式在重建时不丢字符。</p>
 */
public enum TokenKind {
  // 结构
  INDENT,
  DEDENT,
  NEWLINE,

  // 分隔符
  COLON,
  COMMA,
  LANGLE,
  RANGLE,
  LBRACKET,
  RBRACKET,
  LPAREN,
  RPAREN,
  DOT,
  MINUS,
  AT,
  PLUS,

  // 字面量
  IDENTIFIER,
  STRING,
  NUMBER,

  CANVAS,
  DIRECTIVE,
  COMMENT,
  OPERATOR,
  EOF;

  /** 由单个标点字符构成、在表达式中可与相邻标点拼成复合运算符的记号。 */
  public boolean isGlyph() {
    return switch (this) {
      case OPERATOR, LANGLE, RANGLE, MINUS, PLUS, AT -> true;
      default -> false;
    };
  }

  public boolean isStructural() {
    return this == INDENT || this == DEDENT || this == NEWLINE || this == EOF;
  }
}
