package kvlang.compiler.parser;

import kvlang.compiler.lexer.LexException;

/**
 * 容错解析收集的结构化诊断，行号 1 起始，列号 0 起始。
 */
public final class ParsingError {
  public final int line;
  public final int column;
  public final String message;
  public final ErrorKind kind;
  public final String suggestion;

  public ParsingError(int line, int column, String message, ErrorKind kind, String suggestion) {
    this.line = line;
    this.column = column;
    this.message = message;
    this.kind = kind;
    this.suggestion = suggestion;
  }

  public static ParsingError from(ParseException e) {
    return new ParsingError(e.getLine(), e.getColumn(), e.getMessage(), e.getCategory(), e.getSuggestion());
  }

  public static ParsingError from(LexException e) {
    return switch (e.getKind()) {
      case INVALID_INDENTATION -> new ParsingError(e.getLine(), e.getColumn(), e.getMessage(),
          ErrorKind.INVALID_INDENTATION, "Check indentation levels (use spaces, not tabs)");
      case UNTERMINATED_STRING -> new ParsingError(e.getLine(), e.getColumn(), e.getMessage(),
          ErrorKind.UNTERMINATED_STRING, "Add closing quote");
    };
  }

  @Override
  public String toString() {
    String base = "Line " + line + ":" + column + " [" + kind.label() + "] " + message;
    return suggestion == null ? base : base + " (" + suggestion + ")";
  }
}
