package kvlang.compiler.parser;

/** 容错解析诊断的分类，供 IDE 等工具按类别展示。 */
public enum ErrorKind {
  UNEXPECTED_TOKEN("Unexpected Token"),
  MISSING_TOKEN("Missing Token"),
  INVALID_INDENTATION("Invalid Indentation"),
  UNTERMINATED_STRING("Unterminated String"),
  INVALID_SELECTOR("Invalid Selector"),
  INVALID_PROPERTY("Invalid Property"),
  INVALID_DIRECTIVE("Invalid Directive"),
  DUPLICATE_RULE("Duplicate Rule"),
  UNKNOWN("Unknown Error");

  private final String label;

  ErrorKind(String label) { this.label = label; }

  public String label() { return label; }
}
