package kvlang.compiler.parser;

/** 解析模式。 */
public enum ParserMode {
  /** 遇到第一个错误即抛出。 */
  STRICT,
  /** 记录错误并同步到下一个顶层结构后继续解析。 */
  TOLERANT;

  /**
   * 解析配置字符串（大小写不敏感），无法识别时回退到 STRICT。
   */
  public static ParserMode fromString(String value) {
    if (value != null && value.trim().equalsIgnoreCase("tolerant")) {
      return TOLERANT;
    }
    return STRICT;
  }
}
