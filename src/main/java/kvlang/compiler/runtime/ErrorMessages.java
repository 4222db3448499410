package kvlang.compiler.runtime;

/**
 * 错误消息统一生成工具。
 *
 * <p>词法、语法与编译阶段的错误消息均提供中英文双语描述并附带恢复提示。
 * 英文部分保留稳定的关键字，方便测试与 IDE 工具按关键字匹配。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   *
   * @param message 主体消息
   * @param hintZh 中文提示
   * @param hintEn 英文提示
   * @return 包含提示信息的完整消息文本
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  public static String invalidIndentation(int line, int width, int indentSize) {
    String english = "invalid indentation at line " + line + ": " + width + " is not a multiple of " + indentSize;
    String message = bilingual("第 " + line + " 行缩进无效：" + width + " 不是 " + indentSize + " 的整数倍", english);
    return withHint(message, "整个文件使用统一的缩进宽度", "Use one indentation width for the whole file");
  }

  public static String unmatchedDedent(int line, int width) {
    String english = "invalid indentation at line " + line + ": dedent to " + width + " matches no enclosing level";
    String message = bilingual("第 " + line + " 行缩进无效：回退到 " + width + " 列，与任何外层级别都不匹配", english);
    return withHint(message, "回退缩进必须与某个外层块对齐", "Dedent must line up with an enclosing block");
  }

  public static String unterminatedString(int line) {
    String message = bilingual("第 " + line + " 行开始的字符串未闭合", "unterminated string starting at line " + line);
    return withHint(message, "检查引号是否成对出现", "Check that quotes are balanced");
  }

  /**
   * 构造“期望某个记号但遇到另一个记号”的错误消息。
   *
   * @param expected 期望的记号描述
   * @param actual 实际遇到的记号描述
   * @param line 1 起始的源码行号
   * @return 双语错误描述
   */
  public static String unexpectedToken(String expected, String actual, int line) {
    String english = "unexpected token at line " + line + ": expected " + expected + ", got " + actual;
    return bilingual("第 " + line + " 行出现意外记号：期望 " + expected + "，实际为 " + actual, english);
  }

  public static String syntaxError(String detailZh, String detailEn, int line) {
    return bilingual("第 " + line + " 行语法错误：" + detailZh, "syntax error at line " + line + ": " + detailEn);
  }

  public static String registryLoadFailed(String resource, String reason) {
    String message = bilingual("无法加载注册表资源 " + resource + "：" + reason,
        "failed to load registry resource " + resource + ": " + reason);
    return withHint(message, "确认资源文件位于 classpath 中且为合法 JSON",
        "Make sure the resource is on the classpath and is valid JSON");
  }
}
