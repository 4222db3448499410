package kvlang.compiler.runtime;

/**
 * KV 编译器运行配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次，避免在编译过程中反复调用 System.getenv。
 */
public final class KvConfig {
  private KvConfig() {}

  /**
   * 调试模式开关
   * 环境变量：KV_DEBUG
   * 启用时 {@code KvCompiler.parse} 以 INFO 级别输出一行语法树统计与错误数；
   * 各阶段的 FINE 日志由 JUL 配置单独控制
   */
  public static final boolean DEBUG = System.getenv("KV_DEBUG") != null;

  /**
   * 默认解析模式
   * 环境变量：KV_PARSE_MODE（strict | tolerant）
   * 如果未指定，默认为 "strict"
   */
  public static final String PARSE_MODE = getEnvOrDefault("KV_PARSE_MODE", "strict");

  /**
   * 生成类时缺省使用的基类
   * 环境变量：KV_DEFAULT_BASE
   */
  public static final String DEFAULT_BASE = getEnvOrDefault("KV_DEFAULT_BASE", "Widget");

  /**
   * 生成 Python 源码时每级缩进的空格数
   * 环境变量：KV_INDENT_WIDTH
   */
  public static final int INDENT_WIDTH = parseIntOrDefault(getEnvOrDefault("KV_INDENT_WIDTH", "4"), 4);

  /**
   * 辅助方法：读取环境变量或返回默认值
   */
  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }

  private static int parseIntOrDefault(String value, int defaultValue) {
    try {
      int parsed = Integer.parseInt(value.trim());
      return parsed > 0 ? parsed : defaultValue;
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }
}
