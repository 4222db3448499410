package kvlang.compiler.codegen;

import kvlang.compiler.runtime.KvConfig;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 代码生成选项。实例不可变，{@code with*} 方法返回新实例。
 */
public final class GeneratorOptions {

  /** 普通名字规则的补充基类表：规则名 → 基类列表。 */
  public final Map<String, List<String>> classBases;
  /** 既无声明基类、也不在补充表中时使用的基类。 */
  public final String defaultBase;
  public final int indentWidth;

  private GeneratorOptions(Map<String, List<String>> classBases, String defaultBase, int indentWidth) {
    this.classBases = Map.copyOf(classBases);
    this.defaultBase = defaultBase;
    this.indentWidth = indentWidth;
  }

  public static GeneratorOptions defaults() {
    return new GeneratorOptions(Map.of(), KvConfig.DEFAULT_BASE, KvConfig.INDENT_WIDTH);
  }

  public GeneratorOptions withClassBases(String className, List<String> bases) {
    Map<String, List<String>> copy = new HashMap<>(classBases);
    copy.put(className, List.copyOf(bases));
    return new GeneratorOptions(copy, defaultBase, indentWidth);
  }

  public GeneratorOptions withDefaultBase(String base) {
    return new GeneratorOptions(classBases, base, indentWidth);
  }

  public GeneratorOptions withIndentWidth(int width) {
    if (width <= 0) throw new IllegalArgumentException("indent width must be positive: " + width);
    return new GeneratorOptions(classBases, defaultBase, width);
  }
}
