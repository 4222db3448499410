package kvlang.compiler.deps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个属性的依赖分析结果。EXEC 模式下 {@code watchedKeys} 恒为空。
 */
public final class CompiledPropertyValue {
  public final String value;
  public final CompilationMode mode;
  public final List<List<String>> watchedKeys;

  public CompiledPropertyValue(String value, CompilationMode mode, List<List<String>> watchedKeys) {
    this.value = value;
    this.mode = mode;
    List<List<String>> copy = new ArrayList<>(watchedKeys.size());
    for (List<String> key : watchedKeys) copy.add(List.copyOf(key));
    this.watchedKeys = Collections.unmodifiableList(copy);
  }

  public boolean isConstant() {
    return watchedKeys.isEmpty();
  }
}
