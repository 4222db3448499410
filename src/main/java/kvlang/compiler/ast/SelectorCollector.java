package kvlang.compiler.ast;

import java.util.ArrayList;
import java.util.List;

/** 收集所有规则选择器的规范名称。 */
public final class SelectorCollector implements KvVisitor {
  private final List<String> selectors = new ArrayList<>();

  @Override
  public void visitSelector(KvModel.Selector selector) {
    selectors.add(selector.primaryName());
  }

  public List<String> getSelectors() { return selectors; }
}
