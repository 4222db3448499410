package kvlang.compiler.ast;

import java.util.ArrayList;
import java.util.List;

/** 按遍历顺序收集所有属性名（含事件处理器与画布指令属性）。 */
public final class PropertyNameCollector implements KvVisitor {
  private final List<String> propertyNames = new ArrayList<>();

  @Override
  public void visitProperty(KvModel.Property property) {
    propertyNames.add(property.name);
  }

  public List<String> getPropertyNames() { return propertyNames; }
}
