package kvlang.compiler.ast;

import java.util.ArrayList;
import java.util.List;

/** 收集所有控件实例的类型名。 */
public final class WidgetNameCollector implements KvVisitor {
  private final List<String> widgetNames = new ArrayList<>();

  @Override
  public void visitWidget(KvModel.Widget widget) {
    widgetNames.add(widget.name);
    KvVisitor.super.visitWidget(widget);
  }

  public List<String> getWidgetNames() { return widgetNames; }
}
