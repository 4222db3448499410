package kvlang.compiler.ast;

import kvlang.compiler.ast.KvModel.Body;
import kvlang.compiler.ast.KvModel.Canvas;
import kvlang.compiler.ast.KvModel.CanvasInstruction;
import kvlang.compiler.ast.KvModel.Directive;
import kvlang.compiler.ast.KvModel.Module;
import kvlang.compiler.ast.KvModel.Property;
import kvlang.compiler.ast.KvModel.Rule;
import kvlang.compiler.ast.KvModel.Selector;
import kvlang.compiler.ast.KvModel.Template;
import kvlang.compiler.ast.KvModel.Widget;

/**
 * KV 语法树访问者。
 *
 * <p>所有方法都有默认实现，按固定的前序顺序遍历：模块内依次为指令、规则、模板、根控件；
 * 规则与控件内依次为属性、事件处理器、canvas.before、canvas、canvas.after、子控件。
 * 子类只需覆盖关心的节点；覆盖后如需继续向下遍历，调用对应的 {@code KvVisitor.super} 方法即可。</p>
 */
public interface KvVisitor {

  default void visitModule(Module module) {
    for (Directive d : module.directives) visitDirective(d);
    for (Rule r : module.rules) visitRule(r);
    for (Template t : module.templates) visitTemplate(t);
    if (module.root != null) visitWidget(module.root);
  }

  default void visitDirective(Directive directive) {}

  default void visitRule(Rule rule) {
    visitSelector(rule.selector);
    visitBody(rule);
  }

  default void visitSelector(Selector selector) {}

  default void visitTemplate(Template template) {
    visitRule(template.rule);
  }

  default void visitWidget(Widget widget) {
    visitBody(widget);
  }

  /** 规则与控件共用的主体遍历。 */
  default void visitBody(Body body) {
    for (Property p : body.properties()) visitProperty(p);
    for (Property h : body.handlers()) visitProperty(h);
    for (Canvas c : body.canvasLayers()) visitCanvas(c);
    for (Widget child : body.children()) visitWidget(child);
  }

  default void visitProperty(Property property) {}

  default void visitCanvas(Canvas canvas) {
    for (CanvasInstruction i : canvas.instructions) visitCanvasInstruction(i);
  }

  default void visitCanvasInstruction(CanvasInstruction instruction) {
    for (Property p : instruction.properties) visitProperty(p);
  }
}
