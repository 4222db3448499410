package kvlang.compiler.ast;

import kvlang.compiler.ast.KvModel.CanvasInstruction;
import kvlang.compiler.ast.KvModel.Directive;
import kvlang.compiler.ast.KvModel.Module;
import kvlang.compiler.ast.KvModel.Property;
import kvlang.compiler.ast.KvModel.Rule;
import kvlang.compiler.ast.KvModel.Template;
import kvlang.compiler.ast.KvModel.Widget;

/**
 * 语法树统计：指令、规则、模板、控件、属性与画布指令的数量。
 *
 * <p>模板内部的规则同时计入规则数。</p>
 */
public final class AstStatistics implements KvVisitor {
  private int directiveCount;
  private int ruleCount;
  private int templateCount;
  private int widgetCount;
  private int propertyCount;
  private int canvasInstructionCount;

  public static AstStatistics of(Module module) {
    AstStatistics stats = new AstStatistics();
    stats.visitModule(module);
    return stats;
  }

  @Override
  public void visitDirective(Directive directive) {
    directiveCount++;
  }

  @Override
  public void visitRule(Rule rule) {
    ruleCount++;
    KvVisitor.super.visitRule(rule);
  }

  @Override
  public void visitTemplate(Template template) {
    templateCount++;
    KvVisitor.super.visitTemplate(template);
  }

  @Override
  public void visitWidget(Widget widget) {
    widgetCount++;
    KvVisitor.super.visitWidget(widget);
  }

  @Override
  public void visitProperty(Property property) {
    propertyCount++;
  }

  @Override
  public void visitCanvasInstruction(CanvasInstruction instruction) {
    canvasInstructionCount++;
    KvVisitor.super.visitCanvasInstruction(instruction);
  }

  public int getDirectiveCount() { return directiveCount; }
  public int getRuleCount() { return ruleCount; }
  public int getTemplateCount() { return templateCount; }
  public int getWidgetCount() { return widgetCount; }
  public int getPropertyCount() { return propertyCount; }
  public int getCanvasInstructionCount() { return canvasInstructionCount; }

  public String summary() {
    return "AST Statistics:\n"
        + "  Directives: " + directiveCount + "\n"
        + "  Rules: " + ruleCount + "\n"
        + "  Templates: " + templateCount + "\n"
        + "  Widgets: " + widgetCount + "\n"
        + "  Properties: " + propertyCount + "\n"
        + "  Canvas Instructions: " + canvasInstructionCount;
  }
}
