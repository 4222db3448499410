package kvlang.compiler.ast;

import kvlang.compiler.ast.KvModel.Canvas;
import kvlang.compiler.ast.KvModel.CanvasInstruction;
import kvlang.compiler.ast.KvModel.Directive;
import kvlang.compiler.ast.KvModel.Property;
import kvlang.compiler.ast.KvModel.Rule;
import kvlang.compiler.ast.KvModel.Template;
import kvlang.compiler.ast.KvModel.Widget;

/**
 * 把语法树重新输出为 KV 源码。
 *
 * <p>输出再次解析后得到结构相同的模块：指令、规则、模板与根控件的数量一致，
 * 每个规则的属性数量与画布指令数量一致。文本不保证与原始源码逐字节相同。</p>
 */
public final class KvSourceWriter {

  private final String indentUnit;

  public KvSourceWriter() {
    this(4);
  }

  public KvSourceWriter(int indentWidth) {
    this.indentUnit = " ".repeat(indentWidth);
  }

  public String write(KvModel.Module module) {
    StringBuilder out = new StringBuilder();
    for (Directive d : module.directives) {
      out.append(directive(d)).append('\n');
    }
    boolean first = module.directives.isEmpty();
    for (Rule rule : module.rules) {
      if (!first) out.append('\n');
      first = false;
      out.append('<').append(rule.avoidPrevious ? "-" : "").append(rule.selector.primaryName()).append(">:\n");
      writeBody(out, rule, 1);
    }
    for (Template t : module.templates) {
      if (!first) out.append('\n');
      first = false;
      out.append('[').append(t.name).append('@').append(String.join("+", t.baseClasses)).append("]:\n");
      writeBody(out, t.rule, 1);
    }
    if (module.root != null) {
      if (!first) out.append('\n');
      writeWidget(out, module.root, 0);
    }
    return out.toString();
  }

  private static String directive(Directive d) {
    if (d instanceof KvModel.Kivy k) return "#:kivy " + k.version;
    if (d instanceof KvModel.Import im) return "#:import " + im.alias + " " + im.module;
    if (d instanceof KvModel.Set s) return "#:set " + s.name + " " + s.value;
    KvModel.Include inc = (KvModel.Include) d;
    return "#:include " + (inc.force ? "force " : "") + inc.path;
  }

  private void writeWidget(StringBuilder out, Widget widget, int level) {
    out.append(indentUnit.repeat(level)).append(widget.name).append(":\n");
    if (widget.id != null) {
      out.append(indentUnit.repeat(level + 1)).append("id: ").append(widget.id).append('\n');
    }
    writeBody(out, widget, level + 1);
  }

  private void writeBody(StringBuilder out, KvModel.Body body, int level) {
    for (Property p : body.properties()) writeProperty(out, p, level);
    for (Property h : body.handlers()) writeProperty(out, h, level);
    for (Canvas canvas : body.canvasLayers()) {
      out.append(indentUnit.repeat(level)).append(canvas.layer.attribute).append(":\n");
      for (CanvasInstruction i : canvas.instructions) {
        out.append(indentUnit.repeat(level + 1)).append(i.instructionType).append(":\n");
        for (Property p : i.properties) writeProperty(out, p, level + 2);
      }
    }
    for (Widget child : body.children()) writeWidget(out, child, level);
  }

  /** 多行值的后续行比属性名多缩进一级，行内的相对缩进保持不变。 */
  private void writeProperty(StringBuilder out, Property p, int level) {
    String pad = indentUnit.repeat(level);
    String[] lines = p.rawValue.split("\n", -1);
    out.append(pad).append(p.name).append(':');
    if (!lines[0].isEmpty()) out.append(' ').append(lines[0]);
    out.append('\n');
    for (int i = 1; i < lines.length; i++) {
      if (lines[i].isBlank()) continue;
      out.append(pad).append(indentUnit).append(lines[i]).append('\n');
    }
  }
}
