package kvlang.compiler.deps;

import kvlang.compiler.ast.KvModel;
import kvlang.compiler.ast.KvModel.Canvas;
import kvlang.compiler.ast.KvModel.CanvasInstruction;
import kvlang.compiler.ast.KvModel.CompiledValue;
import kvlang.compiler.ast.KvModel.Property;
import kvlang.compiler.ast.KvModel.Rule;
import kvlang.compiler.ast.KvModel.Template;
import kvlang.compiler.ast.KvModel.Widget;
import kvlang.compiler.py.PyLexer;
import kvlang.compiler.py.PyParser;
import kvlang.compiler.py.PyToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 依赖编译器
 * <p>
 * 从属性表达式中提取监听键（watched keys）：表达式读取的点分属性路径，例如 {@code self.parent.width}。
 * <p>
 * <b>提取规则</b>：
 * <ul>
 *   <li>{@code on_} 开头的属性是事件处理器，以 EXEC 模式编译，没有监听键</li>
 *   <li>表达式先经 Python 词法分析，字符串字面量与行尾注释是独立记号，因此其中形似路径的文本不会被提取</li>
 *   <li>取深度至少为 2 的最长点分链，{@code self.parent.width} 只产生一个键</li>
 *   <li>f-string 的每个 {@code {...}} 插值槽按同样规则重新扫描</li>
 *   <li>调用翻译函数 {@code _(...)} 时追加单元素键 {@code [_]}，语言切换也会触发重新求值</li>
 *   <li>结果去重并按点分形式排序</li>
 * </ul>
 * 编译器是无状态的纯函数，可在多线程间共享。
 */
public final class KvDependencyCompiler {

  private static final Logger LOGGER = Logger.getLogger(KvDependencyCompiler.class.getName());

  /** 翻译标记函数名。 */
  public static final String TRANSLATION_MARKER = "_";

  /**
   * 编译单个属性值。
   *
   * @param propertyName 属性名
   * @param rawValue 属性原始表达式文本
   * @return 编译模式与监听键
   */
  public CompiledPropertyValue compile(String propertyName, String rawValue) {
    if (propertyName.startsWith(Property.HANDLER_PREFIX)) {
      return new CompiledPropertyValue(rawValue, CompilationMode.EXEC, List.of());
    }
    return new CompiledPropertyValue(rawValue, CompilationMode.EVAL, extractWatchedKeys(rawValue));
  }

  /**
   * 提取表达式的监听键，结果按点分形式排序。
   */
  public List<List<String>> extractWatchedKeys(String expression) {
    Map<String, List<String>> keys = new TreeMap<>();
    List<PyToken> tokens = PyLexer.tokenizeLenient(expression);
    collectChains(tokens, keys);
    for (int i = 0; i < tokens.size(); i++) {
      PyToken t = tokens.get(i);
      if (t.kind == PyToken.Kind.COMMENT) break;
      if (t.isFString()) {
        for (String slot : PyParser.fStringSlots(t.rawBody())) {
          collectChains(PyLexer.tokenizeLenient(slot), keys);
        }
      } else if (t.isName(TRANSLATION_MARKER) && tokens.get(i + 1).isOp("(") && !precededByDot(tokens, i)) {
        keys.put(TRANSLATION_MARKER, List.of(TRANSLATION_MARKER));
      }
    }
    return new ArrayList<>(keys.values());
  }

  private static void collectChains(List<PyToken> tokens, Map<String, List<String>> keys) {
    for (int i = 0; i < tokens.size(); i++) {
      PyToken t = tokens.get(i);
      if (t.kind == PyToken.Kind.COMMENT) return;
      if (t.kind != PyToken.Kind.NAME || precededByDot(tokens, i)) continue;
      List<String> chain = new ArrayList<>();
      chain.add(t.text);
      int j = i + 1;
      while (j + 1 < tokens.size() && tokens.get(j).isOp(".") && tokens.get(j + 1).kind == PyToken.Kind.NAME) {
        chain.add(tokens.get(j + 1).text);
        j += 2;
      }
      if (chain.size() >= 2) {
        keys.putIfAbsent(String.join(".", chain), chain);
      }
    }
  }

  private static boolean precededByDot(List<PyToken> tokens, int index) {
    return index > 0 && tokens.get(index - 1).isOp(".");
  }

  // ==================== 模块编译 ====================

  /**
   * 为整棵语法树做依赖编译，返回新树；源模块保持不变。
   */
  public CompiledModule compileModule(KvModel.Module module) {
    int[] reactive = new int[1];
    List<Rule> rules = new ArrayList<>(module.rules.size());
    for (Rule r : module.rules) rules.add(compileRule(r, reactive));
    List<Template> templates = new ArrayList<>(module.templates.size());
    for (Template t : module.templates) {
      templates.add(new Template(t.name, t.baseClasses, compileRule(t.rule, reactive), t.line));
    }
    Widget root = module.root == null ? null : compileWidget(module.root, reactive);
    KvModel.Module compiled = new KvModel.Module(module.directives, rules, templates, root, module.dynamicClasses);
    LOGGER.log(Level.FINE, "compiled module: {0} reactive properties", reactive[0]);
    return new CompiledModule(compiled, module, reactive[0]);
  }

  private Rule compileRule(Rule r, int[] reactive) {
    return new Rule(r.selector, r.avoidPrevious, compileProperties(r.properties, reactive), compileProperties(r.handlers, reactive),
        compileCanvas(r.canvasBefore, reactive), compileCanvas(r.canvas, reactive), compileCanvas(r.canvasAfter, reactive),
        compileWidgets(r.children, reactive), r.line);
  }

  private Widget compileWidget(Widget w, int[] reactive) {
    return new Widget(w.name, w.id, compileProperties(w.properties, reactive), compileProperties(w.handlers, reactive),
        compileCanvas(w.canvasBefore, reactive), compileCanvas(w.canvas, reactive), compileCanvas(w.canvasAfter, reactive),
        compileWidgets(w.children, reactive), w.level, w.line);
  }

  private List<Widget> compileWidgets(List<Widget> widgets, int[] reactive) {
    List<Widget> out = new ArrayList<>(widgets.size());
    for (Widget w : widgets) out.add(compileWidget(w, reactive));
    return out;
  }

  private Canvas compileCanvas(Canvas canvas, int[] reactive) {
    if (canvas == null) return null;
    List<CanvasInstruction> instructions = new ArrayList<>(canvas.instructions.size());
    for (CanvasInstruction i : canvas.instructions) {
      instructions.add(new CanvasInstruction(i.instructionType, compileProperties(i.properties, reactive), i.line));
    }
    return new Canvas(canvas.layer, instructions, canvas.line);
  }

  private List<Property> compileProperties(List<Property> properties, int[] reactive) {
    List<Property> out = new ArrayList<>(properties.size());
    for (Property p : properties) {
      CompiledPropertyValue value = compile(p.name, p.rawValue);
      CompiledValue compiled;
      if (value.mode == CompilationMode.EXEC) {
        compiled = new KvModel.Code(p.rawValue);
      } else if (value.isConstant()) {
        compiled = new KvModel.Literal(p.rawValue);
      } else {
        compiled = new KvModel.Expression(p.rawValue);
        reactive[0]++;
      }
      out.add(p.withCompilation(compiled, value.watchedKeys));
    }
    return out;
  }
}
