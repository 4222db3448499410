package kvlang.compiler.ast;

import com.fasterxml.jackson.annotation.*;
import java.util.*;

/**
 * KV 抽象语法树。
 *
 * <p>所有节点在构造后不可变：列表字段经 {@code List.copyOf} 复制，编译阶段通过 {@code with*} 方法产生新节点，
 * 而不是原地修改。模块独占整棵树，节点之间没有反向引用。</p>
 */
public final class KvModel {
  private KvModel() {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class Module {
    public final java.util.List<Directive> directives;
    public final java.util.List<Rule> rules;
    public final java.util.List<Template> templates;
    public final Widget root;
    public final Map<String, java.util.List<String>> dynamicClasses;

    public Module(java.util.List<Directive> directives, java.util.List<Rule> rules, java.util.List<Template> templates,
                  Widget root, Map<String, java.util.List<String>> dynamicClasses) {
      this.directives = java.util.List.copyOf(directives);
      this.rules = java.util.List.copyOf(rules);
      this.templates = java.util.List.copyOf(templates);
      this.root = root;
      this.dynamicClasses = Collections.unmodifiableMap(new LinkedHashMap<>(dynamicClasses));
    }

    public static Module empty() {
      return new Module(java.util.List.of(), java.util.List.of(), java.util.List.of(), null, Map.of());
    }
  }

  // ==================== 指令 ====================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Kivy.class, name = "Kivy"),
    @JsonSubTypes.Type(value = Import.class, name = "Import"),
    @JsonSubTypes.Type(value = Set.class, name = "Set"),
    @JsonSubTypes.Type(value = Include.class, name = "Include")
  })
  public sealed interface Directive permits Kivy, Import, Set, Include {
    int line();
  }

  @JsonTypeName("Kivy")
  public static final class Kivy implements Directive {
    public final String version; public final int line;
    public Kivy(String version, int line) { this.version = version; this.line = line; }
    @Override public int line() { return line; }
  }
  @JsonTypeName("Import")
  public static final class Import implements Directive {
    public final String alias; public final String module; public final int line;
    public Import(String alias, String module, int line) { this.alias = alias; this.module = module; this.line = line; }
    @Override public int line() { return line; }
  }
  @JsonTypeName("Set")
  public static final class Set implements Directive {
    public final String name; public final String value; public final int line;
    public Set(String name, String value, int line) { this.name = name; this.value = value; this.line = line; }
    @Override public int line() { return line; }
  }
  @JsonTypeName("Include")
  public static final class Include implements Directive {
    public final String path; public final boolean force; public final int line;
    public Include(String path, boolean force, int line) { this.path = path; this.force = force; this.line = line; }
    @Override public int line() { return line; }
  }

  // ==================== 选择器 ====================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Name.class, name = "Name"),
    @JsonSubTypes.Type(value = ClassName.class, name = "ClassName"),
    @JsonSubTypes.Type(value = Multiple.class, name = "Multiple"),
    @JsonSubTypes.Type(value = DynamicClass.class, name = "DynamicClass")
  })
  public sealed interface Selector permits Name, ClassName, Multiple, DynamicClass {
    /** 诊断与代码生成使用的规范名称，例如 {@code Button}、{@code .cls}、{@code A,B}、{@code New@A+B}。 */
    String primaryName();
  }

  @JsonTypeName("Name")
  public static final class Name implements Selector {
    public final String name;
    public Name(String name) { this.name = name; }
    @Override public String primaryName() { return name; }
    @Override public boolean equals(Object o) { return o instanceof Name n && n.name.equals(name); }
    @Override public int hashCode() { return name.hashCode(); }
    @Override public String toString() { return "Name(" + name + ")"; }
  }
  @JsonTypeName("ClassName")
  public static final class ClassName implements Selector {
    public final String name;
    public ClassName(String name) { this.name = name; }
    @Override public String primaryName() { return "." + name; }
    @Override public boolean equals(Object o) { return o instanceof ClassName n && n.name.equals(name); }
    @Override public int hashCode() { return 31 + name.hashCode(); }
    @Override public String toString() { return "ClassName(" + name + ")"; }
  }
  @JsonTypeName("Multiple")
  public static final class Multiple implements Selector {
    public final java.util.List<Selector> selectors;
    public Multiple(java.util.List<Selector> selectors) { this.selectors = java.util.List.copyOf(selectors); }
    @Override public String primaryName() {
      StringJoiner joiner = new StringJoiner(",");
      for (Selector s : selectors) joiner.add(s.primaryName());
      return joiner.toString();
    }
    @Override public boolean equals(Object o) { return o instanceof Multiple m && m.selectors.equals(selectors); }
    @Override public int hashCode() { return selectors.hashCode(); }
    @Override public String toString() { return "Multiple(" + selectors + ")"; }
  }
  @JsonTypeName("DynamicClass")
  public static final class DynamicClass implements Selector {
    public final String name; public final java.util.List<String> bases;
    public DynamicClass(String name, java.util.List<String> bases) { this.name = name; this.bases = java.util.List.copyOf(bases); }
    @Override public String primaryName() { return name + "@" + String.join("+", bases); }
    @Override public boolean equals(Object o) { return o instanceof DynamicClass d && d.name.equals(name) && d.bases.equals(bases); }
    @Override public int hashCode() { return Objects.hash(name, bases); }
    @Override public String toString() { return "DynamicClass(" + primaryName() + ")"; }
  }

  // ==================== 规则与控件 ====================

  /**
   * 规则与控件实例共有的主体：属性、事件处理器、三层画布与子控件。
   */
  public interface Body {
    java.util.List<Property> properties();
    java.util.List<Property> handlers();
    Canvas canvasBefore();
    Canvas canvas();
    Canvas canvasAfter();
    java.util.List<Widget> children();
    int line();

    /** 按 before、默认、after 顺序返回非空画布层。 */
    default java.util.List<Canvas> canvasLayers() {
      java.util.List<Canvas> layers = new ArrayList<>(3);
      if (canvasBefore() != null) layers.add(canvasBefore());
      if (canvas() != null) layers.add(canvas());
      if (canvasAfter() != null) layers.add(canvasAfter());
      return layers;
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class Rule implements Body {
    public final Selector selector;
    public final boolean avoidPrevious;
    public final java.util.List<Property> properties;
    public final java.util.List<Property> handlers;
    public final Canvas canvasBefore;
    public final Canvas canvas;
    public final Canvas canvasAfter;
    public final java.util.List<Widget> children;
    public final int line;

    public Rule(Selector selector, boolean avoidPrevious, java.util.List<Property> properties, java.util.List<Property> handlers,
                Canvas canvasBefore, Canvas canvas, Canvas canvasAfter, java.util.List<Widget> children, int line) {
      this.selector = selector;
      this.avoidPrevious = avoidPrevious;
      this.properties = java.util.List.copyOf(properties);
      this.handlers = java.util.List.copyOf(handlers);
      this.canvasBefore = canvasBefore;
      this.canvas = canvas;
      this.canvasAfter = canvasAfter;
      this.children = java.util.List.copyOf(children);
      this.line = line;
    }

    @Override public java.util.List<Property> properties() { return properties; }
    @Override public java.util.List<Property> handlers() { return handlers; }
    @Override public Canvas canvasBefore() { return canvasBefore; }
    @Override public Canvas canvas() { return canvas; }
    @Override public Canvas canvasAfter() { return canvasAfter; }
    @Override public java.util.List<Widget> children() { return children; }
    @Override public int line() { return line; }
  }

  /** 已弃用但仍受支持的 {@code [Name@Base]:} 模板，结构上等同于带名字和基类的规则。 */
  public static final class Template {
    public final String name;
    public final java.util.List<String> baseClasses;
    public final Rule rule;
    public final int line;

    public Template(String name, java.util.List<String> baseClasses, Rule rule, int line) {
      this.name = name;
      this.baseClasses = java.util.List.copyOf(baseClasses);
      this.rule = rule;
      this.line = line;
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class Widget implements Body {
    public final String name;
    public final String id;
    public final java.util.List<Property> properties;
    public final java.util.List<Property> handlers;
    public final Canvas canvasBefore;
    public final Canvas canvas;
    public final Canvas canvasAfter;
    public final java.util.List<Widget> children;
    public final int level;
    public final int line;

    public Widget(String name, String id, java.util.List<Property> properties, java.util.List<Property> handlers,
                  Canvas canvasBefore, Canvas canvas, Canvas canvasAfter, java.util.List<Widget> children,
                  int level, int line) {
      this.name = name;
      this.id = id;
      this.properties = java.util.List.copyOf(properties);
      this.handlers = java.util.List.copyOf(handlers);
      this.canvasBefore = canvasBefore;
      this.canvas = canvas;
      this.canvasAfter = canvasAfter;
      this.children = java.util.List.copyOf(children);
      this.level = level;
      this.line = line;
    }

    @Override public java.util.List<Property> properties() { return properties; }
    @Override public java.util.List<Property> handlers() { return handlers; }
    @Override public Canvas canvasBefore() { return canvasBefore; }
    @Override public Canvas canvas() { return canvas; }
    @Override public Canvas canvasAfter() { return canvasAfter; }
    @Override public java.util.List<Widget> children() { return children; }
    @Override public int line() { return line; }
  }

  // ==================== 属性与画布 ====================

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class Property {
    public static final String HANDLER_PREFIX = "on_";

    public final String name;
    public final String rawValue;
    public final CompiledValue compiled;
    public final java.util.List<java.util.List<String>> watchedKeys; // 未编译时为 null
    public final boolean ignorePrevious;
    public final int line;

    public Property(String name, String rawValue, CompiledValue compiled,
                    java.util.List<java.util.List<String>> watchedKeys, boolean ignorePrevious, int line) {
      this.name = name;
      this.rawValue = rawValue;
      this.compiled = compiled;
      this.watchedKeys = watchedKeys == null ? null : copyKeys(watchedKeys);
      this.ignorePrevious = ignorePrevious;
      this.line = line;
    }

    /** 解析器直接产出的属性：尚未做依赖分析。 */
    public static Property parsed(String name, String rawValue, int line) {
      CompiledValue preliminary = name.startsWith(HANDLER_PREFIX)
          ? new Code(rawValue) : new Expression(rawValue);
      return new Property(name, rawValue, preliminary, null, false, line);
    }

    public Property withCompilation(CompiledValue value, java.util.List<java.util.List<String>> keys) {
      return new Property(name, rawValue, value, keys, ignorePrevious, line);
    }

    @JsonIgnore
    public boolean isEventHandler() { return name.startsWith(HANDLER_PREFIX); }

    /** 没有任何监听键的属性按常量赋值处理。 */
    @JsonIgnore
    public boolean isConstant() { return watchedKeys == null || watchedKeys.isEmpty(); }

    private static java.util.List<java.util.List<String>> copyKeys(java.util.List<java.util.List<String>> keys) {
      java.util.List<java.util.List<String>> copy = new ArrayList<>(keys.size());
      for (java.util.List<String> key : keys) copy.add(java.util.List.copyOf(key));
      return Collections.unmodifiableList(copy);
    }
  }

  public enum CanvasLayer {
    BEFORE("canvas.before"), MAIN("canvas"), AFTER("canvas.after");

    public final String attribute;
    CanvasLayer(String attribute) { this.attribute = attribute; }
  }

  public static final class Canvas {
    public final CanvasLayer layer;
    public final java.util.List<CanvasInstruction> instructions;
    public final int line;

    public Canvas(CanvasLayer layer, java.util.List<CanvasInstruction> instructions, int line) {
      this.layer = layer;
      this.instructions = java.util.List.copyOf(instructions);
      this.line = line;
    }
  }

  public static final class CanvasInstruction {
    public final String instructionType;
    public final java.util.List<Property> properties;
    public final int line;

    public CanvasInstruction(String instructionType, java.util.List<Property> properties, int line) {
      this.instructionType = instructionType;
      this.properties = java.util.List.copyOf(properties);
      this.line = line;
    }
  }

  // ==================== 编译值 ====================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
    @JsonSubTypes.Type(value = Expression.class, name = "Expression"),
    @JsonSubTypes.Type(value = Code.class, name = "Code")
  })
  public sealed interface CompiledValue permits Literal, Expression, Code {
    String source();
  }

  /** 可预先求值的常量。 */
  @JsonTypeName("Literal")
  public static final class Literal implements CompiledValue {
    public final String source;
    public Literal(String source) { this.source = source; }
    @Override public String source() { return source; }
  }
  /** 响应式表达式（eval 模式）。 */
  @JsonTypeName("Expression")
  public static final class Expression implements CompiledValue {
    public final String source;
    public Expression(String source) { this.source = source; }
    @Override public String source() { return source; }
  }
  /** 可执行语句块（exec 模式，事件处理器）。 */
  @JsonTypeName("Code")
  public static final class Code implements CompiledValue {
    public final String source;
    public Code(String source) { this.source = source; }
    @Override public String source() { return source; }
  }
}
