package kvlang.compiler.codegen;

import kvlang.compiler.ast.KvModel;
import kvlang.compiler.ast.KvModel.Canvas;
import kvlang.compiler.ast.KvModel.CanvasInstruction;
import kvlang.compiler.ast.KvModel.Property;
import kvlang.compiler.ast.KvModel.Rule;
import kvlang.compiler.ast.KvModel.Template;
import kvlang.compiler.ast.KvModel.Widget;
import kvlang.compiler.codegen.GenerationContext.ClassSpec;
import kvlang.compiler.deps.CompiledModule;
import kvlang.compiler.deps.KvDependencyCompiler;
import kvlang.compiler.py.PyModel;
import kvlang.compiler.py.PyModel.Assign;
import kvlang.compiler.py.PyModel.Attribute;
import kvlang.compiler.py.PyModel.Call;
import kvlang.compiler.py.PyModel.ClassDef;
import kvlang.compiler.py.PyModel.Constant;
import kvlang.compiler.py.PyModel.DictExpr;
import kvlang.compiler.py.PyModel.Expr;
import kvlang.compiler.py.PyModel.ExprStmt;
import kvlang.compiler.py.PyModel.For;
import kvlang.compiler.py.PyModel.FunctionDef;
import kvlang.compiler.py.PyModel.ImportFrom;
import kvlang.compiler.py.PyModel.Keyword;
import kvlang.compiler.py.PyModel.Lambda;
import kvlang.compiler.py.PyModel.ListExpr;
import kvlang.compiler.py.PyModel.Name;
import kvlang.compiler.py.PyModel.Param;
import kvlang.compiler.py.PyModel.Pass;
import kvlang.compiler.py.PyModel.Stmt;
import kvlang.compiler.py.PyModel.Str;
import kvlang.compiler.py.PyModel.Subscript;
import kvlang.compiler.py.PyModel.Try;
import kvlang.compiler.py.PyModel.Tuple;
import kvlang.compiler.py.PyNames;
import kvlang.compiler.py.PyParseException;
import kvlang.compiler.py.PyParser;
import kvlang.compiler.py.PySourceWriter;
import kvlang.compiler.py.PyTransforms;
import kvlang.compiler.registry.CanvasInstructionRegistry;
import kvlang.compiler.registry.JsonCanvasInstructionRegistry;
import kvlang.compiler.registry.JsonWidgetRegistry;
import kvlang.compiler.registry.ParameterKind;
import kvlang.compiler.registry.PropertyKind;
import kvlang.compiler.registry.WidgetRegistry;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Python 类生成器
 * <p>
 * 把依赖编译后的 KV 模块翻译为 Python 源码：每个普通名字规则、动态类规则和模板生成一个类。
 * <p>
 * <b>类体结构</b>：
 * <ul>
 *   <li>基类中不存在的属性提升为 {@code ObjectProperty(None)} 类字段</li>
 *   <li>{@code __init__} 依次处理静态属性、响应式属性、事件处理器、子控件与画布</li>
 *   <li>每个监听键生成一个回调，登记到 {@code self._bindings}，由 {@code __del__} 统一解绑</li>
 * </ul>
 * <b>降级策略</b>：无法解析的表达式退化为字符串字面量，无法解析的处理器语句退化为 {@code pass}，
 * 单个类生成失败时记录警告并跳过，整个生成过程不会中止。
 * <p>
 * 生成器本身无状态，可重复使用；每次生成的命名计数器保存在独立的 {@link GenerationContext} 中。
 */
public final class PythonClassGenerator {

  private static final Logger LOGGER = Logger.getLogger(PythonClassGenerator.class.getName());

  private static final String BINDINGS = "_bindings";
  private static final Name SELF = new Name("self");
  private static final Set<String> RESERVED_LOCALS = Set.of("self", "app", "args", "kwargs", "instance", "value");
  /** 在规则表达式中有固定含义、不能作为 id 引用的名字。 */
  private static final Set<String> SCOPE_NAMES = Set.of("self", "root", "ids", "app");
  /** 生成器合成的局部名字形如 {@code label_3}、{@code _cb_4}。 */
  private static final Pattern SYNTHETIC_LOCAL = Pattern.compile(".*_[0-9]+");

  private final WidgetRegistry widgets;
  private final CanvasInstructionRegistry instructions;
  private final GeneratorOptions options;
  private final KvDependencyCompiler dependencyCompiler = new KvDependencyCompiler();

  public PythonClassGenerator() {
    this(GeneratorOptions.defaults());
  }

  public PythonClassGenerator(GeneratorOptions options) {
    this(JsonWidgetRegistry.loadDefault(), JsonCanvasInstructionRegistry.loadDefault(), options);
  }

  public PythonClassGenerator(WidgetRegistry widgets, CanvasInstructionRegistry instructions, GeneratorOptions options) {
    this.widgets = Objects.requireNonNull(widgets, "widgets");
    this.instructions = Objects.requireNonNull(instructions, "instructions");
    this.options = Objects.requireNonNull(options, "options");
  }

  /** 先做依赖编译再生成。 */
  public String generate(KvModel.Module module) {
    return generate(dependencyCompiler.compileModule(module));
  }

  public String generate(CompiledModule compiled) {
    return new PySourceWriter(options.indentWidth).write(generateModule(compiled));
  }

  /**
   * 生成 Python 模块语法树：导入、{@code #:set} 常量、类定义。
   */
  public PyModel.Module generateModule(CompiledModule compiled) {
    KvModel.Module module = compiled.module;
    GenerationContext ctx = new GenerationContext(widgets, instructions);
    for (KvModel.Directive d : module.directives) {
      if (d instanceof KvModel.Set set) ctx.defineModuleName(set.name);
      else if (d instanceof KvModel.Import im) ctx.defineModuleName(im.alias);
    }
    collectClasses(module, ctx);

    List<Stmt> classes = new ArrayList<>();
    for (ClassSpec spec : orderedClasses(ctx)) {
      try {
        classes.add(generateClass(spec, ctx));
      } catch (RuntimeException e) {
        LOGGER.log(Level.WARNING, "skipping class " + spec.name + " at line " + spec.rule.line + ": " + e.getMessage(), e);
      }
    }
    if (module.root != null) {
      LOGGER.log(Level.FINE, "root widget {0} emits no class", module.root.name);
    }

    List<Stmt> body = new ArrayList<>(imports(module, ctx));
    body.addAll(constants(module, ctx));
    body.addAll(classes);
    LOGGER.log(Level.FINE, "generated {0} classes", classes.size());
    return new PyModel.Module(body);
  }

  // ==================== 类收集 ====================

  private void collectClasses(KvModel.Module module, GenerationContext ctx) {
    for (Rule rule : module.rules) {
      KvModel.Selector selector = rule.selector;
      if (selector instanceof KvModel.DynamicClass d) {
        declare(ctx, d.name, d.bases, rule);
      } else if (selector instanceof KvModel.Name n) {
        List<String> supplied = options.classBases.get(n.name);
        if (supplied != null) {
          declare(ctx, n.name, supplied, rule);
        } else if (widgets.widgetExists(n.name)) {
          LOGGER.log(Level.FINE, "rule <{0}> styles a known widget, no class emitted", n.name);
        } else {
          declare(ctx, n.name, List.of(), rule);
        }
      } else {
        LOGGER.log(Level.FINE, "selector <{0}> emits no class", selector.primaryName());
      }
    }
    for (Template t : module.templates) {
      declare(ctx, t.name, t.baseClasses, t.rule);
    }
  }

  private void declare(GenerationContext ctx, String name, List<String> bases, Rule rule) {
    if (ctx.isLocal(name)) {
      LOGGER.log(Level.FINE, "class {0} declared again at line {1}, later rule wins", new Object[]{name, rule.line});
    }
    ctx.declare(new ClassSpec(name, bases.isEmpty() ? List.of(options.defaultBase) : bases, rule));
  }

  /** 本地基类排在子类之前，其余保持规则顺序。 */
  private static List<ClassSpec> orderedClasses(GenerationContext ctx) {
    List<ClassSpec> ordered = new ArrayList<>();
    Set<String> placed = new HashSet<>();
    for (ClassSpec spec : ctx.localClasses()) {
      place(spec, ctx, ordered, placed, new HashSet<>());
    }
    return ordered;
  }

  private static void place(ClassSpec spec, GenerationContext ctx, List<ClassSpec> ordered, Set<String> placed, Set<String> visiting) {
    if (placed.contains(spec.name) || !visiting.add(spec.name)) return;
    for (String base : spec.bases) {
      ClassSpec local = ctx.localClass(base);
      if (local != null) place(local, ctx, ordered, placed, visiting);
    }
    ordered.add(spec);
    placed.add(spec.name);
  }

  // ==================== 类生成 ====================

  private ClassDef generateClass(ClassSpec spec, GenerationContext ctx) {
    for (String base : spec.bases) ctx.useWidget(base);
    Rule rule = spec.rule;
    List<Stmt> classBody = new ArrayList<>();

    Set<String> promoted = new LinkedHashSet<>();
    for (Property p : rule.properties) {
      if (!ctx.isInheritedProperty(p.name, spec.bases)) promoted.add(p.name);
    }
    for (String name : promoted) {
      classBody.add(new Assign(new Name(name), PyModel.call(new Name("ObjectProperty"), new Constant("None"))));
      ctx.useObjectProperty();
    }

    Set<String> ids = new LinkedHashSet<>();
    collectIds(rule.children, ids, ctx);
    Scope scope = Scope.rule(ids);
    Wiring wiring = new Wiring(takenNames(rule, ids, ctx));
    for (Property p : rule.properties) {
      if (!isReactive(p)) {
        emitStatic(p, SELF, sequenceKind(ctx, p.name, spec.name), scope, null, wiring, ctx);
      }
    }
    emitReactive(rule.properties, SELF, scope, false, wiring, ctx);
    emitHandlers(rule.handlers, scope, wiring, ctx);
    for (Widget child : rule.children) emitChild(child, SELF, ids, wiring, ctx);
    emitCanvas(rule, scope, wiring, ctx);

    List<Stmt> init = new ArrayList<>();
    init.add(new ExprStmt(new Call(new Attribute(PyModel.call(new Name("super")), "__init__"),
        List.of(), List.of(new Keyword(null, new Name("kwargs"))))));
    init.add(new Assign(new Attribute(SELF, BINDINGS), new ListExpr(List.of())));
    List<Stmt> body = wiring.all();
    if (referencesApp(body)) {
      init.add(new Assign(new Name("app"), runningApp()));
      ctx.useApp();
    }
    init.addAll(body);

    classBody.add(new FunctionDef("__init__", List.of(Param.of("self"), new Param("**", "kwargs", null)), init));
    classBody.addAll(wiring.methods);
    classBody.add(teardown());
    LOGGER.log(Level.FINE, "class {0}({1}): {2} handlers",
        new Object[]{spec.name, String.join(", ", spec.bases), wiring.methods.size()});
    return new ClassDef(spec.name, spec.bases, classBody);
  }

  /**
   * 子控件：构造（静态属性作为关键字参数）、响应式属性、处理器、id 登记、孙控件、画布，最后挂到父控件。
   */
  private void emitChild(Widget widget, Expr parent, Set<String> ids, Wiring wiring, GenerationContext ctx) {
    ctx.useWidget(widget.name);
    String var = variableName(widget, wiring, ctx);
    Name target = new Name(var);
    Scope scope = Scope.child(var, ids);

    List<Keyword> kwargs = new ArrayList<>();
    for (Property p : widget.properties) {
      if (!isReactive(p)) {
        emitStatic(p, target, sequenceKind(ctx, p.name, widget.name), scope, kwargs, wiring, ctx);
      }
    }
    wiring.statements.add(new Assign(target, new Call(new Name(widget.name), List.of(), kwargs)));
    emitReactive(widget.properties, target, scope, false, wiring, ctx);
    emitHandlers(widget.handlers, scope, wiring, ctx);
    if (widget.id != null) {
      wiring.statements.add(new Assign(new Subscript(selfIds(), new Str(widget.id)), target));
    }
    for (Widget child : widget.children) emitChild(child, target, ids, wiring, ctx);
    emitCanvas(widget, scope, wiring, ctx);
    wiring.statements.add(new ExprStmt(PyModel.call(new Attribute(parent, "add_widget"), target)));
  }

  /**
   * 子控件的局部变量名：id 可用时取 id，否则为 {@code <小写类型>_<n>}。
   * 关键字、内置名、模块级名字、控件类型名、规则读取的名字与合成名字形式都不能用作 id 变量。
   */
  private static String variableName(Widget widget, Wiring wiring, GenerationContext ctx) {
    String id = widget.id;
    if (PyNames.isIdentifier(id) && !wiring.taken.contains(id) && !SYNTHETIC_LOCAL.matcher(id).matches()) {
      wiring.taken.add(id);
      return id;
    }
    return widget.name.toLowerCase(Locale.ROOT) + "_" + ctx.next();
  }

  /** 规则子树中可作为裸名字引用的 id。与内置名或模块级名字同名时，裸名字仍指向后者。 */
  private static void collectIds(List<Widget> children, Set<String> ids, GenerationContext ctx) {
    for (Widget w : children) {
      if (PyNames.isIdentifier(w.id) && !PyNames.isKeyword(w.id) && !PyNames.isBuiltin(w.id)
          && !SCOPE_NAMES.contains(w.id) && !ctx.moduleNames().contains(w.id)) {
        ids.add(w.id);
      }
      collectIds(w.children, ids, ctx);
    }
  }

  private static Set<String> takenNames(Rule rule, Set<String> ids, GenerationContext ctx) {
    Set<String> taken = new HashSet<>(RESERVED_LOCALS);
    taken.addAll(PyNames.KEYWORDS);
    taken.addAll(PyNames.BUILTINS);
    taken.addAll(ctx.moduleNames());
    taken.add("App");
    taken.add("ObjectProperty");
    Set<String> reads = new HashSet<>();
    collectReads(rule, reads, taken);
    // 引用 id 的地方改写为 self.ids.<id>，不读取局部变量
    reads.removeAll(ids);
    taken.addAll(reads);
    return taken;
  }

  private static void collectReads(KvModel.Body body, Set<String> reads, Set<String> types) {
    readsOf(body.properties(), reads);
    for (Canvas canvas : body.canvasLayers()) {
      for (CanvasInstruction instruction : canvas.instructions) {
        types.add(instruction.instructionType);
        readsOf(instruction.properties, reads);
      }
    }
    for (Widget child : body.children()) {
      types.add(child.name);
      collectReads(child, reads, types);
    }
  }

  private static void readsOf(List<Property> properties, Set<String> reads) {
    for (Property p : properties) {
      try {
        reads.addAll(PyTransforms.freeNames(PyParser.parseExpression(p.rawValue.strip())));
      } catch (PyParseException e) {
        LOGGER.log(Level.FINEST, "value of {0} reads no names: {1}", new Object[]{p.name, e.getMessage()});
      }
    }
  }

  // ==================== 属性 ====================

  /**
   * 静态属性：子控件的放入构造关键字参数，规则的直接赋值；引用 id 的推迟到子控件全部登记之后。
   */
  private void emitStatic(Property p, Expr target, boolean sequenceTarget, Scope scope, List<Keyword> kwargs,
                          Wiring wiring, GenerationContext ctx) {
    Expr raw = LiteralConverter.convert(p.rawValue, sequenceTarget, scope.knownNames(ctx));
    Expr value = PyTransforms.renameNames(raw, scope.names);
    if (scope.readsIds(PyTransforms.freeNames(raw))) {
      wiring.deferred.add(assign(target, p.name, value));
    } else if (kwargs != null) {
      kwargs.add(new Keyword(p.name, value));
    } else {
      wiring.statements.add(assign(target, p.name, value));
    }
  }

  private Expr staticValue(Property p, boolean sequenceTarget, Scope scope, GenerationContext ctx) {
    return PyTransforms.renameNames(LiteralConverter.convert(p.rawValue, sequenceTarget, scope.knownNames(ctx)), scope.names);
  }

  private static boolean sequenceKind(GenerationContext ctx, String property, String type) {
    return ctx.propertyKind(property, type).map(PropertyKind::isSequence).orElse(false);
  }

  private boolean isReactive(Property p) {
    return !keysOf(p).isEmpty();
  }

  private List<List<String>> keysOf(Property p) {
    return p.watchedKeys != null ? p.watchedKeys : dependencyCompiler.compile(p.name, p.rawValue).watchedKeys;
  }

  /**
   * 响应式属性：先赋初值，再为每个监听键生成一个回调。
   * 引用 {@code ids} 的属性推迟到所有子控件创建之后再连接。
   */
  private void emitReactive(List<Property> properties, Expr target, Scope scope, boolean canvas,
                            Wiring wiring, GenerationContext ctx) {
    for (Property p : properties) {
      List<List<String>> keys = keysOf(p);
      if (keys.isEmpty()) continue;
      List<Stmt> out = referencesIds(keys, scope) ? wiring.deferred : wiring.statements;
      Expr parsed;
      try {
        parsed = PyParser.parseExpression(p.rawValue.strip());
      } catch (PyParseException e) {
        LOGGER.log(Level.FINE, "expression of {0} kept as string literal: {1}", new Object[]{p.name, e.getMessage()});
        out.add(assign(target, p.name, new Str(p.rawValue.strip())));
        continue;
      }
      out.add(assign(target, p.name, PyTransforms.renameNames(parsed, scope.names)));

      // canvas 指令不是事件分发器，没有 setter()
      boolean direct = !canvas && keys.size() == 1 && keys.get(0).equals(PyTransforms.chainOf(parsed));
      for (List<String> key : keys) {
        if (key.size() < 2) continue; // 翻译键只影响初值
        if (!PyTransforms.occursFree(parsed, key)) {
          // 链首由推导式或 lambda 绑定，__init__ 中不存在该对象
          LOGGER.log(Level.FINE, "key {0} of {1} is bound inside the expression, no listener", new Object[]{key, p.name});
          continue;
        }
        Expr source = PyTransforms.renameNames(PyModel.chain(key.subList(0, key.size() - 1)), scope.names);
        String attr = key.get(key.size() - 1);
        Expr callback;
        if (direct) {
          callback = PyModel.call(new Attribute(target, "setter"), new Str(p.name));
        } else {
          Map<String, Expr> names = scope.names;
          if (canvas && key.size() == 2 && key.get(0).equals("self")) {
            names = new HashMap<>(scope.names);
            names.put("self", new Name("instance"));
          }
          Expr value = PyTransforms.renameNames(PyTransforms.substituteChain(parsed, key, new Name("value")), names);
          callback = new Lambda(List.of(Param.of("instance"), Param.of("value")),
              PyModel.call(new Name("setattr"), target, new Str(p.name), value));
        }
        Name local = new Name("_cb_" + ctx.next());
        out.add(new Assign(local, callback));
        out.add(new ExprStmt(new Call(new Attribute(source, "bind"), List.of(), List.of(new Keyword(attr, local)))));
        out.add(new ExprStmt(PyModel.call(new Attribute(new Attribute(SELF, BINDINGS), "append"),
            new Tuple(List.of(source, new Str(attr), local)))));
      }
    }
  }

  private static boolean referencesIds(List<List<String>> keys, Scope scope) {
    for (List<String> key : keys) {
      if (scope.ids.contains(key.get(0)) || key.get(0).equals("ids") || (key.size() > 2 && key.get(1).equals("ids"))) {
        return true;
      }
    }
    return false;
  }

  // ==================== 事件处理器 ====================

  private void emitHandlers(List<Property> handlers, Scope scope, Wiring wiring, GenerationContext ctx) {
    for (Property h : handlers) {
      String method = "_" + h.name + "_" + ctx.next();
      List<Stmt> body = new ArrayList<>();
      for (String piece : PyParser.splitStatements(h.rawValue)) {
        try {
          Stmt s = PyParser.parseStatement(piece);
          if (PyTransforms.collectNames(s).contains("app")) ctx.useApp();
          body.add(PyTransforms.mapExpressions(s, e -> PyTransforms.renameNames(e, scope.handlerNames)));
        } catch (PyParseException e) {
          LOGGER.log(Level.FINE, "handler statement of {0} replaced by pass: {1}", new Object[]{h.name, piece});
          body.add(Pass.INSTANCE);
        }
      }
      if (body.isEmpty()) body.add(Pass.INSTANCE);
      wiring.methods.add(new FunctionDef(method, List.of(Param.of("self"), new Param("*", "args", null)), body));
      wiring.statements.add(new ExprStmt(new Call(new Attribute(scope.target, "bind"), List.of(),
          List.of(new Keyword(h.name, new Attribute(SELF, method))))));
    }
  }

  // ==================== 画布 ====================

  private void emitCanvas(KvModel.Body body, Scope scope, Wiring wiring, GenerationContext ctx) {
    for (Canvas canvas : body.canvasLayers()) {
      Expr layer = scope.target;
      for (String part : canvas.layer.attribute.split("\\.")) layer = new Attribute(layer, part);
      for (CanvasInstruction instruction : canvas.instructions) {
        String type = instruction.instructionType;
        ctx.useInstruction(type);
        List<Keyword> kwargs = new ArrayList<>();
        boolean reactive = false;
        for (Property p : instruction.properties) {
          if (isReactive(p)) {
            reactive = true;
          } else {
            boolean list = instructions.getParameterType(p.name, type).map(k -> k == ParameterKind.LIST).orElse(false);
            kwargs.add(new Keyword(p.name, staticValue(p, list, scope, ctx)));
          }
        }
        Call construct = new Call(new Name(type), List.of(), kwargs);
        if (!reactive) {
          wiring.statements.add(new ExprStmt(PyModel.call(new Attribute(layer, "add"), construct)));
          continue;
        }
        Attribute field = new Attribute(SELF, "_canvas_" + type.toLowerCase(Locale.ROOT) + "_" + ctx.next());
        wiring.statements.add(new Assign(field, construct));
        wiring.statements.add(new ExprStmt(PyModel.call(new Attribute(layer, "add"), field)));
        emitReactive(instruction.properties, field, scope, true, wiring, ctx);
      }
    }
  }

  // ==================== 模块级语句 ====================

  private List<Stmt> imports(KvModel.Module module, GenerationContext ctx) {
    List<Stmt> out = new ArrayList<>();
    Map<String, Set<String>> widgetModules = new TreeMap<>();
    for (String type : ctx.usedWidgets()) {
      String path = widgets.getModulePath(type).orElse("kivy.uix." + type.toLowerCase(Locale.ROOT));
      widgetModules.computeIfAbsent(path, k -> new TreeSet<>()).add(type);
    }
    widgetModules.forEach((path, names) -> out.add(new ImportFrom(path, List.copyOf(names))));
    if (ctx.usesApp()) out.add(new ImportFrom("kivy.app", List.of("App")));
    if (ctx.usesObjectProperty()) out.add(new ImportFrom("kivy.properties", List.of("ObjectProperty")));

    Map<String, Set<String>> graphicsModules = new TreeMap<>();
    for (String type : ctx.usedInstructions()) {
      String path = instructions.getModulePath(type).orElse(JsonCanvasInstructionRegistry.DEFAULT_MODULE);
      graphicsModules.computeIfAbsent(path, k -> new TreeSet<>()).add(type);
    }
    graphicsModules.forEach((path, names) -> out.add(new ImportFrom(path, List.copyOf(names))));

    for (KvModel.Directive d : module.directives) {
      if (d instanceof KvModel.Import im) {
        out.add(directiveImport(im));
      } else if (d instanceof KvModel.Include inc) {
        LOGGER.log(Level.FINE, "include {0} is resolved by the Kivy runtime", inc.path);
      }
    }
    return out;
  }

  /** {@code #:import Window kivy.core.window.Window} 生成 from 导入，其余生成普通 import。 */
  private static Stmt directiveImport(KvModel.Import im) {
    int dot = im.module.lastIndexOf('.');
    String last = im.module.substring(dot + 1);
    if (dot > 0 && !last.isEmpty() && Character.isUpperCase(last.charAt(0))) {
      String name = last.equals(im.alias) ? last : last + " as " + im.alias;
      return new ImportFrom(im.module.substring(0, dot), List.of(name));
    }
    return new PyModel.Import(im.module, im.alias);
  }

  private static List<Stmt> constants(KvModel.Module module, GenerationContext ctx) {
    List<Stmt> out = new ArrayList<>();
    for (KvModel.Directive d : module.directives) {
      if (d instanceof KvModel.Set set) {
        out.add(new Assign(new Name(set.name), LiteralConverter.convert(set.value, false, ctx.moduleNames())));
      }
    }
    return out;
  }

  // ==================== 辅助 ====================

  /** {@code __del__}：逐条解绑，目标对象可能已被回收，解绑失败直接忽略。 */
  private static FunctionDef teardown() {
    Expr unbind = new Call(new Attribute(new Name("obj"), "unbind"), List.of(),
        List.of(new Keyword(null, new DictExpr(List.of(new Name("prop")), List.of(new Name("callback"))))));
    Stmt guarded = new Try(List.of(new ExprStmt(unbind)), new Name("Exception"), List.of(Pass.INSTANCE));
    Stmt loop = new For(new Tuple(List.of(new Name("obj"), new Name("prop"), new Name("callback"))),
        new Attribute(SELF, BINDINGS), List.of(guarded));
    return new FunctionDef("__del__", List.of(Param.of("self")), List.of(loop));
  }

  private static Stmt assign(Expr target, String attr, Expr value) {
    return new Assign(new Attribute(target, attr), value);
  }

  private static Expr selfIds() {
    return new Attribute(SELF, "ids");
  }

  private static Expr runningApp() {
    return PyModel.call(new Attribute(new Name("App"), "get_running_app"));
  }

  private static boolean referencesApp(List<Stmt> statements) {
    for (Stmt s : statements) {
      if (PyTransforms.collectNames(s).contains("app")) return true;
    }
    return false;
  }

  /** 名字重写作用域。裸 id 名字在两种上下文中都改写为 {@code self.ids.<id>}。 */
  private static final class Scope {
    final Expr target;
    final Set<String> ids;
    final Map<String, Expr> names = new HashMap<>();
    final Map<String, Expr> handlerNames = new HashMap<>();

    private Scope(Expr target, Set<String> ids) {
      this.target = target;
      this.ids = ids;
      for (String id : ids) {
        names.put(id, new Attribute(selfIds(), id));
        handlerNames.put(id, new Attribute(selfIds(), id));
      }
      names.put("root", SELF);
      names.put("ids", selfIds());
      handlerNames.put("root", SELF);
      handlerNames.put("ids", selfIds());
      handlerNames.put("app", runningApp());
    }

    /** 规则作用域：{@code root} 即 {@code self}。 */
    static Scope rule(Set<String> ids) {
      return new Scope(SELF, ids);
    }

    /** 子控件作用域：{@code self} 指向子控件，处理器中指向事件源 {@code args[0]}。 */
    static Scope child(String var, Set<String> ids) {
      Scope scope = new Scope(new Name(var), ids);
      scope.names.put("self", new Name(var));
      scope.handlerNames.put("self", new Subscript(new Name("args"), new Constant("0")));
      return scope;
    }

    /** 静态值中可以解析的名字。 */
    Set<String> knownNames(GenerationContext ctx) {
      Set<String> known = new HashSet<>(ctx.moduleNames());
      known.addAll(names.keySet());
      known.add("self");
      known.add("app");
      return known;
    }

    boolean readsIds(Set<String> freeNames) {
      if (freeNames.contains("ids")) return true;
      for (String name : freeNames) if (ids.contains(name)) return true;
      return false;
    }
  }

  /** {@code __init__} 的语句缓冲：依赖 ids 的连接放在最后。 */
  private static final class Wiring {
    final Set<String> taken;
    final List<Stmt> statements = new ArrayList<>();
    final List<Stmt> deferred = new ArrayList<>();
    final List<Stmt> methods = new ArrayList<>();

    Wiring(Set<String> taken) {
      this.taken = taken;
    }

    List<Stmt> all() {
      List<Stmt> all = new ArrayList<>(statements);
      all.addAll(deferred);
      return all;
    }
  }
}
