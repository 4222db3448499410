package kvlang.compiler.codegen;

import kvlang.compiler.ast.KvModel;
import kvlang.compiler.registry.CanvasInstructionRegistry;
import kvlang.compiler.registry.PropertyKind;
import kvlang.compiler.registry.WidgetRegistry;

import java.util.*;

/**
 * 一次生成过程的可变状态：命名计数器、本地类表与导入需求。
 * <p>
 * 每次 {@link PythonClassGenerator#generateModule} 调用创建一个新实例，并按引用传入递归生成过程，
 * 保证同一输出模块内的合成名字唯一且多次生成结果一致。
 */
final class GenerationContext {

  /** 本次生成的一个类。 */
  static final class ClassSpec {
    final String name;
    final List<String> bases;
    final KvModel.Rule rule;

    ClassSpec(String name, List<String> bases, KvModel.Rule rule) {
      this.name = name;
      this.bases = List.copyOf(bases);
      this.rule = rule;
    }
  }

  final WidgetRegistry widgets;
  final CanvasInstructionRegistry instructions;

  private int counter;
  private final Map<String, ClassSpec> localClasses = new LinkedHashMap<>();
  private final Set<String> usedWidgets = new TreeSet<>();
  private final Set<String> usedInstructions = new TreeSet<>();
  private final Set<String> moduleNames = new LinkedHashSet<>();
  private boolean usesApp;
  private boolean usesObjectProperty;

  GenerationContext(WidgetRegistry widgets, CanvasInstructionRegistry instructions) {
    this.widgets = widgets;
    this.instructions = instructions;
  }

  int next() {
    return ++counter;
  }

  void declare(ClassSpec spec) {
    localClasses.put(spec.name, spec);
  }

  ClassSpec localClass(String className) {
    return localClasses.get(className);
  }

  boolean isLocal(String className) {
    return localClasses.containsKey(className);
  }

  Collection<ClassSpec> localClasses() {
    return localClasses.values();
  }

  void useWidget(String type) {
    if (!isLocal(type)) usedWidgets.add(type);
  }

  void useInstruction(String type) {
    usedInstructions.add(type);
  }

  /** {@code #:set} 常量与 {@code #:import} 别名，生成代码中可直接引用的模块级名字。 */
  void defineModuleName(String name) {
    moduleNames.add(name);
  }

  Set<String> moduleNames() { return moduleNames; }

  void useApp() {
    usesApp = true;
  }

  void useObjectProperty() {
    usesObjectProperty = true;
  }

  Set<String> usedWidgets() { return usedWidgets; }
  Set<String> usedInstructions() { return usedInstructions; }
  boolean usesApp() { return usesApp; }
  boolean usesObjectProperty() { return usesObjectProperty; }

  /**
   * 查询属性类型。本地类沿其基类查找，自身规则中声明的属性视为 OBJECT。
   */
  Optional<PropertyKind> propertyKind(String property, String type) {
    return propertyKind(property, type, new HashSet<>());
  }

  private Optional<PropertyKind> propertyKind(String property, String type, Set<String> visited) {
    if (!visited.add(type)) return Optional.empty();
    ClassSpec local = localClasses.get(type);
    if (local == null) return widgets.getPropertyType(property, type);
    for (String base : local.bases) {
      Optional<PropertyKind> kind = propertyKind(property, base, visited);
      if (kind.isPresent()) return kind;
    }
    for (KvModel.Property p : local.rule.properties) {
      if (p.name.equals(property)) return Optional.of(PropertyKind.OBJECT);
    }
    return Optional.empty();
  }

  /** 属性是否已由某个基类提供（注册表中的控件，或本地生成的类）。 */
  boolean isInheritedProperty(String property, List<String> bases) {
    for (String base : bases) {
      if (propertyKind(property, base).isPresent()) return true;
    }
    return false;
  }
}
