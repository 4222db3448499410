package kvlang.compiler.registry;

import java.util.List;

/**
 * 注册表 JSON 资源的数据模型，由 Jackson 直接绑定。
 */
public final class RegistryModel {
  private RegistryModel() {}

  public static final class WidgetCatalog { public List<WidgetEntry> widgets; }

  public static final class WidgetEntry {
    public String name;
    public String module;
    public List<String> bases;
    public List<PropertyEntry> properties;
  }

  public static final class PropertyEntry { public String name; public PropertyKind type; }

  public static final class InstructionCatalog { public List<InstructionEntry> instructions; }

  public static final class InstructionEntry {
    public String name;
    public String module;
    public List<ParameterEntry> parameters;
  }

  public static final class ParameterEntry { public String name; public ParameterKind type; }
}
