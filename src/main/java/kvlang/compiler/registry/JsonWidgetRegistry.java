package kvlang.compiler.registry;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import kvlang.compiler.runtime.ErrorMessages;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 从 classpath 上的 JSON 资源加载的控件注册表。
 *
 * <p>资源格式：{@code {"widgets": [{"name", "module", "bases", "properties": [{"name", "type"}]}]}}，
 * 其中 {@code type} 为 Kivy 属性类名（如 {@code NumericProperty}）。加载后不可变。</p>
 */
public final class JsonWidgetRegistry implements WidgetRegistry {

  private static final Logger LOGGER = Logger.getLogger(JsonWidgetRegistry.class.getName());

  /** 内置资源路径。 */
  public static final String DEFAULT_RESOURCE = "/kivy/widgets.json";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final Map<String, RegistryModel.WidgetEntry> widgets;

  private JsonWidgetRegistry(Map<String, RegistryModel.WidgetEntry> widgets) {
    this.widgets = widgets;
  }

  /** 加载内置控件表。 */
  public static JsonWidgetRegistry loadDefault() {
    return fromResource(DEFAULT_RESOURCE);
  }

  /**
   * 从 classpath 资源加载。
   *
   * @throws IllegalStateException 资源不存在或不是合法的控件表
   */
  public static JsonWidgetRegistry fromResource(String resource) {
    try (InputStream in = JsonWidgetRegistry.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException(ErrorMessages.registryLoadFailed(resource, "not found"));
      }
      return build(MAPPER.readValue(in, RegistryModel.WidgetCatalog.class), resource);
    } catch (IOException e) {
      throw new IllegalStateException(ErrorMessages.registryLoadFailed(resource, e.getMessage()), e);
    }
  }

  /** 从 JSON 文本加载，主要用于测试自定义控件表。 */
  public static JsonWidgetRegistry fromJson(String json) {
    try {
      return build(MAPPER.readValue(json, RegistryModel.WidgetCatalog.class), "<inline>");
    } catch (IOException e) {
      throw new IllegalStateException(ErrorMessages.registryLoadFailed("<inline>", e.getMessage()), e);
    }
  }

  private static JsonWidgetRegistry build(RegistryModel.WidgetCatalog catalog, String source) {
    if (catalog == null || catalog.widgets == null) {
      throw new IllegalStateException(ErrorMessages.registryLoadFailed(source, "missing \"widgets\" array"));
    }
    Map<String, RegistryModel.WidgetEntry> byName = new LinkedHashMap<>();
    for (RegistryModel.WidgetEntry entry : catalog.widgets) {
      if (entry.name == null || entry.name.isEmpty()) {
        throw new IllegalStateException(ErrorMessages.registryLoadFailed(source, "widget without name"));
      }
      if (entry.bases == null) entry.bases = List.of();
      if (entry.properties == null) entry.properties = List.of();
      byName.put(entry.name, entry);
    }
    LOGGER.log(Level.FINE, "loaded {0} widgets from {1}", new Object[]{byName.size(), source});
    return new JsonWidgetRegistry(Collections.unmodifiableMap(byName));
  }

  @Override
  public Optional<PropertyKind> getPropertyType(String property, String widgetType) {
    if (!widgets.containsKey(widgetType)) return Optional.empty();
    List<String> lookup = new ArrayList<>();
    lookup.add(widgetType);
    lookup.addAll(getAllBaseClasses(widgetType));
    for (String type : lookup) {
      RegistryModel.WidgetEntry entry = widgets.get(type);
      if (entry == null) continue;
      for (RegistryModel.PropertyEntry p : entry.properties) {
        if (p.name.equals(property)) return Optional.ofNullable(p.type);
      }
    }
    return Optional.empty();
  }

  @Override
  public Set<PropertyInfo> getAllProperties(String widgetType) {
    if (!widgets.containsKey(widgetType)) return Set.of();
    Set<PropertyInfo> result = new LinkedHashSet<>();
    List<String> lookup = new ArrayList<>();
    lookup.add(widgetType);
    lookup.addAll(getAllBaseClasses(widgetType));
    for (String type : lookup) {
      RegistryModel.WidgetEntry entry = widgets.get(type);
      if (entry == null) continue;
      for (RegistryModel.PropertyEntry p : entry.properties) {
        result.add(new PropertyInfo(p.name, p.type));
      }
    }
    return Collections.unmodifiableSet(result);
  }

  @Override
  public List<String> getAllBaseClasses(String widgetType) {
    RegistryModel.WidgetEntry start = widgets.get(widgetType);
    if (start == null) return List.of();
    // 广度优先：直接基类排在前面
    Set<String> seen = new LinkedHashSet<>();
    Deque<String> queue = new ArrayDeque<>(start.bases);
    while (!queue.isEmpty()) {
      String base = queue.poll();
      if (base.equals(widgetType) || !seen.add(base)) continue;
      RegistryModel.WidgetEntry entry = widgets.get(base);
      if (entry != null) queue.addAll(entry.bases);
    }
    return List.copyOf(seen);
  }

  @Override
  public boolean widgetExists(String widgetType) {
    return widgets.containsKey(widgetType);
  }

  @Override
  public Optional<String> getModulePath(String widgetType) {
    RegistryModel.WidgetEntry entry = widgets.get(widgetType);
    return entry == null ? Optional.empty() : Optional.ofNullable(entry.module);
  }

  /** 已注册的全部控件名，按资源中的顺序。 */
  public Set<String> widgetNames() {
    return widgets.keySet();
  }
}
