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
 * 从 JSON 资源加载的画布指令注册表。
 */
public final class JsonCanvasInstructionRegistry implements CanvasInstructionRegistry {

  private static final Logger LOGGER = Logger.getLogger(JsonCanvasInstructionRegistry.class.getName());

  public static final String DEFAULT_RESOURCE = "/kivy/canvas-instructions.json";
  public static final String DEFAULT_MODULE = "kivy.graphics";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final Map<String, RegistryModel.InstructionEntry> instructions;

  private JsonCanvasInstructionRegistry(Map<String, RegistryModel.InstructionEntry> instructions) {
    this.instructions = instructions;
  }

  public static JsonCanvasInstructionRegistry loadDefault() {
    return fromResource(DEFAULT_RESOURCE);
  }

  /**
   * @throws IllegalStateException 资源不存在或格式错误
   */
  public static JsonCanvasInstructionRegistry fromResource(String resource) {
    try (InputStream in = JsonCanvasInstructionRegistry.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException(ErrorMessages.registryLoadFailed(resource, "not found"));
      }
      RegistryModel.InstructionCatalog catalog = MAPPER.readValue(in, RegistryModel.InstructionCatalog.class);
      if (catalog == null || catalog.instructions == null) {
        throw new IllegalStateException(ErrorMessages.registryLoadFailed(resource, "missing \"instructions\" array"));
      }
      Map<String, RegistryModel.InstructionEntry> byName = new LinkedHashMap<>();
      for (RegistryModel.InstructionEntry entry : catalog.instructions) {
        if (entry.parameters == null) entry.parameters = List.of();
        byName.put(entry.name, entry);
      }
      LOGGER.log(Level.FINE, "loaded {0} canvas instructions from {1}", new Object[]{byName.size(), resource});
      return new JsonCanvasInstructionRegistry(Collections.unmodifiableMap(byName));
    } catch (IOException e) {
      throw new IllegalStateException(ErrorMessages.registryLoadFailed(resource, e.getMessage()), e);
    }
  }

  @Override
  public boolean instructionExists(String instruction) {
    return instructions.containsKey(instruction);
  }

  @Override
  public Set<ParameterInfo> getInstructionParameters(String instruction) {
    RegistryModel.InstructionEntry entry = instructions.get(instruction);
    if (entry == null) return Set.of();
    Set<ParameterInfo> result = new LinkedHashSet<>();
    for (RegistryModel.ParameterEntry p : entry.parameters) result.add(new ParameterInfo(p.name, p.type));
    return Collections.unmodifiableSet(result);
  }

  @Override
  public Optional<ParameterKind> getParameterType(String parameter, String instruction) {
    RegistryModel.InstructionEntry entry = instructions.get(instruction);
    if (entry == null) return Optional.empty();
    for (RegistryModel.ParameterEntry p : entry.parameters) {
      if (p.name.equals(parameter)) return Optional.ofNullable(p.type);
    }
    return Optional.empty();
  }

  @Override
  public Optional<String> getModulePath(String instruction) {
    RegistryModel.InstructionEntry entry = instructions.get(instruction);
    if (entry == null) return Optional.empty();
    return Optional.of(entry.module != null ? entry.module : DEFAULT_MODULE);
  }
}
