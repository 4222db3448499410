package kvlang.compiler.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JsonCanvasInstructionRegistry 测试
 */
class JsonCanvasInstructionRegistryTest {

  private JsonCanvasInstructionRegistry registry;

  @BeforeEach
  void setUp() {
    registry = JsonCanvasInstructionRegistry.loadDefault();
  }

  @Test
  void testInstructionExists() {
    assertTrue(registry.instructionExists("Color"));
    assertTrue(registry.instructionExists("Rectangle"));
    assertTrue(registry.instructionExists("PushMatrix"));
    assertFalse(registry.instructionExists("Label"));
  }

  @Test
  void testParameterType() {
    assertEquals(Optional.of(ParameterKind.LIST), registry.getParameterType("rgba", "Color"));
    assertEquals(Optional.of(ParameterKind.NUMBER), registry.getParameterType("a", "Color"));
    assertEquals(Optional.of(ParameterKind.STRING), registry.getParameterType("source", "Rectangle"));
    assertTrue(registry.getParameterType("nope", "Rectangle").isEmpty());
    assertTrue(registry.getParameterType("pos", "Nope").isEmpty());
  }

  @Test
  void testInstructionParameters() {
    Set<ParameterInfo> params = registry.getInstructionParameters("Rectangle");
    assertTrue(params.contains(new ParameterInfo("pos", ParameterKind.LIST)));
    assertTrue(params.contains(new ParameterInfo("size", ParameterKind.LIST)));
    assertTrue(registry.getInstructionParameters("Nope").isEmpty());
  }

  @Test
  void testModulePath() {
    assertEquals(Optional.of("kivy.graphics"), registry.getModulePath("Ellipse"));
    assertTrue(registry.getModulePath("Nope").isEmpty());
  }

  @Test
  void testLoad_MissingResource() {
    assertThrows(IllegalStateException.class, () -> JsonCanvasInstructionRegistry.fromResource("/kivy/missing.json"));
  }

  @Test
  void testParameterKind() {
    assertEquals(ParameterKind.BOOLEAN, ParameterKind.fromJsonName("boolean"));
    assertEquals("object", ParameterKind.OBJECT.jsonName());
  }
}
