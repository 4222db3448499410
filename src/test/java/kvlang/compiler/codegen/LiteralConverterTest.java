package kvlang.compiler.codegen;

import kvlang.compiler.py.PyModel;
import kvlang.compiler.py.PySourceWriter;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LiteralConverter 与 GeneratorOptions 测试
 */
class LiteralConverterTest {

  private final PySourceWriter writer = new PySourceWriter();

  private String convert(String raw, boolean sequence) {
    return writer.write(LiteralConverter.convert(raw, sequence));
  }

  @Test
  void testStrings() {
    PyModel.Str s = assertInstanceOf(PyModel.Str.class, LiteralConverter.convert("'hello'", false));
    assertEquals("hello", s.value);
    assertEquals("\"it's\"", convert("\"it's\"", false));
  }

  @Test
  void testNumbersAndConstants() {
    assertInstanceOf(PyModel.Constant.class, LiteralConverter.convert("20", false));
    assertEquals("True", convert("True", false));
    assertEquals("None", convert(" None ", false));
    assertEquals("-1.5", convert("-1.5", false));
  }

  @Test
  void testTuples() {
    assertEquals("(1, 0, 0, 1)", convert("1, 0, 0, 1", false));
    assertEquals("[1, 0, 0, 1]", convert("1, 0, 0, 1", true), "序列属性生成列表");
    assertEquals("[10, 20]", convert("[10, 20]", true));
  }

  @Test
  void testFallbackToString() {
    assertEquals("'20sp'", convert("20sp", false));
    assertEquals("''", convert("   ", false));
  }

  @Test
  void testUnresolvedNamesBecomeStrings() {
    assertEquals("'hello'", convert("hello", false));
    assertEquals("'dp(20)'", convert("dp(20)", false), "未定义的函数调用作为字符串");
    assertEquals("'hello world'", convert("hello world", false));
  }

  @Test
  void testKnownNamesKeptAsExpressions() {
    assertEquals("dp(20)", writer.write(LiteralConverter.convert("dp(20)", false, Set.of("dp"))));
    assertEquals("pad * 2", writer.write(LiteralConverter.convert("pad * 2", false, Set.of("pad"))));
    assertEquals("str(3)", convert("str(3)", false), "内置名总是可以解析");
    assertEquals("[len(x) for x in (1, 2)]", convert("[len(x) for x in (1, 2)]", false), "推导式目标不是自由名字");
  }

  @Test
  void testOptions() {
    GeneratorOptions base = GeneratorOptions.defaults();
    GeneratorOptions changed = base.withDefaultBase("BoxLayout").withIndentWidth(2);
    assertEquals("BoxLayout", changed.defaultBase);
    assertEquals(2, changed.indentWidth);
    assertNotSame(base, changed);
    assertThrows(IllegalArgumentException.class, () -> base.withIndentWidth(0));
    GeneratorOptions withBases = base.withClassBases("Foo", java.util.List.of("Label"));
    assertEquals(java.util.List.of("Label"), withBases.classBases.get("Foo"));
    assertTrue(base.classBases.isEmpty(), "原实例不受影响");
  }
}
