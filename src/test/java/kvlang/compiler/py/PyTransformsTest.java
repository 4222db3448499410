package kvlang.compiler.py;

import kvlang.compiler.py.PyModel.Expr;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PyTransforms 改写测试
 */
class PyTransformsTest {

  private PySourceWriter writer;
  private Map<String, Expr> childScope;

  @BeforeEach
  void setUp() {
    writer = new PySourceWriter();
    childScope = Map.of("self", PyModel.name("label_1"), "root", PyModel.name("self"));
  }

  private String rename(String expression) throws PyParseException {
    return writer.write(PyTransforms.renameNames(PyParser.parseExpression(expression), childScope));
  }

  // ============================================================
  // renameNames
  // ============================================================

  @Test
  void testRename_FreeNames() throws PyParseException {
    assertEquals("label_1.width + self.x", rename("self.width + root.x"));
  }

  @Test
  void testRename_AttributeNamesUntouched() throws PyParseException {
    assertEquals("label_1.root.self", rename("self.root.self"));
  }

  @Test
  void testRename_LambdaParameterShadows() throws PyParseException {
    assertEquals("lambda self: self.x + self.y", rename("lambda self: self.x + root.y"));
  }

  @Test
  void testRename_ComprehensionTargetShadows() throws PyParseException {
    assertEquals("[self for self in self.items]", rename("[self for self in root.items]"));
  }

  @Test
  void testRename_FStringSlots() throws PyParseException {
    assertEquals("f'{label_1.width}px'", rename("f'{self.width}px'"));
  }

  @Test
  void testRename_EmptyMappingReturnsSameTree() throws PyParseException {
    Expr e = PyParser.parseExpression("a + b");
    assertSame(e, PyTransforms.renameNames(e, Map.of()));
  }

  // ============================================================
  // 属性链
  // ============================================================

  @Test
  void testSubstituteChain() throws PyParseException {
    Expr e = PyParser.parseExpression("self.width * 2 + self.width_max");
    Expr out = PyTransforms.substituteChain(e, List.of("self", "width"), PyModel.name("value"));
    assertEquals("value * 2 + self.width_max", writer.write(out));
  }

  @Test
  void testSubstituteChain_ComprehensionTargetNotReplaced() throws PyParseException {
    Expr e = PyParser.parseExpression("[c.text for c in c.children]");
    Expr out = PyTransforms.substituteChain(e, List.of("c", "children"), PyModel.name("value"));
    assertEquals("[c.text for c in value]", writer.write(out), "第一个生成器的 iter 属于外层作用域");

    Expr inner = PyTransforms.substituteChain(e, List.of("c", "text"), PyModel.name("value"));
    assertEquals("[c.text for c in c.children]", writer.write(inner), "被推导式目标遮蔽的链不应替换");
  }

  @Test
  void testOccursFree() throws PyParseException {
    Expr e = PyParser.parseExpression("', '.join([c.text for c in self.children])");
    assertFalse(PyTransforms.occursFree(e, List.of("c", "text")));
    assertTrue(PyTransforms.occursFree(e, List.of("self", "children")));

    Expr mixed = PyParser.parseExpression("c.text + (lambda c: c.text)(x)");
    assertTrue(PyTransforms.occursFree(mixed, List.of("c", "text")), "外层的 c.text 是自由出现");
    assertFalse(PyTransforms.occursFree(PyParser.parseExpression("lambda c: c.text"), List.of("c", "text")));
  }

  @Test
  void testFreeNames() throws PyParseException {
    assertEquals(Set.of("items", "f"),
        PyTransforms.freeNames(PyParser.parseExpression("[f(x) for x in items if x]")));
    assertEquals(Set.of("y"), PyTransforms.freeNames(PyParser.parseExpression("lambda x, d=y: x + d")));
    assertEquals(Set.of("dp"), PyTransforms.freeNames(PyParser.parseExpression("dp(14)")));
  }

  @Test
  void testChainOf() throws PyParseException {
    assertEquals(List.of("a", "b", "c"), PyTransforms.chainOf(PyParser.parseExpression("a.b.c")));
    assertEquals(List.of("a"), PyTransforms.chainOf(PyParser.parseExpression("a")));
    assertNull(PyTransforms.chainOf(PyParser.parseExpression("a().b")));
  }

  @Test
  void testCollectNames() throws PyParseException {
    assertEquals(Set.of("x", "y", "f", "z"), PyTransforms.collectNames(PyParser.parseStatement("x = y + f(z)")));
    assertTrue(PyTransforms.collectNames(PyParser.parseExpression("app.title")).contains("app"));
  }

  @Test
  void testMapExpressions() throws PyParseException {
    PyModel.Stmt stmt = PyParser.parseStatement("self.text = root.label");
    PyModel.Stmt out = PyTransforms.mapExpressions(stmt, e -> PyTransforms.renameNames(e, childScope));
    assertEquals("label_1.text = self.label\n", writer.writeStatement(out));
  }
}
