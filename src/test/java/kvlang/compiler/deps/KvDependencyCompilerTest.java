package kvlang.compiler.deps;

import kvlang.compiler.ast.KvModel;
import kvlang.compiler.lexer.KvTokenizer;
import kvlang.compiler.parser.KvParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KvDependencyCompiler 监听键提取测试
 */
class KvDependencyCompilerTest {

  private KvDependencyCompiler compiler;

  @BeforeEach
  void setUp() {
    compiler = new KvDependencyCompiler();
  }

  private static KvModel.Module parse(String source) throws Exception {
    return new KvParser(new KvTokenizer().tokenize(source)).parse();
  }

  // ============================================================
  // 单个属性
  // ============================================================

  @Test
  void testCompile_MaximalChain() {
    CompiledPropertyValue value = compiler.compile("width", "self.parent.width");
    assertEquals(CompilationMode.EVAL, value.mode);
    assertEquals(List.of(List.of("self", "parent", "width")), value.watchedKeys, "最长点分链只产生一个键");
    assertFalse(value.isConstant());
  }

  @Test
  void testCompile_StringLiteralLookalikeIgnored() {
    CompiledPropertyValue value = compiler.compile("text", "'self.width is: ' + str(self.width)");
    assertEquals(List.of(List.of("self", "width")), value.watchedKeys, "字符串中的路径文本不应被提取");
  }

  @Test
  void testCompile_HandlerNeverWatched() {
    CompiledPropertyValue value = compiler.compile("on_press", "print('x')");
    assertEquals(CompilationMode.EXEC, value.mode);
    assertTrue(value.watchedKeys.isEmpty());

    CompiledPropertyValue withPaths = compiler.compile("on_release", "self.parent.do(self.width)");
    assertTrue(withPaths.watchedKeys.isEmpty(), "处理器无论内容如何都没有监听键");
  }

  @Test
  void testCompile_FStringSlots() {
    CompiledPropertyValue value = compiler.compile("text", "f'Width: {self.width}'");
    assertEquals(List.of(List.of("self", "width")), value.watchedKeys);
  }

  @Test
  void testCompile_FStringWithFormatSpec() {
    CompiledPropertyValue value = compiler.compile("text", "f'{root.value:.2f} / {app.limit!r}'");
    assertEquals(List.of(List.of("app", "limit"), List.of("root", "value")), value.watchedKeys);
  }

  @Test
  void testCompile_FStringNestedFormatSpec() {
    CompiledPropertyValue value = compiler.compile("text", "F\"{self.a!r:>{self.w}}\"");
    assertEquals(List.of(List.of("self", "a"), List.of("self", "w")), value.watchedKeys, "格式说明中的宽度也是监听键");
  }

  @Test
  void testCompile_TranslationMarker() {
    CompiledPropertyValue value = compiler.compile("text", "_('Hello %s') % self.name");
    assertEquals(List.of(List.of("_"), List.of("self", "name")), value.watchedKeys);
  }

  @Test
  void testCompile_AttributeNamedUnderscoreIsNotMarker() {
    CompiledPropertyValue value = compiler.compile("text", "obj._('x')");
    assertEquals(List.of(List.of("obj", "_")), value.watchedKeys);
  }

  @Test
  void testCompile_DeduplicatedAndSorted() {
    CompiledPropertyValue value = compiler.compile("size", "(self.width + root.x, self.height + self.width)");
    assertEquals(List.of(List.of("root", "x"), List.of("self", "height"), List.of("self", "width")), value.watchedKeys);
  }

  @Test
  void testCompile_RedundantSelfKeptAsIs() {
    assertEquals(List.of(List.of("self", "self", "x")), compiler.compile("x", "self.self.x").watchedKeys);
  }

  @Test
  void testCompile_Constants() {
    assertTrue(compiler.compile("text", "'hello'").isConstant());
    assertTrue(compiler.compile("size_hint", "None, None").isConstant());
    assertTrue(compiler.compile("font_size", "dp(20)").isConstant(), "单段名字不是监听键");
  }

  @Test
  void testExtract_StopsAtComment() {
    assertEquals(List.of(List.of("self", "x")), compiler.extractWatchedKeys("self.x  # self.y"));
  }

  @Test
  void testExtract_NumbersAreNotChains() {
    assertTrue(compiler.extractWatchedKeys("1.5 + 2.0").isEmpty());
  }

  // ============================================================
  // 模块编译
  // ============================================================

  @Test
  void testCompileModule_AnnotatesEveryProperty() throws Exception {
    String source = """
        <Card@Label>:
            text: 'static'
            font_size: self.height / 2
            on_touch_down: print('touched')
            canvas:
                Rectangle:
                    pos: self.pos
                    size: 10, 10
            Button:
                text: root.text
        """;
    KvModel.Module module = parse(source);
    CompiledModule compiled = compiler.compileModule(module);

    KvModel.Rule rule = compiled.module.rules.get(0);
    assertInstanceOf(KvModel.Literal.class, rule.properties.get(0).compiled);
    assertInstanceOf(KvModel.Expression.class, rule.properties.get(1).compiled);
    assertEquals(List.of(List.of("self", "height")), rule.properties.get(1).watchedKeys);
    assertInstanceOf(KvModel.Code.class, rule.handlers.get(0).compiled);
    assertTrue(rule.handlers.get(0).watchedKeys.isEmpty());

    List<KvModel.Property> rectProps = rule.canvas.instructions.get(0).properties;
    assertEquals(List.of(List.of("self", "pos")), rectProps.get(0).watchedKeys);
    assertTrue(rectProps.get(1).watchedKeys.isEmpty());

    assertEquals(List.of(List.of("root", "text")), rule.children.get(0).properties.get(0).watchedKeys);
    assertEquals(3, compiled.reactivePropertyCount);
  }

  @Test
  void testCompileModule_SourceUnchanged() throws Exception {
    KvModel.Module module = parse("<A@Label>:\n    text: self.parent.name\n");
    CompiledModule compiled = compiler.compileModule(module);
    assertSame(module, compiled.source);
    assertNull(module.rules.get(0).properties.get(0).watchedKeys, "源模块不应被修改");
    assertNotSame(module.rules.get(0), compiled.module.rules.get(0));
  }

  @Test
  void testCompileModule_TemplatesAndRoot() throws Exception {
    String source = """
        [Row@BoxLayout]:
            Label:
                text: ctx.title
        FloatLayout:
            Label:
                x: self.parent.x
        """;
    CompiledModule compiled = compiler.compileModule(parse(source));
    KvModel.Property inTemplate = compiled.module.templates.get(0).rule.children.get(0).properties.get(0);
    assertEquals(List.of(List.of("ctx", "title")), inTemplate.watchedKeys);
    KvModel.Property inRoot = compiled.module.root.children.get(0).properties.get(0);
    assertEquals(List.of(List.of("self", "parent", "x")), inRoot.watchedKeys);
  }

  @Test
  void testWatchedPropertyFinder() throws Exception {
    String source = """
        <A@Label>:
            text: app.title
            color: 1, 1, 1, 1
        <B@Widget>:
            Label:
                width: root.width
        """;
    WatchedPropertyFinder finder = new WatchedPropertyFinder();
    finder.visitModule(parse(source));
    List<WatchedPropertyFinder.Entry> entries = finder.getEntries();
    assertEquals(2, entries.size());
    assertEquals("A@Label", entries.get(0).rule);
    assertEquals("text", entries.get(0).property);
    assertEquals("B@Widget", entries.get(1).rule);
    assertEquals(List.of(List.of("root", "width")), entries.get(1).keys);
  }
}
