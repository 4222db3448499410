package kvlang.compiler;

import kvlang.compiler.ast.AstStatistics;
import kvlang.compiler.codegen.GeneratorOptions;
import kvlang.compiler.deps.CompiledModule;
import kvlang.compiler.parser.ParseResult;
import kvlang.compiler.parser.ParserMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KvCompiler 门面测试：解析模式、依赖编译与端到端生成
 */
class KvCompilerTest {

  private String loginSource;

  @BeforeEach
  void setUp() throws IOException {
    try (InputStream in = KvCompilerTest.class.getResourceAsStream("/kv/login.kv")) {
      assertNotNull(in, "测试资源 login.kv 不存在");
      loginSource = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  // ============================================================
  // 解析
  // ============================================================

  @Test
  void testParse_Fixture() throws Exception {
    ParseResult result = KvCompiler.parse(loginSource, ParserMode.STRICT);
    assertTrue(result.isSuccess());
    AstStatistics stats = AstStatistics.of(result.module);
    assertEquals(3, stats.getDirectiveCount());
    assertEquals(3, stats.getRuleCount(), "模板内部的规则计入规则数");
    assertEquals(1, stats.getTemplateCount());
    assertEquals(2, stats.getCanvasInstructionCount());
    assertNotNull(result.module.root);
  }

  @Test
  void testParse_LexErrorStrictThrows() {
    String source = "<A@Label>:\n    text: 'abc\n";
    assertThrows(KvCompiler.CompilationException.class, () -> KvCompiler.parse(source, ParserMode.STRICT));
  }

  @Test
  void testParse_LexErrorTolerantReturnsEmptyModule() throws Exception {
    ParseResult result = KvCompiler.parse("<A@Label>:\n    text: 'abc\n", ParserMode.TOLERANT);
    assertFalse(result.isSuccess());
    assertEquals(1, result.errors.size());
    assertTrue(result.module.rules.isEmpty());
    assertEquals(2, result.errors.get(0).line);
  }

  @Test
  void testParse_SyntaxErrorStrictThrows() {
    String source = "<A@Label>:\n    text 'x'\n";
    KvCompiler.CompilationException e = assertThrows(KvCompiler.CompilationException.class,
        () -> KvCompiler.parse(source, ParserMode.STRICT));
    assertNotNull(e.getCause());
  }

  @Test
  void testParse_SyntaxErrorTolerantKeepsGoodRules() throws Exception {
    String source = "<A@Label>:\n    text 'x'\n<B@Label>:\n    text: 'y'\n";
    ParseResult result = KvCompiler.parse(source, ParserMode.TOLERANT);
    assertFalse(result.errors.isEmpty());
    assertTrue(result.module.rules.stream().anyMatch(r -> r.selector.primaryName().equals("B@Label")));
  }

  // ============================================================
  // 编译
  // ============================================================

  @Test
  void testCompile_ReactiveCount() throws Exception {
    CompiledModule compiled = KvCompiler.compile(loginSource);
    // pos, size, disabled, text(f-string), color, ctx.title
    assertEquals(6, compiled.reactivePropertyCount);
  }

  @Test
  void testCompileToPython_Fixture() throws Exception {
    String python = KvCompiler.compileToPython(loginSource, ParserMode.STRICT,
        GeneratorOptions.defaults().withIndentWidth(4));
    assertTrue(python.contains("from kivy.core.window import Window\n"));
    assertTrue(python.contains("accent = 0.2, 0.6, 1, 1\n"));
    assertTrue(python.contains("class LoginForm(BoxLayout):"));
    assertTrue(python.contains("class StatusLabel(Label):"));
    assertTrue(python.contains("class ListRow(BoxLayout):"));
    assertTrue(python.contains("    status = ObjectProperty(None)\n"));
    assertTrue(python.contains("self.canvas.before.add(Color(rgba=accent))"));
    assertTrue(python.contains("username = TextInput(multiline=False)"));
    int registered = python.indexOf("self.ids['username'] = username");
    assertTrue(python.indexOf("button_2.disabled = not self.ids.username.text") > registered, "裸 id 经 self.ids 解析并推迟连接");
    assertTrue(python.contains("_cb_3 = lambda instance, value: setattr(button_2, 'disabled', not value)"));
    assertTrue(python.contains("self.ids.username.bind(text=_cb_3)"));
    assertTrue(python.contains("self.submit(self.ids.username.text)"));
    assertFalse(python.contains("class FloatLayout"), "根控件不生成类");
  }

  @Test
  void testCompileToPython_TolerantSkipsBrokenRule() throws Exception {
    String source = "<A@Label>:\n    text 'x'\n<B@Label>:\n    text: 'y'\n";
    String python = KvCompiler.compileToPython(source, ParserMode.TOLERANT, GeneratorOptions.defaults());
    assertTrue(python.contains("class B(Label):"));
  }

  @Test
  void testToJson() throws Exception {
    String json = KvCompiler.toJson(KvCompiler.parse(loginSource, ParserMode.STRICT).module);
    assertTrue(json.contains("\"kind\" : \"DynamicClass\""));
    assertTrue(json.contains("\"rules\""));
    assertFalse(json.contains("eventHandler"));
  }
}
