package kvlang.compiler.codegen;

import kvlang.compiler.ast.KvModel;
import kvlang.compiler.lexer.KvTokenizer;
import kvlang.compiler.parser.KvParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PythonClassGenerator 端到端生成测试
 */
class PythonClassGeneratorTest {

  private PythonClassGenerator generator;

  @BeforeEach
  void setUp() {
    generator = new PythonClassGenerator(GeneratorOptions.defaults().withDefaultBase("Widget").withIndentWidth(4));
  }

  private String generate(String source) throws Exception {
    KvModel.Module module = new KvParser(new KvTokenizer().tokenize(source)).parse();
    return generator.generate(module);
  }

  private static int occurrences(String text, String needle) {
    int count = 0;
    for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) count++;
    return count;
  }

  // ============================================================
  // 完整输出
  // ============================================================

  @Test
  void testGenerate_ChildrenBindingsAndHandlers() throws Exception {
    String source = """
        <MyWidget@BoxLayout>:
            orientation: 'vertical'
            Label:
                id: title
                text: root.title_text
            Button:
                text: 'Press'
                on_press: root.do_it()
        """;
    String expected = """
        from kivy.uix.boxlayout import BoxLayout
        from kivy.uix.button import Button
        from kivy.uix.label import Label


        class MyWidget(BoxLayout):
            def __init__(self, **kwargs):
                super().__init__(**kwargs)
                self._bindings = []
                self.orientation = 'vertical'
                title = Label()
                title.text = self.title_text
                _cb_1 = title.setter('text')
                self.bind(title_text=_cb_1)
                self._bindings.append((self, 'title_text', _cb_1))
                self.ids['title'] = title
                self.add_widget(title)
                button_2 = Button(text='Press')
                button_2.bind(on_press=self._on_press_3)
                self.add_widget(button_2)

            def _on_press_3(self, *args):
                self.do_it()

            def __del__(self):
                for obj, prop, callback in self._bindings:
                    try:
                        obj.unbind(**{prop: callback})
                    except Exception:
                        pass
        """;
    assertEquals(expected, generate(source));
  }

  @Test
  void testGenerate_Deterministic() throws Exception {
    String source = "<A@Label>:\n    text: str(self.width)\n    Button:\n        on_release: print('x')\n";
    assertEquals(generate(source), generate(source), "相同输入必须产生相同输出");
  }

  // ============================================================
  // 响应式属性
  // ============================================================

  @Test
  void testReactive_OneCallbackPerKey() throws Exception {
    String out = generate("<Pair@Label>:\n    text: str(self.width) + str(self.height)\n");
    assertEquals(2, occurrences(out, "self._bindings.append("));
    assertTrue(out.contains("self.text = str(self.width) + str(self.height)"));
    assertTrue(out.contains("_cb_1 = lambda instance, value: setattr(self, 'text', str(self.width) + str(value))"));
    assertTrue(out.contains("self.bind(height=_cb_1)"));
    assertTrue(out.contains("_cb_2 = lambda instance, value: setattr(self, 'text', str(value) + str(self.height))"));
    assertTrue(out.contains("self.bind(width=_cb_2)"));
    assertTrue(out.contains("obj.unbind(**{prop: callback})"));
  }

  @Test
  void testReactive_LongerChainBindsOnOwner() throws Exception {
    String out = generate("<A@Label>:\n    width: self.parent.width\n");
    assertTrue(out.contains("_cb_1 = self.setter('width')"));
    assertTrue(out.contains("self.parent.bind(width=_cb_1)"));
    assertTrue(out.contains("self._bindings.append((self.parent, 'width', _cb_1))"));
  }

  @Test
  void testReactive_AppReference() throws Exception {
    String out = generate("<Title@Label>:\n    text: app.title\n");
    assertTrue(out.contains("from kivy.app import App"));
    assertTrue(out.contains("app = App.get_running_app()"));
    assertTrue(out.indexOf("app = App.get_running_app()") < out.indexOf("self.text = app.title"));
    assertTrue(out.contains("_cb_1 = self.setter('text')"));
    assertTrue(out.contains("app.bind(title=_cb_1)"));
  }

  @Test
  void testReactive_IdsDeferredUntilChildrenExist() throws Exception {
    String source = """
        <Form@BoxLayout>:
            Label:
                text: ids.field.text
            TextInput:
                id: field
        """;
    String out = generate(source);
    int registered = out.indexOf("self.ids['field'] = field");
    int wired = out.indexOf("label_1.text = self.ids.field.text");
    assertTrue(registered >= 0 && wired > registered, "引用 ids 的连接必须在 id 登记之后");
    assertTrue(out.contains("self.ids.field.bind(text=_cb_2)"));
  }

  @Test
  void testReactive_BareIdResolvedThroughIds() throws Exception {
    String source = """
        <Root@BoxLayout>:
            title: inp.text
            Label:
                text: inp.text
            Button:
                on_press: inp.text = ''
            TextInput:
                id: inp
        """;
    String out = generate(source);
    int registered = out.indexOf("self.ids['inp'] = inp");
    assertTrue(registered >= 0);
    assertTrue(out.indexOf("self.title = self.ids.inp.text") > registered, "引用 id 的初值必须在 id 登记之后");
    assertTrue(out.indexOf("label_2.text = self.ids.inp.text") > registered);
    assertTrue(out.contains("_cb_1 = self.setter('title')"));
    assertTrue(out.contains("self.ids.inp.bind(text=_cb_1)"));
    assertTrue(out.contains("self.ids.inp.bind(text=_cb_3)"));
    assertTrue(out.contains("self._bindings.append((self.ids.inp, 'text', _cb_3))"));
    assertFalse(out.contains(" inp.bind("), "裸 id 不能作为局部变量绑定");
  }

  @Test
  void testHandler_BareIdResolvedThroughIds() throws Exception {
    String source = """
        <Root@BoxLayout>:
            Button:
                on_press: inp.text = ''
            TextInput:
                id: inp
        """;
    String out = generate(source);
    assertTrue(out.contains("    def _on_press_2(self, *args):\n        self.ids.inp.text = ''\n"),
        "处理器方法中不能引用 __init__ 的局部变量");
  }

  @Test
  void testReactive_StaticValueReadingIdDeferred() throws Exception {
    String source = """
        <Link@BoxLayout>:
            Label:
                target: field
            TextInput:
                id: field
        """;
    String out = generate(source);
    assertTrue(out.contains("label_1 = Label()"), "引用 id 的静态值不放入构造参数");
    assertTrue(out.indexOf("label_1.target = self.ids.field") > out.indexOf("self.ids['field'] = field"));
  }

  @Test
  void testReactive_ComprehensionTargetNotBound() throws Exception {
    String out = generate("<Names@Label>:\n    text: ', '.join([c.text for c in self.children])\n");
    assertFalse(out.contains("c.bind("), "推导式目标在 __init__ 中不存在");
    assertFalse(out.contains("(c, 'text'"));
    assertEquals(1, occurrences(out, "self._bindings.append("));
    assertTrue(out.contains("self.bind(children=_cb_1)"));
    assertTrue(out.contains("[c.text for c in value]"), "只替换外层作用域中的链");
  }

  @Test
  void testReactive_LambdaParameterNotBound() throws Exception {
    String out = generate("<Sorter@Label>:\n    text: str(sorted(self.items, key=lambda it: it.order))\n");
    assertFalse(out.contains("it.bind("));
    assertTrue(out.contains("self.bind(items=_cb_1)"));
  }

  @Test
  void testReactive_UnparseableExpressionKeptAsString() throws Exception {
    String out = generate("<A@Label>:\n    text: self.x +\n");
    assertTrue(out.contains("self.text = 'self.x +'"));
  }

  // ============================================================
  // 画布
  // ============================================================

  @Test
  void testCanvas_StaticAndReactiveInstructions() throws Exception {
    String source = """
        <Card@Widget>:
            canvas.before:
                Color:
                    rgba: 1, 0, 0, 1
                Rectangle:
                    pos: self.pos
                    size: self.size
        """;
    String out = generate(source);
    assertTrue(out.contains("from kivy.graphics import Color, Rectangle"));
    assertTrue(out.contains("from kivy.uix.widget import Widget"));
    assertTrue(out.contains("self.canvas.before.add(Color(rgba=[1, 0, 0, 1]))"));
    assertTrue(out.contains("self._canvas_rectangle_1 = Rectangle()"));
    assertTrue(out.contains("self.canvas.before.add(self._canvas_rectangle_1)"));
    assertTrue(out.contains("self._canvas_rectangle_1.pos = self.pos"));
    assertTrue(out.contains("_cb_2 = lambda instance, value: setattr(self._canvas_rectangle_1, 'pos', value)"));
    assertTrue(out.contains("self.bind(pos=_cb_2)"));
    assertTrue(out.contains("self.bind(size=_cb_3)"));
    assertFalse(out.contains(".setter("), "画布指令没有 setter()");
  }

  @Test
  void testCanvas_ChildCanvasTargetsChild() throws Exception {
    String source = """
        <Panel@BoxLayout>:
            Label:
                canvas:
                    Color:
                        rgb: 0, 1, 0
        """;
    String out = generate(source);
    assertTrue(out.contains("label_1.canvas.add(Color(rgb=[0, 1, 0]))"));
  }

  // ============================================================
  // 类与属性
  // ============================================================

  @Test
  void testCustomPropertyPromoted() throws Exception {
    String out = generate("<Counter@Label>:\n    count: 0\n    text: 'n'\n");
    assertTrue(out.contains("from kivy.properties import ObjectProperty"));
    assertTrue(out.contains("    count = ObjectProperty(None)\n"));
    assertTrue(out.contains("self.count = 0"));
    assertFalse(out.contains("text = ObjectProperty"), "基类已有的属性不提升");
  }

  @Test
  void testLocalBaseEmittedFirst() throws Exception {
    String source = """
        <Child@Base>:
            count: 5
        <Base@Label>:
            count: 0
        """;
    String out = generate(source);
    int base = out.indexOf("class Base(Label):");
    int child = out.indexOf("class Child(Base):");
    assertTrue(base >= 0 && child > base, "本地基类必须先于子类生成");
    assertEquals(1, occurrences(out, "count = ObjectProperty(None)"), "子类继承本地基类的属性");
    assertFalse(out.contains("import Base"));
  }

  @Test
  void testKnownWidgetRuleEmitsNoClass() throws Exception {
    String out = generate("<Button>:\n    color: 1, 0, 0, 1\n");
    assertFalse(out.contains("class "));
  }

  @Test
  void testKnownWidgetRuleWithSuppliedBases() throws Exception {
    PythonClassGenerator custom = new PythonClassGenerator(
        GeneratorOptions.defaults().withIndentWidth(4).withClassBases("Button", List.of("ButtonBehavior", "Label")));
    KvModel.Module module = new KvParser(new KvTokenizer().tokenize("<Button>:\n    text: 'ok'\n")).parse();
    String out = custom.generate(module);
    assertTrue(out.contains("class Button(ButtonBehavior, Label):"));
    assertTrue(out.contains("from kivy.uix.behaviors import ButtonBehavior"));
  }

  @Test
  void testUnknownNameUsesDefaultBase() throws Exception {
    String out = generate("<MyRoot>:\n    Label:\n        text: 'hi'\n");
    assertTrue(out.contains("class MyRoot(Widget):"));
    assertTrue(out.contains("label_1 = Label(text='hi')"));
  }

  @Test
  void testSelectorsAndRootEmitNoClass() throws Exception {
    String source = """
        <Label,Button>:
            font_size: 20
        <.highlight>:
            bold: True
        BoxLayout:
            Label:
                text: 'root child'
        """;
    assertFalse(generate(source).contains("class "));
  }

  @Test
  void testTemplateEmitsClass() throws Exception {
    String out = generate("[Row@BoxLayout]:\n    Label:\n        text: 'x'\n");
    assertTrue(out.contains("class Row(BoxLayout):"));
  }

  @Test
  void testStaticValue_UnresolvedNamesBecomeStrings() throws Exception {
    String out = generate("<Greeting@Label>:\n    text: hello\n    font_size: dp(14)\n    bold: True\n");
    assertTrue(out.contains("self.text = 'hello'"));
    assertTrue(out.contains("self.font_size = 'dp(14)'"), "未导入的函数调用作为字符串");
    assertTrue(out.contains("self.bold = True"));
  }

  @Test
  void testStaticValue_ModuleNamesResolved() throws Exception {
    String source = """
        #:import dp kivy.metrics.dp
        #:set greeting 'hi'
        <Greeting@Label>:
            text: greeting
            font_size: dp(14)
        """;
    String out = generate(source);
    assertTrue(out.contains("self.text = greeting"));
    assertTrue(out.contains("self.font_size = dp(14)"));
  }

  @Test
  void testIdKeywordOrBuiltinNotUsedAsVariable() throws Exception {
    String source = """
        <Meter@BoxLayout>:
            Label:
                text: str(self.width)
            Slider:
                id: str
            Label:
                id: class
            Button:
                id: label_1
        """;
    String out = generate(source);
    assertTrue(out.contains("label_1.text = str(label_1.width)"));
    assertTrue(out.contains("slider_3 = Slider()"));
    assertTrue(out.contains("self.ids['str'] = slider_3"));
    assertTrue(out.contains("label_4 = Label()"));
    assertTrue(out.contains("self.ids['class'] = label_4"));
    assertTrue(out.contains("button_5 = Button()"), "与合成名字同形的 id 不作为变量");
    assertTrue(out.contains("self.ids['label_1'] = button_5"));
    assertFalse(out.contains("str = "));
    assertFalse(out.contains("class = "));
  }

  @Test
  void testIdShadowingModuleNameNotUsedAsVariable() throws Exception {
    String source = """
        #:set gap 4
        <Row@BoxLayout>:
            spacing: gap
            Widget:
                id: gap
        """;
    String out = generate(source);
    assertTrue(out.contains("self.spacing = gap"), "裸名字仍指向模块常量");
    assertTrue(out.contains("widget_1 = Widget()"));
    assertTrue(out.contains("self.ids['gap'] = widget_1"));
  }

  @Test
  void testIdNotUsableAsVariable() throws Exception {
    String out = generate("<A@BoxLayout>:\n    Label:\n        id: self\n");
    assertTrue(out.contains("label_1 = Label()"));
    assertTrue(out.contains("self.ids['self'] = label_1"));
  }

  // ============================================================
  // 事件处理器
  // ============================================================

  @Test
  void testChildHandlerSelfIsEventSource() throws Exception {
    String out = generate("<P@BoxLayout>:\n    Button:\n        on_press: self.text = 'pressed'\n");
    assertTrue(out.contains("args[0].text = 'pressed'"));
  }

  @Test
  void testRuleHandlerUsesRunningApp() throws Exception {
    String out = generate("<Q@Label>:\n    on_touch_down: app.stop()\n");
    assertTrue(out.contains("App.get_running_app().stop()"));
    assertTrue(out.contains("from kivy.app import App"));
    assertTrue(out.contains("self.bind(on_touch_down=self._on_touch_down_1)"));
  }

  @Test
  void testHandlerMultipleStatementsAndFallback() throws Exception {
    String source = """
        <H@Button>:
            on_release:
                print('a')
                for x in y: pass
        """;
    String out = generate(source);
    assertTrue(out.contains("        print('a')\n        pass\n"), "无法解析的语句降级为 pass");
  }

  // ============================================================
  // 指令
  // ============================================================

  @Test
  void testDirectives() throws Exception {
    String source = """
        #:kivy 2.0.0
        #:import os os
        #:import Window kivy.core.window.Window
        #:import np numpy
        #:set pad 10
        <A@Label>:
            text: 'x'
        """;
    String out = generate(source);
    assertTrue(out.contains("import os\n"));
    assertTrue(out.contains("from kivy.core.window import Window\n"));
    assertTrue(out.contains("import numpy as np\n"));
    assertTrue(out.contains("\npad = 10\n"));
    assertTrue(out.indexOf("pad = 10") < out.indexOf("class A(Label):"), "常量在类定义之前");
  }
}
