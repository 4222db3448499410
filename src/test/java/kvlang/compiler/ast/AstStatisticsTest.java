package kvlang.compiler.ast;

import kvlang.compiler.lexer.KvTokenizer;
import kvlang.compiler.parser.KvParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 语法树访问者测试：统计与各类收集器
 */
class AstStatisticsTest {

  private KvModel.Module module;

  @BeforeEach
  void setUp() throws Exception {
    String source = """
        #:set pad 10
        <Card@BoxLayout>:
            padding: pad
            on_press: print('x')
            canvas:
                Color:
                    rgb: 1, 1, 1
            Label:
                text: 'a'
                Image:
                    source: 'b.png'
        <.small,Button>:
            font_size: 12
        [Item@Label]:
            text: ctx.text
        GridLayout:
            cols: 2
            Card:
        """;
    module = new KvParser(new KvTokenizer().tokenize(source)).parse();
  }

  @Test
  void testStatistics() {
    AstStatistics stats = AstStatistics.of(module);
    assertEquals(1, stats.getDirectiveCount());
    assertEquals(3, stats.getRuleCount());
    assertEquals(1, stats.getTemplateCount());
    assertEquals(4, stats.getWidgetCount(), "Label、Image、根 GridLayout 与 Card");
    // padding, on_press, rgb, text, source, font_size, text, cols
    assertEquals(8, stats.getPropertyCount());
    assertEquals(1, stats.getCanvasInstructionCount());
    assertTrue(stats.summary().contains("Rules: 3"));
  }

  @Test
  void testPropertyNameCollector_PreOrder() {
    PropertyNameCollector collector = new PropertyNameCollector();
    collector.visitModule(module);
    assertEquals(List.of("padding", "on_press", "rgb", "text", "source", "font_size", "text", "cols"),
        collector.getPropertyNames());
  }

  @Test
  void testWidgetNameCollector() {
    WidgetNameCollector collector = new WidgetNameCollector();
    collector.visitModule(module);
    assertEquals(List.of("Label", "Image", "GridLayout", "Card"), collector.getWidgetNames());
  }

  @Test
  void testSelectorCollector() {
    SelectorCollector collector = new SelectorCollector();
    collector.visitModule(module);
    assertEquals(List.of("Card@BoxLayout", ".small,Button", "Item"), collector.getSelectors());
  }

  @Test
  void testEmptyModule() {
    AstStatistics stats = AstStatistics.of(KvModel.Module.empty());
    assertEquals(0, stats.getRuleCount());
    assertEquals(0, stats.getWidgetCount());
  }
}
