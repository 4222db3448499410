package kvlang.compiler.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ErrorMessages 双语消息测试
 */
class ErrorMessagesTest {

  @Test
  void testBilingual() {
    assertEquals("中文 (English)", ErrorMessages.bilingual("中文", "English"));
  }

  @Test
  void testWithHint() {
    String message = ErrorMessages.withHint("消息", "提示内容", "hint text");
    assertTrue(message.startsWith("消息\n"));
    assertTrue(message.endsWith("(Hint: hint text)"));
  }

  @Test
  void testKeywordsStable() {
    assertTrue(ErrorMessages.invalidIndentation(3, 3, 4).contains("invalid indentation at line 3"));
    assertTrue(ErrorMessages.unmatchedDedent(5, 2).contains("matches no enclosing level"));
    assertTrue(ErrorMessages.unterminatedString(7).contains("unterminated string starting at line 7"));
    assertTrue(ErrorMessages.unexpectedToken("':'", "NEWLINE", 2).contains("expected ':', got NEWLINE"));
    assertTrue(ErrorMessages.syntaxError("缺少冒号", "missing colon", 9).contains("syntax error at line 9: missing colon"));
  }

  @Test
  void testConfigDefaults() {
    assertTrue(KvConfig.INDENT_WIDTH > 0, "缩进宽度必须为正数");
    assertNotNull(KvConfig.DEFAULT_BASE);
    assertNotNull(KvConfig.PARSE_MODE);
  }

  @Test
  void testConfigDebugFollowsEnvironment() {
    assertEquals(System.getenv("KV_DEBUG") != null, KvConfig.DEBUG, "DEBUG 只由 KV_DEBUG 是否设置决定");
  }
}
