package kvlang.compiler.lexer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KvTokenizer 词法分析测试
 */
class KvTokenizerTest {

  private KvTokenizer tokenizer;

  @BeforeEach
  void setUp() {
    tokenizer = new KvTokenizer();
  }

  private List<TokenKind> kinds(String source) throws LexException {
    List<TokenKind> kinds = new ArrayList<>();
    for (Token t : tokenizer.tokenize(source)) kinds.add(t.kind);
    return kinds;
  }

  private static long count(List<TokenKind> kinds, TokenKind kind) {
    return kinds.stream().filter(k -> k == kind).count();
  }

  // ============================================================
  // 缩进
  // ============================================================

  @Test
  void testIndentation_BalancedIndentDedent() throws LexException {
    String source = """
        <MyWidget>:
            Label:
                text: 'a'
                Button:
                    text: 'b'
            size_hint: 1, 1
        """;
    List<TokenKind> kinds = kinds(source);
    assertEquals(count(kinds, TokenKind.INDENT), count(kinds, TokenKind.DEDENT), "INDENT 与 DEDENT 数量应相等");
    assertEquals(3, count(kinds, TokenKind.INDENT));
    assertEquals(TokenKind.EOF, kinds.get(kinds.size() - 1));
  }

  @Test
  void testIndentation_NestingDepthMatchesSource() throws LexException {
    String source = "A:\n  B:\n    c: 1\n  d: 2\ne: 3\n";
    List<Token> tokens = tokenizer.tokenize(source);
    int depth = 0;
    List<Integer> depths = new ArrayList<>();
    boolean lineStart = true;
    for (Token t : tokens) {
      if (t.kind == TokenKind.INDENT) depth++;
      else if (t.kind == TokenKind.DEDENT) depth--;
      else if (t.kind == TokenKind.NEWLINE) lineStart = true;
      else if (lineStart && t.kind != TokenKind.EOF) {
        depths.add(depth);
        lineStart = false;
      }
    }
    assertEquals(List.of(0, 1, 2, 1, 0), depths, "每行的嵌套深度应与源码缩进一致");
  }

  @Test
  void testIndentation_TabCountsAsFourColumns() throws LexException {
    List<TokenKind> kinds = kinds("A:\n\tb: 1\n    c: 2\n");
    assertEquals(1, count(kinds, TokenKind.INDENT), "制表符与 4 个空格属于同一层级");
  }

  @Test
  void testIndentation_NotMultipleOfUnit() {
    LexException e = assertThrows(LexException.class, () -> tokenizer.tokenize("A:\n    B:\n          c: 1\n"));
    assertEquals(LexException.Kind.INVALID_INDENTATION, e.getKind());
    assertEquals(3, e.getLine());
    assertTrue(e.getMessage().contains("invalid indentation"));
  }

  @Test
  void testIndentation_DedentToUnknownLevel() {
    LexException e = assertThrows(LexException.class, () -> tokenizer.tokenize("A:\n    B:\n        c: 1\n      d: 2\n"));
    assertEquals(LexException.Kind.INVALID_INDENTATION, e.getKind());
    assertEquals(4, e.getLine());
  }

  @Test
  void testBlankAndCommentLines_ProduceNoTokens() throws LexException {
    List<TokenKind> kinds = kinds("\n# comment\n\nA:\n\n    # nested comment\n    b: 1\n");
    assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.COLON, TokenKind.NEWLINE,
        TokenKind.INDENT, TokenKind.IDENTIFIER, TokenKind.COLON, TokenKind.NUMBER, TokenKind.NEWLINE,
        TokenKind.DEDENT, TokenKind.EOF), kinds);
  }

  // ============================================================
  // 记号
  // ============================================================

  @Test
  void testDirective_WholeLineToken() throws LexException {
    List<Token> tokens = tokenizer.tokenize("#:import os os\n<A>:\n");
    assertEquals(TokenKind.DIRECTIVE, tokens.get(0).kind);
    assertEquals("#:import os os", tokens.get(0).value);
    assertEquals(TokenKind.NEWLINE, tokens.get(1).kind);
    assertEquals(TokenKind.LANGLE, tokens.get(2).kind);
  }

  @Test
  void testSelectorPunctuation() throws LexException {
    List<TokenKind> kinds = kinds("<-Foo@Bar+Baz,.cls>:\n");
    assertEquals(List.of(TokenKind.LANGLE, TokenKind.MINUS, TokenKind.IDENTIFIER, TokenKind.AT,
        TokenKind.IDENTIFIER, TokenKind.PLUS, TokenKind.IDENTIFIER, TokenKind.COMMA, TokenKind.DOT,
        TokenKind.IDENTIFIER, TokenKind.RANGLE, TokenKind.COLON, TokenKind.NEWLINE, TokenKind.EOF), kinds);
  }

  @Test
  void testCanvasKeyword() throws LexException {
    List<Token> tokens = tokenizer.tokenize("canvas.before:\n");
    assertEquals(TokenKind.CANVAS, tokens.get(0).kind);
    assertEquals(TokenKind.DOT, tokens.get(1).kind);
    assertTrue(tokens.get(2).isIdentifier("before"));
  }

  @Test
  void testStrings_QuotesAndEscapes() throws LexException {
    List<Token> tokens = tokenizer.tokenize("text: 'it\\'s' + \"x\\ty\"\n");
    Token first = tokens.get(2);
    assertEquals(TokenKind.STRING, first.kind);
    assertEquals("it's", first.value);
    assertEquals("'it\\'s'", first.text, "原始文本应保留转义");
    assertEquals("x\ty", tokens.get(4).value);
  }

  @Test
  void testStrings_PrefixAttachedToToken() throws LexException {
    List<Token> tokens = tokenizer.tokenize("text: f'{self.width}' + r'\\d'\n");
    assertEquals("f'{self.width}'", tokens.get(2).text);
    assertEquals("r'\\d'", tokens.get(4).text);
    assertEquals("\\d", tokens.get(4).value, "raw 字符串不处理转义");
  }

  @Test
  void testStrings_TripleQuotedSpansLines() throws LexException {
    List<Token> tokens = tokenizer.tokenize("text: '''a\nb'''\nx: 1\n");
    Token s = tokens.get(2);
    assertEquals(TokenKind.STRING, s.kind);
    assertEquals("a\nb", s.value);
    assertEquals(1, s.line);
    assertEquals(3, tokens.get(4).line, "多行字符串之后的行号应继续递增");
  }

  @Test
  void testStrings_Unterminated() {
    LexException e = assertThrows(LexException.class, () -> tokenizer.tokenize("a: 1\ntext: 'oops\n"));
    assertEquals(LexException.Kind.UNTERMINATED_STRING, e.getKind());
    assertEquals(2, e.getLine());
  }

  @Test
  void testNumbers() throws LexException {
    List<Token> tokens = tokenizer.tokenize("v: 0x1F 3.14 1e-3 2j 10\n");
    assertEquals("0x1F", tokens.get(2).text);
    assertEquals("3.14", tokens.get(3).text);
    assertEquals("1e-3", tokens.get(4).text);
    assertEquals("2j", tokens.get(5).text);
    assertEquals("10", tokens.get(6).text);
    for (int i = 2; i <= 6; i++) assertEquals(TokenKind.NUMBER, tokens.get(i).kind);
  }

  @Test
  void testInlineComment() throws LexException {
    List<Token> tokens = tokenizer.tokenize("size: 10  # pixels\n");
    assertEquals(TokenKind.COMMENT, tokens.get(3).kind);
    assertEquals("pixels", tokens.get(3).value);
  }

  @Test
  void testBackslashContinuation() throws LexException {
    List<TokenKind> kinds = kinds("v: 1 + \\\n    2\n");
    assertEquals(1, count(kinds, TokenKind.NEWLINE), "续行不产生 NEWLINE");
    assertEquals(0, count(kinds, TokenKind.INDENT), "续行不参与缩进处理");
  }

  @Test
  void testOperatorsAreSingleCharacters() throws LexException {
    List<Token> tokens = tokenizer.tokenize("v: a >= b\n");
    assertEquals(TokenKind.RANGLE, tokens.get(3).kind);
    assertEquals(TokenKind.OPERATOR, tokens.get(4).kind);
    assertTrue(tokens.get(3).touches(tokens.get(4)));
  }

  @Test
  void testEmptySource() throws LexException {
    assertEquals(List.of(TokenKind.EOF), kinds(""));
  }

  // ============================================================
  // 记号描述
  // ============================================================

  @Test
  void testDescribe_IndependentOfDefaultLocale() {
    Locale previous = Locale.getDefault();
    try {
      Locale.setDefault(new Locale("tr", "TR"));
      Token token = new Token(TokenKind.IDENTIFIER, "title", "title", 1, 0, 5);
      assertEquals("identifier 'title'", token.describe(), "土耳其语环境下记号描述仍应使用 ASCII 小写");
    } finally {
      Locale.setDefault(previous);
    }
  }
}
