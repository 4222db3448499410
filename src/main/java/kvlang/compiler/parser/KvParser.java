package kvlang.compiler.parser;

import kvlang.compiler.ast.KvModel;
import kvlang.compiler.ast.KvModel.Canvas;
import kvlang.compiler.ast.KvModel.CanvasInstruction;
import kvlang.compiler.ast.KvModel.CanvasLayer;
import kvlang.compiler.ast.KvModel.Directive;
import kvlang.compiler.ast.KvModel.Property;
import kvlang.compiler.ast.KvModel.Rule;
import kvlang.compiler.ast.KvModel.Selector;
import kvlang.compiler.ast.KvModel.Template;
import kvlang.compiler.ast.KvModel.Widget;
import kvlang.compiler.lexer.Token;
import kvlang.compiler.lexer.TokenKind;
import kvlang.compiler.runtime.ErrorMessages;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * KV 递归下降语法分析器
 * <p>
 * 文法（非正式）：
 * <pre>
 * module   := directive* (rule | template | widget)*
 * rule     := '&lt;' '-'? selector '&gt;' ':'? NEWLINE (INDENT body DEDENT)?
 * selector := item (',' item)*      item := '-'? ('.' ident | ident ('@' ident ('+' ident)*)?)
 * template := '[' ident '@' ident ('+' ident)* ']' ':' NEWLINE INDENT body DEDENT
 * widget   := ident ':' NEWLINE (INDENT body DEDENT)?
 * body     := (canvas_block | property | widget)*
 * </pre>
 * 主体内 {@code ident ':'} 以大写字母开头时为子控件，否则为属性；{@code on_} 开头的属性是事件处理器。
 * <p>
 * 每个实例对应一份记号流；解析状态只在一次解析调用内有效。
 */
public final class KvParser {

  private static final Logger LOGGER = Logger.getLogger(KvParser.class.getName());

  private static final Set<String> KEYWORDS = Set.of(
      "and", "or", "not", "in", "is", "if", "else", "elif", "return", "lambda",
      "for", "while", "yield", "assert", "del", "await", "import", "from", "as");

  private final List<Token> tokens;
  /** depth[i] 为第 i 个记号之前 INDENT 与 DEDENT 的净数量。 */
  private final int[] depth;
  private int current;

  public KvParser(List<Token> tokens) {
    if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind != TokenKind.EOF) {
      List<Token> terminated = new ArrayList<>(tokens);
      int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line;
      terminated.add(new Token(TokenKind.EOF, "", "", line, 0, 0));
      tokens = terminated;
    }
    this.tokens = List.copyOf(tokens);
    this.depth = new int[this.tokens.size()];
    int level = 0;
    for (int i = 0; i < this.tokens.size(); i++) {
      depth[i] = level;
      TokenKind k = this.tokens.get(i).kind;
      if (k == TokenKind.INDENT) level++;
      else if (k == TokenKind.DEDENT) level = Math.max(0, level - 1);
    }
  }

  /**
   * 严格模式解析，遇到第一个错误即抛出。
   *
   * @return 完整模块
   * @throws ParseException 语法错误
   */
  public KvModel.Module parse() throws ParseException {
    return parseModule(null);
  }

  /**
   * 按指定模式解析。
   * <p>
   * STRICT 模式下错误仍以异常形式抛出；TOLERANT 模式下记录每个错误，跳到下一个同步点
   * （位于行首且缩进层级为 0 的 {@code <}、{@code [} 或标识符）后继续解析顶层结构。
   */
  public ParseResult parseWithRecovery(ParserMode mode) throws ParseException {
    if (mode == ParserMode.STRICT) {
      return new ParseResult(parse(), List.of());
    }
    List<ParsingError> errors = new ArrayList<>();
    KvModel.Module module = parseModule(errors);
    if (!errors.isEmpty()) {
      LOGGER.log(Level.FINE, "tolerant parse recovered from {0} error(s)", errors.size());
    }
    return new ParseResult(module, errors);
  }

  // ==================== 模块 ====================

  private KvModel.Module parseModule(List<ParsingError> errors) throws ParseException {
    current = 0;
    List<Directive> directives = new ArrayList<>();
    List<Rule> rules = new ArrayList<>();
    List<Template> templates = new ArrayList<>();
    Map<String, List<String>> dynamicClasses = new LinkedHashMap<>();
    Widget root = null;

    while (!isAtEnd()) {
      Token token = peek();
      int start = current;
      try {
        switch (token.kind) {
          case NEWLINE, COMMENT, DEDENT -> advance();
          case DIRECTIVE -> {
            directives.add(parseDirective(token));
            advance();
          }
          case LANGLE -> rules.add(parseRule(dynamicClasses));
          case LBRACKET -> templates.add(parseTemplate());
          case IDENTIFIER -> {
            if (root != null) {
              throw new ParseException(ParseException.Kind.SYNTAX_ERROR, ErrorKind.UNEXPECTED_TOKEN,
                  ErrorMessages.syntaxError("一个 KV 文件只允许一个根控件", "only one root widget allowed", token.line),
                  token.line, token.column,
                  "Remove extra root widget or convert to a rule with <WidgetName>:");
            }
            root = parseWidget(0);
          }
          default -> throw unexpected("rule selector (<...>), template ([...]) or widget name", token);
        }
      } catch (ParseException e) {
        if (errors == null) {
          throw e;
        }
        errors.add(ParsingError.from(e));
        synchronize(start);
      }
    }
    return new KvModel.Module(directives, rules, templates, root, dynamicClasses);
  }

  private void synchronize(int constructStart) {
    if (current == constructStart && !isAtEnd()) {
      advance();
    }
    while (!isAtEnd()) {
      Token t = peek();
      boolean anchor = t.kind == TokenKind.LANGLE || t.kind == TokenKind.LBRACKET || t.kind == TokenKind.IDENTIFIER;
      if (anchor && depth[current] == 0 && isLineStart(current)) {
        return;
      }
      advance();
    }
  }

  private boolean isLineStart(int index) {
    if (index == 0) {
      return true;
    }
    TokenKind prev = tokens.get(index - 1).kind;
    return prev == TokenKind.NEWLINE || prev == TokenKind.INDENT || prev == TokenKind.DEDENT;
  }

  // ==================== 指令 ====================

  /**
   * 解析指令行，例如 {@code #:import os os}、{@code #:set pad 10}、{@code #:include force a.kv}。
   */
  Directive parseDirective(Token token) throws ParseException {
    int line = token.line;
    String content = token.value.substring(2).strip();
    String[] parts = content.split("\\s+", 3);
    String command = parts[0];
    switch (command) {
      case "kivy" -> {
        if (parts.length >= 2) return new KvModel.Kivy(parts[1], line);
      }
      case "import" -> {
        if (parts.length >= 3) return new KvModel.Import(parts[1], parts[2].strip(), line);
      }
      case "set" -> {
        if (parts.length >= 3) return new KvModel.Set(parts[1], parts[2].strip(), line);
      }
      case "include" -> {
        boolean force = false;
        String path = null;
        if (parts.length >= 3 && parts[1].equals("force")) {
          force = true;
          path = parts[2].strip();
        } else if (parts.length >= 2) {
          path = parts.length == 3 ? parts[1] + " " + parts[2] : parts[1];
        }
        if (path != null) return new KvModel.Include(stripQuotes(path), force, line);
      }
      default -> throw new ParseException(ParseException.Kind.SYNTAX_ERROR, ErrorKind.INVALID_DIRECTIVE,
          ErrorMessages.syntaxError("未知指令 #:" + command, "unknown directive #:" + command, line),
          line, token.column, "Supported directives: #:kivy, #:import, #:set, #:include");
    }
    throw new ParseException(ParseException.Kind.SYNTAX_ERROR, ErrorKind.INVALID_DIRECTIVE,
        ErrorMessages.syntaxError("指令格式无效：" + token.value, "invalid directive format: " + token.value, line),
        line, token.column, "Check the number of directive arguments");
  }

  // ==================== 规则与模板 ====================

  private Rule parseRule(Map<String, List<String>> dynamicClasses) throws ParseException {
    Token start = expect(TokenKind.LANGLE, "'<'");
    boolean[] avoid = new boolean[1];
    Selector selector = parseSelector(avoid, dynamicClasses);
    expect(TokenKind.RANGLE, "'>'");
    if (check(TokenKind.COLON)) {
      advance();
    }
    endOfHeader();
    BodyBuilder body = new BodyBuilder();
    if (check(TokenKind.INDENT)) {
      advance();
      parseBody(body, 1);
      closeBlock();
    }
    return body.toRule(selector, avoid[0], start.line);
  }

  private Selector parseSelector(boolean[] avoid, Map<String, List<String>> dynamicClasses) throws ParseException {
    List<Selector> items = new ArrayList<>();
    do {
      if (check(TokenKind.MINUS)) {
        advance();
        avoid[0] = true;
      }
      if (check(TokenKind.DOT)) {
        advance();
        items.add(new KvModel.ClassName(expectSelectorName("class name")));
      } else {
        String name = expectSelectorName("selector name");
        if (check(TokenKind.AT)) {
          advance();
          List<String> bases = parseBaseList();
          items.add(new KvModel.DynamicClass(name, bases));
          dynamicClasses.put(name, bases);
        } else {
          items.add(new KvModel.Name(name));
        }
      }
    } while (match(TokenKind.COMMA));
    return items.size() == 1 ? items.get(0) : new KvModel.Multiple(items);
  }

  private List<String> parseBaseList() throws ParseException {
    List<String> bases = new ArrayList<>();
    bases.add(expectSelectorName("base class name"));
    while (match(TokenKind.PLUS)) {
      bases.add(expectSelectorName("base class name"));
    }
    return bases;
  }

  private String expectSelectorName(String what) throws ParseException {
    Token t = peek();
    if (t.kind != TokenKind.IDENTIFIER) {
      throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, ErrorKind.INVALID_SELECTOR,
          ErrorMessages.unexpectedToken(what, t.describe(), t.line), t.line, t.column,
          "Selectors look like <Name>, <.class>, <A,B> or <Name@Base+Base>");
    }
    advance();
    return t.value;
  }

  private Template parseTemplate() throws ParseException {
    Token start = expect(TokenKind.LBRACKET, "'['");
    String name = expectSelectorName("template name");
    expect(TokenKind.AT, "'@'");
    List<String> bases = parseBaseList();
    expect(TokenKind.RBRACKET, "']'");
    expect(TokenKind.COLON, "':'");
    endOfHeader();
    if (!check(TokenKind.INDENT)) {
      Token t = peek();
      throw new ParseException(ParseException.Kind.SYNTAX_ERROR, ErrorKind.MISSING_TOKEN,
          ErrorMessages.syntaxError("模板主体必须缩进", "template body must be indented", t.line),
          t.line, t.column, "Indent the template body under [" + name + "@...]:");
    }
    advance();
    BodyBuilder body = new BodyBuilder();
    parseBody(body, 1);
    closeBlock();
    Rule rule = body.toRule(new KvModel.Name(name), false, start.line);
    return new Template(name, bases, rule, start.line);
  }

  // ==================== 控件与主体 ====================

  private Widget parseWidget(int level) throws ParseException {
    Token nameToken = advance();
    expect(TokenKind.COLON, "':'");
    endOfHeader();
    BodyBuilder body = new BodyBuilder();
    if (check(TokenKind.INDENT)) {
      advance();
      parseBody(body, level + 1);
      closeBlock();
    }
    return body.toWidget(nameToken.value, level, nameToken.line);
  }

  private void parseBody(BodyBuilder body, int childLevel) throws ParseException {
    while (true) {
      Token t = peek();
      switch (t.kind) {
        case DEDENT, EOF -> {
          return;
        }
        case NEWLINE, COMMENT -> advance();
        case CANVAS -> parseCanvasBlock(body);
        case IDENTIFIER -> {
          Token next = peekAt(1);
          if (next.kind != TokenKind.COLON) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, ErrorKind.INVALID_PROPERTY,
                ErrorMessages.unexpectedToken("':' after '" + t.value + "'", next.describe(), next.line),
                next.line, next.column, "Write properties as 'name: value' and children as 'Widget:'");
          }
          if (Character.isUpperCase(t.value.charAt(0))) {
            body.children.add(parseWidget(childLevel));
          } else {
            Property property = parseProperty();
            if (property.isEventHandler()) body.handlers.add(property);
            else body.properties.add(property);
          }
        }
        default -> throw unexpected("property, child widget or canvas block", t);
      }
    }
  }

  private void parseCanvasBlock(BodyBuilder body) throws ParseException {
    Token start = advance();
    CanvasLayer layer = CanvasLayer.MAIN;
    if (match(TokenKind.DOT)) {
      Token modifier = peek();
      if (modifier.isIdentifier("before")) layer = CanvasLayer.BEFORE;
      else if (modifier.isIdentifier("after")) layer = CanvasLayer.AFTER;
      else throw new ParseException(ParseException.Kind.SYNTAX_ERROR, ErrorKind.UNEXPECTED_TOKEN,
            ErrorMessages.syntaxError("未知画布层 canvas." + modifier.text, "unknown canvas layer canvas." + modifier.text, modifier.line),
            modifier.line, modifier.column, "Use canvas, canvas.before or canvas.after");
      advance();
    }
    expect(TokenKind.COLON, "':'");
    endOfHeader();
    List<CanvasInstruction> instructions = new ArrayList<>();
    if (check(TokenKind.INDENT)) {
      advance();
      while (!check(TokenKind.DEDENT) && !isAtEnd()) {
        Token t = peek();
        if (t.kind == TokenKind.NEWLINE || t.kind == TokenKind.COMMENT) {
          advance();
        } else if (t.kind == TokenKind.IDENTIFIER) {
          instructions.add(parseCanvasInstruction());
        } else {
          throw unexpected("canvas instruction", t);
        }
      }
      closeBlock();
    }
    body.addCanvas(layer, instructions, start.line);
  }

  private CanvasInstruction parseCanvasInstruction() throws ParseException {
    Token name = advance();
    match(TokenKind.COLON);
    endOfHeader();
    List<Property> properties = new ArrayList<>();
    if (check(TokenKind.INDENT)) {
      advance();
      while (!check(TokenKind.DEDENT) && !isAtEnd()) {
        Token t = peek();
        if (t.kind == TokenKind.NEWLINE || t.kind == TokenKind.COMMENT) {
          advance();
        } else if (t.kind == TokenKind.IDENTIFIER && peekAt(1).kind == TokenKind.COLON) {
          properties.add(parseProperty());
        } else {
          throw unexpected("instruction property", t);
        }
      }
      closeBlock();
    }
    return new CanvasInstruction(name.value, properties, name.line);
  }

  // ==================== 属性 ====================

  private Property parseProperty() throws ParseException {
    Token name = advance();
    expect(TokenKind.COLON, "':'");
    List<Token> first = collectLine();
    StringBuilder raw = new StringBuilder(reconstruct(first));
    if (check(TokenKind.NEWLINE)) {
      advance();
      if (check(TokenKind.INDENT)) {
        advance();
        int nested = 0;
        while (!isAtEnd()) {
          Token t = peek();
          if (t.kind == TokenKind.NEWLINE || t.kind == TokenKind.COMMENT) {
            advance();
          } else if (t.kind == TokenKind.INDENT) {
            nested++;
            advance();
          } else if (t.kind == TokenKind.DEDENT) {
            advance();
            if (nested == 0) break;
            nested--;
          } else {
            String text = reconstruct(collectLine());
            if (raw.length() > 0) raw.append('\n');
            raw.append("    ".repeat(nested)).append(text);
          }
        }
      }
    }
    return Property.parsed(name.value, raw.toString(), name.line);
  }

  /** 收集到行尾为止的值记号，跳过注释。 */
  private List<Token> collectLine() {
    List<Token> line = new ArrayList<>();
    while (!isAtEnd()) {
      Token t = peek();
      if (t.kind == TokenKind.NEWLINE || t.kind == TokenKind.DEDENT || t.kind == TokenKind.INDENT) break;
      if (t.kind != TokenKind.COMMENT) line.add(t);
      advance();
    }
    return line;
  }

  /**
   * 以确定的空白规则把记号重新拼成表达式文本：
   * {@code .}、左括号与一元负号之后不加空格；{@code . , : ) ]} 以及调用/下标位置的括号之前不加空格；
   * 源码中紧贴的运算符字符（{@code >=}、{@code ==}、{@code **}）保持相连；其余位置用单个空格分隔。
   */
  static String reconstruct(List<Token> line) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < line.size(); i++) {
      Token t = line.get(i);
      if (i > 0 && needsSpace(i >= 2 ? line.get(i - 2) : null, line.get(i - 1), t)) {
        sb.append(' ');
      }
      sb.append(t.text);
    }
    return sb.toString();
  }

  private static boolean needsSpace(Token beforePrev, Token prev, Token t) {
    if (prev.kind.isGlyph() && t.kind.isGlyph() && prev.touches(t)) return false;
    if (prev.kind == TokenKind.DOT || t.kind == TokenKind.DOT) return false;
    if (isOpening(prev)) return false;
    if (isClosing(t) || t.kind == TokenKind.COMMA || t.kind == TokenKind.COLON) return false;
    if (t.kind == TokenKind.LPAREN || t.kind == TokenKind.LBRACKET) {
      if ((prev.kind == TokenKind.IDENTIFIER && !KEYWORDS.contains(prev.value))
          || prev.kind == TokenKind.STRING || isClosing(prev)) {
        return false;
      }
    }
    if ((prev.kind == TokenKind.MINUS || prev.kind == TokenKind.PLUS || prev.text.equals("~"))
        && isUnaryPosition(beforePrev)) {
      return false;
    }
    return true;
  }

  private static boolean isOpening(Token t) {
    return t.kind == TokenKind.LPAREN || t.kind == TokenKind.LBRACKET || t.text.equals("{") && t.kind == TokenKind.OPERATOR;
  }

  private static boolean isClosing(Token t) {
    return t.kind == TokenKind.RPAREN || t.kind == TokenKind.RBRACKET || t.text.equals("}") && t.kind == TokenKind.OPERATOR;
  }

  private static boolean isUnaryPosition(Token before) {
    if (before == null) return true;
    if (before.kind == TokenKind.IDENTIFIER) return KEYWORDS.contains(before.value);
    if (isClosing(before)) return false;
    return before.kind.isGlyph() || isOpening(before)
        || before.kind == TokenKind.COMMA || before.kind == TokenKind.COLON;
  }

  // ==================== 辅助方法 ====================

  /** 结构头（规则、控件、画布）之后只允许注释，然后是换行。 */
  private void endOfHeader() throws ParseException {
    match(TokenKind.COMMENT);
    if (check(TokenKind.NEWLINE)) {
      advance();
    } else if (!isAtEnd()) {
      throw unexpected("end of line", peek());
    }
  }

  private void closeBlock() throws ParseException {
    if (check(TokenKind.DEDENT)) {
      advance();
    } else if (!isAtEnd()) {
      throw unexpected("DEDENT", peek());
    }
  }

  private static String stripQuotes(String s) {
    if (s.length() >= 2 && ((s.startsWith("'") && s.endsWith("'")) || (s.startsWith("\"") && s.endsWith("\"")))) {
      return s.substring(1, s.length() - 1);
    }
    return s;
  }

  private ParseException unexpected(String expected, Token t) {
    return new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, ErrorKind.UNEXPECTED_TOKEN,
        ErrorMessages.unexpectedToken(expected, t.describe(), t.line), t.line, t.column,
        "Check syntax near this token");
  }

  private Token expect(TokenKind kind, String what) throws ParseException {
    Token t = peek();
    if (t.kind != kind) {
      throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, ErrorKind.MISSING_TOKEN,
          ErrorMessages.unexpectedToken(what, t.describe(), t.line), t.line, t.column,
          "Insert " + what);
    }
    return advance();
  }

  private boolean match(TokenKind kind) {
    if (check(kind)) {
      advance();
      return true;
    }
    return false;
  }

  private boolean check(TokenKind kind) {
    return peek().kind == kind;
  }

  private Token peek() {
    return tokens.get(Math.min(current, tokens.size() - 1));
  }

  private Token peekAt(int offset) {
    return tokens.get(Math.min(current + offset, tokens.size() - 1));
  }

  private Token advance() {
    Token t = peek();
    if (current < tokens.size() - 1) current++;
    return t;
  }

  private boolean isAtEnd() {
    return peek().kind == TokenKind.EOF;
  }

  /** 规则与控件主体的可变收集器，解析结束后冻结为不可变节点。 */
  private static final class BodyBuilder {
    final List<Property> properties = new ArrayList<>();
    final List<Property> handlers = new ArrayList<>();
    final List<Widget> children = new ArrayList<>();
    Canvas before;
    Canvas main;
    Canvas after;

    void addCanvas(CanvasLayer layer, List<CanvasInstruction> instructions, int line) {
      Canvas existing = switch (layer) {
        case BEFORE -> before;
        case MAIN -> main;
        case AFTER -> after;
      };
      Canvas merged;
      if (existing == null) {
        merged = new Canvas(layer, instructions, line);
      } else {
        List<CanvasInstruction> all = new ArrayList<>(existing.instructions);
        all.addAll(instructions);
        merged = new Canvas(layer, all, existing.line);
      }
      switch (layer) {
        case BEFORE -> before = merged;
        case MAIN -> main = merged;
        case AFTER -> after = merged;
      }
    }

    Rule toRule(Selector selector, boolean avoidPrevious, int line) {
      return new Rule(selector, avoidPrevious, properties, handlers, before, main, after, children, line);
    }

    Widget toWidget(String name, int level, int line) {
      String id = null;
      List<Property> remaining = new ArrayList<>(properties.size());
      for (Property p : properties) {
        if (p.name.equals("id")) {
          id = stripQuotes(p.rawValue.strip());
        } else {
          remaining.add(p);
        }
      }
      return new Widget(name, id, remaining, handlers, before, main, after, children, level, line);
    }
  }
}
