package kvlang.compiler.py;

import kvlang.compiler.py.PyModel.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Python 表达式递归下降解析器
 * <p>
 * 覆盖完整的表达式优先级层级：lambda、条件表达式、布尔运算、比较、位运算、算术、一元运算、幂、
 * 以及属性访问、调用（含关键字参数与 {@code *}/{@code **} 展开）、下标与切片、推导式和 f-string。
 * <p>
 * 语句只支持事件处理器中常见的形式：表达式语句、赋值（可链式）、增量赋值与 {@code pass}。
 * 这是有意的范围限制；其余语句抛出 {@link PyParseException}，由调用方降级处理。
 */
public final class PyParser {

  private static final Set<String> RESERVED = Set.of(
      "and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del", "elif", "else",
      "except", "finally", "for", "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not",
      "or", "pass", "raise", "return", "try", "while", "with", "yield");

  private static final Set<String> COMPARE_OPS = Set.of("<", ">", "==", ">=", "<=", "!=");
  private static final Set<String> AUG_OPS = Set.of(
      "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");

  private final List<PyToken> tokens;
  private int current;

  private PyParser(List<PyToken> tokens) {
    this.tokens = tokens;
  }

  // ==================== 入口 ====================

  /**
   * 解析单个表达式；顶层逗号产生元组（例如 {@code 1, 0, 0, 1}）。
   */
  public static Expr parseExpression(String text) throws PyParseException {
    PyParser parser = new PyParser(filter(PyLexer.tokenize(text), true));
    if (parser.peek().kind == PyToken.Kind.EOF) {
      throw new PyParseException("empty expression", 0);
    }
    Expr e = parser.parseTestList();
    parser.expectEnd();
    return e;
  }

  /** 解析单条语句。 */
  public static Stmt parseStatement(String text) throws PyParseException {
    PyParser parser = new PyParser(filter(PyLexer.tokenize(text), true));
    Stmt s = parser.parseSimpleStatement();
    parser.expectEnd();
    return s;
  }

  /**
   * 解析语句块，任一语句失败即整体失败。
   */
  public static List<Stmt> parseStatements(String code) throws PyParseException {
    List<Stmt> result = new ArrayList<>();
    for (String piece : splitStatements(code)) {
      result.add(parseStatement(piece));
    }
    return result;
  }

  /**
   * 按顶层换行与分号把代码切分为语句文本，括号内部的换行与分号不切分。
   */
  public static List<String> splitStatements(String code) {
    List<String> pieces = new ArrayList<>();
    int start = -1;
    int depth = 0;
    for (PyToken t : PyLexer.tokenizeLenient(code)) {
      if (t.kind == PyToken.Kind.OP) {
        if (t.text.equals("(") || t.text.equals("[") || t.text.equals("{")) depth++;
        else if (t.text.equals(")") || t.text.equals("]") || t.text.equals("}")) depth = Math.max(0, depth - 1);
      }
      boolean separator = t.kind == PyToken.Kind.NEWLINE || t.kind == PyToken.Kind.EOF
          || t.kind == PyToken.Kind.COMMENT || (depth == 0 && t.isOp(";"));
      if (separator) {
        if (start >= 0) {
          String piece = code.substring(start, t.offset).strip();
          if (!piece.isEmpty()) pieces.add(piece);
          start = -1;
        }
      } else if (start < 0) {
        start = t.offset;
      }
    }
    return pieces;
  }

  /**
   * 提取 f-string 正文中每个 {@code {...}} 插值槽的表达式文本（不含转换符与格式说明），转义的双花括号不算插值槽。
   * 格式说明中嵌套的插值槽（{@code {x:>{width}}}）按出现顺序追加。
   */
  public static List<String> fStringSlots(String rawBody) {
    List<String> slots = new ArrayList<>();
    for (Object part : splitFString(rawBody)) {
      if (part instanceof String[] slot) {
        slots.add(slot[0]);
        if (slot[2] != null) slots.addAll(fStringSlots(slot[2]));
      }
    }
    return slots;
  }

  private static List<PyToken> filter(List<PyToken> raw, boolean dropNewlines) {
    List<PyToken> out = new ArrayList<>(raw.size());
    for (PyToken t : raw) {
      if (t.kind == PyToken.Kind.COMMENT) continue;
      if (dropNewlines && t.kind == PyToken.Kind.NEWLINE) continue;
      out.add(t);
    }
    return out;
  }

  // ==================== 语句 ====================

  private Stmt parseSimpleStatement() throws PyParseException {
    if (peek().isName("pass")) {
      advance();
      return Pass.INSTANCE;
    }
    Expr first = parseTestList();
    if (peek().isOp("=")) {
      List<Expr> targets = new ArrayList<>();
      targets.add(checkTarget(first));
      advance();
      Expr value = parseTestList();
      while (peek().isOp("=")) {
        advance();
        targets.add(checkTarget(value));
        value = parseTestList();
      }
      return new Assign(targets, value);
    }
    PyToken t = peek();
    if (t.kind == PyToken.Kind.OP && AUG_OPS.contains(t.text)) {
      advance();
      Expr target = checkTarget(first);
      if (target instanceof Tuple) {
        throw new PyParseException("illegal target for augmented assignment", t.offset);
      }
      return new AugAssign(target, t.text.substring(0, t.text.length() - 1), parseTestList());
    }
    return new ExprStmt(first);
  }

  private Expr checkTarget(Expr e) throws PyParseException {
    if (e instanceof Name || e instanceof Attribute || e instanceof Subscript) {
      return e;
    }
    if (e instanceof Tuple tuple) {
      for (Expr elt : tuple.elts) checkTarget(elt);
      return e;
    }
    if (e instanceof ListExpr list) {
      for (Expr elt : list.elts) checkTarget(elt);
      return e;
    }
    if (e instanceof Starred s) {
      checkTarget(s.value);
      return e;
    }
    throw new PyParseException("cannot assign to expression", peek().offset);
  }

  // ==================== 表达式 ====================

  private Expr parseTestList() throws PyParseException {
    Expr first = parseTestOrStar();
    if (!peek().isOp(",")) {
      return first;
    }
    List<Expr> elts = new ArrayList<>();
    elts.add(first);
    while (match(",")) {
      if (!canStartExpression(peek())) break;
      elts.add(parseTestOrStar());
    }
    return new Tuple(elts);
  }

  private Expr parseTestOrStar() throws PyParseException {
    if (peek().isOp("*")) {
      advance();
      return new Starred(parseBitOr());
    }
    return parseTest();
  }

  private Expr parseTest() throws PyParseException {
    if (peek().isName("lambda")) {
      return parseLambda();
    }
    Expr body = parseOrTest();
    if (peek().isName("if")) {
      advance();
      Expr test = parseOrTest();
      expectName("else");
      Expr orelse = parseTest();
      return new IfExp(test, body, orelse);
    }
    return body;
  }

  private Expr parseLambda() throws PyParseException {
    expectName("lambda");
    List<Param> params = new ArrayList<>();
    while (!peek().isOp(":")) {
      String prefix = "";
      if (peek().isOp("*") || peek().isOp("**")) {
        prefix = advance().text;
      }
      PyToken name = expectIdentifier();
      Expr def = null;
      if (prefix.isEmpty() && match("=")) {
        def = parseTest();
      }
      params.add(new Param(prefix, name.text, def));
      if (!match(",")) break;
    }
    expectOp(":");
    return new Lambda(params, parseTest());
  }

  private Expr parseOrTest() throws PyParseException {
    Expr first = parseAndTest();
    if (!peek().isName("or")) return first;
    List<Expr> values = new ArrayList<>();
    values.add(first);
    while (peek().isName("or")) {
      advance();
      values.add(parseAndTest());
    }
    return new BoolOp("or", values);
  }

  private Expr parseAndTest() throws PyParseException {
    Expr first = parseNotTest();
    if (!peek().isName("and")) return first;
    List<Expr> values = new ArrayList<>();
    values.add(first);
    while (peek().isName("and")) {
      advance();
      values.add(parseNotTest());
    }
    return new BoolOp("and", values);
  }

  private Expr parseNotTest() throws PyParseException {
    if (peek().isName("not")) {
      advance();
      return new UnaryOp("not", parseNotTest());
    }
    return parseComparison();
  }

  private Expr parseComparison() throws PyParseException {
    Expr left = parseBitOr();
    List<String> ops = new ArrayList<>();
    List<Expr> comparators = new ArrayList<>();
    while (true) {
      PyToken t = peek();
      String op;
      if (t.kind == PyToken.Kind.OP && COMPARE_OPS.contains(t.text)) {
        advance();
        op = t.text;
      } else if (t.isName("in")) {
        advance();
        op = "in";
      } else if (t.isName("not") && peekAt(1).isName("in")) {
        advance();
        advance();
        op = "not in";
      } else if (t.isName("is")) {
        advance();
        op = "is";
        if (peek().isName("not")) {
          advance();
          op = "is not";
        }
      } else {
        break;
      }
      ops.add(op);
      comparators.add(parseBitOr());
    }
    return ops.isEmpty() ? left : new Compare(left, ops, comparators);
  }

  private Expr parseBitOr() throws PyParseException {
    Expr left = parseBitXor();
    while (peek().isOp("|")) {
      advance();
      left = new BinOp(left, "|", parseBitXor());
    }
    return left;
  }

  private Expr parseBitXor() throws PyParseException {
    Expr left = parseBitAnd();
    while (peek().isOp("^")) {
      advance();
      left = new BinOp(left, "^", parseBitAnd());
    }
    return left;
  }

  private Expr parseBitAnd() throws PyParseException {
    Expr left = parseShift();
    while (peek().isOp("&")) {
      advance();
      left = new BinOp(left, "&", parseShift());
    }
    return left;
  }

  private Expr parseShift() throws PyParseException {
    Expr left = parseArith();
    while (peek().isOp("<<") || peek().isOp(">>")) {
      String op = advance().text;
      left = new BinOp(left, op, parseArith());
    }
    return left;
  }

  private Expr parseArith() throws PyParseException {
    Expr left = parseTerm();
    while (peek().isOp("+") || peek().isOp("-")) {
      String op = advance().text;
      left = new BinOp(left, op, parseTerm());
    }
    return left;
  }

  private Expr parseTerm() throws PyParseException {
    Expr left = parseFactor();
    while (peek().isOp("*") || peek().isOp("/") || peek().isOp("//") || peek().isOp("%") || peek().isOp("@")) {
      String op = advance().text;
      left = new BinOp(left, op, parseFactor());
    }
    return left;
  }

  private Expr parseFactor() throws PyParseException {
    PyToken t = peek();
    if (t.isOp("-") || t.isOp("+") || t.isOp("~")) {
      advance();
      return new UnaryOp(t.text, parseFactor());
    }
    return parsePower();
  }

  private Expr parsePower() throws PyParseException {
    Expr base = parsePrimary();
    if (peek().isOp("**")) {
      advance();
      return new BinOp(base, "**", parseFactor());
    }
    return base;
  }

  private Expr parsePrimary() throws PyParseException {
    Expr e = parseAtom();
    while (true) {
      if (peek().isOp(".")) {
        advance();
        e = new Attribute(e, expectIdentifier().text);
      } else if (peek().isOp("(")) {
        advance();
        e = parseCallArgs(e);
      } else if (peek().isOp("[")) {
        advance();
        e = new Subscript(e, parseSubscriptList());
        expectOp("]");
      } else {
        return e;
      }
    }
  }

  private Expr parseCallArgs(Expr func) throws PyParseException {
    List<Expr> args = new ArrayList<>();
    List<Keyword> keywords = new ArrayList<>();
    while (!peek().isOp(")")) {
      if (peek().isOp("*")) {
        advance();
        args.add(new Starred(parseTest()));
      } else if (peek().isOp("**")) {
        advance();
        keywords.add(new Keyword(null, parseTest()));
      } else if (peek().kind == PyToken.Kind.NAME && peekAt(1).isOp("=")) {
        String name = advance().text;
        advance();
        keywords.add(new Keyword(name, parseTest()));
      } else {
        Expr arg = parseTest();
        if (peek().isName("for") && args.isEmpty() && keywords.isEmpty()) {
          arg = new Comprehension(CompKind.GENERATOR, arg, null, parseCompFor());
        }
        args.add(arg);
      }
      if (!match(",")) break;
    }
    expectOp(")");
    return new Call(func, args, keywords);
  }

  private Expr parseSubscriptList() throws PyParseException {
    Expr first = parseSubscript();
    if (!peek().isOp(",")) return first;
    List<Expr> elts = new ArrayList<>();
    elts.add(first);
    while (match(",")) {
      if (peek().isOp("]")) break;
      elts.add(parseSubscript());
    }
    return new Tuple(elts);
  }

  private Expr parseSubscript() throws PyParseException {
    Expr lower = null;
    if (!peek().isOp(":")) {
      lower = parseTest();
      if (!peek().isOp(":")) return lower;
    }
    expectOp(":");
    Expr upper = null;
    Expr step = null;
    if (!peek().isOp("]") && !peek().isOp(",") && !peek().isOp(":")) upper = parseTest();
    if (match(":")) {
      if (!peek().isOp("]") && !peek().isOp(",")) step = parseTest();
    }
    return new Slice(lower, upper, step);
  }

  private List<CompFor> parseCompFor() throws PyParseException {
    List<CompFor> generators = new ArrayList<>();
    while (peek().isName("for")) {
      advance();
      Expr target = parseTargetList();
      expectName("in");
      Expr iter = parseOrTest();
      List<Expr> ifs = new ArrayList<>();
      while (peek().isName("if")) {
        advance();
        ifs.add(parseOrTest());
      }
      generators.add(new CompFor(target, iter, ifs));
    }
    return generators;
  }

  private Expr parseTargetList() throws PyParseException {
    Expr first = parseBitOr();
    if (!peek().isOp(",")) return first;
    List<Expr> elts = new ArrayList<>();
    elts.add(first);
    while (match(",")) {
      if (peek().isName("in")) break;
      elts.add(parseBitOr());
    }
    return new Tuple(elts);
  }

  private Expr parseAtom() throws PyParseException {
    PyToken t = peek();
    switch (t.kind) {
      case NAME -> {
        advance();
        if (t.text.equals("True") || t.text.equals("False") || t.text.equals("None")) {
          return new Constant(t.text);
        }
        if (RESERVED.contains(t.text)) {
          throw new PyParseException("unexpected keyword '" + t.text + "'", t.offset);
        }
        return new Name(t.text);
      }
      case NUMBER -> {
        advance();
        return new Constant(t.text);
      }
      case STRING -> {
        return parseStrings();
      }
      case OP -> {
        switch (t.text) {
          case "(" -> {
            advance();
            if (match(")")) return new Tuple(List.of());
            Expr first = parseTestOrStar();
            if (peek().isName("for")) {
              Expr gen = new Comprehension(CompKind.GENERATOR, first, null, parseCompFor());
              expectOp(")");
              return gen;
            }
            if (!peek().isOp(",")) {
              expectOp(")");
              return first;
            }
            List<Expr> elts = new ArrayList<>();
            elts.add(first);
            while (match(",")) {
              if (peek().isOp(")")) break;
              elts.add(parseTestOrStar());
            }
            expectOp(")");
            return new Tuple(elts);
          }
          case "[" -> {
            advance();
            List<Expr> elts = new ArrayList<>();
            if (match("]")) return new ListExpr(elts);
            Expr first = parseTestOrStar();
            if (peek().isName("for")) {
              Expr comp = new Comprehension(CompKind.LIST, first, null, parseCompFor());
              expectOp("]");
              return comp;
            }
            elts.add(first);
            while (match(",")) {
              if (peek().isOp("]")) break;
              elts.add(parseTestOrStar());
            }
            expectOp("]");
            return new ListExpr(elts);
          }
          case "{" -> {
            advance();
            return parseBraced();
          }
          case "..." -> {
            advance();
            return new Constant("...");
          }
          default -> throw new PyParseException("unexpected '" + t.text + "'", t.offset);
        }
      }
      default -> throw new PyParseException(
          t.kind == PyToken.Kind.EOF ? "unexpected end of expression" : "unexpected " + t, t.offset);
    }
  }

  private Expr parseBraced() throws PyParseException {
    if (match("}")) return new DictExpr(List.of(), List.of());
    List<Expr> keys = new ArrayList<>();
    List<Expr> values = new ArrayList<>();
    if (peek().isOp("**")) {
      advance();
      keys.add(null);
      values.add(parseBitOr());
    } else {
      Expr first = parseTestOrStar();
      if (!match(":")) {
        if (peek().isName("for")) {
          Expr comp = new Comprehension(CompKind.SET, first, null, parseCompFor());
          expectOp("}");
          return comp;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (match(",")) {
          if (peek().isOp("}")) break;
          elts.add(parseTestOrStar());
        }
        expectOp("}");
        return new SetExpr(elts);
      }
      Expr value = parseTest();
      if (peek().isName("for")) {
        Expr comp = new Comprehension(CompKind.DICT, first, value, parseCompFor());
        expectOp("}");
        return comp;
      }
      keys.add(first);
      values.add(value);
    }
    while (match(",")) {
      if (peek().isOp("}")) break;
      if (match("**")) {
        keys.add(null);
        values.add(parseBitOr());
      } else {
        keys.add(parseTest());
        expectOp(":");
        values.add(parseTest());
      }
    }
    expectOp("}");
    return new DictExpr(keys, values);
  }

  /** 相邻字符串字面量隐式拼接；f-string 不参与拼接。 */
  private Expr parseStrings() throws PyParseException {
    List<PyToken> parts = new ArrayList<>();
    while (peek().kind == PyToken.Kind.STRING) {
      parts.add(advance());
    }
    PyToken first = parts.get(0);
    if (parts.size() == 1) {
      if (first.isFString()) {
        return parseFString(first);
      }
      boolean plain = first.prefix.isEmpty() || first.prefix.equals("u");
      return new Str(first.value, plain ? null : first.text);
    }
    StringBuilder value = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    boolean plain = true;
    for (PyToken p : parts) {
      if (p.isFString()) {
        throw new PyParseException("implicit concatenation with f-string is not supported", p.offset);
      }
      if (!(p.prefix.isEmpty() || p.prefix.equals("u"))) plain = false;
      value.append(p.value);
      if (literal.length() > 0) literal.append(' ');
      literal.append(p.text);
    }
    return new Str(value.toString(), plain ? null : literal.toString());
  }

  private static Expr parseFString(PyToken token) throws PyParseException {
    List<FPart> parts = new ArrayList<>();
    for (Object part : splitFString(token.rawBody())) {
      if (part instanceof String text) {
        parts.add(FPart.text(text));
      } else {
        String[] slot = (String[]) part;
        parts.add(FPart.slot(parseExpression(slot[0]), slot[1], slot[2]));
      }
    }
    return new FString(token.prefix, parts);
  }

  /**
   * 切分 f-string 正文：返回的元素为原始文本片段（String）或插值槽 {@code [expr, conversion, formatSpec]}。
   */
  private static List<Object> splitFString(String body) {
    List<Object> parts = new ArrayList<>();
    StringBuilder text = new StringBuilder();
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i);
      if ((c == '{' || c == '}') && i + 1 < body.length() && body.charAt(i + 1) == c) {
        text.append(c).append(c);
        i += 2;
        continue;
      }
      if (c != '{') {
        text.append(c);
        i++;
        continue;
      }
      int close = matchingBrace(body, i + 1);
      if (text.length() > 0) {
        parts.add(text.toString());
        text.setLength(0);
      }
      parts.add(splitSlot(body.substring(i + 1, close)));
      i = close + 1;
    }
    if (text.length() > 0) parts.add(text.toString());
    return parts;
  }

  private static int matchingBrace(String body, int from) {
    int depth = 0;
    char quote = 0;
    for (int j = from; j < body.length(); j++) {
      char d = body.charAt(j);
      if (quote != 0) {
        if (d == quote) quote = 0;
      } else if (d == '\'' || d == '"') {
        quote = d;
      } else if (d == '(' || d == '[' || d == '{') {
        depth++;
      } else if (d == ')' || d == ']') {
        depth = Math.max(0, depth - 1);
      } else if (d == '}') {
        if (depth == 0) return j;
        depth--;
      }
    }
    return body.length();
  }

  /** 把插值槽拆成 {@code [expr, conversion, formatSpec]}，后两者可为 null。 */
  private static String[] splitSlot(String inner) {
    int depth = 0;
    char quote = 0;
    for (int j = 0; j < inner.length(); j++) {
      char d = inner.charAt(j);
      if (quote != 0) {
        if (d == quote) quote = 0;
      } else if (d == '\'' || d == '"') {
        quote = d;
      } else if (d == '(' || d == '[' || d == '{') {
        depth++;
      } else if (d == ')' || d == ']' || d == '}') {
        depth = Math.max(0, depth - 1);
      } else if (depth == 0 && d == '!' && j + 1 < inner.length() && inner.charAt(j + 1) != '=') {
        String rest = inner.substring(j + 1);
        int colon = rest.indexOf(':');
        return new String[] {inner.substring(0, j).strip(),
            colon < 0 ? rest : rest.substring(0, colon), colon < 0 ? null : rest.substring(colon + 1)};
      } else if (depth == 0 && d == ':') {
        return new String[] {inner.substring(0, j).strip(), null, inner.substring(j + 1)};
      }
    }
    return new String[] {inner.strip(), null, null};
  }

  // ==================== 辅助方法 ====================

  private static boolean canStartExpression(PyToken t) {
    return switch (t.kind) {
      case NAME -> !RESERVED.contains(t.text) || t.text.equals("not") || t.text.equals("lambda");
      case NUMBER, STRING -> true;
      case OP -> Set.of("(", "[", "{", "-", "+", "~", "*", "...").contains(t.text);
      default -> false;
    };
  }

  private void expectEnd() throws PyParseException {
    PyToken t = peek();
    if (t.kind != PyToken.Kind.EOF) {
      throw new PyParseException("unexpected trailing " + t, t.offset);
    }
  }

  private PyToken expectIdentifier() throws PyParseException {
    PyToken t = peek();
    if (t.kind != PyToken.Kind.NAME) {
      throw new PyParseException("expected identifier, got " + t, t.offset);
    }
    return advance();
  }

  private void expectName(String name) throws PyParseException {
    PyToken t = peek();
    if (!t.isName(name)) {
      throw new PyParseException("expected '" + name + "', got " + t, t.offset);
    }
    advance();
  }

  private void expectOp(String op) throws PyParseException {
    PyToken t = peek();
    if (!t.isOp(op)) {
      throw new PyParseException("expected '" + op + "', got " + t, t.offset);
    }
    advance();
  }

  private boolean match(String op) {
    if (peek().isOp(op)) {
      advance();
      return true;
    }
    return false;
  }

  private PyToken peek() {
    return tokens.get(Math.min(current, tokens.size() - 1));
  }

  private PyToken peekAt(int offset) {
    return tokens.get(Math.min(current + offset, tokens.size() - 1));
  }

  private PyToken advance() {
    PyToken t = peek();
    if (current < tokens.size() - 1) current++;
    return t;
  }
}
