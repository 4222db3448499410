package kvlang.compiler.py;

import kvlang.compiler.py.PyModel.*;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * 把 {@link PyModel} 渲染为 Python 源码。
 * <p>
 * 括号只在优先级需要时添加；元组总是带括号。顶层定义之间空两行，类体内方法之间空一行。
 */
public final class PySourceWriter {

  private static final int TUPLE = 0;
  private static final int LAMBDA = 1;
  private static final int IFEXP = 2;
  private static final int OR = 3;
  private static final int AND = 4;
  private static final int NOT = 5;
  private static final int COMPARE = 6;
  private static final int BITOR = 7;
  private static final int BITXOR = 8;
  private static final int BITAND = 9;
  private static final int SHIFT = 10;
  private static final int ARITH = 11;
  private static final int TERM = 12;
  private static final int FACTOR = 13;
  private static final int POWER = 14;
  private static final int ATOM = 16;

  private static final Map<String, Integer> BINARY = Map.ofEntries(
      Map.entry("|", BITOR), Map.entry("^", BITXOR), Map.entry("&", BITAND),
      Map.entry("<<", SHIFT), Map.entry(">>", SHIFT),
      Map.entry("+", ARITH), Map.entry("-", ARITH),
      Map.entry("*", TERM), Map.entry("/", TERM), Map.entry("//", TERM), Map.entry("%", TERM), Map.entry("@", TERM),
      Map.entry("**", POWER));

  private final String indentUnit;

  public PySourceWriter() {
    this(4);
  }

  public PySourceWriter(int indentWidth) {
    this.indentUnit = " ".repeat(indentWidth);
  }

  // ==================== 模块与语句 ====================

  public String write(PyModel.Module module) {
    StringBuilder out = new StringBuilder();
    Stmt previous = null;
    for (Stmt s : module.body) {
      if (previous != null) {
        boolean definition = s instanceof ClassDef || s instanceof FunctionDef
            || previous instanceof ClassDef || previous instanceof FunctionDef;
        boolean importBlockEnd = isImport(previous) && !isImport(s);
        if (definition) out.append("\n\n");
        else if (importBlockEnd) out.append('\n');
      }
      writeStmt(out, s, 0);
      previous = s;
    }
    return out.toString();
  }

  private static boolean isImport(Stmt s) {
    return s instanceof PyModel.Import || s instanceof ImportFrom;
  }

  public String writeStatement(Stmt stmt) {
    StringBuilder out = new StringBuilder();
    writeStmt(out, stmt, 0);
    return out.toString();
  }

  private void writeStmt(StringBuilder out, Stmt stmt, int level) {
    String pad = indentUnit.repeat(level);
    if (stmt instanceof PyModel.Import im) {
      out.append(pad).append("import ").append(im.module);
      if (im.alias != null && !im.alias.equals(im.module)) out.append(" as ").append(im.alias);
      out.append('\n');
    } else if (stmt instanceof ImportFrom from) {
      out.append(pad).append("from ").append(from.module).append(" import ").append(String.join(", ", from.names)).append('\n');
    } else if (stmt instanceof Assign a) {
      out.append(pad);
      for (Expr target : a.targets) out.append(writeTarget(target)).append(" = ");
      out.append(writeTopLevel(a.value)).append('\n');
    } else if (stmt instanceof AugAssign a) {
      out.append(pad).append(writeTarget(a.target)).append(' ').append(a.op).append("= ").append(writeTopLevel(a.value)).append('\n');
    } else if (stmt instanceof ExprStmt e) {
      out.append(pad).append(writeTopLevel(e.value)).append('\n');
    } else if (stmt instanceof Pass) {
      out.append(pad).append("pass\n");
    } else if (stmt instanceof FunctionDef f) {
      out.append(pad).append("def ").append(f.name).append('(').append(writeParams(f.params)).append("):\n");
      writeBlock(out, f.body, level + 1);
    } else if (stmt instanceof ClassDef c) {
      out.append(pad).append("class ").append(c.name);
      if (!c.bases.isEmpty()) out.append('(').append(String.join(", ", c.bases)).append(')');
      out.append(":\n");
      Stmt previous = null;
      for (Stmt s : c.body) {
        if (previous != null && (s instanceof FunctionDef || previous instanceof FunctionDef)) out.append('\n');
        writeStmt(out, s, level + 1);
        previous = s;
      }
      if (c.body.isEmpty()) out.append(indentUnit.repeat(level + 1)).append("pass\n");
    } else if (stmt instanceof For f) {
      out.append(pad).append("for ").append(writeTarget(f.target)).append(" in ").append(writeTopLevel(f.iter)).append(":\n");
      writeBlock(out, f.body, level + 1);
    } else if (stmt instanceof Try t) {
      out.append(pad).append("try:\n");
      writeBlock(out, t.body, level + 1);
      out.append(pad).append("except");
      if (t.exceptionType != null) out.append(' ').append(write(t.exceptionType));
      out.append(":\n");
      writeBlock(out, t.handler, level + 1);
    }
  }

  private void writeBlock(StringBuilder out, List<Stmt> body, int level) {
    if (body.isEmpty()) {
      out.append(indentUnit.repeat(level)).append("pass\n");
      return;
    }
    for (Stmt s : body) writeStmt(out, s, level);
  }

  /** 语句顶层的元组不加括号，例如 {@code a, b = b, a}。 */
  private String writeTopLevel(Expr e) {
    if (e instanceof Tuple t && !t.elts.isEmpty()) {
      return joinElements(t.elts, t.elts.size() == 1);
    }
    return write(e);
  }

  private String writeTarget(Expr e) {
    return writeTopLevel(e);
  }

  private String writeParams(List<Param> params) {
    StringJoiner joiner = new StringJoiner(", ");
    for (Param p : params) {
      String text = p.prefix + p.name;
      if (p.defaultValue != null) text += "=" + write(p.defaultValue, LAMBDA);
      joiner.add(text);
    }
    return joiner.toString();
  }

  // ==================== 表达式 ====================

  public String write(Expr e) {
    return write(e, TUPLE);
  }

  private String write(Expr e, int minPrec) {
    String text = render(e);
    return precedence(e) < minPrec ? "(" + text + ")" : text;
  }

  private static int precedence(Expr e) {
    if (e instanceof Lambda) return LAMBDA;
    if (e instanceof IfExp) return IFEXP;
    if (e instanceof BoolOp b) return b.op.equals("or") ? OR : AND;
    if (e instanceof UnaryOp u) return u.op.equals("not") ? NOT : FACTOR;
    if (e instanceof Compare) return COMPARE;
    if (e instanceof BinOp b) return BINARY.getOrDefault(b.op, ARITH);
    if (e instanceof Starred) return BITOR;
    if (e instanceof Constant c && c.text.startsWith("-")) return FACTOR;
    return ATOM;
  }

  private String render(Expr e) {
    if (e instanceof Name n) return n.id;
    if (e instanceof Constant c) return c.text;
    if (e instanceof Str s) return s.literal != null ? s.literal : quote(s.value);
    if (e instanceof FString f) return renderFString(f);
    if (e instanceof Attribute a) {
      String base = write(a.value, ATOM);
      // 整数字面量后直接跟 '.' 会被词法分析为小数
      if (a.value instanceof Constant c && c.text.chars().allMatch(Character::isDigit)) base = "(" + base + ")";
      return base + "." + a.attr;
    }
    if (e instanceof Tuple t) {
      if (t.elts.isEmpty()) return "()";
      return "(" + joinElements(t.elts, t.elts.size() == 1) + ")";
    }
    if (e instanceof ListExpr l) return "[" + joinElements(l.elts, false) + "]";
    if (e instanceof SetExpr s) return "{" + joinElements(s.elts, false) + "}";
    if (e instanceof DictExpr d) {
      StringJoiner joiner = new StringJoiner(", ", "{", "}");
      for (int i = 0; i < d.values.size(); i++) {
        Expr key = d.keys.get(i);
        if (key == null) joiner.add("**" + write(d.values.get(i), BITOR));
        else joiner.add(write(key, LAMBDA) + ": " + write(d.values.get(i), LAMBDA));
      }
      return joiner.toString();
    }
    if (e instanceof Call c) {
      StringJoiner joiner = new StringJoiner(", ", "(", ")");
      for (Expr arg : c.args) {
        boolean soleGenerator = c.args.size() == 1 && c.keywords.isEmpty()
            && arg instanceof Comprehension comp && comp.kind == CompKind.GENERATOR;
        joiner.add(soleGenerator ? renderComprehensionBody((Comprehension) arg) : write(arg, LAMBDA));
      }
      for (Keyword k : c.keywords) {
        joiner.add(k.arg == null ? "**" + write(k.value, BITOR) : k.arg + "=" + write(k.value, LAMBDA));
      }
      return write(c.func, ATOM) + joiner;
    }
    if (e instanceof Starred s) return "*" + write(s.value, BITOR);
    if (e instanceof Subscript s) return write(s.value, ATOM) + "[" + renderIndex(s.index) + "]";
    if (e instanceof Slice s) return renderSlice(s);
    if (e instanceof BinOp b) {
      int prec = BINARY.getOrDefault(b.op, ARITH);
      if (b.op.equals("**")) {
        return write(b.left, POWER + 1) + " ** " + write(b.right, FACTOR);
      }
      return write(b.left, prec) + " " + b.op + " " + write(b.right, prec + 1);
    }
    if (e instanceof UnaryOp u) {
      if (u.op.equals("not")) return "not " + write(u.operand, NOT);
      return u.op + write(u.operand, FACTOR);
    }
    if (e instanceof BoolOp b) {
      int prec = precedence(b);
      StringJoiner joiner = new StringJoiner(" " + b.op + " ");
      for (Expr v : b.values) joiner.add(write(v, prec + 1));
      return joiner.toString();
    }
    if (e instanceof Compare c) {
      StringBuilder sb = new StringBuilder(write(c.left, COMPARE + 1));
      for (int i = 0; i < c.ops.size(); i++) {
        sb.append(' ').append(c.ops.get(i)).append(' ').append(write(c.comparators.get(i), COMPARE + 1));
      }
      return sb.toString();
    }
    if (e instanceof IfExp i) {
      return write(i.body, OR) + " if " + write(i.test, OR) + " else " + write(i.orelse, IFEXP);
    }
    if (e instanceof Lambda l) {
      String params = writeParams(l.params);
      return (params.isEmpty() ? "lambda: " : "lambda " + params + ": ") + write(l.body, LAMBDA);
    }
    if (e instanceof Comprehension c) {
      String body = renderComprehensionBody(c);
      return switch (c.kind) {
        case LIST -> "[" + body + "]";
        case SET, DICT -> "{" + body + "}";
        case GENERATOR -> "(" + body + ")";
      };
    }
    throw new IllegalArgumentException("unsupported expression: " + e.getClass().getSimpleName());
  }

  private String joinElements(List<Expr> elts, boolean trailingComma) {
    StringJoiner joiner = new StringJoiner(", ");
    for (Expr elt : elts) joiner.add(write(elt, LAMBDA));
    return joiner + (trailingComma ? "," : "");
  }

  private String renderIndex(Expr index) {
    if (index instanceof Tuple t && !t.elts.isEmpty()) {
      StringJoiner joiner = new StringJoiner(", ");
      for (Expr elt : t.elts) joiner.add(elt instanceof Slice s ? renderSlice(s) : write(elt, LAMBDA));
      return joiner + (t.elts.size() == 1 ? "," : "");
    }
    return index instanceof Slice s ? renderSlice(s) : write(index, TUPLE);
  }

  private String renderSlice(Slice s) {
    StringBuilder sb = new StringBuilder();
    if (s.lower != null) sb.append(write(s.lower, LAMBDA));
    sb.append(':');
    if (s.upper != null) sb.append(write(s.upper, LAMBDA));
    if (s.step != null) sb.append(':').append(write(s.step, LAMBDA));
    return sb.toString();
  }

  private String renderComprehensionBody(Comprehension c) {
    StringBuilder sb = new StringBuilder();
    sb.append(write(c.elt, c.kind == CompKind.DICT ? LAMBDA : IFEXP));
    if (c.kind == CompKind.DICT) sb.append(": ").append(write(c.value, LAMBDA));
    for (CompFor g : c.generators) {
      sb.append(" for ").append(writeTopLevel(g.target)).append(" in ").append(write(g.iter, OR));
      for (Expr cond : g.ifs) sb.append(" if ").append(write(cond, OR));
    }
    return sb.toString();
  }

  private String renderFString(FString f) {
    StringBuilder body = new StringBuilder();
    boolean hasSingle = false;
    for (FPart part : f.parts) {
      if (part.expr == null) {
        body.append(part.text);
        hasSingle |= part.text.indexOf('\'') >= 0;
      } else {
        String expr = write(part.expr, LAMBDA + 1);
        hasSingle |= expr.indexOf('\'') >= 0;
        // 以 '{' 开头的表达式需要与插值槽的花括号隔开
        body.append('{').append(expr.startsWith("{") ? " " + expr : expr);
        if (part.conversion != null) body.append('!').append(part.conversion);
        if (part.formatSpec != null) body.append(':').append(part.formatSpec);
        body.append('}');
      }
    }
    String q = hasSingle ? "\"" : "'";
    return f.prefix + q + body + q;
  }

  /** 按 Python repr 的习惯选择引号并转义。 */
  public static String quote(String value) {
    char q = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
    StringBuilder sb = new StringBuilder().append(q);
    for (char c : value.toCharArray()) {
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c == q) sb.append('\\');
          sb.append(c);
        }
      }
    }
    return sb.append(q).toString();
  }
}
