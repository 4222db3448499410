package kvlang.compiler.py;

import java.util.*;

/**
 * 生成的 Python 源码模型。
 *
 * <p>表达式与语句均为封闭的 sealed 层次，所有节点不可变；渲染由 {@link PySourceWriter} 完成，
 * 改写由 {@link PyTransforms} 产生新树。</p>
 */
public final class PyModel {
  private PyModel() {}

  public static final class Module {
    public final java.util.List<Stmt> body;
    public Module(java.util.List<Stmt> body) { this.body = java.util.List.copyOf(body); }
  }

  // ==================== 表达式 ====================

  public sealed interface Expr permits Name, Attribute, Constant, Str, FString, Tuple, ListExpr, SetExpr, DictExpr,
      Call, Starred, Subscript, Slice, BinOp, UnaryOp, BoolOp, Compare, IfExp, Lambda, Comprehension {}

  public static final class Name implements Expr {
    public final String id;
    public Name(String id) { this.id = id; }
  }
  public static final class Attribute implements Expr {
    public final Expr value; public final String attr;
    public Attribute(Expr value, String attr) { this.value = value; this.attr = attr; }
  }
  /** 数字、{@code True}、{@code False}、{@code None} 与 {@code ...}，按源码文本原样输出。 */
  public static final class Constant implements Expr {
    public final String text;
    public Constant(String text) { this.text = text; }
  }
  /**
   * 字符串常量。{@code literal} 非空时（带 r/b/u 前缀或隐式拼接）原样输出，否则按 {@code value} 重新加引号。
   */
  public static final class Str implements Expr {
    public final String value; public final String literal;
    public Str(String value, String literal) { this.value = value; this.literal = literal; }
    public Str(String value) { this(value, null); }
  }
  public static final class FString implements Expr {
    public final String prefix; public final java.util.List<FPart> parts;
    public FString(String prefix, java.util.List<FPart> parts) { this.prefix = prefix; this.parts = java.util.List.copyOf(parts); }
  }
  /** f-string 片段：{@code expr} 为空时是原始文本片段，否则是 {@code {expr!conv:spec}} 插值槽。 */
  public static final class FPart {
    public final String text; public final Expr expr; public final String conversion; public final String formatSpec;
    private FPart(String text, Expr expr, String conversion, String formatSpec) {
      this.text = text; this.expr = expr; this.conversion = conversion; this.formatSpec = formatSpec;
    }
    public static FPart text(String text) { return new FPart(text, null, null, null); }
    public static FPart slot(Expr expr, String conversion, String formatSpec) { return new FPart(null, expr, conversion, formatSpec); }
    public FPart withExpr(Expr e) { return new FPart(text, e, conversion, formatSpec); }
  }
  public static final class Tuple implements Expr {
    public final java.util.List<Expr> elts;
    public Tuple(java.util.List<Expr> elts) { this.elts = java.util.List.copyOf(elts); }
  }
  public static final class ListExpr implements Expr {
    public final java.util.List<Expr> elts;
    public ListExpr(java.util.List<Expr> elts) { this.elts = java.util.List.copyOf(elts); }
  }
  public static final class SetExpr implements Expr {
    public final java.util.List<Expr> elts;
    public SetExpr(java.util.List<Expr> elts) { this.elts = java.util.List.copyOf(elts); }
  }
  /** 字典字面量；键为 null 的条目表示 {@code **value} 展开。 */
  public static final class DictExpr implements Expr {
    public final java.util.List<Expr> keys; public final java.util.List<Expr> values;
    public DictExpr(java.util.List<Expr> keys, java.util.List<Expr> values) {
      this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
      this.values = java.util.List.copyOf(values);
    }
  }
  public static final class Call implements Expr {
    public final Expr func; public final java.util.List<Expr> args; public final java.util.List<Keyword> keywords;
    public Call(Expr func, java.util.List<Expr> args, java.util.List<Keyword> keywords) {
      this.func = func; this.args = java.util.List.copyOf(args); this.keywords = java.util.List.copyOf(keywords);
    }
  }
  /** 关键字参数；{@code arg} 为 null 表示 {@code **value}。 */
  public static final class Keyword {
    public final String arg; public final Expr value;
    public Keyword(String arg, Expr value) { this.arg = arg; this.value = value; }
  }
  public static final class Starred implements Expr {
    public final Expr value;
    public Starred(Expr value) { this.value = value; }
  }
  public static final class Subscript implements Expr {
    public final Expr value; public final Expr index;
    public Subscript(Expr value, Expr index) { this.value = value; this.index = index; }
  }
  /** 切片，各部分均可为 null。 */
  public static final class Slice implements Expr {
    public final Expr lower; public final Expr upper; public final Expr step;
    public Slice(Expr lower, Expr upper, Expr step) { this.lower = lower; this.upper = upper; this.step = step; }
  }
  public static final class BinOp implements Expr {
    public final Expr left; public final String op; public final Expr right;
    public BinOp(Expr left, String op, Expr right) { this.left = left; this.op = op; this.right = right; }
  }
  /** 一元运算：{@code -}、{@code +}、{@code ~} 或 {@code not}。 */
  public static final class UnaryOp implements Expr {
    public final String op; public final Expr operand;
    public UnaryOp(String op, Expr operand) { this.op = op; this.operand = operand; }
  }
  public static final class BoolOp implements Expr {
    public final String op; public final java.util.List<Expr> values;
    public BoolOp(String op, java.util.List<Expr> values) { this.op = op; this.values = java.util.List.copyOf(values); }
  }
  public static final class Compare implements Expr {
    public final Expr left; public final java.util.List<String> ops; public final java.util.List<Expr> comparators;
    public Compare(Expr left, java.util.List<String> ops, java.util.List<Expr> comparators) {
      this.left = left; this.ops = java.util.List.copyOf(ops); this.comparators = java.util.List.copyOf(comparators);
    }
  }
  public static final class IfExp implements Expr {
    public final Expr test; public final Expr body; public final Expr orelse;
    public IfExp(Expr test, Expr body, Expr orelse) { this.test = test; this.body = body; this.orelse = orelse; }
  }
  public static final class Lambda implements Expr {
    public final java.util.List<Param> params; public final Expr body;
    public Lambda(java.util.List<Param> params, Expr body) { this.params = java.util.List.copyOf(params); this.body = body; }
  }
  /** 形参：{@code prefix} 为空串、{@code *} 或 {@code **}；{@code defaultValue} 可为 null。 */
  public static final class Param {
    public final String prefix; public final String name; public final Expr defaultValue;
    public Param(String prefix, String name, Expr defaultValue) { this.prefix = prefix; this.name = name; this.defaultValue = defaultValue; }
    public static Param of(String name) { return new Param("", name, null); }
  }
  public enum CompKind { LIST, SET, GENERATOR, DICT }
  /** 推导式；DICT 推导式的键在 {@code elt}、值在 {@code value}。 */
  public static final class Comprehension implements Expr {
    public final CompKind kind; public final Expr elt; public final Expr value; public final java.util.List<CompFor> generators;
    public Comprehension(CompKind kind, Expr elt, Expr value, java.util.List<CompFor> generators) {
      this.kind = kind; this.elt = elt; this.value = value; this.generators = java.util.List.copyOf(generators);
    }
  }
  public static final class CompFor {
    public final Expr target; public final Expr iter; public final java.util.List<Expr> ifs;
    public CompFor(Expr target, Expr iter, java.util.List<Expr> ifs) { this.target = target; this.iter = iter; this.ifs = java.util.List.copyOf(ifs); }
  }

  // ==================== 语句 ====================

  public sealed interface Stmt permits Import, ImportFrom, Assign, AugAssign, ExprStmt, Pass, FunctionDef, ClassDef, For, Try {}

  /** {@code import module} 或 {@code import module as alias}（alias 可为 null）。 */
  public static final class Import implements Stmt {
    public final String module; public final String alias;
    public Import(String module, String alias) { this.module = module; this.alias = alias; }
  }
  public static final class ImportFrom implements Stmt {
    public final String module; public final java.util.List<String> names;
    public ImportFrom(String module, java.util.List<String> names) { this.module = module; this.names = java.util.List.copyOf(names); }
  }
  public static final class Assign implements Stmt {
    public final java.util.List<Expr> targets; public final Expr value;
    public Assign(java.util.List<Expr> targets, Expr value) { this.targets = java.util.List.copyOf(targets); this.value = value; }
    public Assign(Expr target, Expr value) { this(java.util.List.of(target), value); }
  }
  public static final class AugAssign implements Stmt {
    public final Expr target; public final String op; public final Expr value;
    public AugAssign(Expr target, String op, Expr value) { this.target = target; this.op = op; this.value = value; }
  }
  public static final class ExprStmt implements Stmt {
    public final Expr value;
    public ExprStmt(Expr value) { this.value = value; }
  }
  public static final class Pass implements Stmt {
    public static final Pass INSTANCE = new Pass();
    private Pass() {}
  }
  public static final class FunctionDef implements Stmt {
    public final String name; public final java.util.List<Param> params; public final java.util.List<Stmt> body;
    public FunctionDef(String name, java.util.List<Param> params, java.util.List<Stmt> body) {
      this.name = name; this.params = java.util.List.copyOf(params); this.body = java.util.List.copyOf(body);
    }
  }
  public static final class ClassDef implements Stmt {
    public final String name; public final java.util.List<String> bases; public final java.util.List<Stmt> body;
    public ClassDef(String name, java.util.List<String> bases, java.util.List<Stmt> body) {
      this.name = name; this.bases = java.util.List.copyOf(bases); this.body = java.util.List.copyOf(body);
    }
  }
  public static final class For implements Stmt {
    public final Expr target; public final Expr iter; public final java.util.List<Stmt> body;
    public For(Expr target, Expr iter, java.util.List<Stmt> body) { this.target = target; this.iter = iter; this.body = java.util.List.copyOf(body); }
  }
  /** 单个 except 分支的 try 语句；{@code exceptionType} 为 null 时为裸 except。 */
  public static final class Try implements Stmt {
    public final java.util.List<Stmt> body; public final Expr exceptionType; public final java.util.List<Stmt> handler;
    public Try(java.util.List<Stmt> body, Expr exceptionType, java.util.List<Stmt> handler) {
      this.body = java.util.List.copyOf(body); this.exceptionType = exceptionType; this.handler = java.util.List.copyOf(handler);
    }
  }

  // ==================== 构造辅助 ====================

  public static Name name(String id) { return new Name(id); }

  /** 由点分路径构造属性访问链，例如 {@code ["self", "parent", "width"]}。 */
  public static Expr chain(java.util.List<String> parts) {
    Expr e = new Name(parts.get(0));
    for (int i = 1; i < parts.size(); i++) e = new Attribute(e, parts.get(i));
    return e;
  }

  public static Call call(Expr func, Expr... args) {
    return new Call(func, Arrays.asList(args), java.util.List.of());
  }
}
