package kvlang.compiler.py;

import kvlang.compiler.py.PyModel.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 表达式树改写工具：名字重命名、属性链替换与名字收集。所有操作返回新树，不修改输入。
 */
public final class PyTransforms {

  private PyTransforms() {}

  /**
   * 自顶向下改写：{@code pre} 返回非 null 时用其结果替换当前节点且不再深入，否则重建节点并递归处理子节点。
   */
  public static Expr rewrite(Expr e, Function<Expr, Expr> pre) {
    if (e == null) return null;
    Expr replaced = pre.apply(e);
    if (replaced != null) return replaced;
    if (e instanceof Name || e instanceof Constant || e instanceof Str) return e;
    if (e instanceof Attribute a) return new Attribute(rewrite(a.value, pre), a.attr);
    if (e instanceof FString f) {
      List<FPart> parts = new ArrayList<>(f.parts.size());
      for (FPart p : f.parts) parts.add(p.expr == null ? p : p.withExpr(rewrite(p.expr, pre)));
      return new FString(f.prefix, parts);
    }
    if (e instanceof Tuple t) return new Tuple(rewriteAll(t.elts, pre));
    if (e instanceof ListExpr l) return new ListExpr(rewriteAll(l.elts, pre));
    if (e instanceof SetExpr s) return new SetExpr(rewriteAll(s.elts, pre));
    if (e instanceof DictExpr d) {
      List<Expr> keys = new ArrayList<>(d.keys.size());
      for (Expr k : d.keys) keys.add(rewrite(k, pre));
      return new DictExpr(keys, rewriteAll(d.values, pre));
    }
    if (e instanceof Call c) {
      List<Keyword> keywords = new ArrayList<>(c.keywords.size());
      for (Keyword k : c.keywords) keywords.add(new Keyword(k.arg, rewrite(k.value, pre)));
      return new Call(rewrite(c.func, pre), rewriteAll(c.args, pre), keywords);
    }
    if (e instanceof Starred s) return new Starred(rewrite(s.value, pre));
    if (e instanceof Subscript s) return new Subscript(rewrite(s.value, pre), rewrite(s.index, pre));
    if (e instanceof Slice s) return new Slice(rewrite(s.lower, pre), rewrite(s.upper, pre), rewrite(s.step, pre));
    if (e instanceof BinOp b) return new BinOp(rewrite(b.left, pre), b.op, rewrite(b.right, pre));
    if (e instanceof UnaryOp u) return new UnaryOp(u.op, rewrite(u.operand, pre));
    if (e instanceof BoolOp b) return new BoolOp(b.op, rewriteAll(b.values, pre));
    if (e instanceof Compare c) return new Compare(rewrite(c.left, pre), c.ops, rewriteAll(c.comparators, pre));
    if (e instanceof IfExp i) return new IfExp(rewrite(i.test, pre), rewrite(i.body, pre), rewrite(i.orelse, pre));
    if (e instanceof Lambda l) {
      List<Param> params = new ArrayList<>(l.params.size());
      for (Param p : l.params) params.add(new Param(p.prefix, p.name, rewrite(p.defaultValue, pre)));
      return new Lambda(params, rewrite(l.body, pre));
    }
    if (e instanceof Comprehension c) {
      List<CompFor> gens = new ArrayList<>(c.generators.size());
      for (CompFor g : c.generators) gens.add(new CompFor(rewrite(g.target, pre), rewrite(g.iter, pre), rewriteAll(g.ifs, pre)));
      return new Comprehension(c.kind, rewrite(c.elt, pre), rewrite(c.value, pre), gens);
    }
    throw new IllegalArgumentException("unsupported expression: " + e.getClass().getSimpleName());
  }

  private static List<Expr> rewriteAll(List<Expr> items, Function<Expr, Expr> pre) {
    List<Expr> out = new ArrayList<>(items.size());
    for (Expr item : items) out.add(rewrite(item, pre));
    return out;
  }

  /**
   * 把自由出现的名字替换为给定表达式。lambda 形参与推导式目标会遮蔽同名映射。
   */
  public static Expr renameNames(Expr e, Map<String, Expr> mapping) {
    if (mapping.isEmpty()) return e;
    return rewrite(e, node -> {
      if (node instanceof Name n) {
        return mapping.getOrDefault(n.id, n);
      }
      if (node instanceof Lambda l) {
        Map<String, Expr> inner = new HashMap<>(mapping);
        for (Param p : l.params) inner.remove(p.name);
        List<Param> params = new ArrayList<>(l.params.size());
        for (Param p : l.params) params.add(new Param(p.prefix, p.name, p.defaultValue == null ? null : renameNames(p.defaultValue, mapping)));
        return new Lambda(params, renameNames(l.body, inner));
      }
      if (node instanceof Comprehension c) {
        Map<String, Expr> inner = new HashMap<>(mapping);
        for (CompFor g : c.generators) for (String bound : collectNames(g.target)) inner.remove(bound);
        List<CompFor> gens = new ArrayList<>(c.generators.size());
        for (int i = 0; i < c.generators.size(); i++) {
          CompFor g = c.generators.get(i);
          // 第一个生成器的 iter 在外层作用域求值
          Map<String, Expr> iterScope = i == 0 ? mapping : inner;
          List<Expr> ifs = new ArrayList<>();
          for (Expr cond : g.ifs) ifs.add(renameNames(cond, inner));
          gens.add(new CompFor(g.target, renameNames(g.iter, iterScope), ifs));
        }
        return new Comprehension(c.kind, renameNames(c.elt, inner), c.value == null ? null : renameNames(c.value, inner), gens);
      }
      return null;
    });
  }

  /**
   * 把与 {@code key} 完全相同的属性访问链替换为 {@code replacement}。
   * 链首被 lambda 形参或推导式目标遮蔽的位置不替换。
   */
  public static Expr substituteChain(Expr e, List<String> key, Expr replacement) {
    return rewriteUnshadowed(e, key.get(0), node -> key.equals(chainOf(node)) ? replacement : null);
  }

  /** 属性链 {@code key} 是否以自由形式出现（链首未被表达式内部绑定）。 */
  public static boolean occursFree(Expr e, List<String> key) {
    boolean[] found = new boolean[1];
    rewriteUnshadowed(e, key.get(0), node -> {
      if (key.equals(chainOf(node))) found[0] = true;
      return null;
    });
    return found[0];
  }

  /** 只对 {@code name} 未被遮蔽的子树应用 {@code pre}。 */
  private static Expr rewriteUnshadowed(Expr e, String name, Function<Expr, Expr> pre) {
    return rewrite(e, node -> {
      if (node instanceof Lambda l && bindsInLambda(l, name)) {
        List<Param> params = new ArrayList<>(l.params.size());
        for (Param p : l.params) params.add(new Param(p.prefix, p.name, rewriteUnshadowed(p.defaultValue, name, pre)));
        return new Lambda(params, l.body);
      }
      if (node instanceof Comprehension c && bindsInComprehension(c, name)) {
        List<CompFor> gens = new ArrayList<>(c.generators);
        CompFor first = gens.get(0);
        gens.set(0, new CompFor(first.target, rewriteUnshadowed(first.iter, name, pre), first.ifs));
        return new Comprehension(c.kind, c.elt, c.value, gens);
      }
      return pre.apply(node);
    });
  }

  private static boolean bindsInLambda(Lambda l, String name) {
    for (Param p : l.params) if (p.name.equals(name)) return true;
    return false;
  }

  private static boolean bindsInComprehension(Comprehension c, String name) {
    for (CompFor g : c.generators) if (collectNames(g.target).contains(name)) return true;
    return false;
  }

  /** 收集表达式中的自由名字：lambda 形参与推导式目标不计入。 */
  public static java.util.Set<String> freeNames(Expr e) {
    java.util.Set<String> names = new LinkedHashSet<>();
    if (e == null) return names;
    rewrite(e, node -> {
      if (node instanceof Name n) {
        names.add(n.id);
        return node;
      }
      if (node instanceof Lambda l) {
        java.util.Set<String> inner = freeNames(l.body);
        for (Param p : l.params) {
          inner.remove(p.name);
          names.addAll(freeNames(p.defaultValue));
        }
        names.addAll(inner);
        return node;
      }
      if (node instanceof Comprehension c) {
        java.util.Set<String> bound = new LinkedHashSet<>();
        java.util.Set<String> inner = new LinkedHashSet<>();
        for (int i = 0; i < c.generators.size(); i++) {
          CompFor g = c.generators.get(i);
          if (i == 0) names.addAll(freeNames(g.iter)); else inner.addAll(freeNames(g.iter));
          bound.addAll(collectNames(g.target));
          for (Expr cond : g.ifs) inner.addAll(freeNames(cond));
        }
        inner.addAll(freeNames(c.elt));
        inner.addAll(freeNames(c.value));
        inner.removeAll(bound);
        names.addAll(inner);
        return node;
      }
      return null;
    });
    return names;
  }

  /**
   * 若表达式是纯粹的点分属性链（{@code a.b.c}），返回其各段，否则返回 null。
   */
  public static List<String> chainOf(Expr e) {
    List<String> parts = new ArrayList<>();
    Expr cur = e;
    while (cur instanceof Attribute a) {
      parts.add(0, a.attr);
      cur = a.value;
    }
    if (!(cur instanceof Name n)) return null;
    parts.add(0, n.id);
    return parts;
  }

  /** 收集表达式中出现的所有名字（不区分自由与绑定）。 */
  public static java.util.Set<String> collectNames(Expr e) {
    java.util.Set<String> names = new LinkedHashSet<>();
    rewrite(e, node -> {
      if (node instanceof Name n) names.add(n.id);
      if (node instanceof Lambda l) for (Param p : l.params) names.add(p.name);
      return null;
    });
    return names;
  }

  /** 收集语句中出现的所有名字。 */
  public static java.util.Set<String> collectNames(Stmt s) {
    java.util.Set<String> names = new LinkedHashSet<>();
    if (s instanceof Assign a) {
      for (Expr t : a.targets) names.addAll(collectNames(t));
      names.addAll(collectNames(a.value));
    } else if (s instanceof AugAssign a) {
      names.addAll(collectNames(a.target));
      names.addAll(collectNames(a.value));
    } else if (s instanceof ExprStmt e) {
      names.addAll(collectNames(e.value));
    }
    return names;
  }

  /** 对语句中的每个表达式应用改写。 */
  public static Stmt mapExpressions(Stmt s, Function<Expr, Expr> fn) {
    if (s instanceof Assign a) {
      List<Expr> targets = new ArrayList<>(a.targets.size());
      for (Expr t : a.targets) targets.add(fn.apply(t));
      return new Assign(targets, fn.apply(a.value));
    }
    if (s instanceof AugAssign a) return new AugAssign(fn.apply(a.target), a.op, fn.apply(a.value));
    if (s instanceof ExprStmt e) return new ExprStmt(fn.apply(e.value));
    return s;
  }
}
