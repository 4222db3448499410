package kvlang.compiler.deps;

import kvlang.compiler.ast.KvModel;
import kvlang.compiler.ast.KvVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 查找带监听键的响应式属性，并记录其所在规则。
 * 已编译的属性直接使用其监听键，未编译的属性现场做依赖分析。
 */
public final class WatchedPropertyFinder implements KvVisitor {

  public static final class Entry {
    public final String rule;
    public final String property;
    public final List<List<String>> keys;

    Entry(String rule, String property, List<List<String>> keys) {
      this.rule = rule;
      this.property = property;
      this.keys = keys;
    }
  }

  private final KvDependencyCompiler compiler = new KvDependencyCompiler();
  private final List<Entry> entries = new ArrayList<>();
  private String currentRule;

  @Override
  public void visitRule(KvModel.Rule rule) {
    String previous = currentRule;
    currentRule = rule.selector.primaryName();
    KvVisitor.super.visitRule(rule);
    currentRule = previous;
  }

  @Override
  public void visitProperty(KvModel.Property property) {
    if (property.isEventHandler()) return;
    List<List<String>> keys = property.watchedKeys != null
        ? property.watchedKeys
        : compiler.compile(property.name, property.rawValue).watchedKeys;
    if (!keys.isEmpty()) {
      entries.add(new Entry(currentRule == null ? "<root>" : currentRule, property.name, keys));
    }
  }

  public List<Entry> getEntries() { return entries; }
}
