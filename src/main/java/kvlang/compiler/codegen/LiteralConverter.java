package kvlang.compiler.codegen;

import kvlang.compiler.py.PyModel.Expr;
import kvlang.compiler.py.PyModel.ListExpr;
import kvlang.compiler.py.PyModel.Str;
import kvlang.compiler.py.PyModel.Tuple;
import kvlang.compiler.py.PyNames;
import kvlang.compiler.py.PyParseException;
import kvlang.compiler.py.PyParser;
import kvlang.compiler.py.PyTransforms;

import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 把非响应式属性的原始文本转换为 Python 常量表达式。
 * <p>
 * 带引号的文本保持为字符串，数字、{@code True}、{@code False}、{@code None} 原样输出，
 * 顶层逗号列表生成元组；目标属性为序列类型时改为列表。
 * 其余文本作为字符串字面量，除非它是自由名字全部可解析的表达式
 * （已知名字或 Python 内置名，例如 {@code #:set} 常量、{@code #:import} 别名）。
 */
public final class LiteralConverter {

  private static final Logger LOGGER = Logger.getLogger(LiteralConverter.class.getName());

  private LiteralConverter() {}

  public static Expr convert(String rawValue, boolean sequenceTarget) {
    return convert(rawValue, sequenceTarget, Set.of());
  }

  /**
   * @param knownNames 生成代码中可以解析的自由名字
   */
  public static Expr convert(String rawValue, boolean sequenceTarget, Set<String> knownNames) {
    String text = rawValue.strip();
    if (text.isEmpty()) return new Str("");
    Expr parsed;
    try {
      parsed = PyParser.parseExpression(text);
    } catch (PyParseException e) {
      LOGGER.log(Level.FINE, "value kept as string literal: {0}", text);
      return new Str(text);
    }
    for (String name : PyTransforms.freeNames(parsed)) {
      if (!knownNames.contains(name) && !PyNames.isBuiltin(name)) {
        LOGGER.log(Level.FINE, "unresolved name {0}, value kept as string literal: {1}", new Object[]{name, text});
        return new Str(text);
      }
    }
    if (sequenceTarget && parsed instanceof Tuple t) {
      return new ListExpr(t.elts);
    }
    return parsed;
  }
}
