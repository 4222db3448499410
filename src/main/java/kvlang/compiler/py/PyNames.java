package kvlang.compiler.py;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Python 名字表：关键字与内置名。生成局部变量名或判断自由名字能否解析时使用。
 */
public final class PyNames {

  private PyNames() {}

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public static final Set<String> KEYWORDS = Set.of(
      "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue", "def",
      "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is",
      "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

  /** builtins 模块中的常用名字。 */
  public static final Set<String> BUILTINS = Set.of(
      "abs", "all", "any", "ascii", "bin", "bool", "bytearray", "bytes", "callable", "chr", "complex",
      "delattr", "dict", "dir", "divmod", "enumerate", "eval", "exec", "filter", "float", "format",
      "frozenset", "getattr", "globals", "hasattr", "hash", "hex", "id", "input", "int", "isinstance",
      "issubclass", "iter", "len", "list", "locals", "map", "max", "min", "next", "object", "oct", "open",
      "ord", "pow", "print", "property", "range", "repr", "reversed", "round", "set", "setattr", "slice",
      "sorted", "staticmethod", "str", "sum", "super", "tuple", "type", "vars", "zip", "Exception");

  public static boolean isIdentifier(String name) {
    return name != null && IDENTIFIER.matcher(name).matches();
  }

  public static boolean isKeyword(String name) {
    return KEYWORDS.contains(name);
  }

  public static boolean isBuiltin(String name) {
    return BUILTINS.contains(name);
  }
}
