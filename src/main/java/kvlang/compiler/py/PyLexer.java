package kvlang.compiler.py;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Python 表达式词法分析器
 * <p>
 * 只覆盖 KV 属性值与事件处理器中出现的子集：名字、数字、带前缀的字符串、运算符与注释。
 * 括号内部的换行按 Python 规则忽略；顶层换行产生 NEWLINE 记号，用于切分语句。
 * <p>
 * 宽松模式下遇到未闭合字符串或未知字符不会失败：前者吞掉剩余文本作为一个字符串，后者作为单字符 OP。
 * 依赖分析使用宽松模式，保证任何属性值都能得到（可能为空的）监听键。
 */
public final class PyLexer {

  private static final String[] OPERATORS = {
      "**=", "//=", ">>=", "<<=", "...",
      "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
      "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
      "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
      "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=", "!"
  };

  private PyLexer() {}

  public static List<PyToken> tokenize(String source) throws PyParseException {
    return tokenize(source, false);
  }

  /** 宽松模式词法分析，永不失败。 */
  public static List<PyToken> tokenizeLenient(String source) {
    try {
      return tokenize(source, true);
    } catch (PyParseException e) {
      throw new IllegalStateException("lenient tokenization cannot fail", e);
    }
  }

  private static List<PyToken> tokenize(String src, boolean lenient) throws PyParseException {
    List<PyToken> tokens = new ArrayList<>();
    int depth = 0;
    int pos = 0;
    int n = src.length();
    while (pos < n) {
      char c = src.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\f') {
        pos++;
        continue;
      }
      if (c == '\\' && pos + 1 < n && (src.charAt(pos + 1) == '\n' || src.charAt(pos + 1) == '\r')) {
        pos += 2;
        continue;
      }
      if (c == '\n' || c == '\r') {
        if (depth == 0 && !tokens.isEmpty() && tokens.get(tokens.size() - 1).kind != PyToken.Kind.NEWLINE) {
          tokens.add(new PyToken(PyToken.Kind.NEWLINE, "\n", "\n", "", pos));
        }
        pos++;
        continue;
      }
      if (c == '#') {
        int end = pos;
        while (end < n && src.charAt(end) != '\n' && src.charAt(end) != '\r') end++;
        String text = src.substring(pos, end);
        tokens.add(new PyToken(PyToken.Kind.COMMENT, text, text, "", pos));
        pos = end;
        continue;
      }
      if (Character.isLetter(c) || c == '_') {
        int start = pos;
        while (pos < n && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        String word = src.substring(start, pos);
        if (isStringPrefix(word) && pos < n && (src.charAt(pos) == '\'' || src.charAt(pos) == '"')) {
          pos = scanString(src, start, pos, lenient, tokens);
        } else {
          tokens.add(new PyToken(PyToken.Kind.NAME, word, word, "", start));
        }
        continue;
      }
      if (c == '\'' || c == '"') {
        pos = scanString(src, pos, pos, lenient, tokens);
        continue;
      }
      if (Character.isDigit(c) || (c == '.' && pos + 1 < n && Character.isDigit(src.charAt(pos + 1)))) {
        pos = scanNumber(src, pos, tokens);
        continue;
      }
      String op = matchOperator(src, pos);
      if (op == null) {
        if (!lenient) {
          throw new PyParseException("unexpected character '" + c + "'", pos);
        }
        op = String.valueOf(c);
      }
      if (op.equals("(") || op.equals("[") || op.equals("{")) depth++;
      else if (op.equals(")") || op.equals("]") || op.equals("}")) depth = Math.max(0, depth - 1);
      tokens.add(new PyToken(PyToken.Kind.OP, op, op, "", pos));
      pos += op.length();
    }
    tokens.add(new PyToken(PyToken.Kind.EOF, "", "", "", n));
    return tokens;
  }

  private static String matchOperator(String src, int pos) {
    for (String op : OPERATORS) {
      if (src.startsWith(op, pos)) return op;
    }
    return null;
  }

  static boolean isStringPrefix(String word) {
    if (word.isEmpty() || word.length() > 2) return false;
    for (char ch : word.toCharArray()) {
      if ("rRbBuUfF".indexOf(ch) < 0) return false;
    }
    return true;
  }

  private static int scanString(String src, int start, int quotePos, boolean lenient, List<PyToken> tokens)
      throws PyParseException {
    int n = src.length();
    String prefix = src.substring(start, quotePos).toLowerCase(Locale.ROOT);
    boolean raw = prefix.indexOf('r') >= 0;
    char quote = src.charAt(quotePos);
    boolean triple = quotePos + 2 < n && src.charAt(quotePos + 1) == quote && src.charAt(quotePos + 2) == quote;
    int pos = quotePos + (triple ? 3 : 1);
    StringBuilder value = new StringBuilder();
    boolean closed = false;
    while (pos < n) {
      char c = src.charAt(pos);
      if (c == quote) {
        if (!triple) {
          pos++;
          closed = true;
          break;
        }
        if (pos + 2 < n && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote) {
          pos += 3;
          closed = true;
          break;
        }
        value.append(c);
        pos++;
      } else if (c == '\\' && pos + 1 < n) {
        char next = src.charAt(pos + 1);
        if (raw) {
          value.append(c).append(next);
        } else {
          switch (next) {
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'r' -> value.append('\r');
            case '0' -> value.append('\0');
            case '\\', '\'', '"' -> value.append(next);
            case '\n' -> { }
            default -> value.append('\\').append(next);
          }
        }
        pos += 2;
      } else if ((c == '\n' || c == '\r') && !triple) {
        break;
      } else {
        value.append(c);
        pos++;
      }
    }
    if (!closed) {
      if (!lenient) {
        throw new PyParseException("unterminated string literal", start);
      }
      while (pos < n && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') pos++;
    }
    tokens.add(new PyToken(PyToken.Kind.STRING, src.substring(start, pos), value.toString(), prefix, start));
    return pos;
  }

  private static int scanNumber(String src, int pos, List<PyToken> tokens) {
    int n = src.length();
    int start = pos;
    if (src.charAt(pos) == '0' && pos + 1 < n && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
      pos += 2;
      while (pos < n && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
    } else {
      while (pos < n && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
      if (pos < n && src.charAt(pos) == '.' && !(pos + 1 < n && src.charAt(pos + 1) == '.')) {
        pos++;
        while (pos < n && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
      }
      if (pos < n && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
        int save = pos++;
        if (pos < n && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) pos++;
        if (pos < n && Character.isDigit(src.charAt(pos))) {
          while (pos < n && Character.isDigit(src.charAt(pos))) pos++;
        } else {
          pos = save;
        }
      }
      if (pos < n && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) pos++;
    }
    String text = src.substring(start, pos);
    tokens.add(new PyToken(PyToken.Kind.NUMBER, text, text, "", start));
    return pos;
  }
}
