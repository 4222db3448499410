package kvlang.compiler.lexer;

import kvlang.compiler.runtime.ErrorMessages;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * KV 源码词法分析器
 * <p>
 * 将源码转换为扁平记号流，并像 Python/YAML 一样根据缩进合成 INDENT/DEDENT/NEWLINE 结构记号。
 * <p>
 * <b>缩进规则</b>：
 * <ul>
 *   <li>缩进栈初始为 {@code [0]}，制表符按 4 列计算</li>
 *   <li>文件中第一次缩进增加决定缩进单位，之后的缩进必须是该单位的整数倍</li>
 *   <li>回退缩进必须恰好落在栈中某一层，否则报 INVALID_INDENTATION</li>
 *   <li>空行与整行注释不产生任何记号；以 {@code #:} 开头的行整体作为 DIRECTIVE 记号</li>
 * </ul>
 * 实例本身不保存状态，每次 {@link #tokenize(String)} 调用都使用独立的扫描状态，可在多线程间共享。
 */
public final class KvTokenizer {

  private static final Logger LOGGER = Logger.getLogger(KvTokenizer.class.getName());

  /**
   * 对整份源码做词法分析。
   *
   * @param source KV 源码
   * @return 以 EOF 结尾的记号列表
   * @throws LexException 缩进无效或字符串未闭合时抛出
   */
  public List<Token> tokenize(String source) throws LexException {
    List<Token> tokens = new Scanner(source).run();
    LOGGER.log(Level.FINE, "tokenized {0} tokens", tokens.size());
    return tokens;
  }

  private static final class Scanner {
    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Integer> indentStack = new ArrayList<>();
    private int indentSize = 0;
    private int pos = 0;
    private int line = 1;
    private int lineStart = 0;

    Scanner(String source) {
      this.src = source == null ? "" : source;
      indentStack.add(0);
    }

    List<Token> run() throws LexException {
      while (pos < src.length()) {
        int width = 0;
        while (pos < src.length() && (src.charAt(pos) == ' ' || src.charAt(pos) == '\t')) {
          width += src.charAt(pos) == '\t' ? 4 : 1;
          pos++;
        }
        if (pos >= src.length()) {
          break;
        }
        char c = src.charAt(pos);
        if (c == '\n' || c == '\r') {
          skipNewline();
          continue;
        }
        if (c == '#') {
          int end = lineEnd();
          if (pos + 1 < src.length() && src.charAt(pos + 1) == ':') {
            String text = src.substring(pos, end).strip();
            tokens.add(new Token(TokenKind.DIRECTIVE, text, text, line, pos - lineStart, text.length()));
            tokens.add(Token.structural(TokenKind.NEWLINE, line, end - lineStart));
          }
          pos = end;
          skipNewline();
          continue;
        }
        handleIndentation(width);
        scanLine();
        tokens.add(Token.structural(TokenKind.NEWLINE, line, pos - lineStart));
        skipNewline();
      }
      while (indentStack.size() > 1) {
        indentStack.remove(indentStack.size() - 1);
        tokens.add(Token.structural(TokenKind.DEDENT, line, 0));
      }
      tokens.add(Token.structural(TokenKind.EOF, line, 0));
      return tokens;
    }

    private void handleIndentation(int width) throws LexException {
      int current = indentStack.get(indentStack.size() - 1);
      if (width > current) {
        if (indentSize == 0) {
          indentSize = width;
        }
        if (width % indentSize != 0) {
          throw new LexException(LexException.Kind.INVALID_INDENTATION,
              ErrorMessages.invalidIndentation(line, width, indentSize), line, 0);
        }
        indentStack.add(width);
        tokens.add(Token.structural(TokenKind.INDENT, line, 0));
      } else if (width < current) {
        while (indentStack.get(indentStack.size() - 1) > width) {
          indentStack.remove(indentStack.size() - 1);
          tokens.add(Token.structural(TokenKind.DEDENT, line, 0));
        }
        if (indentStack.get(indentStack.size() - 1) != width) {
          throw new LexException(LexException.Kind.INVALID_INDENTATION,
              ErrorMessages.unmatchedDedent(line, width), line, 0);
        }
      }
    }

    private void scanLine() throws LexException {
      while (pos < src.length()) {
        char c = src.charAt(pos);
        if (c == '\n' || c == '\r') {
          return;
        }
        if (c == ' ' || c == '\t' || c == '\f') {
          pos++;
          continue;
        }
        // 反斜杠续行：同一逻辑行延续到下一物理行
        if (c == '\\' && pos + 1 < src.length() && (src.charAt(pos + 1) == '\n' || src.charAt(pos + 1) == '\r')) {
          pos++;
          skipNewline();
          continue;
        }
        int col = pos - lineStart;
        if (c == '#') {
          int end = lineEnd();
          String text = src.substring(pos, end).stripTrailing();
          tokens.add(new Token(TokenKind.COMMENT, text, text.substring(1).strip(), line, col, text.length()));
          pos = end;
          return;
        }
        TokenKind single = singleCharKind(c);
        if (single != null) {
          String text = String.valueOf(c);
          tokens.add(new Token(single, text, text, line, col, 1));
          pos++;
        } else if (c == '\'' || c == '"') {
          scanString(pos, pos);
        } else if (Character.isLetter(c) || c == '_') {
          int start = pos;
          while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
          }
          String word = src.substring(start, pos);
          if (isStringPrefix(word) && pos < src.length() && (src.charAt(pos) == '\'' || src.charAt(pos) == '"')) {
            scanString(start, pos);
          } else if (word.equals("canvas")) {
            tokens.add(new Token(TokenKind.CANVAS, word, word, line, col, word.length()));
          } else {
            tokens.add(new Token(TokenKind.IDENTIFIER, word, word, line, col, word.length()));
          }
        } else if (Character.isDigit(c)) {
          scanNumber();
        } else {
          String text = String.valueOf(c);
          tokens.add(new Token(TokenKind.OPERATOR, text, text, line, col, 1));
          pos++;
        }
      }
    }

    private static TokenKind singleCharKind(char c) {
      return switch (c) {
        case ':' -> TokenKind.COLON;
        case ',' -> TokenKind.COMMA;
        case '<' -> TokenKind.LANGLE;
        case '>' -> TokenKind.RANGLE;
        case '[' -> TokenKind.LBRACKET;
        case ']' -> TokenKind.RBRACKET;
        case '(' -> TokenKind.LPAREN;
        case ')' -> TokenKind.RPAREN;
        case '.' -> TokenKind.DOT;
        case '-' -> TokenKind.MINUS;
        case '@' -> TokenKind.AT;
        case '+' -> TokenKind.PLUS;
        default -> null;
      };
    }

    private static boolean isStringPrefix(String word) {
      if (word.isEmpty() || word.length() > 2) {
        return false;
      }
      for (char ch : word.toCharArray()) {
        if ("rRbBuUfF".indexOf(ch) < 0) {
          return false;
        }
      }
      return true;
    }

    private void scanString(int start, int quotePos) throws LexException {
      int startLine = line;
      int col = start - lineStart;
      boolean raw = src.substring(start, quotePos).toLowerCase(Locale.ROOT).contains("r");
      char quote = src.charAt(quotePos);
      boolean triple = quotePos + 2 < src.length()
          && src.charAt(quotePos + 1) == quote && src.charAt(quotePos + 2) == quote;
      pos = quotePos + (triple ? 3 : 1);
      StringBuilder value = new StringBuilder();
      while (true) {
        if (pos >= src.length()) {
          throw unterminated(startLine, col);
        }
        char c = src.charAt(pos);
        if (c == quote) {
          if (!triple) {
            pos++;
            break;
          }
          if (pos + 2 < src.length() && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote) {
            pos += 3;
            break;
          }
          value.append(c);
          pos++;
        } else if (c == '\\') {
          if (pos + 1 >= src.length()) {
            throw unterminated(startLine, col);
          }
          char next = src.charAt(pos + 1);
          if (raw) {
            value.append(c).append(next);
          } else {
            appendEscape(value, next);
          }
          pos += 2;
          if (next == '\n') {
            newLineAt(pos);
          }
        } else if (c == '\n' || c == '\r') {
          if (!triple) {
            throw unterminated(startLine, col);
          }
          value.append('\n');
          pos += (c == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') ? 2 : 1;
          newLineAt(pos);
        } else {
          value.append(c);
          pos++;
        }
      }
      String text = src.substring(start, pos);
      tokens.add(new Token(TokenKind.STRING, text, value.toString(), startLine, col, pos - start));
    }

    private static void appendEscape(StringBuilder value, char next) {
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

    private LexException unterminated(int startLine, int col) {
      return new LexException(LexException.Kind.UNTERMINATED_STRING,
          ErrorMessages.unterminatedString(startLine), startLine, col);
    }

    private void scanNumber() {
      int start = pos;
      int col = pos - lineStart;
      if (src.charAt(pos) == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
        pos += 2;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
          pos++;
        }
      } else {
        skipDigits();
        if (pos < src.length() && src.charAt(pos) == '.') {
          pos++;
          skipDigits();
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
          int save = pos;
          pos++;
          if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
            pos++;
          }
          if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
            skipDigits();
          } else {
            pos = save;
          }
        }
        if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
          pos++;
        }
      }
      String text = src.substring(start, pos);
      tokens.add(new Token(TokenKind.NUMBER, text, text, line, col, text.length()));
    }

    private void skipDigits() {
      while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
        pos++;
      }
    }

    private int lineEnd() {
      int end = pos;
      while (end < src.length() && src.charAt(end) != '\n' && src.charAt(end) != '\r') {
        end++;
      }
      return end;
    }

    private void skipNewline() {
      if (pos >= src.length()) {
        return;
      }
      if (src.charAt(pos) == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
        pos += 2;
      } else {
        pos++;
      }
      newLineAt(pos);
    }

    private void newLineAt(int offset) {
      line++;
      lineStart = offset;
    }
  }
}
