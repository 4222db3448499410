package kvlang.compiler.parser;

import kvlang.compiler.ast.KvModel;

import java.util.List;

/**
 * 容错解析结果：可能不完整的模块与解析过程中记录的全部错误。
 */
public final class ParseResult {
  public final KvModel.Module module;
  public final List<ParsingError> errors;

  public ParseResult(KvModel.Module module, List<ParsingError> errors) {
    this.module = module;
    this.errors = List.copyOf(errors);
  }

  public boolean isSuccess() {
    return errors.isEmpty();
  }
}
