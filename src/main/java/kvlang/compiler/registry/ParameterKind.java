package kvlang.compiler.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 画布指令参数的取值类型。
 */
public enum ParameterKind {
  NUMBER,
  LIST,
  STRING,
  BOOLEAN,
  OBJECT;

  @JsonValue
  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ParameterKind fromJsonName(String name) {
    return valueOf(name.toUpperCase(Locale.ROOT));
  }
}
