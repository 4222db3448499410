package kvlang.compiler.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kivy 属性类型，与 {@code kivy.properties} 中的类名一一对应。
 */
public enum PropertyKind {
  NUMERIC("NumericProperty"),
  STRING("StringProperty"),
  LIST("ListProperty"),
  OBJECT("ObjectProperty"),
  BOOLEAN("BooleanProperty"),
  DICT("DictProperty"),
  OPTION("OptionProperty"),
  REFERENCE_LIST("ReferenceListProperty"),
  ALIAS("AliasProperty"),
  BOUNDED_NUMERIC("BoundedNumericProperty"),
  VARIABLE_LIST("VariableListProperty"),
  COLOR("ColorProperty");

  private final String kivyName;

  PropertyKind(String kivyName) {
    this.kivyName = kivyName;
  }

  @JsonValue
  public String kivyName() {
    return kivyName;
  }

  /** 取值为序列的属性类型，静态元组值会被生成为 Python 列表。 */
  public boolean isSequence() {
    return this == LIST || this == REFERENCE_LIST || this == VARIABLE_LIST || this == COLOR;
  }

  @JsonCreator
  public static PropertyKind fromKivyName(String name) {
    for (PropertyKind kind : values()) {
      if (kind.kivyName.equals(name) || kind.name().equalsIgnoreCase(name)) return kind;
    }
    throw new IllegalArgumentException("Unknown property kind: " + name);
  }
}
