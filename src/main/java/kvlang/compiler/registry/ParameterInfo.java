package kvlang.compiler.registry;

import java.util.Objects;

/**
 * 画布指令参数的名字与类型。
 */
public final class ParameterInfo {
  public final String name;
  public final ParameterKind kind;

  public ParameterInfo(String name, ParameterKind kind) {
    this.name = Objects.requireNonNull(name, "name");
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ParameterInfo other)) return false;
    return name.equals(other.name) && kind == other.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind);
  }

  @Override
  public String toString() {
    return name + ":" + kind.jsonName();
  }
}
