package kvlang.compiler.registry;

import java.util.Objects;

/**
 * 控件属性的名字与类型。相等性只由两者决定。
 */
public final class PropertyInfo {
  public final String name;
  public final PropertyKind kind;

  public PropertyInfo(String name, PropertyKind kind) {
    this.name = Objects.requireNonNull(name, "name");
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PropertyInfo other)) return false;
    return name.equals(other.name) && kind == other.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind);
  }

  @Override
  public String toString() {
    return name + ":" + kind.kivyName();
  }
}
