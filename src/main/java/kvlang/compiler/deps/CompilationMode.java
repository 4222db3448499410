package kvlang.compiler.deps;

/** 属性值的编译模式。 */
public enum CompilationMode {
  /** 值表达式，依赖变化时重新求值。 */
  EVAL,
  /** 语句块（事件处理器），按需执行，从不监听。 */
  EXEC
}
