package kvlang.compiler.deps;

import kvlang.compiler.ast.KvModel;

/**
 * 依赖编译后的模块：与源模块结构相同的新树，其中每个属性都带有监听键与最终的编译值。
 */
public final class CompiledModule {
  /** 编译后的新树。 */
  public final KvModel.Module module;
  /** 未经修改的源模块。 */
  public final KvModel.Module source;
  public final int reactivePropertyCount;

  CompiledModule(KvModel.Module module, KvModel.Module source, int reactivePropertyCount) {
    this.module = module;
    this.source = source;
    this.reactivePropertyCount = reactivePropertyCount;
  }
}
