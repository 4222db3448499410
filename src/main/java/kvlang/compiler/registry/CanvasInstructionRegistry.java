package kvlang.compiler.registry;

import java.util.Optional;
import java.util.Set;

/**
 * 画布指令知识库。
 */
public interface CanvasInstructionRegistry {

  boolean instructionExists(String instruction);

  /** 指令接受的全部参数；未知指令返回空集合。 */
  Set<ParameterInfo> getInstructionParameters(String instruction);

  Optional<ParameterKind> getParameterType(String parameter, String instruction);

  /** 指令所在的 Python 模块，缺省为 {@code kivy.graphics}。 */
  Optional<String> getModulePath(String instruction);
}
