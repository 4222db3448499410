package kvlang.compiler.registry;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 控件类型知识库：属性类型、继承链与 Python 模块路径。
 *
 * <p>代码生成器只通过该接口查询控件信息，实现必须在构造后不可变，可被多个生成器共享。</p>
 */
public interface WidgetRegistry {

  /**
   * 查询控件上某个属性的类型，沿继承链向上查找。
   *
   * @param property 属性名
   * @param widgetType 控件类型名
   * @return 属性类型；控件或属性未知时为空
   */
  Optional<PropertyKind> getPropertyType(String property, String widgetType);

  /** 控件自身及所有祖先声明的属性。未知控件返回空集合。 */
  Set<PropertyInfo> getAllProperties(String widgetType);

  /** 全部祖先类型，按就近优先、去重后的顺序排列，不含控件自身。 */
  List<String> getAllBaseClasses(String widgetType);

  boolean widgetExists(String widgetType);

  /** 控件所在的 Python 模块，例如 {@code kivy.uix.button}。 */
  Optional<String> getModulePath(String widgetType);
}
