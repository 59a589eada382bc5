package com.lingplug.api.annotation;

import java.lang.annotation.*;

/**
 * 插件声明注解
 * <p>
 * 标记一个实现了 {@link com.lingplug.api.plugin.Plugin} 的类，声明其所在的命名空间与名称。
 * 被标记的类可以被构建期扫描发现，也可以直接作为入口点的目标。
 * </p>
 *
 * @author LingPlug
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface LingPlugin {

    /**
     * 插件所属的命名空间（扩展点标识）
     * @return 命名空间
     */
    String namespace();

    /**
     * 插件在命名空间内的唯一名称
     * @return 名称
     */
    String name();
}
