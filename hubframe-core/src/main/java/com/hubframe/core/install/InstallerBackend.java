package com.hubframe.core.install;

/**
 * 安装后端 SPI
 * <p>
 * 实现负责把插件放到插件目录并读出清单；注册表提交由流水线完成。
 * 长时间操作应响应线程中断，看门狗超时或取消时会中断工作线程。
 */
public interface InstallerBackend {

    InstallResult install(InstallRequest request, InstallCallback callback) throws Exception;

    /**
     * 卸载时清理插件文件，默认不做任何事
     */
    default void remove(String pluginId) throws Exception {
    }
}
