package org.portal.chooser;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 文件选择门户的配置（{@code app.portal.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #serviceName}：门户在本机的唯一名称，同一时刻只允许一个进程持有（见 {@link #instanceLockEnabled}）。</li>
 *   <li>{@link #replace}：启动时若名称已被占用，是否要求现有进程让出（命令行 {@code --replace}）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.portal")
public class PortalProperties {

    /**
     * 门户名称，同时用作锁文件名。
     */
    @NotBlank
    private String serviceName = "org.portal.desktop.FileChooser";

    /**
     * 名称已被占用时是否替换现有进程。
     */
    private boolean replace = false;

    /**
     * 是否启用单实例锁。关闭后不做任何名称占用检查（用于调试）。
     */
    private boolean instanceLockEnabled = true;

    /**
     * 锁文件目录；为空时优先使用 {@code $XDG_RUNTIME_DIR}，否则使用系统临时目录。
     */
    private String lockDirectory;

    /**
     * 持有者检查“替换请求”的间隔，以及替换方等待锁释放的间隔。
     */
    @NotNull
    private Duration replacePollInterval = Duration.ofMillis(200);

    /**
     * 替换方最多等待多久；超时仍拿不到锁则启动失败。
     */
    @NotNull
    private Duration replaceTimeout = Duration.ofSeconds(5);

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public boolean isReplace() {
        return replace;
    }

    public void setReplace(boolean replace) {
        this.replace = replace;
    }

    public boolean isInstanceLockEnabled() {
        return instanceLockEnabled;
    }

    public void setInstanceLockEnabled(boolean instanceLockEnabled) {
        this.instanceLockEnabled = instanceLockEnabled;
    }

    public String getLockDirectory() {
        return lockDirectory;
    }

    public void setLockDirectory(String lockDirectory) {
        this.lockDirectory = lockDirectory;
    }

    public Duration getReplacePollInterval() {
        return replacePollInterval;
    }

    public void setReplacePollInterval(Duration replacePollInterval) {
        this.replacePollInterval = replacePollInterval;
    }

    public Duration getReplaceTimeout() {
        return replaceTimeout;
    }

    public void setReplaceTimeout(Duration replaceTimeout) {
        this.replaceTimeout = replaceTimeout;
    }
}
