package org.portal.chooser;

import org.portal.chooser.swing.SwingChooserPresenter;
import org.portal.instance.PortalInstanceLock;
import org.portal.instance.PortalInstanceLockException;
import org.portal.request.RequestHandleRegistry;
import org.portal.request.RequestLifecycleManager;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.MessageSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * 文件选择门户的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>请求句柄注册表是唯一的跨请求共享状态，显式注入到生命周期管理器中。</li>
 *   <li>展示层默认使用 Swing；容器中已有其它 {@link ChooserPresenter} 时不再创建。</li>
 *   <li>单实例锁在容器启动时获取，获取失败会导致启动失败。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class PortalConfiguration {

    @Bean
    public RequestHandleRegistry requestHandleRegistry() {
        return new RequestHandleRegistry();
    }

    @Bean
    public RequestLifecycleManager requestLifecycleManager(RequestHandleRegistry registry) {
        return new RequestLifecycleManager(registry);
    }

    @Bean
    public SaveSetResolver saveSetResolver() {
        return new SaveSetResolver(PathExistence.FILESYSTEM);
    }

    @Bean
    @ConditionalOnMissingBean(ChooserPresenter.class)
    public ChooserPresenter swingChooserPresenter(MessageSource messageSource) {
        return new SwingChooserPresenter(messageSource);
    }

    @Bean
    public FileChooserPortal fileChooserPortal(
            RequestLifecycleManager lifecycle, ChooserPresenter presenter, SaveSetResolver saveSetResolver) {
        return new FileChooserPortal(lifecycle, presenter, saveSetResolver);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "app.portal", name = "instance-lock-enabled", havingValue = "true", matchIfMissing = true)
    public PortalInstanceLock portalInstanceLock(PortalProperties properties, ConfigurableApplicationContext context) {
        PortalInstanceLock lock = new PortalInstanceLock(
                lockDirectory(properties),
                properties.getServiceName(),
                properties.getReplacePollInterval(),
                properties.getReplaceTimeout()
        );
        try {
            // 失去名称后不再继续服务：关闭容器并退出
            lock.acquire(properties.isReplace(), () -> System.exit(SpringApplication.exit(context, () -> 0)));
        } catch (PortalInstanceLockException e) {
            throw new IllegalStateException("无法创建门户：" + e.getMessage(), e);
        }
        return lock;
    }

    static Path lockDirectory(PortalProperties properties) {
        String configured = properties.getLockDirectory();
        if (configured != null && !configured.isBlank()) {
            return Path.of(configured);
        }
        String runtimeDir = System.getenv("XDG_RUNTIME_DIR");
        if (runtimeDir != null && !runtimeDir.isBlank()) {
            return Path.of(runtimeDir);
        }
        return Path.of(System.getProperty("java.io.tmpdir"));
    }
}
