package com.hubframe.starter.configuration;

import com.hubframe.api.auth.TokenService;
import com.hubframe.api.cache.KeyValueCache;
import com.hubframe.api.plugin.PluginFactory;
import com.hubframe.core.HubOrchestrator;
import com.hubframe.core.config.HubFrameConfig;
import com.hubframe.core.dependency.PluginDependencyResolver;
import com.hubframe.core.device.DeviceCommandService;
import com.hubframe.core.device.DeviceRegistry;
import com.hubframe.core.event.TopicEventBus;
import com.hubframe.core.install.InstallPipeline;
import com.hubframe.core.install.InstallerBackend;
import com.hubframe.core.registry.PluginRegistry;
import com.hubframe.core.registry.PluginStore;
import com.hubframe.core.rpc.RpcChannelFactory;
import com.hubframe.core.supervisor.RuntimeSupervisor;
import com.hubframe.starter.config.HubFrameProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextRefreshedEvent;

import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties(HubFrameProperties.class)
@ConditionalOnProperty(prefix = "hubframe", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HubFrameAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public HubFrameConfig hubFrameConfig(HubFrameProperties properties) {
        return properties.toConfig();
    }

    // 收集容器中的插件工厂和可选的 SPI 实现，缺省的由编排器补齐
    @Bean
    @ConditionalOnMissingBean
    public HubOrchestrator hubOrchestrator(HubFrameConfig config,
                                           ObjectProvider<PluginFactory> pluginFactories,
                                           ObjectProvider<PluginStore> storeProvider,
                                           ObjectProvider<InstallerBackend> installerProvider,
                                           ObjectProvider<RpcChannelFactory> channelFactoryProvider,
                                           ObjectProvider<KeyValueCache> cacheProvider,
                                           ObjectProvider<TokenService> tokenServiceProvider) {
        List<PluginFactory> factories = pluginFactories.orderedStream().toList();
        log.info("Creating HubFrame orchestrator with {} plugin factories", factories.size());
        return HubOrchestrator.builder()
                .config(config)
                .plugins(factories)
                .store(storeProvider.getIfAvailable())
                .installer(installerProvider.getIfAvailable())
                .channelFactory(channelFactoryProvider.getIfAvailable())
                .cache(cacheProvider.getIfAvailable())
                .tokenService(tokenServiceProvider.getIfAvailable())
                .build();
    }

    // 以下组件由编排器持有并关闭
    @Bean(destroyMethod = "")
    public RuntimeSupervisor runtimeSupervisor(HubOrchestrator orchestrator) {
        return orchestrator.getSupervisor();
    }

    @Bean(destroyMethod = "")
    public PluginRegistry pluginRegistry(HubOrchestrator orchestrator) {
        return orchestrator.getRegistry();
    }

    @Bean(destroyMethod = "")
    public TopicEventBus topicEventBus(HubOrchestrator orchestrator) {
        return orchestrator.getEventBus();
    }

    @Bean(destroyMethod = "")
    public DeviceRegistry deviceRegistry(HubOrchestrator orchestrator) {
        return orchestrator.getDevices();
    }

    @Bean(destroyMethod = "")
    public DeviceCommandService deviceCommandService(HubOrchestrator orchestrator) {
        return orchestrator.getCommands();
    }

    @Bean
    public PluginDependencyResolver pluginDependencyResolver(HubOrchestrator orchestrator) {
        return orchestrator.getDependencies();
    }

    @Bean(destroyMethod = "")
    public InstallPipeline installPipeline(HubOrchestrator orchestrator) {
        return orchestrator.getInstallPipeline();
    }

    @Bean
    public ApplicationListener<ContextRefreshedEvent> hubFrameInitializer(HubOrchestrator orchestrator) {
        return event -> {
            if (event.getApplicationContext().getParent() == null) { // 仅 Host 容器执行
                orchestrator.start();
            }
        };
    }
}
