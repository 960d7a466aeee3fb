package com.hubframe.core.dependency;

import com.hubframe.api.exception.DependencyCycleException;
import com.hubframe.api.model.DependencyType;
import com.hubframe.core.device.BindingRegistry;
import com.hubframe.core.registry.InMemoryPluginStore;
import com.hubframe.core.registry.PluginRecord;
import com.hubframe.core.registry.PluginRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginDependencyResolver 单元测试")
public class PluginDependencyResolverTest {

    private PluginRegistry registry;
    private PluginDependencyResolver resolver;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry(new InMemoryPluginStore(), new BindingRegistry());
        resolver = new PluginDependencyResolver(registry);
    }

    // ==================== 加载检查 ====================

    @Nested
    @DisplayName("加载检查")
    class LoadableTests {

        @Test
        @DisplayName("必需依赖未安装")
        void missingRequired() {
            register("scenes", "1.0.0", requires("lights", null));

            assertEquals(List.of("required plugin lights is not installed"), resolver.checkLoadable("scenes"));
        }

        @Test
        @DisplayName("必需依赖已安装但未加载")
        void requiredNotLoaded() {
            register("lights", "1.0.0");
            register("scenes", "1.0.0", requires("lights", ">=1.0"));

            assertEquals(List.of("required plugin lights is not loaded"), resolver.checkLoadable("scenes"));

            registry.markLoaded("lights", true);
            assertTrue(resolver.checkLoadable("scenes").isEmpty());
        }

        @Test
        @DisplayName("版本不满足时只报告版本问题")
        void versionMismatch() {
            register("lights", "2.1.0");
            registry.markLoaded("lights", true);
            register("scenes", "1.0.0", requires("lights", ">=1.0.0,<2.0.0"));

            List<String> problems = resolver.checkLoadable("scenes");

            assertEquals(1, problems.size());
            assertTrue(problems.get(0).contains("2.1.0 does not satisfy >=1.0.0,<2.0.0"));
        }

        @Test
        @DisplayName("可选依赖缺失不影响加载，存在时检查版本")
        void optionalDependency() {
            register("scenes", "1.0.0", dependency("weather", ">=3.0", DependencyType.OPTIONAL));
            assertTrue(resolver.checkLoadable("scenes").isEmpty());

            register("weather", "2.0.0");
            assertEquals(1, resolver.checkLoadable("scenes").size());
        }

        @Test
        @DisplayName("冲突在双方任一方声明都生效")
        void conflictsInBothDirections() {
            register("lights", "1.0.0");
            register("legacy-lights", "1.0.0", dependency("lights", null, DependencyType.CONFLICTS));

            registry.markLoaded("lights", true);
            assertEquals(List.of("conflicts with loaded plugin lights"), resolver.checkLoadable("legacy-lights"));
            assertEquals(List.of("lights"), resolver.conflictsOf("legacy-lights"));

            registry.markLoaded("lights", false);
            registry.markLoaded("legacy-lights", true);
            assertEquals(List.of("loaded plugin legacy-lights declares a conflict"), resolver.checkLoadable("lights"));
            assertEquals(List.of("legacy-lights"), resolver.conflictsOf("lights"));
        }

        @Test
        @DisplayName("建议依赖不影响加载")
        void suggestedIsIgnored() {
            register("scenes", "1.0.0", dependency("weather", null, DependencyType.SUGGESTED));

            assertTrue(resolver.checkLoadable("scenes").isEmpty());
        }
    }

    // ==================== 加载顺序 ====================

    @Nested
    @DisplayName("加载顺序")
    class OrderTests {

        @Test
        @DisplayName("依赖排在依赖方之前，独立插件保持原顺序")
        void dependenciesFirst() {
            register("scenes", "1.0.0", requires("lights", null), dependency("weather", null, DependencyType.SUGGESTED));
            register("clock", "1.0.0");
            register("lights", "1.0.0");
            register("weather", "1.0.0");

            List<String> order = resolver.loadOrder(List.of("scenes", "clock", "lights", "weather"));

            assertEquals(List.of("lights", "weather", "scenes", "clock"), order);
        }

        @Test
        @DisplayName("集合外的依赖不加入结果")
        void outOfScopeDependenciesAreIgnored() {
            register("lights", "1.0.0");
            register("scenes", "1.0.0", requires("lights", null));

            assertEquals(List.of("scenes"), resolver.loadOrder(List.of("scenes")));
        }

        @Test
        @DisplayName("冲突不构成顺序约束")
        void conflictsDoNotOrder() {
            register("a", "1.0.0", dependency("b", null, DependencyType.CONFLICTS));
            register("b", "1.0.0", dependency("a", null, DependencyType.CONFLICTS));

            assertEquals(List.of("a", "b"), resolver.loadOrder(List.of("a", "b")));
        }

        @Test
        @DisplayName("依赖成环时报告环路")
        void cycleIsReported() {
            register("a", "1.0.0", requires("b", null));
            register("b", "1.0.0", requires("c", null));
            register("c", "1.0.0", requires("a", null));

            DependencyCycleException e = assertThrows(DependencyCycleException.class,
                    () -> resolver.loadOrder(List.of("a", "b", "c")));

            assertEquals(List.of("a", "b", "c", "a"), e.getCycle());
        }
    }

    // ==================== 查询 ====================

    @Test
    @DisplayName("依赖与被依赖查询")
    void dependenciesAndDependents() {
        register("lights", "1.0.0");
        register("scenes", "1.0.0", requires("lights", null));
        register("dashboard", "1.0.0", dependency("lights", null, DependencyType.OPTIONAL));
        register("legacy", "1.0.0", dependency("lights", null, DependencyType.CONFLICTS));

        assertEquals(List.of("lights"), resolver.dependenciesOf("scenes"));
        assertEquals(List.of("dashboard", "scenes"), resolver.dependentsOf("lights").stream().sorted().toList());
        assertTrue(resolver.dependenciesOf("ghost").isEmpty());

        registry.markLoaded("scenes", true);
        registry.markLoaded("dashboard", true);
        assertEquals(List.of("scenes"), resolver.loadedDependents("lights"));
    }

    // ==================== 辅助方法 ====================

    private void register(String id, String version, PluginDependency... dependencies) {
        registry.register(PluginRecord.builder()
                .id(id)
                .name(id)
                .latestVersion(version)
                .enabled(true)
                .dependencies(List.of(dependencies))
                .build());
    }

    private static PluginDependency requires(String pluginId, String versionSpec) {
        return dependency(pluginId, versionSpec, DependencyType.REQUIRED);
    }

    private static PluginDependency dependency(String pluginId, String versionSpec, DependencyType type) {
        return PluginDependency.builder().pluginId(pluginId).versionSpec(versionSpec).type(type).build();
    }
}
