package com.hubframe.core.dependency;

import com.hubframe.api.exception.DependencyCycleException;
import com.hubframe.api.model.DependencyType;
import com.hubframe.core.registry.PluginRecord;
import com.hubframe.core.registry.PluginRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 插件依赖解析
 * <p>
 * 依赖声明保存在注册记录中，每次查询基于注册表当前快照计算，不维护单独的图。
 * <ul>
 *     <li>{@link #checkLoadable}：加载前检查依赖与冲突</li>
 *     <li>{@link #loadOrder}：依赖优先的加载顺序，发现环时报错</li>
 * </ul>
 */
@Slf4j
public class PluginDependencyResolver {

    private final PluginRegistry registry;

    public PluginDependencyResolver(PluginRegistry registry) {
        this.registry = registry;
    }

    /**
     * 检查插件当前能否加载
     *
     * @return 全部问题；为空表示可以加载
     */
    public List<String> checkLoadable(String pluginId) {
        PluginRecord record = registry.require(pluginId);
        List<String> problems = new ArrayList<>();

        for (PluginDependency dependency : record.getDependencies()) {
            Optional<PluginRecord> target = registry.get(dependency.getPluginId());
            switch (dependency.getType()) {
                case CONFLICTS -> {
                    if (target.map(PluginRecord::isLoaded).orElse(false)) {
                        problems.add("conflicts with loaded plugin " + dependency.getPluginId());
                    }
                }
                case REQUIRED -> {
                    if (target.isEmpty()) {
                        problems.add("required plugin " + dependency.getPluginId() + " is not installed");
                    } else if (versionMatches(dependency, target.get(), problems) && !target.get().isLoaded()) {
                        problems.add("required plugin " + dependency.getPluginId() + " is not loaded");
                    }
                }
                case OPTIONAL -> target.ifPresent(t -> versionMatches(dependency, t, problems));
                default -> {
                    // SUGGESTED 只影响顺序
                }
            }
        }

        for (PluginRecord other : registry.list()) {
            if (other.isLoaded() && !other.getId().equals(pluginId) && declaresConflict(other, pluginId)) {
                problems.add("loaded plugin " + other.getId() + " declares a conflict");
            }
        }
        return problems;
    }

    /**
     * 依赖优先的加载顺序
     * <p>
     * 只对给定的插件排序，指向集合外的依赖不参与；相互独立的插件保持传入顺序。
     *
     * @throws DependencyCycleException 集合内的依赖成环
     */
    public List<String> loadOrder(Collection<String> pluginIds) {
        Set<String> scope = new LinkedHashSet<>(pluginIds);
        Map<String, Boolean> done = new HashMap<>();
        List<String> path = new ArrayList<>();
        List<String> order = new ArrayList<>();
        for (String pluginId : scope) {
            visit(pluginId, scope, done, path, order);
        }
        return order;
    }

    private void visit(String pluginId, Set<String> scope, Map<String, Boolean> done,
                       List<String> path, List<String> order) {
        Boolean finished = done.get(pluginId);
        if (Boolean.TRUE.equals(finished)) {
            return;
        }
        if (Boolean.FALSE.equals(finished)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(pluginId), path.size()));
            cycle.add(pluginId);
            throw new DependencyCycleException(cycle);
        }
        done.put(pluginId, false);
        path.add(pluginId);
        for (String dependency : dependenciesOf(pluginId)) {
            if (scope.contains(dependency)) {
                visit(dependency, scope, done, path, order);
            }
        }
        path.remove(path.size() - 1);
        done.put(pluginId, true);
        order.add(pluginId);
    }

    /**
     * 参与排序的依赖（冲突除外），按声明顺序
     */
    public List<String> dependenciesOf(String pluginId) {
        return registry.get(pluginId)
                .map(r -> r.getDependencies().stream()
                        .filter(d -> d.getType().affectsOrder())
                        .map(PluginDependency::getPluginId)
                        .distinct()
                        .toList())
                .orElse(List.of());
    }

    /**
     * 依赖该插件的其他插件（冲突除外）
     */
    public List<String> dependentsOf(String pluginId) {
        return registry.list().stream()
                .filter(r -> r.getDependencies().stream()
                        .anyMatch(d -> d.getType().affectsOrder() && d.getPluginId().equals(pluginId)))
                .map(PluginRecord::getId)
                .toList();
    }

    /**
     * 以该插件为必需依赖、且已加载的插件
     */
    public List<String> loadedDependents(String pluginId) {
        return registry.list().stream()
                .filter(PluginRecord::isLoaded)
                .filter(r -> r.getDependencies().stream()
                        .anyMatch(d -> d.getType() == DependencyType.REQUIRED && d.getPluginId().equals(pluginId)))
                .map(PluginRecord::getId)
                .toList();
    }

    /**
     * 与该插件冲突且已加载的插件，双向声明都算
     */
    public List<String> conflictsOf(String pluginId) {
        Set<String> conflicts = new LinkedHashSet<>();
        registry.get(pluginId).ifPresent(record -> record.getDependencies().stream()
                .filter(d -> d.getType() == DependencyType.CONFLICTS)
                .map(PluginDependency::getPluginId)
                .filter(id -> registry.get(id).map(PluginRecord::isLoaded).orElse(false))
                .forEach(conflicts::add));
        for (PluginRecord other : registry.list()) {
            if (other.isLoaded() && !other.getId().equals(pluginId) && declaresConflict(other, pluginId)) {
                conflicts.add(other.getId());
            }
        }
        return List.copyOf(conflicts);
    }

    private boolean versionMatches(PluginDependency dependency, PluginRecord target, List<String> problems) {
        try {
            if (dependency.spec().matches(target.getLatestVersion())) {
                return true;
            }
            problems.add(dependency.getPluginId() + " version " + target.getLatestVersion()
                    + " does not satisfy " + dependency.getVersionSpec());
        } catch (IllegalArgumentException e) {
            problems.add("invalid version spec for " + dependency.getPluginId() + ": " + e.getMessage());
        }
        return false;
    }

    private static boolean declaresConflict(PluginRecord record, String pluginId) {
        return record.getDependencies().stream()
                .anyMatch(d -> d.getType() == DependencyType.CONFLICTS && d.getPluginId().equals(pluginId));
    }
}
