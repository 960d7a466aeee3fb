package com.hubframe.core.device;

import com.hubframe.api.exception.CycleRejectedException;
import com.hubframe.api.exception.DuplicateLinkException;
import com.hubframe.api.model.LinkDirection;
import com.hubframe.api.model.LinkType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 设备关联图
 * <p>
 * 节点和边都存放在数组中，邻接表保存边下标。每条边同时挂在两个端点上，
 * 遍历时按方向过滤。插入会拒绝在深度上限内形成环的边，失败时图不变。
 */
@Slf4j
public class DeviceLinkGraph {

    public static final int DEFAULT_MAX_DEPTH = 5;

    private final int maxDepth;

    private final List<Node> nodes = new ArrayList<>();
    private final Map<String, Integer> nodeIndex = new HashMap<>();
    /**
     * 已删除的边置为 null，下标不复用
     */
    private final List<DeviceLink> edges = new ArrayList<>();
    private long sequence;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public DeviceLinkGraph() {
        this(DEFAULT_MAX_DEPTH);
    }

    public DeviceLinkGraph(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.maxDepth = maxDepth;
    }

    // ==================== 写操作 ====================

    public DeviceLink addLink(String from, String to, String linkType, String direction) {
        return addLink(from, to, LinkType.fromWire(linkType), LinkDirection.fromWire(direction));
    }

    /**
     * 新增关联
     *
     * @throws CycleRejectedException 会形成长度不超过上限的环（含自环）
     * @throws DuplicateLinkException 已存在同向的边
     */
    public DeviceLink addLink(String from, String to, LinkType linkType, LinkDirection direction) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(linkType, "linkType");
        Objects.requireNonNull(direction, "direction");

        lock.writeLock().lock();
        try {
            if (from.equals(to)) {
                throw new CycleRejectedException(from, to, maxDepth);
            }
            if (findEdge(from, to) >= 0) {
                throw new DuplicateLinkException(from, to);
            }
            // 新边 from→to 加上已有路径 to→…→from 构成环，路径最多 maxDepth-1 跳
            int maxHops = maxDepth - 1;
            if (pathExists(to, from, maxHops)) {
                throw new CycleRejectedException(from, to, maxDepth);
            }
            if (direction == LinkDirection.BIDIRECTIONAL && pathExists(from, to, maxHops)) {
                throw new CycleRejectedException(from, to, maxDepth);
            }

            DeviceLink link = new DeviceLink(from, to, linkType, direction, ++sequence);
            int edgeIdx = edges.size();
            edges.add(link);
            nodeFor(from).edges.add(edgeIdx);
            nodeFor(to).edges.add(edgeIdx);
            log.debug("Link added: {} -> {} ({}, {})", from, to, linkType, direction);
            return link;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 删除关联；双向边也可以用反向端点删除
     *
     * @return 是否删除了边
     */
    public boolean removeLink(String from, String to) {
        lock.writeLock().lock();
        try {
            int idx = findEdge(from, to);
            if (idx < 0) {
                return false;
            }
            DeviceLink link = edges.get(idx);
            edges.set(idx, null);
            nodes.get(nodeIndex.get(link.from())).edges.remove(Integer.valueOf(idx));
            nodes.get(nodeIndex.get(link.to())).edges.remove(Integer.valueOf(idx));
            log.debug("Link removed: {} -> {}", link.from(), link.to());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 删除设备相关的所有边
     */
    public int removeDevice(String deviceId) {
        lock.writeLock().lock();
        try {
            Integer idx = nodeIndex.get(deviceId);
            if (idx == null) {
                return 0;
            }
            List<Integer> incident = new ArrayList<>(nodes.get(idx).edges);
            for (int edgeIdx : incident) {
                DeviceLink link = edges.get(edgeIdx);
                edges.set(edgeIdx, null);
                nodes.get(nodeIndex.get(link.from())).edges.remove(Integer.valueOf(edgeIdx));
                nodes.get(nodeIndex.get(link.to())).edges.remove(Integer.valueOf(edgeIdx));
            }
            return incident.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== 读操作 ====================

    /**
     * 关联设备
     * 广度优先，遵守边的方向，同层按边的插入顺序，最多 maxDepth 层，不含自身。
     * 每个设备只出现一次，路径为首次到达时经过的边。
     */
    public List<RelatedDevice> relatedDevices(String deviceId) {
        lock.readLock().lock();
        try {
            List<RelatedDevice> result = new ArrayList<>();
            if (!nodeIndex.containsKey(deviceId)) {
                return result;
            }
            Map<String, List<DeviceLink>> paths = new HashMap<>();
            paths.put(deviceId, List.of());
            Deque<String> frontier = new ArrayDeque<>();
            frontier.add(deviceId);

            for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
                Deque<String> next = new ArrayDeque<>();
                for (String current : frontier) {
                    List<DeviceLink> viaCurrent = paths.get(current);
                    for (int edgeIdx : nodes.get(nodeIndex.get(current)).edges) {
                        DeviceLink link = edges.get(edgeIdx);
                        if (!link.traversableFrom(current)) {
                            continue;
                        }
                        String neighbor = link.otherEnd(current);
                        if (paths.containsKey(neighbor)) {
                            continue;
                        }
                        List<DeviceLink> path = new ArrayList<>(viaCurrent);
                        path.add(link);
                        paths.put(neighbor, path);
                        result.add(new RelatedDevice(neighbor, path));
                        next.add(neighbor);
                    }
                }
                frontier = next;
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DeviceLink> links() {
        lock.readLock().lock();
        try {
            return edges.stream().filter(Objects::nonNull).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DeviceLink> linksOf(String deviceId) {
        lock.readLock().lock();
        try {
            Integer idx = nodeIndex.get(deviceId);
            if (idx == null) {
                return List.of();
            }
            return nodes.get(idx).edges.stream().map(edges::get).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int linkCount() {
        return links().size();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    // ==================== 内部方法 ====================

    private Node nodeFor(String deviceId) {
        Integer idx = nodeIndex.get(deviceId);
        if (idx != null) {
            return nodes.get(idx);
        }
        Node node = new Node(deviceId);
        nodeIndex.put(deviceId, nodes.size());
        nodes.add(node);
        return node;
    }

    private int findEdge(String from, String to) {
        Integer idx = nodeIndex.get(from);
        if (idx == null) {
            return -1;
        }
        for (int edgeIdx : nodes.get(idx).edges) {
            if (edges.get(edgeIdx).connects(from, to)) {
                return edgeIdx;
            }
        }
        return -1;
    }

    private List<String> neighbors(String deviceId) {
        Integer idx = nodeIndex.get(deviceId);
        if (idx == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (int edgeIdx : nodes.get(idx).edges) {
            DeviceLink link = edges.get(edgeIdx);
            if (link.traversableFrom(deviceId)) {
                result.add(link.otherEnd(deviceId));
            }
        }
        return result;
    }

    private boolean pathExists(String source, String target, int maxHops) {
        if (!nodeIndex.containsKey(source) || !nodeIndex.containsKey(target)) {
            return false;
        }
        Set<String> visited = new HashSet<>();
        visited.add(source);
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(source);
        for (int hop = 1; hop <= maxHops && !frontier.isEmpty(); hop++) {
            Deque<String> next = new ArrayDeque<>();
            for (String current : frontier) {
                for (String neighbor : neighbors(current)) {
                    if (neighbor.equals(target)) {
                        return true;
                    }
                    if (visited.add(neighbor)) {
                        next.add(neighbor);
                    }
                }
            }
            frontier = next;
        }
        return false;
    }

    private static final class Node {
        private final String deviceId;
        /**
         * 关联边的下标，按插入顺序
         */
        private final List<Integer> edges = new ArrayList<>();

        private Node(String deviceId) {
            this.deviceId = deviceId;
        }

        @Override
        public String toString() {
            return deviceId;
        }
    }
}
