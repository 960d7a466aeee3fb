package com.hubframe.core.device;

import com.hubframe.api.exception.CycleRejectedException;
import com.hubframe.api.exception.DuplicateLinkException;
import com.hubframe.api.exception.InvalidDirectionException;
import com.hubframe.api.exception.InvalidLinkTypeException;
import com.hubframe.api.model.LinkDirection;
import com.hubframe.api.model.LinkType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeviceLinkGraph 单元测试")
public class DeviceLinkGraphTest {

    private DeviceLinkGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DeviceLinkGraph();
    }

    // ==================== 环检测 ====================

    @Nested
    @DisplayName("环检测")
    class CycleTests {

        @Test
        @DisplayName("A→B 之后 B→A 被拒绝，已有边保留")
        void reverseEdgeIsRejected() {
            graph.addLink("a", "b", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);

            assertThrows(CycleRejectedException.class,
                    () -> graph.addLink("b", "a", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL));
            assertEquals(1, graph.linkCount());
        }

        @Test
        @DisplayName("自环被拒绝")
        void selfLoopIsRejected() {
            assertThrows(CycleRejectedException.class,
                    () -> graph.addLink("a", "a", LinkType.SYNC, LinkDirection.UNIDIRECTIONAL));
            assertEquals(0, graph.linkCount());
        }

        @Test
        @DisplayName("闭合长度为 5 的环被拒绝")
        void cycleWithinDepthIsRejected() {
            chain("d1", "d2", "d3", "d4", "d5");

            assertThrows(CycleRejectedException.class,
                    () -> graph.addLink("d5", "d1", LinkType.PROXY, LinkDirection.UNIDIRECTIONAL));
        }

        @Test
        @DisplayName("闭合长度为 6 的环超出深度上限，允许")
        void cycleBeyondDepthIsAllowed() {
            chain("d1", "d2", "d3", "d4", "d5", "d6");

            DeviceLink link = graph.addLink("d6", "d1", LinkType.PROXY, LinkDirection.UNIDIRECTIONAL);

            assertEquals("d6", link.from());
            assertEquals(6, graph.linkCount());
        }

        @Test
        @DisplayName("双向边两个方向都参与环检测")
        void bidirectionalEdgeClosesCycleInEitherDirection() {
            graph.addLink("a", "b", LinkType.SYNC, LinkDirection.UNIDIRECTIONAL);
            graph.addLink("b", "c", LinkType.SYNC, LinkDirection.UNIDIRECTIONAL);

            assertThrows(CycleRejectedException.class,
                    () -> graph.addLink("a", "c", LinkType.MIRROR, LinkDirection.BIDIRECTIONAL));
        }
    }

    // ==================== 校验 ====================

    @Nested
    @DisplayName("校验")
    class ValidationTests {

        @Test
        @DisplayName("重复的同向边被拒绝")
        void duplicateIsRejected() {
            graph.addLink("a", "b", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);

            assertThrows(DuplicateLinkException.class,
                    () -> graph.addLink("a", "b", LinkType.SYNC, LinkDirection.UNIDIRECTIONAL));
        }

        @Test
        @DisplayName("未知类型或方向不会留下边")
        void invalidWireValuesLeaveNoEdge() {
            assertThrows(InvalidLinkTypeException.class, () -> graph.addLink("a", "b", "teleport", "bidirectional"));
            assertThrows(InvalidDirectionException.class, () -> graph.addLink("a", "b", "bridge", "sideways"));

            assertEquals(0, graph.linkCount());
            assertTrue(graph.relatedDevices("a").isEmpty());
        }

        @Test
        @DisplayName("线上取值大小写不敏感")
        void wireValuesAreCaseInsensitive() {
            DeviceLink link = graph.addLink("a", "b", "Bridge", "BIDIRECTIONAL");

            assertEquals(LinkType.BRIDGE, link.linkType());
            assertTrue(link.isBidirectional());
        }
    }

    // ==================== 遍历 ====================

    @Nested
    @DisplayName("关联设备遍历")
    class TraversalTests {

        @Test
        @DisplayName("广度优先，同层按插入顺序")
        void breadthFirstInInsertionOrder() {
            graph.addLink("hub", "lamp", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);
            graph.addLink("hub", "blind", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);
            graph.addLink("lamp", "bulb", LinkType.PROXY, LinkDirection.UNIDIRECTIONAL);
            graph.addLink("blind", "motor", LinkType.PROXY, LinkDirection.UNIDIRECTIONAL);

            assertEquals(List.of("lamp", "blind", "bulb", "motor"), relatedIds("hub"));
        }

        @Test
        @DisplayName("单向边只能正向遍历")
        void unidirectionalIsOneWay() {
            graph.addLink("a", "b", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);

            assertEquals(List.of("b"), relatedIds("a"));
            assertTrue(graph.relatedDevices("b").isEmpty());
        }

        @Test
        @DisplayName("双向边可反向遍历")
        void bidirectionalIsTwoWay() {
            graph.addLink("a", "b", LinkType.SYNC, LinkDirection.BIDIRECTIONAL);

            assertEquals(List.of("a"), relatedIds("b"));
        }

        @Test
        @DisplayName("遍历深度不超过上限")
        void traversalStopsAtMaxDepth() {
            chain("d0", "d1", "d2", "d3", "d4", "d5", "d6");

            assertEquals(List.of("d1", "d2", "d3", "d4", "d5"), relatedIds("d0"));
        }

        @Test
        @DisplayName("每个关联设备带有首次到达时经过的边")
        void relatedDevicesCarryPaths() {
            DeviceLink hubLamp = graph.addLink("hub", "lamp", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);
            DeviceLink hubBlind = graph.addLink("hub", "blind", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);
            DeviceLink lampBulb = graph.addLink("lamp", "bulb", LinkType.PROXY, LinkDirection.UNIDIRECTIONAL);
            // bulb 也能经 blind 到达，但 lamp 分支的边先插入
            graph.addLink("blind", "bulb", LinkType.PROXY, LinkDirection.UNIDIRECTIONAL);

            List<RelatedDevice> related = graph.relatedDevices("hub");

            assertEquals(List.of("lamp", "blind", "bulb"), related.stream().map(RelatedDevice::deviceId).toList());
            assertEquals(List.of(hubLamp), related.get(0).path());
            assertEquals(List.of(hubBlind), related.get(1).path());
            assertEquals(List.of(hubLamp, lampBulb), related.get(2).path());
            assertEquals(2, related.get(2).depth());
        }

        @Test
        @DisplayName("反向经过双向边时路径保留原始边")
        void reverseTraversalKeepsOriginalEdge() {
            DeviceLink link = graph.addLink("a", "b", LinkType.SYNC, LinkDirection.BIDIRECTIONAL);

            RelatedDevice related = graph.relatedDevices("b").get(0);

            assertEquals("a", related.deviceId());
            assertEquals(List.of(link), related.path());
        }

        @Test
        @DisplayName("最远设备的路径长度等于深度上限")
        void deepestPathHasMaxDepthHops() {
            chain("d0", "d1", "d2", "d3", "d4", "d5", "d6");

            List<RelatedDevice> related = graph.relatedDevices("d0");
            RelatedDevice last = related.get(related.size() - 1);

            assertEquals("d5", last.deviceId());
            assertEquals(DeviceLinkGraph.DEFAULT_MAX_DEPTH, last.depth());
            assertEquals("d4", last.path().get(4).from());
        }

        @Test
        @DisplayName("未知设备没有关联")
        void unknownDeviceHasNoRelations() {
            assertTrue(graph.relatedDevices("ghost").isEmpty());
        }
    }

    // ==================== 删除 ====================

    @Nested
    @DisplayName("删除")
    class RemovalTests {

        @Test
        @DisplayName("双向边可用反向端点删除")
        void removeBidirectionalByReverseEndpoints() {
            graph.addLink("a", "b", LinkType.SYNC, LinkDirection.BIDIRECTIONAL);

            assertTrue(graph.removeLink("b", "a"));
            assertEquals(0, graph.linkCount());
            assertFalse(graph.removeLink("a", "b"));
        }

        @Test
        @DisplayName("删除后原本会成环的边可以添加")
        void removalAllowsReverseEdge() {
            graph.addLink("a", "b", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);
            graph.removeLink("a", "b");

            graph.addLink("b", "a", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);
            assertEquals(List.of("a"), relatedIds("b"));
        }

        @Test
        @DisplayName("删除设备移除所有相关边")
        void removeDeviceDropsIncidentEdges() {
            graph.addLink("a", "b", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);
            graph.addLink("c", "b", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);
            graph.addLink("c", "d", LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);

            assertEquals(2, graph.removeDevice("b"));
            assertEquals(1, graph.linkCount());
            assertTrue(graph.linksOf("b").isEmpty());
        }
    }

    // ==================== 辅助方法 ====================

    private List<String> relatedIds(String deviceId) {
        return graph.relatedDevices(deviceId).stream().map(RelatedDevice::deviceId).toList();
    }

    private void chain(String... ids) {
        for (int i = 0; i + 1 < ids.length; i++) {
            graph.addLink(ids[i], ids[i + 1], LinkType.BRIDGE, LinkDirection.UNIDIRECTIONAL);
        }
    }
}
