package io.clusterstate.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterstate.enums.InterfaceClass;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ModelsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testPartitionId_TextForm() {
        PartitionId id = PartitionId.of(7, 0x1a);

        assertThat(id.toString()).isEqualTo("7.1a");
        assertThat(PartitionId.parse("7.1a")).isEqualTo(id);
        assertThatThrownBy(() -> PartitionId.parse("7"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PartitionId.parse("x.1"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testPartitionId_OrderedByPoolThenSeed() {
        assertThat(PartitionId.of(1, 0xff)).isLessThan(PartitionId.of(2, 0));
        assertThat(PartitionId.of(2, 1)).isLessThan(PartitionId.of(2, 2));
    }

    @Test
    void testVersionPair_EpochBeforeSequence() {
        assertThat(VersionPair.of(5, 10).isNewerThan(VersionPair.of(5, 9))).isTrue();
        assertThat(VersionPair.of(6, 0).isNewerThan(VersionPair.of(5, 99))).isTrue();
        assertThat(VersionPair.of(5, 10).isNewerThan(VersionPair.of(5, 10))).isFalse();
        assertThat(VersionPair.of(0, 0).isNewerThan(null)).isTrue();
    }

    @Test
    void testPartitionStats_MarkStale() {
        PartitionStats stats = PartitionStats.builder()
            .version(VersionPair.of(3, 4))
            .state("active+clean")
            .actingPrimary(2)
            .build();

        PartitionStats stale = stats.markStale(99L);

        assertThat(stats.isStale()).isFalse();
        assertThat(stale.isStale()).isTrue();
        assertThat(stale.hasStateFlag("clean")).isTrue();
        assertThat(stale.getLastUnstale()).isEqualTo(99L);
        assertThat(stale.getVersion()).isEqualTo(stats.getVersion());
        assertThat(PartitionStats.builder().build().markStale(1L).getState()).isEqualTo("stale");
    }

    @Test
    void testPartitionStats_PrimaryFallsBackToUpPrimary() {
        assertThat(PartitionStats.builder().upPrimary(4).build().getPrimary()).isEqualTo(4);
        assertThat(PartitionStats.builder().upPrimary(4).actingPrimary(1).build().getPrimary()).isEqualTo(1);
        assertThat(PartitionStats.builder().build().getPrimary()).isEqualTo(-1);
    }

    @Test
    void testNodeStatusReport_DecodedFromJson() throws Exception {
        String json = "{\"node_id\":3,\"epoch\":41,"
            + "\"node_stats\":{\"used_bytes\":100,\"peer_ping_times\":{\"4\":{\"back\":"
            + "{\"average\":{\"1min\":10,\"5min\":20,\"15min\":30},\"last\":12}}}},"
            + "\"partition_stats\":{\"2.1f\":{\"version\":{\"epoch\":41,\"sequence\":7},"
            + "\"state\":\"active+clean\",\"acting_primary\":3,\"unknown_field\":true}}}";

        NodeStatusReport report = objectMapper.readValue(json, NodeStatusReport.class);

        assertThat(report.getNodeId()).isEqualTo(3);
        assertThat(report.getEpoch()).isEqualTo(41L);
        InterfacePingStats back = report.getNodeStats().getPeerPingTimes().get(4).get(InterfaceClass.BACK);
        assertThat(back.getObservedLatency()).isEqualTo(30L);
        assertThat(back.getMin()).isEqualTo(PingWindows.EMPTY);
        assertThat(report.getNodeStats().getPeerPingTimes().get(4).getFront()).isNull();
        PartitionStats stats = report.getPartitionStats().get(PartitionId.of(2, 0x1f));
        assertThat(stats.getVersion()).isEqualTo(VersionPair.of(41, 7));
        assertThat(stats.getUpPrimary()).isEqualTo(-1);
        assertThat(stats.getActingPrimary()).isEqualTo(3);
    }
}
