package com.hedgebot.engine.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hedgebot.engine.shadow.ShadowObservation;
import com.hedgebot.engine.trade.PhaseState;
import com.hedgebot.engine.trade.PlacedOrder;
import com.hedgebot.engine.trade.SkipReason;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhaseStateCodecTest {

    private static final Instant AT = Instant.parse("2026-03-14T15:21:31Z");

    private final PhaseStateCodec codec = new PhaseStateCodec(new ObjectMapper());

    @Test
    void missingStateReadsAsScheduled() {
        assertThat(codec.read(null)).isEqualTo(new PhaseState.Scheduled());
        assertThat(codec.read(" ")).isEqualTo(new PhaseState.Scheduled());
    }

    @Test
    void triggerWaitKeepsRecordedEntryOrders() {
        PhaseState.TriggerWait wait = new PhaseState.TriggerWait(1.5, AT, 2.0, List.of(30, 60), null,
                List.of(new PlacedOrder("b1", 2.0, 200.0, "abcd1234-entry-0", AT)), true);

        String json = codec.write(wait);

        assertThat(json).contains("\"type\":\"TRIGGER_WAIT\"").contains("2026-03-14T15:21:31Z");
        assertThat(codec.read(json)).isEqualTo(wait);
    }

    @Test
    void shadowMilestonesSurviveStorage() {
        ShadowObservation shadow = ShadowObservation.fromEntry("TRIGGER_AFTER_CUTOFF", AT, 2.5, 3.0, AT)
                .withMinPrice(2.5)
                .withSecondsToMilestone(Map.of(10, 60L, 20, 120L));
        PhaseState.Skipped skipped = new PhaseState.Skipped(SkipReason.TRIGGER_AFTER_CUTOFF, shadow);

        PhaseState read = codec.read(codec.write(skipped));

        assertThat(read).isEqualTo(skipped);
        assertThat(((PhaseState.Skipped) read).shadow().secondsTo(20)).isEqualTo(120L);
    }

    @Test
    void unknownPropertiesAreIgnored() {
        String json = """
                {"type":"WATCHING","baselinePrice":2.0,"lastPrice":2.1,"recentPrices":[2.0,2.1],"legacyField":1}
                """;

        assertThat(codec.read(json)).isEqualTo(new PhaseState.Watching(2.0, 2.1, List.of(2.0, 2.1)));
    }

    @Test
    void eventPayloadReadsBackAsNestedMap() {
        String json = codec.writePayload(Map.of("betId", "b1", "betIds", List.of("b1", "b2"), "matchedSoFar", 12.5));

        Map<String, Object> payload = codec.readPayload(json);

        assertThat(payload).containsEntry("betId", "b1").containsEntry("matchedSoFar", 12.5);
        assertThat(payload.get("betIds")).isEqualTo(List.of("b1", "b2"));
        assertThat(codec.readPayload(null)).isEmpty();
    }

    @Test
    void unreadableStateFailsLoudly() {
        assertThatThrownBy(() -> codec.read("{\"type\":\"NO_SUCH_PHASE\"}"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("cannot parse phase state");
    }
}
