package dev.collab.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionValueTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void convertsEveryJsonForm() throws Exception {
        var node = mapper.readTree("""
            {"flag": true, "score": 8.5, "name": "x", "none": null,
             "files": ["a.py", 2], "review": {"ok": false}}
            """);

        Map<String, DecisionValue> values = DecisionValue.mapFromJson(node);

        assertThat(values.keySet()).containsExactly("flag", "score", "name", "none", "files", "review");
        assertThat(values.get("flag")).isEqualTo(DecisionValue.TRUE);
        assertThat(values.get("score")).isEqualTo(new DecisionValue.Number(new BigDecimal("8.5")));
        assertThat(values.get("name")).isEqualTo(DecisionValue.of("x"));
        assertThat(values.get("none")).isEqualTo(DecisionValue.NULL);
        assertThat(values.get("files"))
            .isEqualTo(new DecisionValue.Array(List.of(DecisionValue.of("a.py"), DecisionValue.of(2))));
        assertThat(values.get("review"))
            .isEqualTo(new DecisionValue.Mapping(Map.of("ok", DecisionValue.FALSE)));
    }

    @Test
    void nonFiniteDoubleNodeDoesNotThrow() throws Exception {
        var node = mapper.readTree("{\"score\": 1e400}");

        assertThat(DecisionValue.mapFromJson(node)).containsEntry("score", DecisionValue.of("Infinity"));
    }

    @Test
    void numbersEqualByValueRegardlessOfScale() {
        var eight = new DecisionValue.Number(new BigDecimal("8"));
        var eightPointZero = new DecisionValue.Number(new BigDecimal("8.00"));

        assertThat(eight).isEqualTo(eightPointZero);
        assertThat(eight.hashCode()).isEqualTo(eightPointZero.hashCode());
        assertThat(eightPointZero.render()).isEqualTo("8");
    }

    @Test
    void rendersForPrompts() {
        assertThat(DecisionValue.of(10).render()).isEqualTo("10");
        assertThat(DecisionValue.TRUE.render()).isEqualTo("true");
        assertThat(DecisionValue.NULL.render()).isEmpty();
        assertThat(new DecisionValue.Mapping(Map.of("a", DecisionValue.of(1))).render()).isEqualTo("{\"a\":1}");
    }

    @Test
    void truthiness() {
        assertThat(DecisionValue.of(0).truthy()).isFalse();
        assertThat(DecisionValue.of(-1).truthy()).isTrue();
        assertThat(DecisionValue.of("").truthy()).isFalse();
        assertThat(DecisionValue.of("no").truthy()).isTrue();
        assertThat(new DecisionValue.Mapping(Map.of()).truthy()).isFalse();
        assertThat(DecisionValue.NULL.truthy()).isFalse();
    }

    @Test
    void mapToJsonKeepsInsertionOrder() {
        var entries = new LinkedHashMap<String, DecisionValue>();
        entries.put("b", DecisionValue.of(1));
        entries.put("a", DecisionValue.of(2));

        assertThat(DecisionValue.mapToJson(entries).toString()).isEqualTo("{\"b\":1,\"a\":2}");
    }
}
