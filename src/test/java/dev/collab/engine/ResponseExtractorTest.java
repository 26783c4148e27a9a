package dev.collab.engine;

import dev.collab.model.DecisionValue;
import dev.collab.model.ExtractionResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseExtractorTest {

    @Test
    void extractsTrailingControlBlock() {
        var result = ResponseExtractor.extract("""
            Created file X.
            {"content":"done","decisions":{"approved":true}}""");

        assertThat(result).isInstanceOf(ExtractionResult.Success.class);
        var success = (ExtractionResult.Success) result;
        assertThat(success.content()).isEqualTo("done");
        assertThat(success.decisions()).containsExactly(Map.entry("approved", DecisionValue.TRUE));
    }

    @Test
    void acceptsFencedPrettyPrintedBlock() {
        var result = ResponseExtractor.extract("""
            I wrote collab/architect/design.md.

            ```json
            {
              "content": "Design ready",
              "decisions": {
                "design_ready": true,
                "score": 7
              }
            }
            ```
            """);

        assertThat(result).isInstanceOf(ExtractionResult.Success.class);
        var success = (ExtractionResult.Success) result;
        assertThat(success.content()).isEqualTo("Design ready");
        assertThat(success.decisions())
            .containsEntry("design_ready", DecisionValue.TRUE)
            .containsEntry("score", DecisionValue.of(7));
    }

    @Test
    void skipsBracesInEarlierProse() {
        var result = ResponseExtractor.extract("""
            def config(): return {'debug': True}
            Use a {placeholder} here.
            {"content": "ok", "decisions": {}}""");

        assertThat(result).isInstanceOf(ExtractionResult.Success.class);
        assertThat(((ExtractionResult.Success) result).decisions()).isEmpty();
    }

    @Test
    void walksOutwardPastNestedObjects() {
        var result = ResponseExtractor.extract(
            "Reviewed.\n{\"content\":\"ok\",\"decisions\":{\"review\":{\"score\":9},\"files\":[\"a.py\"]}}");

        assertThat(result).isInstanceOf(ExtractionResult.Success.class);
        var decisions = ((ExtractionResult.Success) result).decisions();
        assertThat(decisions.get("review"))
            .isEqualTo(new DecisionValue.Mapping(Map.of("score", DecisionValue.of(9))));
        assertThat(decisions.get("files"))
            .isEqualTo(new DecisionValue.Array(List.of(DecisionValue.of("a.py"))));
    }

    @Test
    void keepsNumbersBeyondDoubleRangeExact() {
        var result = ResponseExtractor.extract("done\n{\"content\":\"x\",\"decisions\":{\"score\":1e400,\"ratio\":0.1}}");

        assertThat(result).isInstanceOf(ExtractionResult.Success.class);
        var decisions = ((ExtractionResult.Success) result).decisions();
        assertThat(decisions.get("score")).isEqualTo(new DecisionValue.Number(new BigDecimal("1e400")));
        assertThat(decisions.get("ratio")).isEqualTo(new DecisionValue.Number(new BigDecimal("0.1")));
    }

    @Test
    void keepsBracesInsideContentString() {
        var result = ResponseExtractor.extract("{\"content\": \"added {x} support\", \"decisions\": {\"done\": true}}");

        assertThat(result).isInstanceOf(ExtractionResult.Success.class);
        assertThat(((ExtractionResult.Success) result).content()).isEqualTo("added {x} support");
    }

    @Test
    void failsWithoutJson() {
        var result = ResponseExtractor.extract("I forgot the control block.");

        assertThat(result).isInstanceOf(ExtractionResult.Failure.class);
        assertThat(((ExtractionResult.Failure) result).error()).contains("No JSON control block");
    }

    @Test
    void failsWhenTextFollowsTheJson() {
        var result = ResponseExtractor.extract("{\"content\":\"x\",\"decisions\":{}}\nLet me know if you need more.");

        assertThat(result).isInstanceOf(ExtractionResult.Failure.class);
    }

    @Test
    void failsOnEmptyResponse() {
        assertThat(ResponseExtractor.extract("  \n")).isEqualTo(new ExtractionResult.Failure("Empty response", null));
        assertThat(ResponseExtractor.extract(null)).isInstanceOf(ExtractionResult.Failure.class);
    }

    @Test
    void reportsMalformedJson() {
        var result = ResponseExtractor.extract("Done.\n{\"content\": \"x\", \"decisions\": {\"a\": true}");

        assertThat(result).isInstanceOf(ExtractionResult.Failure.class);
        assertThat(((ExtractionResult.Failure) result).error()).startsWith("Invalid JSON");
    }

    @Test
    void requiresDecisionsObject() {
        var missing = ResponseExtractor.extract("{\"content\": \"x\"}");
        var wrongType = ResponseExtractor.extract("{\"content\": \"x\", \"decisions\": [1]}");

        assertThat(missing).isInstanceOf(ExtractionResult.Failure.class);
        assertThat(((ExtractionResult.Failure) missing).error()).contains("'decisions'");
        assertThat(((ExtractionResult.Failure) wrongType).error()).contains("non-object 'decisions'");
    }

    @Test
    void requiresStringContent() {
        var result = ResponseExtractor.extract("{\"content\": 5, \"decisions\": {}}");

        assertThat(result).isInstanceOf(ExtractionResult.Failure.class);
        assertThat(((ExtractionResult.Failure) result).error()).contains("'content'");
    }

    @Test
    void rejectsObjectsWithoutControlFields() {
        var result = ResponseExtractor.extract("Here is the config: {\"debug\": true}");

        assertThat(result).isInstanceOf(ExtractionResult.Failure.class);
        assertThat(((ExtractionResult.Failure) result).error()).contains("'content' and 'decisions'");
    }
}
