package com.dexsentinel.core.rules;

import com.dexsentinel.core.model.AnomalyFinding;
import com.dexsentinel.core.model.CreatureRecord;
import com.dexsentinel.core.model.RecordValidationException;
import com.dexsentinel.core.model.SampleRecords;
import com.dexsentinel.core.model.Severity;
import com.dexsentinel.core.model.StatBlock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleEngine}.
 */
class RuleEngineTest {

    private RuleEngine engine;

    @BeforeEach
    void setUp() {
        engine = RuleEngine.withDefaults();
    }

    @Test
    @DisplayName("Should find nothing wrong with a clean record")
    void shouldPassCleanRecord() {
        assertThat(engine.evaluate(SampleRecords.pikachu())).isEmpty();
    }

    @Test
    @DisplayName("Should fire exactly negative_stats for a record with negative hp")
    void shouldFireNegativeStatsOnly() {
        List<AnomalyFinding> findings = engine.evaluate(SampleRecords.withNegativeHp(25, "pikachu"));

        assertThat(findings).hasSize(1);
        AnomalyFinding finding = findings.get(0);
        assertThat(finding.getRuleId()).isEqualTo("negative_stats");
        assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(finding.getDescription()).isEqualTo("Negative stats detected: hp=-5");
        assertThat(finding.getDetails()).containsEntry("violations", List.of("hp=-5"));
    }

    @Test
    @DisplayName("Should return findings in registration order, identically on every call")
    void shouldBeDeterministic() {
        CreatureRecord record = SampleRecords.withNegativeHp(7, "squirtle").toBuilder()
                .types(List.of("water", "cosmic"))
                .spriteFront(null)
                .spriteShiny(null)
                .build();

        List<AnomalyFinding> first = engine.evaluate(record);
        List<AnomalyFinding> second = engine.evaluate(record);

        assertThat(first).extracting(AnomalyFinding::getRuleId)
                .containsExactly("negative_stats", "invalid_type", "missing_sprite");
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should not mutate the evaluated record")
    void shouldNotMutateRecord() {
        CreatureRecord record = SampleRecords.withNegativeHp(7, "squirtle");
        CreatureRecord before = record.toBuilder().build();

        engine.evaluate(record);

        assertThat(record).isEqualTo(before);
    }

    @Test
    @DisplayName("Should tolerate absent optional fields")
    void shouldTolerateAbsentFields() {
        CreatureRecord sparse = CreatureRecord.builder().id(1).name("missingno").build();

        assertThat(engine.evaluate(sparse)).extracting(AnomalyFinding::getRuleId)
                .containsExactly("missing_sprite");
    }

    @Test
    @DisplayName("Should reject records without identity")
    void shouldRejectRecordsWithoutIdentity() {
        assertThatThrownBy(() -> engine.evaluate(null))
                .isInstanceOf(RecordValidationException.class);
        assertThatThrownBy(() -> engine.evaluate(CreatureRecord.builder().name("ghost").build()))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("has no id");
        assertThatThrownBy(() -> engine.evaluate(CreatureRecord.builder().id(3).build()))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("has no name");
    }

    @Test
    @DisplayName("Should skip a rule whose check throws and keep evaluating the rest")
    void shouldSkipFailingRule() {
        engine.register(new AnomalyRule("broken", "custom", Severity.LOW, "broken", true,
                record -> {
                    throw new IllegalStateException("boom");
                }));
        engine.register(new AnomalyRule("always", "custom", Severity.LOW, "always fires", true,
                record -> List.of("x")));

        assertThat(engine.evaluate(SampleRecords.pikachu()))
                .extracting(AnomalyFinding::getRuleId)
                .containsExactly("always");
    }

    @Test
    @DisplayName("Should replace a re-registered rule in place")
    void shouldReplaceInPlace() {
        engine.register(new AnomalyRule("negative_stats", "negative_stats", Severity.LOW,
                "Stats below zero", true, BuiltInChecks.negativeStats()));

        assertThat(engine.rules()).extracting(AnomalyRule::getId)
                .containsExactly("negative_stats", "invalid_type", "missing_sprite");
        assertThat(engine.evaluate(SampleRecords.withNegativeHp(1, "a")).get(0).getSeverity())
                .isEqualTo(Severity.LOW);
    }

    @Test
    @DisplayName("Should disable and re-enable a rule by id")
    void shouldToggleRule() {
        CreatureRecord record = SampleRecords.withNegativeHp(1, "a");

        assertThat(engine.setEnabled("negative_stats", false)).isTrue();
        assertThat(engine.evaluate(record)).isEmpty();

        assertThat(engine.setEnabled("negative_stats", true)).isTrue();
        assertThat(engine.evaluate(record)).hasSize(1);

        assertThat(engine.setEnabled("nope", true)).isFalse();
    }

    @Test
    @DisplayName("Should remove a rule by id")
    void shouldRemoveRule() {
        assertThat(engine.remove("invalid_type")).isTrue();
        assertThat(engine.remove("invalid_type")).isFalse();
        assertThat(engine.rule("invalid_type")).isEmpty();
    }

    @Test
    @DisplayName("Should swap the whole rule set on reconfigure")
    void shouldReconfigure() {
        AnomalyRule extreme = new AnomalyRule("extreme_stats", "extreme_stats", Severity.MEDIUM,
                "Extreme stats detected: %s", true, BuiltInChecks.extremeStats(1, 255));

        engine.reconfigure(List.of(extreme));

        CreatureRecord record = SampleRecords.pikachu().toBuilder()
                .stats(StatBlock.of(35, 999, 40, 50, 50, 90))
                .build();
        assertThat(engine.rules()).containsExactly(extreme);
        assertThat(engine.evaluate(record)).extracting(AnomalyFinding::getRuleId)
                .containsExactly("extreme_stats");
    }
}
