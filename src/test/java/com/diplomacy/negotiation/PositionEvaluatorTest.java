package com.diplomacy.negotiation;

import com.diplomacy.alliance.AllianceTerm;
import com.diplomacy.alliance.AllianceType;
import com.diplomacy.faction.FactionSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.diplomacy.faction.Trait.*;
import static com.diplomacy.support.TestFactions.*;
import static org.junit.jupiter.api.Assertions.*;

class PositionEvaluatorTest {

    private final PositionEvaluator evaluator = new PositionEvaluator();

    @Test
    @DisplayName("Ambitious, disciplined warlord position in a military pact")
    void militaryPosition() {
        FactionSnapshot warlord = faction("warlord", AMBITION, 9, DISCIPLINE, 8, PRAGMATISM, 6, INTEGRITY, 4);
        NegotiationPosition position = evaluator.evaluate(warlord, AllianceType.MILITARY);

        assertEquals(NegotiationStance.EAGER, position.stance());
        assertEquals(Set.of(AllianceTerm.OFFENSIVE_COORDINATION, AllianceTerm.MUTUAL_DEFENSE,
            AllianceTerm.JOINT_MILITARY_EXERCISES), position.priorityTerms());
        assertTrue(position.dealBreakers().isEmpty());
        assertEquals(0.5, position.trustRequirement(), 1e-9);
        assertEquals(0.46, position.minimumBenefitThreshold(), 1e-9);
        assertEquals(0.4, position.flexibility(), 1e-9);
        assertTrue(position.acceptedCurrentTerms());
    }

    @Test
    @DisplayName("The type-specific priority follows the alliance type")
    void typeSpecificPriority() {
        FactionSnapshot envoy = faction("envoy", AMBITION, 3, PRAGMATISM, 7, INTEGRITY, 8, DISCIPLINE, 4);

        assertEquals(Set.of(AllianceTerm.TRADE_PREFERENCES),
            evaluator.evaluate(envoy, AllianceType.ECONOMIC).priorityTerms());
        assertEquals(Set.of(AllianceTerm.DIPLOMATIC_COORDINATION),
            evaluator.evaluate(envoy, AllianceType.DIPLOMATIC).priorityTerms());
        assertTrue(evaluator.evaluate(envoy, AllianceType.MILITARY).priorityTerms().isEmpty());
        assertEquals(Set.of(AllianceTerm.OFFENSIVE_COORDINATION),
            evaluator.evaluate(envoy, AllianceType.MILITARY).dealBreakers());
    }
}
