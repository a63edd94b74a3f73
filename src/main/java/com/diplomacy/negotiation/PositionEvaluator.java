package com.diplomacy.negotiation;

import com.diplomacy.alliance.AllianceTerm;
import com.diplomacy.alliance.AllianceType;
import com.diplomacy.faction.FactionSnapshot;
import com.diplomacy.faction.Trait;
import com.diplomacy.faction.TraitVector;

import java.util.EnumSet;
import java.util.Set;

/**
 * Derives a faction's negotiating position from its hidden traits.
 */
public class PositionEvaluator {

    public NegotiationPosition evaluate(FactionSnapshot faction, AllianceType type) {
        TraitVector traits = faction.traits();
        NegotiationStance stance = stance(traits);
        return new NegotiationPosition(
            faction.factionId(),
            faction.name(),
            stance,
            priorityTerms(traits, type),
            dealBreakers(traits),
            0.3 + traits.get(Trait.INTEGRITY) / 20.0,
            0.1 + traits.get(Trait.AMBITION) / 25.0,
            (traits.get(Trait.PRAGMATISM) + (10 - traits.get(Trait.DISCIPLINE))) / 20.0,
            stance == NegotiationStance.EAGER);
    }

    public NegotiationStance stance(TraitVector traits) {
        int ambition = traits.get(Trait.AMBITION);
        int pragmatism = traits.get(Trait.PRAGMATISM);

        if (ambition >= 8 && pragmatism >= 6) {
            return NegotiationStance.EAGER;
        } else if (pragmatism >= 7) {
            return NegotiationStance.INTERESTED;
        } else if (pragmatism >= 4) {
            return NegotiationStance.CAUTIOUS;
        } else if (ambition <= 3) {
            return NegotiationStance.RELUCTANT;
        }
        return NegotiationStance.HOSTILE;
    }

    Set<AllianceTerm> priorityTerms(TraitVector traits, AllianceType type) {
        Set<AllianceTerm> priorities = EnumSet.noneOf(AllianceTerm.class);
        if (traits.get(Trait.AMBITION) >= 7) {
            priorities.add(AllianceTerm.OFFENSIVE_COORDINATION);
        }
        if (traits.get(Trait.DISCIPLINE) >= 6) {
            priorities.add(AllianceTerm.MUTUAL_DEFENSE);
        }
        switch (type) {
            case ECONOMIC -> {
                if (traits.get(Trait.PRAGMATISM) >= 6) {
                    priorities.add(AllianceTerm.TRADE_PREFERENCES);
                }
            }
            case DIPLOMATIC -> {
                if (traits.get(Trait.INTEGRITY) >= 6) {
                    priorities.add(AllianceTerm.DIPLOMATIC_COORDINATION);
                }
            }
            case MILITARY -> {
                if (traits.get(Trait.DISCIPLINE) >= 8) {
                    priorities.add(AllianceTerm.JOINT_MILITARY_EXERCISES);
                }
            }
        }
        return priorities;
    }

    /** Principled factions walk away from offensive pacts. */
    Set<AllianceTerm> dealBreakers(TraitVector traits) {
        if (traits.get(Trait.INTEGRITY) >= 8) {
            return EnumSet.of(AllianceTerm.OFFENSIVE_COORDINATION);
        }
        return EnumSet.noneOf(AllianceTerm.class);
    }
}
