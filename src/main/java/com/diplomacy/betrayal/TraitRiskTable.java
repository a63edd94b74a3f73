package com.diplomacy.betrayal;

import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.faction.Trait;
import com.diplomacy.faction.TraitVector;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-trait betrayal risk adjustments, indexed by trait value 0-10.
 * With the shipped values every table is monotonic: ambition and impulsivity
 * raise risk, integrity and pragmatism lower it.
 */
public final class TraitRiskTable {

    private static final int ENTRIES = TraitVector.MAX - TraitVector.MIN + 1;

    private final Map<Trait, double[]> tables;

    public TraitRiskTable(DiplomacyProperties.Betrayal config) {
        EnumMap<Trait, double[]> loaded = new EnumMap<>(Trait.class);
        loaded.put(Trait.AMBITION, toArray(Trait.AMBITION, config.getAmbitionModifiers()));
        loaded.put(Trait.INTEGRITY, toArray(Trait.INTEGRITY, config.getIntegrityModifiers()));
        loaded.put(Trait.IMPULSIVITY, toArray(Trait.IMPULSIVITY, config.getImpulsivityModifiers()));
        loaded.put(Trait.PRAGMATISM, toArray(Trait.PRAGMATISM, config.getPragmatismModifiers()));
        this.tables = Collections.unmodifiableMap(loaded);
    }

    public double modifier(Trait trait, int value) {
        double[] table = tables.get(trait);
        if (table == null) {
            return 0.0;
        }
        return table[value];
    }

    /** Sum of the modifiers for every governed trait. */
    public double totalModifier(TraitVector traits) {
        double total = 0.0;
        for (Trait trait : tables.keySet()) {
            total += modifier(trait, traits.get(trait));
        }
        return total;
    }

    private static double[] toArray(Trait trait, List<Double> modifiers) {
        if (modifiers == null || modifiers.size() != ENTRIES) {
            throw new IllegalArgumentException("diplomacy.betrayal." + trait.getValue()
                + "-modifiers needs exactly " + ENTRIES + " entries");
        }
        double[] table = new double[ENTRIES];
        for (int i = 0; i < ENTRIES; i++) {
            table[i] = modifiers.get(i);
        }
        return table;
    }
}
