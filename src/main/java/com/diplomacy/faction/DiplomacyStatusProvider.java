package com.diplomacy.faction;

/**
 * Current formal status between two factions. Used for reporting only; no
 * score depends on it.
 */
public interface DiplomacyStatusProvider {

    DiplomaticStatus getStatus(String factionA, String factionB);
}
