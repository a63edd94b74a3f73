package com.diplomacy.relationship;

import com.diplomacy.config.DiplomacyProperties;
import com.diplomacy.faction.AttributeProvider;
import com.diplomacy.faction.DiplomacyStatusProvider;
import com.diplomacy.faction.FactionSnapshot;
import com.diplomacy.faction.Scores;
import com.diplomacy.trust.InteractionRecord;
import com.diplomacy.trust.PairKey;
import com.diplomacy.trust.RelationshipStore;
import com.diplomacy.trust.TrustCategory;
import com.diplomacy.trust.TrustEvolution;
import com.diplomacy.trust.TrustLedger;
import com.diplomacy.trust.TrustSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Derives trends, predictions and reputation from the trust ledger and the
 * interaction history. Reads only; the one write is the lazy seeding of a
 * pair that has no trust record yet.
 */
public class RelationshipAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RelationshipAnalyzer.class);

    private static final double NEUTRAL = 0.5;

    private final DiplomacyProperties.Trust trustConfig;
    private final DiplomacyProperties.Network networkConfig;
    private final RelationshipForecast forecast;
    private final TrustLedger ledger;
    private final RelationshipStore store;
    private final AttributeProvider attributes;
    private final DiplomacyStatusProvider statusProvider;
    private final Clock clock;

    public RelationshipAnalyzer(DiplomacyProperties.Trust trustConfig,
                                DiplomacyProperties.Network networkConfig,
                                RelationshipForecast forecast,
                                TrustLedger ledger,
                                RelationshipStore store,
                                AttributeProvider attributes,
                                DiplomacyStatusProvider statusProvider,
                                Clock clock) {
        this.trustConfig = trustConfig;
        this.networkConfig = networkConfig;
        this.forecast = forecast;
        this.ledger = ledger;
        this.store = store;
        this.attributes = attributes;
        this.statusProvider = statusProvider;
        this.clock = clock;
    }

    /**
     * @throws com.diplomacy.error.FactionNotFoundException if either faction is unknown
     */
    public RelationshipSummary summarize(String factionA, String factionB) {
        PairKey pair = PairKey.of(factionA, factionB);
        FactionSnapshot first = attributes.getFaction(pair.first());
        FactionSnapshot second = attributes.getFaction(pair.second());

        TrustEvolution trust = ledger.initialize(pair.first(), pair.second());
        List<InteractionRecord> interactions = store.getInteractions(pair.first(), pair.second());
        Instant now = Instant.now(clock);

        int positive = (int) interactions.stream().filter(InteractionRecord::isPositive).count();
        int negative = (int) interactions.stream().filter(InteractionRecord::isNegative).count();
        Optional<InteractionRecord> firstSeen = interactions.stream().min(Comparator.comparing(InteractionRecord::timestamp));
        Optional<InteractionRecord> lastSeen = interactions.stream().max(Comparator.comparing(InteractionRecord::timestamp));
        long durationDays = firstSeen.map(i -> Duration.between(i.timestamp(), now).toDays()).orElse(0L);

        double significance = trustConfig.getSignificanceThreshold();
        InteractionRecord bestEvent = interactions.stream()
            .filter(i -> i.trustImpact() > significance)
            .max(Comparator.comparingDouble(InteractionRecord::trustImpact))
            .orElse(null);
        InteractionRecord worstEvent = interactions.stream()
            .filter(i -> i.trustImpact() < -significance)
            .min(Comparator.comparingDouble(InteractionRecord::trustImpact))
            .orElse(null);

        RelationshipTrend trend = trend(trust, now);
        double mutual = trust.mutualTrust();
        double allianceProbability = forecast.allianceProbability(mutual, trust.baselineCompatibility(), trust.volatility());
        double conflictProbability = forecast.conflictProbability(mutual, trust.baselineCompatibility(), trust.volatility());
        log.debug("Relationship {}: trust={}, trend={}, alliance={}, conflict={}",
            pair, mutual, trend.getValue(), allianceProbability, conflictProbability);

        return new RelationshipSummary(
            first.factionId(),
            second.factionId(),
            first.name(),
            second.name(),
            TrustCategory.of(mutual),
            mutual,
            trust.aTrustsB(),
            trust.bTrustsA(),
            trend,
            statusProvider.getStatus(first.factionId(), second.factionId()),
            durationDays,
            interactions.size(),
            positive,
            negative,
            forecast.predictTrajectory(trend, trust.baselineCompatibility()),
            allianceProbability,
            conflictProbability,
            forecast.stabilityScore(trust),
            lastSeen.map(InteractionRecord::timestamp).orElse(null),
            bestEvent,
            worstEvent,
            turningPoints(interactions));
    }

    /**
     * Aggregates every recorded relationship of the faction. A faction nobody
     * has dealt with sits at neutral.
     *
     * @throws com.diplomacy.error.FactionNotFoundException if the faction is unknown
     */
    public FactionReputation reputation(String factionId) {
        FactionSnapshot faction = attributes.getFaction(factionId);
        List<TrustEvolution> relationships = store.getTrustEvolutionsInvolving(factionId);

        List<Double> trustInFaction = new ArrayList<>();
        List<String> alliances = new ArrayList<>();
        List<String> conflicts = new ArrayList<>();
        for (TrustEvolution relationship : relationships) {
            String other = relationship.pair().other(factionId);
            trustInFaction.add(relationship.trustFrom(other));
            if (relationship.mutualTrust() >= networkConfig.getHighTrustThreshold()) {
                alliances.add(other);
            } else if (relationship.mutualTrust() <= networkConfig.getLowTrustThreshold()) {
                conflicts.add(other);
            }
        }
        double overall = trustInFaction.isEmpty() ? NEUTRAL : Scores.mean(trustInFaction);

        List<InteractionRecord> initiated = store.getInteractionsInvolving(factionId).stream()
            .filter(i -> i.initiatorId().equals(factionId))
            .toList();
        double reliability = initiated.isEmpty()
            ? NEUTRAL
            : (double) initiated.stream().filter(i -> i.trustImpact() >= 0).count() / initiated.size();

        return new FactionReputation(
            faction.factionId(),
            faction.name(),
            overall,
            reliability,
            ReputationStanding.of(overall),
            relationships.size(),
            alliances,
            conflicts);
    }

    /**
     * Compares mean trust at the start and end of the analysis window ending at
     * {@code now}. High volatility overrides the direction.
     */
    public RelationshipTrend trend(TrustEvolution trust, Instant now) {
        Instant windowStart = now.minus(trustConfig.getAnalysisWindow());
        List<TrustSample> recent = trust.history().stream()
            .filter(s -> !s.timestamp().isBefore(windowStart))
            .toList();
        if (recent.size() < 2) {
            return RelationshipTrend.STABLE;
        }
        if (trust.volatility() > trustConfig.getVolatilityThreshold()) {
            return RelationshipTrend.VOLATILE;
        }

        double change = recent.get(recent.size() - 1).mean() - recent.get(0).mean();
        return forecast.trendOf(change);
    }

    List<InteractionRecord> turningPoints(List<InteractionRecord> interactions) {
        return interactions.stream()
            .filter(i -> Math.abs(i.trustImpact()) > trustConfig.getSignificanceThreshold())
            .sorted(Comparator.comparingDouble((InteractionRecord i) -> Math.abs(i.trustImpact())).reversed())
            .limit(trustConfig.getTurningPointLimit())
            .toList();
    }
}
