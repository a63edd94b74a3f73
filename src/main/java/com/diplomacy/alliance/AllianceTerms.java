package com.diplomacy.alliance;

import com.diplomacy.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the terms on the table in one negotiation round.
 *
 * Updates never mutate a snapshot: {@link #withOverrides(Map)} validates the
 * requested changes and returns a new snapshot with {@code version + 1}.
 * Unknown keys and values of the wrong shape are rejected as a whole; a
 * partially applied override never escapes.
 */
public record AllianceTerms(
    @JsonProperty("alliance_name") String allianceName,
    @JsonProperty("alliance_type") AllianceType allianceType,
    @JsonProperty("version") int version,
    @JsonProperty("duration_months") Integer durationMonths,
    @JsonProperty("auto_renew") boolean autoRenew,
    @JsonProperty("military_terms") MilitaryTerms military,
    @JsonProperty("economic_terms") EconomicTerms economic,
    @JsonProperty("diplomatic_terms") DiplomaticTerms diplomatic,
    @JsonProperty("territorial_terms") TerritorialTerms territorial,
    @JsonProperty("exit_clauses") List<String> exitClauses,
    @JsonProperty("dispute_resolution") String disputeResolution,
    @JsonProperty("activation_triggers") List<String> activationTriggers,
    @JsonProperty("suspension_conditions") List<String> suspensionConditions
) {

    public AllianceTerms {
        exitClauses = List.copyOf(exitClauses);
        activationTriggers = List.copyOf(activationTriggers);
        suspensionConditions = List.copyOf(suspensionConditions);
    }

    public record MilitaryTerms(
        @JsonProperty("mutual_defense") boolean mutualDefense,
        @JsonProperty("offensive_coordination") boolean offensiveCoordination,
        @JsonProperty("military_support_level") double militarySupportLevel,
        @JsonProperty("shared_intelligence") boolean sharedIntelligence,
        @JsonProperty("joint_military_exercises") boolean jointMilitaryExercises
    ) {}

    public record EconomicTerms(
        @JsonProperty("trade_preferences") boolean tradePreferences,
        @JsonProperty("resource_sharing") Map<String, Double> resourceSharing,
        @JsonProperty("economic_support_level") double economicSupportLevel,
        @JsonProperty("shared_infrastructure") boolean sharedInfrastructure,
        @JsonProperty("joint_economic_projects") boolean jointEconomicProjects
    ) {
        public EconomicTerms {
            resourceSharing = Map.copyOf(resourceSharing);
        }
    }

    public record DiplomaticTerms(
        @JsonProperty("diplomatic_coordination") boolean diplomaticCoordination,
        @JsonProperty("shared_embassies") boolean sharedEmbassies,
        @JsonProperty("cultural_exchange") boolean culturalExchange,
        @JsonProperty("joint_diplomatic_missions") boolean jointDiplomaticMissions
    ) {}

    public record TerritorialTerms(
        @JsonProperty("territory_access") Map<String, List<String>> territoryAccess,
        @JsonProperty("shared_borders") boolean sharedBorders,
        @JsonProperty("territorial_guarantees") boolean territorialGuarantees
    ) {
        public TerritorialTerms {
            territoryAccess = Map.copyOf(territoryAccess);
        }
    }

    public static Builder builder(AllianceType type) {
        return new Builder(type);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public boolean isEnabled(AllianceTerm term) {
        return switch (term) {
            case MUTUAL_DEFENSE -> military.mutualDefense();
            case OFFENSIVE_COORDINATION -> military.offensiveCoordination();
            case SHARED_INTELLIGENCE -> military.sharedIntelligence();
            case JOINT_MILITARY_EXERCISES -> military.jointMilitaryExercises();
            case TRADE_PREFERENCES -> economic.tradePreferences();
            case SHARED_INFRASTRUCTURE -> economic.sharedInfrastructure();
            case JOINT_ECONOMIC_PROJECTS -> economic.jointEconomicProjects();
            case DIPLOMATIC_COORDINATION -> diplomatic.diplomaticCoordination();
            case SHARED_EMBASSIES -> diplomatic.sharedEmbassies();
            case CULTURAL_EXCHANGE -> diplomatic.culturalExchange();
            case JOINT_DIPLOMATIC_MISSIONS -> diplomatic.jointDiplomaticMissions();
            case SHARED_BORDERS -> territorial.sharedBorders();
            case TERRITORIAL_GUARANTEES -> territorial.territorialGuarantees();
            case AUTO_RENEW -> autoRenew;
        };
    }

    public Set<AllianceTerm> enabledTerms() {
        Set<AllianceTerm> enabled = EnumSet.noneOf(AllianceTerm.class);
        for (AllianceTerm term : AllianceTerm.values()) {
            if (isEnabled(term)) {
                enabled.add(term);
            }
        }
        return enabled;
    }

    /**
     * Applies flat, snake_case keyed overrides, e.g. {@code {"mutual_defense": true,
     * "military_support_level": 0.7}}, producing the next version.
     *
     * @throws ValidationException for unknown keys, wrong value types or out-of-range scalars
     */
    public AllianceTerms withOverrides(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Builder builder = toBuilder();
        overrides.forEach(builder::apply);
        builder.version(version + 1);
        return builder.build();
    }

    public static final class Builder {
        private final AllianceType type;
        private String allianceName;
        private int version = 1;
        private Integer durationMonths;
        private double militarySupportLevel;
        private double economicSupportLevel;
        private final EnumSet<AllianceTerm> enabled = EnumSet.noneOf(AllianceTerm.class);
        private Map<String, Double> resourceSharing = new LinkedHashMap<>();
        private Map<String, List<String>> territoryAccess = new LinkedHashMap<>();
        private List<String> exitClauses = new ArrayList<>();
        private String disputeResolution = "negotiation";
        private List<String> activationTriggers = new ArrayList<>();
        private List<String> suspensionConditions = new ArrayList<>();

        private Builder(AllianceType type) {
            this.type = type;
            this.allianceName = capitalize(type.getValue()) + " Alliance";
        }

        private Builder(AllianceTerms terms) {
            this.type = terms.allianceType();
            this.allianceName = terms.allianceName();
            this.version = terms.version();
            this.durationMonths = terms.durationMonths();
            this.militarySupportLevel = terms.military().militarySupportLevel();
            this.economicSupportLevel = terms.economic().economicSupportLevel();
            this.enabled.addAll(terms.enabledTerms());
            this.resourceSharing = new LinkedHashMap<>(terms.economic().resourceSharing());
            this.territoryAccess = new LinkedHashMap<>(terms.territorial().territoryAccess());
            this.exitClauses = new ArrayList<>(terms.exitClauses());
            this.disputeResolution = terms.disputeResolution();
            this.activationTriggers = new ArrayList<>(terms.activationTriggers());
            this.suspensionConditions = new ArrayList<>(terms.suspensionConditions());
        }

        public Builder enable(AllianceTerm term) {
            enabled.add(term);
            return this;
        }

        public Builder set(AllianceTerm term, boolean on) {
            if (on) {
                enabled.add(term);
            } else {
                enabled.remove(term);
            }
            return this;
        }

        public Builder militarySupportLevel(double level) {
            this.militarySupportLevel = unitInterval("military_support_level", level);
            return this;
        }

        public Builder economicSupportLevel(double level) {
            this.economicSupportLevel = unitInterval("economic_support_level", level);
            return this;
        }

        public Builder durationMonths(Integer months) {
            if (months != null && months < 1) {
                throw new ValidationException("duration_months must be positive, got " + months);
            }
            this.durationMonths = months;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public AllianceTerms build() {
            return new AllianceTerms(
                allianceName,
                type,
                version,
                durationMonths,
                enabled.contains(AllianceTerm.AUTO_RENEW),
                new MilitaryTerms(
                    enabled.contains(AllianceTerm.MUTUAL_DEFENSE),
                    enabled.contains(AllianceTerm.OFFENSIVE_COORDINATION),
                    militarySupportLevel,
                    enabled.contains(AllianceTerm.SHARED_INTELLIGENCE),
                    enabled.contains(AllianceTerm.JOINT_MILITARY_EXERCISES)),
                new EconomicTerms(
                    enabled.contains(AllianceTerm.TRADE_PREFERENCES),
                    resourceSharing,
                    economicSupportLevel,
                    enabled.contains(AllianceTerm.SHARED_INFRASTRUCTURE),
                    enabled.contains(AllianceTerm.JOINT_ECONOMIC_PROJECTS)),
                new DiplomaticTerms(
                    enabled.contains(AllianceTerm.DIPLOMATIC_COORDINATION),
                    enabled.contains(AllianceTerm.SHARED_EMBASSIES),
                    enabled.contains(AllianceTerm.CULTURAL_EXCHANGE),
                    enabled.contains(AllianceTerm.JOINT_DIPLOMATIC_MISSIONS)),
                new TerritorialTerms(
                    territoryAccess,
                    enabled.contains(AllianceTerm.SHARED_BORDERS),
                    enabled.contains(AllianceTerm.TERRITORIAL_GUARANTEES)),
                exitClauses,
                disputeResolution,
                activationTriggers,
                suspensionConditions);
        }

        private void apply(String key, Object value) {
            Optional<AllianceTerm> flag = AllianceTerm.byKey(key);
            if (flag.isPresent()) {
                set(flag.get(), requireBoolean(key, value));
                return;
            }
            switch (key) {
                case "alliance_name" -> allianceName = requireText(key, value);
                case "duration_months" -> durationMonths(value == null ? null : requireInteger(key, value));
                case "military_support_level" -> militarySupportLevel(requireNumber(key, value));
                case "economic_support_level" -> economicSupportLevel(requireNumber(key, value));
                case "dispute_resolution" -> disputeResolution = requireText(key, value);
                case "exit_clauses" -> exitClauses = requireStringList(key, value);
                case "activation_triggers" -> activationTriggers = requireStringList(key, value);
                case "suspension_conditions" -> suspensionConditions = requireStringList(key, value);
                case "resource_sharing" -> resourceSharing = requireShares(key, value);
                case "territory_access" -> territoryAccess = requireAccess(key, value);
                case "alliance_type" -> throw new ValidationException("alliance_type cannot be overridden");
                default -> throw new ValidationException("unknown alliance term: " + key);
            }
        }

        private static boolean requireBoolean(String key, Object value) {
            if (!(value instanceof Boolean b)) {
                throw new ValidationException(key + " must be a boolean");
            }
            return b;
        }

        private static String requireText(String key, Object value) {
            if (!(value instanceof String s) || s.isBlank()) {
                throw new ValidationException(key + " must be a non-empty string");
            }
            return s;
        }

        private static double requireNumber(String key, Object value) {
            if (!(value instanceof Number n)) {
                throw new ValidationException(key + " must be a number");
            }
            return n.doubleValue();
        }

        private static int requireInteger(String key, Object value) {
            if (!(value instanceof Number n) || n.doubleValue() != Math.rint(n.doubleValue())) {
                throw new ValidationException(key + " must be an integer");
            }
            double d = n.doubleValue();
            if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new ValidationException(key + " is out of range: " + n);
            }
            return n.intValue();
        }

        private static List<String> requireStringList(String key, Object value) {
            if (!(value instanceof List<?> list)) {
                throw new ValidationException(key + " must be a list of strings");
            }
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (!(item instanceof String s)) {
                    throw new ValidationException(key + " must be a list of strings");
                }
                result.add(s);
            }
            return result;
        }

        private static Map<String, Double> requireShares(String key, Object value) {
            if (!(value instanceof Map<?, ?> map)) {
                throw new ValidationException(key + " must be an object of resource -> share");
            }
            Map<String, Double> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String resource)) {
                    throw new ValidationException(key + " keys must be strings");
                }
                result.put(resource, unitInterval(key + "." + resource, requireNumber(key, entry.getValue())));
            }
            return result;
        }

        private static Map<String, List<String>> requireAccess(String key, Object value) {
            if (!(value instanceof Map<?, ?> map)) {
                throw new ValidationException(key + " must be an object of faction -> regions");
            }
            Map<String, List<String>> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String faction)) {
                    throw new ValidationException(key + " keys must be strings");
                }
                result.put(faction, List.copyOf(requireStringList(key + "." + faction, entry.getValue())));
            }
            return result;
        }

        private static double unitInterval(String key, double value) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new ValidationException(key + " must be within [0, 1], got " + value);
            }
            return value;
        }

        private static String capitalize(String raw) {
            return Character.toUpperCase(raw.charAt(0)) + raw.substring(1);
        }
    }
}
