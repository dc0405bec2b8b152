package io.flagstore;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.gson.annotations.JsonAdapter;
import com.launchdarkly.sdk.AttributeRef;
import com.launchdarkly.sdk.ContextKind;
import com.launchdarkly.sdk.LDValue;
import io.flagstore.DataModelPreprocessing.FlagPreprocessed;
import io.flagstore.DataModelPreprocessing.SegmentPreprocessed;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptySet;

/**
 * The flag and segment items held by the stores.
 * <p>
 * A {@link io.flagstore.subsystems.ReadOnlyStore} returns {@link FeatureFlag} instances for
 * {@link io.flagstore.subsystems.DataStoreTypes.DataKind#FEATURES} and {@link Segment} instances for
 * {@link io.flagstore.subsystems.DataStoreTypes.DataKind#SEGMENTS}. Only getters are public, so that an
 * evaluator in another package can read items but nothing outside this package can build or change them.
 * <p>
 * Classes decoded reflectively by Gson need a no-argument constructor and non-final fields; classes with
 * their own type adapter in {@link DataModelSerialization} use final fields. List and set getters return an
 * empty collection when the JSON omitted the property. {@link FeatureFlag} and {@link Segment} carry a
 * transient {@code preprocessed} field that is filled in by {@code preprocess()} after decoding.
 */
public abstract class DataModel {
  private DataModel() {}

  /**
   * What flags and segments have in common: a key, a version, and whether the item is a tombstone.
   */
  public interface VersionedData {
    String getKey();

    int getVersion();

    boolean isDeleted();
  }

  /**
   * A feature flag definition. Evaluation happens elsewhere; this class only holds the decoded data.
   */
  @JsonAdapter(JsonHelpers.PreprocessingAdapterFactory.class)
  public static final class FeatureFlag implements VersionedData, JsonHelpers.Preprocessable {
    private String key;
    private int version;
    private boolean on;
    private List<Prerequisite> prerequisites;
    private String salt;
    private List<Target> targets;
    private List<Target> contextTargets;
    private List<Rule> rules;
    private VariationOrRollout fallthrough;
    private Integer offVariation; //optional
    private List<LDValue> variations;
    private boolean clientSide;
    private boolean trackEvents;
    private boolean trackEventsFallthrough;
    private Long debugEventsUntilDate;
    private boolean deleted;
    private ClientSideAvailability clientSideAvailability;
    private Long samplingRatio;
    private Migration migration;
    private boolean excludeFromSummaries;

    transient FlagPreprocessed preprocessed;

    FeatureFlag() {}

    FeatureFlag(String key, int version, boolean on, List<Prerequisite> prerequisites, String salt, List<Target> targets,
        List<Target> contextTargets, List<Rule> rules, VariationOrRollout fallthrough, Integer offVariation,
        List<LDValue> variations, boolean clientSide, boolean trackEvents, boolean trackEventsFallthrough,
        Long debugEventsUntilDate, boolean deleted) {
      this(key, version, on, prerequisites, salt, targets, contextTargets, rules, fallthrough, offVariation,
          variations, clientSide, trackEvents, trackEventsFallthrough, debugEventsUntilDate, deleted,
          null, null, null, false);
    }

    FeatureFlag(String key, int version, boolean on, List<Prerequisite> prerequisites, String salt, List<Target> targets,
        List<Target> contextTargets, List<Rule> rules, VariationOrRollout fallthrough, Integer offVariation,
        List<LDValue> variations, boolean clientSide, boolean trackEvents, boolean trackEventsFallthrough,
        Long debugEventsUntilDate, boolean deleted, ClientSideAvailability clientSideAvailability,
        Long samplingRatio, Migration migration, boolean excludeFromSummaries) {
      this.key = key;
      this.version = version;
      this.on = on;
      this.prerequisites = prerequisites;
      this.salt = salt;
      this.targets = targets;
      this.contextTargets = contextTargets;
      this.rules = rules;
      this.fallthrough = fallthrough;
      this.offVariation = offVariation;
      this.variations = variations;
      this.clientSide = clientSide;
      this.trackEvents = trackEvents;
      this.trackEventsFallthrough = trackEventsFallthrough;
      this.debugEventsUntilDate = debugEventsUntilDate;
      this.deleted = deleted;
      this.clientSideAvailability = clientSideAvailability;
      this.samplingRatio = samplingRatio;
      this.migration = migration;
      this.excludeFromSummaries = excludeFromSummaries;
    }

    public int getVersion() {
      return version;
    }

    public String getKey() {
      return key;
    }

    public boolean isTrackEvents() {
      return trackEvents;
    }

    public boolean isTrackEventsFallthrough() {
      return trackEventsFallthrough;
    }

    public Long getDebugEventsUntilDate() {
      return debugEventsUntilDate;
    }

    public boolean isDeleted() {
      return deleted;
    }

    public boolean isOn() {
      return on;
    }

    public List<Prerequisite> getPrerequisites() {
      return prerequisites == null ? emptyList() : prerequisites;
    }

    public String getSalt() {
      return salt;
    }

    public List<Target> getTargets() {
      return targets == null ? emptyList() : targets;
    }

    public List<Target> getContextTargets() {
      return contextTargets == null ? emptyList() : contextTargets;
    }

    public List<Rule> getRules() {
      return rules == null ? emptyList() : rules;
    }

    public VariationOrRollout getFallthrough() {
      return fallthrough;
    }

    public List<LDValue> getVariations() {
      return variations == null ? emptyList() : variations;
    }

    public Integer getOffVariation() {
      return offVariation;
    }

    public boolean isClientSide() {
      return clientSide;
    }

    public ClientSideAvailability getClientSideAvailability() {
      return clientSideAvailability;
    }

    // null means every evaluation event is kept
    public Long getSamplingRatio() {
      return samplingRatio;
    }

    public Migration getMigration() {
      return migration;
    }

    public boolean isExcludeFromSummaries() {
      return excludeFromSummaries;
    }

    public void preprocess() {
      DataModelPreprocessing.preprocessFlag(this);
    }
  }

  /**
   * Which client-side credentials may see a flag.
   */
  public static final class ClientSideAvailability {
    private boolean usingMobileKey;
    private boolean usingEnvironmentId;

    ClientSideAvailability() {}

    ClientSideAvailability(boolean usingMobileKey, boolean usingEnvironmentId) {
      this.usingMobileKey = usingMobileKey;
      this.usingEnvironmentId = usingEnvironmentId;
    }

    public boolean isUsingMobileKey() {
      return usingMobileKey;
    }

    public boolean isUsingEnvironmentId() {
      return usingEnvironmentId;
    }
  }

  /**
   * Settings for a flag that drives a migration.
   */
  public static final class Migration {
    private Long checkRatio;

    Migration() {}

    Migration(Long checkRatio) {
      this.checkRatio = checkRatio;
    }

    public Long getCheckRatio() {
      return checkRatio;
    }
  }

  /**
   * Names another flag that has to return {@code variation} before this flag's own rules are used.
   */
  public static final class Prerequisite {
    private String key;
    private int variation;

    Prerequisite() {}

    Prerequisite(String key, int variation) {
      this.key = key;
      this.variation = variation;
    }

    public String getKey() {
      return key;
    }

    public int getVariation() {
      return variation;
    }
  }

  /**
   * Individual targeting: contexts with one of these keys get {@code variation}.
   */
  public static final class Target {
    private ContextKind contextKind;
    private Set<String> values;
    private int variation;

    Target() {}

    Target(ContextKind contextKind, Set<String> values, int variation) {
      this.contextKind = contextKind;
      this.values = values;
      this.variation = variation;
    }

    public ContextKind getContextKind() {
      return contextKind;
    }

    public Collection<String> getValues() {
      return values == null ? emptySet() : values;
    }

    public int getVariation() {
      return variation;
    }
  }

  /**
   * A flag rule. All clauses must match; the inherited variation or rollout says what to serve then.
   */
  public static final class Rule extends VariationOrRollout {
    private String id;
    private List<Clause> clauses;
    private boolean trackEvents;

    Rule() {
      super();
    }

    Rule(String id, List<Clause> clauses, Integer variation, Rollout rollout, boolean trackEvents) {
      super(variation, rollout);
      this.id = id;
      this.clauses = clauses;
      this.trackEvents = trackEvents;
    }

    public String getId() {
      return id;
    }

    public List<Clause> getClauses() {
      return clauses == null ? emptyList() : clauses;
    }

    public boolean isTrackEvents() {
      return trackEvents;
    }
  }

  /**
   * One condition in a rule. The condition holds if the attribute matches any of the values, inverted
   * when {@code negate} is set.
   */
  @JsonAdapter(DataModelSerialization.ClauseTypeAdapter.class)
  public static final class Clause {
    private final ContextKind contextKind;
    private final AttributeRef attribute;
    private final Operator op;
    private final List<LDValue> values;
    private final boolean negate;

    Clause(ContextKind contextKind, AttributeRef attribute, Operator op, List<LDValue> values, boolean negate) {
      this.contextKind = contextKind;
      this.attribute = attribute;
      this.op = op;
      this.values = values == null ? emptyList() : values;
      this.negate = negate;
    }

    public ContextKind getContextKind() {
      return contextKind;
    }

    public AttributeRef getAttribute() {
      return attribute;
    }

    public Operator getOp() {
      return op;
    }

    public List<LDValue> getValues() {
      return values;
    }

    public boolean isNegate() {
      return negate;
    }
  }

  /**
   * Splits contexts into weighted buckets.
   */
  @JsonAdapter(DataModelSerialization.RolloutTypeAdapter.class)
  public static final class Rollout {
    private final ContextKind contextKind;
    private final List<WeightedVariation> variations;
    private final AttributeRef bucketBy;
    private final RolloutKind kind;
    private final Integer seed;

    Rollout(ContextKind contextKind, List<WeightedVariation> variations, AttributeRef bucketBy, RolloutKind kind, Integer seed) {
      this.contextKind = contextKind;
      this.variations = variations == null ? emptyList() : variations;
      this.bucketBy = bucketBy;
      this.kind = kind;
      this.seed = seed;
    }

    public ContextKind getContextKind() {
      return contextKind;
    }

    public List<WeightedVariation> getVariations() {
      return variations;
    }

    public AttributeRef getBucketBy() {
      return bucketBy;
    }

    public RolloutKind getKind() {
      return this.kind;
    }

    public Integer getSeed() {
      return this.seed;
    }

    public boolean isExperiment() {
      return kind == RolloutKind.experiment;
    }
  }

  /**
   * What a rule or fallthrough serves: a fixed variation index, or a rollout. Well-formed data sets
   * exactly one of them.
   */
  public static class VariationOrRollout {
    private Integer variation;
    private Rollout rollout;

    VariationOrRollout() {}

    VariationOrRollout(Integer variation, Rollout rollout) {
      this.variation = variation;
      this.rollout = rollout;
    }

    public Integer getVariation() {
      return variation;
    }

    public Rollout getRollout() {
      return rollout;
    }
  }

  /**
   * One bucket of a rollout. Weights are in units of 1/100000.
   */
  public static final class WeightedVariation {
    private int variation;
    private int weight;
    private boolean untracked;

    WeightedVariation() {}

    WeightedVariation(int variation, int weight, boolean untracked) {
      this.variation = variation;
      this.weight = weight;
      this.untracked = untracked;
    }

    public int getVariation() {
      return variation;
    }

    public int getWeight() {
      return weight;
    }

    public boolean isUntracked() {
      return untracked;
    }
  }

  /**
   * A named group of contexts that flag rules and other segments refer to with {@code segmentMatch}.
   */
  @JsonAdapter(JsonHelpers.PreprocessingAdapterFactory.class)
  public static final class Segment implements VersionedData, JsonHelpers.Preprocessable {
    private String key;
    private Set<String> included;
    private Set<String> excluded;
    private List<SegmentTarget> includedContexts;
    private List<SegmentTarget> excludedContexts;
    private String salt;
    private List<SegmentRule> rules;
    private int version;
    private boolean deleted;
    private boolean unbounded;
    private ContextKind unboundedContextKind;
    private Integer generation;

    transient SegmentPreprocessed preprocessed;

    Segment() {}

    Segment(String key,
            Set<String> included,
            Set<String> excluded,
            List<SegmentTarget> includedContexts,
            List<SegmentTarget> excludedContexts,
            String salt,
            List<SegmentRule> rules,
            int version,
            boolean deleted,
            boolean unbounded,
            ContextKind unboundedContextKind,
            Integer generation) {
      this.key = key;
      this.included = included;
      this.excluded = excluded;
      this.includedContexts = includedContexts;
      this.excludedContexts = excludedContexts;
      this.salt = salt;
      this.rules = rules;
      this.version = version;
      this.deleted = deleted;
      this.unbounded = unbounded;
      this.unboundedContextKind = unboundedContextKind;
      this.generation = generation;
    }

    public String getKey() {
      return key;
    }

    public Collection<String> getIncluded() {
      return included == null ? emptySet() : included;
    }

    public Collection<String> getExcluded() {
      return excluded == null ? emptySet() : excluded;
    }

    public List<SegmentTarget> getIncludedContexts() {
      return includedContexts == null ? emptyList() : includedContexts;
    }

    public List<SegmentTarget> getExcludedContexts() {
      return excludedContexts == null ? emptyList() : excludedContexts;
    }

    public String getSalt() {
      return salt;
    }

    public List<SegmentRule> getRules() {
      return rules == null ? emptyList() : rules;
    }

    public int getVersion() {
      return version;
    }

    public boolean isDeleted() {
      return deleted;
    }

    public boolean isUnbounded() {
      return unbounded;
    }

    public ContextKind getUnboundedContextKind() {
      return unboundedContextKind;
    }

    public Integer getGeneration() {
      return generation;
    }

    public void preprocess() {
      DataModelPreprocessing.preprocessSegment(this);
    }
  }

  /**
   * A segment rule. When {@code weight} is set, only that share of the matching contexts is included.
   */
  @JsonAdapter(DataModelSerialization.SegmentRuleTypeAdapter.class)
  public static final class SegmentRule {
    private final List<Clause> clauses;
    private final Integer weight;
    private final ContextKind rolloutContextKind;
    private final AttributeRef bucketBy;

    SegmentRule(List<Clause> clauses, Integer weight, ContextKind rolloutContextKind, AttributeRef bucketBy) {
      this.clauses = clauses == null ? emptyList() : clauses;
      this.weight = weight;
      this.rolloutContextKind = rolloutContextKind;
      this.bucketBy = bucketBy;
    }

    public List<Clause> getClauses() {
      return clauses;
    }

    public Integer getWeight() {
      return weight;
    }

    public ContextKind getRolloutContextKind() {
      return rolloutContextKind;
    }

    public AttributeRef getBucketBy() {
      return bucketBy;
    }
  }

  // Keys of one context kind listed in a segment's includedContexts or excludedContexts.
  public static class SegmentTarget {
    private ContextKind contextKind;
    private Set<String> values;

    SegmentTarget(ContextKind contextKind, Set<String> values) {
      this.contextKind = contextKind;
      this.values = values;
    }

    public ContextKind getContextKind() {
      return contextKind;
    }

    public Set<String> getValues() {
      return values == null ? emptySet() : values;
    }
  }

  /**
   * A clause operator.
   * <p>
   * Not an enum: a data set written by a newer service may contain operators this code does not know, and
   * such a clause must still decode. Known operators are shared instances and can be compared with
   * {@code ==}; an unknown one is a fresh instance that is equal to any other with the same name.
   */
  public static final class Operator {
    private final String name;
    private final boolean builtin;

    private Operator(String name, boolean builtin) {
      this.name = name;
      this.builtin = builtin;
    }

    public static final Operator in = new Operator("in", true);
    public static final Operator startsWith = new Operator("startsWith", true);
    public static final Operator endsWith = new Operator("endsWith", true);
    public static final Operator matches = new Operator("matches", true);
    public static final Operator contains = new Operator("contains", true);
    public static final Operator lessThan = new Operator("lessThan", true);
    public static final Operator lessThanOrEqual = new Operator("lessThanOrEqual", true);
    public static final Operator greaterThan = new Operator("greaterThan", true);
    public static final Operator greaterThanOrEqual = new Operator("greaterThanOrEqual", true);
    public static final Operator before = new Operator("before", true);
    public static final Operator after = new Operator("after", true);
    public static final Operator semVerEqual = new Operator("semVerEqual", true);
    public static final Operator semVerLessThan = new Operator("semVerLessThan", true);
    public static final Operator semVerGreaterThan = new Operator("semVerGreaterThan", true);
    public static final Operator segmentMatch = new Operator("segmentMatch", true);

    private static final Map<String, Operator> KNOWN = Maps.uniqueIndex(ImmutableList.of(
        in, startsWith, endsWith, matches, contains, lessThan, lessThanOrEqual, greaterThan,
        greaterThanOrEqual, before, after, semVerEqual, semVerLessThan, semVerGreaterThan, segmentMatch),
        Operator::name);

    /**
     * @param name the operator name from the JSON data
     * @return the shared instance for a known name, otherwise a new non-builtin operator
     */
    public static Operator forName(String name) {
      Operator known = KNOWN.get(name);
      return known != null ? known : new Operator(name, false);
    }

    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      if (other == this) {
        return true;
      }
      // builtins are only ever equal to themselves
      return !builtin && other instanceof Operator && !((Operator)other).builtin &&
          ((Operator)other).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /**
   * How a rollout is used. The constant names are the JSON values.
   */
  public enum RolloutKind {
    rollout,
    experiment
  }
}
