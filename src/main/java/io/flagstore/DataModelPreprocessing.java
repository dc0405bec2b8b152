package io.flagstore;

import com.google.common.collect.ImmutableList;
import com.launchdarkly.sdk.EvaluationDetail;
import com.launchdarkly.sdk.EvaluationReason;
import com.launchdarkly.sdk.EvaluationReason.ErrorKind;
import com.launchdarkly.sdk.LDValue;
import io.flagstore.DataModel.Clause;
import io.flagstore.DataModel.FeatureFlag;
import io.flagstore.DataModel.Operator;
import io.flagstore.DataModel.Prerequisite;
import io.flagstore.DataModel.Rule;
import io.flagstore.DataModel.Segment;
import io.flagstore.DataModel.SegmentRule;
import io.flagstore.DataModel.Target;
import io.flagstore.DataModel.VariationOrRollout;
import io.flagstore.DataModel.WeightedVariation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.launchdarkly.sdk.EvaluationDetail.NO_VARIATION;

/**
 * Derived data computed once per decoded flag or segment, so that an evaluator does not rebuild the same
 * result objects on every evaluation.
 * <p>
 * {@code FeatureFlag.preprocess()} and {@code Segment.preprocess()} call in here right after decoding, while
 * the item is still private to the decoding thread, so nothing here is synchronized. The same pass checks
 * variation indices and attribute references. A problem is recorded as a message on the result instead
 * of being thrown, so a partly malformed item is still stored; whoever decoded it logs the messages.
 * <p>
 * An item built without going through {@code preprocess()} has a null {@code preprocessed} field.
 */
abstract class DataModelPreprocessing {
  private DataModelPreprocessing() {}

  static final String EMPTY_ATTRIBUTE_ERROR = "attribute reference cannot be empty";

  static final class EvalResultsForSingleVariation {
    private final EvaluationDetail<LDValue> regularResult;
    private final EvaluationDetail<LDValue> inExperimentResult;

    EvalResultsForSingleVariation(
        LDValue value,
        int variationIndex,
        EvaluationReason regularReason,
        EvaluationReason inExperimentReason
        ) {
      this.regularResult = EvaluationDetail.fromValue(value, variationIndex, regularReason);
      this.inExperimentResult = EvaluationDetail.fromValue(value, variationIndex, inExperimentReason);
    }

    EvaluationDetail<LDValue> getResult(boolean inExperiment) {
      return inExperiment ? inExperimentResult : regularResult;
    }
  }

  static final class EvalResultFactoryMultiVariations {
    private final List<EvalResultsForSingleVariation> variations;

    EvalResultFactoryMultiVariations(
        List<EvalResultsForSingleVariation> variations
        ) {
      this.variations = variations;
    }

    EvaluationDetail<LDValue> forVariation(int index, boolean inExperiment) {
      if (index < 0 || index >= variations.size()) {
        return malformedFlagResult();
      }

      if (variations.get(index) == null) {
        // the preprocessor only fills in the indices that the rule can actually select
        return EvaluationDetail.fromValue(LDValue.ofNull(), NO_VARIATION,
            EvaluationReason.error(ErrorKind.EXCEPTION));
      }

      return variations.get(index).getResult(inExperiment);
    }
  }

  /**
   * Everything precomputed for one version of a flag. Lists are parallel to the corresponding lists in
   * the flag: the Nth prerequisite result belongs to the Nth prerequisite, and so on.
   */
  static final class FlagPreprocessed {
    final EvaluationDetail<LDValue> offResult;
    final EvalResultFactoryMultiVariations fallthroughResults;
    final List<EvaluationDetail<LDValue>> prerequisiteFailedResults;
    final List<EvaluationDetail<LDValue>> targetMatchResults;
    final List<EvaluationDetail<LDValue>> contextTargetMatchResults;
    final List<EvalResultFactoryMultiVariations> ruleResults;
    final List<String> inconsistencies;

    FlagPreprocessed(
        EvaluationDetail<LDValue> offResult,
        EvalResultFactoryMultiVariations fallthroughResults,
        List<EvaluationDetail<LDValue>> prerequisiteFailedResults,
        List<EvaluationDetail<LDValue>> targetMatchResults,
        List<EvaluationDetail<LDValue>> contextTargetMatchResults,
        List<EvalResultFactoryMultiVariations> ruleResults,
        List<String> inconsistencies
        ) {
      this.offResult = offResult;
      this.fallthroughResults = fallthroughResults;
      this.prerequisiteFailedResults = prerequisiteFailedResults;
      this.targetMatchResults = targetMatchResults;
      this.contextTargetMatchResults = contextTargetMatchResults;
      this.ruleResults = ruleResults;
      this.inconsistencies = inconsistencies;
    }
  }

  static final class SegmentPreprocessed {
    final List<String> inconsistencies;

    SegmentPreprocessed(List<String> inconsistencies) {
      this.inconsistencies = inconsistencies;
    }
  }

  static void preprocessFlag(FeatureFlag f) {
    List<String> errors = new ArrayList<>();

    preprocessValueList(f.getVariations());
    checkVariationOrRollout(f, f.getFallthrough(), "fallthrough", errors);
    if (f.getOffVariation() != null) {
      checkVariationRange(f, f.getOffVariation(), "off variation", errors);
    }

    ImmutableList.Builder<EvaluationDetail<LDValue>> prereqResults = ImmutableList.builder();
    for (Prerequisite p: f.getPrerequisites()) {
      checkVariationRange(f, p.getVariation(), "prerequisite", errors);
      prereqResults.add(EvaluatorHelpers.evaluationDetailForOffVariation(f,
          EvaluationReason.prerequisiteFailed(p.getKey())));
    }

    ImmutableList.Builder<EvaluationDetail<LDValue>> targetResults = ImmutableList.builder();
    for (Target t: f.getTargets()) {
      targetResults.add(preprocessTarget(t, f, errors));
    }
    ImmutableList.Builder<EvaluationDetail<LDValue>> contextTargetResults = ImmutableList.builder();
    for (Target t: f.getContextTargets()) {
      contextTargetResults.add(preprocessTarget(t, f, errors));
    }

    ImmutableList.Builder<EvalResultFactoryMultiVariations> ruleResults = ImmutableList.builder();
    List<Rule> rules = f.getRules();
    int n = rules.size();
    for (int i = 0; i < n; i++) {
      ruleResults.add(preprocessFlagRule(rules.get(i), i, f, errors));
    }

    f.preprocessed = new FlagPreprocessed(
        EvaluatorHelpers.evaluationDetailForOffVariation(f, EvaluationReason.off()),
        precomputeMultiVariationResultsForFlag(f, EvaluationReason.fallthrough(false),
            EvaluationReason.fallthrough(true)),
        prereqResults.build(),
        targetResults.build(),
        contextTargetResults.build(),
        ruleResults.build(),
        Collections.unmodifiableList(errors)
        );
  }

  static void preprocessSegment(Segment s) {
    List<String> errors = new ArrayList<>();
    for (SegmentRule r: s.getRules()) {
      for (Clause c: r.getClauses()) {
        preprocessClause(c, errors);
      }
    }
    s.preprocessed = new SegmentPreprocessed(Collections.unmodifiableList(errors));
  }

  private static EvaluationDetail<LDValue> preprocessTarget(Target t, FeatureFlag f, List<String> errors) {
    checkVariationRange(f, t.getVariation(), "target", errors);
    return EvaluatorHelpers.evaluationDetailForVariation(f, t.getVariation(), EvaluationReason.targetMatch());
  }

  private static EvalResultFactoryMultiVariations preprocessFlagRule(Rule r, int ruleIndex, FeatureFlag f,
      List<String> errors) {
    for (Clause c: r.getClauses()) {
      preprocessClause(c, errors);
    }
    checkVariationOrRollout(f, r, "rule", errors);
    EvaluationReason ruleMatchReason = EvaluationReason.ruleMatch(ruleIndex, r.getId(), false);
    EvaluationReason ruleMatchReasonInExperiment = EvaluationReason.ruleMatch(ruleIndex, r.getId(), true);
    return precomputeMultiVariationResultsForRule(f, r, ruleMatchReason, ruleMatchReasonInExperiment);
  }

  private static void preprocessClause(Clause c, List<String> errors) {
    preprocessValueList(c.getValues());
    if (c.getOp() == Operator.segmentMatch) {
      // segmentMatch clauses name segments in their values and have no attribute
      return;
    }
    if (c.getAttribute() == null) {
      errors.add("clause has invalid attribute: " + EMPTY_ATTRIBUTE_ERROR);
    } else if (!c.getAttribute().isValid()) {
      errors.add("clause has invalid attribute: " + c.getAttribute().getError());
    }
  }

  private static void checkVariationOrRollout(FeatureFlag f, VariationOrRollout vr, String description,
      List<String> errors) {
    if (vr == null) {
      return;
    }
    if (vr.getVariation() != null) {
      checkVariationRange(f, vr.getVariation(), description, errors);
    }
    if (vr.getRollout() != null) {
      for (WeightedVariation wv: vr.getRollout().getVariations()) {
        checkVariationRange(f, wv.getVariation(), description, errors);
      }
    }
  }

  private static void checkVariationRange(FeatureFlag f, int variation, String description, List<String> errors) {
    if (variation < 0 || variation >= f.getVariations().size()) {
      errors.add(description + " has invalid variation index");
    }
  }

  static void preprocessValueList(List<LDValue> values) {
    // If a list of values contains a null (which is valid in terms of the JSON schema, even if it
    // isn't useful), Gson will give us an actual null. Change this to LDValue.ofNull() to avoid NPEs
    // down the line.
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) == null) {
        values.set(i, LDValue.ofNull());
      }
    }
  }

  static EvaluationDetail<LDValue> malformedFlagResult() {
    return EvaluationDetail.fromValue(LDValue.ofNull(), NO_VARIATION, EvaluationReason.error(ErrorKind.MALFORMED_FLAG));
  }

  private static EvalResultFactoryMultiVariations precomputeMultiVariationResultsForFlag(
      FeatureFlag f,
      EvaluationReason regularReason,
      EvaluationReason inExperimentReason
      ) {
    ArrayList<EvalResultsForSingleVariation> variations = new ArrayList<>(f.getVariations().size());
    for (int i = 0; i < f.getVariations().size(); i++) {
      variations.add(new EvalResultsForSingleVariation(f.getVariations().get(i), i,
          regularReason, inExperimentReason));
    }
    return new EvalResultFactoryMultiVariations(Collections.unmodifiableList(variations));
  }

  private static EvalResultFactoryMultiVariations precomputeMultiVariationResultsForRule(
      FeatureFlag f,
      Rule r,
      EvaluationReason regularReason,
      EvaluationReason inExperimentReason
  ) {
    // Only the indices that the rule can select are filled in; most flags have few variations, so a
    // sparse list is cheaper than a map here.
    List<EvalResultsForSingleVariation> variations = new ArrayList<>(Collections.nCopies(f.getVariations().size(), null));
    if (r.getVariation() != null) {
      int index = r.getVariation();
      if (index >= 0 && index < f.getVariations().size()) {
        variations.set(index, new EvalResultsForSingleVariation(f.getVariations().get(index), index,
            regularReason, inExperimentReason));
      }
    }

    if (r.getRollout() != null) {
      for (WeightedVariation wv : r.getRollout().getVariations()) {
        int index = wv.getVariation();
        if (index >= 0 && index < f.getVariations().size()) {
          variations.set(index, new EvalResultsForSingleVariation(f.getVariations().get(index), index,
              regularReason, inExperimentReason));
        }
      }
    }

    return new EvalResultFactoryMultiVariations(Collections.unmodifiableList(variations));
  }
}
