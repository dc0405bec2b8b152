package io.flagstore;

import com.launchdarkly.sdk.EvaluationDetail;
import com.launchdarkly.sdk.EvaluationReason;
import com.launchdarkly.sdk.LDValue;
import io.flagstore.DataModel.FeatureFlag;

import java.util.List;

import static com.launchdarkly.sdk.EvaluationDetail.NO_VARIATION;

/**
 * Accessors for the evaluation results that are precomputed when a flag is decoded.
 * <p>
 * An evaluation engine calls these instead of building results itself. Each method first checks whether
 * the flag carries a preprocessed value for this kind of result; if so, it returns that same instance.
 * That will normally always be the case, because preprocessing happens as part of deserializing a flag.
 * If somehow no preprocessed value is available, one is constructed on the fly. An index that the flag
 * data does not define produces a {@link EvaluationReason.ErrorKind#MALFORMED_FLAG} result, never an
 * exception.
 */
public abstract class EvaluatorHelpers {
  private EvaluatorHelpers() {}

  /**
   * Returns the result for a flag that is switched off.
   *
   * @param flag the flag
   * @return the result
   */
  public static EvaluationDetail<LDValue> offResult(FeatureFlag flag) {
    if (flag.preprocessed != null) {
      return flag.preprocessed.offResult;
    }
    return evaluationDetailForOffVariation(flag, EvaluationReason.off());
  }

  /**
   * Returns the result for a flag whose prerequisite at the given position failed.
   *
   * @param flag the flag
   * @param prerequisiteIndex the position of the prerequisite in {@link FeatureFlag#getPrerequisites()}
   * @return the result
   */
  public static EvaluationDetail<LDValue> prerequisiteFailedResult(FeatureFlag flag, int prerequisiteIndex) {
    if (flag.preprocessed != null) {
      return resultAt(flag.preprocessed.prerequisiteFailedResults, prerequisiteIndex);
    }
    if (prerequisiteIndex < 0 || prerequisiteIndex >= flag.getPrerequisites().size()) {
      return DataModelPreprocessing.malformedFlagResult();
    }
    return evaluationDetailForOffVariation(flag,
        EvaluationReason.prerequisiteFailed(flag.getPrerequisites().get(prerequisiteIndex).getKey()));
  }

  /**
   * Returns the result for a match on one of the flag's individual targets.
   *
   * @param flag the flag
   * @param targetIndex the position of the target in {@link FeatureFlag#getTargets()}
   * @param contextTarget true to use {@link FeatureFlag#getContextTargets()} instead
   * @return the result
   */
  public static EvaluationDetail<LDValue> targetMatchResult(FeatureFlag flag, int targetIndex, boolean contextTarget) {
    if (flag.preprocessed != null) {
      return resultAt(contextTarget ? flag.preprocessed.contextTargetMatchResults :
        flag.preprocessed.targetMatchResults, targetIndex);
    }
    List<DataModel.Target> targets = contextTarget ? flag.getContextTargets() : flag.getTargets();
    if (targetIndex < 0 || targetIndex >= targets.size()) {
      return DataModelPreprocessing.malformedFlagResult();
    }
    return evaluationDetailForVariation(flag, targets.get(targetIndex).getVariation(), EvaluationReason.targetMatch());
  }

  /**
   * Returns the result for the fallthrough, once the variation has been chosen.
   *
   * @param flag the flag
   * @param variation the variation index
   * @param inExperiment true if the context is part of an experiment
   * @return the result
   */
  public static EvaluationDetail<LDValue> fallthroughResult(FeatureFlag flag, int variation, boolean inExperiment) {
    if (flag.preprocessed != null) {
      return flag.preprocessed.fallthroughResults.forVariation(variation, inExperiment);
    }
    return evaluationDetailForVariation(flag, variation, EvaluationReason.fallthrough(inExperiment));
  }

  /**
   * Returns the result for a rule match, once the variation has been chosen.
   *
   * @param flag the flag
   * @param ruleIndex the position of the rule in {@link FeatureFlag#getRules()}
   * @param variation the variation index
   * @param inExperiment true if the context is part of an experiment
   * @return the result
   */
  public static EvaluationDetail<LDValue> ruleMatchResult(FeatureFlag flag, int ruleIndex, int variation,
      boolean inExperiment) {
    if (ruleIndex < 0 || ruleIndex >= flag.getRules().size()) {
      return DataModelPreprocessing.malformedFlagResult();
    }
    if (flag.preprocessed != null) {
      return flag.preprocessed.ruleResults.get(ruleIndex).forVariation(variation, inExperiment);
    }
    return evaluationDetailForVariation(flag, variation,
        EvaluationReason.ruleMatch(ruleIndex, flag.getRules().get(ruleIndex).getId(), inExperiment));
  }

  static EvaluationDetail<LDValue> evaluationDetailForOffVariation(FeatureFlag flag, EvaluationReason reason) {
    Integer offVariation = flag.getOffVariation();
    if (offVariation == null) { // off variation unspecified - return default value
      return EvaluationDetail.fromValue(LDValue.ofNull(), NO_VARIATION, reason);
    }
    return evaluationDetailForVariation(flag, offVariation, reason);
  }

  static EvaluationDetail<LDValue> evaluationDetailForVariation(FeatureFlag flag, int variation, EvaluationReason reason) {
    if (variation < 0 || variation >= flag.getVariations().size()) {
      return DataModelPreprocessing.malformedFlagResult();
    }
    return EvaluationDetail.fromValue(
        LDValue.normalize(flag.getVariations().get(variation)),
        variation,
        reason);
  }

  private static EvaluationDetail<LDValue> resultAt(List<EvaluationDetail<LDValue>> results, int index) {
    if (index < 0 || index >= results.size()) {
      return DataModelPreprocessing.malformedFlagResult();
    }
    return results.get(index);
  }
}
