package io.flagstore;

import com.launchdarkly.sdk.LDContext;
import com.launchdarkly.sdk.LDValue;
import io.flagstore.interfaces.FlagChangeEvent;
import io.flagstore.interfaces.FlagChangeListener;
import io.flagstore.interfaces.FlagTracker;
import io.flagstore.interfaces.FlagValueChangeEvent;
import io.flagstore.interfaces.FlagValueChangeListener;

import java.util.function.BiFunction;

/**
 * Exposes the flag-change broadcaster to applications. Value-change listeners are wrapped in a
 * {@link ValueWatcher} that re-evaluates one flag for one context whenever that flag is reported as changed.
 */
final class FlagTrackerImpl implements FlagTracker {
  private final EventBroadcasterImpl<FlagChangeListener, FlagChangeEvent> flagChanges;
  private final BiFunction<String, LDContext, LDValue> evaluator;

  FlagTrackerImpl(
      EventBroadcasterImpl<FlagChangeListener, FlagChangeEvent> flagChanges,
      BiFunction<String, LDContext, LDValue> evaluator
      ) {
    this.flagChanges = flagChanges;
    this.evaluator = evaluator;
  }

  @Override
  public void addFlagChangeListener(FlagChangeListener listener) {
    flagChanges.register(listener);
  }

  @Override
  public void removeFlagChangeListener(FlagChangeListener listener) {
    flagChanges.unregister(listener);
  }

  @Override
  public FlagChangeListener addFlagValueChangeListener(String flagKey, LDContext context,
      FlagValueChangeListener listener) {
    ValueWatcher watcher = new ValueWatcher(flagKey, context, evaluator, listener);
    flagChanges.register(watcher);
    return watcher;
  }

  private static final class ValueWatcher implements FlagChangeListener {
    private final String flagKey;
    private final LDContext context;
    private final BiFunction<String, LDContext, LDValue> evaluator;
    private final FlagValueChangeListener target;
    private LDValue lastValue;

    ValueWatcher(String flagKey, LDContext context, BiFunction<String, LDContext, LDValue> evaluator,
        FlagValueChangeListener target) {
      this.flagKey = flagKey;
      this.context = context;
      this.evaluator = evaluator;
      this.target = target;
      this.lastValue = evaluate();
    }

    private LDValue evaluate() {
      return LDValue.normalize(evaluator.apply(flagKey, context));
    }

    @Override
    public void onFlagChange(FlagChangeEvent event) {
      if (!flagKey.equals(event.getKey())) {
        return;
      }
      LDValue newValue = evaluate();
      LDValue oldValue;
      synchronized (this) {
        if (newValue.equals(lastValue)) {
          return;
        }
        oldValue = lastValue;
        lastValue = newValue;
      }
      target.onFlagValueChange(new FlagValueChangeEvent(flagKey, oldValue, newValue));
    }
  }
}
