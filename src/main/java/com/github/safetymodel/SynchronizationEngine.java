package com.github.safetymodel;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Propagates the shared fields of an edited instance to every other instance of the same logical
 * identity. Local fields, children and parents are never touched.
 *
 * The whole edit is validated before the first instance is written, so an abort leaves every
 * instance as it was.
 */
public final class SynchronizationEngine {
  private static final Logger logger =
      LogManager.getLogger(SynchronizationEngine.class.getSimpleName());

  private final SafetyModel model;
  private final CloneResolver resolver;

  public SynchronizationEngine(final SafetyModel model) {
    this.model = model;
    this.resolver = model.getResolver();
  }

  public SynchronizationResult synchronize(final Node edited) throws SafetyModelException {
    final Node primary = resolver.resolveOriginal(edited);
    for (SharedField<?> field : edited.getSchema()) {
      final Object value = edited.getRawValue(field.getName());
      if (!field.accepts(value)) {
        throw SafetyModelException.synchronizationAbort(edited.getId(), field.getName(), value,
            field.getType());
      }
    }

    final List<Node> targets = new ArrayList<>();
    final List<Long> skipped = new ArrayList<>();
    for (Node candidate : model.allNodes()) {
      if (candidate == edited) {
        continue;
      }
      final Node candidatePrimary;
      try {
        candidatePrimary = resolver.resolveOriginal(candidate);
      } catch (SafetyModelException broken) {
        skipped.add(candidate.getId());
        logWarning(model.getId(), "Skipping instance with broken clone chain: "
            + broken.getMessage());
        continue;
      }
      if (candidatePrimary == primary) {
        targets.add(candidate);
      }
    }

    final List<Long> touched = new ArrayList<>(targets.size());
    for (Node target : targets) {
      for (SharedField<?> field : edited.getSchema()) {
        target.putRawValue(field.getName(), edited.getRawValue(field.getName()));
      }
      target.refreshDisplayLabel();
      touched.add(target.getId());
    }
    edited.refreshDisplayLabel();
    logDebug(model.getId(), "Synchronized node " + edited.getId() + " to " + touched.size()
        + " instance(s) of primary " + primary.getId());
    return new SynchronizationResult(edited.getId(), primary.getId(), touched, skipped);
  }

  private static void logWarning(final String modelId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(modelId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String modelId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(modelId).append("] ").append(message)
          .toString());
    }
  }
}
