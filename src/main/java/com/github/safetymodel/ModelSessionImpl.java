package com.github.safetymodel;

import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.safetymodel.SafetyModelException.Code;

/**
 * Default {@link ModelSession}: wires one model with its synchronization engine, snapshot codec and
 * undo/redo manager.
 */
public final class ModelSessionImpl implements ModelSession {
  private static final Logger logger = LogManager.getLogger(ModelSessionImpl.class.getSimpleName());

  private final String sessionId = UUID.randomUUID().toString();

  private final ModelSessionConfiguration config;
  private final SafetyModel model;
  private final SnapshotCodec codec = new SnapshotCodec();
  private final SnapshotComparator comparator = new SnapshotComparator();
  private final SynchronizationEngine synchronizationEngine;
  private final UndoRedoManager undoRedoManager;
  private final SessionStatistics sessionStats;

  private boolean sessionAlive;

  ModelSessionImpl(final ModelSessionConfiguration config, final SafetyModel model,
      final Snapshot initialSnapshot) throws SafetyModelException {
    logInfo(sessionId, "Opening model session");
    this.config = config == null ? ModelSessionConfiguration.defaults() : config;
    this.model = model != null ? model
        : new SafetyModel(new CloneResolver(this.config.getMaxCloneHops()),
            this.config.getCloneOffset());
    this.synchronizationEngine = new SynchronizationEngine(this.model);
    this.sessionStats = new SessionStatistics(sessionId);
    this.undoRedoManager = new UndoRedoManager(sessionId, this.model, codec,
        this.config.getMaxHistory(), sessionStats);
    if (initialSnapshot != null) {
      codec.importInto(this.model, initialSnapshot);
    }
    sessionAlive = true;
    logInfo(sessionId, "Opened model session with " + this.config);
  }

  @Override
  public SafetyModel getModel() throws SafetyModelException {
    sessionAlive();
    return model;
  }

  @Override
  public SynchronizationResult synchronize(final Node edited) throws SafetyModelException {
    sessionAlive();
    try {
      final SynchronizationResult result = synchronizationEngine.synchronize(edited);
      sessionStats.totalSynchronizations++;
      sessionStats.totalSkippedBrokenClones += result.getSkippedNodeIds().size();
      if (!result.isComplete()) {
        logWarning(sessionId, "Synchronization skipped broken clones: " + result);
      }
      return result;
    } catch (SafetyModelException problem) {
      if (problem.getCode() == Code.SYNCHRONIZATION_ABORT) {
        sessionStats.totalSynchronizationAborts++;
      }
      logError(sessionId, "Synchronization aborted: " + problem.getMessage());
      throw problem;
    }
  }

  @Override
  public boolean push() throws SafetyModelException {
    return push(config.getDefaultStrategy());
  }

  @Override
  public boolean push(final CoalescingStrategy strategy) throws SafetyModelException {
    sessionAlive();
    return undoRedoManager.push(strategy);
  }

  @Override
  public void commitGesture() throws SafetyModelException {
    sessionAlive();
    undoRedoManager.commitGesture();
  }

  @Override
  public boolean undo() throws SafetyModelException {
    return undo(config.getDefaultStrategy());
  }

  @Override
  public boolean undo(final CoalescingStrategy strategy) throws SafetyModelException {
    sessionAlive();
    return undoRedoManager.undo(strategy);
  }

  @Override
  public boolean redo() throws SafetyModelException {
    return redo(config.getDefaultStrategy());
  }

  @Override
  public boolean redo(final CoalescingStrategy strategy) throws SafetyModelException {
    sessionAlive();
    return undoRedoManager.redo(strategy);
  }

  @Override
  public boolean canUndo() throws SafetyModelException {
    sessionAlive();
    return undoRedoManager.canUndo();
  }

  @Override
  public boolean canRedo() throws SafetyModelException {
    sessionAlive();
    return undoRedoManager.canRedo();
  }

  @Override
  public void clearHistory() throws SafetyModelException {
    sessionAlive();
    undoRedoManager.clearHistory();
  }

  @Override
  public Snapshot exportSnapshot() throws SafetyModelException {
    sessionAlive();
    return codec.export(model);
  }

  @Override
  public void importSnapshot(final Snapshot snapshot) throws SafetyModelException {
    sessionAlive();
    codec.importInto(model, snapshot);
    undoRedoManager.clearHistory();
    logInfo(sessionId, "Imported " + snapshot);
  }

  @Override
  public List<NodeChange> compare(final Snapshot older, final Snapshot newer)
      throws SafetyModelException {
    sessionAlive();
    if (older == null || newer == null) {
      throw new SafetyModelException(Code.INVALID_SNAPSHOT, "Cannot compare a null snapshot");
    }
    return comparator.compare(older, newer);
  }

  @Override
  public String getId() {
    return sessionId;
  }

  @Override
  public ModelSessionConfiguration getConfiguration() {
    return config;
  }

  @Override
  public SessionStatistics getStatistics() {
    return sessionStats;
  }

  @Override
  public boolean alive() {
    return sessionAlive;
  }

  @Override
  public boolean close() {
    if (!sessionAlive) {
      logInfo(sessionId, "Model session is already closed");
      return true;
    }
    sessionAlive = false;
    undoRedoManager.clearHistory();
    logInfo(sessionId, sessionStats.toString());
    logInfo(sessionId, "Closed model session");
    return true;
  }

  UndoRedoManager getUndoRedoManager() {
    return undoRedoManager;
  }

  private void sessionAlive() throws SafetyModelException {
    if (!alive()) {
      throw new SafetyModelException(Code.SESSION_CLOSED,
          "Model session id:" + sessionId + " is closed");
    }
  }

  private static void logError(final String sessionId, final String message) {
    logger.error(new StringBuilder().append("[s:").append(sessionId).append("] ").append(message)
        .toString());
  }

  private static void logWarning(final String sessionId, final String message) {
    logger.warn(new StringBuilder().append("[s:").append(sessionId).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String sessionId, final String message) {
    logger.info(new StringBuilder().append("[s:").append(sessionId).append("] ").append(message)
        .toString());
  }
}
