package com.github.safetymodel;

import java.util.List;

/**
 * An editing session over one safety model: the GUI mutates nodes of {@link #getModel()}, fans
 * shared-field edits out with {@link #synchronize(Node)} and records undo history with
 * {@link #push(CoalescingStrategy)}.
 *
 * Notes for users:<br>
 * 1. this session is NOT thread-safe. It expects to be driven from the single GUI event thread.<br>
 *
 * 2. it is not a singleton, open as many sessions as there are open documents.<br>
 *
 * 3. the call sequence for a typical edit is: push, mutate, synchronize, commitGesture. For a drag:
 * push before every mouse-move step, commitGesture on release. The whole drag then undoes in one
 * step. Pushing after the mutation as well is harmless, identical frames are ignored.<br>
 *
 * 4. the strategy-less push/undo/redo calls use the configured default strategy. All four
 * strategies give the same observable undo behavior.<br>
 *
 * 5. errors surface as {@link SafetyModelException}. An error aborts the single user action and
 * leaves both the model and the undo history as they were.<br>
 *
 * 6. this is a header interface for easier demonstration of the session functionality. It is not
 * meant as a way to extend or create custom sessions.<br>
 */
public interface ModelSession {

  ///// Model & synchronization API /////
  /**
   * The live model forest edited by this session.
   */
  SafetyModel getModel() throws SafetyModelException;

  /**
   * Copy the shared fields of the edited instance to every other instance of its logical identity.
   */
  SynchronizationResult synchronize(final Node edited) throws SafetyModelException;


  ///// Undo/Redo API /////
  /**
   * Capture the live model into the undo history using the default strategy.
   */
  boolean push() throws SafetyModelException;

  boolean push(final CoalescingStrategy strategy) throws SafetyModelException;

  /**
   * End the interactive gesture in progress.
   */
  void commitGesture() throws SafetyModelException;

  /**
   * Returns false, without touching the model, when there is nothing to undo.
   */
  boolean undo() throws SafetyModelException;

  boolean undo(final CoalescingStrategy strategy) throws SafetyModelException;

  /**
   * Returns false, without touching the model, when there is nothing to redo.
   */
  boolean redo() throws SafetyModelException;

  boolean redo(final CoalescingStrategy strategy) throws SafetyModelException;

  boolean canUndo() throws SafetyModelException;

  boolean canRedo() throws SafetyModelException;

  void clearHistory() throws SafetyModelException;


  ///// Snapshot API /////
  Snapshot exportSnapshot() throws SafetyModelException;

  /**
   * Replace the live model, eg. when a file is loaded. The undo history starts afresh.
   */
  void importSnapshot(final Snapshot snapshot) throws SafetyModelException;

  /**
   * Node level differences between two snapshots, eg. to review what changed between versions.
   */
  List<NodeChange> compare(final Snapshot older, final Snapshot newer)
      throws SafetyModelException;


  ///// Session functions /////
  /**
   * Reports the id of this session.
   */
  String getId();

  ModelSessionConfiguration getConfiguration();

  SessionStatistics getStatistics();

  boolean alive();

  /**
   * Drop the history and refuse any further request.
   */
  boolean close();

  /**
   * A simple builder to let users use fluent APIs to open sessions.
   */
  public final static class ModelSessionBuilder {
    private ModelSessionConfiguration config;
    private SafetyModel model;
    private Snapshot initialSnapshot;

    public static ModelSessionBuilder newBuilder() {
      return new ModelSessionBuilder();
    }

    public ModelSessionBuilder config(final ModelSessionConfiguration config) {
      this.config = config;
      return this;
    }

    /**
     * Edit an existing model. It must have been built with the same clone settings as the config.
     */
    public ModelSessionBuilder model(final SafetyModel model) {
      this.model = model;
      return this;
    }

    /**
     * Load this snapshot into the session's model before handing it out.
     */
    public ModelSessionBuilder initialSnapshot(final Snapshot initialSnapshot) {
      this.initialSnapshot = initialSnapshot;
      return this;
    }

    public ModelSession build() throws SafetyModelException {
      return new ModelSessionImpl(config, model, initialSnapshot);
    }

    private ModelSessionBuilder() {}
  }

}
