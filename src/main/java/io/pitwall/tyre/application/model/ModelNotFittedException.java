package io.pitwall.tyre.application.model;

/**
 * Thrown when a health query reaches the model before a fit pass has completed.
 *
 * <p>Callers are expected to check {@link TyreDegradationModel#isFitted()} first rather than catch this.</p>
 *
 * @since 0.1.0
 */
public final class ModelNotFittedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public ModelNotFittedException() {
    super("Model must be fitted before prediction");
  }
}
