package warp;

/**
 * An external engine that finds warping functions by gradient descent
 * on a learned (basis-expanded, layered) warping model with random
 * restarts. Implementations are discovered with
 * {@link java.util.ServiceLoader}; restarts, early stopping once the
 * error falls below the options' eps, and device placement are the
 * engine's business.
 */
public interface GradientReparam {

  /**
   * Finds the warping function that aligns {@code q2} to {@code q1}.
   * @param t array[n] of grid coordinates.
   * @param q1 array[n] SRSF of the reference function.
   * @param q2 array[n] SRSF of the function to be aligned.
   * @param options optimizer options.
   * @return array[n] warping function with values in [0,1].
   */
  public double[] reparam(
      double[] t, double[] q1, double[] q2, LearnedOptions options);
}
