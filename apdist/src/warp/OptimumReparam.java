package warp;

/**
 * An external dynamic-programming engine for optimal reparameterization
 * of SRSFs. Implementations are discovered with
 * {@link java.util.ServiceLoader}.
 */
public interface OptimumReparam {

  /**
   * Finds the warping function that aligns {@code q2} to {@code q1}.
   * @param q1 array[n] SRSF of the reference function.
   * @param t array[n] of grid coordinates.
   * @param q2 array[n] SRSF of the function to be aligned.
   * @param lambda weight of the penalty on warping roughness.
   * @param gridDim resolution of the search grid.
   * @return array[n] warping function with values in [0,1].
   */
  public double[] reparam(
      double[] q1, double[] t, double[] q2, double lambda, int gridDim);
}
