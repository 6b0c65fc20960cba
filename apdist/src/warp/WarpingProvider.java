package warp;

/**
 * A source of warping functions that align one SRSF to another.
 * <p>
 * Implementations work on the unit interval: the returned warping
 * function is sampled at the grid coordinates but takes values in
 * [0,1], and its end values need not be exactly 0 and 1. Callers map
 * it onto the domain range and renormalize its end points.
 */
public interface WarpingProvider {

  /**
   * Finds the warping function that aligns {@code q2} to {@code q1}.
   * @param t array[n] of grid coordinates.
   * @param q1 array[n] SRSF of the reference function.
   * @param q2 array[n] SRSF of the function to be aligned.
   * @param options alignment options.
   * @return array[n] warping function with values in [0,1].
   */
  public double[] findWarping(
      double[] t, double[] q1, double[] q2, AlignmentOptions options);

  /**
   * Returns a short name for this provider, used in messages.
   * @return the name.
   */
  public String getName();

  /**
   * Returns a non-fatal warning about this provider, such as the reason
   * it replaced an unavailable one.
   * @return the warning; null, if none.
   */
  public String getWarning();
}
