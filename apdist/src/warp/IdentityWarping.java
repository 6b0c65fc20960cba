package warp;

import edu.mines.jtk.util.Check;

/**
 * Provides the identity warping, gamma(t) = t, whatever the SRSFs.
 * <p>
 * Used explicitly to compare functions without alignment, and as the
 * deterministic replacement for a provider whose engine is unavailable.
 */
public class IdentityWarping implements WarpingProvider {

  /**
   * Constructs an identity warping provider.
   */
  public IdentityWarping() {
    this(null);
  }

  /**
   * Returns an identity warping provider that replaces an unavailable
   * provider.
   * @param warning the reason for the replacement, reported with every 
   *  result computed with the returned provider.
   * @return the provider.
   */
  public static IdentityWarping fallback(String warning) {
    Check.argument(warning!=null,"warning!=null");
    return new IdentityWarping(warning);
  }

  public double[] findWarping(
      double[] t, double[] q1, double[] q2, AlignmentOptions options)
  {
    int n = t.length;
    Check.argument(n>=2,"t.length>=2");
    double t0 = t[0];
    double tr = t[n-1]-t0;
    double[] gamma = new double[n];
    for (int i=0; i<n; i++)
      gamma[i] = (t[i]-t0)/tr;
    return gamma;
  }

  public String getName() {
    return "identity";
  }

  public String getWarning() {
    return _warning;
  }

  /**
   * Returns true if this provider replaces an unavailable provider.
   * @return true, if a fallback; false, otherwise.
   */
  public boolean isFallback() {
    return _warning!=null;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private String _warning;

  private IdentityWarping(String warning) {
    _warning = warning;
  }
}
