package distance;

import static edu.mines.jtk.util.ArrayMath.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import edu.mines.jtk.dsp.Sampling;
import edu.mines.jtk.util.Check;

import srsf.SquareRootSlope;
import srsf.SquareRootSlope.Derivative;
import util.Quadrature;
import util.Samples;
import warp.AlignmentOptions;
import warp.WarpingProvider;
import warp.WarpingProviders;

/**
 * Elastic distance between two sampled functions, decomposed into 
 * amplitude and phase.
 * <p>
 * The domain is first rescaled to [0,1]. Both functions are converted
 * to SRSFs, a warping provider aligns the second SRSF to the first, and
 * the warping function is renormalized so that its end values equal
 * the domain's. The phase distance measures how far that warping is
 * from the identity; the amplitude distance is what remains between
 * the aligned SRSFs.
 * <p>
 * Both distances return exactly zero when the difference of the SRSFs
 * sums to exactly zero. Functions that are nearly but not bitwise 
 * identical take the general path and may have small nonzero distances.
 */
public class AmplitudePhaseDistance {

  /**
   * Constructs a distance that aligns with dynamic programming, or with
   * the identity warping if no dynamic programming engine is installed.
   */
  public AmplitudePhaseDistance() {
    this(WarpingProviders.dynamicProgramming());
  }

  /**
   * Constructs a distance that aligns with the specified provider.
   * @param provider the warping provider.
   */
  public AmplitudePhaseDistance(WarpingProvider provider) {
    this(provider,Derivative.GRADIENT);
  }

  /**
   * Constructs a distance that aligns with the specified provider.
   * @param provider the warping provider.
   * @param derivative method for derivatives of functions and warpings.
   */
  public AmplitudePhaseDistance(
      WarpingProvider provider, Derivative derivative) 
  {
    Check.argument(provider!=null,"provider!=null");
    Check.argument(derivative!=null,"derivative!=null");
    _provider = provider;
    _derivative = derivative;
  }

  public WarpingProvider getProvider() {
    return _provider;
  }

  /**
   * Computes amplitude and phase distances with default options.
   * @param x array[n] of strictly increasing domain coordinates.
   * @param f1 array[n] reference function.
   * @param f2 array[n] function aligned to the reference.
   * @return the distances.
   */
  public AmplitudePhase compute(double[] x, double[] f1, double[] f2) {
    return compute(x,f1,f2,new AlignmentOptions());
  }

  /**
   * Computes amplitude and phase distances with options read from a map.
   * @param x array[n] of strictly increasing domain coordinates.
   * @param f1 array[n] reference function.
   * @param f2 array[n] function aligned to the reference.
   * @param options map with keys optim, lambda and grid_dim.
   * @return the distances.
   */
  public AmplitudePhase compute(
      double[] x, double[] f1, double[] f2, Map<String,?> options)
  {
    return compute(x,f1,f2,AlignmentOptions.fromMap(options));
  }

  /**
   * Computes amplitude and phase distances.
   * @param x array[n] of strictly increasing domain coordinates.
   * @param f1 array[n] reference function.
   * @param f2 array[n] function aligned to the reference.
   * @param options alignment options.
   * @return the distances.
   */
  public AmplitudePhase compute(
      double[] x, double[] f1, double[] f2, AlignmentOptions options)
  {
    Sampling st = Samples.sampling(unitDomain(x));
    int n = st.getCount();
    Samples.checkSamples(n,f1,"f1");
    Samples.checkSamples(n,f2,"f2");
    Check.argument(options!=null,"options!=null");
    SquareRootSlope srsf = new SquareRootSlope(st,_derivative);
    double[] q1 = srsf.toSrsf(f1);
    double[] q2 = srsf.toSrsf(f2);
    double[] gamma = srsf.getWarping(q1,q2,_provider,options);
    gamma = renormalize(gamma,st);
    double dp = phaseDistance(srsf,q1,q2,gamma);
    double da = amplitudeDistance(srsf,q1,q2,gamma);
    List<String> warnings = new ArrayList<>();
    if (_provider.getWarning()!=null)
      warnings.add(_provider.getWarning());
    return new AmplitudePhase(da,dp,gamma,warnings);
  }

  /**
   * Computes the amplitude distance between two SRSFs, given the warping
   * function that aligns the second to the first.
   * @param st the domain grid.
   * @param q1 array[n] SRSF of the reference function.
   * @param q2 array[n] SRSF of the aligned function.
   * @param gamma array[n] warping function.
   * @return the non-negative amplitude distance.
   */
  public static double amplitudeDistance(
      Sampling st, double[] q1, double[] q2, double[] gamma)
  {
    return amplitudeDistance(new SquareRootSlope(st),q1,q2,gamma);
  }

  /**
   * Computes the amplitude distance between two SRSFs, with warping
   * derivatives estimated by the specified transform.
   * @param srsf the SRSF transform for the domain grid.
   * @param q1 array[n] SRSF of the reference function.
   * @param q2 array[n] SRSF of the aligned function.
   * @param gamma array[n] warping function.
   * @return the non-negative amplitude distance.
   */
  public static double amplitudeDistance(
      SquareRootSlope srsf, double[] q1, double[] q2, double[] gamma)
  {
    checkSrsfs(srsf,q1,q2);
    if (identical(q1,q2))
      return 0.0;
    double[] t = srsf.getSampling().getValues();
    double[] qw = srsf.warpQ(q2,gamma);
    int n = t.length;
    double[] y = new double[n];
    for (int i=0; i<n; i++) {
      double d = qw[i]-q1[i];
      y[i] = d*d;
    }
    return sqrt(max(0.0,Quadrature.trapz(y,t)));
  }

  /**
   * Computes the phase distance of the warping function that aligns
   * two SRSFs.
   * @param st the domain grid.
   * @param q1 array[n] SRSF of the reference function.
   * @param q2 array[n] SRSF of the aligned function.
   * @param gamma array[n] warping function.
   * @return the phase distance, in [0,pi].
   */
  public static double phaseDistance(
      Sampling st, double[] q1, double[] q2, double[] gamma)
  {
    return phaseDistance(new SquareRootSlope(st),q1,q2,gamma);
  }

  /**
   * Computes the phase distance, with warping derivatives estimated by
   * the specified transform. The cosine of this distance is the inner 
   * product of sqrt(gamma') with the representation of the identity.
   * @param srsf the SRSF transform for the domain grid.
   * @param q1 array[n] SRSF of the reference function.
   * @param q2 array[n] SRSF of the aligned function.
   * @param gamma array[n] warping function.
   * @return the phase distance, in [0,pi].
   */
  public static double phaseDistance(
      SquareRootSlope srsf, double[] q1, double[] q2, double[] gamma)
  {
    checkSrsfs(srsf,q1,q2);
    if (identical(q1,q2))
      return 0.0;
    double[] t = srsf.getSampling().getValues();
    double theta = Quadrature.trapz(srsf.sqrtSlope(gamma),t);
    theta = max(-1.0,min(1.0,theta));
    return acos(theta);
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private WarpingProvider _provider;
  private Derivative _derivative;

  private static void checkSrsfs(
      SquareRootSlope srsf, double[] q1, double[] q2)
  {
    Check.argument(srsf!=null,"srsf!=null");
    int n = srsf.getSampling().getCount();
    Samples.checkSamples(n,q1,"q1");
    Samples.checkSamples(n,q2,"q2");
  }

  // Exact test; near-identical inputs are deliberately not treated as equal.
  private static boolean identical(double[] q1, double[] q2) {
    Check.argument(q1.length==q2.length,"q1.length==q2.length");
    return sum(sub(q1,q2))==0.0;
  }

  // Coordinates rescaled to [0,1], with exact ends.
  static double[] unitDomain(double[] x) {
    Sampling sx = Samples.sampling(x);
    double x0 = sx.getFirst();
    double xr = sx.getLast()-x0;
    int n = x.length;
    double[] t = new double[n];
    for (int i=0; i<n; i++)
      t[i] = (x[i]-x0)/xr;
    t[n-1] = 1.0;
    return t;
  }

  // Rescales gamma so that its end values equal the domain's end values.
  private static double[] renormalize(double[] gamma, Sampling st) {
    int n = gamma.length;
    double g0 = gamma[0];
    double gr = gamma[n-1]-g0;
    Check.state(gr>0.0,"warping function increases over the domain");
    double t0 = st.getFirst();
    double tr = st.getLast()-t0;
    double[] g = new double[n];
    for (int i=0; i<n; i++)
      g[i] = (gamma[i]-g0)/gr*tr+t0;
    g[0] = t0;
    g[n-1] = st.getLast();
    return g;
  }
}
