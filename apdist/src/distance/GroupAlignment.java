package distance;

import edu.mines.jtk.dsp.Sampling;
import edu.mines.jtk.util.Check;

import manifold.KarcherMean;
import manifold.WarpingManifold;
import srsf.SquareRootSlope;
import util.Samples;
import warp.AlignmentOptions;

/**
 * Aligns a group of functions to a reference function and summarizes
 * the warping functions by their Karcher mean.
 * <p>
 * Warping functions and the center are returned in domain coordinates;
 * they are computed on the domain rescaled to [0,1], where 
 * representations of warping functions have unit norm.
 */
public class GroupAlignment {

  /**
   * The warping functions, aligned functions, distances and center of
   * a group alignment.
   */
  public static class Result {

    Result(
        double[][] warpings, double[][] aligned, AmplitudePhase[] distances,
        double[] center, KarcherMean.Result karcher)
    {
      _warpings = warpings;
      _aligned = aligned;
      _distances = distances;
      _center = center;
      _karcher = karcher;
    }

    /**
     * Returns the warping functions that align each function to the 
     * reference.
     * @return array[m][n] of warping functions in domain coordinates.
     */
    public double[][] getWarpings() {
      return _warpings;
    }

    /**
     * Returns the functions composed with their warping functions.
     * @return array[m][n] of aligned functions.
     */
    public double[][] getAligned() {
      return _aligned;
    }

    public AmplitudePhase[] getDistances() {
      return _distances;
    }

    /**
     * Returns the Karcher mean of the warping functions.
     * @return array[n] center in domain coordinates.
     */
    public double[] getCenter() {
      return _center;
    }

    public KarcherMean.Result getKarcherResult() {
      return _karcher;
    }

    private double[][] _warpings;
    private double[][] _aligned;
    private AmplitudePhase[] _distances;
    private double[] _center;
    private KarcherMean.Result _karcher;
  }

  /**
   * Constructs a group alignment.
   * @param apd the amplitude-phase distance used for each alignment.
   */
  public GroupAlignment(AmplitudePhaseDistance apd) {
    Check.argument(apd!=null,"apd!=null");
    _apd = apd;
    _options = new AlignmentOptions();
  }

  /**
   * Sets the options used for every alignment.
   * @param options the alignment options.
   */
  public void setOptions(AlignmentOptions options) {
    Check.argument(options!=null,"options!=null");
    _options = options;
  }

  /**
   * Makes the Karcher mean used for the center. Subclasses may override
   * this method to change its step size, tolerance or iteration limit.
   * @param st the domain grid rescaled to [0,1].
   * @return the Karcher mean.
   */
  protected KarcherMean makeKarcherMean(Sampling st) {
    return new KarcherMean(new WarpingManifold(st));
  }

  /**
   * Aligns every function to the reference.
   * @param x array[n] of strictly increasing domain coordinates.
   * @param reference array[n] reference function.
   * @param f array[m][n] of functions to align.
   * @return the result.
   */
  public Result align(double[] x, double[] reference, double[][] f) {
    Check.argument(f!=null && f.length>0,"at least one function");
    Sampling sx = Samples.sampling(x);
    int m = f.length;
    double[][] gu = new double[m][];
    AmplitudePhase[] aps = new AmplitudePhase[m];
    for (int k=0; k<m; k++) {
      aps[k] = _apd.compute(x,reference,f[k],_options);
      gu[k] = aps[k].getWarping();
    }
    Sampling st = Samples.sampling(AmplitudePhaseDistance.unitDomain(x));
    SquareRootSlope srsf = new SquareRootSlope(st);
    double[][] aligned = new double[m][];
    for (int k=0; k<m; k++)
      aligned[k] = srsf.warpF(f[k],gu[k]);
    KarcherMean.Result kr = makeKarcherMean(st).compute(gu);
    double x0 = sx.getFirst();
    double xr = sx.getLast()-x0;
    double[][] gx = new double[m][];
    for (int k=0; k<m; k++)
      gx[k] = toDomain(gu[k],x0,xr);
    return new Result(gx,aligned,aps,toDomain(kr.getMean(),x0,xr),kr);
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private AmplitudePhaseDistance _apd;
  private AlignmentOptions _options;

  private static double[] toDomain(double[] g, double x0, double xr) {
    int n = g.length;
    double[] gx = new double[n];
    for (int i=0; i<n; i++)
      gx[i] = x0+g[i]*xr;
    return gx;
  }
}
