package distance;

import java.util.logging.Logger;

import edu.mines.jtk.util.Check;
import edu.mines.jtk.util.Parallel;
import edu.mines.jtk.util.Stopwatch;

import warp.AlignmentOptions;

/**
 * Amplitude and phase distances between all ordered pairs of a set of
 * functions sampled on a shared domain.
 * <p>
 * Every pair is an independent query. Rows are computed in parallel
 * unless parallel computation is disabled; the warping provider of 
 * the distance must then be safe to call from several threads.
 */
public class DistanceMatrix {

  /**
   * Constructs a distance matrix for the specified distance.
   * @param apd the amplitude-phase distance.
   */
  public DistanceMatrix(AmplitudePhaseDistance apd) {
    Check.argument(apd!=null,"apd!=null");
    _apd = apd;
    _options = new AlignmentOptions();
    _parallel = true;
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
   * Sets whether rows are computed in parallel. Default is true.
   * @param parallel true, for parallel; false, for serial.
   */
  public void setParallel(boolean parallel) {
    _parallel = parallel;
  }

  /**
   * Computes distances between all ordered pairs of functions. Element 
   * [i][j] aligns function j to reference function i; diagonal elements
   * are zero.
   * @param x array[n] of strictly increasing domain coordinates.
   * @param f array[m][n] of functions.
   * @return array {da,dp} of amplitude and phase distances, each 
   *  array[m][m].
   */
  public double[][][] compute(final double[] x, final double[][] f) {
    Check.argument(f!=null && f.length>0,"at least one function");
    final int m = f.length;
    final double[][] da = new double[m][m];
    final double[][] dp = new double[m][m];
    Stopwatch s = new Stopwatch();
    s.start();
    if (_parallel) {
      Parallel.loop(m,new Parallel.LoopInt() {
      public void compute(int i) {
        computeRow(i,x,f,da[i],dp[i]);
      }});
    } else {
      for (int i=0; i<m; i++)
        computeRow(i,x,f,da[i],dp[i]);
    }
    s.stop();
    LOG.fine("Computed "+m*(m-1)+" distances in "+s.time()+" seconds");
    return new double[][][]{da,dp};
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final Logger LOG =
      Logger.getLogger(DistanceMatrix.class.getName());

  private AmplitudePhaseDistance _apd;
  private AlignmentOptions _options;
  private boolean _parallel;

  private void computeRow(
      int i, double[] x, double[][] f, double[] dai, double[] dpi)
  {
    int m = f.length;
    for (int j=0; j<m; j++) {
      if (j==i)
        continue;
      AmplitudePhase ap = _apd.compute(x,f[i],f[j],_options);
      dai[j] = ap.getAmplitude();
      dpi[j] = ap.getPhase();
    }
  }
}
