package manifold;

import static edu.mines.jtk.util.ArrayMath.*;

import java.util.logging.Logger;

import edu.mines.jtk.util.Check;

/**
 * Karcher mean of warping functions by iterative geodesic averaging.
 * <p>
 * Each warping function is represented by psi = sqrt(gamma'). The mean
 * mu starts at the psi nearest to the arithmetic mean of all psi. At
 * every iteration all psi are mapped by the logarithm map into the
 * tangent space at mu, their tangent vectors are averaged, and mu moves
 * a fixed fraction of that average along the exponential map. The
 * iteration stops when the norm of the average is small enough or when
 * the number of iterations reaches its maximum. The mean warping
 * function is the cumulative integral of mu squared, rescaled to the
 * domain range; the center returned is its inverse.
 */
public class KarcherMean {

  /**
   * States of the iteration.
   */
  public enum State {
    INIT,
    ITERATING,
    CONVERGED,
    MAX_ITER_REACHED
  }

  /**
   * The outcome of a Karcher mean computation.
   */
  public static class Result {

    Result(double[] mean, State state, int iterations, double error) {
      _mean = mean;
      _state = state;
      _iterations = iterations;
      _error = error;
    }

    /**
     * Returns the center, the inverse of the mean warping function.
     * @return array[n] center.
     */
    public double[] getMean() {
      return _mean;
    }

    /**
     * Returns the final state, either converged or stopped at the
     * maximum number of iterations.
     * @return the state.
     */
    public State getState() {
      return _state;
    }

    public int getIterations() {
      return _iterations;
    }

    /**
     * Returns the norm of the last average tangent vector.
     * @return the error.
     */
    public double getError() {
      return _error;
    }

    private double[] _mean;
    private State _state;
    private int _iterations;
    private double _error;
  }

  /**
   * Constructs a Karcher mean with step size 0.3, tolerance 1e-6 and at
   * most 501 iterations.
   * @param wm the manifold of warping functions.
   */
  public KarcherMean(WarpingManifold wm) {
    Check.argument(wm!=null,"wm!=null");
    _wm = wm;
    _stepSize = 0.3;
    _tolerance = 1.0e-6;
    _maxIterations = 501;
  }

  /**
   * Sets the fraction of the average tangent vector moved at each step.
   * @param stepSize the step size, in (0,1].
   */
  public void setStepSize(double stepSize) {
    Check.argument(stepSize>0.0 && stepSize<=1.0,"0<stepSize<=1");
    _stepSize = stepSize;
  }

  /**
   * Sets the norm of the average tangent vector at or below which the
   * iteration has converged.
   * @param tolerance the non-negative tolerance.
   */
  public void setTolerance(double tolerance) {
    Check.argument(tolerance>=0.0,"tolerance>=0.0");
    _tolerance = tolerance;
  }

  /**
   * Sets the maximum number of iterations.
   * @param maxIterations the maximum number of iterations.
   */
  public void setMaxIterations(int maxIterations) {
    Check.argument(maxIterations>=0,"maxIterations>=0");
    _maxIterations = maxIterations;
  }

  public double getStepSize() {
    return _stepSize;
  }

  public double getTolerance() {
    return _tolerance;
  }

  public int getMaxIterations() {
    return _maxIterations;
  }

  /**
   * Computes the Karcher mean of the specified warping functions. For a
   * single warping function, the center is its inverse.
   * @param gammas array[m][n] of warping functions.
   * @return the result.
   */
  public Result compute(double[][] gammas) {
    Check.argument(gammas!=null && gammas.length>0,"at least one gamma");
    int m = gammas.length;
    if (m==1)
      return new Result(_wm.inverse(gammas[0]),State.CONVERGED,0,0.0);
    State state = State.INIT;
    double[][] psi = new double[m][];
    for (int k=0; k<m; k++)
      psi[k] = _wm.toPsi(gammas[k]);
    double[] mu = copy(psi[nearestToMean(psi)]);
    int n = mu.length;

    state = State.ITERATING;
    int iter = 0;
    double error;
    double[] vbar = new double[n];
    while (true) {
      fill(0.0,vbar);
      for (int k=0; k<m; k++) {
        double[] v = _wm.log(mu,psi[k]).getVector();
        for (int i=0; i<n; i++)
          vbar[i] += v[i];
      }
      for (int i=0; i<n; i++)
        vbar[i] /= m;
      error = _wm.norm(vbar);
      if (error<=_tolerance) {
        state = State.CONVERGED;
        break;
      }
      if (iter>=_maxIterations) {
        state = State.MAX_ITER_REACHED;
        break;
      }
      mu = _wm.exp(mu,mul(_stepSize,vbar));
      ++iter;
    }
    LOG.fine("Karcher mean of "+m+" warping functions: "+state+
        " after "+iter+" iterations, error="+error);

    double[] gamma = _wm.fromPsi(mu);
    return new Result(_wm.inverse(gamma),state,iter,error);
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final Logger LOG =
      Logger.getLogger(KarcherMean.class.getName());

  private WarpingManifold _wm;
  private double _stepSize;
  private double _tolerance;
  private int _maxIterations;

  // Index of the representation nearest, in the sum of squared
  // differences, to the arithmetic mean of all representations.
  private static int nearestToMean(double[][] psi) {
    int m = psi.length;
    int n = psi[0].length;
    double[] mean = new double[n];
    for (int k=0; k<m; k++)
      for (int i=0; i<n; i++)
        mean[i] += psi[k][i];
    for (int i=0; i<n; i++)
      mean[i] /= m;
    int kmin = 0;
    double dmin = Double.MAX_VALUE;
    for (int k=0; k<m; k++) {
      double d = 0.0;
      for (int i=0; i<n; i++) {
        double di = psi[k][i]-mean[i];
        d += di*di;
      }
      if (d<dmin) {
        dmin = d;
        kmin = k;
      }
    }
    return kmin;
  }
}
