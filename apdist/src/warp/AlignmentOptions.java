package warp;

import java.util.Map;
import java.util.Properties;

import edu.mines.jtk.util.Check;

/**
 * Options for finding the warping function that aligns two SRSFs.
 * <p>
 * Recognized keys when read from a map are {@code optim}, 
 * {@code lambda} and {@code grid_dim}. The only optimization method is
 * dynamic programming, {@code "DP"}.
 */
public class AlignmentOptions {

  /**
   * The dynamic programming optimization method.
   */
  public static final String DP = "DP";

  /**
   * Constructs default options: dynamic programming with no penalty
   * and a search grid of dimension 7.
   */
  public AlignmentOptions() {
    _optim = DP;
    _lambda = 0.0;
    _gridDim = 7;
  }

  /**
   * Returns options read from the specified map.
   * @param options map of option names to values; values may be
   *  strings or numbers.
   * @return the options.
   * @throws IllegalArgumentException if a key is not recognized or a
   *  value is invalid.
   */
  public static AlignmentOptions fromMap(Map<String,?> options) {
    AlignmentOptions ao = new AlignmentOptions();
    for (Map.Entry<String,?> e : options.entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      Check.argument(value!=null,"option "+key+" has a value");
      if (OPTIM.equals(key)) {
        ao.setOptim(value.toString());
      } else if (LAMBDA.equals(key)) {
        ao.setLambda(OptionValues.toDouble(key,value));
      } else if (GRID_DIM.equals(key)) {
        ao.setGridDim(OptionValues.toInt(key,value));
      } else {
        throw new IllegalArgumentException(
            key+" is not a recognized alignment option.");
      }
    }
    return ao;
  }

  /**
   * Returns options read from the specified properties.
   * @param properties the properties.
   * @return the options.
   */
  public static AlignmentOptions fromProperties(Properties properties) {
    return fromMap(OptionValues.toMap(properties));
  }

  /**
   * Sets the optimization method.
   * @param optim the method; must be {@code "DP"}.
   * @throws IllegalArgumentException if the method is not recognized.
   */
  public void setOptim(String optim) {
    if (!DP.equals(optim))
      throw new IllegalArgumentException(
          "Method "+optim+" for gamma optimization is not recognized");
    _optim = optim;
  }

  /**
   * Sets the weight of the penalty on warping roughness.
   * @param lambda the non-negative weight.
   */
  public void setLambda(double lambda) {
    Check.argument(lambda>=0.0,"lambda>=0.0");
    _lambda = lambda;
  }

  /**
   * Sets the resolution of the dynamic programming search grid.
   * @param gridDim the positive grid dimension.
   */
  public void setGridDim(int gridDim) {
    Check.argument(gridDim>0,"gridDim>0");
    _gridDim = gridDim;
  }

  public String getOptim() {
    return _optim;
  }

  public double getLambda() {
    return _lambda;
  }

  public int getGridDim() {
    return _gridDim;
  }

  @Override
  public String toString() {
    return "optim="+_optim+", lambda="+_lambda+", grid_dim="+_gridDim;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private static final String OPTIM = "optim";
  private static final String LAMBDA = "lambda";
  private static final String GRID_DIM = "grid_dim";

  private String _optim;
  private double _lambda;
  private int _gridDim;
}
