package manifold;

/**
 * A tangent vector produced by the logarithm map, together with the 
 * geodesic distance between the two points it joins.
 */
public class Tangent {

  /**
   * Constructs a tangent.
   * @param vector array[n] tangent vector.
   * @param theta geodesic distance (angle) from the base point.
   */
  public Tangent(double[] vector, double theta) {
    _vector = vector;
    _theta = theta;
  }

  public double[] getVector() {
    return _vector;
  }

  public double getTheta() {
    return _theta;
  }

  private double[] _vector;
  private double _theta;
}
