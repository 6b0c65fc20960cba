package distance;

import java.util.Collections;
import java.util.List;

/**
 * Amplitude and phase distances between two functions, with the 
 * warping function that aligned them.
 */
public class AmplitudePhase {

  /**
   * Constructs a result.
   * @param amplitude the amplitude distance.
   * @param phase the phase distance.
   * @param warping array[n] warping function on the unit interval.
   * @param warnings non-fatal warnings raised while aligning.
   */
  public AmplitudePhase(
      double amplitude, double phase, double[] warping, List<String> warnings)
  {
    _amplitude = amplitude;
    _phase = phase;
    _warping = warping;
    _warnings = Collections.unmodifiableList(warnings);
  }

  /**
   * Returns the amplitude distance, the L2 distance between the SRSFs
   * after alignment.
   * @return the non-negative amplitude distance.
   */
  public double getAmplitude() {
    return _amplitude;
  }

  /**
   * Returns the phase distance, the geodesic distance between the
   * warping function and the identity.
   * @return the phase distance, in [0,pi].
   */
  public double getPhase() {
    return _phase;
  }

  /**
   * Returns the warping function that aligns the second function to the
   * first, sampled on the domain rescaled to [0,1].
   * @return array[n] warping function.
   */
  public double[] getWarping() {
    return _warping.clone();
  }

  /**
   * Returns non-fatal warnings, such as a fallback to identity warping.
   * @return list of warnings; empty, if none.
   */
  public List<String> getWarnings() {
    return _warnings;
  }

  @Override
  public String toString() {
    return "amplitude="+_amplitude+", phase="+_phase;
  }

  private double _amplitude;
  private double _phase;
  private double[] _warping;
  private List<String> _warnings;
}
