package warp;

import edu.mines.jtk.util.Check;

/**
 * Finds warping functions with an external learned (gradient-descent)
 * engine.
 * <p>
 * If the options ask for a dynamic programming start, this provider 
 * returns the warping of its dynamic programming provider directly and
 * does not run the engine; in that case the engine may be absent.
 */
public class LearnedWarping implements WarpingProvider {

  /**
   * Constructs a learned warping provider.
   * @param engine the gradient-descent engine; may be null only if 
   *  {@code options} ask for the dynamic programming warping.
   * @param initial provider of the dynamic programming warping; may be
   *  null unless {@code options} ask for that warping.
   * @param options options passed to the engine.
   */
  public LearnedWarping(
      GradientReparam engine, WarpingProvider initial, LearnedOptions options)
  {
    Check.argument(options!=null,"options!=null");
    Check.argument(initial!=null || !options.isNumpyInit(),
        "initial!=null if options use the dynamic programming warping");
    Check.argument(engine!=null || options.isNumpyInit(),
        "engine!=null unless options use the dynamic programming warping");
    _engine = engine;
    _initial = initial;
    _options = options;
  }

  /**
   * Looks up a learned warping engine with the specified class loader.
   * @param loader the class loader used to find engines.
   * @return the resolution; a failure, if no engine can be loaded.
   */
  public static Resolution<GradientReparam> resolve(ClassLoader loader) {
    return Engines.resolve(GradientReparam.class,loader);
  }

  public double[] findWarping(
      double[] t, double[] q1, double[] q2, AlignmentOptions options)
  {
    if (_options.isNumpyInit()) {
      Check.state(_initial!=null,"initial provider is available");
      return _initial.findWarping(t,q1,q2,options);
    }
    Check.state(_engine!=null,"learned engine is available");
    double[] gamma = _engine.reparam(t,q1,q2,_options);
    Check.state(gamma!=null && gamma.length==t.length,
        "engine returned one warping value per sample");
    return gamma;
  }

  public String getName() {
    if (_options.isNumpyInit() && _initial!=null)
      return "learned, initialized by "+_initial.getName();
    return (_engine!=null)?"learned ("+_engine.getClass().getName()+")":
        "learned";
  }

  public String getWarning() {
    return (_options.isNumpyInit() && _initial!=null)?
        _initial.getWarning():null;
  }

  /**
   * Returns the options passed to the engine.
   * @return the options.
   */
  public LearnedOptions getOptions() {
    return _options;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private GradientReparam _engine;
  private WarpingProvider _initial;
  private LearnedOptions _options;
}
