package warp;

import edu.mines.jtk.util.Check;

/**
 * Finds warping functions with an external dynamic programming engine.
 * <p>
 * The engine is looked up once, by {@link #resolve(ClassLoader)}; a 
 * provider is constructed only from an engine that was found. Use 
 * {@link WarpingProviders#dynamicProgramming()} for a provider that 
 * falls back to the identity warping when no engine is installed.
 */
public class DynamicProgrammingWarping implements WarpingProvider {

  /**
   * Constructs a provider for the specified engine.
   * @param engine the dynamic programming engine.
   */
  public DynamicProgrammingWarping(OptimumReparam engine) {
    Check.argument(engine!=null,"engine!=null");
    _engine = engine;
  }

  /**
   * Looks up a dynamic programming engine with the context class loader
   * of the current thread.
   * @return the resolution.
   */
  public static Resolution<OptimumReparam> resolve() {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader==null)
      loader = DynamicProgrammingWarping.class.getClassLoader();
    return resolve(loader);
  }

  /**
   * Looks up a dynamic programming engine with the specified class loader.
   * The first engine found is used.
   * @param loader the class loader used to find engines.
   * @return the resolution; a failure, if no engine can be loaded.
   */
  public static Resolution<OptimumReparam> resolve(ClassLoader loader) {
    return Engines.resolve(OptimumReparam.class,loader);
  }

  public double[] findWarping(
      double[] t, double[] q1, double[] q2, AlignmentOptions options)
  {
    Check.argument(AlignmentOptions.DP.equals(options.getOptim()),
        "optim is "+AlignmentOptions.DP);
    double[] gamma = _engine.reparam(
        q1,t,q2,options.getLambda(),options.getGridDim());
    Check.state(gamma!=null && gamma.length==t.length,
        "engine returned one warping value per sample");
    return gamma;
  }

  public String getName() {
    return "dynamic programming ("+_engine.getClass().getName()+")";
  }

  public String getWarning() {
    return null;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private OptimumReparam _engine;
}
