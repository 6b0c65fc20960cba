package warp;

import edu.mines.jtk.util.Check;

/**
 * The outcome of looking up an optional engine: either the engine, or
 * the reason it could not be found.
 * @param <T> the engine type.
 */
public final class Resolution<T> {

  /**
   * Returns a successful resolution.
   * @param engine the engine found.
   * @return the resolution.
   */
  public static <T> Resolution<T> success(T engine) {
    Check.argument(engine!=null,"engine!=null");
    return new Resolution<T>(engine,null);
  }

  /**
   * Returns a failed resolution.
   * @param reason why no engine is available.
   * @return the resolution.
   */
  public static <T> Resolution<T> failure(String reason) {
    Check.argument(reason!=null,"reason!=null");
    return new Resolution<T>(null,reason);
  }

  /**
   * Returns true if an engine was found.
   * @return true, if available; false, otherwise.
   */
  public boolean isAvailable() {
    return _engine!=null;
  }

  /**
   * Returns the engine.
   * @return the engine.
   * @throws IllegalStateException if no engine is available.
   */
  public T get() {
    Check.state(_engine!=null,"engine is available: "+_reason);
    return _engine;
  }

  /**
   * Returns the reason no engine is available.
   * @return the reason; null, if available.
   */
  public String getReason() {
    return _reason;
  }

  ///////////////////////////////////////////////////////////////////////////
  // private

  private T _engine;
  private String _reason;

  private Resolution(T engine, String reason) {
    _engine = engine;
    _reason = reason;
  }
}
