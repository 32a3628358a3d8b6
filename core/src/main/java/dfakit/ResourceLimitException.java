package dfakit;

/**
 * A computation was refused because its output would exceed a safety bound.
 */
public class ResourceLimitException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -5482262510339135620L;

  /**
   * Size the computation would have produced (saturated at {@code Long.MAX_VALUE}).
   */
  public final long projected;

  /**
   * Configured bound.
   */
  public final long limit;

  public ResourceLimitException(long projected, long limit) {
    super("Output of " + (projected == Long.MAX_VALUE ? "more than " + Long.MAX_VALUE : projected)
      + " strings exceeds the limit of " + limit);
    this.projected = projected;
    this.limit = limit;
  }
}
