package docbuild.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Uses the standard insert and the candidate-by-candidate claim.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
