package games.pokercards.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the command-line showdown.
 *
 * Usage:
 * {@code java -jar poker-cards-engine.jar --showdown.players=6 --showdown.seed=42 --showdown.trace=true}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "showdown")
public class ShowdownProperties {
  private int players = 4;
  private Long seed;
  private boolean trace = false;

  /**
   * Returns the number of seats dealt in.
   * @return seat count, 2 to 10
   */
  public int getPlayers() {
    return players;
  }

  public void setPlayers(int players) {
    this.players = players;
  }

  /**
   * Returns the shuffle seed, if one is fixed.
   * @return the seed, or null for a random shuffle
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Returns whether each evaluation step is written to the debug log.
   * @return true to trace hand evaluation
   */
  public boolean isTrace() {
    return trace;
  }

  public void setTrace(boolean trace) {
    this.trace = trace;
  }
}
