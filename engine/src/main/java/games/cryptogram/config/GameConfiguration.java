package games.cryptogram.config;

import games.cryptogram.game.alignment.CellAligner;
import java.time.Clock;
import java.util.Random;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Collaborators the engine takes through its constructors. Tests build their own instances
 * (fixed clocks, seeded randoms) instead of going through Spring.
 */
@Configuration
public class GameConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public Random random() {
    return new Random();
  }

  @Bean
  public CellAligner cellAligner() {
    return new CellAligner();
  }
}
