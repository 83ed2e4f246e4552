package games.cryptogram.config;

import games.cryptogram.game.DifficultyConfig;
import games.cryptogram.game.DifficultyMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the difficulty of new games.
 *
 * In normal mode a share of the distinct letters is pre-filled when a puzzle starts; expert
 * mode starts from an empty board. Both modes fail a session after {@code maxMistakes}
 * incorrect guesses.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.jvmArguments="-Ddifficulty.mode=expert"}
 */
@Component
@ConfigurationProperties(prefix = "difficulty")
public class DifficultyProperties {
  private String mode = DifficultyMode.NORMAL.getDisplayName();
  private double prefillFraction = DifficultyConfig.DEFAULT_PREFILL_FRACTION;
  private int maxMistakes = DifficultyConfig.DEFAULT_MAX_MISTAKES;

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public double getPrefillFraction() {
    return prefillFraction;
  }

  public void setPrefillFraction(double prefillFraction) {
    this.prefillFraction = prefillFraction;
  }

  public int getMaxMistakes() {
    return maxMistakes;
  }

  public void setMaxMistakes(int maxMistakes) {
    this.maxMistakes = maxMistakes;
  }

  /**
   * Validates the bound values and converts them into the engine's immutable form.
   * @return the difficulty settings
   * @throws IllegalArgumentException if the mode is unknown or a value is out of range
   */
  public DifficultyConfig toConfig() {
    return new DifficultyConfig(DifficultyMode.fromName(mode), prefillFraction, maxMistakes);
  }
}
