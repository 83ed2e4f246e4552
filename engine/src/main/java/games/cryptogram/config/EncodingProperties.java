package games.cryptogram.config;

import games.cryptogram.game.EncodingScheme;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the encoding puzzles are played with.
 *
 * Usage:
 * {@code -Dencoding.scheme=numbers}
 */
@Component
@ConfigurationProperties(prefix = "encoding")
public class EncodingProperties {
  private String scheme = EncodingScheme.LETTERS.getLabel();

  public String getScheme() {
    return scheme;
  }

  public void setScheme(String scheme) {
    this.scheme = scheme;
  }

  /**
   * @return the configured scheme
   * @throws IllegalArgumentException if the value is neither "letters" nor "numbers"
   */
  public EncodingScheme toScheme() {
    return EncodingScheme.fromLabel(scheme);
  }
}
