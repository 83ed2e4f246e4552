package games.cryptogram.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for saved sessions and attempt history.
 */
@Component
@ConfigurationProperties(prefix = "progress")
public class ProgressProperties {
  private String directory = System.getProperty("user.home") + "/.cryptogram/sessions";
  private boolean resume = true;
  private String attemptsFile = System.getProperty("user.home") + "/.cryptogram/attempts.json";

  /**
   * Returns the directory holding one JSON snapshot per puzzle.
   * @return directory path
   */
  public String getDirectory() {
    return directory;
  }

  public void setDirectory(String directory) {
    this.directory = directory;
  }

  /**
   * Returns whether a saved unfinished session is resumed when its puzzle is started again.
   * @return true to resume
   */
  public boolean isResume() {
    return resume;
  }

  public void setResume(boolean resume) {
    this.resume = resume;
  }

  /**
   * Returns the JSON file holding every finished attempt, read by the {@code stats} command.
   * @return file path
   */
  public String getAttemptsFile() {
    return attemptsFile;
  }

  public void setAttemptsFile(String attemptsFile) {
    this.attemptsFile = attemptsFile;
  }
}
