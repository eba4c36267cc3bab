package io.playgroundx.web.config;

import io.playgroundx.persistence.exec.DatabaseCredentials;
import io.playgroundx.persistence.exec.PoolSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "playgroundx.db")
public class DatabaseProperties {
  private final Target primary = new Target();
  private final Target secondary = new Target();

  /** Run {@code SELECT 1} against the primary target at startup and abort when it fails. */
  private boolean verifyOnStartup;

  public Target getPrimary() { return primary; }
  public Target getSecondary() { return secondary; }
  public boolean isVerifyOnStartup() { return verifyOnStartup; }
  public void setVerifyOnStartup(boolean verifyOnStartup) { this.verifyOnStartup = verifyOnStartup; }

  public static class Target {
    private String user;
    private String password;
    private String host;
    private Integer port;
    private String name;

    private int minPoolSize = PoolSettings.DEFAULT_MIN_SIZE;
    private int maxPoolSize = PoolSettings.DEFAULT_MAX_SIZE;
    private Duration acquireTimeout = PoolSettings.DEFAULT_ACQUIRE_TIMEOUT;

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public int getMinPoolSize() { return minPoolSize; }
    public void setMinPoolSize(int minPoolSize) { this.minPoolSize = minPoolSize; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    public Duration getAcquireTimeout() { return acquireTimeout; }
    public void setAcquireTimeout(Duration acquireTimeout) { this.acquireTimeout = acquireTimeout; }

    /** True when any connection field was supplied (blank environment placeholders do not count). */
    public boolean isConfigured() {
      return !isBlank(user) || !isBlank(password) || !isBlank(host) || port != null || !isBlank(name);
    }

    public DatabaseCredentials credentials() {
      String pw = (password == null || password.isEmpty()) ? null : password;
      return new DatabaseCredentials(trim(user), pw, trim(host), port == null ? 0 : port, trim(name));
    }

    public PoolSettings poolSettings() {
      return new PoolSettings(minPoolSize, maxPoolSize, acquireTimeout);
    }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }
    private static String trim(String s) { return s == null ? null : s.trim(); }
  }
}
