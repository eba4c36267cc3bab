package io.playgroundx.persistence.exec;

import java.util.ArrayList;
import java.util.List;

/** Connection credentials for one database target. */
public record DatabaseCredentials(String user, String password, String host, int port, String database) {

  /** Names of the required fields that are blank or unset; empty when complete. */
  public List<String> missingFields() {
    List<String> missing = new ArrayList<>();
    if (isBlank(user)) missing.add("user");
    if (password == null) missing.add("password");
    if (isBlank(host)) missing.add("host");
    if (port <= 0) missing.add("port");
    if (isBlank(database)) missing.add("database");
    return missing;
  }

  public boolean isComplete() { return missingFields().isEmpty(); }

  @Override
  public String toString() {
    return "DatabaseCredentials[user=" + user + ", host=" + host + ", port=" + port + ", database=" + database + "]";
  }

  private static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
