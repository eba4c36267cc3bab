package io.playgroundx.web.api;

import io.playgroundx.web.db.ConnectorFactory;
import io.playgroundx.web.db.DatabaseManager;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Gives every request its own {@link DatabaseManager} and closes it when the request ends. */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public final class DatabaseManagerFilter extends OncePerRequestFilter {
  public static final String ATTRIBUTE = DatabaseManager.class.getName();

  private final ConnectorFactory connectors;

  public DatabaseManagerFilter(ConnectorFactory connectors) {
    this.connectors = connectors;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    DatabaseManager db = new DatabaseManager(connectors);
    request.setAttribute(ATTRIBUTE, db);
    try {
      filterChain.doFilter(request, response);
    } finally {
      request.removeAttribute(ATTRIBUTE);
      db.close();
    }
  }
}
