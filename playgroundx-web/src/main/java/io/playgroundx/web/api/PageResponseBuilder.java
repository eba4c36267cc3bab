package io.playgroundx.web.api;

import io.playgroundx.persistence.exec.DatabaseConnector;
import io.playgroundx.persistence.mapping.Row;
import io.playgroundx.persistence.mapping.RowDecoder;
import io.playgroundx.persistence.page.LinkBuilder;
import io.playgroundx.persistence.page.PageRequest;
import io.playgroundx.persistence.page.PagedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Runs a paged query, decodes its rows and attaches navigation links. */
public final class PageResponseBuilder {
  private static final Logger log = LoggerFactory.getLogger(PageResponseBuilder.class);

  private PageResponseBuilder() {}

  public static <T> PagedResult<T> paginate(DatabaseConnector db,
                                            String query,
                                            List<?> params,
                                            RowDecoder<T> decoder,
                                            PageRequest page,
                                            LinkBuilder links) {
    PagedResult<Row> rows = db.fetchAll(query, params, page);
    if (rows.isEmpty()) {
      log.warn("No data found for the query: {}", query);
      return PagedResult.empty();
    }
    return PagedResult.decode(rows, decoder).withLinks(links);
  }
}
