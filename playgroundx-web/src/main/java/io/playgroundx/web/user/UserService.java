package io.playgroundx.web.user;

import io.playgroundx.persistence.page.LinkBuilder;
import io.playgroundx.persistence.page.PageRequest;
import io.playgroundx.persistence.page.PagedResult;
import io.playgroundx.web.api.PageResponseBuilder;
import io.playgroundx.web.db.DatabaseManager;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class UserService {
  static final String LIST_QUERY = "SELECT id, username, email, created_at FROM users ORDER BY id";

  public PagedResult<User> list(DatabaseManager db, PageRequest page, LinkBuilder links) {
    return PageResponseBuilder.paginate(db.primary(), LIST_QUERY, List.of(), User.DECODER, page, links);
  }
}
