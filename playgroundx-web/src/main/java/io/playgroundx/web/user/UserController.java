package io.playgroundx.web.user;

import io.playgroundx.persistence.page.PageRequest;
import io.playgroundx.persistence.page.PagedResult;
import io.playgroundx.web.api.EndpointLinks;
import io.playgroundx.web.db.DatabaseManager;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/user")
public final class UserController {
  private final UserService users;

  public UserController(UserService users) {
    this.users = users;
  }

  @GetMapping
  public PagedResult<User> list(DatabaseManager db,
                                @RequestParam(name = "page", defaultValue = "1") int page,
                                @RequestParam(name = "size", defaultValue = "5") int size) {
    return users.list(db, PageRequest.of(page, size), EndpointLinks.to("/user"));
  }
}
