package io.playgroundx.web.api;

import io.playgroundx.persistence.page.LinkBuilder;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/** Absolute page links to an endpoint of the current application, built from the current request. */
public final class EndpointLinks {
  private EndpointLinks() {}

  public static LinkBuilder to(String path) {
    return (page, size) -> ServletUriComponentsBuilder.fromCurrentContextPath()
        .path(path)
        .queryParam("page", page)
        .queryParam("size", size)
        .toUriString();
  }
}
