package io.playgroundx.web.api;

import io.playgroundx.web.db.DatabaseManager;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/** Resolves {@link DatabaseManager} handler parameters to the current request's manager. */
public final class DatabaseManagerArgumentResolver implements HandlerMethodArgumentResolver {
  @Override
  public boolean supportsParameter(MethodParameter parameter) {
    return DatabaseManager.class.equals(parameter.getParameterType());
  }

  @Override
  public Object resolveArgument(MethodParameter parameter,
                                ModelAndViewContainer mavContainer,
                                NativeWebRequest webRequest,
                                WebDataBinderFactory binderFactory) {
    Object db = webRequest.getAttribute(DatabaseManagerFilter.ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
    if (db instanceof DatabaseManager m) return m;
    throw new IllegalStateException("No DatabaseManager bound to this request; is DatabaseManagerFilter registered?");
  }
}
