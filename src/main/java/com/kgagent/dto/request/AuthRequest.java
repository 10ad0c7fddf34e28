package com.kgagent.dto.request;

/**
 * Input of the {@code auth} command.
 *
 * @param target {@code llm}, {@code jobs} or the shortname of a graph whose endpoint needs a bearer token.
 * @param token  the secret to store.
 */
public record AuthRequest(String target, String token) {
}
