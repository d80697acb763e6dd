package com.finsolve.assistant.service.conversation;

/**
 * A self-contained rewrite of the latest message. {@code fallback} is set when the
 * rewrite failed and {@code text} is the raw message.
 */
public record StandaloneQuery(String text, boolean fallback) {
}
