package com.cloudmusic.resolver;

/**
 * Typed failure of a resolver operation.
 * <p>
 * Provider clients throw it for a single failed attempt ({@link ErrorKind#NETWORK} or
 * {@link ErrorKind#UPSTREAM}); the {@link ResolutionChain} only lets one escape when every
 * provider is exhausted. {@link #getUserMessage()} is meant for display and is distinct from
 * the internal message.
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class MusicResolutionException extends Exception {
    private final ErrorKind kind;
    private final String userMessage;

    public MusicResolutionException(ErrorKind kind, String message) {
        this(kind, message, kind.defaultUserMessage(), null);
    }

    public MusicResolutionException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, kind.defaultUserMessage(), cause);
    }

    public MusicResolutionException(ErrorKind kind, String message, String userMessage, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.userMessage = userMessage == null || userMessage.isBlank() ? kind.defaultUserMessage() : userMessage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getUserMessage() {
        return userMessage;
    }

    static MusicResolutionException upstream(String message) {
        return new MusicResolutionException(ErrorKind.UPSTREAM, message);
    }
}
