package com.eyelevel.documentcompressor.service.policy;

import com.eyelevel.documentcompressor.model.CompressionMethod;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * The outcome of applying a {@link CompressionPolicy} to a document: either compress with a method and level,
 * or skip with a reason.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class CompressionDecision {

    public enum Action {
        COMPRESS,
        SKIP
    }

    private final Action action;
    private final CompressionMethod method;
    private final int level;
    private final String reason;

    public static CompressionDecision compress(CompressionMethod method, int level) {
        return new CompressionDecision(Action.COMPRESS, method, level, null);
    }

    public static CompressionDecision skip(String reason) {
        return new CompressionDecision(Action.SKIP, null, 0, reason);
    }

    public boolean isSkip() {
        return action == Action.SKIP;
    }
}
