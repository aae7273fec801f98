package spmconvert;

import java.util.Objects;

/**
 * Record from the {@code added_tokens} list of {@code tokenizer.json}.
 *
 * <p>Only {@code content} and {@code normalized} matter for conversion: tokens that
 * are not normalized are control tokens handled by the caller and never become
 * pieces.</p>
 */
public final class AddedToken {
    private final String content;
    private final boolean normalized;

    public AddedToken(String content, boolean normalized) {
        this.content = Objects.requireNonNull(content, "content");
        this.normalized = normalized;
    }

    public String content() {
        return content;
    }

    public boolean normalized() {
        return normalized;
    }

    @Override
    public String toString() {
        return "AddedToken{" + content + ", normalized=" + normalized + "}";
    }
}
