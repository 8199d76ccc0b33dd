package domain.model;

import java.util.Objects;

/**
 * Fatal, caller-facing failure of an analysis request.
 *
 * <p>The message always names the offending identifier(s). The {@link ErrorCode} tells validation
 * problems apart from invariant violations and from failures of the external engine.</p>
 */
public class Ancombc2Exception extends RuntimeException {

    private final ErrorCode code;

    public Ancombc2Exception(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public Ancombc2Exception(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
