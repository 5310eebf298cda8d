package yamlquill.document;

import java.util.Objects;
import java.util.Optional;

/// Outcome of a structural edit.
///
/// When `isSuccess()` is true there is no error.
/// When it is false the [EditError] says why and the tree is unchanged.
public record EditResult(boolean isSuccess, EditError error) {

    private static final EditResult SUCCESS = new EditResult(true, null);

    public EditResult {
        if (isSuccess == (error != null)) {
            throw new IllegalArgumentException("a successful result has no error, a failure has exactly one");
        }
    }

    public static EditResult success() {
        return SUCCESS;
    }

    public static EditResult failure(EditError error) {
        return new EditResult(false, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isFailure() {
        return !isSuccess;
    }

    public Optional<EditError> errorIfAny() {
        return Optional.ofNullable(error);
    }
}
