package yamlquill.document;

import java.util.Objects;

/// Why a structural edit on a [DocTree] was refused.
///
/// Every variant is recoverable: the tree is left exactly as it was and the
/// caller decides how to report it.
public sealed interface EditError permits
        EditError.CannotDeleteRoot,
        EditError.ParentNotFound,
        EditError.IndexOutOfBounds,
        EditError.NotAContainer,
        EditError.NotAnObject,
        EditError.NotAnArray,
        EditError.DuplicateKey,
        EditError.AnchorInUse {

    /// {@return a human readable message suitable for a status line}
    String message();

    record CannotDeleteRoot() implements EditError {
        @Override
        public String message() {
            return "Cannot delete root node";
        }
    }

    record ParentNotFound(NodePath parent) implements EditError {
        public ParentNotFound {
            Objects.requireNonNull(parent, "parent must not be null");
        }

        @Override
        public String message() {
            return "Parent node not found at " + parent;
        }
    }

    record IndexOutOfBounds(int index, int length, String containerType) implements EditError {
        @Override
        public String message() {
            return "Index " + index + " out of bounds for " + containerType + " with " + length + " entries";
        }
    }

    record NotAContainer(String actualType) implements EditError {
        @Override
        public String message() {
            return "Parent is not a container type (found " + actualType + ")";
        }
    }

    record NotAnObject(String actualType) implements EditError {
        @Override
        public String message() {
            return "Target is not an object (found " + actualType + ")";
        }
    }

    record NotAnArray(String actualType) implements EditError {
        @Override
        public String message() {
            return "Target is not an array (found " + actualType + ")";
        }
    }

    record DuplicateKey(String key) implements EditError {
        @Override
        public String message() {
            return "Key \"" + key + "\" already exists";
        }
    }

    /// Deleting would orphan aliases that refer to an anchor inside the deleted subtree.
    record AnchorInUse(String anchor, int aliasCount) implements EditError {
        public AnchorInUse {
            Objects.requireNonNull(anchor, "anchor must not be null");
        }

        @Override
        public String message() {
            return "Cannot delete anchor '&" + anchor + "': " + aliasCount + " alias(es) still refer to it";
        }
    }
}
