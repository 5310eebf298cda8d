package yamlquill.yamlpath;

import java.util.Objects;

/// Why a query string could not be parsed.
public sealed interface YamlPathError {

    String message();

    /// A character appeared where something else was required.
    record UnexpectedToken(int position, String found, String expected) implements YamlPathError {
        public UnexpectedToken {
            Objects.requireNonNull(found, "found must not be null");
            Objects.requireNonNull(expected, "expected must not be null");
        }

        @Override
        public String message() {
            return "Unexpected token '" + found + "' at position " + position + ", expected " + expected;
        }
    }

    /// The query stopped before a construct was complete.
    record UnexpectedEnd(String expected) implements YamlPathError {
        public UnexpectedEnd {
            Objects.requireNonNull(expected, "expected must not be null");
        }

        @Override
        public String message() {
            return "Unexpected end of input, expected " + expected;
        }
    }

    record InvalidSyntax(String detail) implements YamlPathError {
        public InvalidSyntax {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public String message() {
            return "Invalid YAMLPath syntax: " + detail;
        }
    }
}
