package com.nilsson.promptextractor.model;

import java.util.Objects;

/**
 <h2>ExtractionResult</h2>
 <p>
 Outcome of processing one image file. Exactly one of two shapes:
 </p>
 <ul>
 <li>{@link Success}: the file's base name and its non-empty, trimmed positive prompt.</li>
 <li>{@link Failure}: the file's base name, a {@link FailureReason} and a human-readable detail.</li>
 </ul>
 <p>
 Instances are created by worker tasks and handed to the aggregating thread; they are immutable.
 </p>
 */
public abstract class ExtractionResult {

    private final String identifier;

    private ExtractionResult(String identifier) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
    }

    public static Success success(String identifier, String prompt) {
        return new Success(identifier, prompt);
    }

    public static Failure failure(String identifier, FailureReason reason, String detail) {
        return new Failure(identifier, reason, detail);
    }

    public String getIdentifier() {
        return identifier;
    }

    public abstract boolean isSuccess();

    // ------------------------------------------------------------------------
    // Variants
    // ------------------------------------------------------------------------

    public static final class Success extends ExtractionResult {
        private final String prompt;

        private Success(String identifier, String prompt) {
            super(identifier);
            if (prompt == null || prompt.isBlank()) {
                throw new IllegalArgumentException("Prompt must not be empty for " + identifier);
            }
            this.prompt = prompt.strip();
        }

        public String getPrompt() {
            return prompt;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Success)) return false;
            Success other = (Success) o;
            return getIdentifier().equals(other.getIdentifier()) && prompt.equals(other.prompt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getIdentifier(), prompt);
        }

        @Override
        public String toString() {
            return "Success{" + getIdentifier() + "}";
        }
    }

    public static final class Failure extends ExtractionResult {
        private final FailureReason reason;
        private final String detail;

        private Failure(String identifier, FailureReason reason, String detail) {
            super(identifier);
            this.reason = Objects.requireNonNull(reason, "reason");
            this.detail = detail == null ? "" : detail;
        }

        public FailureReason getReason() {
            return reason;
        }

        public String getDetail() {
            return detail;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String toString() {
            return "Failure{" + getIdentifier() + ", " + reason + ", " + detail + "}";
        }
    }
}
