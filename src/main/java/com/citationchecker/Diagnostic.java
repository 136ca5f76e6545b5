package com.citationchecker;

import java.util.List;

/**
 * One finding about a name-year manuscript.
 */
public interface Diagnostic {

    enum Kind {
        MISSING_REFERENCE,
        UNUSED_REFERENCE,
        YEAR_MISMATCH,
        SPELLING_MISMATCH,
        FORMAT_ERROR,
        ET_AL_ERROR,
        ABBREVIATION_ERROR,
        DUPLICATE_REFERENCE
    }

    enum Severity {
        ERROR,
        WARNING
    }

    Kind kind();

    Severity severity();

    /** Human-readable description, one line. */
    String message();

    /** Paragraph indices the finding refers to; empty when it has no location. */
    List<Integer> locations();

    /**
     * Cited, but nothing in the bibliography resolves it.
     */
    record MissingReference(String citation, List<Integer> locations) implements Diagnostic {
        public MissingReference {
            locations = List.copyOf(locations);
        }

        @Override
        public Kind kind() {
            return Kind.MISSING_REFERENCE;
        }

        @Override
        public Severity severity() {
            return Severity.ERROR;
        }

        @Override
        public String message() {
            return citation + " is cited but not in the bibliography";
        }
    }

    /**
     * In the bibliography, never cited.
     *
     * @param line paragraph index of the entry
     * @param text entry snippet
     */
    record UnusedReference(String reference, String referenceKey, int line, String text) implements Diagnostic {
        @Override
        public Kind kind() {
            return Kind.UNUSED_REFERENCE;
        }

        @Override
        public Severity severity() {
            return Severity.ERROR;
        }

        @Override
        public String message() {
            return reference + " is in the bibliography but never cited";
        }

        @Override
        public List<Integer> locations() {
            return List.of(line);
        }
    }

    record YearMismatch(
            String citation,
            String citedYear,
            String referenceYear,
            String referenceKey,
            List<Integer> locations
    ) implements Diagnostic {
        public YearMismatch {
            locations = List.copyOf(locations);
        }

        @Override
        public Kind kind() {
            return Kind.YEAR_MISMATCH;
        }

        @Override
        public Severity severity() {
            return Severity.ERROR;
        }

        @Override
        public String message() {
            return citation + " cites " + citedYear + " but the reference year is " + referenceYear;
        }
    }

    /**
     * @param similarity ratio in {@code (0.8, 1]} between the cited and the reference author
     */
    record SpellingMismatch(
            String citation,
            String citedAuthor,
            String referenceAuthor,
            String referenceKey,
            double similarity,
            List<Integer> locations
    ) implements Diagnostic {
        public SpellingMismatch {
            locations = List.copyOf(locations);
        }

        @Override
        public Kind kind() {
            return Kind.SPELLING_MISMATCH;
        }

        @Override
        public Severity severity() {
            return Severity.ERROR;
        }

        @Override
        public String message() {
            return "Author '" + citedAuthor + "' does not match reference author '" + referenceAuthor + "'";
        }
    }

    record FormatError(String citation, List<String> warnings, List<Integer> locations) implements Diagnostic {
        public FormatError {
            warnings = List.copyOf(warnings);
            locations = List.copyOf(locations);
        }

        @Override
        public Kind kind() {
            return Kind.FORMAT_ERROR;
        }

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }

        @Override
        public String message() {
            return citation + ": " + String.join("; ", warnings);
        }
    }

    record EtAlError(
            String citation,
            Severity severity,
            String message,
            String correctForm,
            int authorCount,
            List<Integer> locations
    ) implements Diagnostic {
        public EtAlError {
            locations = List.copyOf(locations);
        }

        @Override
        public Kind kind() {
            return Kind.ET_AL_ERROR;
        }
    }

    record AbbreviationError(
            String citation,
            Severity severity,
            String message,
            String abbreviation,
            List<Integer> locations
    ) implements Diagnostic {
        public AbbreviationError {
            locations = List.copyOf(locations);
        }

        @Override
        public Kind kind() {
            return Kind.ABBREVIATION_ERROR;
        }
    }

    /**
     * @param id          key of the later entry
     * @param duplicateOf key of the earlier entry
     * @param score       similarity percentage, one decimal
     */
    record DuplicateReference(String id, String text, String duplicateOf, double score) implements Diagnostic {
        @Override
        public Kind kind() {
            return Kind.DUPLICATE_REFERENCE;
        }

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }

        @Override
        public String message() {
            return id + " duplicates " + duplicateOf + " (" + score + "% similar)";
        }

        @Override
        public List<Integer> locations() {
            return List.of();
        }
    }
}
