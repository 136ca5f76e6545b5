package com.citationchecker;

import java.util.List;

/**
 * Edits that turn one {@link NumberedDocument} into another, in application order.
 *
 * <p>Operations address paragraphs by their stable id, so a host that keeps its own paragraph
 * objects (a word-processor DOM, say) can replay them without knowing this model.
 */
public record MutationPlan(List<Operation> operations) {

    public static final MutationPlan EMPTY = new MutationPlan(List.of());

    public MutationPlan {
        operations = List.copyOf(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public interface Operation {
        int paragraphId();
    }

    /** Replaces the runs of a paragraph. */
    public record SetRuns(int paragraphId, List<StyledRun> runs) implements Operation {
        public SetRuns {
            runs = List.copyOf(runs);
        }
    }

    /** Takes a paragraph out of the document order. */
    public record RemoveParagraph(int paragraphId) implements Operation {}

    /**
     * Puts a previously removed paragraph back at {@code position} of the document order
     * (0-based, counted after all earlier operations).
     */
    public record InsertParagraph(int paragraphId, int position) implements Operation {}
}
