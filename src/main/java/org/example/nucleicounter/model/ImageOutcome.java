package org.example.nucleicounter.model;

public record ImageOutcome(
        String image,
        OutcomeStatus status,
        Integer count,
        String detail
) {

    public static ImageOutcome counted(String image, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        return new ImageOutcome(image, OutcomeStatus.COUNTED, count, null);
    }

    public static ImageOutcome failed(String image, OutcomeStatus status, String detail) {
        if (status == OutcomeStatus.COUNTED) {
            throw new IllegalArgumentException("a failed outcome needs a failure status");
        }
        return new ImageOutcome(image, status, null, detail);
    }

    public boolean succeeded() {
        return status == OutcomeStatus.COUNTED;
    }
}
