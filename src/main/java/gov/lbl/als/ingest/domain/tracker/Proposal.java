package gov.lbl.als.ingest.domain.tracker;

/**
 * Tracker record for a proposal.
 *
 * @param slug Tracker-assigned identifier; {@code null} before the record is created
 * @param name proposal identifier as used in descriptors
 * @param description free-form note
 */
public record Proposal(String slug, String name, String description) {}
