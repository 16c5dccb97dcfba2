package gov.lbl.als.ingest.domain.tracker;

/**
 * Tracker record for a beamline.
 *
 * @param slug Tracker-assigned identifier; {@code null} before the record is created
 * @param name beamline name as used in descriptors
 * @param description free-form note
 */
public record Beamline(String slug, String name, String description) {}
